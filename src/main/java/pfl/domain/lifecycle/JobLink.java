package pfl.domain.lifecycle;

/**
 * Result of a successful link between an observed print and a scheduled job
 * @since 15/01/2026
 */
public record JobLink(long scheduledJobId, EMatchStrategy strategy, String matchedName) {

    public enum EMatchStrategy {
        NAME,
        LAYER_COUNT
    }
}

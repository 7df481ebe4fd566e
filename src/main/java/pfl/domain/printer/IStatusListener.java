package pfl.domain.printer;

/**
 * Observer handed to an adapter at construction time. Called on the adapter's ingestion thread
 * for every successfully parsed status.
 * @since 12/01/2026
 */
@FunctionalInterface
public interface IStatusListener {
    void onStatusUpdate(CanonicalStatus status);
}

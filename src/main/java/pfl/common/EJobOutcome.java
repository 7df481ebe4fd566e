package pfl.common;

/**
 * Outcome of the last job as reported by the device itself.
 * Bambu keeps FINISH/FAILED in gcode_state until the next print, Moonraker keeps
 * "complete"/"error" in print_stats, so an IDLE printer may still carry an outcome.
 * @since 12/01/2026
 */
public enum EJobOutcome {
    NONE,
    FINISHED,
    FAILED
}

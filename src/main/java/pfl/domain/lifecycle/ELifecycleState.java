package pfl.domain.lifecycle;

/**
 * States of the job lifecycle state machine. FINISH and FAILED are the terminal outcomes of a print.
 * @since 14/01/2026
 */
public enum ELifecycleState {
    IDLE,
    PRINTING,
    PAUSED,
    FINISH,
    FAILED,
    OFFLINE,
    UNKNOWN
}

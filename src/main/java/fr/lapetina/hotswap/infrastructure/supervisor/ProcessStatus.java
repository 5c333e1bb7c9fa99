package fr.lapetina.hotswap.infrastructure.supervisor;

/**
 * Aggregated status of a supervised process group.
 */
public enum ProcessStatus {
    RUNNING,
    STOPPED,
    FATAL,
    UNKNOWN;

    /**
     * Maps a supervisord process state name onto a group status.
     */
    public static ProcessStatus fromSupervisorState(String stateName) {
        if (stateName == null) {
            return UNKNOWN;
        }
        return switch (stateName) {
            case "RUNNING", "STARTING" -> RUNNING;
            case "STOPPED", "STOPPING", "EXITED" -> STOPPED;
            case "FATAL", "BACKOFF" -> FATAL;
            default -> UNKNOWN;
        };
    }
}

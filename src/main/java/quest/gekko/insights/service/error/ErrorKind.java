package quest.gekko.insights.service.error;

/**
 * Kinds of failure that may cross the service boundary. Anything else is reported as {@link #INTERNAL}.
 */
public enum ErrorKind {
    INVALID_ARGUMENT,
    NOT_FOUND,
    ACQUISITION_FAILED,
    STORAGE_FAILURE,
    TRANSIENT_FAILURE,
    INTERNAL
}

package quest.gekko.insights.service.error;

public class StorageFailureException extends PageInsightsException {
    private final boolean transientFailure;

    public StorageFailureException(String message, Throwable cause, boolean transientFailure) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public boolean isTransientFailure() {
        return transientFailure;
    }

    @Override
    public ErrorKind kind() {
        return transientFailure ? ErrorKind.TRANSIENT_FAILURE : ErrorKind.STORAGE_FAILURE;
    }
}

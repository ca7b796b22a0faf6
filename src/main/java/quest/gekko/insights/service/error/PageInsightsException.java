package quest.gekko.insights.service.error;

public abstract class PageInsightsException extends RuntimeException {

    protected PageInsightsException(String message) {
        super(message);
    }

    protected PageInsightsException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind kind();
}

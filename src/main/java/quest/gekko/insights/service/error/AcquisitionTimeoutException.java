package quest.gekko.insights.service.error;

import java.time.Duration;

/**
 * Raised when a live fetch exceeds its time budget. Only used inside acquisition, where it
 * routes the request to the synthetic path; it is never reported to callers.
 */
public class AcquisitionTimeoutException extends PageInsightsException {

    public AcquisitionTimeoutException(String identifier, Duration timeout) {
        super("Live acquisition of '" + identifier + "' timed out after " + timeout.toMillis() + "ms");
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.TRANSIENT_FAILURE;
    }
}

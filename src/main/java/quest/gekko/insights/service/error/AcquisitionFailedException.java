package quest.gekko.insights.service.error;

/**
 * Neither the live path nor the synthetic path produced a page.
 */
public class AcquisitionFailedException extends PageInsightsException {

    public AcquisitionFailedException(String identifier, Throwable cause) {
        super("Failed to acquire page '" + identifier + "': " + cause.getMessage(), cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.ACQUISITION_FAILED;
    }
}

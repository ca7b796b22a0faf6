package quest.gekko.insights.service.error;

public class PageNotFoundException extends PageInsightsException {
    private final String identifier;

    public PageNotFoundException(String identifier) {
        super("Page '" + identifier + "' not found");
        this.identifier = identifier;
    }

    public String getIdentifier() {
        return identifier;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.NOT_FOUND;
    }
}

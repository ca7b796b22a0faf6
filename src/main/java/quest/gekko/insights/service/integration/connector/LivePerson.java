package quest.gekko.insights.service.integration.connector;

public record LivePerson(String profileIdentifier, String firstName, String lastName, String headline,
                         String currentPosition) {}

package quest.gekko.insights.web.dto;

import quest.gekko.insights.domain.PersonProfile;
import quest.gekko.insights.domain.PersonRole;

public record PersonDTO(
        String username,
        PersonRole role,
        String firstName,
        String lastName,
        String headline,
        String location,
        String currentPosition,
        String currentCompany,
        long connectionsCount,
        long followersCount
) {
    public static PersonDTO from(PersonProfile person) {
        return new PersonDTO(person.getProfileIdentifier(), person.getRole(), person.getFirstName(), person.getLastName(),
                person.getHeadline(), person.getLocation(), person.getCurrentPosition(), person.getCurrentCompany(),
                person.getConnectionsCount(), person.getFollowersCount());
    }
}

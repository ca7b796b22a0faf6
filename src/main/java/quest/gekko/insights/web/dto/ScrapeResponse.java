package quest.gekko.insights.web.dto;

import quest.gekko.insights.domain.AcquisitionSource;
import quest.gekko.insights.service.acquisition.AcquisitionOutcome;

public record ScrapeResponse(
        String status,
        String message,
        AcquisitionSource source,
        int postsStored,
        int peopleStored,
        CompanyPageDTO page
) {
    public static ScrapeResponse from(AcquisitionOutcome outcome) {
        String message = "Acquired page '" + outcome.page().getIdentifier() + "' from "
                + outcome.source().name().toLowerCase() + " data";
        return new ScrapeResponse("success", message, outcome.source(), outcome.postsStored(),
                outcome.peopleStored(), CompanyPageDTO.from(outcome.page()));
    }
}

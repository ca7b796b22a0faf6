package quest.gekko.insights.service.acquisition;

import quest.gekko.insights.domain.AcquisitionSource;
import quest.gekko.insights.domain.CompanyPage;

public record AcquisitionOutcome(CompanyPage page, AcquisitionSource source, AcquisitionState state,
                                 int postsStored, int peopleStored) {}

package quest.gekko.insights.service.scheduling;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import quest.gekko.insights.domain.CompanyPage;
import quest.gekko.insights.service.acquisition.AcquisitionOrchestrator;
import quest.gekko.insights.service.core.PageStore;
import quest.gekko.insights.service.error.AcquisitionFailedException;

import java.util.List;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RefreshSchedulerTest {

    @Mock
    private PageStore pageStore;

    @Mock
    private AcquisitionOrchestrator orchestrator;

    @InjectMocks
    private RefreshScheduler scheduler;

    @Test
    void shouldReacquireEveryPageAtItsLastDepthAndCarryOnAfterFailures() {
        // GIVEN
        when(pageStore.findAllPages()).thenReturn(List.of(page("acme", 3), page("globex", 0), page("initech", 2)));
        when(orchestrator.acquire("acme", 3))
                .thenThrow(new AcquisitionFailedException("acme", new IllegalStateException("boom")));

        // WHEN
        scheduler.refreshAll();

        // THEN
        verify(orchestrator).acquire("acme", 3);
        verify(orchestrator).acquire("globex", 1);
        verify(orchestrator).acquire("initech", 2);
    }

    private static CompanyPage page(String identifier, int lastDepth) {
        CompanyPage page = new CompanyPage();
        page.setIdentifier(identifier);
        page.setLastDepth(lastDepth);
        return page;
    }
}

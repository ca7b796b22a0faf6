package quest.gekko.insights.service.scheduling;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import quest.gekko.insights.domain.CompanyPage;
import quest.gekko.insights.service.acquisition.AcquisitionOrchestrator;
import quest.gekko.insights.service.acquisition.AcquisitionRequest;
import quest.gekko.insights.service.core.PageStore;

import java.util.List;

/**
 * Re-acquires every stored page at the depth it was last acquired with, which appends a follower
 * sample per page and run.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(prefix = "insights.refresh", name = "enabled", havingValue = "true")
public class RefreshScheduler {
    private final PageStore pageStore;
    private final AcquisitionOrchestrator orchestrator;

    // 02:10 UTC daily unless overridden
    @Scheduled(cron = "${insights.refresh.cron:0 10 2 * * *}", zone = "UTC")
    public void refreshAll() {
        List<CompanyPage> pages = pageStore.findAllPages();
        log.info("Refreshing {} stored pages", pages.size());

        int refreshed = 0;
        for (CompanyPage page : pages) {
            int depth = Math.max(AcquisitionRequest.MIN_DEPTH, page.getLastDepth());
            try {
                orchestrator.acquire(page.getIdentifier(), depth);
                refreshed++;
            } catch (RuntimeException e) {
                log.warn("Refresh of {} failed: {}", page.getIdentifier(), e.getMessage());
            }
        }
        log.info("Refresh finished: {} of {} pages updated", refreshed, pages.size());
    }
}

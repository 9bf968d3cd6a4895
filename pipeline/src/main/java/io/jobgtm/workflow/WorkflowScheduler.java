package io.jobgtm.workflow;

import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

/**
 * Cron triggers for the workflows. Every trigger is {@code off} unless configured.
 */
@ApplicationScoped
public class WorkflowScheduler {

    private static final Logger LOG = Logger.getLogger(WorkflowScheduler.class);

    final WorkflowLauncher launcher;

    public WorkflowScheduler(WorkflowLauncher launcher) {
        this.launcher = launcher;
    }

    @Scheduled(identity = "scrape", cron = "{pipeline.schedule.scrape.cron}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void scrape() {
        fire(ScrapeWorkflow.TYPE, launcher.launchScrape(null));
    }

    @Scheduled(identity = "detail-scrape", cron = "{pipeline.schedule.detail-scrape.cron}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void detailScrape() {
        fire(DetailScrapeWorkflow.TYPE, launcher.launchDetailScrape());
    }

    @Scheduled(identity = "enrichment-backfill", cron = "{pipeline.schedule.enrichment-backfill.cron}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void enrichmentBackfill() {
        fire(EnrichmentWorkflow.TYPE, launcher.launchEnrichmentBackfill());
    }

    private <R> void fire(String type, Uni<ExecutionHandle<R>> launch) {
        launch.subscribe().with(
                handle -> LOG.infof("Scheduled %s workflow started as %s", type, handle.executionId()),
                err -> LOG.warnf("Scheduled %s workflow not started: %s", type, err.getMessage()));
    }
}

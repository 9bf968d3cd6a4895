package io.jobgtm.workflow;

import io.jobgtm.client.ScraperGateway;
import io.jobgtm.model.RawItem;
import io.jobgtm.queue.QueueTopology;
import io.jobgtm.queue.StagePublisher;
import io.jobgtm.retry.ActivityRetryEnvelope;
import io.jobgtm.retry.RetryPolicy;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * First stage: walks listing pages of each scraper and publishes every card to
 * {@code scraped_jobs}. Scrapers run concurrently, pages of one scraper in order; a scraper
 * stops at its first empty page or first failed page.
 */
@ApplicationScoped
public class ScrapeWorkflow {

    private static final Logger LOG = Logger.getLogger(ScrapeWorkflow.class);

    public static final String TYPE = "scrape";

    final ScraperGateway scraper;
    final StagePublisher publisher;
    final ActivityRetryEnvelope envelope;

    RetryPolicy listPolicy = RetryPolicy.exponential(3, Duration.ofSeconds(1), Duration.ofSeconds(10), Duration.ofSeconds(30));
    RetryPolicy pagePolicy = RetryPolicy.exponential(3, Duration.ofSeconds(2), Duration.ofSeconds(30), Duration.ofMinutes(5));

    public ScrapeWorkflow(ScraperGateway scraper, StagePublisher publisher, ActivityRetryEnvelope envelope) {
        this.scraper = scraper;
        this.publisher = publisher;
        this.envelope = envelope;
    }

    public Uni<ScrapeSummary> run(String executionId, ScrapeRequest request) {
        Uni<List<String>> names = request.scraper() != null && !request.scraper().isBlank()
                ? Uni.createFrom().item(List.of(request.scraper()))
                : envelope.run("list-scrapers", listPolicy, scraper::availableScrapers);
        return names.onItem().transformToUni(list -> {
            if (list.isEmpty()) {
                LOG.warnf("[%s] no scrapers available", executionId);
                return Uni.createFrom().item(new ScrapeSummary(executionId, 0, 0, List.of()));
            }
            LOG.infof("[%s] scraping %d scraper(s), up to %d page(s) each", executionId, list.size(), request.maxPages());
            List<Uni<ScrapeSummary.ScraperRun>> runs = new ArrayList<>(list.size());
            for (String name : list) {
                runs.add(scrapeFrom(executionId, name, 1, request.maxPages(), ScrapeSummary.ScraperRun.begin(name)));
            }
            return Uni.join().all(runs).andFailFast()
                    .onItem().transform(done -> {
                        int total = done.stream().mapToInt(ScrapeSummary.ScraperRun::jobsPublished).sum();
                        LOG.infof("[%s] scrape finished: %d job(s) published", executionId, total);
                        return new ScrapeSummary(executionId, done.size(), total, done);
                    });
        });
    }

    private Uni<ScrapeSummary.ScraperRun> scrapeFrom(String executionId, String name, int page, int maxPages,
                                                     ScrapeSummary.ScraperRun soFar) {
        if (page > maxPages) {
            return Uni.createFrom().item(soFar);
        }
        return envelope.run("scrape-page:" + name, pagePolicy, () -> scraper.scrapePage(name, page))
                .onItem().transformToUni(cards -> cards.isEmpty()
                        ? Uni.createFrom().item(PageOutcome.END)
                        : publishAll(cards).onItem().transform(PageOutcome::published))
                .onFailure().recoverWithItem(PageOutcome::failed)
                .onItem().transformToUni(outcome -> {
                    if (outcome.error() != null) {
                        LOG.errorf("[%s] %s page %d failed, stopping: %s", executionId, name, page, outcome.error());
                        return Uni.createFrom().item(soFar.partial(outcome.error()));
                    }
                    if (outcome.published() < 0) {
                        LOG.infof("[%s] %s has no more jobs after page %d", executionId, name, page - 1);
                        return Uni.createFrom().item(soFar);
                    }
                    return scrapeFrom(executionId, name, page + 1, maxPages, soFar.withPage(outcome.published()));
                });
    }

    private Uni<Integer> publishAll(List<RawItem> cards) {
        return Multi.createFrom().iterable(cards)
                .onItem().transformToUniAndConcatenate(card -> publisher.publish(QueueTopology.SCRAPED_JOBS, card).replaceWith(card))
                .collect().asList()
                .onItem().transform(List::size);
    }

    private record PageOutcome(int published, String error) {

        static final PageOutcome END = new PageOutcome(-1, null);

        static PageOutcome published(int count) {
            return new PageOutcome(count, null);
        }

        static PageOutcome failed(Throwable err) {
            return new PageOutcome(0, err.getMessage() == null ? err.getClass().getSimpleName() : err.getMessage());
        }
    }
}

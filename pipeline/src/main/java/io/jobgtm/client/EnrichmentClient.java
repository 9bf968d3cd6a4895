package io.jobgtm.client;

import io.jobgtm.model.Enrichment;
import io.jobgtm.model.ScrapedItem;
import io.smallrye.mutiny.Uni;

public interface EnrichmentClient {

    /**
     * Fails only on transport errors. A model answer that cannot be read comes back as an
     * {@link Enrichment} with {@code error} set.
     */
    Uni<Enrichment> enrich(ScrapedItem item);

    Uni<Boolean> healthy();
}

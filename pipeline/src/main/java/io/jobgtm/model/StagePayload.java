package io.jobgtm.model;

import java.util.Map;

/**
 * Typed message body for one pipeline stage.
 */
public sealed interface StagePayload permits RawItem, ScrapedItem, EnrichedItem {

    /**
     * Key an operator can use to find and replay the item; logged on dead-lettering.
     */
    String idempotencyKey();

    /**
     * Headers attached when the payload is published.
     */
    Map<String, Object> headers();
}

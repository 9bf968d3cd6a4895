package io.jobgtm.store;

/**
 * @param id      golden id of the updated row, {@code null} when nothing matched
 * @param version enrichment version after the update
 */
public record UpdateOutcome(Long id, Integer version) {

    public static UpdateOutcome notFound() {
        return new UpdateOutcome(null, null);
    }

    public boolean found() {
        return id != null;
    }
}

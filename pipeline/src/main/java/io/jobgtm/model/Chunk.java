package io.jobgtm.model;

/**
 * Partition of an id-ordered work item query.
 *
 * <p>{@code offset}/{@code limit} address the chunk by position, which holds while the query's
 * result does not change under the run. When {@code firstId} is set the chunk is the id range
 * {@code [firstId, lastId]} of at most {@code limit} items instead; that range stays put when
 * items drop out of the query as they are processed.</p>
 */
public record Chunk(int chunkIndex, int offset, int limit, Long firstId, Long lastId) {

    public Chunk {
        if (chunkIndex < 0 || offset < 0 || limit <= 0) {
            throw new IllegalArgumentException(
                    "Invalid chunk: index=" + chunkIndex + ", offset=" + offset + ", limit=" + limit);
        }
        if ((firstId == null) != (lastId == null) || (firstId != null && firstId > lastId)) {
            throw new IllegalArgumentException(
                    "Invalid chunk id range: index=" + chunkIndex + ", ids=" + firstId + ".." + lastId);
        }
    }

    public Chunk(int chunkIndex, int offset, int limit) {
        this(chunkIndex, offset, limit, null, null);
    }

    public int endExclusive() {
        return offset + limit;
    }

    public boolean byIdRange() {
        return firstId != null;
    }
}

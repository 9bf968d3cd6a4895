package io.jobgtm.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Chunk boundaries computed from a single count; no item payload is involved.
 */
public record ChunkPlan(int totalCount, int chunkSize, int chunkCount, List<Chunk> chunks) {

    public ChunkPlan {
        chunks = List.copyOf(chunks);
    }

    /**
     * Partitions {@code totalCount} items into contiguous chunks of at most {@code chunkSize}.
     * The last chunk carries the remainder.
     */
    public static ChunkPlan of(int totalCount, int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
        }
        int total = Math.max(0, totalCount);
        int count = (int) (((long) total + chunkSize - 1) / chunkSize);
        List<Chunk> list = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int offset = (int) ((long) i * chunkSize);
            list.add(new Chunk(i, offset, Math.min(chunkSize, total - offset)));
        }
        return new ChunkPlan(total, chunkSize, count, list);
    }

    /**
     * Same partition as {@link #of(int, int)} over {@code ids.size()} items, with every chunk
     * pinned to the ids it covers. {@code ids} must be ascending.
     */
    public static ChunkPlan ofIds(List<Long> ids, int chunkSize) {
        ChunkPlan byPosition = of(ids.size(), chunkSize);
        List<Chunk> list = new ArrayList<>(byPosition.chunkCount());
        for (Chunk c : byPosition.chunks()) {
            list.add(new Chunk(c.chunkIndex(), c.offset(), c.limit(),
                    ids.get(c.offset()), ids.get(c.endExclusive() - 1)));
        }
        return new ChunkPlan(byPosition.totalCount(), chunkSize, byPosition.chunkCount(), list);
    }

    public boolean isEmpty() {
        return chunkCount == 0;
    }

    /**
     * Splits the chunks into consecutive waves of at most {@code maxParallel} chunks.
     */
    public List<List<Chunk>> waves(int maxParallel) {
        int size = Math.max(1, maxParallel);
        List<List<Chunk>> waves = new ArrayList<>();
        for (int i = 0; i < chunks.size(); i += size) {
            waves.add(chunks.subList(i, Math.min(i + size, chunks.size())));
        }
        return waves;
    }
}

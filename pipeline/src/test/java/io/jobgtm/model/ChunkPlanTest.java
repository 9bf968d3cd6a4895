package io.jobgtm.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChunkPlanTest {

    @Test
    void remainderGoesToLastChunk() {
        ChunkPlan plan = ChunkPlan.of(237, 50);

        assertEquals(5, plan.chunkCount());
        assertEquals(List.of(0, 50, 100, 150, 200), plan.chunks().stream().map(Chunk::offset).toList());
        assertEquals(List.of(50, 50, 50, 50, 37), plan.chunks().stream().map(Chunk::limit).toList());
        assertEquals(237, plan.chunks().stream().mapToInt(Chunk::limit).sum());
    }

    @Test
    void chunksAreContiguous() {
        ChunkPlan plan = ChunkPlan.of(1001, 100);
        int expectedOffset = 0;
        for (Chunk c : plan.chunks()) {
            assertEquals(expectedOffset, c.offset());
            expectedOffset = c.endExclusive();
        }
        assertEquals(1001, expectedOffset);
    }

    @Test
    void exactMultipleHasNoPartialChunk() {
        ChunkPlan plan = ChunkPlan.of(200, 50);
        assertEquals(4, plan.chunkCount());
        assertTrue(plan.chunks().stream().allMatch(c -> c.limit() == 50));
    }

    @Test
    void zeroItemsMeansNoChunks() {
        assertTrue(ChunkPlan.of(0, 50).isEmpty());
    }

    @Test
    void wavesSplitChunksInOrder() {
        List<List<Chunk>> waves = ChunkPlan.of(237, 50).waves(2);
        assertEquals(3, waves.size());
        assertEquals(List.of(2, 2, 1), waves.stream().map(List::size).toList());
        assertEquals(4, waves.get(2).get(0).chunkIndex());
    }

    @Test
    void rejectsNonPositiveChunkSize() {
        assertThrows(IllegalArgumentException.class, () -> ChunkPlan.of(10, 0));
    }

    @Test
    void countNearIntegerLimitDoesNotOverflow() {
        ChunkPlan plan = ChunkPlan.of(Integer.MAX_VALUE, 1_000_000_000);

        assertEquals(3, plan.chunkCount());
        Chunk last = plan.chunks().get(2);
        assertEquals(2_000_000_000, last.offset());
        assertEquals(Integer.MAX_VALUE - 2_000_000_000, last.limit());
    }
}

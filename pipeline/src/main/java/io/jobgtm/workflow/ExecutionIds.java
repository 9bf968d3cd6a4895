package io.jobgtm.workflow;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Execution id scheme: {@code {stage}-{yyyyMMddHHmmss}-{6 random [a-z0-9]}} for coordinators
 * and {@code {parentId}-chunk-{index}} for their children.
 */
public final class ExecutionIds {

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");
    private static final char[] ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789".toCharArray();
    private static final int SUFFIX_LENGTH = 6;

    private ExecutionIds() {
    }

    public static String coordinator(String stage) {
        return coordinator(stage, Clock.systemUTC(), ThreadLocalRandom.current());
    }

    static String coordinator(String stage, Clock clock, Random random) {
        StringBuilder suffix = new StringBuilder(SUFFIX_LENGTH);
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            suffix.append(ALPHABET[random.nextInt(ALPHABET.length)]);
        }
        return stage + "-" + LocalDateTime.now(clock).format(STAMP) + "-" + suffix;
    }

    public static String child(String parentId, int chunkIndex) {
        return parentId + "-chunk-" + chunkIndex;
    }
}

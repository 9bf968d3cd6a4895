package io.jobgtm.store;

import io.vertx.mutiny.sqlclient.Pool;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Recreates the job tables from {@code db/job-tables.sql} on the test database.
 */
public final class PgTestSchema {

    private static final String SCRIPT = "/db/job-tables.sql";

    private PgTestSchema() {
    }

    public static void recreateJobTables(Pool pg) {
        for (String statement : read().split(";")) {
            if (statement.isBlank()) continue;
            pg.query(statement).execute().await().atMost(Duration.ofSeconds(10));
        }
    }

    private static String read() {
        try (InputStream in = PgTestSchema.class.getResourceAsStream(SCRIPT)) {
            if (in == null) {
                throw new IllegalStateException(SCRIPT + " not on the test classpath");
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}

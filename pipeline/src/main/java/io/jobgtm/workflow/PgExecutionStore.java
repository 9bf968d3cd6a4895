package io.jobgtm.workflow;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.sqlclient.Pool;
import io.vertx.mutiny.sqlclient.Row;
import io.vertx.mutiny.sqlclient.RowSet;
import io.vertx.mutiny.sqlclient.Tuple;
import io.vertx.pgclient.PgException;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * {@link ExecutionStore} on the {@code workflow_runs} table.
 */
@ApplicationScoped
public class PgExecutionStore implements ExecutionStore {

    private static final Logger LOG = Logger.getLogger(PgExecutionStore.class);

    private static final String UNIQUE_VIOLATION = "23505";

    private static final List<String> SCHEMA = List.of(
            """
            CREATE TABLE IF NOT EXISTS workflow_runs (
                id                 SERIAL PRIMARY KEY,
                workflow_id        VARCHAR(255) NOT NULL UNIQUE,
                run_id             VARCHAR(255) NOT NULL,
                parent_workflow_id VARCHAR(255),
                workflow_type      VARCHAR(100) NOT NULL,
                status             VARCHAR(50) NOT NULL,
                input_params       JSON,
                result             JSON,
                error_message      TEXT,
                started_at         TIMESTAMPTZ DEFAULT now(),
                completed_at       TIMESTAMPTZ,
                created_at         TIMESTAMPTZ DEFAULT now(),
                updated_at         TIMESTAMPTZ
            )
            """,
            "ALTER TABLE workflow_runs ADD COLUMN IF NOT EXISTS parent_workflow_id VARCHAR(255)",
            "CREATE INDEX IF NOT EXISTS workflow_runs_type_status_idx ON workflow_runs (workflow_type, status)"
    );

    private static final String COLUMNS = """
            workflow_id, parent_workflow_id, workflow_type, status, input_params::text AS input_params,
            result::text AS result, error_message, started_at, completed_at
            """;

    final Pool pg;

    public PgExecutionStore(Pool pg) {
        this.pg = pg;
    }

    @Override
    public Uni<Void> initialize() {
        return Multi.createFrom().iterable(SCHEMA)
                .onItem().transformToUniAndConcatenate(ddl -> pg.query(ddl).execute())
                .collect().last()
                .replaceWithVoid();
    }

    @Override
    public Uni<Void> start(String executionId, String parentId, String workflowType, String input) {
        String sql = """
                INSERT INTO workflow_runs (workflow_id, run_id, parent_workflow_id, workflow_type, status,
                                           input_params, started_at)
                VALUES ($1, $2, $3, $4, 'running', $5::json, now())
                """;
        return pg.preparedQuery(sql)
                .execute(Tuple.of(executionId, UUID.randomUUID().toString(), parentId, workflowType, input))
                .onFailure(PgException.class).transform(e -> {
                    if (UNIQUE_VIOLATION.equals(((PgException) e).getSqlState())) {
                        return new DuplicateExecutionException("Execution " + executionId + " already exists");
                    }
                    return e;
                })
                .replaceWithVoid();
    }

    @Override
    public Uni<Void> complete(String executionId, String result) {
        return finish(executionId, ExecutionStatus.COMPLETED, result, null);
    }

    @Override
    public Uni<Void> fail(String executionId, String error) {
        return finish(executionId, ExecutionStatus.FAILED, null, error);
    }

    private Uni<Void> finish(String executionId, ExecutionStatus status, String result, String error) {
        String sql = """
                UPDATE workflow_runs
                SET status = $2, result = $3::json, error_message = LEFT($4::text, 2000),
                    completed_at = now(), updated_at = now()
                WHERE workflow_id = $1
                """;
        return pg.preparedQuery(sql)
                .execute(Tuple.of(executionId, status.wire(), result, error))
                .invoke(rows -> {
                    if (rows.rowCount() == 0) {
                        LOG.warnf("No workflow run %s to mark %s", executionId, status.wire());
                    }
                })
                .replaceWithVoid();
    }

    @Override
    public Uni<ExecutionRecord> describe(String executionId) {
        return pg.preparedQuery("SELECT " + COLUMNS + " FROM workflow_runs WHERE workflow_id = $1")
                .execute(Tuple.of(executionId))
                .onItem().transform(rows -> rows.rowCount() == 0 ? null : toRecord(rows.iterator().next()));
    }

    @Override
    public Uni<List<ExecutionRecord>> findRunning(String workflowType) {
        String sql = "SELECT " + COLUMNS + """
                FROM workflow_runs
                WHERE workflow_type = $1 AND status = 'running' AND parent_workflow_id IS NULL
                ORDER BY started_at
                """;
        return pg.preparedQuery(sql)
                .execute(Tuple.of(workflowType))
                .onItem().transform(PgExecutionStore::toRecords);
    }

    @Override
    public Uni<Integer> markInterrupted() {
        String sql = """
                UPDATE workflow_runs
                SET status = 'interrupted', error_message = 'process stopped while running',
                    completed_at = now(), updated_at = now()
                WHERE status = 'running'
                """;
        return pg.query(sql).execute().onItem().transform(RowSet::rowCount);
    }

    private static List<ExecutionRecord> toRecords(RowSet<Row> rows) {
        List<ExecutionRecord> list = new ArrayList<>(rows.rowCount());
        for (Row r : rows) {
            list.add(toRecord(r));
        }
        return list;
    }

    private static ExecutionRecord toRecord(Row r) {
        return new ExecutionRecord(
                r.getString("workflow_id"),
                r.getString("parent_workflow_id"),
                r.getString("workflow_type"),
                ExecutionStatus.fromWire(r.getString("status")),
                r.getString("input_params"),
                r.getString("result"),
                r.getString("error_message"),
                r.getOffsetDateTime("started_at"),
                r.getOffsetDateTime("completed_at"));
    }
}

package io.jobgtm.queue;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.sqlclient.Pool;
import io.vertx.mutiny.sqlclient.Row;
import io.vertx.mutiny.sqlclient.SqlConnection;
import io.vertx.mutiny.sqlclient.Tuple;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * PostgreSQL-backed {@link MessageBroker}.
 *
 * <p>Exchanges, queues and bindings are rows; a message is a row in {@code mq_message} owned by
 * exactly one queue. Fetching leases rows with {@code FOR UPDATE SKIP LOCKED} by pushing
 * {@code visible_at} into the future, so concurrent consumers never receive the same message
 * while the lease holds. Ack deletes the row. Requeue and reject each settle the original and
 * insert its successor in one statement.</p>
 */
@ApplicationScoped
public class PgMessageBroker implements MessageBroker {

    private static final Logger LOG = Logger.getLogger(PgMessageBroker.class);

    private static final List<String> SCHEMA = List.of(
            """
            CREATE TABLE IF NOT EXISTS mq_exchange (
                name       TEXT PRIMARY KEY,
                created_at TIMESTAMPTZ NOT NULL DEFAULT now()
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS mq_queue (
                name                    TEXT PRIMARY KEY,
                dead_letter_exchange    TEXT,
                dead_letter_routing_key TEXT,
                created_at              TIMESTAMPTZ NOT NULL DEFAULT now()
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS mq_binding (
                exchange    TEXT NOT NULL REFERENCES mq_exchange (name),
                routing_key TEXT NOT NULL,
                queue       TEXT NOT NULL REFERENCES mq_queue (name),
                PRIMARY KEY (exchange, routing_key, queue)
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS mq_message (
                id             BIGSERIAL PRIMARY KEY,
                queue          TEXT NOT NULL REFERENCES mq_queue (name),
                body           TEXT NOT NULL,
                headers        JSONB NOT NULL DEFAULT '{}'::jsonb,
                delivery_count INT NOT NULL DEFAULT 0,
                visible_at     TIMESTAMPTZ NOT NULL DEFAULT now(),
                enqueued_at    TIMESTAMPTZ NOT NULL DEFAULT now(),
                last_error     TEXT
            )
            """,
            "CREATE INDEX IF NOT EXISTS mq_message_ready_idx ON mq_message (queue, visible_at, id)"
    );

    final Pool pg;

    public PgMessageBroker(Pool pg) {
        this.pg = pg;
    }

    @Override
    public Uni<Void> initialize() {
        return Multi.createFrom().iterable(SCHEMA)
                .onItem().transformToUniAndConcatenate(ddl -> pg.query(ddl).execute())
                .collect().last()
                .invoke(() -> LOG.debug("Broker schema ready"))
                .replaceWithVoid();
    }

    @Override
    public Uni<Void> declare(QueueTopology t) {
        return pg.withTransaction(conn -> exchanges(conn, t)
                .chain(() -> conn.preparedQuery("""
                                INSERT INTO mq_queue (name, dead_letter_exchange, dead_letter_routing_key)
                                VALUES ($1, NULL, NULL)
                                ON CONFLICT (name) DO NOTHING
                                """)
                        .execute(Tuple.of(t.deadLetterQueue())))
                .chain(() -> conn.preparedQuery("""
                                INSERT INTO mq_queue (name, dead_letter_exchange, dead_letter_routing_key)
                                VALUES ($1, $2, $3)
                                ON CONFLICT (name) DO UPDATE
                                  SET dead_letter_exchange    = EXCLUDED.dead_letter_exchange,
                                      dead_letter_routing_key = EXCLUDED.dead_letter_routing_key
                                """)
                        .execute(Tuple.of(t.queue(), t.deadLetterExchange(), t.routingKey())))
                .chain(() -> conn.preparedQuery("""
                                INSERT INTO mq_binding (exchange, routing_key, queue)
                                VALUES ($1, $2, $3), ($4, $2, $5)
                                ON CONFLICT DO NOTHING
                                """)
                        .execute(Tuple.of(t.exchange(), t.routingKey(), t.queue(),
                                t.deadLetterExchange(), t.deadLetterQueue())))
        ).invoke(() -> LOG.infof("Declared queue %s (exchange=%s, dlx=%s, dlq=%s)",
                t.queue(), t.exchange(), t.deadLetterExchange(), t.deadLetterQueue())
        ).replaceWithVoid();
    }

    private Uni<?> exchanges(SqlConnection conn, QueueTopology t) {
        return conn.preparedQuery("""
                        INSERT INTO mq_exchange (name) VALUES ($1), ($2)
                        ON CONFLICT (name) DO NOTHING
                        """)
                .execute(Tuple.of(t.exchange(), t.deadLetterExchange()));
    }

    @Override
    public Uni<Integer> publish(String exchange, String routingKey, String body, Map<String, Object> headers) {
        String sql = """
                INSERT INTO mq_message (queue, body, headers)
                SELECT b.queue, $3::text, $4::jsonb
                FROM mq_binding b
                WHERE b.exchange = $1 AND b.routing_key = $2
                """;
        return pg.preparedQuery(sql)
                .execute(Tuple.of(exchange, routingKey, body, toJson(headers)))
                .onItem().transformToUni(rows -> rows.rowCount() == 0
                        ? Uni.createFrom().<Integer>failure(new UnroutableMessageException(exchange, routingKey))
                        : Uni.createFrom().item(rows.rowCount()));
    }

    @Override
    public Uni<List<QueueMessage>> fetch(String queue, int max, Duration lease) {
        String sql = """
                WITH picked AS (
                SELECT id
                FROM mq_message
                WHERE queue = $1 AND visible_at <= now()
                ORDER BY id
                FOR UPDATE SKIP LOCKED
                LIMIT $2
                )
                UPDATE mq_message m
                SET delivery_count = m.delivery_count + 1,
                    visible_at     = $3
                FROM picked p
                WHERE m.id = p.id
                RETURNING m.id, m.queue, m.body, m.headers, m.delivery_count
                """;
        OffsetDateTime leasedUntil = OffsetDateTime.now(ZoneOffset.UTC).plus(lease);
        return pg.preparedQuery(sql)
                .execute(Tuple.of(queue, max, leasedUntil))
                .onItem().transform(rows -> {
                    List<QueueMessage> list = new ArrayList<>(rows.rowCount());
                    for (Row r : rows) {
                        list.add(new QueueMessage(
                                r.getLong("id"),
                                r.getString("queue"),
                                r.getString("body"),
                                headersOf(r),
                                r.getInteger("delivery_count")));
                    }
                    list.sort(Comparator.comparingLong(QueueMessage::deliveryTag));
                    return list;
                });
    }

    @Override
    public Uni<Integer> extendLease(List<QueueMessage> messages, Duration lease) {
        if (messages.isEmpty()) {
            return Uni.createFrom().item(0);
        }
        String sql = """
                UPDATE mq_message m
                SET visible_at = $3
                FROM unnest($1::int8[], $2::int4[]) AS held(id, delivery_count)
                WHERE m.id = held.id AND m.delivery_count = held.delivery_count
                """;
        Long[] tags = new Long[messages.size()];
        Integer[] deliveries = new Integer[messages.size()];
        for (int i = 0; i < messages.size(); i++) {
            tags[i] = messages.get(i).deliveryTag();
            deliveries[i] = messages.get(i).deliveryCount();
        }
        OffsetDateTime leasedUntil = OffsetDateTime.now(ZoneOffset.UTC).plus(lease);
        return pg.preparedQuery(sql)
                .execute(Tuple.tuple().addValue(tags).addValue(deliveries).addValue(leasedUntil))
                .onItem().transform(rows -> rows.rowCount());
    }

    @Override
    public Uni<Void> ack(QueueMessage message) {
        return pg.preparedQuery("DELETE FROM mq_message WHERE id = $1")
                .execute(Tuple.of(message.deliveryTag()))
                .invoke(rows -> {
                    if (rows.rowCount() == 0) {
                        LOG.debugf("Ack of %d found no message (lease expired and redelivered?)", message.deliveryTag());
                    }
                })
                .replaceWithVoid();
    }

    @Override
    public Uni<Void> requeue(QueueMessage message, Map<String, Object> headers) {
        String sql = """
                WITH old AS (
                DELETE FROM mq_message WHERE id = $1
                RETURNING queue, body
                )
                INSERT INTO mq_message (queue, body, headers, last_error)
                SELECT queue, body, $2::jsonb, LEFT($3::text, 500) FROM old
                """;
        Object lastError = headers == null ? null : headers.get("x-last-error");
        return pg.preparedQuery(sql)
                .execute(Tuple.of(message.deliveryTag(), toJson(headers), lastError == null ? null : lastError.toString()))
                .invoke(rows -> {
                    if (rows.rowCount() == 0) {
                        LOG.warnf("Requeue of %d found no message to settle", message.deliveryTag());
                    }
                })
                .replaceWithVoid();
    }

    @Override
    public Uni<Boolean> reject(QueueMessage message, String reason) {
        String sql = """
                WITH old AS (
                DELETE FROM mq_message WHERE id = $1
                RETURNING queue, body, headers
                ),
                target AS (
                SELECT b.queue AS dlq, o.queue AS origin, o.body, o.headers
                FROM old o
                JOIN mq_queue q ON q.name = o.queue
                JOIN mq_binding b ON b.exchange = q.dead_letter_exchange
                                  AND b.routing_key = q.dead_letter_routing_key
                )
                INSERT INTO mq_message (queue, body, headers, last_error)
                SELECT dlq, body,
                       headers || jsonb_build_object('x-original-queue', origin, 'x-death-reason', LEFT($2::text, 500)),
                       LEFT($2::text, 500)
                FROM target
                """;
        return pg.preparedQuery(sql)
                .execute(Tuple.of(message.deliveryTag(), reason == null ? "rejected" : reason))
                .onItem().transform(rows -> {
                    if (rows.rowCount() == 0) {
                        LOG.warnf("Message %d from %s dropped on reject (no dead-letter route)",
                                message.deliveryTag(), message.queue());
                        return false;
                    }
                    return true;
                });
    }

    @Override
    public Uni<Long> depth(String queue) {
        return pg.preparedQuery("SELECT count(*) AS depth FROM mq_message WHERE queue = $1")
                .execute(Tuple.of(queue))
                .onItem().transform(rows -> rows.iterator().next().getLong("depth"));
    }

    private static JsonObject toJson(Map<String, Object> headers) {
        return headers == null ? new JsonObject() : new JsonObject(new HashMap<>(headers));
    }

    private static Map<String, Object> headersOf(Row r) {
        Object raw = r.getValue("headers");
        if (raw instanceof JsonObject json) return json.getMap();
        return Map.of();
    }
}

/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.adapter.kafka;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intuitivedesigns.querykernel.adapter.SourceAdapter;
import com.intuitivedesigns.querykernel.adapter.SourceAdapterException;
import com.intuitivedesigns.querykernel.adapter.SourceAdapterException.Reason;
import com.intuitivedesigns.querykernel.config.KernelConfig;
import com.intuitivedesigns.querykernel.metrics.MetricsRuntime;
import com.intuitivedesigns.querykernel.model.FieldRole;
import com.intuitivedesigns.querykernel.model.FieldSpec;
import com.intuitivedesigns.querykernel.model.QueryPayload;
import com.intuitivedesigns.querykernel.model.SemanticType;
import com.intuitivedesigns.querykernel.model.TableSchema;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.consumer.OffsetAndTimestamp;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.PartitionInfo;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.AuthenticationException;
import org.apache.kafka.common.errors.AuthorizationException;
import org.apache.kafka.common.errors.InterruptException;
import org.apache.kafka.common.errors.RetriableException;
import org.apache.kafka.common.errors.TimeoutException;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.function.Supplier;

/**
 * Message-log source. Each table is a topic; each call reads a bounded slice of it with a
 * short-lived consumer that is assigned partitions directly and never commits offsets.
 *
 * <p>Payload keys: {@code topic} (or {@code table}), {@code fromTimestamp} and
 * {@code toTimestamp} (epoch millis), {@code where} (equality on parsed value fields),
 * {@code fields} (projection) and {@code limit}. Without a lower bound, the newest
 * {@code limit} messages per partition are read.</p>
 *
 * <p>Rows carry the parsed JSON value plus {@code _key}, {@code _partition},
 * {@code _offset} and {@code _timestamp}.</p>
 */
public final class KafkaSourceAdapter implements SourceAdapter {

    private static final Logger log = LoggerFactory.getLogger(KafkaSourceAdapter.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    // Config keys (relative to sources.<id>.)
    public static final String KEY_TOPICS = "kafka.topics";
    public static final String KEY_SAMPLE_SIZE = "kafka.sample.size";
    public static final String KEY_DEFAULT_LIMIT = "kafka.default.limit";

    // Defaults
    private static final int DEFAULT_SAMPLE_SIZE = 20;
    private static final int DEFAULT_LIMIT = 500;
    private static final Duration POLL_SLICE = Duration.ofMillis(100);
    private static final Duration METADATA_TIMEOUT = Duration.ofSeconds(5);

    static final String META_KEY = "_key";
    static final String META_PARTITION = "_partition";
    static final String META_OFFSET = "_offset";
    static final String META_TIMESTAMP = "_timestamp";
    static final String RAW_VALUE = "value";

    private final String sourceId;
    private final Supplier<Consumer<String, String>> consumerFactory;
    private final List<String> topics;
    private final int sampleSize;
    private final int defaultLimit;
    private final MetricsRuntime metrics;

    public KafkaSourceAdapter(String sourceId,
                              Supplier<Consumer<String, String>> consumerFactory,
                              List<String> topics,
                              int sampleSize,
                              int defaultLimit,
                              MetricsRuntime metrics) {
        this.sourceId = Objects.requireNonNull(sourceId, "sourceId");
        this.consumerFactory = Objects.requireNonNull(consumerFactory, "consumerFactory");
        this.topics = (topics == null) ? List.of() : List.copyOf(topics);
        this.sampleSize = Math.max(1, sampleSize);
        this.defaultLimit = Math.max(1, defaultLimit);
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public static KafkaSourceAdapter fromConfig(String sourceId, String brokers, KernelConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        Properties props = buildConsumerProps(sourceId, brokers, config);

        List<String> topics = new ArrayList<>();
        for (String t : config.getString(KEY_TOPICS, "").split(",")) {
            if (!t.isBlank()) topics.add(t.trim());
        }
        return new KafkaSourceAdapter(sourceId,
                () -> new KafkaConsumer<>(props),
                topics,
                config.getInt(KEY_SAMPLE_SIZE, DEFAULT_SAMPLE_SIZE),
                config.getInt(KEY_DEFAULT_LIMIT, DEFAULT_LIMIT),
                metrics);
    }

    static Properties buildConsumerProps(String sourceId, String brokers, KernelConfig config) {
        Properties props = new Properties();

        // 1. Connection
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG,
                (brokers == null || brokers.isBlank()) ? "localhost:9092" : brokers);
        props.put(ConsumerConfig.CLIENT_ID_CONFIG, "querykernel-" + sourceId);

        // 2. Deserialization
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());

        // 3. Behavior: partitions are assigned explicitly and offsets are never committed
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");

        // 4. Performance Tuning
        props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, config.getString("kafka.consumer.max.poll.records", "500"));
        props.put(ConsumerConfig.FETCH_MAX_WAIT_MS_CONFIG, config.getString("kafka.consumer.fetch.max.wait.ms", "100"));

        // 5. Security Passthrough
        for (String key : config.keys()) {
            if (key.startsWith("kafka.ssl.") || key.startsWith("kafka.security.") || key.startsWith("kafka.sasl.")) {
                props.put(key.substring(6), config.getString(key, ""));
            }
        }
        return props;
    }

    @Override
    public void connect() {
        // Consumers are created per call; nothing is held between calls.
        log.info("Kafka source '{}' ready (topics={})", sourceId, topics.isEmpty() ? "<discovered>" : topics);
    }

    @Override
    public List<TableSchema> introspect() throws SourceAdapterException {
        List<String> names = topics;
        if (names.isEmpty()) {
            names = new ArrayList<>();
            try (Consumer<String, String> consumer = consumerFactory.get()) {
                for (String t : consumer.listTopics(METADATA_TIMEOUT).keySet()) {
                    if (!t.startsWith("__")) names.add(t);
                }
            } catch (KafkaException e) {
                throw classify(e, "topic listing");
            }
            names.sort(Comparator.naturalOrder());
        }

        List<TableSchema> out = new ArrayList<>(names.size());
        for (String topic : names) {
            List<Map<String, Object>> sample = read(topic, null, null, sampleSize, METADATA_TIMEOUT);
            out.add(new TableSchema(topic, inferFields(sample)));
        }
        return out;
    }

    @Override
    public List<Map<String, Object>> execute(QueryPayload payload, Duration timeout) throws SourceAdapterException {
        String topic = payload.getString("topic", payload.getString("table", null));
        if (topic == null || topic.isBlank()) {
            throw SourceAdapterException.fatal(Reason.MALFORMED_QUERY, "Payload has no 'topic'");
        }
        Long from = payload.has("fromTimestamp") ? payload.getLong("fromTimestamp", 0L) : null;
        Long to = payload.has("toTimestamp") ? payload.getLong("toTimestamp", Long.MAX_VALUE) : null;
        int limit = (int) Math.min(Integer.MAX_VALUE, Math.max(0, payload.getLong("limit", defaultLimit)));

        long start = System.nanoTime();
        List<Map<String, Object>> rows = read(topic, from, to, limit, timeout);

        Map<String, Object> where = payload.getMap("where");
        List<Object> fields = payload.getList("fields");
        List<Map<String, Object>> out = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            if (!matches(row, where)) continue;
            out.add(project(row, fields));
        }
        metrics.timer("qk.adapter.kafka.latency", (System.nanoTime() - start) / 1_000_000L);
        metrics.counter("qk.adapter.kafka.read", out.size());
        return out;
    }

    /**
     * Reads every partition of {@code topic} from the start bound up to the end offset
     * captured at call time, ordered by timestamp then partition then offset.
     */
    List<Map<String, Object>> read(String topic, Long fromTs, Long toTs, int limit, Duration timeout)
            throws SourceAdapterException {
        if (limit == 0) return List.of();
        long deadline = System.nanoTime() + ((timeout == null) ? METADATA_TIMEOUT : timeout).toNanos();

        try (Consumer<String, String> consumer = consumerFactory.get()) {
            List<PartitionInfo> infos = consumer.partitionsFor(topic, METADATA_TIMEOUT);
            if (infos == null || infos.isEmpty()) {
                throw SourceAdapterException.fatal(Reason.NOT_FOUND,
                        "Topic '" + topic + "' not found on source '" + sourceId + "'");
            }
            List<TopicPartition> parts = new ArrayList<>(infos.size());
            for (PartitionInfo pi : infos) parts.add(new TopicPartition(topic, pi.partition()));
            consumer.assign(parts);

            Map<TopicPartition, Long> begin = consumer.beginningOffsets(parts);
            Map<TopicPartition, Long> end = consumer.endOffsets(parts);
            Map<TopicPartition, Long> startAt = new HashMap<>();
            if (fromTs != null) {
                Map<TopicPartition, Long> query = new HashMap<>();
                for (TopicPartition tp : parts) query.put(tp, fromTs);
                Map<TopicPartition, OffsetAndTimestamp> found = consumer.offsetsForTimes(query, METADATA_TIMEOUT);
                for (TopicPartition tp : parts) {
                    OffsetAndTimestamp ot = (found == null) ? null : found.get(tp);
                    startAt.put(tp, (ot == null) ? end.get(tp) : ot.offset());
                }
            } else {
                for (TopicPartition tp : parts) {
                    startAt.put(tp, Math.max(begin.getOrDefault(tp, 0L), end.getOrDefault(tp, 0L) - limit));
                }
            }

            List<TopicPartition> pending = new ArrayList<>();
            for (TopicPartition tp : parts) {
                long s = startAt.get(tp);
                if (s < end.getOrDefault(tp, 0L)) {
                    consumer.seek(tp, s);
                    pending.add(tp);
                }
            }
            consumer.pause(difference(parts, pending));

            List<ConsumerRecord<String, String>> records = new ArrayList<>();
            while (!pending.isEmpty()) {
                if (Thread.currentThread().isInterrupted()) {
                    throw SourceAdapterException.fatal(Reason.CANCELLED, "Read of '" + topic + "' interrupted");
                }
                if (System.nanoTime() >= deadline) {
                    throw new SourceAdapterException(Reason.TIMEOUT,
                            "Read of '" + topic + "' on '" + sourceId + "' did not reach the end offset in time");
                }
                ConsumerRecords<String, String> batch = consumer.poll(POLL_SLICE);
                for (ConsumerRecord<String, String> r : batch) {
                    TopicPartition tp = new TopicPartition(r.topic(), r.partition());
                    if (r.offset() < end.getOrDefault(tp, 0L)) records.add(r);
                }
                pending.removeIf(tp -> consumer.position(tp) >= end.getOrDefault(tp, 0L));
            }

            records.sort(Comparator.<ConsumerRecord<String, String>>comparingLong(ConsumerRecord::timestamp)
                    .thenComparingInt(ConsumerRecord::partition)
                    .thenComparingLong(ConsumerRecord::offset));

            List<Map<String, Object>> rows = new ArrayList<>(Math.min(records.size(), limit));
            for (ConsumerRecord<String, String> r : records) {
                if (toTs != null && r.timestamp() > toTs) continue;
                rows.add(toRow(r));
            }
            // Newest messages win when no lower bound is given.
            if (rows.size() > limit) {
                rows = (fromTs == null)
                        ? new ArrayList<>(rows.subList(rows.size() - limit, rows.size()))
                        : new ArrayList<>(rows.subList(0, limit));
            }
            return rows;
        } catch (InterruptException e) {
            Thread.currentThread().interrupt();
            throw new SourceAdapterException(Reason.CANCELLED, "Read of '" + topic + "' interrupted", e);
        } catch (KafkaException e) {
            metrics.counter("qk.adapter.kafka.errors");
            throw classify(e, "read of " + topic);
        }
    }

    static Map<String, Object> toRow(ConsumerRecord<String, String> r) {
        Map<String, Object> row = new LinkedHashMap<>();
        String value = r.value();
        if (value != null) {
            try {
                JsonNode node = MAPPER.readTree(value);
                if (node != null && node.isObject()) {
                    row.putAll(MAPPER.convertValue(node,
                            MAPPER.getTypeFactory().constructMapType(LinkedHashMap.class, String.class, Object.class)));
                } else {
                    row.put(RAW_VALUE, value);
                }
            } catch (JsonProcessingException e) {
                row.put(RAW_VALUE, value);
            }
        }
        row.put(META_KEY, r.key());
        row.put(META_PARTITION, (long) r.partition());
        row.put(META_OFFSET, r.offset());
        row.put(META_TIMESTAMP, r.timestamp());
        return row;
    }

    static List<FieldSpec> inferFields(List<Map<String, Object>> sample) {
        Map<String, SemanticType> types = new LinkedHashMap<>();
        for (Map<String, Object> row : sample) {
            for (Map.Entry<String, Object> e : row.entrySet()) {
                if (e.getKey().startsWith("_")) continue;
                if (e.getValue() == null) {
                    types.putIfAbsent(e.getKey(), SemanticType.TEXT);
                } else if (!types.containsKey(e.getKey()) || types.get(e.getKey()) == SemanticType.TEXT) {
                    types.put(e.getKey(), SemanticType.infer(e.getValue()));
                }
            }
        }
        List<FieldSpec> out = new ArrayList<>();
        types.forEach((name, type) -> out.add(FieldSpec.value(name, type)));
        out.add(FieldSpec.value(META_KEY, SemanticType.TEXT));
        out.add(new FieldSpec(META_PARTITION, SemanticType.INTEGER, false, FieldRole.VALUE));
        out.add(new FieldSpec(META_OFFSET, SemanticType.INTEGER, false, FieldRole.VALUE));
        out.add(new FieldSpec(META_TIMESTAMP, SemanticType.TIMESTAMP, false, FieldRole.TIMESTAMP));
        return out;
    }

    static Reason reasonFor(KafkaException e) {
        if (e instanceof TimeoutException) return Reason.TIMEOUT;
        if (e instanceof RetriableException) return Reason.TRANSIENT;
        if (e instanceof AuthorizationException || e instanceof AuthenticationException) return Reason.PERMISSION_DENIED;
        return Reason.UNKNOWN;
    }

    private SourceAdapterException classify(KafkaException e, String what) {
        Reason reason = reasonFor(e);
        return new SourceAdapterException(reason, reason.retryableByDefault(),
                "Kafka " + what + " failed on '" + sourceId + "': " + e.getMessage(), e);
    }

    private static boolean matches(Map<String, Object> row, Map<String, Object> where) {
        for (Map.Entry<String, Object> cond : where.entrySet()) {
            Object v = row.get(cond.getKey());
            Object want = cond.getValue();
            if (v instanceof Number a && want instanceof Number b) {
                if (Double.compare(a.doubleValue(), b.doubleValue()) != 0) return false;
            } else if (!Objects.equals(v, want)) {
                return false;
            }
        }
        return true;
    }

    private static Map<String, Object> project(Map<String, Object> row, List<Object> fields) {
        if (fields.isEmpty()) return row;
        Map<String, Object> p = new LinkedHashMap<>();
        for (Object f : fields) {
            String k = String.valueOf(f);
            if (row.containsKey(k)) p.put(k, row.get(k));
        }
        return p;
    }

    private static List<TopicPartition> difference(List<TopicPartition> all, List<TopicPartition> keep) {
        List<TopicPartition> out = new ArrayList<>(all);
        out.removeAll(keep);
        return out;
    }
}

/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.adapter.mongo;

import com.intuitivedesigns.querykernel.adapter.SourceAdapter;
import com.intuitivedesigns.querykernel.adapter.SourceAdapterException;
import com.intuitivedesigns.querykernel.adapter.SourceAdapterException.Reason;
import com.intuitivedesigns.querykernel.config.KernelConfig;
import com.intuitivedesigns.querykernel.metrics.MetricsRuntime;
import com.intuitivedesigns.querykernel.model.FieldRole;
import com.intuitivedesigns.querykernel.model.FieldSpec;
import com.intuitivedesigns.querykernel.model.QueryPayload;
import com.intuitivedesigns.querykernel.model.SemanticType;
import com.intuitivedesigns.querykernel.model.SourceKind;
import com.intuitivedesigns.querykernel.model.TableSchema;
import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.MongoCommandException;
import com.mongodb.MongoException;
import com.mongodb.MongoExecutionTimeoutException;
import com.mongodb.MongoSecurityException;
import com.mongodb.MongoSocketException;
import com.mongodb.MongoTimeoutException;
import com.mongodb.client.AggregateIterable;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import org.bson.Document;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Document and vector source backed by the synchronous MongoDB driver.
 *
 * <p>Payload keys:</p>
 * <ul>
 *   <li>{@code collection} (or {@code table}): target collection, required</li>
 *   <li>{@code filter}: query document</li>
 *   <li>{@code fields}: projection</li>
 *   <li>{@code sort}: sort document, e.g. {@code {"created": -1}}</li>
 *   <li>{@code limit}</li>
 *   <li>{@code vector}: query embedding; switches to a {@code $vectorSearch} aggregation</li>
 *   <li>{@code pipeline}: raw aggregation stages, used verbatim</li>
 * </ul>
 */
public final class MongoSourceAdapter implements SourceAdapter {

    private static final Logger log = LoggerFactory.getLogger(MongoSourceAdapter.class);

    // Config keys (relative to sources.<id>.)
    public static final String KEY_DATABASE = "mongo.database";
    public static final String KEY_POOL_SIZE = "mongo.pool.size";
    public static final String KEY_SAMPLE_SIZE = "mongo.sample.size";
    public static final String KEY_VECTOR_INDEX = "mongo.vector.index";
    public static final String KEY_VECTOR_PATH = "mongo.vector.path";

    // Defaults
    private static final int DEFAULT_POOL_SIZE = 20;
    private static final int DEFAULT_SAMPLE_SIZE = 50;
    private static final String DEFAULT_VECTOR_INDEX = "vector_index";
    private static final String DEFAULT_VECTOR_PATH = "embedding";
    private static final int DEFAULT_VECTOR_LIMIT = 10;
    private static final int CANDIDATE_FACTOR = 10;

    static final String SCORE_FIELD = "score";

    private final String sourceId;
    private final SourceKind kind;
    private final MongoClientSettings settings;
    private final String databaseName;
    private final int sampleSize;
    private final String vectorIndex;
    private final String vectorPath;
    private final MetricsRuntime metrics;

    private volatile MongoClient client;
    private volatile MongoDatabase database;

    private MongoSourceAdapter(String sourceId, SourceKind kind, MongoClientSettings settings, String databaseName,
                               int sampleSize, String vectorIndex, String vectorPath, MetricsRuntime metrics) {
        this.sourceId = sourceId;
        this.kind = kind;
        this.settings = settings;
        this.databaseName = databaseName;
        this.sampleSize = sampleSize;
        this.vectorIndex = vectorIndex;
        this.vectorPath = vectorPath;
        this.metrics = metrics;
    }

    public static MongoSourceAdapter fromConfig(String sourceId, SourceKind kind, String uri,
                                                KernelConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(sourceId, "sourceId");
        Objects.requireNonNull(config, "config");
        String uriStr = (uri == null || uri.isBlank()) ? "mongodb://localhost:27017" : uri;

        ConnectionString connString = new ConnectionString(uriStr);
        int poolSize = Math.max(1, config.getInt(KEY_POOL_SIZE, DEFAULT_POOL_SIZE));
        MongoClientSettings settings = MongoClientSettings.builder()
                .applyConnectionString(connString)
                .applyToConnectionPoolSettings(builder ->
                        builder.maxSize(poolSize)
                                .maxWaitTime(2_000, TimeUnit.MILLISECONDS))
                .applyToClusterSettings(builder -> builder.serverSelectionTimeout(5_000, TimeUnit.MILLISECONDS))
                .build();

        String db = config.getString(KEY_DATABASE, connString.getDatabase());
        if (db == null || db.isBlank()) {
            throw new IllegalArgumentException("Source '" + sourceId + "' needs " + KEY_DATABASE + " or a database in its URI");
        }

        return new MongoSourceAdapter(sourceId, kind, settings, db,
                Math.max(1, config.getInt(KEY_SAMPLE_SIZE, DEFAULT_SAMPLE_SIZE)),
                config.getString(KEY_VECTOR_INDEX, DEFAULT_VECTOR_INDEX),
                config.getString(KEY_VECTOR_PATH, DEFAULT_VECTOR_PATH),
                metrics);
    }

    @Override
    public synchronized void connect() throws SourceAdapterException {
        if (client != null) return;
        try {
            MongoClient c = MongoClients.create(settings);
            client = c;
            database = c.getDatabase(databaseName);
            log.info("MongoDB source '{}' connected: {}", sourceId, databaseName);
        } catch (MongoException e) {
            throw classify(e, "connect");
        }
    }

    @Override
    public List<TableSchema> introspect() throws SourceAdapterException {
        MongoDatabase db = requireDatabase();
        try {
            List<TableSchema> out = new ArrayList<>();
            for (String name : db.listCollectionNames()) {
                if (name.startsWith("system.")) continue;
                List<Document> sample = new ArrayList<>(sampleSize);
                db.getCollection(name).find().limit(sampleSize).into(sample);
                out.add(new TableSchema(name, inferFields(sample)));
            }
            return out;
        } catch (MongoException e) {
            throw classify(e, "introspection");
        }
    }

    @Override
    public List<Map<String, Object>> execute(QueryPayload payload, Duration timeout) throws SourceAdapterException {
        String name = payload.getString("collection", payload.getString("table", null));
        if (name == null || name.isBlank()) {
            throw SourceAdapterException.fatal(Reason.MALFORMED_QUERY, "Payload has no 'collection'");
        }
        MongoCollection<Document> col = requireDatabase().getCollection(name);
        long maxMs = (timeout == null) ? 0 : Math.max(0, timeout.toMillis());
        long start = System.nanoTime();

        try {
            List<Document> docs = new ArrayList<>();
            List<Document> pipeline = pipelineFor(payload);
            if (pipeline != null) {
                AggregateIterable<Document> it = col.aggregate(pipeline);
                if (maxMs > 0) it.maxTime(maxMs, TimeUnit.MILLISECONDS);
                it.into(docs);
            } else {
                FindIterable<Document> it = col.find(new Document(payload.getMap("filter")));
                List<Object> fields = payload.getList("fields");
                if (!fields.isEmpty()) it.projection(projection(fields));
                Map<String, Object> sort = payload.getMap("sort");
                if (!sort.isEmpty()) it.sort(new Document(sort));
                long limit = payload.getLong("limit", -1L);
                if (limit >= 0) it.limit((int) Math.min(Integer.MAX_VALUE, limit));
                if (maxMs > 0) it.maxTime(maxMs, TimeUnit.MILLISECONDS);
                it.into(docs);
            }

            List<Map<String, Object>> rows = new ArrayList<>(docs.size());
            for (Document d : docs) rows.add(toRow(d));
            metrics.timer("qk.adapter.mongo.latency", (System.nanoTime() - start) / 1_000_000L);
            return rows;
        } catch (MongoException e) {
            metrics.counter("qk.adapter.mongo.errors");
            throw classify(e, "query on " + name);
        } catch (IllegalArgumentException e) {
            throw new SourceAdapterException(Reason.MALFORMED_QUERY,
                    "Invalid payload for '" + sourceId + "/" + name + "': " + e.getMessage(), e);
        }
    }

    @Override
    public synchronized void close() {
        MongoClient c = client;
        client = null;
        database = null;
        if (c != null) {
            log.info("Closing MongoDB connection for source '{}'", sourceId);
            c.close();
        }
    }

    /**
     * Null when the payload is a plain find.
     */
    List<Document> pipelineFor(QueryPayload payload) {
        List<Object> raw = payload.getList("pipeline");
        if (!raw.isEmpty()) {
            List<Document> stages = new ArrayList<>(raw.size());
            for (Object o : raw) {
                if (!(o instanceof Map<?, ?> m)) {
                    throw new IllegalArgumentException("Pipeline stages must be objects");
                }
                stages.add(new Document(castMap(m)));
            }
            return stages;
        }
        List<Object> vector = payload.getList("vector");
        if (vector.isEmpty()) return null;
        if (kind != SourceKind.VECTOR) {
            log.debug("Vector payload on non-vector source '{}'", sourceId);
        }

        long limit = payload.getLong("limit", DEFAULT_VECTOR_LIMIT);
        Document search = new Document("index", vectorIndex)
                .append("path", vectorPath)
                .append("queryVector", vector)
                .append("numCandidates", limit * CANDIDATE_FACTOR)
                .append("limit", limit);
        Map<String, Object> filter = payload.getMap("filter");
        if (!filter.isEmpty()) search.append("filter", new Document(filter));

        Document project = new Document(vectorPath, 0)
                .append(SCORE_FIELD, new Document("$meta", "vectorSearchScore"));
        List<Document> stages = new ArrayList<>(2);
        stages.add(new Document("$vectorSearch", search));
        stages.add(new Document("$project", project));
        return stages;
    }

    private static Document projection(List<Object> fields) {
        Document p = new Document();
        for (Object f : fields) p.append(String.valueOf(f), 1);
        return p;
    }

    static Map<String, Object> toRow(Document doc) {
        Map<String, Object> row = new LinkedHashMap<>(doc.size() * 2);
        for (Map.Entry<String, Object> e : doc.entrySet()) {
            row.put(e.getKey(), normalize(e.getValue()));
        }
        return row;
    }

    private static Object normalize(Object v) {
        if (v instanceof ObjectId oid) return oid.toHexString();
        if (v instanceof Decimal128 d) return d.bigDecimalValue();
        if (v instanceof Document d) return toRow(d);
        if (v instanceof List<?> l) {
            List<Object> out = new ArrayList<>(l.size());
            for (Object o : l) out.add(normalize(o));
            return out;
        }
        return v;
    }

    /**
     * Field set is the union over the sample in first-seen order; the type comes from the
     * first non-null value. {@code _id} is the key.
     */
    static List<FieldSpec> inferFields(List<Document> sample) {
        Map<String, SemanticType> types = new LinkedHashMap<>();
        Set<String> typed = new HashSet<>();
        for (Document d : sample) {
            for (Map.Entry<String, Object> e : toRow(d).entrySet()) {
                String field = e.getKey();
                Object value = e.getValue();
                if (value == null) {
                    types.putIfAbsent(field, SemanticType.TEXT);
                } else if (typed.add(field)) {
                    types.put(field, SemanticType.infer(value));
                }
            }
        }
        List<FieldSpec> out = new ArrayList<>(types.size());
        for (Map.Entry<String, SemanticType> e : types.entrySet()) {
            String field = e.getKey();
            SemanticType type = e.getValue();
            if ("_id".equals(field)) {
                out.add(new FieldSpec(field, type, false, FieldRole.KEY));
            } else {
                out.add(new FieldSpec(field, type, true,
                        type == SemanticType.TIMESTAMP ? FieldRole.TIMESTAMP : FieldRole.VALUE));
            }
        }
        return out;
    }

    static Reason reasonFor(MongoException e) {
        if (e instanceof MongoExecutionTimeoutException) return Reason.TIMEOUT;
        if (e instanceof MongoTimeoutException || e instanceof MongoSocketException) return Reason.TRANSIENT;
        if (e instanceof MongoSecurityException) return Reason.PERMISSION_DENIED;
        if (e instanceof MongoCommandException ce) {
            switch (ce.getErrorCode()) {
                case 13:
                case 18:
                    return Reason.PERMISSION_DENIED;
                case 26:
                    return Reason.NOT_FOUND;
                case 50:
                    return Reason.TIMEOUT;
                default:
                    return Reason.MALFORMED_QUERY;
            }
        }
        if (e.hasErrorLabel(MongoException.TRANSIENT_TRANSACTION_ERROR_LABEL)) return Reason.TRANSIENT;
        return Reason.UNKNOWN;
    }

    private SourceAdapterException classify(MongoException e, String what) {
        Reason reason = reasonFor(e);
        return new SourceAdapterException(reason, reason.retryableByDefault(),
                "MongoDB " + what + " failed on '" + sourceId + "': " + e.getMessage(), e);
    }

    private MongoDatabase requireDatabase() throws SourceAdapterException {
        MongoDatabase db = database;
        if (db == null) {
            throw SourceAdapterException.fatal(Reason.UNKNOWN, "Source '" + sourceId + "' is not connected");
        }
        return db;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> castMap(Map<?, ?> m) {
        return (Map<String, Object>) m;
    }
}

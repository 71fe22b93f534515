/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.adapter.jdbc;

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
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Array;
import java.sql.Clob;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientException;
import java.sql.Types;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Relational source backed by a HikariCP pool.
 *
 * Payload: {@code sql} (required, parameter placeholders as {@code ?}), {@code params}
 * (positional values) and {@code limit} (applied as max rows).
 */
public final class JdbcSourceAdapter implements SourceAdapter {

    private static final Logger log = LoggerFactory.getLogger(JdbcSourceAdapter.class);

    // Config keys (relative to sources.<id>.)
    public static final String KEY_USERNAME = "jdbc.username";
    public static final String KEY_PASSWORD = "jdbc.password";
    public static final String KEY_POOL_SIZE = "jdbc.pool.size";
    public static final String KEY_SCHEMA = "jdbc.schema";

    // Defaults
    private static final int DEFAULT_POOL_SIZE = 4;
    private static final String[] TABLE_TYPES = {"TABLE", "VIEW"};

    private final String sourceId;
    private final HikariConfig hikari;
    private final String schema;
    private final MetricsRuntime metrics;

    private volatile HikariDataSource dataSource;

    private JdbcSourceAdapter(String sourceId, HikariConfig hikari, String schema, MetricsRuntime metrics) {
        this.sourceId = sourceId;
        this.hikari = hikari;
        this.schema = schema;
        this.metrics = metrics;
    }

    public static JdbcSourceAdapter fromConfig(String sourceId, String jdbcUrl, KernelConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(sourceId, "sourceId");
        Objects.requireNonNull(config, "config");
        if (jdbcUrl == null || jdbcUrl.isBlank()) {
            throw new IllegalArgumentException("Source '" + sourceId + "' has no JDBC connection URL");
        }

        HikariConfig hikari = new HikariConfig();
        hikari.setPoolName("qk-jdbc-" + sourceId);
        hikari.setJdbcUrl(jdbcUrl);
        hikari.setUsername(config.getString(KEY_USERNAME, null));
        hikari.setPassword(config.getString(KEY_PASSWORD, null));

        hikari.setMaximumPoolSize(Math.max(1, config.getInt(KEY_POOL_SIZE, DEFAULT_POOL_SIZE)));
        hikari.setMinimumIdle(1);
        hikari.setConnectionTimeout(5000);
        hikari.setReadOnly(true);

        // Driver-side prepared statement cache
        hikari.addDataSourceProperty("cachePrepStmts", "true");
        hikari.addDataSourceProperty("prepStmtCacheSize", "250");
        hikari.addDataSourceProperty("prepStmtCacheSqlLimit", "2048");

        String schema = config.getString(KEY_SCHEMA, null);
        return new JdbcSourceAdapter(sourceId, hikari, schema, metrics);
    }

    @Override
    public synchronized void connect() throws SourceAdapterException {
        if (dataSource != null) return;
        try {
            dataSource = new HikariDataSource(hikari);
            log.info("JDBC source '{}' connected (pool={})", sourceId, hikari.getMaximumPoolSize());
        } catch (RuntimeException e) {
            throw new SourceAdapterException(Reason.TRANSIENT, true,
                    "Cannot open pool for source '" + sourceId + "': " + e.getMessage(), e);
        }
    }

    @Override
    public List<TableSchema> introspect() throws SourceAdapterException {
        try (Connection c = requireDataSource().getConnection()) {
            DatabaseMetaData md = c.getMetaData();
            List<String> names = new ArrayList<>();
            try (ResultSet rs = md.getTables(c.getCatalog(), schema, "%", TABLE_TYPES)) {
                while (rs.next()) names.add(rs.getString("TABLE_NAME"));
            }

            List<TableSchema> out = new ArrayList<>(names.size());
            for (String table : names) {
                Set<String> keys = new HashSet<>();
                try (ResultSet rs = md.getPrimaryKeys(c.getCatalog(), schema, table)) {
                    while (rs.next()) keys.add(rs.getString("COLUMN_NAME"));
                }
                List<FieldSpec> fields = new ArrayList<>();
                try (ResultSet rs = md.getColumns(c.getCatalog(), schema, table, "%")) {
                    while (rs.next()) {
                        String col = rs.getString("COLUMN_NAME");
                        SemanticType type = mapType(rs.getInt("DATA_TYPE"));
                        boolean key = keys.contains(col);
                        boolean nullable = !key && rs.getInt("NULLABLE") != DatabaseMetaData.columnNoNulls;
                        FieldRole role = key ? FieldRole.KEY
                                : (type == SemanticType.TIMESTAMP ? FieldRole.TIMESTAMP : FieldRole.VALUE);
                        fields.add(new FieldSpec(col, type, nullable, role));
                    }
                }
                out.add(new TableSchema(table, fields));
            }
            log.debug("Introspected {} table(s) on source '{}'", out.size(), sourceId);
            return out;
        } catch (SQLException e) {
            throw classify(e, "introspection");
        }
    }

    @Override
    public List<Map<String, Object>> execute(QueryPayload payload, Duration timeout) throws SourceAdapterException {
        String sql = payload.getString("sql", null);
        if (sql == null || sql.isBlank()) {
            throw SourceAdapterException.fatal(Reason.MALFORMED_QUERY, "Payload has no 'sql'");
        }
        List<Object> params = payload.getList("params");
        long limit = payload.getLong("limit", -1L);

        long start = System.nanoTime();
        try (Connection c = requireDataSource().getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {

            if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
                ps.setQueryTimeout((int) Math.max(1, (timeout.toMillis() + 999) / 1000));
            }
            if (limit >= 0) ps.setMaxRows((int) Math.min(Integer.MAX_VALUE, limit));
            for (int i = 0; i < params.size(); i++) {
                ps.setObject(i + 1, params.get(i));
            }

            List<Map<String, Object>> rows = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                ResultSetMetaData md = rs.getMetaData();
                int n = md.getColumnCount();
                while (rs.next()) {
                    if (Thread.currentThread().isInterrupted()) {
                        throw SourceAdapterException.fatal(Reason.CANCELLED, "Query on '" + sourceId + "' interrupted");
                    }
                    Map<String, Object> row = new LinkedHashMap<>(n * 2);
                    for (int i = 1; i <= n; i++) {
                        row.put(md.getColumnLabel(i), normalize(rs.getObject(i)));
                    }
                    rows.add(row);
                }
            }
            metrics.timer("qk.adapter.jdbc.latency", (System.nanoTime() - start) / 1_000_000L);
            return rows;
        } catch (SQLException e) {
            metrics.counter("qk.adapter.jdbc.errors");
            throw classify(e, "query");
        }
    }

    @Override
    public synchronized void close() {
        HikariDataSource ds = dataSource;
        dataSource = null;
        if (ds != null) {
            try {
                ds.close();
            } catch (RuntimeException e) {
                log.warn("Error closing pool for source '{}'", sourceId, e);
            }
        }
    }

    private HikariDataSource requireDataSource() throws SourceAdapterException {
        HikariDataSource ds = dataSource;
        if (ds == null) {
            throw SourceAdapterException.fatal(Reason.UNKNOWN, "Source '" + sourceId + "' is not connected");
        }
        return ds;
    }

    private SourceAdapterException classify(SQLException e, String what) {
        Reason reason = reasonFor(e);
        return new SourceAdapterException(reason, reason.retryableByDefault(),
                "JDBC " + what + " failed on '" + sourceId + "' [" + e.getSQLState() + "]: " + e.getMessage(), e);
    }

    /**
     * SQLState classes: 08 connection and 40 rollback/serialization are transient, 28 is
     * authorization, 42 and 22 are statement errors.
     */
    static Reason reasonFor(SQLException e) {
        if (e instanceof SQLTimeoutException) return Reason.TIMEOUT;
        if (e instanceof SQLTransientException) return Reason.TRANSIENT;
        String state = e.getSQLState();
        if (state == null || state.length() < 2) return Reason.UNKNOWN;
        if ("57014".equals(state)) return Reason.TIMEOUT;
        if ("42501".equals(state)) return Reason.PERMISSION_DENIED;
        if ("42P01".equals(state)) return Reason.NOT_FOUND;
        switch (state.substring(0, 2)) {
            case "08":
            case "40":
            case "53":
            case "57":
                return Reason.TRANSIENT;
            case "28":
                return Reason.PERMISSION_DENIED;
            case "42":
            case "22":
                return Reason.MALFORMED_QUERY;
            default:
                return Reason.UNKNOWN;
        }
    }

    static SemanticType mapType(int sqlType) {
        switch (sqlType) {
            case Types.BIGINT:
            case Types.INTEGER:
            case Types.SMALLINT:
            case Types.TINYINT:
                return SemanticType.INTEGER;
            case Types.DECIMAL:
            case Types.NUMERIC:
            case Types.DOUBLE:
            case Types.FLOAT:
            case Types.REAL:
                return SemanticType.FLOAT;
            case Types.BOOLEAN:
            case Types.BIT:
                return SemanticType.BOOLEAN;
            case Types.DATE:
            case Types.TIMESTAMP:
            case Types.TIMESTAMP_WITH_TIMEZONE:
                return SemanticType.TIMESTAMP;
            case Types.ARRAY:
                return SemanticType.VECTOR;
            default:
                return SemanticType.TEXT;
        }
    }

    private static Object normalize(Object v) throws SQLException {
        if (v instanceof Clob clob) {
            long len = clob.length();
            return clob.getSubString(1, (int) Math.min(Integer.MAX_VALUE, len));
        }
        if (v instanceof Array arr) {
            Object inner = arr.getArray();
            if (inner instanceof Object[] items) return Arrays.asList(items);
            return inner;
        }
        return v;
    }
}

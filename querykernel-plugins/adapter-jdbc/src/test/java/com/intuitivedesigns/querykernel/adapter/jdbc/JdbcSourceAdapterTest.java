/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.adapter.jdbc;

import com.intuitivedesigns.querykernel.adapter.SourceAdapterException;
import com.intuitivedesigns.querykernel.adapter.SourceAdapterException.Reason;
import com.intuitivedesigns.querykernel.config.KernelConfig;
import com.intuitivedesigns.querykernel.model.QueryPayload;
import com.intuitivedesigns.querykernel.model.SemanticType;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;
import java.sql.Types;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JdbcSourceAdapterTest {

    private static final String URL = "jdbc:postgresql://localhost:5432/crm";

    @Test
    void testSqlStateClassification() {
        assertEquals(Reason.TIMEOUT, JdbcSourceAdapter.reasonFor(new SQLTimeoutException("slow")));
        assertEquals(Reason.TRANSIENT, JdbcSourceAdapter.reasonFor(new SQLTransientConnectionException("reset")));
        assertEquals(Reason.TIMEOUT, JdbcSourceAdapter.reasonFor(new SQLException("cancel", "57014")));
        assertEquals(Reason.TRANSIENT, JdbcSourceAdapter.reasonFor(new SQLException("refused", "08001")));
        assertEquals(Reason.TRANSIENT, JdbcSourceAdapter.reasonFor(new SQLException("deadlock", "40P01")));
        assertEquals(Reason.PERMISSION_DENIED, JdbcSourceAdapter.reasonFor(new SQLException("auth", "28P01")));
        assertEquals(Reason.PERMISSION_DENIED, JdbcSourceAdapter.reasonFor(new SQLException("denied", "42501")));
        assertEquals(Reason.NOT_FOUND, JdbcSourceAdapter.reasonFor(new SQLException("no table", "42P01")));
        assertEquals(Reason.MALFORMED_QUERY, JdbcSourceAdapter.reasonFor(new SQLException("syntax", "42601")));
        assertEquals(Reason.MALFORMED_QUERY, JdbcSourceAdapter.reasonFor(new SQLException("cast", "22P02")));
        assertEquals(Reason.UNKNOWN, JdbcSourceAdapter.reasonFor(new SQLException("?")));
    }

    @Test
    void testColumnTypeMapping() {
        assertEquals(SemanticType.INTEGER, JdbcSourceAdapter.mapType(Types.BIGINT));
        assertEquals(SemanticType.FLOAT, JdbcSourceAdapter.mapType(Types.NUMERIC));
        assertEquals(SemanticType.BOOLEAN, JdbcSourceAdapter.mapType(Types.BIT));
        assertEquals(SemanticType.TIMESTAMP, JdbcSourceAdapter.mapType(Types.TIMESTAMP_WITH_TIMEZONE));
        assertEquals(SemanticType.VECTOR, JdbcSourceAdapter.mapType(Types.ARRAY));
        assertEquals(SemanticType.TEXT, JdbcSourceAdapter.mapType(Types.VARCHAR));
    }

    @Test
    void testBlankUrlIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> JdbcSourceAdapter.fromConfig("crm", " ", KernelConfig.empty(), () -> null));
    }

    @Test
    void testPayloadWithoutSqlIsMalformed() {
        JdbcSourceAdapter adapter = JdbcSourceAdapter.fromConfig("crm", URL, KernelConfig.empty(), () -> null);

        SourceAdapterException e = assertThrows(SourceAdapterException.class,
                () -> adapter.execute(QueryPayload.of(Map.of("limit", 5)), Duration.ofSeconds(1)));
        assertEquals(Reason.MALFORMED_QUERY, e.reason());
    }

    @Test
    void testQueryBeforeConnectFails() {
        JdbcSourceAdapter adapter = JdbcSourceAdapter.fromConfig("crm", URL, KernelConfig.empty(), () -> null);

        SourceAdapterException e = assertThrows(SourceAdapterException.class,
                () -> adapter.execute(QueryPayload.of(Map.of("sql", "SELECT 1")), Duration.ofSeconds(1)));
        assertFalse(e.retryable());
        adapter.close();
    }
}

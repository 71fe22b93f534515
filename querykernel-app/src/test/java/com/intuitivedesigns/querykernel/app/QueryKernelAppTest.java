/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.app;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intuitivedesigns.querykernel.config.KernelConfig;
import com.intuitivedesigns.querykernel.executor.CancellationToken;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(60)
class QueryKernelAppTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static Properties demo;

    @BeforeAll
    static void loadDemoConfig() throws Exception {
        demo = new Properties();
        try (InputStream is = QueryKernelAppTest.class.getClassLoader().getResourceAsStream("querykernel.properties")) {
            assertNotNull(is, "bundled demo configuration");
            demo.load(is);
        }
    }

    private static final class Run {
        final int code;
        final String out;

        Run(int code, String out) {
            this.code = code;
            this.out = out;
        }
    }

    private static Run run(KernelConfig config, String stdin, String... args) throws Exception {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        AtomicReference<CancellationToken> current = new AtomicReference<>();
        int code;
        try (PrintStream out = new PrintStream(buf, true, StandardCharsets.UTF_8)) {
            code = QueryKernelApp.run(new ArrayList<>(Arrays.asList(args)), config,
                    new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)), out, current);
        }
        assertNull(current.get());
        return new Run(code, buf.toString(StandardCharsets.UTF_8));
    }

    private static Run run(String... args) throws Exception {
        return run(KernelConfig.of(demo), "", args);
    }

    @Test
    void testAskJoinsCustomersWithOrders() throws Exception {
        Run r = run("ask", "customers", "and", "their", "orders");

        assertEquals(QueryKernelApp.EXIT_OK, r.code);
        JsonNode json = MAPPER.readTree(r.out);
        assertFalse(json.path("partial").asBoolean());
        assertEquals(4, json.path("rows").size());
        for (JsonNode row : json.path("rows")) {
            assertTrue(row.has("name"));
            assertTrue(row.has("amount"));
        }
    }

    @Test
    void testSourcesListsIntrospectedTables() throws Exception {
        Run r = run("sources");

        assertEquals(QueryKernelApp.EXIT_OK, r.code);
        JsonNode json = MAPPER.readTree(r.out);
        assertEquals(3, json.size());
        assertEquals("crm", json.get(0).path("id").asText());
        assertEquals("customers", json.get(0).path("tables").get(0).path("name").asText());
        assertEquals(1, json.get(0).path("tables").get(0).path("version").asInt());
    }

    @Test
    void testSourcesCanBeFilteredByTableOrEntity() throws Exception {
        JsonNode byEntity = MAPPER.readTree(run("sources", "purchase").out);
        assertEquals(1, byEntity.size());
        assertEquals("shop", byEntity.get(0).path("id").asText());
        assertEquals("orders", byEntity.get(0).path("tables").get(0).path("name").asText());

        JsonNode byName = MAPPER.readTree(run("sources", "tick").out);
        assertEquals(1, byName.size());
        assertEquals("support", byName.get(0).path("id").asText());

        Run none = run("sources", "invoices");
        assertEquals(QueryKernelApp.EXIT_OK, none.code);
        assertEquals(0, MAPPER.readTree(none.out).size());
    }

    @Test
    void testPlanCanBeSavedAndRunLater(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("plan.json");

        Run planned = run("plan", "list", "support", "tickets", "--out", file.toString());
        assertEquals(QueryKernelApp.EXIT_OK, planned.code);
        assertTrue(Files.exists(file));
        assertTrue(Files.readString(file).contains("\"formatVersion\""));

        Run executed = run("run", file.toString());
        assertEquals(QueryKernelApp.EXIT_OK, executed.code);
        JsonNode json = MAPPER.readTree(executed.out);
        assertEquals(2, json.path("rows").size());
        assertEquals(0, json.path("warnings").size());
    }

    @Test
    void testPlanPrintsJsonWithoutOutFile() throws Exception {
        Run r = run("plan", "list", "customers");

        assertEquals(QueryKernelApp.EXIT_OK, r.code);
        JsonNode json = MAPPER.readTree(r.out);
        assertEquals(1, json.path("formatVersion").asInt());
    }

    @Test
    void testInteractiveModeReadsOneQuestionPerLine() throws Exception {
        Run r = run(KernelConfig.of(demo), "# comment\n\nlist tickets\nquit\nlist customers\n");

        assertEquals(QueryKernelApp.EXIT_OK, r.code);
        assertTrue(r.out.contains("T-1"));
        assertFalse(r.out.contains("Acme Corp"));
    }

    @Test
    void testUsageErrors() throws Exception {
        Run unknown = run("explain", "x");
        assertEquals(QueryKernelApp.EXIT_USAGE, unknown.code);
        assertTrue(unknown.out.startsWith("usage:"));

        assertEquals(QueryKernelApp.EXIT_USAGE, run("ask").code);
        assertEquals(QueryKernelApp.EXIT_USAGE, run("run").code);
    }

    @Test
    void testQueryFailureIsReportedAsError() throws Exception {
        Properties none = new Properties();
        none.putAll(demo);
        for (String id : List.of("crm", "shop", "support")) {
            none.setProperty("sources." + id + ".enabled", "false");
        }

        Run r = run(KernelConfig.of(none), "", "ask", "customers");

        assertEquals(QueryKernelApp.EXIT_QUERY_FAILED, r.code);
        assertEquals("NO_CANDIDATE_SOURCES", MAPPER.readTree(r.out).path("error").path("kind").asText());
    }
}

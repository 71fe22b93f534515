/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.generation.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.intuitivedesigns.querykernel.config.KernelConfig;
import com.intuitivedesigns.querykernel.generation.AggregateSpec;
import com.intuitivedesigns.querykernel.generation.GeneratedQuery;
import com.intuitivedesigns.querykernel.generation.GenerationException;
import com.intuitivedesigns.querykernel.generation.GenerationRequest;
import com.intuitivedesigns.querykernel.generation.QueryGenerator;
import com.intuitivedesigns.querykernel.metrics.MetricsRuntime;
import com.intuitivedesigns.querykernel.model.AggregateFunction;
import com.intuitivedesigns.querykernel.model.AggregateTerm;
import com.intuitivedesigns.querykernel.model.QueryPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Drafts source payloads through an OpenAI-compatible chat completions endpoint.
 *
 * In mock mode (the default) no HTTP call is made: payloads are drafted deterministically
 * from the schema context and summaries come from keyword heuristics.
 */
public final class LlmQueryGenerator implements QueryGenerator {

    private static final Logger log = LoggerFactory.getLogger(LlmQueryGenerator.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String CT = "Content-Type";
    private static final String APP_JSON = "application/json";
    private static final String AUTH = "Authorization";
    private static final String BEARER = "Bearer ";

    // Config keys
    public static final String KEY_MOCK = "generator.llm.mock";
    public static final String KEY_URL = "generator.llm.url";
    public static final String KEY_API_KEY = "generator.llm.key";
    public static final String KEY_MODEL = "generator.llm.model";
    public static final String KEY_TIMEOUT_MS = "generator.llm.timeout.ms";
    public static final String KEY_CONNECT_TIMEOUT_MS = "generator.llm.connect.timeout.ms";
    public static final String KEY_HTTP_VERSION = "generator.llm.http.version";
    public static final String KEY_TEMPERATURE = "generator.llm.temperature";
    public static final String KEY_DEFAULT_LIMIT = "generator.llm.default.limit";

    // Defaults
    private static final String DEFAULT_URL = "http://localhost:11434/v1/chat/completions";
    private static final String DEFAULT_MODEL = "llama3";
    private static final int DEFAULT_CONNECT_TIMEOUT_MS = 2_000;
    private static final int DEFAULT_REQUEST_TIMEOUT_MS = 20_000;
    private static final long DEFAULT_LIMIT = 1_000;

    private static final String DRAFT_INSTRUCTIONS =
            "You translate questions into a single query for one data source. "
                    + "Reply with one JSON object and nothing else: "
                    + "{\"table\": \"<table>\", \"fields\": [\"<field>\", ...], \"payload\": <payload>}. "
                    + "Only use tables and fields listed in the schema.";

    private static final String SUMMARY_INSTRUCTIONS =
            "Decide whether the question asks for an aggregate over the listed fields. "
                    + "Reply with one JSON object and nothing else: either {\"none\": true} or "
                    + "{\"groupBy\": [\"<field>\", ...], \"terms\": [{\"function\": \"COUNT|SUM|AVG|MIN|MAX\", "
                    + "\"field\": \"<field or null for COUNT>\", \"alias\": \"<name>\"}]}.";

    private final boolean useMock;
    private final MetricsRuntime metrics;
    private final long defaultLimit;

    private final HttpClient httpClient;
    private final URI apiUri;
    private final String apiKey;
    private final String model;
    private final double temperature;
    private final Duration requestTimeout;

    public LlmQueryGenerator(KernelConfig config, MetricsRuntime metrics) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        final KernelConfig cfg = (config == null) ? KernelConfig.empty() : config;
        this.useMock = cfg.getBoolean(KEY_MOCK, true);
        this.defaultLimit = cfg.getLong(KEY_DEFAULT_LIMIT, DEFAULT_LIMIT);

        if (!useMock) {
            this.apiUri = URI.create(cfg.getString(KEY_URL, DEFAULT_URL));
            this.apiKey = normalize(cfg.getString(KEY_API_KEY, null));
            this.model = normalizeOrDefault(cfg.getString(KEY_MODEL, DEFAULT_MODEL), DEFAULT_MODEL);
            this.temperature = cfg.getDouble(KEY_TEMPERATURE, 0.0);

            final long timeoutMs = Math.max(100L, cfg.getLong(KEY_TIMEOUT_MS, DEFAULT_REQUEST_TIMEOUT_MS));
            final long connectTimeoutMs = Math.max(100L, cfg.getLong(KEY_CONNECT_TIMEOUT_MS, DEFAULT_CONNECT_TIMEOUT_MS));
            this.requestTimeout = Duration.ofMillis(timeoutMs);
            this.httpClient = HttpClient.newBuilder()
                    .connectTimeout(Duration.ofMillis(connectTimeoutMs))
                    .version(parseVersion(cfg.getString(KEY_HTTP_VERSION, "HTTP_2")))
                    .build();

            log.info("LLM Generator: REAL MODE (Target: {}, model={})", apiUri, model);
        } else {
            this.apiUri = null;
            this.apiKey = null;
            this.model = null;
            this.temperature = 0.0;
            this.requestTimeout = null;
            this.httpClient = null;

            log.info("LLM Generator: MOCK MODE");
        }
    }

    public boolean isMock() {
        return useMock;
    }

    @Override
    public GeneratedQuery generate(GenerationRequest request) throws GenerationException {
        Objects.requireNonNull(request, "request");
        final String sourceId = request.source().id();
        final long startNs = System.nanoTime();
        try {
            if (useMock) {
                GeneratedQuery q = PayloadTemplates.draft(request.question(), request.context(),
                        request.source().adapterType(), defaultLimit);
                if (q == null) {
                    throw new GenerationException(sourceId, "No tables known for source '" + sourceId + "'");
                }
                return q;
            }
            String content = complete(sourceId, DRAFT_INSTRUCTIONS, draftPrompt(request));
            return parseDraft(sourceId, content);
        } catch (GenerationException e) {
            metrics.counter("qk.generator.errors");
            throw e;
        } finally {
            metrics.timer("qk.generator.latency", (System.nanoTime() - startNs) / 1_000_000L);
        }
    }

    @Override
    public Optional<AggregateSpec> summarize(String question, List<String> availableFields) {
        if (useMock) return SummaryHeuristics.detect(question, availableFields);

        String prompt = "Question: " + question + "\nFields: " + String.join(", ", availableFields);
        try {
            return parseSummary(complete("summary", SUMMARY_INSTRUCTIONS, prompt), availableFields);
        } catch (GenerationException e) {
            log.warn("Summary generation failed, continuing without a summary step: {}", e.getMessage());
            metrics.counter("qk.generator.errors");
            return Optional.empty();
        }
    }

    static String draftPrompt(GenerationRequest request) {
        StringBuilder sb = new StringBuilder(512);
        sb.append("Schema:\n").append(request.context().render());
        sb.append("Payload format for this source: ")
                .append(PayloadTemplates.describe(request.source().adapterType())).append('\n');
        sb.append("Question: ").append(request.question()).append('\n');
        if (request.isRetry()) {
            sb.append("Your previous answer was rejected:\n");
            for (String f : request.feedback()) sb.append("- ").append(f).append('\n');
            sb.append("Fix these problems.\n");
        }
        return sb.toString();
    }

    String requestBody(String system, String user) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("model", model);
        root.put("temperature", temperature);
        ArrayNode messages = root.putArray("messages");
        messages.addObject().put("role", "system").put("content", system);
        messages.addObject().put("role", "user").put("content", user);
        return root.toString();
    }

    private String complete(String sourceId, String system, String user) throws GenerationException {
        HttpRequest.Builder b = HttpRequest.newBuilder()
                .uri(apiUri)
                .timeout(requestTimeout)
                .header(CT, APP_JSON)
                .POST(HttpRequest.BodyPublishers.ofString(requestBody(system, user), StandardCharsets.UTF_8));
        if (apiKey != null) {
            b.header(AUTH, BEARER + apiKey);
        }

        final HttpResponse<String> response;
        try {
            response = httpClient.send(b.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new GenerationException(sourceId, "LLM call failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerationException(sourceId, "LLM call interrupted", e);
        }
        if (response.statusCode() != 200) {
            throw new GenerationException(sourceId, "LLM API HTTP " + response.statusCode());
        }
        return extractContent(sourceId, response.body());
    }

    static String extractContent(String sourceId, String body) throws GenerationException {
        try {
            JsonNode content = MAPPER.readTree(body).path("choices").path(0).path("message").path("content");
            if (!content.isTextual()) {
                throw new GenerationException(sourceId, "LLM response has no message content");
            }
            return content.asText();
        } catch (JsonProcessingException e) {
            throw new GenerationException(sourceId, "LLM response is not JSON", e);
        }
    }

    static GeneratedQuery parseDraft(String sourceId, String content) throws GenerationException {
        JsonNode node = readObject(sourceId, content);
        String table = node.path("table").asText("");
        if (table.isBlank()) {
            throw new GenerationException(sourceId, "Draft names no table");
        }
        JsonNode payload = node.path("payload");
        if (!payload.isObject()) {
            throw new GenerationException(sourceId, "Draft has no payload object");
        }
        List<String> fields = new ArrayList<>();
        for (JsonNode f : node.path("fields")) fields.add(f.asText());

        Map<String, Object> values = MAPPER.convertValue(payload,
                MAPPER.getTypeFactory().constructMapType(LinkedHashMap.class, String.class, Object.class));
        try {
            return new GeneratedQuery(table, fields, QueryPayload.of(values));
        } catch (IllegalArgumentException e) {
            throw new GenerationException(sourceId, "Draft payload rejected: " + e.getMessage(), e);
        }
    }

    static Optional<AggregateSpec> parseSummary(String content, List<String> availableFields) throws GenerationException {
        JsonNode node = readObject("summary", content);
        if (node.path("none").asBoolean(false) || !node.has("terms")) return Optional.empty();

        List<String> groupBy = new ArrayList<>();
        for (JsonNode g : node.path("groupBy")) {
            if (availableFields.contains(g.asText())) groupBy.add(g.asText());
        }
        List<AggregateTerm> terms = new ArrayList<>();
        for (JsonNode t : node.path("terms")) {
            try {
                AggregateFunction fn = AggregateFunction.valueOf(t.path("function").asText("").toUpperCase(Locale.ROOT));
                String field = t.hasNonNull("field") ? t.get("field").asText() : null;
                if (field != null && !availableFields.contains(field)) continue;
                terms.add(new AggregateTerm(fn, field, t.hasNonNull("alias") ? t.get("alias").asText() : null));
            } catch (IllegalArgumentException e) {
                log.debug("Ignoring summary term {}: {}", t, e.getMessage());
            }
        }
        return terms.isEmpty() ? Optional.empty() : Optional.of(new AggregateSpec(groupBy, terms));
    }

    /**
     * Models often wrap JSON in markdown fences; strips them before parsing.
     */
    private static JsonNode readObject(String sourceId, String content) throws GenerationException {
        String text = (content == null) ? "" : content.trim();
        if (text.startsWith("```")) {
            int nl = text.indexOf('\n');
            int end = text.lastIndexOf("```");
            text = (nl >= 0 && end > nl) ? text.substring(nl + 1, end).trim() : text.replace("```", "");
        }
        try {
            JsonNode node = MAPPER.readTree(text);
            if (node == null || !node.isObject()) {
                throw new GenerationException(sourceId, "LLM reply is not a JSON object");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new GenerationException(sourceId, "LLM reply is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static HttpClient.Version parseVersion(String raw) {
        try {
            return HttpClient.Version.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.warn("Unknown HTTP version '{}', using HTTP_2", raw);
            return HttpClient.Version.HTTP_2;
        }
    }

    private static String normalize(String s) {
        if (s == null) return null;
        final String t = s.trim();
        return t.isEmpty() ? null : t;
    }

    private static String normalizeOrDefault(String s, String def) {
        final String n = normalize(s);
        return (n != null) ? n : def;
    }
}

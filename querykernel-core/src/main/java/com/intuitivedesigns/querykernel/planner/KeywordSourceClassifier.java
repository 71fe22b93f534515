/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.planner;

import com.intuitivedesigns.querykernel.model.SourceDescriptor;
import com.intuitivedesigns.querykernel.model.SourceKind;
import com.intuitivedesigns.querykernel.registry.SchemaRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Scores sources by what the question mentions.
 *
 * <ul>
 *   <li>+3 per table of the source named in the question (singular or plural)</li>
 *   <li>+2 per ontology entity mapped onto one of its tables</li>
 *   <li>+1 per storage-family keyword ("similar", "document", "channel", ...)</li>
 * </ul>
 * Sources scoring zero are left out. When nothing scores, every enabled source is a candidate.
 */
public final class KeywordSourceClassifier implements SourceClassifier {

    private static final Logger log = LoggerFactory.getLogger(KeywordSourceClassifier.class);

    private static final Map<SourceKind, Set<String>> KIND_KEYWORDS = new EnumMap<>(SourceKind.class);

    static {
        KIND_KEYWORDS.put(SourceKind.RELATIONAL, Set.of("table", "row", "rows", "sql", "query", "join"));
        KIND_KEYWORDS.put(SourceKind.DOCUMENT, Set.of("document", "documents", "collection", "json", "nosql"));
        KIND_KEYWORDS.put(SourceKind.VECTOR, Set.of("similar", "vector", "embedding", "embeddings", "semantic"));
        KIND_KEYWORDS.put(SourceKind.MESSAGE_LOG, Set.of("message", "messages", "channel", "chat", "conversation", "event", "events", "topic", "log"));
    }

    private final SchemaRegistry registry;
    private final int maxCandidates;

    public KeywordSourceClassifier(SchemaRegistry registry, int maxCandidates) {
        this.registry = Objects.requireNonNull(registry, "registry");
        if (maxCandidates < 1) throw new IllegalArgumentException("maxCandidates must be >= 1");
        this.maxCandidates = maxCandidates;
    }

    @Override
    public List<SourceDescriptor> candidates(String question) {
        Set<String> tokens = tokenize(question);
        List<Scored> scored = new ArrayList<>();
        List<SourceDescriptor> enabled = new ArrayList<>();

        for (SourceDescriptor s : registry.listSources()) {
            if (!s.enabled()) continue;
            enabled.add(s);
            int score = score(s, tokens);
            if (score > 0) scored.add(new Scored(s, score));
        }

        List<SourceDescriptor> out = new ArrayList<>();
        if (scored.isEmpty()) {
            // listSources() is already priority ordered
            out.addAll(enabled);
        } else {
            scored.sort(Comparator.comparingInt(Scored::score).reversed()
                    .thenComparingInt(x -> x.source().priority())
                    .thenComparing(x -> x.source().id()));
            for (Scored x : scored) out.add(x.source());
        }
        if (out.size() > maxCandidates) out = new ArrayList<>(out.subList(0, maxCandidates));

        log.debug("Candidates for '{}': {}", question, ids(out));
        return out;
    }

    private int score(SourceDescriptor s, Set<String> tokens) {
        int score = 0;
        for (String table : registry.listTables(s.id())) {
            if (mentions(tokens, table)) score += 3;
            for (String entity : registry.entitiesFor(s.id(), table)) {
                if (mentions(tokens, entity)) score += 2;
            }
        }
        for (String kw : KIND_KEYWORDS.getOrDefault(s.kind(), Set.of())) {
            if (tokens.contains(kw)) score += 1;
        }
        return score;
    }

    static boolean mentions(Set<String> tokens, String name) {
        String n = name.toLowerCase(Locale.ROOT);
        if (tokens.contains(n) || tokens.contains(n + "s")) return true;
        return n.endsWith("s") && tokens.contains(n.substring(0, n.length() - 1));
    }

    static Set<String> tokenize(String question) {
        Set<String> out = new HashSet<>();
        if (question == null) return out;
        for (String t : question.toLowerCase(Locale.ROOT).split("[^a-z0-9_]+")) {
            if (!t.isEmpty()) out.add(t);
        }
        return out;
    }

    private static List<String> ids(List<SourceDescriptor> sources) {
        List<String> out = new ArrayList<>(sources.size());
        for (SourceDescriptor s : sources) out.add(s.id());
        return out;
    }

    private record Scored(SourceDescriptor source, int score) {}
}

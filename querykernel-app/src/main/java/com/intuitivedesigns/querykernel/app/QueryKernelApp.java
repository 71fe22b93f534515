/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.app;

import com.intuitivedesigns.querykernel.config.KernelConfig;
import com.intuitivedesigns.querykernel.core.QueryOrchestrator;
import com.intuitivedesigns.querykernel.core.QueryResponse;
import com.intuitivedesigns.querykernel.error.QueryKernelException;
import com.intuitivedesigns.querykernel.executor.CancellationToken;
import com.intuitivedesigns.querykernel.metrics.MetricsFactory;
import com.intuitivedesigns.querykernel.metrics.MetricsRuntime;
import com.intuitivedesigns.querykernel.metrics.MetricsSettings;
import com.intuitivedesigns.querykernel.plan.Plan;
import com.intuitivedesigns.querykernel.plan.PlanCodec;
import com.intuitivedesigns.querykernel.planner.PlanningResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Command line entry point.
 *
 * <pre>
 * querykernel [--config file] ask &lt;question&gt;
 * querykernel [--config file] plan &lt;question&gt; [--out plan.json]
 * querykernel [--config file] run &lt;plan.json&gt;
 * querykernel [--config file] sources [text]    (tables whose name or entity matches)
 * querykernel [--config file]                 (one question per stdin line)
 * </pre>
 */
public final class QueryKernelApp {

    private static final Logger log = LoggerFactory.getLogger(QueryKernelApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_QUERY_FAILED = 3;

    private static final String DEMO_CONFIG = "querykernel.properties";

    private QueryKernelApp() {}

    public static void main(String[] args) {
        log.info("=== Booting QueryKernel ===");

        final AtomicReference<CancellationToken> current = new AtomicReference<>();
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            CancellationToken t = current.get();
            if (t != null) {
                log.info("Shutdown signal received, cancelling the running query.");
                t.cancel();
            }
        }, "qk-shutdown"));

        int code;
        try {
            code = run(args, System.in, System.out, current);
        } catch (Throwable t) {
            log.error("Fatal application error", t);
            code = EXIT_FATAL;
        }
        System.exit(code);
    }

    static int run(String[] rawArgs, InputStream in, PrintStream out, AtomicReference<CancellationToken> current)
            throws IOException {
        List<String> args = new ArrayList<>(Arrays.asList(rawArgs));
        KernelConfig config = resolveConfig(args);
        return run(args, config, in, out, current);
    }

    static int run(List<String> args, KernelConfig config, InputStream in, PrintStream out,
                   AtomicReference<CancellationToken> current) throws IOException {
        final ResponseRenderer renderer = new ResponseRenderer();
        final String command = args.isEmpty() ? "" : args.get(0);

        MetricsRuntime metrics = null;
        try {
            metrics = MetricsFactory.init(MetricsSettings.from(config));
            try (QueryOrchestrator kernel = QueryOrchestrator.fromConfig(config, metrics)) {
                switch (command) {
                    case "ask":
                        return ask(kernel, joinFrom(args, 1), renderer, out, current);
                    case "plan":
                        return plan(kernel, args, renderer, out);
                    case "run":
                        return runPlan(kernel, args, renderer, out, current);
                    case "sources":
                        out.println(renderer.renderSources(kernel.registry(), joinFrom(args, 1)));
                        return EXIT_OK;
                    case "":
                        return interactive(kernel, in, renderer, out, current);
                    default:
                        usage(out);
                        return EXIT_USAGE;
                }
            }
        } finally {
            closeQuietly(metrics);
        }
    }

    private static int ask(QueryOrchestrator kernel, String question, ResponseRenderer renderer, PrintStream out,
                           AtomicReference<CancellationToken> current) {
        if (question.isBlank()) {
            usage(out);
            return EXIT_USAGE;
        }
        CancellationToken token = new CancellationToken();
        current.set(token);
        try {
            QueryResponse response = kernel.ask(question, token);
            out.println(renderer.render(response));
            return EXIT_OK;
        } catch (QueryKernelException e) {
            log.warn("Query failed: {}", e.getMessage());
            out.println(renderer.render(e.toError()));
            return EXIT_QUERY_FAILED;
        } finally {
            current.set(null);
        }
    }

    private static int plan(QueryOrchestrator kernel, List<String> args, ResponseRenderer renderer, PrintStream out)
            throws IOException {
        List<String> rest = new ArrayList<>(args.subList(1, args.size()));
        String target = takeOption(rest, "--out");
        String question = String.join(" ", rest).trim();
        if (question.isEmpty()) {
            usage(out);
            return EXIT_USAGE;
        }
        try {
            PlanningResult result = kernel.plan(question);
            PlanCodec codec = new PlanCodec();
            result.diagnostics().forEach(d -> log.info("Planner: {}", d));
            if (target != null) {
                codec.write(result.plan(), Path.of(target));
                log.info("Plan {} written to {}", result.plan().id(), target);
            } else {
                out.println(codec.toJson(result.plan()));
            }
            return EXIT_OK;
        } catch (QueryKernelException e) {
            out.println(renderer.render(e.toError()));
            return EXIT_QUERY_FAILED;
        }
    }

    private static int runPlan(QueryOrchestrator kernel, List<String> args, ResponseRenderer renderer, PrintStream out,
                               AtomicReference<CancellationToken> current) throws IOException {
        if (args.size() < 2) {
            usage(out);
            return EXIT_USAGE;
        }
        Plan plan = new PlanCodec().read(Path.of(args.get(1)));
        CancellationToken token = new CancellationToken();
        current.set(token);
        try {
            out.println(renderer.render(kernel.execute(plan, token)));
            return EXIT_OK;
        } catch (QueryKernelException e) {
            out.println(renderer.render(e.toError()));
            return EXIT_QUERY_FAILED;
        } finally {
            current.set(null);
        }
    }

    private static int interactive(QueryOrchestrator kernel, InputStream in, ResponseRenderer renderer, PrintStream out,
                                   AtomicReference<CancellationToken> current) throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        int last = EXIT_OK;
        String line;
        while ((line = reader.readLine()) != null) {
            String q = line.trim();
            if (q.isEmpty() || q.startsWith("#")) continue;
            if (q.equalsIgnoreCase("quit") || q.equalsIgnoreCase("exit")) break;
            last = ask(kernel, q, renderer, out, current);
        }
        return last;
    }

    /**
     * {@code --config} wins, then {@code -Dqk.config.path} / {@code QK_CONFIG_PATH}, then the
     * bundled demo configuration.
     */
    static KernelConfig resolveConfig(List<String> args) throws IOException {
        String path = takeOption(args, "--config");
        if (path != null) return KernelConfig.load(Path.of(path));

        KernelConfig config = KernelConfig.get();
        if (!config.keys().isEmpty()) return config;

        try (InputStream is = QueryKernelApp.class.getClassLoader().getResourceAsStream(DEMO_CONFIG)) {
            if (is == null) return config;
            Properties p = new Properties();
            p.load(is);
            log.info("Using bundled demo configuration ({} keys)", p.size());
            return KernelConfig.of(p);
        }
    }

    private static String takeOption(List<String> args, String name) {
        int i = args.indexOf(name);
        if (i < 0) return null;
        if (i + 1 >= args.size()) {
            throw new IllegalArgumentException("Missing value for " + name);
        }
        String v = args.get(i + 1);
        args.subList(i, i + 2).clear();
        return v;
    }

    private static String joinFrom(List<String> args, int from) {
        return (args.size() <= from) ? "" : String.join(" ", args.subList(from, args.size())).trim();
    }

    private static void usage(PrintStream out) {
        out.println("usage: querykernel [--config file] (ask <question> | plan <question> [--out file] | run <plan.json> | sources [text])");
    }

    private static void closeQuietly(AutoCloseable resource) {
        if (resource == null) return;
        try {
            resource.close();
        } catch (Exception e) {
            log.debug("Error closing {}", resource, e);
        }
    }
}

package io.coordhub.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.coordhub.config.CoordHubConfig;
import io.coordhub.dispatch.MethodDispatcher;
import io.coordhub.observability.AuditLogger;
import io.coordhub.runtime.CoordHubRuntime;
import io.coordhub.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.PrintStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "coordhub",
        mixinStandardHelpOptions = true,
        description = "CoordHub coordination service CLI",
        subcommands = {
                CoordHubCommand.ServeCommand.class,
                CoordHubCommand.StdioCommand.class,
                CoordHubCommand.MethodsCommand.class,
                CoordHubCommand.SettingsCommand.class,
                CoordHubCommand.AuditTailCommand.class,
                CoordHubCommand.AuditVerifyCommand.class
        }
)
public final class CoordHubCommand implements Runnable {
    @Option(names = {"--root"}, description = "Data root directory (audit log, settings)", defaultValue = "data")
    String root;

    @Option(names = {"--namespace"}, description = "Namespace (tenant scope)", defaultValue = "default")
    String namespace;

    @Override
    public void run() {
        System.out.println("Use subcommands: serve | stdio | methods | settings | audit-tail | audit-verify");
    }

    CoordHubConfig config() {
        return CoordHubConfig.fromRoot(root, namespace);
    }

    CoordHubRuntime runtime() {
        return new CoordHubRuntime(config());
    }

    @Command(name = "serve", description = "Serve the method surface over HTTP")
    static final class ServeCommand implements Callable<Integer> {
        @ParentCommand
        CoordHubCommand parent;

        @Option(names = {"--port"}, defaultValue = "8787", description = "Bind port")
        int port;

        @Override
        public Integer call() throws Exception {
            CoordHubRuntime runtime = parent.runtime();
            MethodDispatcher dispatcher = new MethodDispatcher(runtime);
            HttpServer server = HttpServer.create(new InetSocketAddress(port), 0);
            server.createContext("/rpc", exchange -> {
                if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                    writeJson(exchange, RpcEnvelopes.error(null, "VALIDATION", "POST required", 405).body(), 405);
                    return;
                }
                String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
                RpcEnvelopes.RpcReply reply = RpcEnvelopes.handle(dispatcher, body);
                writeJson(exchange, reply.body(), reply.status());
            });
            server.createContext("/api/stats", exchange -> {
                if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                    writeJson(exchange, Map.of("error", "method_not_allowed"), 405);
                    return;
                }
                writeJson(exchange, runtime.stats(), 200);
            });
            server.createContext("/api/state", exchange -> {
                if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                    writeJson(exchange, Map.of("error", "method_not_allowed"), 405);
                    return;
                }
                writeJson(exchange, runtime.state(), 200);
            });
            server.createContext("/api/methods", exchange -> {
                if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                    writeJson(exchange, Map.of("error", "method_not_allowed"), 405);
                    return;
                }
                writeJson(exchange, Map.of("methods", MethodDispatcher.catalogue()), 200);
            });
            server.createContext("/api/audit", exchange -> {
                if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                    writeJson(exchange, Map.of("error", "method_not_allowed"), 405);
                    return;
                }
                Map<String, String> q = parseQuery(exchange.getRequestURI());
                int limit = parseIntOrDefault(q.get("limit"), 50);
                writeJson(exchange, Map.of("rows", runtime.auditLogger().tail(limit)), 200);
            });
            server.createContext("/metrics", exchange -> {
                byte[] bytes = runtime.metricsText().getBytes(StandardCharsets.UTF_8);
                exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4; charset=utf-8");
                exchange.sendResponseHeaders(200, bytes.length);
                try (OutputStream os = exchange.getResponseBody()) {
                    os.write(bytes);
                }
            });
            server.setExecutor(null);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                server.stop(0);
                runtime.close();
            }, "coordhub-shutdown-hook"));
            runtime.start();
            server.start();
            System.out.println("CoordHub listening on http://127.0.0.1:" + port + "/rpc"
                    + ", namespace=" + runtime.config().namespace()
                    + ", sweepEnabled=" + runtime.sweeperRunning());
            Thread.currentThread().join();
            return 0;
        }
    }

    @Command(name = "stdio", description = "Serve the method surface as JSON lines over stdin/stdout")
    static final class StdioCommand implements Callable<Integer> {
        @ParentCommand
        CoordHubCommand parent;

        @Override
        public Integer call() throws IOException {
            try (CoordHubRuntime runtime = parent.runtime()) {
                runtime.start();
                MethodDispatcher dispatcher = new MethodDispatcher(runtime);
                BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
                serveLines(dispatcher, in, System.out);
            }
            return 0;
        }
    }

    @Command(name = "methods", description = "Print the method catalogue")
    static final class MethodsCommand implements Callable<Integer> {
        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(Map.of("methods", MethodDispatcher.catalogue())));
            return 0;
        }
    }

    @Command(name = "settings", description = "Print effective settings for the root and namespace")
    static final class SettingsCommand implements Callable<Integer> {
        @ParentCommand
        CoordHubCommand parent;

        @Override
        public Integer call() {
            CoordHubRuntime runtime = parent.runtime();
            CoordHubRuntime.SettingsReloadOutcome out = runtime.reloadSettings();
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "audit-tail", description = "Print the latest audit rows")
    static final class AuditTailCommand implements Callable<Integer> {
        @ParentCommand
        CoordHubCommand parent;

        @Option(names = {"--lines"}, defaultValue = "50", description = "Number of latest lines")
        int lines;

        @Override
        public Integer call() {
            AuditLogger auditLogger = auditLogger(parent.config());
            List<JsonNode> rows = auditLogger.tail(lines);
            for (JsonNode row : rows) {
                System.out.println(Jsons.toCompactJson(row));
            }
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        CoordHubCommand parent;

        @Override
        public Integer call() {
            AuditLogger.IntegrityOutcome out = auditLogger(parent.config()).verifyChain();
            System.out.println(Jsons.toJson(out));
            return out.ok() ? 0 : 1;
        }
    }

    static AuditLogger auditLogger(CoordHubConfig config) {
        return new AuditLogger(config.auditFile(), config.namespace(), null);
    }

    /**
     * One reply line per non-blank request line, flushed immediately. Returns the number of requests handled.
     */
    static int serveLines(MethodDispatcher dispatcher, BufferedReader in, PrintStream out) throws IOException {
        int handled = 0;
        String line;
        while ((line = in.readLine()) != null) {
            if (line.isBlank()) {
                continue;
            }
            RpcEnvelopes.RpcReply reply = RpcEnvelopes.handle(dispatcher, line);
            out.println(Jsons.toCompactJson(reply.body()));
            out.flush();
            handled++;
        }
        return handled;
    }

    private static void writeJson(HttpExchange exchange, Object body, int status) throws IOException {
        byte[] bytes = Jsons.toJson(body).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    static Map<String, String> parseQuery(URI uri) {
        Map<String, String> out = new LinkedHashMap<>();
        String raw = uri == null ? null : uri.getRawQuery();
        if (raw == null || raw.isBlank()) {
            return out;
        }
        for (String pair : raw.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String key = eq < 0 ? pair : pair.substring(0, eq);
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            out.put(URLDecoder.decode(key, StandardCharsets.UTF_8), URLDecoder.decode(value, StandardCharsets.UTF_8));
        }
        return out;
    }

    static int parseIntOrDefault(String raw, int fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}

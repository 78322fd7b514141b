package com.davisodom.settlementsim.admin;

import com.davisodom.settlementsim.disasters.DisasterCoordinator;
import com.davisodom.settlementsim.disasters.DisasterEvent;
import com.davisodom.settlementsim.economy.ResourceLedger;
import com.davisodom.settlementsim.errors.SimulationException;
import com.davisodom.settlementsim.events.EventDispatcher;
import com.davisodom.settlementsim.events.SimulationEvent;
import com.davisodom.settlementsim.obs.Metrics;
import com.davisodom.settlementsim.settlements.Settlement;
import com.davisodom.settlementsim.settlements.SettlementContext;
import com.davisodom.settlementsim.settlements.SettlementService;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.LongSupplier;
import java.util.logging.Logger;

/**
 * Operator HTTP endpoints for diagnostics.
 *
 * - GET /healthz
 * - GET /v1/settlements
 * - GET /v1/disasters
 * - GET /v1/metrics
 * - POST /v1/disasters/{id}/advance forces a disaster into its next phase
 */
public class AdminHttpServer {

    private final Logger logger;
    private final int port;
    private final SettlementService settlementService;
    private final ResourceLedger ledger;
    private final DisasterCoordinator disasterCoordinator;
    private final EventDispatcher dispatcher;
    private final Metrics metrics;
    private final LongSupplier clock;
    private final ObjectMapper om = new ObjectMapper();
    private HttpServer server;

    public AdminHttpServer(Logger logger, int port, SettlementService settlementService, ResourceLedger ledger,
                           DisasterCoordinator disasterCoordinator, EventDispatcher dispatcher, Metrics metrics,
                           LongSupplier clock) {
        this.logger = logger;
        this.port = port;
        this.settlementService = settlementService;
        this.ledger = ledger;
        this.disasterCoordinator = disasterCoordinator;
        this.dispatcher = dispatcher;
        this.metrics = metrics;
        this.clock = clock;
    }

    public void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(port), 0);
        server.createContext("/healthz", new HealthCheckHandler());
        server.createContext("/v1/settlements", new SettlementsHandler());
        server.createContext("/v1/disasters", new DisastersHandler());
        server.createContext("/v1/metrics", new MetricsHandler());
        server.setExecutor(null); // Default executor
        server.start();
        logger.info("Admin HTTP server started on port " + getPort());
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
            server = null;
            logger.info("Admin HTTP server stopped");
        }
    }

    /**
     * Bound port; differs from the configured one when that was 0.
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : port;
    }

    private class HealthCheckHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            ObjectNode body = om.createObjectNode();
            body.put("status", "OK");
            body.put("settlements", settlementService.size());
            send(exchange, 200, body);
        }
    }

    private class SettlementsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!allow(exchange, "GET")) {
                return;
            }
            ArrayNode arr = om.createArrayNode();
            for (SettlementContext context : settlementService.getAll()) {
                ObjectNode node = context.withLock(() -> settlementNode(context.getSettlement()));
                arr.add(node);
            }
            send(exchange, 200, om.createObjectNode().set("settlements", arr));
        }

        private ObjectNode settlementNode(Settlement settlement) {
            ObjectNode node = om.createObjectNode();
            node.put("id", settlement.getId().toString());
            node.put("ownerId", settlement.getOwnerId().toString());
            node.put("name", settlement.getName());
            node.put("world", settlement.getWorldName());
            node.put("tier", settlement.getTier());
            node.put("population", settlement.getPopulation().getCount());
            node.put("happiness", settlement.getPopulation().getHappiness());
            node.put("structures", settlement.getActiveStructures().size());
            node.put("queued", settlement.getQueue().size());
            node.put("resilience", settlement.getResilience());
            node.set("resources", om.valueToTree(ledger.getBalances(settlement.getId()).toUnitsMap()));
            return node;
        }
    }

    private class DisastersHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String path = exchange.getRequestURI().getPath();
            if (path.endsWith("/advance")) {
                handleAdvance(exchange, path);
                return;
            }
            if (!allow(exchange, "GET")) {
                return;
            }
            ArrayNode arr = om.createArrayNode();
            for (DisasterEvent event : disasterCoordinator.getAll()) {
                ObjectNode node = om.createObjectNode();
                node.put("id", event.getId().toString());
                node.put("world", event.getWorldName());
                node.put("type", event.getType().name());
                node.put("severity", event.getSeverity());
                node.put("tier", event.getTier().name());
                node.put("status", event.getStatus().name());
                node.put("scheduledAt", event.getScheduledAt());
                node.put("nextTransitionAt", event.getStatus().isTerminal() ? -1 : event.nextTransitionAt());
                node.put("structuresDamaged", event.getDamagedStructures().size());
                node.put("structuresDestroyed", event.getDestroyedStructures().size());
                node.put("casualties", event.getCasualties());
                arr.add(node);
            }
            send(exchange, 200, om.createObjectNode().set("disasters", arr));
        }

        private void handleAdvance(HttpExchange exchange, String path) throws IOException {
            if (!allow(exchange, "POST")) {
                return;
            }
            String[] parts = path.split("/");
            // /v1/disasters/{id}/advance
            if (parts.length != 5) {
                sendError(exchange, 404, "Not Found");
                return;
            }
            UUID eventId;
            try {
                eventId = UUID.fromString(parts[3]);
            } catch (IllegalArgumentException e) {
                sendError(exchange, 400, "Invalid disaster id: " + parts[3]);
                return;
            }
            try {
                List<SimulationEvent> events = disasterCoordinator.forceAdvance(eventId, clock.getAsLong());
                dispatcher.dispatch(events);
                DisasterEvent event = disasterCoordinator.getEvent(eventId).orElseThrow();
                ObjectNode body = om.createObjectNode();
                body.put("id", eventId.toString());
                body.put("status", event.getStatus().name());
                body.put("eventsEmitted", events.size());
                send(exchange, 200, body);
            } catch (SimulationException e) {
                int status;
                switch (e.getKind()) {
                    case NOT_FOUND: status = 404; break;
                    case PRECONDITION: case CONFLICT: status = 409; break;
                    default: status = 500; break;
                }
                sendError(exchange, status, e.getMessage());
            }
        }
    }

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!allow(exchange, "GET")) {
                return;
            }
            Metrics.Snapshot snapshot = metrics.getSnapshot();
            ObjectNode body = om.createObjectNode();
            body.set("counters", om.valueToTree(snapshot.counters()));
            ObjectNode ticks = om.createObjectNode();
            for (Map.Entry<String, Metrics.TickTimeStats> entry : snapshot.timings().entrySet()) {
                Metrics.TickTimeStats stats = entry.getValue();
                ObjectNode node = om.createObjectNode();
                node.put("count", stats.getCount());
                node.put("avgMicros", stats.getAverageMicros());
                node.put("p95Micros", stats.getP95Micros());
                node.put("p99Micros", stats.getP99Micros());
                node.put("maxMicros", stats.getMaxMicros());
                ticks.set(entry.getKey(), node);
            }
            body.set("tickTimes", ticks);
            send(exchange, 200, body);
        }
    }

    private boolean allow(HttpExchange exchange, String method) throws IOException {
        if (method.equalsIgnoreCase(exchange.getRequestMethod())) {
            return true;
        }
        exchange.getResponseHeaders().add("Allow", method);
        sendError(exchange, 405, "Method Not Allowed");
        return false;
    }

    private void sendError(HttpExchange exchange, int status, String message) throws IOException {
        ObjectNode body = om.createObjectNode();
        body.put("error", message);
        send(exchange, status, body);
    }

    private void send(HttpExchange exchange, int status, ObjectNode body) throws IOException {
        byte[] bytes = body.toString().getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}

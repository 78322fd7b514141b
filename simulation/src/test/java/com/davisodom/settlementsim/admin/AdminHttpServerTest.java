package com.davisodom.settlementsim.admin;

import com.davisodom.settlementsim.SimulationFixture;
import com.davisodom.settlementsim.disasters.DisasterCoordinator;
import com.davisodom.settlementsim.disasters.DisasterDamageCalculator;
import com.davisodom.settlementsim.disasters.DisasterEvent;
import com.davisodom.settlementsim.disasters.DisasterStatus;
import com.davisodom.settlementsim.disasters.DisasterType;
import com.davisodom.settlementsim.disasters.RepairCostCalculator;
import com.davisodom.settlementsim.events.EventDispatcher;
import com.davisodom.settlementsim.events.EventPublisher;
import com.davisodom.settlementsim.obs.Metrics;
import com.davisodom.settlementsim.population.HappinessCalculator;
import com.davisodom.settlementsim.population.PopulationEngine;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.util.Random;
import java.util.UUID;

import static com.davisodom.settlementsim.SimulationFixture.T0;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class AdminHttpServerTest {

    private final ObjectMapper om = new ObjectMapper();
    private SimulationFixture fx;
    private DisasterCoordinator disasters;
    private EventDispatcher dispatcher;
    private AdminHttpServer server;

    @BeforeEach
    void setUp() throws IOException {
        fx = SimulationFixture.create();
        Metrics metrics = new Metrics(fx.logger);
        PopulationEngine population = new PopulationEngine(fx.logger, fx.config.population, fx.stats,
                new HappinessCalculator(fx.config.population, fx.stats), fx.ledger, new Random(1));
        disasters = new DisasterCoordinator(fx.logger, fx.settlements, fx.catalog,
                new DisasterDamageCalculator(fx.catalog, fx.stats, fx.config.disasters), new RepairCostCalculator(),
                population, fx.config.disasters);
        dispatcher = new EventDispatcher(fx.logger, mock(EventPublisher.class), metrics);
        metrics.increment("tick.completed");

        server = new AdminHttpServer(fx.logger, 0, fx.settlements, fx.ledger, disasters, dispatcher, metrics, () -> T0);
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop();
        dispatcher.shutdown();
    }

    private HttpURLConnection open(String method, String path) throws IOException {
        HttpURLConnection connection = (HttpURLConnection) new URL("http://localhost:" + server.getPort() + path)
                .openConnection();
        connection.setRequestMethod(method);
        return connection;
    }

    private JsonNode body(HttpURLConnection connection) throws IOException {
        InputStream in = connection.getResponseCode() < 400 ? connection.getInputStream() : connection.getErrorStream();
        try (InputStream stream = in) {
            return om.readTree(stream);
        }
    }

    @Test
    void testHealthAndSettlements() throws IOException {
        fx.settlement(UUID.randomUUID(), 7, SimulationFixture.plenty());

        HttpURLConnection health = open("GET", "/healthz");
        assertEquals(200, health.getResponseCode());
        assertEquals(1, body(health).get("settlements").asInt());

        HttpURLConnection list = open("GET", "/v1/settlements");
        JsonNode settlement = body(list).get("settlements").get(0);
        assertEquals(7, settlement.get("population").asInt());
        assertEquals(500.0, settlement.get("resources").get("food").asDouble(), 1e-9);
    }

    @Test
    void testMetricsEndpoint() throws IOException {
        HttpURLConnection connection = open("GET", "/v1/metrics");

        assertEquals(200, connection.getResponseCode());
        assertEquals(1, body(connection).get("counters").get("tick.completed").asLong());
    }

    @Test
    void testAdvanceDisaster() throws IOException {
        DisasterEvent event = disasters.schedule(DisasterEvent.builder()
                .worldName("overworld").type(DisasterType.DROUGHT).severity(20)
                .scheduledAt(T0 + 3_600_000L).warningMillis(3_600_000L).impactMillis(600_000L).aftermathMillis(600_000L)
                .build());

        HttpURLConnection connection = open("POST", "/v1/disasters/" + event.getId() + "/advance");

        assertEquals(200, connection.getResponseCode());
        assertEquals(DisasterStatus.WARNING.name(), body(connection).get("status").asText());
        assertEquals(DisasterStatus.WARNING, disasters.getEvent(event.getId()).orElseThrow().getStatus());
    }

    @Test
    void testAdvanceErrors() throws IOException {
        assertEquals(404, open("POST", "/v1/disasters/" + UUID.randomUUID() + "/advance").getResponseCode());
        assertEquals(400, open("POST", "/v1/disasters/not-a-uuid/advance").getResponseCode());
        assertEquals(405, open("GET", "/v1/disasters/" + UUID.randomUUID() + "/advance").getResponseCode());
        assertEquals(405, open("POST", "/v1/settlements").getResponseCode());
    }
}

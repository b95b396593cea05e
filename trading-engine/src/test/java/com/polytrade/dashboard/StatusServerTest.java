package com.polytrade.dashboard;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polytrade.circuit.CircuitBreakerRegistry;
import com.polytrade.ledger.PositionLedger;
import com.polytrade.metrics.MetricsRecorder;
import com.polytrade.persistence.JsonMappers;
import com.polytrade.persistence.SnapshotStore;
import com.polytrade.risk.RiskGate;
import com.polytrade.risk.RiskLimits;
import com.polytrade.scanner.Side;
import com.polytrade.testing.MutableClock;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("StatusServer Tests")
class StatusServerTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = JsonMappers.create();
    private final HttpClient http = HttpClient.newHttpClient();

    private PositionLedger ledger;
    private CircuitBreakerRegistry breakers;
    private MetricsRecorder metrics;
    private StatusServer server;
    private int port;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(Instant.parse("2024-03-06T10:00:00Z"));
        RiskLimits limits = RiskLimits.defaults();
        ledger = new PositionLedger(10_000, limits, clock, ZoneOffset.UTC);
        RiskGate gate = new RiskGate(ledger, limits);
        breakers = new CircuitBreakerRegistry(5, Duration.ofSeconds(300), clock);
        PrometheusMeterRegistry prometheus = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        metrics = new MetricsRecorder(clock, 365, prometheus,
            new SnapshotStore(tempDir.resolve("s.jsonl"), mapper));

        server = new StatusServer(ledger, gate, breakers, metrics, prometheus, mapper);
        port = server.start(0);
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://localhost:" + port + path))
            .timeout(Duration.ofSeconds(5))
            .GET()
            .build();
        return http.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    @DisplayName("Health check answers OK")
    void testHealth() throws Exception {
        HttpResponse<String> response = get("/healthz");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).isEqualTo("OK");
    }

    @Test
    @DisplayName("Portfolio endpoint reports balances and open positions")
    void testPortfolio() throws Exception {
        ledger.open("m1", "Will it rain?", Side.BUY, 40, 0.3);

        HttpResponse<String> response = get("/api/portfolio");

        assertThat(response.statusCode()).isEqualTo(200);
        JsonNode body = mapper.readTree(response.body());
        assertThat(body.get("balance").asDouble()).isEqualTo(10_000.0);
        assertThat(body.get("openPositions")).hasSize(1);
        assertThat(body.get("openPositions").get(0).get("id").asText()).isEqualTo("P-1");
        assertThat(body.get("risk").get("drawdownHalted").asBoolean()).isFalse();
    }

    @Test
    @DisplayName("Circuits endpoint lists every known breaker")
    void testCircuits() throws Exception {
        breakers.breaker("executor");

        JsonNode body = mapper.readTree(get("/api/circuits").body());

        assertThat(body.get("executor").get("status").asText()).isEqualTo("CLOSED");
    }

    @Test
    @DisplayName("Summary is 404 until a snapshot exists")
    void testSummary() throws Exception {
        assertThat(get("/api/metrics/summary").statusCode()).isEqualTo(404);

        metrics.persist(metrics.snapshot(ledger.portfolioSummary(), false));

        HttpResponse<String> response = get("/api/metrics/summary");
        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(mapper.readTree(response.body()).get("totalSnapshots").asInt()).isEqualTo(1);
    }

    @Test
    @DisplayName("Prometheus scrape exposes recorder metrics")
    void testPrometheus() throws Exception {
        metrics.recordExecution(true);

        HttpResponse<String> response = get("/metrics");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).contains("polytrade_orders_executed");
    }
}

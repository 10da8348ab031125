package com.creativeforge.orchestrator.ai;

import com.creativeforge.orchestrator.model.FailureKind;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * AiGatewayClient against a local HTTP stub.
 */
class AiGatewayClientTest {

    HttpServer server;
    AiGatewayClient client;

    final AtomicReference<String> lastBody = new AtomicReference<>();
    volatile int    status = 200;
    volatile String reply  = "{}";

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", exchange -> {
            lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] bytes = reply.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();
        client = new AiGatewayClient("http://127.0.0.1:" + server.getAddress().getPort(),
                Duration.ofSeconds(5), new ObjectMapper());
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void analyze_parsesReport() {
        reply = """
                {"category":"jewellery","confidence":0.83,"attributes":{"metal":"silver"},"model":"v2"}
                """;

        AnalysisReport report = client.analyze("s3://uploads/ring.jpg");

        assertThat(report.category()).isEqualTo("jewellery");
        assertThat(report.confidence()).isEqualTo(0.83);
        assertThat(report.attributes()).containsEntry("metal", "silver");
        assertThat(lastBody.get()).contains("\"asset_ref\":\"s3://uploads/ring.jpg\"");
    }

    @Test
    void generate_readsAssetRefs() {
        reply = """
                {"asset_refs":["bg://1","bg://2","bg://3"]}
                """;

        assertThat(client.generate("studio background", 3)).containsExactly("bg://1", "bg://2", "bg://3");
        assertThat(lastBody.get()).contains("\"count\":3");
    }

    @Test
    void moderateText_sendsLanguage() {
        reply = """
                {"safe":false,"reason":"violence","flaggedCategories":["violence"]}
                """;

        SafetyAssessment assessment = client.moderateText("caption", "ta");

        assertThat(assessment.safe()).isFalse();
        assertThat(assessment.flaggedCategories()).containsExactly("violence");
        assertThat(lastBody.get()).contains("\"language\":\"ta\"");
    }

    @Test
    void serverError_isTransient() {
        status = 503;

        assertThatThrownBy(() -> client.moderateImages(List.of("bg://1")))
                .isInstanceOf(CapabilityException.class)
                .extracting(e -> ((CapabilityException) e).kind())
                .isEqualTo(FailureKind.TRANSIENT);
    }

    @Test
    void clientError_isPermanent() {
        status = 422;
        reply  = "{\"error\":\"not an image\"}";

        assertThatThrownBy(() -> client.analyze("s3://uploads/notes.txt"))
                .isInstanceOf(CapabilityException.class)
                .extracting(e -> ((CapabilityException) e).kind())
                .isEqualTo(FailureKind.PERMANENT);
    }

    @Test
    void nullBody_isTransientInsteadOfNullPointer() {
        reply = "null";

        assertThatThrownBy(() -> client.generate("studio background", 3))
                .isInstanceOf(CapabilityException.class)
                .extracting(e -> ((CapabilityException) e).kind())
                .isEqualTo(FailureKind.TRANSIENT);
    }

    @Test
    void unparseableBody_isTransient() {
        reply = "<html>gateway hiccup</html>";

        assertThatThrownBy(() -> client.analyze("s3://uploads/ring.jpg"))
                .isInstanceOf(CapabilityException.class)
                .extracting(e -> ((CapabilityException) e).kind())
                .isEqualTo(FailureKind.TRANSIENT);
    }
}

package fr.lapetina.hotswap.infrastructure.supervisor;

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class XmlRpcSupervisorGatewayTest {

    private static final Pattern METHOD = Pattern.compile("<methodName>([^<]+)</methodName>");
    private static final String OK = "<methodResponse><params><param><value><boolean>1</boolean></value></param></params></methodResponse>";

    private HttpServer supervisord;
    private final Map<String, String> responses = new ConcurrentHashMap<>();
    private final List<String> bodies = new CopyOnWriteArrayList<>();
    private final List<String> authorizations = new CopyOnWriteArrayList<>();
    private URI rpcUri;

    @BeforeEach
    void setUp() throws IOException {
        supervisord = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        supervisord.createContext("/RPC2", exchange -> {
            String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
            bodies.add(body);
            String auth = exchange.getRequestHeaders().getFirst("Authorization");
            authorizations.add(auth != null ? auth : "");
            Matcher matcher = METHOD.matcher(body);
            String method = matcher.find() ? matcher.group(1) : "";
            byte[] reply = responses.getOrDefault(method, OK).getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "text/xml");
            exchange.sendResponseHeaders(200, reply.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(reply);
            }
        });
        supervisord.start();
        rpcUri = URI.create("http://127.0.0.1:" + supervisord.getAddress().getPort() + "/RPC2");
    }

    @AfterEach
    void tearDown() {
        supervisord.stop(0);
    }

    private XmlRpcSupervisorGateway gateway() {
        return new XmlRpcSupervisorGateway(rpcUri, Duration.ofSeconds(2), null, null);
    }

    private static String fault(int code, String text) {
        return "<methodResponse><fault><value><struct>"
                + "<member><name>faultCode</name><value><int>" + code + "</int></value></member>"
                + "<member><name>faultString</name><value><string>" + text + "</string></value></member>"
                + "</struct></value></fault></methodResponse>";
    }

    private static String processInfo(String... groupAndState) {
        StringBuilder xml = new StringBuilder("<methodResponse><params><param><value><array><data>");
        for (int i = 0; i < groupAndState.length; i += 2) {
            xml.append("<value><struct>")
                    .append("<member><name>group</name><value><string>").append(groupAndState[i]).append("</string></value></member>")
                    .append("<member><name>name</name><value><string>worker</string></value></member>")
                    .append("<member><name>statename</name><value><string>").append(groupAndState[i + 1]).append("</string></value></member>")
                    .append("</struct></value>");
        }
        return xml.append("</data></array></value></param></params></methodResponse>").toString();
    }

    @Nested
    @DisplayName("start and stop")
    class StartStop {

        @Test
        @DisplayName("should call startProcessGroup with wait enabled")
        void shouldStartGroup() throws Exception {
            gateway().start("greeter-a");

            assertThat(bodies).hasSize(1);
            assertThat(bodies.get(0))
                    .contains("<methodName>supervisor.startProcessGroup</methodName>")
                    .contains("<string>greeter-a</string>")
                    .contains("<boolean>1</boolean>");
        }

        @Test
        @DisplayName("should treat an already started group as started")
        void shouldIgnoreAlreadyStarted() {
            responses.put("supervisor.startProcessGroup", fault(60, "ALREADY_STARTED: greeter-a"));

            assertThatCode(() -> gateway().start("greeter-a"))
                    .doesNotThrowAnyException();
        }

        @Test
        @DisplayName("should treat a group that is not running as stopped")
        void shouldIgnoreNotRunning() {
            responses.put("supervisor.stopProcessGroup", fault(70, "NOT_RUNNING: greeter-a"));

            assertThatCode(() -> gateway().stop("greeter-a"))
                    .doesNotThrowAnyException();
            assertThat(bodies.get(0)).contains("supervisor.stopProcessGroup");
        }

        @Test
        @DisplayName("should surface other faults with their code")
        void shouldSurfaceOtherFaults() {
            responses.put("supervisor.startProcessGroup", fault(10, "BAD_NAME: nope"));

            assertThatThrownBy(() -> gateway().start("nope"))
                    .isInstanceOf(GatewayException.class)
                    .satisfies(e -> assertThat(((GatewayException) e).getFaultCode()).isEqualTo(10));
        }
    }

    @Nested
    @DisplayName("status")
    class Status {

        @Test
        @DisplayName("should aggregate the processes of the group")
        void shouldAggregateGroupStatus() throws Exception {
            responses.put("supervisor.getAllProcessInfo", processInfo(
                    "greeter-a", "RUNNING",
                    "greeter-a", "STARTING",
                    "greeter-b", "STOPPED",
                    "other-a", "FATAL"));

            assertThat(gateway().status("greeter-a")).isEqualTo(ProcessStatus.RUNNING);
            assertThat(gateway().status("greeter-b")).isEqualTo(ProcessStatus.STOPPED);
            assertThat(gateway().status("other-a")).isEqualTo(ProcessStatus.FATAL);
        }

        @Test
        @DisplayName("should report FATAL when any process of the group is fatal")
        void shouldPreferFatal() throws Exception {
            responses.put("supervisor.getAllProcessInfo", processInfo(
                    "greeter-a", "RUNNING",
                    "greeter-a", "BACKOFF"));

            assertThat(gateway().status("greeter-a")).isEqualTo(ProcessStatus.FATAL);
        }

        @Test
        @DisplayName("should reject an unknown group")
        void shouldRejectUnknownGroup() {
            responses.put("supervisor.getAllProcessInfo", processInfo("greeter-a", "RUNNING"));

            assertThatThrownBy(() -> gateway().status("missing-a"))
                    .isInstanceOf(GatewayException.class)
                    .hasMessageContaining("missing-a");
        }
    }

    @Test
    @DisplayName("should send basic credentials when configured")
    void shouldSendBasicAuth() throws Exception {
        new XmlRpcSupervisorGateway(rpcUri, Duration.ofSeconds(2), "admin", "secret").start("greeter-a");

        assertThat(authorizations).containsExactly("Basic YWRtaW46c2VjcmV0");
    }

    @Test
    @DisplayName("should fail with a gateway error when the supervisor is unreachable")
    void shouldFailWhenUnreachable() throws Exception {
        int freePort;
        try (ServerSocket socket = new ServerSocket(0)) {
            freePort = socket.getLocalPort();
        }
        XmlRpcSupervisorGateway unreachable = new XmlRpcSupervisorGateway(
                URI.create("http://127.0.0.1:" + freePort + "/RPC2"), Duration.ofMillis(500), null, null);

        assertThatThrownBy(() -> unreachable.status("greeter-a"))
                .isInstanceOf(GatewayException.class)
                .hasMessageContaining("unreachable");
    }

    @Test
    @DisplayName("should fail on a non-200 answer")
    void shouldFailOnHttpError() {
        supervisord.removeContext("/RPC2");
        supervisord.createContext("/RPC2", exchange -> {
            exchange.sendResponseHeaders(401, -1);
            exchange.close();
        });

        assertThatThrownBy(() -> gateway().start("greeter-a"))
                .isInstanceOf(GatewayException.class)
                .hasMessageContaining("401");
    }
}

package fr.lapetina.hotswap.infrastructure.supervisor;

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
import java.util.Base64;
import java.util.List;
import java.util.Map;

/**
 * Supervisor gateway speaking the supervisord XML-RPC API.
 *
 * <p>See http://supervisord.org/api.html for the method contracts. Group status is
 * aggregated over every process of the group: any FATAL process makes the group FATAL,
 * otherwise any RUNNING process makes it RUNNING.
 */
public final class XmlRpcSupervisorGateway implements SupervisorGateway {

    private static final Logger log = LoggerFactory.getLogger(XmlRpcSupervisorGateway.class);

    // supervisord xmlrpc.Faults
    static final int FAULT_BAD_NAME = 10;
    static final int FAULT_ALREADY_STARTED = 60;
    static final int FAULT_NOT_RUNNING = 70;

    private final HttpClient httpClient;
    private final URI rpcUri;
    private final Duration callTimeout;
    private final String authorization;

    public XmlRpcSupervisorGateway(URI rpcUri, Duration callTimeout, String username, String password) {
        this.rpcUri = rpcUri;
        this.callTimeout = callTimeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(callTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();
        if (username != null && !username.isEmpty()) {
            String credentials = username + ":" + (password != null ? password : "");
            this.authorization = "Basic " + Base64.getEncoder()
                    .encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
        } else {
            this.authorization = null;
        }
    }

    public XmlRpcSupervisorGateway(URI rpcUri) {
        this(rpcUri, Duration.ofSeconds(10), null, null);
    }

    @Override
    public void start(String groupName) throws GatewayException {
        log.info("Starting process group: group={}", groupName);
        try {
            call("supervisor.startProcessGroup", groupName, Boolean.TRUE);
        } catch (GatewayException e) {
            if (e.getFaultCode() != FAULT_ALREADY_STARTED) {
                throw e;
            }
            log.debug("Process group already started: group={}", groupName);
        }
    }

    @Override
    public void stop(String groupName) throws GatewayException {
        log.info("Stopping process group: group={}", groupName);
        try {
            call("supervisor.stopProcessGroup", groupName, Boolean.TRUE);
        } catch (GatewayException e) {
            if (e.getFaultCode() != FAULT_NOT_RUNNING) {
                throw e;
            }
            log.debug("Process group not running: group={}", groupName);
        }
    }

    @Override
    public ProcessStatus status(String groupName) throws GatewayException {
        Object result = call("supervisor.getAllProcessInfo");
        if (!(result instanceof List<?> processes)) {
            throw new GatewayException("Unexpected getAllProcessInfo result: " + result);
        }

        List<ProcessStatus> states = new ArrayList<>();
        for (Object process : processes) {
            if (process instanceof Map<?, ?> info && groupName.equals(info.get("group"))) {
                states.add(ProcessStatus.fromSupervisorState(String.valueOf(info.get("statename"))));
            }
        }

        if (states.isEmpty()) {
            throw new GatewayException("Unknown process group: " + groupName, FAULT_BAD_NAME, null);
        }
        if (states.contains(ProcessStatus.FATAL)) {
            return ProcessStatus.FATAL;
        }
        if (states.contains(ProcessStatus.RUNNING)) {
            return ProcessStatus.RUNNING;
        }
        if (states.stream().allMatch(s -> s == ProcessStatus.STOPPED)) {
            return ProcessStatus.STOPPED;
        }
        return ProcessStatus.UNKNOWN;
    }

    private Object call(String method, Object... params) throws GatewayException {
        String body = XmlRpcCodec.encodeCall(method, params);
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(rpcUri)
                .timeout(callTimeout)
                .header("Content-Type", "text/xml")
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));
        if (authorization != null) {
            builder.header("Authorization", authorization);
        }

        HttpResponse<byte[]> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofByteArray());
        } catch (IOException e) {
            throw new GatewayException("Supervisor unreachable at " + rpcUri + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GatewayException("Interrupted calling " + method, e);
        }

        if (response.statusCode() != 200) {
            throw new GatewayException("Supervisor returned HTTP " + response.statusCode() + " for " + method);
        }
        Object result = XmlRpcCodec.decodeResponse(response.body());
        log.debug("Supervisor call completed: method={}, result={}", method, result);
        return result;
    }
}

package com.cronhook.server;

import com.cronhook.core.Job;
import com.cronhook.core.JobPayload;
import com.cronhook.core.JobRegistry;
import com.cronhook.core.Json;
import com.cronhook.core.Metrics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * HTTP front end of the job registry.
 * <pre>
 * POST   /jobs       create a job
 * GET    /jobs       list jobs
 * GET    /jobs/{id}  fetch a job
 * PUT    /jobs/{id}  change name, schedule or payload
 * DELETE /jobs/{id}  delete a job
 * GET    /metrics    Prometheus text metrics
 * GET    /health     liveness and job count
 * </pre>
 */
public class JobApiServer {
    private static final Logger log = LoggerFactory.getLogger(JobApiServer.class);
    private static final String JOBS = "/jobs";

    private final JobRegistry registry;
    private final ObjectMapper mapper = Json.newMapper();
    private HttpServer server;

    public JobApiServer(JobRegistry registry) {
        this.registry = registry;
    }

    /**
     * Binds and starts the server.
     *
     * @param port port to bind, 0 for an ephemeral port
     * @return the bound port
     */
    public synchronized int start(int port) throws IOException {
        if (server != null) {
            return getPort();
        }
        server = HttpServer.create(new InetSocketAddress(port), 0);
        server.createContext(JOBS, this::handleJobs);
        server.createContext("/metrics", this::handleMetrics);
        server.createContext("/health", this::handleHealth);
        server.start();
        log.info("Job API listening on port {}", getPort());
        return getPort();
    }

    /** Stops the server if running. */
    public synchronized void stop() {
        if (server != null) {
            server.stop(0);
            server = null;
        }
    }

    /** Returns the port the server is bound to, or -1 if not running. */
    public synchronized int getPort() {
        return server == null ? -1 : server.getAddress().getPort();
    }

    private void handleJobs(HttpExchange ex) throws IOException {
        try {
            String path = ex.getRequestURI().getPath();
            String rest = path.length() > JOBS.length() ? path.substring(JOBS.length() + 1) : "";
            if (!path.equals(JOBS) && !path.startsWith(JOBS + "/")) {
                sendError(ex, 404, "Not found");
            } else if (rest.isEmpty()) {
                handleCollection(ex);
            } else if (rest.contains("/")) {
                sendError(ex, 404, "Not found");
            } else {
                handleItem(ex, rest);
            }
        } catch (IllegalArgumentException e) {
            sendError(ex, 400, e.getMessage());
        } catch (IllegalStateException e) {
            sendError(ex, 503, e.getMessage());
        } catch (Exception e) {
            log.error("Request {} {} failed", ex.getRequestMethod(), ex.getRequestURI(), e);
            sendError(ex, 500, "Internal error");
        } finally {
            ex.close();
        }
    }

    private void handleCollection(HttpExchange ex) throws IOException {
        switch (ex.getRequestMethod()) {
            case "GET" -> sendJson(ex, 200, registry.list());
            case "POST" -> {
                JsonNode body = readBody(ex);
                Job job = registry.create(text(body, "name"), text(body, "schedule"), payload(body));
                sendJson(ex, 201, job);
            }
            default -> sendError(ex, 405, "Method not allowed");
        }
    }

    private void handleItem(HttpExchange ex, String id) throws IOException {
        switch (ex.getRequestMethod()) {
            case "GET" -> sendFound(ex, registry.get(id));
            case "PUT" -> {
                JsonNode body = readBody(ex);
                sendFound(ex, registry.update(id, text(body, "name"), text(body, "schedule"), payload(body)));
            }
            case "DELETE" -> {
                if (registry.delete(id)) {
                    ObjectNode ack = mapper.createObjectNode();
                    ack.put("ok", true);
                    ack.put("message", "Job deleted");
                    sendJson(ex, 200, ack);
                } else {
                    sendError(ex, 404, "Job not found");
                }
            }
            default -> sendError(ex, 405, "Method not allowed");
        }
    }

    private void handleMetrics(HttpExchange ex) throws IOException {
        try {
            byte[] body = Metrics.getInstance().toPrometheus(registry.size()).getBytes(StandardCharsets.UTF_8);
            ex.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            ex.sendResponseHeaders(200, body.length);
            try (OutputStream os = ex.getResponseBody()) {
                os.write(body);
            }
        } finally {
            ex.close();
        }
    }

    private void handleHealth(HttpExchange ex) throws IOException {
        try {
            ObjectNode health = mapper.createObjectNode();
            boolean up = !registry.isClosed();
            health.put("status", up ? "UP" : "STOPPING");
            health.put("jobs", registry.size());
            sendJson(ex, up ? 200 : 503, health);
        } finally {
            ex.close();
        }
    }

    private JsonNode readBody(HttpExchange ex) throws IOException {
        byte[] raw = ex.getRequestBody().readAllBytes();
        JsonNode node;
        try {
            node = raw.length == 0 ? null : mapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("request body is not valid JSON");
        }
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("request body must be a JSON object");
        }
        return node;
    }

    private static String text(JsonNode body, String field) {
        JsonNode v = body.get(field);
        if (v == null || v.isNull()) {
            return null;
        }
        if (!v.isTextual()) {
            throw new IllegalArgumentException(field + " must be a string");
        }
        return v.asText();
    }

    private static JobPayload payload(JsonNode body) {
        JsonNode p = body.get("payload");
        if (p == null || p.isNull()) {
            return null;
        }
        if (!p.isObject()) {
            throw new IllegalArgumentException("payload must be an object");
        }
        JsonNode content = p.get("body");
        return new JobPayload(text(p, "url"), content == null || content.isNull() ? null : content);
    }

    private void sendFound(HttpExchange ex, Optional<Job> job) throws IOException {
        if (job.isPresent()) {
            sendJson(ex, 200, job.get());
        } else {
            sendError(ex, 404, "Job not found");
        }
    }

    private void sendError(HttpExchange ex, int status, String message) throws IOException {
        ObjectNode error = mapper.createObjectNode();
        error.put("error", message);
        sendJson(ex, status, error);
    }

    private void sendJson(HttpExchange ex, int status, Object value) throws IOException {
        byte[] body = mapper.writeValueAsBytes(value);
        ex.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        ex.sendResponseHeaders(status, body.length);
        try (OutputStream os = ex.getResponseBody()) {
            os.write(body);
        }
    }
}

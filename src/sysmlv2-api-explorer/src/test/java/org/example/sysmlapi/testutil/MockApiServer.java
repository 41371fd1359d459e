package org.example.sysmlapi.testutil;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process stand-in for a SysML v2 API server. Routes are matched on the
 * decoded path plus query first, then on the path alone; anything else
 * answers 404.
 */
public class MockApiServer implements AutoCloseable {

    /** One request as the server saw it. */
    public record Received(String method, String path, String query, String authorization) {}

    private record Response(int status, String body) {}

    private final HttpServer server;
    private final Map<String, Response> routes = new ConcurrentHashMap<>();
    private final List<Received> received = new CopyOnWriteArrayList<>();

    public MockApiServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        server.createContext("/", this::handle);
        server.setExecutor(null);
        server.start();
    }

    public String baseUrl() {
        return "http://localhost:" + server.getAddress().getPort();
    }

    public MockApiServer respond(String pathAndQuery, String json) {
        return respond(pathAndQuery, 200, json);
    }

    public MockApiServer respond(String pathAndQuery, int status, String body) {
        routes.put(pathAndQuery, new Response(status, body));
        return this;
    }

    public List<Received> received() {
        return received;
    }

    public long count(String path) {
        return received.stream().filter(r -> r.path().equals(path)).count();
    }

    private void handle(HttpExchange exchange) throws IOException {
        String path = exchange.getRequestURI().getPath();
        String query = exchange.getRequestURI().getQuery();
        received.add(new Received(exchange.getRequestMethod(), path, query,
            exchange.getRequestHeaders().getFirst("Authorization")));

        Response response = null;
        if (query != null) response = routes.get(path + "?" + query);
        if (response == null) response = routes.get(path);
        if (response == null) response = new Response(404, "{\"error\":\"not found: " + path + "\"}");

        byte[] bytes = response.body().getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(response.status(), bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    @Override
    public void close() {
        server.stop(0);
    }
}

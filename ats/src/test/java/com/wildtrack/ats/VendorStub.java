package com.wildtrack.ats;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Local stand-in for the ATS web service, serving the two pull endpoints.
 */
public final class VendorStub implements AutoCloseable {

    public final Endpoint data = new Endpoint(Fixtures.load("data_points.xml"));
    public final Endpoint transmissions = new Endpoint(Fixtures.load("transmissions.xml"));

    private final HttpServer server;

    public VendorStub() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/GetPointsAtsIridium", exchange -> data.serve(exchange));
        server.createContext("/GetTransmissionsIridium", exchange -> transmissions.serve(exchange));
        server.start();
    }

    public String dataUrl() {
        return base() + "/GetPointsAtsIridium";
    }

    public String transmissionsUrl() {
        return base() + "/GetTransmissionsIridium";
    }

    private String base() {
        return "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(0);
    }

    /** Canned answer of one endpoint plus the number of requests it received. */
    public static final class Endpoint {

        public final AtomicReference<String> body;
        public final AtomicInteger status = new AtomicInteger(200);
        public final AtomicInteger hits = new AtomicInteger();

        Endpoint(String body) {
            this.body = new AtomicReference<>(body);
        }

        private void serve(HttpExchange exchange) throws IOException {
            hits.incrementAndGet();
            byte[] response = body.get().getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "text/xml; charset=utf-8");
            exchange.sendResponseHeaders(status.get(), response.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(response);
            }
        }
    }
}

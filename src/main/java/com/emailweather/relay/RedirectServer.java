package com.emailweather.relay;

import com.emailweather.oauth2.RedirectChannel;
import com.emailweather.oauth2.RedirectParameters;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Embedded HTTP endpoint receiving the OAuth2 consent redirect.
 *
 * <p>{@code GET <path>?code=...&state=...} forwards the parameters to the
 * {@link RedirectChannel} the installed flow is waiting on and answers with a small HTML
 * page telling the user they may close the tab.
 */
public class RedirectServer {

    private static final Logger logger = LoggerFactory.getLogger(RedirectServer.class);

    public static final String DEFAULT_PATH = "/oauth2";

    private static final String SUCCESS_PAGE = "<!DOCTYPE html><html><head>"
            + "<title>email-weather Authentication Successful</title></head><body>"
            + "Authentication with the email-weather service was successful, "
            + "you may close this browser tab.</body></html>";

    private final HttpServer server;
    private final RedirectChannel channel;
    private boolean stopped;

    private RedirectServer(HttpServer server, RedirectChannel channel) {
        this.server = server;
        this.channel = channel;
    }

    /**
     * Binds and starts the server.
     *
     * @param address the address to bind; port 0 picks a free port
     * @param path    the redirect path, e.g. {@code /oauth2}
     * @param channel the channel to forward redirects to
     * @return the running server
     * @throws IOException if the address cannot be bound
     */
    public static RedirectServer start(InetSocketAddress address, String path, RedirectChannel channel)
            throws IOException {
        if (channel == null) {
            throw new IllegalArgumentException("Redirect channel cannot be null");
        }
        if (path == null || !path.startsWith("/")) {
            throw new IllegalArgumentException("Redirect path must start with '/'");
        }
        HttpServer server = HttpServer.create(address, 0);
        RedirectServer redirectServer = new RedirectServer(server, channel);
        server.createContext(path, redirectServer::handle);
        server.start();
        logger.info("OAuth2 redirect server listening on {}{}", server.getAddress(), path);
        return redirectServer;
    }

    /**
     * The bound port, useful when started on port 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    /**
     * Stops the server and closes the channel, waking any flow still waiting for consent.
     * Idempotent.
     */
    public synchronized void stop() {
        if (stopped) {
            return;
        }
        stopped = true;
        server.stop(0);
        channel.close();
        logger.debug("OAuth2 redirect server stopped");
    }

    private void handle(HttpExchange exchange) throws IOException {
        try {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                respond(exchange, 405, "Method not allowed");
                return;
            }

            Map<String, String> query = parseQuery(exchange.getRequestURI().getRawQuery());
            String error = query.get("error");
            if (error != null) {
                logger.warn("Consent redirect reported error: {}", error);
                respond(exchange, 400, "Authorization failed: " + escapeHtml(error));
                return;
            }

            String code = query.get("code");
            String state = query.get("state");
            if (code == null || code.isBlank() || state == null || state.isBlank()) {
                logger.warn("Consent redirect without code or state");
                respond(exchange, 400, "Missing code or state parameter");
                return;
            }

            if (!channel.send(new RedirectParameters(code, state))) {
                logger.warn("Consent redirect rejected, another redirect is already pending");
                respond(exchange, 503, "Another authorization redirect is already pending");
                return;
            }

            logger.debug("Forwarded consent redirect to waiting flow");
            respond(exchange, 200, SUCCESS_PAGE);
        } finally {
            exchange.close();
        }
    }

    private static void respond(HttpExchange exchange, int status, String html) throws IOException {
        byte[] body = html.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "text/html; charset=utf-8");
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(body);
        }
    }

    static Map<String, String> parseQuery(String rawQuery) {
        Map<String, String> result = new HashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return result;
        }
        for (String pair : rawQuery.split("&")) {
            int idx = pair.indexOf('=');
            String name = idx < 0 ? pair : pair.substring(0, idx);
            String value = idx < 0 ? "" : pair.substring(idx + 1);
            result.putIfAbsent(URLDecoder.decode(name, StandardCharsets.UTF_8),
                    URLDecoder.decode(value, StandardCharsets.UTF_8));
        }
        return result;
    }

    private static String escapeHtml(String value) {
        return value.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;")
                .replace("\"", "&quot;");
    }
}

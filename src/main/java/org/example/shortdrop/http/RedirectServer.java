package org.example.shortdrop.http;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.example.shortdrop.model.Entry;
import org.example.shortdrop.model.EntryMetadata;
import org.example.shortdrop.model.LookupResult;
import org.example.shortdrop.service.ShortDropService;
import org.example.shortdrop.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Minimal HTTP front end for resolving short codes and creating new ones.
 *
 * <ul>
 *   <li>{@code GET /<code>} – 302 to a URL target, 200 attachment download for a file target, 404
 *       for an unknown code, 410 for an expired one.
 *   <li>{@code GET /api/metadata/<code>} – JSON {@code {target, created_at, expires_in, hits}}, or
 *       404 {@code {"error":"Not found"}}. Reading metadata does not count as a hit.
 *   <li>{@code POST /upload} – creates an entry. A form-encoded body carries {@code url} and
 *       {@code code}. Any other body is the file itself, named by the {@code filename} query
 *       parameter; {@code code} (and, to be rejected, {@code url}) may also come from the query.
 *       Answers 200 with the short URL, or 400 with the validation message.
 * </ul>
 *
 * <p>Requests are handled on a cached thread pool; all shared state lives in the service's store.
 */
public class RedirectServer {
  private static final Logger LOGGER = LoggerFactory.getLogger(RedirectServer.class);

  static final String METADATA_PATH = "/api/metadata/";
  static final String UPLOAD_PATH = "/upload";

  private final String host;
  private final int port;
  private final ShortDropService service;
  private HttpServer server;
  private ExecutorService executor;

  /**
   * @param host bind address, e.g. {@code 0.0.0.0} or {@code localhost}
   * @param port port to bind; {@code 0} picks a free one
   * @param service lookup service
   */
  public RedirectServer(String host, int port, ShortDropService service) {
    this.host = Objects.requireNonNull(host, "host");
    this.port = port;
    this.service = Objects.requireNonNull(service, "service");
  }

  public synchronized void start() throws IOException {
    if (server != null) throw new IllegalStateException("Server already started");
    server = HttpServer.create(new InetSocketAddress(host, port), 0);
    server.createContext("/", this::handle);
    executor = Executors.newCachedThreadPool();
    server.setExecutor(executor);
    server.start();
    LOGGER.info("Redirect server listening on http://{}:{}/", host, port());
  }

  public synchronized void stop() {
    if (server == null) return;
    server.stop(0);
    executor.shutdownNow();
    server = null;
    executor = null;
    LOGGER.info("Redirect server stopped");
  }

  /**
   * @return bound port, or the configured one if not started
   */
  public synchronized int port() {
    return (server == null) ? port : server.getAddress().getPort();
  }

  private void handle(HttpExchange ex) throws IOException {
    try {
      String path = ex.getRequestURI().getPath();
      if (UPLOAD_PATH.equals(path) && "POST".equalsIgnoreCase(ex.getRequestMethod())) {
        handleUpload(ex);
        return;
      }
      if (!"GET".equalsIgnoreCase(ex.getRequestMethod())) {
        sendText(ex, 405, "Method not allowed");
        return;
      }
      if (path.startsWith(METADATA_PATH)) {
        handleMetadata(ex, path.substring(METADATA_PATH.length()));
      } else {
        handleRedirect(ex, path.substring(1));
      }
    } catch (RuntimeException e) {
      LOGGER.error("Request {} failed", ex.getRequestURI(), e);
      if (ex.getResponseCode() == -1) {
        sendText(ex, 500, "Internal error");
      }
    } finally {
      ex.close();
    }
  }

  private void handleRedirect(HttpExchange ex, String code) throws IOException {
    if (code.isEmpty() || code.contains("/")) {
      sendText(ex, 404, "Not found");
      return;
    }
    LookupResult result = service.lookup(code);
    switch (result.outcome()) {
      case NOT_FOUND -> sendText(ex, 404, "Not found");
      case EXPIRED -> sendText(ex, 410, "Link expired");
      case TARGET -> {
        String target = result.target();
        if (Entry.isArtifactTarget(target)) {
          sendArtifact(ex, target);
        } else {
          ex.getResponseHeaders().add("Location", target);
          ex.sendResponseHeaders(302, -1);
        }
      }
    }
  }

  private void sendArtifact(HttpExchange ex, String target) throws IOException {
    Optional<Path> file = service.resolveArtifact(target);
    if (file.isEmpty() || !Files.isRegularFile(file.get())) {
      sendText(ex, 404, "Not found");
      return;
    }
    Path p = file.get();
    long size;
    try {
      size = Files.size(p);
    } catch (NoSuchFileException e) {
      sendText(ex, 404, "Not found");
      return;
    }
    ex.getResponseHeaders().add("Content-Type", "application/octet-stream");
    ex.getResponseHeaders()
        .add("Content-Disposition", "attachment; filename=\"" + p.getFileName() + "\"");
    ex.sendResponseHeaders(200, size == 0 ? -1 : size);
    if (size > 0) {
      try (OutputStream os = ex.getResponseBody()) {
        Files.copy(p, os);
      }
    }
  }

  private void handleUpload(HttpExchange ex) throws IOException {
    Map<String, String> fields = new HashMap<>(parseForm(ex.getRequestURI().getRawQuery()));
    String contentType = ex.getRequestHeaders().getFirst("Content-Type");
    String fileName = null;
    InputStream file = null;
    if (contentType != null
        && contentType.toLowerCase(Locale.ROOT).startsWith("application/x-www-form-urlencoded")) {
      fields.putAll(
          parseForm(new String(ex.getRequestBody().readAllBytes(), StandardCharsets.UTF_8)));
    } else {
      fileName = fields.get("filename");
      file = ex.getRequestBody();
    }

    Entry created;
    try {
      created = service.create(fields.get("url"), fileName, file, fields.get("code"));
    } catch (IllegalArgumentException e) {
      sendText(ex, 400, e.getMessage());
      return;
    } catch (IOException e) {
      LOGGER.warn("Upload of {} failed: {}", fileName, e.getMessage());
      sendText(ex, 500, "Upload failed");
      return;
    }
    sendText(ex, 200, service.makeShort(created.code));
  }

  /**
   * Decodes {@code a=1&b=2} pairs. A key without {@code =} maps to the empty string; a repeated
   * key keeps its last value.
   */
  static Map<String, String> parseForm(String raw) {
    Map<String, String> out = new HashMap<>();
    if (raw == null || raw.isEmpty()) return out;
    for (String pair : raw.split("&")) {
      if (pair.isEmpty()) continue;
      int eq = pair.indexOf('=');
      String key = (eq < 0) ? pair : pair.substring(0, eq);
      String value = (eq < 0) ? "" : pair.substring(eq + 1);
      out.put(
          URLDecoder.decode(key, StandardCharsets.UTF_8),
          URLDecoder.decode(value, StandardCharsets.UTF_8));
    }
    return out;
  }

  private void handleMetadata(HttpExchange ex, String code) throws IOException {
    Optional<EntryMetadata> meta = service.metadata(code);
    if (meta.isEmpty()) {
      sendJson(ex, 404, Map.of("error", "Not found"));
      return;
    }
    sendJson(ex, 200, meta.get());
  }

  private static void sendJson(HttpExchange ex, int status, Object body) throws IOException {
    ex.getResponseHeaders().add("Content-Type", "application/json; charset=utf-8");
    send(ex, status, JsonUtils.compact().toJson(body).getBytes(StandardCharsets.UTF_8));
  }

  private static void sendText(HttpExchange ex, int status, String msg) throws IOException {
    ex.getResponseHeaders().add("Content-Type", "text/plain; charset=utf-8");
    send(ex, status, msg.getBytes(StandardCharsets.UTF_8));
  }

  private static void send(HttpExchange ex, int status, byte[] body) throws IOException {
    ex.sendResponseHeaders(status, body.length);
    try (OutputStream os = ex.getResponseBody()) {
      os.write(body);
    }
  }
}

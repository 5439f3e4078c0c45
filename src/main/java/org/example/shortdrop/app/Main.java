package org.example.shortdrop.app;

import java.io.IOException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import org.example.shortdrop.cli.ConsoleInput;
import org.example.shortdrop.cli.ConsoleMenu;
import org.example.shortdrop.http.RedirectServer;
import org.example.shortdrop.service.CodeGenerator;
import org.example.shortdrop.service.ExpiryReaper;
import org.example.shortdrop.service.ShortDropService;
import org.example.shortdrop.storage.AppConfig;
import org.example.shortdrop.storage.JsonMappingStore;
import org.example.shortdrop.storage.LocalArtifactStore;
import org.example.shortdrop.storage.StoreUnavailableException;
import org.example.shortdrop.util.TtlPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of ShortDrop.
 *
 * <p>Bootstrapping order:
 *
 * <ol>
 *   <li>Load {@code data/config.json}, creating defaults if missing.
 *   <li>Open the mapping store and the upload directory. A store that cannot be opened aborts
 *       startup with exit status 1.
 *   <li>Start the expiry reaper and the redirect HTTP server.
 *   <li>Run the console menu until the user exits.
 *   <li>Stop the server and the reaper.
 * </ol>
 *
 * <p><b>Threading:</b> the console runs on the main thread; HTTP requests run on the server's
 * pool; the reaper has its own thread. They share only the mapping store.
 */
public class Main {
  private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

  public static void main(String[] args) {
    AppConfig config = AppConfig.loadOrCreateDefault();
    Clock clock = Clock.systemUTC();
    TtlPolicy ttl = config.ttlPolicy();

    JsonMappingStore store;
    LocalArtifactStore artifacts;
    try {
      store = new JsonMappingStore(config.dataFilePath(), clock);
      artifacts = new LocalArtifactStore(config.uploadDirPath(), clock);
    } catch (StoreUnavailableException | IOException e) {
      LOGGER.error("Cannot start: {}", e.getMessage(), e);
      System.exit(1);
      return;
    }

    ShortDropService service =
        new ShortDropService(
            store,
            artifacts,
            new CodeGenerator(new SecureRandom(), config.codeLength),
            ttl,
            clock,
            config.baseUrl);
    ExpiryReaper reaper =
        new ExpiryReaper(
            store, artifacts, ttl, clock, Duration.ofSeconds(config.sweepIntervalSeconds));
    RedirectServer server = new RedirectServer("0.0.0.0", config.port, service);

    reaper.start();
    try {
      server.start();
    } catch (IOException | RuntimeException e) {
      LOGGER.warn("Redirect server not started on port {}: {}", config.port, e.getMessage());
    }

    System.out.println("========================================");
    System.out.println(" ShortDrop (Java)");
    System.out.println("========================================");
    System.out.println("Short links: " + config.baseUrl + "<code>");
    System.out.println("Entries expire after " + ttl.ttlSeconds() + " seconds.");
    System.out.println("Type a number to choose an option, 'q' to quit.\n");

    try {
      new ConsoleMenu(config, service, reaper, new ConsoleInput(System.in)).mainLoop();
    } finally {
      server.stop();
      reaper.stop();
    }
    System.out.println("\nBye!");
  }
}

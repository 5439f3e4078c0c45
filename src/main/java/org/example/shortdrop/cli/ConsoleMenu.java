package org.example.shortdrop.cli;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;
import org.example.shortdrop.model.Entry;
import org.example.shortdrop.model.EntryMetadata;
import org.example.shortdrop.model.LookupResult;
import org.example.shortdrop.service.ExpiryReaper;
import org.example.shortdrop.service.ShortDropService;
import org.example.shortdrop.service.SweepReport;
import org.example.shortdrop.storage.AppConfig;
import org.example.shortdrop.storage.StoreUnavailableException;

/**
 * Console UI for ShortDrop.
 *
 * <p>Renders a numbered menu, reads commands through {@link ConsoleInput}, delegates to {@link
 * ShortDropService} and prints results to {@code System.out}.
 *
 * <h2>Responsibilities</h2>
 *
 * <ul>
 *   <li>Create short links for URLs and local files, with an optional custom code
 *   <li>Resolve a code the same way the redirect server does (this counts a hit)
 *   <li>Show metadata and the admin table with search
 *   <li>Trigger an expiry sweep on demand
 * </ul>
 *
 * <h2>Error handling</h2>
 *
 * <p>Validation errors are printed and the loop continues. {@link StoreUnavailableException} is
 * not caught here: it ends the session and reaches {@code Main}. When the background reaper has
 * stopped on a store failure, every menu repaint starts with a warning, and Settings shows the
 * reaper state.
 */
public class ConsoleMenu {

  private static final DateTimeFormatter CREATED_FMT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneId.systemDefault());

  private final AppConfig config;
  private final ShortDropService service;
  private final ExpiryReaper reaper;
  private final ConsoleInput input;

  public ConsoleMenu(
      AppConfig config, ShortDropService service, ExpiryReaper reaper, ConsoleInput input) {
    this.config = config;
    this.service = service;
    this.reaper = reaper;
    this.input = input;
  }

  /** Runs the main loop until the user exits or input is closed. */
  public void mainLoop() {
    while (true) {
      printMainMenu();
      String choice = input.readTrimmed("Select: ");

      if (choice == null) {
        System.out.println("Input closed. Exiting.");
        return;
      }

      switch (choice.toLowerCase()) {
        case "1" -> actionShortenUrl();
        case "2" -> actionDropFile();
        case "3" -> actionOpen();
        case "4" -> actionMetadata();
        case "5" -> actionAdmin();
        case "6" -> actionSweep();
        case "7" -> showSettings();
        case "8", "q", "quit", "exit" -> {
          return;
        }
        default -> System.out.println("Unknown option. Please try again.");
      }
    }
  }

  private void printMainMenu() {
    System.out.println();
    if (reaper.fatalError() != null) {
      System.out.println("WARNING: " + reaperStatus());
    }
    System.out.println("Main Menu");
    System.out.println("1. Shorten URL");
    System.out.println("2. Drop File");
    System.out.println("3. Open Short Link");
    System.out.println("4. Link Metadata");
    System.out.println("5. Admin (list / search)");
    System.out.println("6. Run Expiry Sweep Now");
    System.out.println("7. Settings");
    System.out.println("8. Exit");
  }

  private void actionShortenUrl() {
    String url = input.readTrimmed("Enter URL: ");
    if (url == null || url.isBlank()) {
      System.out.println("No URL provided.");
      return;
    }
    String code = input.readTrimmed("Custom code (empty = random): ");
    try {
      printCreated(service.shortenUrl(url, code));
    } catch (IllegalArgumentException ex) {
      System.out.println(ex.getMessage());
    }
  }

  private void actionDropFile() {
    String pathStr = input.readTrimmed("Path to file: ");
    if (pathStr == null || pathStr.isBlank()) {
      System.out.println("No file provided.");
      return;
    }
    Path path = Paths.get(pathStr);
    if (!Files.isRegularFile(path)) {
      System.out.println("File not found: " + pathStr);
      return;
    }
    String code = input.readTrimmed("Custom code (empty = random): ");
    try (InputStream in = Files.newInputStream(path)) {
      printCreated(service.dropFile(String.valueOf(path.getFileName()), in, code));
    } catch (IOException ex) {
      System.out.println("Upload failed: " + ex.getMessage());
    }
  }

  private void printCreated(Entry e) {
    System.out.println("Short URL: " + service.makeShort(e.code) + " → " + e.target);
    System.out.println(
        "This link will expire in " + service.secondsLeft(e.createdAt) + " seconds");
  }

  private void actionOpen() {
    String code = input.readTrimmed("Code: ");
    if (code == null || code.isBlank()) {
      System.out.println("No code provided.");
      return;
    }
    LookupResult r = service.lookup(code);
    switch (r.outcome()) {
      case NOT_FOUND -> System.out.println("Not found: " + code);
      case EXPIRED -> System.out.println("Link expired: " + code);
      case TARGET -> {
        if (Entry.isArtifactTarget(r.target())) {
          Optional<Path> file = service.resolveArtifact(r.target());
          System.out.println(
              "File: " + file.map(p -> p.toAbsolutePath().toString()).orElse(r.target()));
        } else {
          System.out.println("Redirect to: " + r.target());
        }
      }
    }
  }

  private void actionMetadata() {
    String code = input.readTrimmed("Code: ");
    if (code == null || code.isBlank()) {
      System.out.println("No code provided.");
      return;
    }
    Optional<EntryMetadata> meta = service.metadata(code);
    if (meta.isEmpty()) {
      System.out.println("Not found: " + code);
      return;
    }
    EntryMetadata m = meta.get();
    System.out.println("Target:     " + m.target);
    System.out.println("Created:    " + CREATED_FMT.format(Instant.ofEpochSecond(m.createdAt)));
    System.out.println("Expires in: " + m.expiresIn + "s");
    System.out.println("Hits:       " + m.hits);
  }

  private void actionAdmin() {
    String q = input.readTrimmed("Search (empty = all): ");
    List<Entry> rows = service.search(q);
    if (rows.isEmpty()) {
      System.out.println("No entries.");
      return;
    }
    System.out.printf("%-12s %-19s %-10s %-6s %s%n", "Code", "Created", "Expires", "Hits", "Target");
    for (Entry e : rows) {
      System.out.printf(
          "%-12s %-19s %-10s %-6d %s%n",
          e.code,
          CREATED_FMT.format(Instant.ofEpochSecond(e.createdAt)),
          service.secondsLeft(e.createdAt) + "s",
          e.hits,
          e.target);
    }
  }

  private void actionSweep() {
    SweepReport report = reaper.sweep();
    System.out.println("Sweep done: " + report);
    System.out.println(reaperStatus());
  }

  private String reaperStatus() {
    StoreUnavailableException fatal = reaper.fatalError();
    if (fatal != null) {
      return "Reaper: STOPPED (store unavailable: " + fatal.getMessage() + ")";
    }
    if (reaper.isRunning()) {
      return "Reaper: RUNNING (every " + config.sweepIntervalSeconds + "s)";
    }
    return "Reaper: NOT RUNNING";
  }

  private void showSettings() {
    System.out.println();
    System.out.println("Settings");
    System.out.println("baseUrl:              " + config.baseUrl);
    System.out.println("port:                 " + config.port);
    System.out.println("codeLength:           " + config.codeLength);
    System.out.println("ttlSeconds:           " + config.ttlSeconds);
    System.out.println("sweepIntervalSeconds: " + config.sweepIntervalSeconds);
    System.out.println("dataFile:             " + config.dataFile);
    System.out.println("uploadDir:            " + config.uploadDir);
    System.out.println(reaperStatus());
  }
}

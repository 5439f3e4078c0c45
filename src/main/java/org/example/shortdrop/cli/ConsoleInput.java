package org.example.shortdrop.cli;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Scanner;

/**
 * Line-oriented console input used by the CLI.
 *
 * <p>Wraps a single UTF-8 {@link Scanner}. The source stream is injected so tests can script a
 * session without touching {@code System.in}.
 */
public final class ConsoleInput {

  private final Scanner sc;

  /**
   * @param in source of user input, typically {@code System.in}
   */
  public ConsoleInput(InputStream in) {
    this.sc = new Scanner(Objects.requireNonNull(in, "in"), StandardCharsets.UTF_8);
  }

  /**
   * Prints the given prompt and reads a single line.
   *
   * @param prompt text written before reading, without newline
   * @return trimmed input line, or {@code null} if input is exhausted or closed
   */
  public String readTrimmed(String prompt) {
    System.out.print(prompt);
    try {
      return sc.nextLine().trim();
    } catch (IllegalStateException | NoSuchElementException e) {
      return null; // input stream closed
    }
  }
}

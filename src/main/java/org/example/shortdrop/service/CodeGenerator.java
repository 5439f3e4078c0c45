package org.example.shortdrop.service;

import java.security.SecureRandom;
import java.util.Objects;
import java.util.Random;

/**
 * Produces random alphanumeric short codes.
 *
 * <p>Each symbol is drawn uniformly from 62 characters ({@code 0-9}, {@code A-Z}, {@code a-z}). At
 * the default length of 6 this gives 62^6 (about 5.7e10) combinations. The generator does not
 * check for collisions: a colliding code simply replaces the older entry in the store.
 *
 * <p>Thread-safe as long as the supplied {@link Random} is ({@link SecureRandom} and {@link
 * Random} both are).
 */
public class CodeGenerator {

  public static final int DEFAULT_LENGTH = 6;

  private static final char[] B62 =
      "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz".toCharArray();

  private final Random rnd;
  private final int defaultLength;

  public CodeGenerator() {
    this(new SecureRandom(), DEFAULT_LENGTH);
  }

  /**
   * @param rnd randomness source
   * @param defaultLength length used by {@link #generate()}
   * @throws IllegalArgumentException if {@code defaultLength < 1}
   */
  public CodeGenerator(Random rnd, int defaultLength) {
    this.rnd = Objects.requireNonNull(rnd, "rnd");
    checkLength(defaultLength);
    this.defaultLength = defaultLength;
  }

  /**
   * @return random code of the configured default length
   */
  public String generate() {
    return generate(defaultLength);
  }

  /**
   * Produces a random Base62 string of the requested length.
   *
   * @param length number of characters, at least 1
   * @return random code (not guaranteed to be unique)
   * @throws IllegalArgumentException if {@code length < 1}
   */
  public String generate(int length) {
    checkLength(length);
    char[] c = new char[length];
    for (int i = 0; i < length; i++) c[i] = B62[rnd.nextInt(B62.length)];
    return new String(c);
  }

  private static void checkLength(int length) {
    if (length < 1) {
      throw new IllegalArgumentException("Code length must be positive: " + length);
    }
  }
}

package com.bottlespin.application;

import java.util.Random;
import java.util.function.Predicate;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Produces short, human-shareable room codes.
 *
 * <p>Codes are {@value #CODE_LENGTH} characters from an alphabet of upper-case letters and digits
 * without the look-alikes I, O, 0 and 1.
 */
@Component
public class RoomCodeGenerator {
  public static final String ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789";
  public static final int CODE_LENGTH = 6;

  private final Random rnd;
  private final int maxAttempts;

  public RoomCodeGenerator(
      @Qualifier("gameRandom") Random rnd,
      @Value("${bottlespin.code-max-attempts:1000}") int maxAttempts) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("bottlespin.code-max-attempts must be positive");
    }
    this.rnd = rnd;
    this.maxAttempts = maxAttempts;
  }

  /** A random code; uniqueness is up to the caller. */
  public String candidate() {
    StringBuilder sb = new StringBuilder(CODE_LENGTH);
    for (int j = 0; j < CODE_LENGTH; j++) {
      sb.append(ALPHABET.charAt(rnd.nextInt(ALPHABET.length())));
    }
    return sb.toString();
  }

  /**
   * Draw candidates until {@code reserve} accepts one.
   *
   * @param reserve atomically claims a code, returning false if it is already taken
   * @return the claimed code
   * @throws IllegalStateException if no free code was found within the attempt limit
   */
  public String generate(Predicate<String> reserve) {
    for (int i = 0; i < maxAttempts; i++) {
      String code = candidate();
      if (reserve.test(code)) {
        return code;
      }
    }
    throw new IllegalStateException("No free room code after " + maxAttempts + " attempts");
  }
}

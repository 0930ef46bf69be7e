package ca.on.oicr.gsi.calibra;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One failed verification test on one amplifier of one detector
 *
 * @param detector the detector name, such as <tt>R22_S21</tt>; empty if not reported
 * @param amplifier the amplifier name, such as <tt>C17</tt>; empty if not reported
 * @param testName the name of the test that failed, such as <tt>NOISE</tt>
 */
public record FailureRecord(String detector, String amplifier, String testName) {
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  /**
   * Parse the verification pipeline's text description of a failure
   *
   * <p>The description is a space-separated list that ends with the test name, such as <tt>R22_S21
   * C17 NOISE</tt>.
   *
   * @param description the text description
   * @return the parsed failure
   */
  public static FailureRecord parse(String description) {
    Objects.requireNonNull(description, "description");
    final var trimmed = description.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException("Failure description is empty.");
    }
    final var parts = WHITESPACE.split(trimmed);
    return switch (parts.length) {
      case 1 -> new FailureRecord("", "", parts[0]);
      case 2 -> new FailureRecord(parts[0], "", parts[1]);
      default -> new FailureRecord(parts[0], parts[1], parts[parts.length - 1]);
    };
  }

  public FailureRecord {
    Objects.requireNonNull(detector, "detector");
    Objects.requireNonNull(amplifier, "amplifier");
    Objects.requireNonNull(testName, "testName");
  }

  /**
   * Convert back to the verification pipeline's text format
   *
   * @return the space-separated description
   */
  public String describe() {
    final var builder = new StringBuilder();
    if (!detector.isEmpty()) {
      builder.append(detector).append(' ');
    }
    if (!amplifier.isEmpty()) {
      builder.append(amplifier).append(' ');
    }
    return builder.append(testName).toString();
  }
}

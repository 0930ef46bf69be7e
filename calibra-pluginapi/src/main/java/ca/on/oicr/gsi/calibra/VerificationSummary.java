package ca.on.oicr.gsi.calibra;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The statistics produced by a verification pipeline for a calibration product
 *
 * @param success whether the verification pipeline considered the whole product good
 * @param exposures the per-exposure results, keyed by exposure identifier
 */
public record VerificationSummary(
    boolean success, SortedMap<String, ExposureVerification> exposures) {
  private static final String FAILURES = "FAILURES";
  private static final String SUCCESS = "SUCCESS";

  /**
   * Read the verification pipeline's JSON output
   *
   * <p>The output has a top-level <tt>SUCCESS</tt> flag and one object per exposure, each with its
   * own <tt>SUCCESS</tt> flag and a <tt>FAILURES</tt> list of text failure descriptions. Any other
   * top-level values are ignored.
   *
   * @param node the JSON output
   * @return the typed summary
   */
  public static VerificationSummary fromJson(JsonNode node) {
    if (node == null || !node.isObject()) {
      throw new IllegalArgumentException("Verification summary must be a JSON object.");
    }
    final var success = node.path(SUCCESS);
    if (!success.isBoolean()) {
      throw new IllegalArgumentException("Verification summary has no boolean SUCCESS value.");
    }
    final var exposures = new TreeMap<String, ExposureVerification>();
    for (final var entry : (Iterable<Map.Entry<String, JsonNode>>) node::fields) {
      if (entry.getKey().equals(SUCCESS) || !entry.getValue().isObject()) {
        continue;
      }
      final var failures = new ArrayList<FailureRecord>();
      for (final var failure : entry.getValue().path(FAILURES)) {
        failures.add(FailureRecord.parse(failure.asText()));
      }
      exposures.put(
          entry.getKey(),
          new ExposureVerification(
              entry.getValue().path(SUCCESS).asBoolean(failures.isEmpty()), failures));
    }
    return new VerificationSummary(success.booleanValue(), exposures);
  }

  public VerificationSummary {
    exposures = Collections.unmodifiableSortedMap(new TreeMap<>(exposures));
  }
}

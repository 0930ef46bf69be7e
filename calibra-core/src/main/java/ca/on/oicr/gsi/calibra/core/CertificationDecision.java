package ca.on.oicr.gsi.calibra.core;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.Optional;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Whether a calibration product should be certified and the evidence used to decide
 *
 * @param certify true if the product should be certified
 * @param failures for each exposure with failures, the number of times each test failed; empty
 *     if verification passed outright
 * @param failedExposures the exposures where some test reached the per-exposure threshold
 * @param maxFailuresPerDetectorPerTestType the configured per-detector threshold
 * @param maxFailedDetectors the derived detector majority
 * @param failureThresholdPerExposure the derived number of test failures that fails an exposure
 * @param maxFailedExposures the derived number of failed exposures that fails the product
 */
public record CertificationDecision(
    @JsonProperty("certify") boolean certify,
    @JsonProperty("failures") Optional<SortedMap<String, SortedMap<String, Integer>>> failures,
    @JsonProperty("failedExposures") SortedSet<String> failedExposures,
    @JsonProperty("maxFailuresPerDetectorPerTestType") int maxFailuresPerDetectorPerTestType,
    @JsonProperty("maxFailedDetectors") int maxFailedDetectors,
    @JsonProperty("failureThresholdPerExposure") int failureThresholdPerExposure,
    @JsonProperty("maxFailedExposures") int maxFailedExposures) {
  public CertificationDecision {
    failures =
        failures.map(
            f -> {
              final var copy = new TreeMap<String, SortedMap<String, Integer>>();
              f.forEach(
                  (exposure, tally) ->
                      copy.put(exposure, Collections.unmodifiableSortedMap(new TreeMap<>(tally))));
              return Collections.unmodifiableSortedMap(copy);
            });
    failedExposures = Collections.unmodifiableSortedSet(new TreeSet<>(failedExposures));
  }

  /**
   * Whether the product is certified even though some tests failed
   *
   * @return true if certified with a non-empty failure tally
   */
  public boolean isSoftPass() {
    return certify && failures.map(f -> !f.isEmpty()).orElse(false);
  }
}

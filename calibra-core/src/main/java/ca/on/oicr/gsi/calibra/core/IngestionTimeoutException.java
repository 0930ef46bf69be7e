package ca.on.oicr.gsi.calibra.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.stream.Collectors;

/**
 * Some exposures of a batch were not ingested before the timeout
 *
 * <p>The exposures that did arrive are still available as a completed partial batch.
 */
public final class IngestionTimeoutException extends Exception {
  private final Map<String, SortedSet<Integer>> missing;
  private final ExposureBatch partialBatch;

  IngestionTimeoutException(ExposureBatch partialBatch, Map<String, SortedSet<Integer>> missing) {
    super(
        String.format(
            "Timed out waiting for %s exposures to be ingested. Missing: %s",
            partialBatch.imageType(),
            missing.entrySet().stream()
                .map(e -> String.format("%s (detectors %s)", e.getKey(), e.getValue()))
                .collect(Collectors.joining(", "))));
    this.partialBatch = partialBatch;
    this.missing = Collections.unmodifiableMap(new LinkedHashMap<>(missing));
  }

  /**
   * The exposures that were not completely ingested and the detectors still outstanding for each
   *
   * @return the missing exposures, in request order
   */
  public Map<String, SortedSet<Integer>> missing() {
    return missing;
  }

  /**
   * The identifiers of the exposures that were not completely ingested
   *
   * @return the missing exposure identifiers, in request order
   */
  public List<String> missingExposureIds() {
    return List.copyOf(missing.keySet());
  }

  /** The batch made up of the exposures that were ingested */
  public ExposureBatch partialBatch() {
    return partialBatch;
  }
}

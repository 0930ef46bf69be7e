package ca.on.oicr.gsi.calibra.core;

/**
 * The limits used to decide whether a verified calibration product is good enough to certify
 *
 * @param maxFailuresPerDetectorPerTestType the number of failures of one test allowed on each
 *     detector
 * @param detectorCount the number of detectors in the product
 */
public record Thresholds(int maxFailuresPerDetectorPerTestType, int detectorCount) {
  public Thresholds {
    if (maxFailuresPerDetectorPerTestType < 0) {
      throw new IllegalArgumentException("Failure threshold cannot be negative.");
    }
    if (detectorCount < 1) {
      throw new IllegalArgumentException("At least one detector is required.");
    }
  }

  /**
   * The number of detectors that must fail a test for the exposure to fail: a strict majority
   *
   * @return <tt>floor(detectorCount / 2) + 1</tt>
   */
  public int maxFailedDetectors() {
    return detectorCount / 2 + 1;
  }

  /**
   * The number of occurrences of one test failing in one exposure that makes the exposure fail
   *
   * @return <tt>maxFailuresPerDetectorPerTestType * maxFailedDetectors</tt>
   */
  public int failureThresholdPerExposure() {
    return maxFailuresPerDetectorPerTestType * maxFailedDetectors();
  }

  /**
   * The number of failed exposures that makes the product fail: a strict majority
   *
   * @param exposureCount the number of exposures verified
   * @return <tt>floor(exposureCount / 2) + 1</tt>
   */
  public static int maxFailedExposures(int exposureCount) {
    return exposureCount / 2 + 1;
  }
}

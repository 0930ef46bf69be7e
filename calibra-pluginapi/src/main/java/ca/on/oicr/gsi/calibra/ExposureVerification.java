package ca.on.oicr.gsi.calibra;

import java.util.List;

/**
 * The verification result for one exposure
 *
 * @param success whether every test passed for this exposure
 * @param failures the tests that failed, if any
 */
public record ExposureVerification(boolean success, List<FailureRecord> failures) {
  public ExposureVerification {
    failures = List.copyOf(failures);
  }
}

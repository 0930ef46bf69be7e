package ca.on.oicr.gsi.calibra.core;

import java.util.Optional;

/**
 * The result of processing one image type or extra product
 *
 * @param name the dataset type of the product
 * @param outcome what happened
 * @param generationJobId the job that generated the product, if one was dispatched
 * @param verificationJobId the job that verified the product, if one was dispatched
 * @param decision the certification decision, if the product was verified
 * @param error why processing stopped, if it did not finish normally
 */
public record ProductReport(
    String name,
    Outcome outcome,
    Optional<String> generationJobId,
    Optional<String> verificationJobId,
    Optional<CertificationDecision> decision,
    Optional<String> error) {
  public enum Outcome {
    CANCELLED,
    CERTIFIED,
    FAILED,
    NOT_CERTIFIED,
    SKIPPED
  }

  static ProductReport cancelled(String name) {
    return new ProductReport(
        name,
        Outcome.CANCELLED,
        Optional.empty(),
        Optional.empty(),
        Optional.empty(),
        Optional.of("Did not finish before the background task timeout."));
  }

  static ProductReport failed(String name, String error) {
    return new ProductReport(
        name,
        Outcome.FAILED,
        Optional.empty(),
        Optional.empty(),
        Optional.empty(),
        Optional.of(error));
  }

  static ProductReport skipped(String name) {
    return new ProductReport(
        name,
        Outcome.SKIPPED,
        Optional.empty(),
        Optional.empty(),
        Optional.empty(),
        Optional.empty());
  }
}

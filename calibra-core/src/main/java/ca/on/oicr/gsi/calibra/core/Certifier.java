package ca.on.oicr.gsi.calibra.core;

import ca.on.oicr.gsi.calibra.CertificationRequest;
import ca.on.oicr.gsi.calibra.CertificationTool;
import ca.on.oicr.gsi.calibra.ProcessOutput;
import io.prometheus.client.Counter;
import java.io.IOException;
import java.lang.System.Logger.Level;
import java.time.Instant;

/**
 * Publishes generated calibration products into the calibration collection
 *
 * <p>Certifying the same product twice is not prevented and may create overlapping validity
 * ranges.
 */
public final class Certifier {
  static final Counter CERTIFICATIONS =
      Counter.build("calibra_certifications", "The number of products certified")
          .labelNames("dataset_type")
          .register();
  static final Counter CERTIFICATION_FAILURES =
      Counter.build(
              "calibra_certification_failures", "The number of failed certification attempts")
          .labelNames("dataset_type")
          .register();

  private final RunMonitor monitor;
  private final String repo;
  private final CertificationTool tool;

  public Certifier(CertificationTool tool, String repo, RunMonitor monitor) {
    this.tool = tool;
    this.repo = repo;
    this.monitor = monitor;
  }

  /**
   * Certify a calibration product
   *
   * @param datasetType the product's dataset type, such as <tt>bias</tt>
   * @param sourceCollection the collection the product was generated into
   * @param destinationCollection the calibration collection to publish into
   * @param validFrom the start of the validity range
   * @param validTo the end of the validity range
   * @throws CertificationException if the tool could not run or reported failure
   */
  public void certify(
      String datasetType,
      String sourceCollection,
      String destinationCollection,
      Instant validFrom,
      Instant validTo)
      throws CertificationException, InterruptedException {
    final var request =
        new CertificationRequest(
            repo, sourceCollection, destinationCollection, datasetType, validFrom, validTo);
    monitor.log(
        Level.INFO,
        String.format(
            "Certifying %s from %s into %s for %s to %s",
            datasetType, sourceCollection, destinationCollection, validFrom, validTo));
    final ProcessOutput output;
    try {
      output = tool.certify(request);
    } catch (IOException e) {
      CERTIFICATION_FAILURES.labels(datasetType).inc();
      throw new CertificationException(
          String.format("Cannot run certification of %s from %s.", datasetType, sourceCollection),
          e);
    }
    monitor.log(
        Level.DEBUG,
        String.format("Certification of %s returned %d", datasetType, output.exitCode()));
    if (!output.success()) {
      CERTIFICATION_FAILURES.labels(datasetType).inc();
      monitor.log(Level.DEBUG, output.standardOutput());
      monitor.log(Level.ERROR, output.standardError());
      throw new CertificationException(
          String.format(
              "Certification of %s from %s failed with exit code %d: %s",
              datasetType, sourceCollection, output.exitCode(), output.standardError().trim()),
          output.exitCode(),
          output.standardOutput() + output.standardError());
    }
    CERTIFICATIONS.labels(datasetType).inc();
  }
}

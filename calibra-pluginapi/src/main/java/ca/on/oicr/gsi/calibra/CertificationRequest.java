package ca.on.oicr.gsi.calibra;

import java.time.Instant;

/**
 * A request to publish a calibration product into a calibration collection
 *
 * @param repo the data repository to operate on
 * @param sourceCollection the collection holding the generated product
 * @param destinationCollection the long-lived calibration collection
 * @param datasetType the dataset type of the product, such as <tt>bias</tt>
 * @param validFrom the start of the validity range
 * @param validTo the end of the validity range
 */
public record CertificationRequest(
    String repo,
    String sourceCollection,
    String destinationCollection,
    String datasetType,
    Instant validFrom,
    Instant validTo) {
  public CertificationRequest {
    if (!validFrom.isBefore(validTo)) {
      throw new IllegalArgumentException(
          String.format("Validity range %s to %s is empty.", validFrom, validTo));
    }
  }
}

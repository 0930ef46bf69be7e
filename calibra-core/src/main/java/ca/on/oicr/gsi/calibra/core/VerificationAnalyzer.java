package ca.on.oicr.gsi.calibra.core;

import ca.on.oicr.gsi.calibra.DataRepository;
import ca.on.oicr.gsi.calibra.ExposureVerification;
import ca.on.oicr.gsi.calibra.ImageType;
import ca.on.oicr.gsi.calibra.VerificationSummary;
import io.prometheus.client.Counter;
import java.io.IOException;
import java.lang.System.Logger.Level;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Decides whether a calibration product passed verification well enough to be certified
 *
 * <p>A product with failed tests can still be certified. An exposure fails when any one test
 * fails at least {@link Thresholds#failureThresholdPerExposure()} times in it, and the product
 * fails only when a majority of its exposures fail.
 */
public final class VerificationAnalyzer {
  static final Counter DECISIONS =
      Counter.build(
              "calibra_certification_decisions",
              "The number of verification analyses by outcome")
          .labelNames("image_type", "decision")
          .register();

  /**
   * Apply the certification thresholds to a verification summary
   *
   * <p>This is a pure function of its inputs.
   *
   * @param summary the verification statistics
   * @param thresholds the limits to apply
   * @return the decision and the tally it was based on
   */
  public static CertificationDecision decide(VerificationSummary summary, Thresholds thresholds) {
    final var perExposure = thresholds.failureThresholdPerExposure();
    final var maxFailedExposures = Thresholds.maxFailedExposures(summary.exposures().size());
    if (summary.success()) {
      return new CertificationDecision(
          true,
          Optional.empty(),
          new TreeSet<>(),
          thresholds.maxFailuresPerDetectorPerTestType(),
          thresholds.maxFailedDetectors(),
          perExposure,
          maxFailedExposures);
    }
    final var failures = new TreeMap<String, SortedMap<String, Integer>>();
    final var failedExposures = new TreeSet<String>();
    for (final var exposure : summary.exposures().entrySet()) {
      if (exposure.getValue().failures().isEmpty()) {
        continue;
      }
      final var tally = new TreeMap<String, Integer>();
      for (final var failure : exposure.getValue().failures()) {
        tally.merge(failure.testName(), 1, Integer::sum);
      }
      failures.put(exposure.getKey(), tally);
      if (tally.values().stream().anyMatch(count -> count >= perExposure)) {
        failedExposures.add(exposure.getKey());
      }
    }
    return new CertificationDecision(
        failedExposures.size() < maxFailedExposures,
        Optional.of(failures),
        failedExposures,
        thresholds.maxFailuresPerDetectorPerTestType(),
        thresholds.maxFailedDetectors(),
        perExposure,
        maxFailedExposures);
  }

  private final String collectionPrefix;
  private final String instrument;
  private final RunMonitor monitor;
  private final Duration pollInterval;
  private final Duration readTimeout;
  private final DataRepository repository;

  public VerificationAnalyzer(
      DataRepository repository,
      String instrument,
      String collectionPrefix,
      Duration readTimeout,
      Duration pollInterval,
      RunMonitor monitor) {
    this.repository = repository;
    this.instrument = instrument;
    this.collectionPrefix = collectionPrefix;
    this.readTimeout = readTimeout;
    this.pollInterval = pollInterval;
    this.monitor = monitor;
  }

  /**
   * Read the verification output of a job and decide whether to certify
   *
   * <p>Entries for exposures that were not selected for verification are left out of the decision.
   *
   * @param type the image type verified
   * @param verifyJobId the verification job whose output should be read
   * @param exposureIds the exposures selected for the verification job
   * @param generationJobId the generation job whose output is also searched, if there was one
   * @param thresholds the limits to apply
   * @return the decision
   * @throws VerificationReadException if the output could not be read or did not appear in time
   */
  public CertificationDecision checkVerification(
      ImageType type,
      String verifyJobId,
      Collection<String> exposureIds,
      Optional<String> generationJobId,
      Thresholds thresholds)
      throws VerificationReadException, InterruptedException {
    final var collections = new ArrayList<String>();
    collections.add(collectionPrefix + verifyJobId);
    generationJobId.map(id -> collectionPrefix + id).ifPresent(collections::add);

    final var summary =
        selectedOnly(type, verifyJobId, readSummary(type, verifyJobId, collections), exposureIds);
    final var decision = decide(summary, thresholds);
    DECISIONS.labels(type.name(), decision.certify() ? "certify" : "reject").inc();
    if (summary.success()) {
      monitor.log(
          Level.INFO,
          String.format("%s verification job %s passed all tests.", type, verifyJobId));
    } else if (decision.certify()) {
      monitor.log(
          Level.WARNING,
          String.format(
              "%s verification job %s had failures but only %d of %d exposures exceeded %d"
                  + " failures of a single test (limit %d); certifying anyway. Failures: %s",
              type,
              verifyJobId,
              decision.failedExposures().size(),
              summary.exposures().size(),
              decision.failureThresholdPerExposure(),
              decision.maxFailedExposures(),
              decision.failures().orElseThrow()));
    } else {
      monitor.log(
          Level.ERROR,
          String.format(
              "%s verification job %s failed: %d of %d exposures %s exceeded %d failures of a"
                  + " single test (limit %d). Failures: %s",
              type,
              verifyJobId,
              decision.failedExposures().size(),
              summary.exposures().size(),
              decision.failedExposures(),
              decision.failureThresholdPerExposure(),
              decision.maxFailedExposures(),
              decision.failures().orElseThrow()));
    }
    return decision;
  }

  private VerificationSummary selectedOnly(
      ImageType type,
      String verifyJobId,
      VerificationSummary summary,
      Collection<String> exposureIds) {
    final var selected = new HashSet<>(exposureIds);
    final var kept = new TreeMap<String, ExposureVerification>();
    final var extra = new TreeSet<String>();
    for (final var exposure : summary.exposures().entrySet()) {
      if (selected.contains(exposure.getKey())) {
        kept.put(exposure.getKey(), exposure.getValue());
      } else {
        extra.add(exposure.getKey());
      }
    }
    if (extra.isEmpty()) {
      return summary;
    }
    monitor.log(
        Level.WARNING,
        String.format(
            "%s verification output of job %s has exposures %s that were not selected; ignoring"
                + " them.",
            type, verifyJobId, extra));
    return new VerificationSummary(summary.success(), kept);
  }

  private VerificationSummary readSummary(
      ImageType type, String verifyJobId, ArrayList<String> collections)
      throws VerificationReadException, InterruptedException {
    final var deadline = System.nanoTime() + readTimeout.toNanos();
    while (true) {
      final Optional<VerificationSummary> summary;
      try {
        summary = repository.verificationSummary(type, instrument, collections);
      } catch (IOException | RuntimeException e) {
        throw new VerificationReadException(
            String.format(
                "Cannot read %s verification output of job %s from %s: %s",
                type, verifyJobId, collections, e.getMessage()),
            e);
      }
      if (summary.isPresent()) {
        return summary.get();
      }
      final var remaining = deadline - System.nanoTime();
      if (remaining <= 0) {
        throw new VerificationReadException(
            String.format(
                "%s verification output of job %s did not appear in %s after %s.",
                type, verifyJobId, collections, readTimeout));
      }
      monitor.log(
          Level.DEBUG,
          String.format("Waiting for %s verification output in %s", type, collections));
      Thread.sleep(Math.max(1, Math.min(pollInterval.toMillis(), remaining / 1_000_000)));
    }
  }
}

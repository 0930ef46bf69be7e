package ca.on.oicr.gsi.calibra.core;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import ca.on.oicr.gsi.calibra.ExposureVerification;
import ca.on.oicr.gsi.calibra.FailureRecord;
import ca.on.oicr.gsi.calibra.ImageType;
import ca.on.oicr.gsi.calibra.VerificationSummary;
import java.lang.System.Logger.Level;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;
import org.junit.Test;

public class VerificationAnalyzerTest {
  static final List<String> EXPOSURES = List.of("exp0", "exp1", "exp2", "exp3", "exp4");

  /** Five exposures, the first <tt>failing</tt> of which have 41 NOISE failures */
  static VerificationSummary summary(int failing) {
    return summary(EXPOSURES, failing);
  }

  static VerificationSummary summary(List<String> exposureIds, int failing) {
    final var exposures = new TreeMap<String, ExposureVerification>();
    for (var i = 0; i < exposureIds.size(); i++) {
      final var failures = new ArrayList<FailureRecord>();
      if (i < failing) {
        for (var f = 0; f < 41; f++) {
          failures.add(new FailureRecord("R22_S" + (f % 9), "C" + f, "NOISE"));
        }
      } else {
        failures.add(new FailureRecord("R22_S00", "C00", "MEAN"));
      }
      exposures.put(exposureIds.get(i), new ExposureVerification(false, failures));
    }
    return new VerificationSummary(false, exposures);
  }

  private final RecordingRunMonitor monitor = new RecordingRunMonitor();

  @Test
  public void whenSummarySucceeds_certifyWithoutFailures() {
    final var decision =
        VerificationAnalyzer.decide(
            new VerificationSummary(true, new TreeMap<>()), new Thresholds(8, 9));
    assertTrue(decision.certify());
    assertFalse(decision.failures().isPresent());
    assertFalse(decision.isSoftPass());
  }

  @Test
  public void whenMinorityOfExposuresFail_softPass() {
    final var decision = VerificationAnalyzer.decide(summary(2), new Thresholds(8, 9));
    assertEquals(5, decision.maxFailedDetectors());
    assertEquals(40, decision.failureThresholdPerExposure());
    assertEquals(3, decision.maxFailedExposures());
    assertEquals(List.of("exp0", "exp1"), List.copyOf(decision.failedExposures()));
    assertEquals(Integer.valueOf(41), decision.failures().get().get("exp0").get("NOISE"));
    assertEquals(Integer.valueOf(1), decision.failures().get().get("exp4").get("MEAN"));
    assertTrue(decision.certify());
    assertTrue(decision.isSoftPass());
  }

  @Test
  public void whenMajorityOfExposuresFail_doNotCertify() {
    final var decision = VerificationAnalyzer.decide(summary(3), new Thresholds(8, 9));
    assertEquals(3, decision.failedExposures().size());
    assertFalse(decision.certify());
  }

  @Test
  public void whenThresholdExactlyReached_exposureFails() {
    // 41 failures against 8 * 5 = 40 fails; against 9 * 5 = 45 it passes
    assertEquals(
        3, VerificationAnalyzer.decide(summary(3), new Thresholds(8, 9)).failedExposures().size());
    assertEquals(
        0, VerificationAnalyzer.decide(summary(3), new Thresholds(9, 9)).failedExposures().size());
  }

  @Test
  public void testRaisingThresholdNeverRevokesCertification() {
    for (var failing = 0; failing <= 5; failing++) {
      final var summary = summary(failing);
      var certified = false;
      for (var limit = 0; limit <= 12; limit++) {
        final var decision = VerificationAnalyzer.decide(summary, new Thresholds(limit, 9));
        if (certified) {
          assertTrue(
              String.format("failing=%d limit=%d", failing, limit), decision.certify());
        }
        certified = decision.certify();
      }
      assertTrue(certified);
    }
  }

  @Test
  public void testDecisionIsDeterministic() throws Exception {
    final var repository = new FakeDataRepository();
    repository.put(ImageType.DARK, summary(2));
    final var analyzer =
        new VerificationAnalyzer(
            repository,
            "LSSTComCam",
            "u/ocps/",
            Duration.ofSeconds(1),
            Duration.ofMillis(5),
            monitor);
    final var first =
        analyzer.checkVerification(
            ImageType.DARK, "job-2", EXPOSURES, Optional.of("job-1"), new Thresholds(8, 9));
    final var second =
        analyzer.checkVerification(
            ImageType.DARK, "job-2", EXPOSURES, Optional.of("job-1"), new Thresholds(8, 9));
    assertEquals(first, second);
    assertEquals(List.of("u/ocps/job-2", "u/ocps/job-1"), repository.reads().get(0));
    assertTrue(monitor.contains(Level.WARNING, "certifying anyway"));
  }

  @Test
  public void whenRejected_errorLogged() throws Exception {
    final var repository = new FakeDataRepository();
    repository.put(ImageType.FLAT, summary(4));
    final var analyzer =
        new VerificationAnalyzer(
            repository,
            "LSSTComCam",
            "u/ocps/",
            Duration.ofSeconds(1),
            Duration.ofMillis(5),
            monitor);
    final var decision =
        analyzer.checkVerification(
            ImageType.FLAT, "job-9", EXPOSURES, Optional.empty(), new Thresholds(8, 9));
    assertFalse(decision.certify());
    assertEquals(List.of("u/ocps/job-9"), repository.reads().get(0));
    assertTrue(monitor.contains(Level.ERROR, "job-9"));
  }

  @Test
  public void whenOutputAppearsLater_analyzerWaits() throws Exception {
    final var repository = new FakeDataRepository();
    repository.put(ImageType.BIAS, new VerificationSummary(true, new TreeMap<>()));
    repository.readsBeforeAvailable(3);
    final var analyzer =
        new VerificationAnalyzer(
            repository, "LATISS", "u/ocps/", Duration.ofSeconds(5), Duration.ofMillis(1), monitor);
    assertTrue(
        analyzer
            .checkVerification(
                ImageType.BIAS, "job-2", EXPOSURES, Optional.of("job-1"), new Thresholds(8, 1))
            .certify());
    assertEquals(4, repository.reads().size());
  }

  @Test
  public void whenOutputNeverAppears_readFails() throws Exception {
    final var analyzer =
        new VerificationAnalyzer(
            new FakeDataRepository(),
            "LATISS",
            "u/ocps/",
            Duration.ofMillis(30),
            Duration.ofMillis(5),
            monitor);
    try {
      analyzer.checkVerification(
          ImageType.BIAS, "job-2", EXPOSURES, Optional.empty(), new Thresholds(8, 1));
      fail("Expected read failure");
    } catch (VerificationReadException e) {
      assertTrue(e.getMessage().contains("job-2"));
    }
  }

  @Test(expected = VerificationReadException.class)
  public void whenRepositoryBroken_readFails() throws Exception {
    final var repository = new FakeDataRepository();
    repository.broken();
    new VerificationAnalyzer(
            repository, "LATISS", "u/ocps/", Duration.ofSeconds(1), Duration.ofMillis(5), monitor)
        .checkVerification(
            ImageType.BIAS, "job-2", EXPOSURES, Optional.empty(), new Thresholds(8, 1));
  }

  @Test
  public void whenOutputHasUnselectedExposures_theyAreIgnored() throws Exception {
    final var repository = new FakeDataRepository();
    repository.put(ImageType.DARK, summary(2));
    final var analyzer =
        new VerificationAnalyzer(
            repository,
            "LSSTComCam",
            "u/ocps/",
            Duration.ofSeconds(1),
            Duration.ofMillis(5),
            monitor);
    final var decision =
        analyzer.checkVerification(
            ImageType.DARK,
            "job-2",
            List.of("exp0", "exp1", "exp2"),
            Optional.of("job-1"),
            new Thresholds(8, 9));
    assertFalse(decision.certify());
    assertEquals(2, decision.maxFailedExposures());
    assertEquals(List.of("exp0", "exp1"), List.copyOf(decision.failedExposures()));
    assertTrue(monitor.contains(Level.WARNING, "[exp3, exp4]"));
  }
}

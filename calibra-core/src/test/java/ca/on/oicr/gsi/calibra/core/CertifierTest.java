package ca.on.oicr.gsi.calibra.core;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.lang.System.Logger.Level;
import java.time.Instant;
import java.util.Optional;
import org.junit.Test;

public class CertifierTest {
  private static final Instant FROM = Instant.parse("1950-01-01T00:00:00Z");
  private static final Instant TO = Instant.parse("2050-01-01T00:00:00Z");

  private final RecordingRunMonitor monitor = new RecordingRunMonitor();
  private final FakeCertificationTool tool = new FakeCertificationTool();

  @Test
  public void testRequestCarriesRepositoryAndRange() throws Exception {
    new Certifier(tool, "/repo/LATISS", monitor)
        .certify("bias", "u/ocps/job-1", "LATISS/calib/daily", FROM, TO);
    final var request = tool.requests().get(0);
    assertEquals("/repo/LATISS", request.repo());
    assertEquals("u/ocps/job-1", request.sourceCollection());
    assertEquals("LATISS/calib/daily", request.destinationCollection());
    assertEquals("bias", request.datasetType());
    assertEquals(FROM, request.validFrom());
    assertEquals(TO, request.validTo());
  }

  @Test
  public void whenToolExitsNonZero_failureCarriesOutput() throws Exception {
    tool.fail("dark");
    try {
      new Certifier(tool, "/repo/LATISS", monitor)
          .certify("dark", "u/ocps/job-3", "LATISS/calib/daily", FROM, TO);
      fail("Expected certification failure");
    } catch (CertificationException e) {
      assertEquals(Optional.of(1), e.exitCode());
      assertTrue(e.output().contains("Collection does not exist"));
    }
    assertTrue(monitor.contains(Level.ERROR, "Collection does not exist"));
  }

  @Test
  public void whenToolCannotRun_failureHasNoExitCode() throws Exception {
    tool.unavailable();
    try {
      new Certifier(tool, "/repo/LATISS", monitor)
          .certify("flat", "u/ocps/job-5", "LATISS/calib/daily", FROM, TO);
      fail("Expected certification failure");
    } catch (CertificationException e) {
      assertFalse(e.exitCode().isPresent());
    }
  }
}

package ca.on.oicr.gsi.calibra.sh;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import ca.on.oicr.gsi.calibra.CertificationRequest;
import ca.on.oicr.gsi.calibra.CertificationTool;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import org.junit.Test;

public class ButlerCertificationToolTest {
  private static final CertificationRequest REQUEST =
      new CertificationRequest(
          "/repo/LATISS",
          "u/ocps/job-1",
          "LATISS/calib/daily",
          "bias",
          Instant.parse("1950-01-01T00:00:00Z"),
          Instant.parse("2050-01-01T12:30:00Z"));

  private static ButlerCertificationTool tool(String... command) {
    final var tool = new ButlerCertificationTool();
    tool.setCommand(List.of(command));
    tool.startup();
    return tool;
  }

  @Test
  public void testCommandLine() {
    assertEquals(
        List.of(
            "butler",
            "certify-calibrations",
            "/repo/LATISS",
            "u/ocps/job-1",
            "LATISS/calib/daily",
            "bias",
            "--begin-date",
            "1950-01-01T00:00:00",
            "--end-date",
            "2050-01-01T12:30:00"),
        new ButlerCertificationTool().commandLine(REQUEST));
  }

  @Test
  public void whenCommandSucceeds_outputIsCaptured() throws Exception {
    final var output = tool("echo").certify(REQUEST);
    assertTrue(output.success());
    assertTrue(output.standardOutput().startsWith("certify-calibrations /repo/LATISS"));
  }

  @Test
  public void whenCommandFails_exitCodeAndErrorAreCaptured() throws Exception {
    final var output = tool("sh", "-c", "echo 'Dataset not found' >&2; exit 3").certify(REQUEST);
    assertFalse(output.success());
    assertEquals(3, output.exitCode());
    assertEquals("Dataset not found\n", output.standardError());
  }

  @Test
  public void whenCommandTakesTooLong_itIsKilled() throws Exception {
    final var tool = tool("sh", "-c", "sleep 30");
    tool.setMaximumWaitSeconds(1L);
    try {
      tool.certify(REQUEST);
      fail("Expected process to be killed");
    } catch (IOException e) {
      assertTrue(e.getMessage().startsWith("Killed process"));
    }
  }

  @Test
  public void testLoadedFromConfiguration() throws Exception {
    final var tool =
        new ObjectMapper()
            .readValue(
                "{\"type\": \"butler\", \"command\": [\"/opt/lsst/bin/butler\"],"
                    + " \"maximumWaitSeconds\": 600}",
                CertificationTool.class);
    assertTrue(tool instanceof ButlerCertificationTool);
    final var butler = (ButlerCertificationTool) tool;
    assertEquals(Long.valueOf(600), butler.getMaximumWaitSeconds());
    assertEquals("/opt/lsst/bin/butler", butler.commandLine(REQUEST).get(0));
  }

  @Test(expected = IllegalArgumentException.class)
  public void whenNoCommand_startupFails() {
    tool();
  }
}

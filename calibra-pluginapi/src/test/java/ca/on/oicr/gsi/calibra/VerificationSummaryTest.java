package ca.on.oicr.gsi.calibra;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.TreeSet;
import org.junit.Test;

public class VerificationSummaryTest {
  private final ObjectMapper mapper = new ObjectMapper();

  @Test
  public void testReadsExposuresAndFailures() throws Exception {
    final var summary =
        VerificationSummary.fromJson(
            mapper.readTree(
                "{\"SUCCESS\": false,"
                    + " \"2024010100001\": {\"SUCCESS\": false, \"FAILURES\":"
                    + " [\"R22_S21 C17 NOISE\", \"R22_S21 C10 MEAN\"]},"
                    + " \"2024010100002\": {\"SUCCESS\": true, \"FAILURES\": []},"
                    + " \"VERSION\": 3}"));
    assertFalse(summary.success());
    assertEquals(
        List.of("2024010100001", "2024010100002"), List.copyOf(summary.exposures().keySet()));
    final var failed = summary.exposures().get("2024010100001");
    assertFalse(failed.success());
    assertEquals(
        List.of(
            new FailureRecord("R22_S21", "C17", "NOISE"),
            new FailureRecord("R22_S21", "C10", "MEAN")),
        failed.failures());
    assertTrue(summary.exposures().get("2024010100002").success());
  }

  @Test
  public void whenExposureHasNoFlag_successFollowsFailures() throws Exception {
    final var summary =
        VerificationSummary.fromJson(
            mapper.readTree(
                "{\"SUCCESS\": false, \"a\": {\"FAILURES\": [\"NOISE\"]}, \"b\": {}}"));
    assertFalse(summary.exposures().get("a").success());
    assertTrue(summary.exposures().get("b").success());
  }

  @Test(expected = IllegalArgumentException.class)
  public void whenNoOverallFlag_rejected() throws Exception {
    VerificationSummary.fromJson(mapper.readTree("{\"a\": {\"SUCCESS\": true}}"));
  }

  @Test
  public void testQueryOmitsDetectorsWhenAllAreUsed() {
    final var selection =
        new DataSelection("LATISS", new TreeSet<>(), List.of("1", "2"));
    assertEquals("instrument='LATISS' AND exposure IN (1, 2)", selection.toQuery());
  }

  @Test
  public void testQueryListsDetectors() {
    final var selection =
        new DataSelection("LSSTComCam", new TreeSet<>(List.of(4, 0)), List.of("7"));
    assertEquals(
        "instrument='LSSTComCam' AND detector IN (0, 4) AND exposure IN (7)",
        selection.toQuery());
  }
}

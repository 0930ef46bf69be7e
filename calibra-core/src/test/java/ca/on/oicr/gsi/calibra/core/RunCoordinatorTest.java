package ca.on.oicr.gsi.calibra.core;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import ca.on.oicr.gsi.calibra.ExposureRequest;
import ca.on.oicr.gsi.calibra.ExposureVerification;
import ca.on.oicr.gsi.calibra.ImageType;
import ca.on.oicr.gsi.calibra.PipelineRequest;
import ca.on.oicr.gsi.calibra.VerificationSummary;
import java.time.Duration;
import java.util.List;
import java.util.TreeMap;
import java.util.stream.Collectors;
import org.junit.After;
import org.junit.Test;

public class RunCoordinatorTest {
  private static final String BASE =
      "\"instrument\": \"LATISS\", \"bias\": {\"count\": 3, \"discard\": 1},"
          + " \"dark\": {\"count\": 2, \"exposureTimes\": 30},"
          + " \"flat\": {\"count\": 2, \"exposureTimes\": [1, 2], \"filter\": \"empty\"},"
          + " \"imageInOodsTimeout\": \"PT2S\", \"jobResultTimeout\": \"PT5S\","
          + " \"verificationReadTimeout\": \"PT1S\", \"verificationPollInterval\": \"PT0.01S\"";

  private static CalibrationConfiguration configuration(String extra) throws Exception {
    return CalibrationConfiguration.parse(
        "{" + BASE + (extra.isEmpty() ? "" : ", " + extra) + "}");
  }

  private static VerificationSummary passing() {
    return new VerificationSummary(true, new TreeMap<>());
  }

  private final FakeCertificationTool certificationTool = new FakeCertificationTool();
  private final FakeExecutionService executionService = new FakeExecutionService();
  private final FakeInstrument instrument = new FakeInstrument(List.of(0));
  private final RecordingRunMonitor monitor = new RecordingRunMonitor();
  private final FakeDataRepository repository = new FakeDataRepository();

  {
    repository.put(ImageType.BIAS, passing());
    repository.put(ImageType.DARK, passing());
    repository.put(ImageType.FLAT, passing());
  }

  private RunCoordinator coordinator(CalibrationConfiguration configuration) {
    return new RunCoordinator(
        configuration, instrument, executionService, repository, certificationTool, monitor);
  }

  private List<String> pipelinesRun() {
    return executionService.requests().stream()
        .map(PipelineRequest::pipeline)
        .map(p -> p.substring(p.lastIndexOf('/') + 1))
        .sorted()
        .collect(Collectors.toList());
  }

  private PipelineRequest request(String file) {
    return executionService.requests().stream()
        .filter(r -> r.pipeline().endsWith("/" + file))
        .findFirst()
        .orElseThrow();
  }

  @After
  public void shutdown() {
    executionService.shutdown();
  }

  @Test
  public void whenBiasesPassVerification_theyAreCertified() throws Exception {
    final var coordinator =
        coordinator(
            configuration("\"scriptMode\": \"BIAS\", \"bias\": {\"count\": 20, \"discard\": 1}"));
    final var summary = coordinator.run();

    assertEquals(19, summary.exposureIds().get(ImageType.BIAS).size());
    assertEquals(20, summary.imagesTaken());
    final var bias = summary.product("bias").orElseThrow();
    assertEquals(ProductReport.Outcome.CERTIFIED, bias.outcome());
    assertEquals("job-1", bias.generationJobId().orElseThrow());
    assertEquals("job-2", bias.verificationJobId().orElseThrow());
    assertTrue(bias.decision().orElseThrow().certify());
    assertFalse(bias.decision().orElseThrow().failures().isPresent());

    final var generation = request("cpBias.yaml");
    assertEquals("${CP_PIPE_DIR}/pipelines/LATISS/cpBias.yaml", generation.pipeline());
    assertEquals("-j 8 -i LATISS/calib --register-dataset-types", generation.config());
    assertEquals(
        summary.exposureIds().get(ImageType.BIAS), generation.selection().exposureIds());
    assertEquals(
        "-j 8 -i LATISS/calib -i u/ocps/job-1 --register-dataset-types",
        request("verifyBias.yaml").config());
    assertEquals(List.of("u/ocps/job-2", "u/ocps/job-1"), repository.reads().get(0));

    final var certification = certificationTool.requests().get(0);
    assertEquals("u/ocps/job-1", certification.sourceCollection());
    assertEquals("LATISS/calib/daily", certification.destinationCollection());
    assertEquals("/repo/LATISS", certification.repo());
    assertEquals(RunState.Phase.DONE, coordinator.state().phase());
    assertEquals(List.of(), coordinator.state().inFlight());
  }

  @Test
  public void testFullRunWithExtraProducts() throws Exception {
    final var coordinator =
        coordinator(
            configuration(
                "\"doDefects\": true, \"doPtc\": true, \"doGainFromFlatPairs\": true,"
                    + " \"nProcesses\": 2, \"ptc\": {\"configOptions\": \"-c a=b\"}"));
    final var summary = coordinator.run();

    assertEquals(
        List.of("bias", "dark", "flat", "defects", "ptc", "gain"),
        summary.products().stream().map(ProductReport::name).collect(Collectors.toList()));
    assertEquals(
        List.of("bias", "dark", "flat", "defects", "ptc", "gain"),
        summary.productsWith(ProductReport.Outcome.CERTIFIED));
    assertEquals(
        List.of(
            "cpBias.yaml",
            "cpDark.yaml",
            "cpDefects.yaml",
            "cpFlat.yaml",
            "cpPtc.yaml",
            "cpPtcGainFromFlatPairs.yaml",
            "verifyBias.yaml",
            "verifyDark.yaml",
            "verifyFlat.yaml"),
        pipelinesRun());
    assertEquals(7, summary.imagesTaken());
    assertEquals(
        List.of(
            FakeInstrument.exposureId(4),
            FakeInstrument.exposureId(5),
            FakeInstrument.exposureId(6),
            FakeInstrument.exposureId(7)),
        request("cpDefects.yaml").selection().exposureIds());
    assertEquals(
        List.of(FakeInstrument.exposureId(6), FakeInstrument.exposureId(7)),
        request("cpPtc.yaml").selection().exposureIds());
    assertEquals(
        "-j 2 -i LATISS/calib --register-dataset-types -c a=b", request("cpPtc.yaml").config());
    assertEquals(
        List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)),
        instrument.requests().stream()
            .filter(r -> r.type() == ImageType.FLAT)
            .map(ExposureRequest::exposureTime)
            .collect(Collectors.toList()));
    assertTrue(summary.toJson().contains("\"CERTIFIED\""));
  }

  @Test
  public void whenPtcTaskThrows_mainSequenceStillFinishes() throws Exception {
    executionService.explode("cpPtc.yaml");
    final var coordinator = coordinator(configuration("\"doPtc\": true"));
    final var summary = coordinator.run();

    assertEquals(
        List.of("bias", "dark", "flat"), summary.productsWith(ProductReport.Outcome.CERTIFIED));
    final var ptc = summary.product("ptc").orElseThrow();
    assertEquals(ProductReport.Outcome.FAILED, ptc.outcome());
    assertTrue(ptc.error().orElseThrow().contains("Connection to execution service lost"));
    assertEquals(RunState.Phase.DONE, coordinator.state().phase());
  }

  @Test
  public void whenPtcJobFails_itIsReportedSeparately() throws Exception {
    executionService.phase("cpPtc.yaml", "failed");
    final var summary = coordinator(configuration("\"doPtc\": true")).run();

    assertEquals(ProductReport.Outcome.FAILED, summary.product("ptc").orElseThrow().outcome());
    assertEquals(List.of("bias", "dark", "flat"), certificationTool.certified());
    assertTrue(monitor.contains(System.Logger.Level.ERROR, "ptc"));
  }

  @Test
  public void whenVerificationDisabled_certifyStraightAfterGeneration() throws Exception {
    final var coordinator =
        new RunCoordinator(
            configuration("\"doVerify\": false"),
            instrument,
            executionService,
            null,
            certificationTool,
            monitor);
    final var summary = coordinator.run();

    assertEquals(
        List.of("bias", "dark", "flat"), summary.productsWith(ProductReport.Outcome.CERTIFIED));
    assertEquals(List.of("cpBias.yaml", "cpDark.yaml", "cpFlat.yaml"), pipelinesRun());
    assertFalse(summary.product("dark").orElseThrow().decision().isPresent());
  }

  @Test
  public void whenStaleVerificationEntriesPresent_onlySelectedExposuresCount() throws Exception {
    final var stale = new TreeMap<String, ExposureVerification>();
    stale.putAll(
        VerificationAnalyzerTest.summary(List.of("2023123100001", "2023123100002"), 2)
            .exposures());
    stale.putAll(
        VerificationAnalyzerTest.summary(
                List.of(FakeInstrument.exposureId(4), FakeInstrument.exposureId(5)), 0)
            .exposures());
    repository.put(ImageType.DARK, new VerificationSummary(false, stale));
    final var summary = coordinator(configuration("")).run();

    final var dark = summary.product("dark").orElseThrow();
    assertEquals(ProductReport.Outcome.CERTIFIED, dark.outcome());
    assertEquals(2, dark.decision().orElseThrow().maxFailedExposures());
    assertTrue(dark.decision().orElseThrow().failedExposures().isEmpty());
    assertTrue(monitor.contains(System.Logger.Level.WARNING, "2023123100001"));
  }

  @Test
  public void whenGenerationDisabled_imagesAreOnlyTaken() throws Exception {
    final var coordinator =
        new RunCoordinator(
            configuration("\"generateCalibrations\": false"),
            instrument,
            executionService,
            null,
            null,
            monitor);
    final var summary = coordinator.run();

    assertEquals(
        List.of("bias", "dark", "flat"), summary.productsWith(ProductReport.Outcome.SKIPPED));
    assertEquals(List.of(), executionService.requests());
    assertEquals(2, summary.exposureIds().get(ImageType.DARK).size());
    assertEquals(7, summary.imagesTaken());
  }

  @Test
  public void whenBackgroundTimeoutFires_unfinishedPipelinesAreCancelled() throws Exception {
    executionService.silent("cpDark.yaml");
    executionService.silent("cpFlat.yaml");
    final var coordinator =
        coordinator(
            configuration("\"backgroundTaskTimeout\": \"PT0.5S\", \"jobResultTimeout\": \"PT1M\""));
    final var summary = coordinator.run();

    assertEquals(ProductReport.Outcome.CERTIFIED, summary.product("bias").orElseThrow().outcome());
    assertEquals(
        List.of("dark", "flat"), summary.productsWith(ProductReport.Outcome.CANCELLED));
    assertEquals(List.of("bias"), certificationTool.certified());
    assertEquals(RunState.Phase.DONE, coordinator.state().phase());
  }

  @Test
  public void whenMajorityOfExposuresFail_productIsNotCertified() throws Exception {
    repository.put(
        ImageType.DARK,
        VerificationAnalyzerTest.summary(
            List.of(FakeInstrument.exposureId(4), FakeInstrument.exposureId(5)), 2));
    final var summary = coordinator(configuration("")).run();

    final var dark = summary.product("dark").orElseThrow();
    assertEquals(ProductReport.Outcome.NOT_CERTIFIED, dark.outcome());
    assertEquals(2, dark.decision().orElseThrow().failedExposures().size());
    assertEquals(List.of("bias", "flat"), certificationTool.certified());
  }

  @Test
  public void whenFlatsInfeasible_dependentProductsFail() throws Exception {
    instrument.infeasible(ImageType.FLAT);
    final var summary = coordinator(configuration("\"doDefects\": true")).run();

    assertEquals(List.of("bias", "dark"), summary.productsWith(ProductReport.Outcome.CERTIFIED));
    assertEquals(List.of("flat", "defects"), summary.productsWith(ProductReport.Outcome.FAILED));
    assertTrue(summary.product("flat").orElseThrow().error().orElseThrow().contains("Dome"));
    assertEquals(5, summary.imagesTaken());
  }

  @Test
  public void whenInstrumentThrowsUnchecked_onlyThatTypeFails() throws Exception {
    instrument.broken(ImageType.DARK);
    final var coordinator = coordinator(configuration(""));
    final var summary = coordinator.run();

    assertEquals(List.of("bias", "flat"), summary.productsWith(ProductReport.Outcome.CERTIFIED));
    final var dark = summary.product("dark").orElseThrow();
    assertEquals(ProductReport.Outcome.FAILED, dark.outcome());
    assertTrue(dark.error().orElseThrow().contains("Shutter controller fault"));
    assertEquals(RunState.Phase.DONE, coordinator.state().phase());
  }

  @Test
  public void whenCertificationFails_siblingsAreCertified() throws Exception {
    certificationTool.fail("dark");
    final var summary = coordinator(configuration("")).run();

    final var dark = summary.product("dark").orElseThrow();
    assertEquals(ProductReport.Outcome.FAILED, dark.outcome());
    assertTrue(dark.decision().orElseThrow().certify());
    assertEquals(List.of("bias", "flat"), summary.productsWith(ProductReport.Outcome.CERTIFIED));
  }

  @Test
  public void whenDispatchRejected_onlyThatTypeFails() throws Exception {
    executionService.reject("cpFlat.yaml");
    final var summary = coordinator(configuration("")).run();

    assertEquals(List.of("flat"), summary.productsWith(ProductReport.Outcome.FAILED));
    assertFalse(summary.product("flat").orElseThrow().generationJobId().isPresent());
    assertEquals(List.of("bias", "dark"), certificationTool.certified());
  }

  @Test
  public void whenSomeExposuresNotIngested_processingUsesTheRest() throws Exception {
    instrument.dropExposure(4);
    final var summary =
        coordinator(
                configuration(
                    "\"scriptMode\": \"BIAS_DARK\", \"imageInOodsTimeout\": \"PT0.2S\""))
            .run();

    assertEquals(
        List.of(FakeInstrument.exposureId(5)), summary.exposureIds().get(ImageType.DARK));
    assertEquals(
        List.of(FakeInstrument.exposureId(5)), request("cpDark.yaml").selection().exposureIds());
    assertEquals(ProductReport.Outcome.CERTIFIED, summary.product("dark").orElseThrow().outcome());
    assertEquals(5, summary.imagesTaken());
    assertTrue(monitor.contains(System.Logger.Level.WARNING, FakeInstrument.exposureId(4)));
  }

  @Test
  public void whenCreatedFromConfiguration_pluginsAreLoaded() throws Exception {
    final var configuration =
        configuration(
            "\"generateCalibrations\": false,"
                + " \"dataRepository\": {\"type\": \"json-directory\", \"root\": \"/tmp\"}");
    assertTrue(configuration.getDataRepository() instanceof JsonFileDataRepository);

    final var summary =
        RunCoordinator.create(configuration, instrument, executionService, monitor).run();
    assertEquals(
        List.of("bias", "dark", "flat"), summary.productsWith(ProductReport.Outcome.SKIPPED));
  }

  @Test(expected = IllegalArgumentException.class)
  public void whenNoCertificationTool_rejected() throws Exception {
    new RunCoordinator(configuration(""), instrument, executionService, repository, null, monitor);
  }
}

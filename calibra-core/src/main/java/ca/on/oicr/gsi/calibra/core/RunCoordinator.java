package ca.on.oicr.gsi.calibra.core;

import ca.on.oicr.gsi.calibra.CertificationTool;
import ca.on.oicr.gsi.calibra.DataRepository;
import ca.on.oicr.gsi.calibra.DataSelection;
import ca.on.oicr.gsi.calibra.ExecutionService;
import ca.on.oicr.gsi.calibra.ImageType;
import ca.on.oicr.gsi.calibra.InstrumentProxy;
import java.io.IOException;
import java.lang.System.Logger.Level;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Takes calibration exposures and turns them into certified calibration products
 *
 * <p>Image types are taken one after another. As soon as the exposures of a type are available,
 * generation, verification, and certification of that type start as a background task, so the next
 * type's exposures can be taken while the previous one is processed. Extra products start once all
 * image types have been taken. The run ends only when every background task has finished or been
 * cancelled.
 *
 * <p>A failure while processing one image type or product is logged and reported in the summary; it
 * never stops the others.
 */
public final class RunCoordinator {
  /**
   * Create a coordinator that reports to standard error
   *
   * @param configuration the run configuration, including its plugin sections
   * @param instrument the instrument to take images with
   * @param executionService the service that runs pipelines
   */
  public static RunCoordinator create(
      CalibrationConfiguration configuration,
      InstrumentProxy instrument,
      ExecutionService executionService) {
    return create(
        configuration,
        instrument,
        executionService,
        new StandardErrorRunMonitor(configuration.getInstrument()));
  }

  /**
   * Create a coordinator using the data repository and certification tool described in the
   * configuration
   *
   * @param configuration the run configuration
   * @param instrument the camera to take exposures with
   * @param executionService the service that runs pipelines
   * @param monitor where to report progress
   */
  public static RunCoordinator create(
      CalibrationConfiguration configuration,
      InstrumentProxy instrument,
      ExecutionService executionService,
      RunMonitor monitor) {
    final var repository = configuration.getDataRepository();
    if (repository != null) {
      repository.startup();
    }
    final var tool = configuration.getCertificationTool();
    if (tool != null) {
      tool.startup();
    }
    return new RunCoordinator(
        configuration, instrument, executionService, repository, tool, monitor);
  }

  private final VerificationAnalyzer analyzer;
  private final Certifier certifier;
  private final CalibrationConfiguration configuration;
  private final JobDispatcher dispatcher;
  private final ExecutionService executionService;
  private final InstrumentProxy instrument;
  private final RunMonitor monitor;
  private final RunState state = new RunState();
  private final ExposureBatchTaker taker;

  public RunCoordinator(
      CalibrationConfiguration configuration,
      InstrumentProxy instrument,
      ExecutionService executionService,
      DataRepository dataRepository,
      CertificationTool certificationTool,
      RunMonitor monitor) {
    final var errors = configuration.validate();
    if (!errors.isEmpty()) {
      throw new IllegalArgumentException(
          "Invalid configuration:\n" + String.join("\n", errors));
    }
    if (configuration.getGenerateCalibrations() && certificationTool == null) {
      throw new IllegalArgumentException("A certification tool is required to certify products.");
    }
    if (configuration.getGenerateCalibrations()
        && configuration.getDoVerify()
        && dataRepository == null) {
      throw new IllegalArgumentException("A data repository is required to verify products.");
    }
    this.configuration = configuration;
    this.instrument = instrument;
    this.executionService = executionService;
    this.monitor = monitor;
    taker =
        new ExposureBatchTaker(
            instrument,
            configuration.detectorIds(),
            configuration.detectorCount(),
            configuration.getWaitBetweenExposures(),
            monitor);
    dispatcher =
        new JobDispatcher(
            executionService,
            configuration.pipelineInstrumentName(),
            configuration.getJobAcknowledgementTimeout(),
            monitor);
    analyzer =
        dataRepository == null
            ? null
            : new VerificationAnalyzer(
                dataRepository,
                configuration.getInstrument(),
                configuration.getOutputCollectionPrefix(),
                configuration.getVerificationReadTimeout(),
                configuration.getVerificationPollInterval(),
                monitor);
    certifier =
        certificationTool == null
            ? null
            : new Certifier(certificationTool, configuration.repository(), monitor);
  }

  private void certify(String name, String generationJobId)
      throws CertificationException, InterruptedException {
    stage(name, PipelineStage.CERTIFYING);
    certifier.certify(
        name,
        configuration.getOutputCollectionPrefix() + generationJobId,
        configuration.certificationCollection(),
        configuration.validFrom(),
        configuration.validTo());
  }

  private String configString(
      String inputCollections, Optional<String> generationJobId, String options) {
    final var buffer = new StringBuilder();
    buffer.append("-j ").append(configuration.getNProcesses());
    buffer.append(" -i ").append(inputCollections);
    generationJobId.ifPresent(
        id -> buffer.append(" -i ").append(configuration.getOutputCollectionPrefix()).append(id));
    buffer.append(" --register-dataset-types");
    if (options != null && !options.isBlank()) {
      buffer.append(' ').append(options.trim());
    }
    return buffer.toString();
  }

  private String runJob(
      String name,
      Pipeline pipeline,
      String config,
      DataSelection selection,
      JobResultCorrelator correlator,
      List<String> jobIds)
      throws DispatchException, JobTimeoutException, JobFailedException, InterruptedException {
    final var job = dispatcher.dispatch(pipeline, config, selection);
    jobIds.add(job.id());
    monitor.log(
        Level.INFO, String.format("Dispatched %s job %s for %s", pipeline.file(), job.id(), name));
    final var result = correlator.awaitResult(job, configuration.getJobResultTimeout());
    if (!result.completed()) {
      throw new JobFailedException(name + " " + pipeline.file(), result);
    }
    return job.id();
  }

  private ProductReport processExtraProduct(
      ExtraProduct product, List<String> exposureIds, JobResultCorrelator correlator)
      throws InterruptedException {
    final var name = product.datasetType();
    final var jobIds = new ArrayList<String>();
    try {
      stage(name, PipelineStage.DISPATCHING);
      final var generationJobId =
          runJob(
              name,
              product.pipeline(),
              configString(
                  configuration.inputCollections(product),
                  Optional.empty(),
                  configuration.extraProduct(product).getConfigOptions()),
              selection(exposureIds),
              correlator,
              jobIds);
      certify(name, generationJobId);
      monitor.log(Level.INFO, String.format("Certified %s from job %s", name, generationJobId));
      return new ProductReport(
          name,
          ProductReport.Outcome.CERTIFIED,
          Optional.of(generationJobId),
          Optional.empty(),
          Optional.empty(),
          Optional.empty());
    } catch (DispatchException
        | JobTimeoutException
        | JobFailedException
        | CertificationException e) {
      monitor.log(
          Level.ERROR,
          String.format("Processing of %s (jobs %s) failed: %s", name, jobIds, e.getMessage()));
      return new ProductReport(
          name,
          ProductReport.Outcome.FAILED,
          jobIds.stream().findFirst(),
          Optional.empty(),
          Optional.empty(),
          Optional.of(e.getMessage()));
    } finally {
      stage(name, PipelineStage.DONE);
    }
  }

  private ProductReport processImageType(
      ImageType type, List<String> exposureIds, JobResultCorrelator correlator)
      throws InterruptedException {
    final var name = type.datasetType();
    final var typeConfiguration = configuration.imageType(type);
    final var selection = selection(exposureIds);
    final var jobIds = new ArrayList<String>();
    Optional<CertificationDecision> decision = Optional.empty();
    try {
      stage(name, PipelineStage.DISPATCHING);
      final var generationJobId =
          runJob(
              name,
              Pipeline.generation(type),
              configString(
                  configuration.inputCollections(type),
                  Optional.empty(),
                  typeConfiguration.getConfigOptions()),
              selection,
              correlator,
              jobIds);
      Optional<String> verificationJobId = Optional.empty();
      if (configuration.getDoVerify()) {
        stage(name, PipelineStage.AWAITING_VERIFICATION);
        verificationJobId =
            Optional.of(
                runJob(
                    name,
                    Pipeline.verification(type),
                    configString(
                        configuration.inputCollectionsVerify(type),
                        Optional.of(generationJobId),
                        typeConfiguration.getConfigOptionsVerify()),
                    selection,
                    correlator,
                    jobIds));
        decision =
            Optional.of(
                analyzer.checkVerification(
                    type,
                    verificationJobId.get(),
                    exposureIds,
                    Optional.of(generationJobId),
                    new Thresholds(
                        typeConfiguration.getMaxFailuresPerDetectorPerTestType(),
                        configuration.detectorCount())));
        if (!decision.get().certify()) {
          return new ProductReport(
              name,
              ProductReport.Outcome.NOT_CERTIFIED,
              Optional.of(generationJobId),
              verificationJobId,
              decision,
              Optional.of("Verification failed."));
        }
      } else {
        monitor.log(
            Level.INFO,
            String.format(
                "Verification disabled; certifying %s from job %s directly.",
                name, generationJobId));
      }
      certify(name, generationJobId);
      monitor.log(Level.INFO, String.format("Certified %s from job %s", name, generationJobId));
      return new ProductReport(
          name,
          ProductReport.Outcome.CERTIFIED,
          Optional.of(generationJobId),
          verificationJobId,
          decision,
          Optional.empty());
    } catch (DispatchException
        | JobTimeoutException
        | JobFailedException
        | VerificationReadException
        | CertificationException e) {
      monitor.log(
          Level.ERROR,
          String.format(
              "Processing of %s (jobs %s) failed: %s", name, jobIds, e.getMessage()));
      return new ProductReport(
          name,
          ProductReport.Outcome.FAILED,
          jobIds.stream().findFirst(),
          jobIds.stream().skip(1).findFirst(),
          decision,
          Optional.of(e.getMessage()));
    } finally {
      stage(name, PipelineStage.DONE);
    }
  }

  /**
   * Perform the calibration run
   *
   * @return what happened to each image type and product
   * @throws InterruptedException if the run is interrupted; any background tasks are cancelled
   *     before this is thrown
   */
  public RunSummary run() throws InterruptedException {
    final var reports = new LinkedHashMap<String, ProductReport>();
    final var order = new ArrayList<String>();
    try (final var correlator =
            new JobResultCorrelator(executionService.completions(), monitor);
        final var tasks = new BackgroundTaskGroup<ProductReport>("calibra", monitor)) {
      state.phase(RunState.Phase.TAKING_IMAGES);
      for (final var type : configuration.getScriptMode().imageTypes()) {
        final var name = type.datasetType();
        order.add(name);
        final Optional<List<String>> exposureIds;
        try {
          exposureIds = takeImages(type);
        } catch (IOException | RuntimeException e) {
          final var message = e.getMessage() == null ? e.getClass().getName() : e.getMessage();
          monitor.log(
              Level.ERROR, String.format("Failed to take %s exposures: %s", name, message));
          reports.put(name, ProductReport.failed(name, message));
          stage(name, PipelineStage.DONE);
          continue;
        }
        if (exposureIds.isEmpty()) {
          reports.put(name, ProductReport.failed(name, "No usable exposures were ingested."));
          stage(name, PipelineStage.DONE);
        } else if (!configuration.getGenerateCalibrations()) {
          monitor.log(
              Level.INFO,
              String.format(
                  "Generation disabled; %s exposures %s are not processed.",
                  name, exposureIds.get()));
          reports.put(name, ProductReport.skipped(name));
          stage(name, PipelineStage.DONE);
        } else {
          final var ids = exposureIds.get();
          tasks.spawn(name, () -> processImageType(type, ids, correlator));
        }
      }
      state.currentImageType(null);

      for (final var product : configuration.enabledExtraProducts()) {
        final var name = product.datasetType();
        order.add(name);
        final var missing =
            product.requires().stream()
                .filter(type -> state.exposureIds(type).map(List::isEmpty).orElse(true))
                .collect(Collectors.toList());
        if (!missing.isEmpty()) {
          monitor.log(
              Level.ERROR,
              String.format("Cannot build %s because there are no %s exposures.", name, missing));
          reports.put(name, ProductReport.failed(name, "No exposures of " + missing + "."));
          continue;
        }
        final var ids =
            product.requires().stream()
                .flatMap(type -> state.exposureIds(type).orElseThrow().stream())
                .collect(Collectors.toList());
        tasks.spawn(name, () -> processExtraProduct(product, ids, correlator));
      }

      state.phase(RunState.Phase.BACKGROUND_PROCESSING);
      monitor.log(
          Level.INFO,
          String.format("Waiting for background tasks %s to finish.", tasks.tasks()));
      for (final var outcome : tasks.awaitAll(configuration.getBackgroundTaskTimeout()).values()) {
        switch (outcome.status()) {
          case COMPLETED:
            reports.put(outcome.name(), outcome.value().orElseThrow());
            break;
          case CANCELLED:
            reports.put(outcome.name(), ProductReport.cancelled(outcome.name()));
            stage(outcome.name(), PipelineStage.DONE);
            break;
          case FAILED:
            final var error = outcome.error().orElseThrow();
            reports.put(
                outcome.name(),
                ProductReport.failed(
                    outcome.name(), error.getClass().getSimpleName() + ": " + error.getMessage()));
            stage(outcome.name(), PipelineStage.DONE);
            break;
          default:
            throw new IllegalStateException("Unknown task status " + outcome.status());
        }
      }
    } finally {
      state.phase(RunState.Phase.DONE);
    }
    final var summary =
        new RunSummary(
            order.stream().map(reports::get).collect(Collectors.toList()),
            state.exposureIds(),
            state.imagesTaken());
    monitor.log(Level.INFO, "Run summary: " + summary.toJson());
    return summary;
  }

  private DataSelection selection(List<String> exposureIds) {
    return new DataSelection(
        configuration.getInstrument(), configuration.detectorIds(), exposureIds);
  }

  private void stage(String name, PipelineStage stage) {
    state.stage(name, stage);
    monitor.log(Level.DEBUG, String.format("%s is now %s", name, stage));
  }

  /** The progress of the run */
  public RunState state() {
    return state;
  }

  private Optional<List<String>> takeImages(ImageType type)
      throws IOException, InterruptedException {
    final var name = type.datasetType();
    final var typeConfiguration = configuration.imageType(type);
    state.currentImageType(type);
    stage(name, PipelineStage.TAKING_IMAGES);
    if (type == ImageType.FLAT) {
      instrument.assertFeasibility(type);
    }
    ExposureBatch batch;
    try {
      batch =
          taker.takeBatch(
              type,
              typeConfiguration.exposureTimes(type),
              typeConfiguration.getDiscard(),
              configuration.getImageInOodsTimeout(),
              Optional.ofNullable(typeConfiguration.getFilter()));
      state.addImagesTaken(batch.ingestedCount());
    } catch (IngestionTimeoutException e) {
      batch = e.partialBatch();
      state.addImagesTaken(batch.ingestedCount() + e.missing().size());
      monitor.log(
          Level.WARNING,
          String.format(
              "Continuing %s with %d exposures %s; missing: %s",
              name, batch.exposureIds().size(), batch.exposureIds(), e.missing()));
    }
    state.exposureIds(type, batch.exposureIds());
    monitor.log(Level.INFO, String.format("Took %s exposures %s", name, batch.exposureIds()));
    return batch.exposureIds().isEmpty() ? Optional.empty() : Optional.of(batch.exposureIds());
  }
}

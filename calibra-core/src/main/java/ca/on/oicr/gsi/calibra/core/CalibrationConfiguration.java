package ca.on.oicr.gsi.calibra.core;

import ca.on.oicr.gsi.calibra.CertificationTool;
import ca.on.oicr.gsi.calibra.DataRepository;
import ca.on.oicr.gsi.calibra.ImageType;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/** The configuration of a calibration run */
public final class CalibrationConfiguration {
  static final ObjectMapper MAPPER = new ObjectMapper();

  static {
    MAPPER.registerModule(new Jdk8Module());
    MAPPER.registerModule(new JavaTimeModule());
    MAPPER.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    MAPPER.disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);
  }

  /**
   * Read and validate a configuration file
   *
   * @param path the JSON file to read
   * @return the configuration
   * @throws IOException if the file cannot be read or contains fields that are not understood
   * @throws IllegalArgumentException if the configuration is not valid; the message lists every
   *     problem found
   */
  public static CalibrationConfiguration load(Path path) throws IOException {
    return check(MAPPER.readValue(path.toFile(), CalibrationConfiguration.class));
  }

  /**
   * Read and validate a configuration
   *
   * @param json the configuration as JSON text
   * @return the configuration
   * @throws IOException if the text contains fields that are not understood
   * @throws IllegalArgumentException if the configuration is not valid
   */
  public static CalibrationConfiguration parse(String json) throws IOException {
    return check(MAPPER.readValue(json, CalibrationConfiguration.class));
  }

  /**
   * Convert a date in the configuration to an instant
   *
   * <p>Dates may be a plain date (<tt>2024-01-31</tt>), which is taken as the start of that day,
   * a date and time without a zone, or an ISO-8601 instant. Zone-less values are taken as UTC.
   *
   * @param value the date text
   * @return the instant
   * @throws DateTimeParseException if the date is in none of the accepted formats
   */
  public static Instant parseDate(String value) {
    if (value.indexOf('T') < 0) {
      return LocalDate.parse(value).atStartOfDay().toInstant(ZoneOffset.UTC);
    }
    final var parsed =
        DateTimeFormatter.ISO_DATE_TIME.parseBest(
            value, OffsetDateTime::from, LocalDateTime::from);
    return parsed instanceof OffsetDateTime
        ? ((OffsetDateTime) parsed).toInstant()
        : ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
  }

  private static CalibrationConfiguration check(CalibrationConfiguration configuration) {
    final var errors = configuration.validate();
    if (!errors.isEmpty()) {
      throw new IllegalArgumentException(
          "Invalid configuration:\n" + errors.stream().collect(Collectors.joining("\n")));
    }
    return configuration;
  }

  private static void checkPositive(List<String> errors, String name, Duration value) {
    if (value == null || value.isNegative() || value.isZero()) {
      errors.add(String.format("%s must be a positive duration.", name));
    }
  }

  private static Stream<String> date(String name, String value) {
    if (value == null) {
      return Stream.of(String.format("%s is required.", name));
    }
    try {
      parseDate(value);
      return Stream.empty();
    } catch (DateTimeParseException e) {
      return Stream.of(String.format("%s \"%s\" is not a date: %s", name, value, e.getMessage()));
    }
  }

  private Duration backgroundTaskTimeout = Duration.ofHours(1);
  private ImageTypeConfiguration bias = new ImageTypeConfiguration();
  private String calibCollection;
  private CertificationTool certificationTool;
  private String certifyCalibBeginDate = "1950-01-01";
  private String certifyCalibEndDate = "2050-01-01";
  private ImageTypeConfiguration dark = new ImageTypeConfiguration();
  private DataRepository dataRepository;
  private ExtraProductConfiguration defects = new ExtraProductConfiguration();
  private List<Integer> detectors = Collections.emptyList();
  private boolean doDefects;
  private boolean doGainFromFlatPairs;
  private boolean doPtc;
  private boolean doVerify = true;
  private ImageTypeConfiguration flat = new ImageTypeConfiguration();
  private ExtraProductConfiguration gain = new ExtraProductConfiguration();
  private boolean generateCalibrations = true;
  private Duration imageInOodsTimeout = Duration.ofMinutes(10);
  private String instrument;
  private Duration jobAcknowledgementTimeout = Duration.ofMinutes(1);
  private Duration jobResultTimeout = Duration.ofMinutes(30);
  private int nProcesses = 8;
  private String outputCollectionPrefix = "u/ocps/";
  private String pipelineInstrument;
  private ExtraProductConfiguration ptc = new ExtraProductConfiguration();
  private String repo;
  private ScriptMode scriptMode = ScriptMode.BIAS_DARK_FLAT;
  private Duration verificationPollInterval = Duration.ofSeconds(5);
  private Duration verificationReadTimeout = Duration.ofMinutes(2);
  private Duration waitBetweenExposures = Duration.ZERO;

  /** The collection products are certified into */
  public String certificationCollection() {
    return calibCollection == null ? instrument + "/calib/daily" : calibCollection;
  }

  /**
   * The number of detectors that report each exposure
   *
   * @return the size of the detector list or, if it is empty, the instrument's full complement;
   *     0 if neither is known
   */
  public int detectorCount() {
    if (!detectors.isEmpty()) {
      return detectorIds().size();
    }
    return InstrumentProfile.find(instrument).map(InstrumentProfile::detectorCount).orElse(0);
  }

  /** The detectors to process; empty means all detectors */
  public SortedSet<Integer> detectorIds() {
    return Collections.unmodifiableSortedSet(new TreeSet<>(detectors));
  }

  /** The extra products enabled, in the order they are started */
  public List<ExtraProduct> enabledExtraProducts() {
    final var products = new ArrayList<ExtraProduct>();
    if (doDefects) {
      products.add(ExtraProduct.DEFECTS);
    }
    if (doPtc) {
      products.add(ExtraProduct.PTC);
    }
    if (doGainFromFlatPairs) {
      products.add(ExtraProduct.GAIN);
    }
    return products;
  }

  public ExtraProductConfiguration extraProduct(ExtraProduct product) {
    switch (product) {
      case DEFECTS:
        return defects;
      case PTC:
        return ptc;
      case GAIN:
        return gain;
      default:
        throw new IllegalArgumentException("Unknown product " + product);
    }
  }

  public Duration getBackgroundTaskTimeout() {
    return backgroundTaskTimeout;
  }

  public ImageTypeConfiguration getBias() {
    return bias;
  }

  public String getCalibCollection() {
    return calibCollection;
  }

  public CertificationTool getCertificationTool() {
    return certificationTool;
  }

  public String getCertifyCalibBeginDate() {
    return certifyCalibBeginDate;
  }

  public String getCertifyCalibEndDate() {
    return certifyCalibEndDate;
  }

  public ImageTypeConfiguration getDark() {
    return dark;
  }

  public DataRepository getDataRepository() {
    return dataRepository;
  }

  public ExtraProductConfiguration getDefects() {
    return defects;
  }

  public List<Integer> getDetectors() {
    return detectors;
  }

  public boolean getDoDefects() {
    return doDefects;
  }

  public boolean getDoGainFromFlatPairs() {
    return doGainFromFlatPairs;
  }

  public boolean getDoPtc() {
    return doPtc;
  }

  public boolean getDoVerify() {
    return doVerify;
  }

  public ImageTypeConfiguration getFlat() {
    return flat;
  }

  public ExtraProductConfiguration getGain() {
    return gain;
  }

  public boolean getGenerateCalibrations() {
    return generateCalibrations;
  }

  public Duration getImageInOodsTimeout() {
    return imageInOodsTimeout;
  }

  public String getInstrument() {
    return instrument;
  }

  public Duration getJobAcknowledgementTimeout() {
    return jobAcknowledgementTimeout;
  }

  public Duration getJobResultTimeout() {
    return jobResultTimeout;
  }

  @JsonProperty("nProcesses")
  public int getNProcesses() {
    return nProcesses;
  }

  public String getOutputCollectionPrefix() {
    return outputCollectionPrefix;
  }

  public String getPipelineInstrument() {
    return pipelineInstrument;
  }

  public ExtraProductConfiguration getPtc() {
    return ptc;
  }

  public String getRepo() {
    return repo;
  }

  public ScriptMode getScriptMode() {
    return scriptMode;
  }

  public Duration getVerificationPollInterval() {
    return verificationPollInterval;
  }

  public Duration getVerificationReadTimeout() {
    return verificationReadTimeout;
  }

  public Duration getWaitBetweenExposures() {
    return waitBetweenExposures;
  }

  public ImageTypeConfiguration imageType(ImageType type) {
    switch (type) {
      case BIAS:
        return bias;
      case DARK:
        return dark;
      case FLAT:
        return flat;
      default:
        throw new IllegalArgumentException("Unknown image type " + type);
    }
  }

  /** The collections a generation pipeline reads its inputs from */
  public String inputCollections(ImageType type) {
    final var collections = imageType(type).getInputCollections();
    return collections == null ? instrument + "/calib" : collections;
  }

  /** The collections an extra product pipeline reads its inputs from */
  public String inputCollections(ExtraProduct product) {
    final var collections = extraProduct(product).getInputCollections();
    return collections == null ? instrument + "/calib" : collections;
  }

  /** The collections a verification pipeline reads its inputs from */
  public String inputCollectionsVerify(ImageType type) {
    final var collections = imageType(type).getInputCollectionsVerify();
    return collections == null ? instrument + "/calib" : collections;
  }

  /** The instrument name used in the pipeline packages */
  public String pipelineInstrumentName() {
    return pipelineInstrument == null ? instrument : pipelineInstrument;
  }

  /** The data repository pipelines run against */
  public String repository() {
    return repo == null ? "/repo/" + instrument : repo;
  }

  public void setBackgroundTaskTimeout(Duration backgroundTaskTimeout) {
    this.backgroundTaskTimeout = backgroundTaskTimeout;
  }

  public void setBias(ImageTypeConfiguration bias) {
    this.bias = bias;
  }

  public void setCalibCollection(String calibCollection) {
    this.calibCollection = calibCollection;
  }

  public void setCertificationTool(CertificationTool certificationTool) {
    this.certificationTool = certificationTool;
  }

  public void setCertifyCalibBeginDate(String certifyCalibBeginDate) {
    this.certifyCalibBeginDate = certifyCalibBeginDate;
  }

  public void setCertifyCalibEndDate(String certifyCalibEndDate) {
    this.certifyCalibEndDate = certifyCalibEndDate;
  }

  public void setDark(ImageTypeConfiguration dark) {
    this.dark = dark;
  }

  public void setDataRepository(DataRepository dataRepository) {
    this.dataRepository = dataRepository;
  }

  public void setDefects(ExtraProductConfiguration defects) {
    this.defects = defects;
  }

  public void setDetectors(List<Integer> detectors) {
    this.detectors = detectors;
  }

  public void setDoDefects(boolean doDefects) {
    this.doDefects = doDefects;
  }

  public void setDoGainFromFlatPairs(boolean doGainFromFlatPairs) {
    this.doGainFromFlatPairs = doGainFromFlatPairs;
  }

  public void setDoPtc(boolean doPtc) {
    this.doPtc = doPtc;
  }

  public void setDoVerify(boolean doVerify) {
    this.doVerify = doVerify;
  }

  public void setFlat(ImageTypeConfiguration flat) {
    this.flat = flat;
  }

  public void setGain(ExtraProductConfiguration gain) {
    this.gain = gain;
  }

  public void setGenerateCalibrations(boolean generateCalibrations) {
    this.generateCalibrations = generateCalibrations;
  }

  public void setImageInOodsTimeout(Duration imageInOodsTimeout) {
    this.imageInOodsTimeout = imageInOodsTimeout;
  }

  public void setInstrument(String instrument) {
    this.instrument = instrument;
  }

  public void setJobAcknowledgementTimeout(Duration jobAcknowledgementTimeout) {
    this.jobAcknowledgementTimeout = jobAcknowledgementTimeout;
  }

  public void setJobResultTimeout(Duration jobResultTimeout) {
    this.jobResultTimeout = jobResultTimeout;
  }

  @JsonProperty("nProcesses")
  public void setNProcesses(int nProcesses) {
    this.nProcesses = nProcesses;
  }

  public void setOutputCollectionPrefix(String outputCollectionPrefix) {
    this.outputCollectionPrefix = outputCollectionPrefix;
  }

  public void setPipelineInstrument(String pipelineInstrument) {
    this.pipelineInstrument = pipelineInstrument;
  }

  public void setPtc(ExtraProductConfiguration ptc) {
    this.ptc = ptc;
  }

  public void setRepo(String repo) {
    this.repo = repo;
  }

  public void setScriptMode(ScriptMode scriptMode) {
    this.scriptMode = scriptMode;
  }

  public void setVerificationPollInterval(Duration verificationPollInterval) {
    this.verificationPollInterval = verificationPollInterval;
  }

  public void setVerificationReadTimeout(Duration verificationReadTimeout) {
    this.verificationReadTimeout = verificationReadTimeout;
  }

  public void setWaitBetweenExposures(Duration waitBetweenExposures) {
    this.waitBetweenExposures = waitBetweenExposures;
  }

  /**
   * Check the configuration for problems
   *
   * @return a description of every problem found; empty if the configuration is usable
   */
  public List<String> validate() {
    final var errors = new ArrayList<String>();
    if (instrument == null || instrument.isBlank()) {
      errors.add("instrument is required.");
      return errors;
    }
    if (scriptMode == null) {
      errors.add("scriptMode is required.");
      return errors;
    }
    if (detectors.stream().anyMatch(d -> d == null || d < 0)) {
      errors.add("detectors must be non-negative integers.");
    } else if (new TreeSet<>(detectors).size() != detectors.size()) {
      errors.add("detectors contains duplicates.");
    } else if (detectorCount() == 0) {
      errors.add(
          String.format(
              "Instrument %s is not known; the detectors to process must be listed.",
              instrument));
    }
    if (nProcesses < 1) {
      errors.add(String.format("nProcesses must be at least 1, but is %d.", nProcesses));
    }
    if (outputCollectionPrefix == null) {
      errors.add("outputCollectionPrefix is required.");
    }
    final Map<ImageType, ImageTypeConfiguration> types = new EnumMap<>(ImageType.class);
    for (final var type : scriptMode.imageTypes()) {
      final var configuration = imageType(type);
      if (configuration == null) {
        errors.add(String.format("%s configuration is required.", type.datasetType()));
      } else {
        types.put(type, configuration);
      }
    }
    types.forEach((type, configuration) -> configuration.validate(type).forEach(errors::add));

    final var dateErrors =
        Stream.concat(
                date("certifyCalibBeginDate", certifyCalibBeginDate),
                date("certifyCalibEndDate", certifyCalibEndDate))
            .collect(Collectors.toList());
    errors.addAll(dateErrors);
    if (dateErrors.isEmpty() && !validFrom().isBefore(validTo())) {
      errors.add(
          String.format(
              "certifyCalibBeginDate %s must be before certifyCalibEndDate %s.",
              certifyCalibBeginDate, certifyCalibEndDate));
    }

    checkPositive(errors, "imageInOodsTimeout", imageInOodsTimeout);
    checkPositive(errors, "jobAcknowledgementTimeout", jobAcknowledgementTimeout);
    checkPositive(errors, "jobResultTimeout", jobResultTimeout);
    checkPositive(errors, "verificationReadTimeout", verificationReadTimeout);
    checkPositive(errors, "verificationPollInterval", verificationPollInterval);
    checkPositive(errors, "backgroundTaskTimeout", backgroundTaskTimeout);
    if (waitBetweenExposures == null || waitBetweenExposures.isNegative()) {
      errors.add("waitBetweenExposures cannot be negative.");
    }

    for (final var product : enabledExtraProducts()) {
      if (!generateCalibrations) {
        errors.add(
            String.format(
                "%s requires generateCalibrations to be enabled.", product.datasetType()));
      }
      if (extraProduct(product) == null) {
        errors.add(String.format("%s configuration is required.", product.datasetType()));
      }
      for (final var required : product.requires()) {
        if (!scriptMode.imageTypes().contains(required)) {
          errors.add(
              String.format(
                  "%s requires %s images, but script mode %s does not take them.",
                  product.datasetType(), required.datasetType(), scriptMode));
        }
      }
    }
    return errors;
  }

  /** The start of the validity range of certified products */
  public Instant validFrom() {
    return parseDate(certifyCalibBeginDate);
  }

  /** The end of the validity range of certified products */
  public Instant validTo() {
    return parseDate(certifyCalibEndDate);
  }
}

package ca.on.oicr.gsi.calibra.core;

import ca.on.oicr.gsi.calibra.ImageType;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Stream;

/** How to take and process the exposures of one image type */
public final class ImageTypeConfiguration {
  private static Duration seconds(double value) {
    return Duration.ofNanos(Math.round(value * 1e9));
  }

  private String configOptions = "";
  private String configOptionsVerify = "";
  private Integer count = 1;
  private int discard;
  private List<Double> exposureTimes = List.of(0.0);
  private boolean exposureTimeScalar = true;
  private String filter;
  private String inputCollections;
  private String inputCollectionsVerify;
  private int maxFailuresPerDetectorPerTestType = 8;

  /**
   * The exposure time of every exposure to take, in order
   *
   * <p>A single exposure time is repeated for every exposure. Biases are always zero seconds.
   *
   * @param type the image type this configuration is for
   */
  public List<Duration> exposureTimes(ImageType type) {
    final var n = count == null ? (exposureTimeScalar ? 1 : exposureTimes.size()) : count;
    if (type == ImageType.BIAS) {
      return Collections.nCopies(n, Duration.ZERO);
    }
    if (exposureTimeScalar) {
      return Collections.nCopies(n, seconds(exposureTimes.get(0)));
    }
    return exposureTimes.stream().map(ImageTypeConfiguration::seconds).toList();
  }

  public String getConfigOptions() {
    return configOptions;
  }

  public String getConfigOptionsVerify() {
    return configOptionsVerify;
  }

  public Integer getCount() {
    return count;
  }

  public int getDiscard() {
    return discard;
  }

  public List<Double> getExposureTimes() {
    return exposureTimes;
  }

  public String getFilter() {
    return filter;
  }

  public String getInputCollections() {
    return inputCollections;
  }

  public String getInputCollectionsVerify() {
    return inputCollectionsVerify;
  }

  public int getMaxFailuresPerDetectorPerTestType() {
    return maxFailuresPerDetectorPerTestType;
  }

  public void setConfigOptions(String configOptions) {
    this.configOptions = configOptions;
  }

  public void setConfigOptionsVerify(String configOptionsVerify) {
    this.configOptionsVerify = configOptionsVerify;
  }

  public void setCount(Integer count) {
    this.count = count;
  }

  public void setDiscard(int discard) {
    this.discard = discard;
  }

  @JsonSetter("exposureTimes")
  public void setExposureTimes(JsonNode exposureTimes) {
    if (exposureTimes.isNumber()) {
      this.exposureTimes = List.of(exposureTimes.asDouble());
      exposureTimeScalar = true;
    } else if (exposureTimes.isArray()) {
      final var times = new ArrayList<Double>();
      for (final var time : exposureTimes) {
        if (!time.isNumber()) {
          throw new IllegalArgumentException("Exposure times must be numbers of seconds.");
        }
        times.add(time.asDouble());
      }
      this.exposureTimes = List.copyOf(times);
      exposureTimeScalar = false;
    } else {
      throw new IllegalArgumentException(
          "Exposure times must be a number or a list of numbers of seconds.");
    }
  }

  public void setFilter(String filter) {
    this.filter = filter;
  }

  public void setInputCollections(String inputCollections) {
    this.inputCollections = inputCollections;
  }

  public void setInputCollectionsVerify(String inputCollectionsVerify) {
    this.inputCollectionsVerify = inputCollectionsVerify;
  }

  public void setMaxFailuresPerDetectorPerTestType(int maxFailuresPerDetectorPerTestType) {
    this.maxFailuresPerDetectorPerTestType = maxFailuresPerDetectorPerTestType;
  }

  Stream<String> validate(ImageType type) {
    final var errors = new ArrayList<String>();
    final var name = type.name().toLowerCase();
    if (count != null && count < 1) {
      errors.add(String.format("%s: count must be at least 1, but is %d.", name, count));
    }
    if (exposureTimes.isEmpty()) {
      errors.add(String.format("%s: at least one exposure time is required.", name));
    }
    if (exposureTimes.stream().anyMatch(t -> t < 0)) {
      errors.add(String.format("%s: exposure times cannot be negative.", name));
    }
    if (type == ImageType.BIAS && exposureTimes.stream().anyMatch(t -> t != 0)) {
      errors.add(String.format("%s: biases must have zero exposure time.", name));
    }
    if (!exposureTimeScalar
        && count != null
        && type != ImageType.BIAS
        && count != exposureTimes.size()) {
      errors.add(
          String.format(
              "%s: count is %d, but %d exposure times are given.",
              name, count, exposureTimes.size()));
    }
    if (errors.isEmpty()) {
      final var total = exposureTimes(type).size();
      if (discard < 0 || discard >= total) {
        errors.add(
            String.format(
                "%s: discard must be at least 0 and less than the %d exposures taken, but is %d.",
                name, total, discard));
      }
    }
    if (maxFailuresPerDetectorPerTestType < 0) {
      errors.add(
          String.format("%s: maxFailuresPerDetectorPerTestType cannot be negative.", name));
    }
    return errors.stream();
  }
}

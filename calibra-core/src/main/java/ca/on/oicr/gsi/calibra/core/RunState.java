package ca.on.oicr.gsi.calibra.core;

import ca.on.oicr.gsi.calibra.ImageType;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/** The progress of a calibration run, owned by its {@link RunCoordinator} */
public final class RunState {
  public enum Phase {
    IDLE,
    TAKING_IMAGES,
    BACKGROUND_PROCESSING,
    DONE
  }

  private ImageType currentImageType;
  private final Map<ImageType, List<String>> exposureIds = new EnumMap<>(ImageType.class);
  private int imagesTaken;
  private Phase phase = Phase.IDLE;
  private final Map<String, PipelineStage> stages = new LinkedHashMap<>();

  synchronized void addImagesTaken(int count) {
    if (count < 0) {
      throw new IllegalArgumentException("Image count cannot decrease.");
    }
    imagesTaken += count;
  }

  /** The image type whose exposures are being taken, if any */
  public synchronized Optional<ImageType> currentImageType() {
    return Optional.ofNullable(currentImageType);
  }

  synchronized void currentImageType(ImageType type) {
    currentImageType = type;
  }

  /** The exposures usable for processing, for every image type taken so far */
  public synchronized SortedMap<ImageType, List<String>> exposureIds() {
    return Collections.unmodifiableSortedMap(new TreeMap<>(exposureIds));
  }

  public synchronized Optional<List<String>> exposureIds(ImageType type) {
    return Optional.ofNullable(exposureIds.get(type));
  }

  synchronized void exposureIds(ImageType type, List<String> ids) {
    exposureIds.put(type, List.copyOf(ids));
  }

  /** The number of exposures the instrument took during this run */
  public synchronized int imagesTaken() {
    return imagesTaken;
  }

  public synchronized Phase phase() {
    return phase;
  }

  synchronized void phase(Phase phase) {
    this.phase = phase;
  }

  /** The names of image types and products whose processing has started but not finished */
  public synchronized List<String> inFlight() {
    return stages.entrySet().stream()
        .filter(e -> e.getValue() != PipelineStage.IDLE && e.getValue() != PipelineStage.DONE)
        .map(Map.Entry::getKey)
        .toList();
  }

  public synchronized PipelineStage stage(String pipeline) {
    return stages.getOrDefault(pipeline, PipelineStage.IDLE);
  }

  synchronized void stage(String pipeline, PipelineStage stage) {
    stages.put(pipeline, stage);
  }
}

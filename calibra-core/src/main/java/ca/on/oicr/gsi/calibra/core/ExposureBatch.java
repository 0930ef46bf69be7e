package ca.on.oicr.gsi.calibra.core;

import ca.on.oicr.gsi.calibra.ImageType;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A set of exposures of one image type requested together
 *
 * <p>Identifiers are recorded as the instrument reports them and appended again, in request order,
 * once ingested; after the batch is completed, it cannot change. The first {@link #discard()}
 * exposures requested were taken to let the hardware settle and are never part of {@link
 * #exposureIds()}, even if they were not ingested.
 */
public final class ExposureBatch {
  private boolean completed;
  private final int discard;
  private final List<Duration> exposureTimes;
  private final ImageType imageType;
  private final List<String> ingested = new ArrayList<>();
  private final List<String> requested = new ArrayList<>();

  ExposureBatch(ImageType imageType, List<Duration> exposureTimes, int discard) {
    this.imageType = imageType;
    this.exposureTimes = List.copyOf(exposureTimes);
    this.discard = discard;
  }

  synchronized void request(String exposureId) {
    if (completed) {
      throw new IllegalStateException("Cannot add exposures to a completed batch.");
    }
    requested.add(exposureId);
  }

  synchronized void append(String exposureId) {
    if (completed) {
      throw new IllegalStateException("Cannot add exposures to a completed batch.");
    }
    ingested.add(exposureId);
  }

  synchronized void complete() {
    completed = true;
  }

  /** The number of leading exposures that are not used for processing */
  public int discard() {
    return discard;
  }

  /**
   * The exposures taken only to let the hardware settle
   *
   * @return the discarded identifiers, in request order
   */
  public synchronized List<String> discardedIds() {
    return List.copyOf(requested.subList(0, Math.min(discard, requested.size())));
  }

  /**
   * The ingested exposures that should be processed
   *
   * @return the identifiers, in request order, without the discarded ones
   */
  public synchronized List<String> exposureIds() {
    final var discarded = discardedIds();
    return ingested.stream()
        .filter(id -> !discarded.contains(id))
        .collect(Collectors.toUnmodifiableList());
  }

  /** The exposure times requested */
  public List<Duration> exposureTimes() {
    return Collections.unmodifiableList(exposureTimes);
  }

  /** The image type of every exposure in the batch */
  public ImageType imageType() {
    return imageType;
  }

  /**
   * The number of exposures that were ingested, including the discarded ones
   *
   * @return the ingested count
   */
  public synchronized int ingestedCount() {
    return ingested.size();
  }

  public synchronized boolean isCompleted() {
    return completed;
  }

  @Override
  public synchronized String toString() {
    return String.format(
        "ExposureBatch{%s, %d requested, %d ingested, %d discarded}",
        imageType, exposureTimes.size(), ingested.size(), discardedIds().size());
  }
}

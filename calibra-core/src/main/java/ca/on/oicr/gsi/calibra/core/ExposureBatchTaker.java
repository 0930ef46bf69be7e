package ca.on.oicr.gsi.calibra.core;

import ca.on.oicr.gsi.calibra.ExposureRequest;
import ca.on.oicr.gsi.calibra.ImageType;
import ca.on.oicr.gsi.calibra.IngestionEvent;
import ca.on.oicr.gsi.calibra.InstrumentProxy;
import io.prometheus.client.Counter;
import java.io.IOException;
import java.lang.System.Logger.Level;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Takes a batch of exposures and waits for them to be ingested
 *
 * <p>The ingestion event stream is flushed before every batch. This assumes nothing else is
 * requesting exposures from the same instrument at the same time.
 */
public final class ExposureBatchTaker {
  static final Counter EXPOSURES_INGESTED =
      Counter.build(
              "calibra_exposures_ingested",
              "The number of exposures that were completely ingested")
          .labelNames("image_type")
          .register();
  static final Counter EXPOSURES_MISSING =
      Counter.build(
              "calibra_exposures_missing",
              "The number of exposures that were not ingested before the timeout")
          .labelNames("image_type")
          .register();

  private final int detectorCount;
  private final SortedSet<Integer> detectors;
  private final InstrumentProxy instrument;
  private final RunMonitor monitor;
  private final Duration waitBetweenExposures;

  /**
   * Create a new batch taker
   *
   * @param instrument the instrument to take exposures with
   * @param detectors the detectors expected to report ingestion; if empty, any detector counts
   * @param detectorCount the number of detectors that report ingestion for each exposure
   * @param waitBetweenExposures a pause between successive exposure requests
   * @param monitor where to report progress
   */
  public ExposureBatchTaker(
      InstrumentProxy instrument,
      SortedSet<Integer> detectors,
      int detectorCount,
      Duration waitBetweenExposures,
      RunMonitor monitor) {
    if (detectorCount < 1) {
      throw new IllegalArgumentException("At least one detector is required.");
    }
    if (!detectors.isEmpty() && detectors.size() != detectorCount) {
      throw new IllegalArgumentException("Detector count does not match detector list.");
    }
    this.instrument = instrument;
    this.detectors = new TreeSet<>(detectors);
    this.detectorCount = detectorCount;
    this.waitBetweenExposures = waitBetweenExposures;
    this.monitor = monitor;
  }

  /**
   * Take exposures and wait until every detector of every exposure has been ingested
   *
   * @param imageType the kind of exposure
   * @param exposureTimes the exposure time of each exposure, in the order they are taken
   * @param discard the number of leading exposures to leave out of the batch
   * @param timeout the maximum time to wait for ingestion once the last exposure is taken
   * @param filter the filter to use, if it should change
   * @return the completed batch
   * @throws IngestionTimeoutException if some exposures were not ingested in time; the exception
   *     carries the partial batch
   * @throws IOException if the instrument failed to take the exposures
   */
  public ExposureBatch takeBatch(
      ImageType imageType,
      List<Duration> exposureTimes,
      int discard,
      Duration timeout,
      Optional<String> filter)
      throws IngestionTimeoutException, IOException, InterruptedException {
    if (exposureTimes.isEmpty()) {
      throw new IllegalArgumentException("No exposures requested.");
    }
    if (discard < 0 || discard >= exposureTimes.size()) {
      throw new IllegalArgumentException(
          String.format(
              "Cannot discard %d of %d %s exposures.", discard, exposureTimes.size(), imageType));
    }
    final var expected = exposureTimes.size() * detectorCount;
    final var batch = new ExposureBatch(imageType, exposureTimes, discard);
    final var events = new LinkedBlockingQueue<IngestionEvent>();

    instrument.ingestionEvents().flush();
    final List<String> requested = new ArrayList<>();
    try (final var subscription = instrument.ingestionEvents().subscribe(events::add)) {
      for (var i = 0; i < exposureTimes.size(); i++) {
        if (i > 0 && !waitBetweenExposures.isZero()) {
          Thread.sleep(waitBetweenExposures.toMillis());
        }
        final var ids =
            instrument.takeImages(new ExposureRequest(imageType, exposureTimes.get(i), 1, filter));
        monitor.log(
            Level.DEBUG,
            String.format(
                "Took %s exposure %d of %d with exposure time %s: %s",
                imageType, i + 1, exposureTimes.size(), exposureTimes.get(i), ids));
        requested.addAll(ids);
        ids.forEach(batch::request);
      }
      if (requested.size() != exposureTimes.size()) {
        throw new IOException(
            String.format(
                "Requested %d %s exposures but instrument reported %d.",
                exposureTimes.size(), imageType, requested.size()));
      }

      final Map<String, Set<Integer>> received = new HashMap<>();
      for (final var id : requested) {
        received.put(id, new TreeSet<>());
      }
      var count = 0;
      final var deadline = System.nanoTime() + timeout.toNanos();
      while (count < expected) {
        final var remaining = deadline - System.nanoTime();
        if (remaining <= 0) {
          break;
        }
        final var event = events.poll(remaining, TimeUnit.NANOSECONDS);
        if (event == null) {
          break;
        }
        if (!detectors.isEmpty() && !detectors.contains(event.detector())) {
          continue;
        }
        final var seen = received.get(event.exposureId());
        if (seen != null && seen.add(event.detector())) {
          count++;
        }
      }

      final Map<String, SortedSet<Integer>> missing = new LinkedHashMap<>();
      for (final var id : requested) {
        final var seen = received.get(id);
        if (seen.size() >= detectorCount) {
          batch.append(id);
          EXPOSURES_INGESTED.labels(imageType.name()).inc();
        } else {
          // Without a detector list, only the shortfall is known, not which detectors.
          final var outstanding = new TreeSet<>(detectors);
          outstanding.removeAll(seen);
          missing.put(id, outstanding);
        }
      }
      batch.complete();
      if (!missing.isEmpty()) {
        EXPOSURES_MISSING.labels(imageType.name()).inc(missing.size());
        throw new IngestionTimeoutException(batch, missing);
      }
      monitor.log(
          Level.INFO,
          String.format(
              "All %d %s exposures ingested (%d images); discarded %s",
              requested.size(), imageType, expected, batch.discardedIds()));
      return batch;
    }
  }
}

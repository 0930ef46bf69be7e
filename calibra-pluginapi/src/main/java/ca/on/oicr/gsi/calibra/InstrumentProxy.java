package ca.on.oicr.gsi.calibra;

import java.io.IOException;
import java.util.List;

/** Access to a camera that can take exposures and report when they have been ingested */
public interface InstrumentProxy {

  /**
   * Check that the observatory is in a state where exposures of this type make sense
   *
   * <p>For example, flats need the dome and its light sources to be ready.
   *
   * @param type the kind of exposure about to be taken
   * @throws IOException if the exposures cannot be taken
   */
  default void assertFeasibility(ImageType type) throws IOException {
    // Everything is feasible unless the instrument knows better.
  }

  /**
   * The stream of ingestion notifications, one per detector per exposure
   *
   * @return the shared ingestion event stream
   */
  EventStream<IngestionEvent> ingestionEvents();

  /**
   * Take exposures and wait for the instrument to acknowledge them
   *
   * <p>This does not wait for the exposures to be ingested.
   *
   * @param request the exposures to take
   * @return the identifiers of the exposures taken, in the order they were taken
   */
  List<String> takeImages(ExposureRequest request) throws IOException, InterruptedException;
}

package ca.on.oicr.gsi.calibra;

import java.time.Duration;
import java.util.Optional;

/**
 * A request for the instrument to take exposures
 *
 * @param type the kind of exposure
 * @param exposureTime the shutter time of each exposure
 * @param count the number of exposures to take
 * @param filter the filter to put in the beam before exposing, if it should change
 */
public record ExposureRequest(
    ImageType type, Duration exposureTime, int count, Optional<String> filter) {}

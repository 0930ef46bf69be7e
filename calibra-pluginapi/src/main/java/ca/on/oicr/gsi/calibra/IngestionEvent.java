package ca.on.oicr.gsi.calibra;

/**
 * Notification that one detector's image of an exposure is available in the data repository
 *
 * @param exposureId the exposure identifier
 * @param detector the detector that produced the image
 */
public record IngestionEvent(String exposureId, int detector) {}

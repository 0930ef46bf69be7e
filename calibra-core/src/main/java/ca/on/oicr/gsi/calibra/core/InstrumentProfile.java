package ca.on.oicr.gsi.calibra.core;

import java.util.Optional;
import java.util.stream.Stream;

/** Instruments whose detector layout is known without configuration */
public enum InstrumentProfile {
  LATISS("LATISS", 1),
  LSST_COM_CAM("LSSTComCam", 9),
  // Science and wavefront detectors; guiders do not produce calibration images
  LSST_CAM("LSSTCam", 197);

  /**
   * Find the profile for an instrument
   *
   * @param name the instrument name used by the data repository
   * @return the profile, if the instrument is known
   */
  public static Optional<InstrumentProfile> find(String name) {
    return Stream.of(values()).filter(p -> p.instrument.equals(name)).findFirst();
  }

  private final int detectorCount;
  private final String instrument;

  InstrumentProfile(String instrument, int detectorCount) {
    this.instrument = instrument;
    this.detectorCount = detectorCount;
  }

  public int detectorCount() {
    return detectorCount;
  }

  public String instrument() {
    return instrument;
  }
}

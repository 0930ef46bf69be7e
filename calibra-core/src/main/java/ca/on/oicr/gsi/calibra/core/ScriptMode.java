package ca.on.oicr.gsi.calibra.core;

import ca.on.oicr.gsi.calibra.ImageType;
import java.util.List;

/** Which basic image types a run takes and processes, in order */
public enum ScriptMode {
  BIAS(ImageType.BIAS),
  BIAS_DARK(ImageType.BIAS, ImageType.DARK),
  BIAS_DARK_FLAT(ImageType.BIAS, ImageType.DARK, ImageType.FLAT);

  private final List<ImageType> imageTypes;

  ScriptMode(ImageType... imageTypes) {
    this.imageTypes = List.of(imageTypes);
  }

  public List<ImageType> imageTypes() {
    return imageTypes;
  }
}

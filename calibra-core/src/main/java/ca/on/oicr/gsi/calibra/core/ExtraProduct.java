package ca.on.oicr.gsi.calibra.core;

import ca.on.oicr.gsi.calibra.ImageType;
import java.util.List;

/** Calibration products built from the exposures of the basic image types */
public enum ExtraProduct {
  DEFECTS("cpDefects.yaml", "defects", ImageType.DARK, ImageType.FLAT),
  PTC("cpPtc.yaml", "ptc", ImageType.FLAT),
  GAIN("cpPtcGainFromFlatPairs.yaml", "gain", ImageType.FLAT);

  private final String datasetType;
  private final String file;
  private final List<ImageType> requires;

  ExtraProduct(String file, String datasetType, ImageType... requires) {
    this.file = file;
    this.datasetType = datasetType;
    this.requires = List.of(requires);
  }

  /** The dataset type the product is certified as */
  public String datasetType() {
    return datasetType;
  }

  /** The pipeline that produces this product */
  public Pipeline pipeline() {
    return new Pipeline(Pipeline.GENERATION_DIRECTORY, file);
  }

  /**
   * The image types whose exposures are used to build this product
   *
   * @return the image types, in the order their exposures are passed to the pipeline
   */
  public List<ImageType> requires() {
    return requires;
  }
}

package ca.on.oicr.gsi.calibra.core;

import ca.on.oicr.gsi.calibra.ImageType;

/**
 * A pipeline definition file in a pipeline package
 *
 * <p>Each package keeps instrument-specific definitions in a subdirectory named after the
 * instrument and generic definitions in <tt>_ingredients</tt>.
 *
 * @param directory the package's pipeline directory, possibly containing environment variables
 * @param file the definition file name
 */
public record Pipeline(String directory, String file) {
  static final String GENERATION_DIRECTORY = "${CP_PIPE_DIR}/pipelines";
  static final String GENERIC_SUBDIRECTORY = "_ingredients";
  static final String VERIFICATION_DIRECTORY = "${CP_VERIFY_DIR}/pipelines";

  /**
   * The pipeline that combines exposures into a calibration product
   *
   * @param type the image type
   */
  public static Pipeline generation(ImageType type) {
    return new Pipeline(GENERATION_DIRECTORY, "cp" + type.title() + ".yaml");
  }

  /**
   * The pipeline that measures the quality of a calibration product
   *
   * @param type the image type
   */
  public static Pipeline verification(ImageType type) {
    return new Pipeline(VERIFICATION_DIRECTORY, "verify" + type.title() + ".yaml");
  }

  /**
   * The location of the generic definition
   *
   * @return the path in the <tt>_ingredients</tt> directory
   */
  public String generic() {
    return String.format("%s/%s/%s", directory, GENERIC_SUBDIRECTORY, file);
  }

  /**
   * The location of the instrument-specific definition
   *
   * @param pipelineInstrument the instrument name used in the pipeline package
   * @return the path in the instrument's directory
   */
  public String forInstrument(String pipelineInstrument) {
    return String.format("%s/%s/%s", directory, pipelineInstrument, file);
  }

  @Override
  public String toString() {
    return directory + "/" + file;
  }
}

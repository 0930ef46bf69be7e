package ca.on.oicr.gsi.calibra;

/** The kinds of exposure that can be combined into a calibration product */
public enum ImageType {
  BIAS("Bias"),
  DARK("Dark"),
  FLAT("Flat");

  private final String title;

  ImageType(String title) {
    this.title = title;
  }

  /**
   * The dataset type name used by the certification tool
   *
   * @return the lower-case name, such as <tt>bias</tt>
   */
  public String datasetType() {
    return title.toLowerCase();
  }

  /**
   * The capitalized name used in pipeline and dataset file names
   *
   * @return the title-case name, such as <tt>Bias</tt>
   */
  public String title() {
    return title;
  }
}

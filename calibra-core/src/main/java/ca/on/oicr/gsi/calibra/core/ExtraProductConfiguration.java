package ca.on.oicr.gsi.calibra.core;

/** How to build a product derived from the basic image types */
public final class ExtraProductConfiguration {
  private String configOptions = "";
  private String inputCollections;

  public String getConfigOptions() {
    return configOptions;
  }

  public String getInputCollections() {
    return inputCollections;
  }

  public void setConfigOptions(String configOptions) {
    this.configOptions = configOptions;
  }

  public void setInputCollections(String inputCollections) {
    this.inputCollections = inputCollections;
  }
}

package ca.on.oicr.gsi.calibra.core;

import ca.on.oicr.gsi.calibra.ImageType;
import com.fasterxml.jackson.core.JsonProcessingException;
import java.util.List;
import java.util.Optional;
import java.util.SortedMap;

/**
 * What a calibration run did
 *
 * @param products the result for every image type and extra product, in processing order
 * @param exposureIds the usable exposures taken for each image type
 * @param imagesTaken the total number of exposures taken, including discarded ones
 */
public record RunSummary(
    List<ProductReport> products, SortedMap<ImageType, List<String>> exposureIds, int imagesTaken) {
  public RunSummary {
    products = List.copyOf(products);
  }

  /**
   * Find the report for a product
   *
   * @param name the product's dataset type, such as <tt>bias</tt> or <tt>ptc</tt>
   */
  public Optional<ProductReport> product(String name) {
    return products.stream().filter(p -> p.name().equals(name)).findFirst();
  }

  /** The products with a given outcome */
  public List<String> productsWith(ProductReport.Outcome outcome) {
    return products.stream()
        .filter(p -> p.outcome() == outcome)
        .map(ProductReport::name)
        .toList();
  }

  /** Render the summary as JSON */
  public String toJson() {
    try {
      return CalibrationConfiguration.MAPPER
          .writerWithDefaultPrettyPrinter()
          .writeValueAsString(this);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Cannot render run summary.", e);
    }
  }
}

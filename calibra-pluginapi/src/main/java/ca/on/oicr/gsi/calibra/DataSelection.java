package ca.on.oicr.gsi.calibra;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * The data a pipeline should process
 *
 * @param instrument the instrument that produced the exposures
 * @param detectors the detectors to include; if empty, all detectors of the instrument are used
 * @param exposureIds the exposures to include, in the order they were taken
 */
public record DataSelection(
    String instrument, SortedSet<Integer> detectors, List<String> exposureIds) {
  public DataSelection {
    Objects.requireNonNull(instrument, "instrument");
    detectors = Collections.unmodifiableSortedSet(new TreeSet<>(detectors));
    exposureIds = List.copyOf(exposureIds);
  }

  /**
   * Render the selection as a query for the execution service
   *
   * @return a query of the form <tt>instrument='X' AND detector IN (0, 1) AND exposure IN
   *     (...)</tt>
   */
  public String toQuery() {
    final var query = new StringBuilder();
    query.append("instrument='").append(instrument).append("'");
    if (!detectors.isEmpty()) {
      query
          .append(" AND detector IN ")
          .append(
              detectors.stream().map(String::valueOf).collect(Collectors.joining(", ", "(", ")")));
    }
    query
        .append(" AND exposure IN ")
        .append(exposureIds.stream().collect(Collectors.joining(", ", "(", ")")));
    return query.toString();
  }
}

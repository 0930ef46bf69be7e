package ca.on.oicr.gsi.calibra;

import java.util.Map;
import java.util.stream.Stream;

/** Reads data repository configuration */
public interface DataRepositoryProvider {

  /**
   * Provides the type names and classes this plugin provides
   *
   * @return a stream of type names and the classes that should be used to deserialize them
   */
  Stream<Map.Entry<String, Class<? extends DataRepository>>> types();
}

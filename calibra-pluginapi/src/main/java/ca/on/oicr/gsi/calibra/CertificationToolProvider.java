package ca.on.oicr.gsi.calibra;

import java.util.Map;
import java.util.stream.Stream;

/** Reads certification tool configuration */
public interface CertificationToolProvider {

  /**
   * Provides the type names and classes this plugin provides
   *
   * @return a stream of type names and the classes that should be used to deserialize them
   */
  Stream<Map.Entry<String, Class<? extends CertificationTool>>> types();
}

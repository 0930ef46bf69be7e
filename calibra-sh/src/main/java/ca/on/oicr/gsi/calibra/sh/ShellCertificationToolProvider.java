package ca.on.oicr.gsi.calibra.sh;

import ca.on.oicr.gsi.calibra.CertificationTool;
import ca.on.oicr.gsi.calibra.CertificationToolProvider;
import java.util.Map;
import java.util.stream.Stream;

public final class ShellCertificationToolProvider implements CertificationToolProvider {

  @Override
  public Stream<Map.Entry<String, Class<? extends CertificationTool>>> types() {
    return Stream.of(Map.entry("butler", ButlerCertificationTool.class));
  }
}

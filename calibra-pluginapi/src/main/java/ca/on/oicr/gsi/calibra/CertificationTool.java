package ca.on.oicr.gsi.calibra;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeInfo.As;
import com.fasterxml.jackson.annotation.JsonTypeInfo.Id;
import com.fasterxml.jackson.databind.DatabindContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.annotation.JsonTypeIdResolver;
import com.fasterxml.jackson.databind.jsontype.impl.TypeIdResolverBase;
import java.io.IOException;
import java.util.Map;
import java.util.Map.Entry;
import java.util.ServiceLoader;
import java.util.ServiceLoader.Provider;
import java.util.stream.Collectors;

/**
 * An external operation that publishes a product into a calibration collection
 *
 * <p>Certification is not idempotent: certifying the same product twice may create overlapping
 * validity ranges.
 */
@JsonTypeIdResolver(CertificationTool.CertificationToolIdResolver.class)
@JsonTypeInfo(use = JsonTypeInfo.Id.CUSTOM, include = As.PROPERTY, property = "type")
public interface CertificationTool {

  final class CertificationToolIdResolver extends TypeIdResolverBase {
    private final Map<String, Class<? extends CertificationTool>> knownIds =
        ServiceLoader.load(CertificationToolProvider.class).stream()
            .map(Provider::get)
            .flatMap(CertificationToolProvider::types)
            .collect(Collectors.toMap(Entry::getKey, Entry::getValue));

    @Override
    public Id getMechanism() {
      return Id.CUSTOM;
    }

    @Override
    public String idFromValue(Object o) {
      return knownIds.entrySet().stream()
          .filter(known -> known.getValue().isInstance(o))
          .map(Entry::getKey)
          .findFirst()
          .orElseThrow();
    }

    @Override
    public String idFromValueAndType(Object o, Class<?> aClass) {
      return idFromValue(o);
    }

    @Override
    public JavaType typeFromId(DatabindContext context, String id) throws IOException {
      final var clazz = knownIds.get(id);
      return clazz == null ? null : context.constructType(clazz);
    }
  }

  /**
   * Run the certification
   *
   * @param request what to certify
   * @return the exit status and captured output of the operation
   * @throws IOException if the operation could not be started or did not finish in time
   */
  ProcessOutput certify(CertificationRequest request) throws IOException, InterruptedException;

  /**
   * Called to initialise this tool.
   *
   * <p>If the configuration is invalid, this should throw a runtime exception.
   */
  void startup();
}

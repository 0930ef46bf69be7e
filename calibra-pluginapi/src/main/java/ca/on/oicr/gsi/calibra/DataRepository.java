package ca.on.oicr.gsi.calibra;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeInfo.As;
import com.fasterxml.jackson.annotation.JsonTypeInfo.Id;
import com.fasterxml.jackson.databind.DatabindContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.annotation.JsonTypeIdResolver;
import com.fasterxml.jackson.databind.jsontype.impl.TypeIdResolverBase;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.ServiceLoader.Provider;
import java.util.stream.Collectors;

/** Read access to the repository where pipelines write their outputs */
@JsonTypeIdResolver(DataRepository.DataRepositoryIdResolver.class)
@JsonTypeInfo(use = JsonTypeInfo.Id.CUSTOM, include = As.PROPERTY, property = "type")
public interface DataRepository {

  final class DataRepositoryIdResolver extends TypeIdResolverBase {
    private final Map<String, Class<? extends DataRepository>> knownIds =
        ServiceLoader.load(DataRepositoryProvider.class).stream()
            .map(Provider::get)
            .flatMap(DataRepositoryProvider::types)
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
   * Called to initialise this repository.
   *
   * <p>If the configuration is invalid, this should throw a runtime exception.
   */
  void startup();

  /**
   * Read the verification statistics for a calibration product
   *
   * @param type the image type that was verified
   * @param instrument the instrument the data came from
   * @param collections the collections to search, in priority order
   * @return the summary, or empty if the verification output is not available yet
   * @throws IOException if the output exists but cannot be read
   */
  Optional<VerificationSummary> verificationSummary(
      ImageType type, String instrument, List<String> collections) throws IOException;
}

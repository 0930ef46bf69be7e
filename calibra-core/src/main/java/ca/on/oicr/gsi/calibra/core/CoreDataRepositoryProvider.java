package ca.on.oicr.gsi.calibra.core;

import ca.on.oicr.gsi.calibra.DataRepository;
import ca.on.oicr.gsi.calibra.DataRepositoryProvider;
import java.util.Map;
import java.util.stream.Stream;

public final class CoreDataRepositoryProvider implements DataRepositoryProvider {

  @Override
  public Stream<Map.Entry<String, Class<? extends DataRepository>>> types() {
    return Stream.of(Map.entry("json-directory", JsonFileDataRepository.class));
  }
}

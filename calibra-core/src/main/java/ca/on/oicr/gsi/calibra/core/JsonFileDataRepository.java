package ca.on.oicr.gsi.calibra.core;

import ca.on.oicr.gsi.calibra.DataRepository;
import ca.on.oicr.gsi.calibra.ImageType;
import ca.on.oicr.gsi.calibra.VerificationSummary;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Reads verification summaries that pipelines export as JSON files
 *
 * <p>A summary for collection <tt>c</tt> is expected at
 * <tt>root/c/instrument/verifyTypeStats.json</tt>.
 */
public final class JsonFileDataRepository implements DataRepository {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private String root;

  public String getRoot() {
    return root;
  }

  /**
   * The file where a summary would be found
   *
   * @param type the image type verified
   * @param instrument the instrument the exposures were taken with
   * @param collection the collection the verification job wrote to
   */
  public Path path(ImageType type, String instrument, String collection) {
    return Path.of(root)
        .resolve(collection)
        .resolve(instrument)
        .resolve("verify" + type.title() + "Stats.json");
  }

  public void setRoot(String root) {
    this.root = root;
  }

  @Override
  public void startup() {
    if (root == null) {
      throw new IllegalArgumentException("JSON data repository requires a root directory.");
    }
  }

  @Override
  public Optional<VerificationSummary> verificationSummary(
      ImageType type, String instrument, List<String> collections) throws IOException {
    for (final var collection : collections) {
      final var file = path(type, instrument, collection);
      if (Files.isRegularFile(file)) {
        return Optional.of(VerificationSummary.fromJson(MAPPER.readTree(file.toFile())));
      }
    }
    return Optional.empty();
  }
}

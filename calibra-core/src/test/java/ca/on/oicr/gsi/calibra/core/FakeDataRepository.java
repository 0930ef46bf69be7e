package ca.on.oicr.gsi.calibra.core;

import ca.on.oicr.gsi.calibra.DataRepository;
import ca.on.oicr.gsi.calibra.ImageType;
import ca.on.oicr.gsi.calibra.VerificationSummary;
import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Returns a fixed verification summary for each image type */
final class FakeDataRepository implements DataRepository {
  private final Map<ImageType, VerificationSummary> summaries = new EnumMap<>(ImageType.class);
  private final List<List<String>> reads = new ArrayList<>();
  private int readsBeforeAvailable;
  private boolean broken;

  synchronized void broken() {
    broken = true;
  }

  synchronized void put(ImageType type, VerificationSummary summary) {
    summaries.put(type, summary);
  }

  /** Pretend the summaries take this many reads to appear */
  synchronized void readsBeforeAvailable(int count) {
    readsBeforeAvailable = count;
  }

  synchronized List<List<String>> reads() {
    return List.copyOf(reads);
  }

  @Override
  public void startup() {
    // Nothing to check.
  }

  @Override
  public synchronized Optional<VerificationSummary> verificationSummary(
      ImageType type, String instrument, List<String> collections) throws IOException {
    reads.add(List.copyOf(collections));
    if (broken) {
      throw new IOException("Repository is offline.");
    }
    if (readsBeforeAvailable > 0) {
      readsBeforeAvailable--;
      return Optional.empty();
    }
    return Optional.ofNullable(summaries.get(type));
  }
}

package ca.on.oicr.gsi.calibra;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * The information required to run a local process
 *
 * @param maximumWait the maximum allowed runtime for a process
 * @param command the command to run and its arguments
 */
public record ProcessInput(Optional<Duration> maximumWait, List<String> command) {
  public ProcessInput {
    if (command.isEmpty()) {
      throw new IllegalArgumentException("No command to run.");
    }
    command = List.copyOf(command);
  }

  /**
   * Run the process and capture its output
   *
   * <p>Standard output and standard error are written to temporary files so a chatty process
   * cannot block on a full pipe. If the calling thread is interrupted, the process is killed.
   *
   * @return the exit code and captured output
   * @throws IOException if the process cannot be started or exceeds its maximum wait
   */
  public ProcessOutput run() throws IOException, InterruptedException {
    final var stdout = File.createTempFile("calibra", ".out");
    final var stderr = File.createTempFile("calibra", ".err");
    stdout.deleteOnExit();
    stderr.deleteOnExit();
    try {
      final var process =
          new ProcessBuilder()
              .command(command)
              .redirectInput(ProcessBuilder.Redirect.from(new File("/dev/null")))
              .redirectOutput(stdout)
              .redirectError(stderr)
              .start();
      try {
        if (maximumWait.isPresent()) {
          if (!process.waitFor(maximumWait.get().toMillis(), TimeUnit.MILLISECONDS)) {
            process.destroyForcibly();
            throw new IOException(
                String.format(
                    "Killed process %d after %s timeout", process.pid(), maximumWait.get()));
          }
        } else {
          process.waitFor();
        }
      } catch (InterruptedException e) {
        process.destroyForcibly();
        throw e;
      }
      return new ProcessOutput(
          process.exitValue(),
          Files.readString(stdout.toPath(), StandardCharsets.UTF_8),
          Files.readString(stderr.toPath(), StandardCharsets.UTF_8));
    } finally {
      stdout.delete();
      stderr.delete();
    }
  }
}

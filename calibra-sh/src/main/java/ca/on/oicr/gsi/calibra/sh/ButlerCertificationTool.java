package ca.on.oicr.gsi.calibra.sh;

import ca.on.oicr.gsi.calibra.CertificationRequest;
import ca.on.oicr.gsi.calibra.CertificationTool;
import ca.on.oicr.gsi.calibra.ProcessInput;
import ca.on.oicr.gsi.calibra.ProcessOutput;
import java.io.IOException;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Certify calibrations by running <tt>butler certify-calibrations</tt> locally */
public final class ButlerCertificationTool implements CertificationTool {
  private static final DateTimeFormatter DATE_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss").withZone(ZoneOffset.UTC);

  private List<String> command = List.of("butler");
  private Long maximumWaitSeconds;

  /**
   * The full command line for a request
   *
   * @param request the certification to perform
   */
  public List<String> commandLine(CertificationRequest request) {
    final var commandLine = new ArrayList<>(command);
    commandLine.add("certify-calibrations");
    commandLine.add(request.repo());
    commandLine.add(request.sourceCollection());
    commandLine.add(request.destinationCollection());
    commandLine.add(request.datasetType());
    commandLine.add("--begin-date");
    commandLine.add(DATE_FORMAT.format(request.validFrom()));
    commandLine.add("--end-date");
    commandLine.add(DATE_FORMAT.format(request.validTo()));
    return commandLine;
  }

  @Override
  public ProcessOutput certify(CertificationRequest request)
      throws IOException, InterruptedException {
    return new ProcessInput(
            Optional.ofNullable(maximumWaitSeconds).map(Duration::ofSeconds),
            commandLine(request))
        .run();
  }

  public List<String> getCommand() {
    return command;
  }

  public Long getMaximumWaitSeconds() {
    return maximumWaitSeconds;
  }

  public void setCommand(List<String> command) {
    this.command = command;
  }

  public void setMaximumWaitSeconds(Long maximumWaitSeconds) {
    this.maximumWaitSeconds = maximumWaitSeconds;
  }

  @Override
  public void startup() {
    if (command == null || command.isEmpty()) {
      throw new IllegalArgumentException("Butler certification tool requires a command.");
    }
    if (maximumWaitSeconds != null && maximumWaitSeconds < 1) {
      throw new IllegalArgumentException("Maximum wait must be at least one second.");
    }
  }
}

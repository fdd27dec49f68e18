package com.scholary.mediascribe.process;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.StringJoiner;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs external command-line tools (ffmpeg, yt-dlp) with a hard timeout.
 *
 * <p>stderr is merged into stdout and drained on a separate thread so a chatty process can never
 * block on a full pipe. A process that outlives its timeout, or whose caller is interrupted, is
 * killed together with its children.
 */
@Component
public class ProcessRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProcessRunner.class);
  private static final int OUTPUT_SNIPPET_MAX = 4_000;

  /**
   * Run a command to completion.
   *
   * @param command the command and its arguments
   * @param timeout how long to wait before killing the process
   * @return exit code, collected output, and whether the process timed out
   * @throws IOException if the process cannot be started
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  public ProcessResult run(List<String> command, Duration timeout)
      throws IOException, InterruptedException {
    LOGGER.debug("Running process: {}", String.join(" ", command));

    Process process = new ProcessBuilder(command).redirectErrorStream(true).start();
    StringJoiner output = new StringJoiner(System.lineSeparator());
    Thread reader =
        new Thread(
            () -> {
              try (BufferedReader buffered =
                  new BufferedReader(
                      new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = buffered.readLine()) != null) {
                  synchronized (output) {
                    output.add(line);
                  }
                }
              } catch (IOException e) {
                LOGGER.debug("Process output stream closed early: {}", e.getMessage());
              }
            },
            "process-output-reader");
    reader.setDaemon(true);
    reader.start();

    boolean finished;
    try {
      finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      LOGGER.warn("Interrupted while waiting for {}, killing it", command.get(0));
      kill(process);
      throw e;
    }
    if (!finished) {
      kill(process);
      process.waitFor(5, TimeUnit.SECONDS);
    }
    reader.join(TimeUnit.SECONDS.toMillis(5));

    String collected;
    synchronized (output) {
      collected = output.toString();
    }
    int code = finished ? process.exitValue() : -1;
    return new ProcessResult(code, collected, !finished);
  }

  private static void kill(Process process) {
    process.descendants().forEach(ProcessHandle::destroyForcibly);
    process.destroyForcibly();
  }

  /**
   * Shorten process output for error messages.
   *
   * @param output the full output
   * @return the output, cut to a bounded length
   */
  public static String snippet(String output) {
    if (output == null || output.isBlank()) {
      return "<no output>";
    }
    if (output.length() <= OUTPUT_SNIPPET_MAX) {
      return output;
    }
    return output.substring(output.length() - OUTPUT_SNIPPET_MAX);
  }
}

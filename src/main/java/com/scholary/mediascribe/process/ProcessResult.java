package com.scholary.mediascribe.process;

/** Outcome of an external process run. {@code code} is -1 when the process timed out. */
public record ProcessResult(int code, String output, boolean timedOut) {

  public boolean succeeded() {
    return !timedOut && code == 0;
  }
}

package com.scholary.mediascribe.api;

import com.scholary.mediascribe.cache.RequesterResultEntry;
import com.scholary.mediascribe.transcript.Transcript;
import java.nio.file.Path;
import java.time.Instant;

/** Latest transcript of a requester. */
public record ResultResponse(
    String requesterId,
    long version,
    String sourceName,
    String raw,
    String formatted,
    String rawPath,
    String formattedPath,
    String subtitlesPath,
    Instant storedAt) {

  public static ResultResponse from(RequesterResultEntry entry) {
    return of(entry.requesterId(), entry.version(), entry.transcript(), entry.storedAt());
  }

  public static ResultResponse of(
      String requesterId, long version, Transcript transcript, Instant storedAt) {
    return new ResultResponse(
        requesterId,
        version,
        transcript.sourceName(),
        transcript.raw(),
        transcript.formatted(),
        pathString(transcript.rawPath()),
        pathString(transcript.formattedPath()),
        pathString(transcript.subtitlesPath()),
        storedAt);
  }

  private static String pathString(Path path) {
    return path == null ? null : path.toString();
  }
}

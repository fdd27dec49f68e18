package com.scholary.mediascribe.acquisition;

/**
 * A classified link.
 *
 * @param kind which downloader handles it
 * @param id the video or file id extracted from the link
 * @param downloadUrl what the downloader fetches
 */
public record UrlSource(Kind kind, String id, String downloadUrl) {

  public enum Kind {
    YOUTUBE,
    GOOGLE_DRIVE
  }
}

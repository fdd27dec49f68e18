package com.scholary.mediascribe.acquisition;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/** Classifies links into the sources we know how to download. */
@Component
public class UrlRouter {

  private static final Pattern YOUTUBE =
      Pattern.compile(
          "(https?://)?(www\\.)?(youtube|youtu|youtube-nocookie)\\.(com|be)/"
              + "(watch\\?v=|embed/|v/|.+\\?v=)?([^&=%?\\s]{11})");

  private static final Pattern GOOGLE_DRIVE =
      Pattern.compile(
          "https://drive\\.google\\.com/file/d/([^/\\s]+)/view"
              + "|https://drive\\.google\\.com/open\\?id=([^/&\\s]+)");

  private static final Pattern ANY_URL = Pattern.compile("https?://\\S+");

  /**
   * Classify a link.
   *
   * @throws AcquisitionException if the link is not a supported source
   */
  public UrlSource route(String url) {
    if (url == null || url.isBlank()) {
      throw new AcquisitionException("No URL given");
    }

    Matcher youtube = YOUTUBE.matcher(url);
    if (youtube.find()) {
      String id = youtube.group(6);
      return new UrlSource(
          UrlSource.Kind.YOUTUBE, id, "https://www.youtube.com/watch?v=" + id);
    }

    Matcher drive = GOOGLE_DRIVE.matcher(url);
    if (drive.find()) {
      String id = drive.group(1) != null ? drive.group(1) : drive.group(2);
      return new UrlSource(
          UrlSource.Kind.GOOGLE_DRIVE, id, "https://drive.google.com/uc?id=" + id);
    }

    throw new AcquisitionException("Unsupported URL: " + url);
  }

  /** Find the first http(s) link in a chat message. */
  public Optional<String> findUrl(String text) {
    if (text == null) {
      return Optional.empty();
    }
    Matcher matcher = ANY_URL.matcher(text);
    return matcher.find() ? Optional.of(matcher.group()) : Optional.empty();
  }
}

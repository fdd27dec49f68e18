package com.scholary.mediascribe.whisper;

import com.scholary.mediascribe.audio.AudioSegment;

/** Speech-to-text for one audio window. */
public interface WhisperService {

  /**
   * Transcribe one window.
   *
   * @param segment the window to transcribe
   * @return text and window-local segments, or {@link WhisperResponse#empty()} on failure
   */
  WhisperResponse transcribe(AudioSegment segment);
}

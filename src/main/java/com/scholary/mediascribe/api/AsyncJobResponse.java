package com.scholary.mediascribe.api;

/** Response for an accepted transcription request: poll {@code /api/jobs/{jobId}} for status. */
public record AsyncJobResponse(String jobId) {}

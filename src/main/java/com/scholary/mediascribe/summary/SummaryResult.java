package com.scholary.mediascribe.summary;

/** A computed summary and the model that produced its final text (null when none was called). */
public record SummaryResult(SummaryKind kind, String text, String model) {}

package com.scholary.discussion.analysis;

/** System and user message for one analysis call. */
public record AnalysisPrompt(String system, String user) {}

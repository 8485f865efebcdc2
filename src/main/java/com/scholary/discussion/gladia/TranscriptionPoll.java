package com.scholary.discussion.gladia;

/** A fetched job together with the response body it was parsed from. */
public record TranscriptionPoll(GladiaJob job, String rawJson) {}

package com.scholary.discussion.api;

/** Error body for 4xx responses. */
public record ErrorResponse(String error) {}

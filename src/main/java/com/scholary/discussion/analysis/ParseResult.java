package com.scholary.discussion.analysis;

import com.scholary.discussion.analysis.model.CategoryResults;

/** Outcome of parsing a model response: one of the two known shapes, or a failure. */
public sealed interface ParseResult
    permits ParseResult.NestedOk, ParseResult.FlatOk, ParseResult.Failed {

  /** Short label for logs and the audit record. */
  String outcome();

  /** Parsed in the sectioned shape ({@code comedy_categories}, ...). */
  record NestedOk(CategoryResults results) implements ParseResult {
    @Override
    public String outcome() {
      return "nested";
    }
  }

  /** Parsed in the flat shape ({@code BestJoke}, ...). */
  record FlatOk(CategoryResults results) implements ParseResult {
    @Override
    public String outcome() {
      return "flat";
    }
  }

  record Failed(String reason) implements ParseResult {
    @Override
    public String outcome() {
      return "failed";
    }
  }
}

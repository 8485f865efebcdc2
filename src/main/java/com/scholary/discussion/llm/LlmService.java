package com.scholary.discussion.llm;

/**
 * Interface to a chat-completions model.
 *
 * <p>Implementations retry transient failures themselves; an exception means the call is given up.
 */
public interface LlmService {

  /**
   * Send one system and one user message and return the model's reply.
   *
   * @param systemPrompt instructions for the model
   * @param userPrompt the request itself
   * @return the content of the first choice
   * @throws LlmException when the call fails after retries
   */
  String complete(String systemPrompt, String userPrompt);
}

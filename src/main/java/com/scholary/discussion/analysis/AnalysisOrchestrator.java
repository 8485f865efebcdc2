package com.scholary.discussion.analysis;

import com.scholary.discussion.analysis.model.CategoryResults;
import com.scholary.discussion.config.PipelineProperties;
import com.scholary.discussion.llm.LlmException;
import com.scholary.discussion.llm.LlmService;
import com.scholary.discussion.logging.PipelineEventLogger;
import com.scholary.discussion.session.Session;
import com.scholary.discussion.transcript.AggregatedTranscript;
import com.scholary.discussion.transcript.TranscriptAggregator;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs the analysis pass for sessions.
 *
 * <p>Per session: aggregate the transcripts, build the prompt, call the model once, parse the reply
 * (nested shape, then flat), correct speaker names and keep an audit record. Any failure past the
 * aggregation step yields a degraded result instead of an exception, so a session never stays stuck
 * in analysis. Every model call, from a batch or from a single session run, takes a permit from the
 * shared {@link BoundedTaskRunner}.
 */
@Service
public class AnalysisOrchestrator {

  private static final Logger LOGGER = LoggerFactory.getLogger(AnalysisOrchestrator.class);
  private static final PipelineEventLogger EVENTS = new PipelineEventLogger(LOGGER);

  private final TranscriptAggregator aggregator;
  private final PromptBuilder promptBuilder;
  private final LlmService llmService;
  private final AnalysisResponseParser parser;
  private final SpeakerNameCorrector nameCorrector;
  private final AnalysisAuditWriter auditWriter;
  private final AnalysisProperties analysisProperties;
  private final PipelineProperties pipelineProperties;
  private final BoundedTaskRunner taskRunner;

  public AnalysisOrchestrator(
      TranscriptAggregator aggregator,
      PromptBuilder promptBuilder,
      LlmService llmService,
      AnalysisResponseParser parser,
      SpeakerNameCorrector nameCorrector,
      AnalysisAuditWriter auditWriter,
      AnalysisProperties analysisProperties,
      PipelineProperties pipelineProperties,
      BoundedTaskRunner taskRunner) {
    this.aggregator = aggregator;
    this.promptBuilder = promptBuilder;
    this.llmService = llmService;
    this.parser = parser;
    this.nameCorrector = nameCorrector;
    this.auditWriter = auditWriter;
    this.analysisProperties = analysisProperties;
    this.pipelineProperties = pipelineProperties;
    this.taskRunner = taskRunner;
  }

  /** Result of analysing one session as part of a batch. */
  public record SessionAnalysis(String sessionId, CategoryResults results) {}

  /**
   * Analyse several sessions on the analysis executor.
   *
   * @return one entry per session, in completion order
   */
  public List<SessionAnalysis> analyzeSessions(List<Session> sessions) {
    LOGGER.info(
        "Analysing {} sessions with {} concurrent calls", sessions.size(), taskRunner.permits());
    return taskRunner.runAll(
        sessions, session -> new SessionAnalysis(session.getId(), analyze(session)));
  }

  /**
   * Analyse one session.
   *
   * @return the parsed and corrected results, or a degraded result naming the reason
   */
  public CategoryResults analyze(Session session) {
    AggregatedTranscript transcript =
        aggregator.aggregate(session, pipelineProperties.transcriptBudgetChars());
    if (!transcript.hasContent()) {
      LOGGER.warn("Session {} has no transcripts to analyse", session.getId());
      return CategoryResults.degraded("no transcripts available");
    }

    AnalysisPrompt prompt =
        promptBuilder.build(session, transcript, analysisProperties.discussionQuestions());

    String raw;
    try {
      raw = taskRunner.call(() -> llmService.complete(prompt.system(), prompt.user()));
    } catch (LlmException e) {
      LOGGER.error("Analysis call failed for session {}: {}", session.getId(), e.getMessage(), e);
      String reason = "analysis call failed: " + e.getMessage();
      audit(session, prompt, null, "call_failed", reason);
      return CategoryResults.degraded(reason);
    }

    ParseResult parsed = parser.parse(raw);
    CategoryResults results;
    String detail = null;
    if (parsed instanceof ParseResult.NestedOk) {
      results = nameCorrector.correct(((ParseResult.NestedOk) parsed).results());
    } else if (parsed instanceof ParseResult.FlatOk) {
      results = nameCorrector.correct(((ParseResult.FlatOk) parsed).results());
    } else {
      detail = ((ParseResult.Failed) parsed).reason();
      LOGGER.warn("Could not parse analysis for session {}: {}", session.getId(), detail);
      results = CategoryResults.degraded("response could not be parsed: " + detail);
    }

    EVENTS.logAnalysisParsed(parsed.outcome(), results.populatedCategoryCount(), raw.length());
    audit(session, prompt, raw, parsed.outcome(), detail);
    return results;
  }

  private void audit(
      Session session, AnalysisPrompt prompt, String raw, String outcome, String detail) {
    if (session.getFolderPath() == null) {
      return;
    }
    try {
      auditWriter.write(
          Path.of(session.getFolderPath()), session.getId(), prompt, raw, outcome, detail);
    } catch (IOException e) {
      LOGGER.warn(
          "Failed to write analysis audit record for session {}: {}",
          session.getId(),
          e.getMessage());
    }
  }
}

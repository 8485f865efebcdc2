package com.scholary.discussion.analysis;

import com.scholary.discussion.analysis.model.AnalysisCategory;
import com.scholary.discussion.analysis.model.TopFiveCategory;
import com.scholary.discussion.session.Session;
import com.scholary.discussion.transcript.AggregatedTranscript;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Builds the analysis prompt for a session.
 *
 * <p>The user message carries the session context, the mic roster in slot order (so the model can
 * cross-check names against individual mic evidence), the discussion questions, the transcript and
 * the flat JSON shape the answer must follow.
 */
@Component
public class PromptBuilder {

  static final String SYSTEM_PROMPT =
      "You are an expert entertainment analyst who finds the most entertaining and memorable"
          + " moments in recordings of movie discussions. Respond only with a single JSON object.";

  private static final DateTimeFormatter DATE_FORMAT =
      DateTimeFormatter.ofPattern("MMMM d, yyyy", Locale.ENGLISH);

  public AnalysisPrompt build(
      Session session, AggregatedTranscript transcript, List<String> discussionQuestions) {
    StringBuilder prompt = new StringBuilder();

    prompt
        .append("Analyze this movie discussion transcript and identify the most entertaining")
        .append(" moments across the categories below.\n\n");
    prompt.append("Movie: ").append(orUnknown(session.getMovieTitle())).append('\n');
    prompt
        .append("Date: ")
        .append(
            session.getSessionDate() == null
                ? "Unknown"
                : session.getSessionDate().format(DATE_FORMAT))
        .append("\n\n");

    appendRoster(prompt, session.getMicAssignments());
    appendQuestions(prompt, discussionQuestions);

    prompt.append("TRANSCRIPT TO ANALYZE:\n").append(transcript.text()).append("\n\n");
    if (transcript.truncated()) {
      prompt
          .append("NOTE: parts of the transcript were cut to fit; the marked gap is not missing")
          .append(" audio.\n\n");
    }

    appendSchema(prompt);
    appendGuidelines(prompt);

    return new AnalysisPrompt(SYSTEM_PROMPT, prompt.toString());
  }

  private static void appendRoster(StringBuilder prompt, Map<Integer, String> micAssignments) {
    prompt.append("PARTICIPANTS (microphone order):\n");
    if (micAssignments.isEmpty()) {
      prompt.append("Unknown participants\n");
    }
    micAssignments.forEach(
        (slot, name) ->
            prompt.append("Mic ").append(slot + 1).append(": ").append(name).append('\n'));
    prompt
        .append("In the master recording, Speaker N usually corresponds to Mic N. Use the")
        .append(" participant names above when attributing quotes.\n\n");
  }

  private static void appendQuestions(StringBuilder prompt, List<String> questions) {
    if (questions == null || questions.isEmpty()) {
      prompt.append("This was a free-form discussion without structured questions.\n\n");
      return;
    }
    prompt.append("DISCUSSION QUESTIONS the group was guided by:\n");
    for (int i = 0; i < questions.size(); i++) {
      prompt.append(i + 1).append(". ").append(questions.get(i)).append('\n');
    }
    prompt.append('\n');
  }

  private static void appendSchema(StringBuilder prompt) {
    prompt.append("Respond with JSON in exactly this shape:\n{\n");
    for (AnalysisCategory category : AnalysisCategory.values()) {
      prompt
          .append("  \"")
          .append(category.flatKey())
          .append("\": {\"Speaker\": \"[Name]\", \"Timestamp\": \"[MM:SS]\",")
          .append(" \"Quote\": \"[")
          .append(category.displayName())
          .append(" quote]\", \"Setup\": \"\", \"GroupReaction\": \"\", \"WhyItsGreat\": \"\",")
          .append(" \"AudioQualityString\": \"[Clear/Muffled/Background_Noise]\",")
          .append(" \"EntertainmentScore\": 1-10,")
          .append(" \"RunnersUp\": [{\"Speaker\": \"\", \"Timestamp\": \"\",")
          .append(" \"BriefDescription\": \"\"}]},\n");
    }
    for (TopFiveCategory category : TopFiveCategory.values()) {
      prompt
          .append("  \"")
          .append(category.flatKey())
          .append("\": {\"Entries\": [{\"Rank\": 1, \"Speaker\": \"[Name]\",")
          .append(" \"Timestamp\": \"[MM:SS]\", \"Quote\": \"\", \"Context\": \"\",")
          .append(" \"AudioQualityString\": \"[Clear/Muffled/Background_Noise]\",")
          .append(" \"Score\": 1-10.0, \"Reasoning\": \"\",")
          .append(" \"EstimatedStartEnd\": [start_seconds, end_seconds]}]},\n");
    }
    prompt
        .append("  \"OpeningQuestions\": {\"Questions\": [{\"Question\": \"\", \"Speaker\": \"\",")
        .append(" \"Answer\": \"\", \"Timestamp\": \"[MM:SS]\", \"EntertainmentValue\": 1-10}]}\n")
        .append("}\n\n");
  }

  private static void appendGuidelines(StringBuilder prompt) {
    prompt
        .append("GUIDELINES:\n")
        .append("1. Focus on entertainment value: laughter, surprise, disagreement, insight.\n")
        .append("2. Use exact quotes where possible.\n")
        .append("3. Rate entertainment from 1 to 10.\n")
        .append("4. Each top 5 list has exactly 5 entries ranked by entertainment value.\n")
        .append("5. Timestamps refer to the master recording, as MM:SS or H:MM:SS.\n")
        .append("6. If a category has no suitable moment, say so in its quote.\n")
        .append("Respond ONLY with the JSON object, without any text around it.\n");
  }

  private static String orUnknown(String value) {
    return value == null || value.isBlank() ? "Unknown" : value;
  }
}

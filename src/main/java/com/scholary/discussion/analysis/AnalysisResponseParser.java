package com.scholary.discussion.analysis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.discussion.analysis.model.AnalysisCategory;
import com.scholary.discussion.analysis.model.AnalysisCategory.Section;
import com.scholary.discussion.analysis.model.AudioQuality;
import com.scholary.discussion.analysis.model.CategoryResults;
import com.scholary.discussion.analysis.model.CategoryWinner;
import com.scholary.discussion.analysis.model.QuestionAnswer;
import com.scholary.discussion.analysis.model.RunnerUp;
import com.scholary.discussion.analysis.model.TopFiveCategory;
import com.scholary.discussion.analysis.model.TopFiveEntry;
import com.scholary.discussion.analysis.model.TopFiveList;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Parses the model's analysis response into {@link CategoryResults}.
 *
 * <p>Two shapes are accepted. The nested shape groups categories into sections; models are not
 * consistent about it, so section names are matched loosely and a category that is not under its
 * own key is searched for among the section's values (including numbered keys such as {@code "1"})
 * by its {@code category}, {@code title} or {@code name} field. The flat shape has one PascalCase
 * key per category. Property names inside a category may be PascalCase or snake_case.
 */
@Component
public class AnalysisResponseParser {

  private static final Logger LOGGER = LoggerFactory.getLogger(AnalysisResponseParser.class);

  static final int DEFAULT_SCORE = 5;
  private static final String[] TITLE_FIELDS = {"category", "Category", "title", "Title", "name"};

  private final ObjectMapper objectMapper;

  public AnalysisResponseParser(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public ParseResult parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return new ParseResult.Failed("empty response");
    }

    JsonNode root;
    try {
      root = readObject(stripFences(raw));
    } catch (JsonProcessingException e) {
      LOGGER.warn("Analysis response is not valid JSON: {}", e.getOriginalMessage());
      return new ParseResult.Failed("response is not valid JSON: " + e.getOriginalMessage());
    }
    if (root == null || !root.isObject()) {
      return new ParseResult.Failed("response is not a JSON object");
    }

    CategoryResults nested = parseNested(root);
    if (nested.populatedCategoryCount() > 0) {
      return new ParseResult.NestedOk(nested);
    }
    CategoryResults flat = parseFlat(root);
    if (!flat.isEmpty()) {
      return new ParseResult.FlatOk(flat);
    }
    return new ParseResult.Failed("no recognised categories in response");
  }

  /** Remove markdown code fences the model sometimes wraps around JSON. */
  static String stripFences(String raw) {
    String cleaned = raw.trim();
    if (cleaned.startsWith("```")) {
      int firstNewline = cleaned.indexOf('\n');
      cleaned = firstNewline < 0 ? "" : cleaned.substring(firstNewline + 1);
    }
    if (cleaned.endsWith("```")) {
      cleaned = cleaned.substring(0, cleaned.length() - 3);
    }
    return cleaned.trim();
  }

  private JsonNode readObject(String text) throws JsonProcessingException {
    try {
      return objectMapper.readTree(text);
    } catch (JsonProcessingException e) {
      // Prose around the object: retry with the outermost braces.
      int start = text.indexOf('{');
      int end = text.lastIndexOf('}');
      if (start < 0 || end <= start) {
        throw e;
      }
      return objectMapper.readTree(text.substring(start, end + 1));
    }
  }

  CategoryResults parseNested(JsonNode root) {
    Map<Section, JsonNode> sections = new EnumMap<>(Section.class);
    root.fields()
        .forEachRemaining(
            field -> {
              for (Section section : Section.values()) {
                if (section.matchesKey(field.getKey())) {
                  sections.putIfAbsent(section, field.getValue());
                }
              }
            });

    Map<AnalysisCategory, CategoryWinner> winners = new EnumMap<>(AnalysisCategory.class);
    for (AnalysisCategory category : AnalysisCategory.values()) {
      JsonNode section = sections.get(category.section());
      if (section == null) {
        continue;
      }
      JsonNode node = findInSection(section, category.nestedKey(), category.flatKey());
      if (node == null) {
        node = findByTitle(section, category::matchesTitle);
      }
      if (node != null && node.isObject()) {
        winners.put(category, parseWinner(node));
      }
    }

    Map<TopFiveCategory, TopFiveList> lists = new EnumMap<>(TopFiveCategory.class);
    JsonNode topFive = sections.get(Section.TOP_FIVE);
    if (topFive != null) {
      for (TopFiveCategory category : TopFiveCategory.values()) {
        JsonNode node = findInSection(topFive, category.nestedKey(), category.flatKey());
        if (node == null) {
          node = findByTitle(topFive, category::matchesTitle);
        }
        if (node != null) {
          lists.put(category, parseTopFive(node));
        }
      }
    }

    return CategoryResults.of(winners, lists, parseQuestions(findOpeningQuestions(root)));
  }

  CategoryResults parseFlat(JsonNode root) {
    Map<AnalysisCategory, CategoryWinner> winners = new EnumMap<>(AnalysisCategory.class);
    for (AnalysisCategory category : AnalysisCategory.values()) {
      JsonNode node = root.get(category.flatKey());
      if (node != null && node.isObject()) {
        winners.put(category, parseWinner(node));
      }
    }

    Map<TopFiveCategory, TopFiveList> lists = new EnumMap<>(TopFiveCategory.class);
    for (TopFiveCategory category : TopFiveCategory.values()) {
      JsonNode node = root.get(category.flatKey());
      if (node != null) {
        lists.put(category, parseTopFive(node));
      }
    }

    return CategoryResults.of(winners, lists, parseQuestions(findOpeningQuestions(root)));
  }

  private static JsonNode findInSection(JsonNode section, String... keys) {
    if (!section.isObject()) {
      return null;
    }
    Iterator<Map.Entry<String, JsonNode>> fields = section.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      String name = Section.normalize(field.getKey());
      for (String key : keys) {
        if (name.equals(Section.normalize(key))) {
          return field.getValue();
        }
      }
    }
    return null;
  }

  private static JsonNode findByTitle(JsonNode section, TitleMatcher matcher) {
    for (JsonNode candidate : section) {
      if (!candidate.isObject()) {
        continue;
      }
      for (String titleField : TITLE_FIELDS) {
        JsonNode title = candidate.get(titleField);
        if (title != null && title.isTextual() && matcher.matches(title.asText())) {
          return candidate;
        }
      }
    }
    return null;
  }

  @FunctionalInterface
  private interface TitleMatcher {
    boolean matches(String title);
  }

  private static JsonNode findOpeningQuestions(JsonNode root) {
    return findInSection(root, "OpeningQuestions", "opening_questions", "initial_questions");
  }

  private CategoryWinner parseWinner(JsonNode node) {
    List<RunnerUp> runnersUp = new ArrayList<>();
    JsonNode runners = field(node, "RunnersUp", "runners_up");
    if (runners != null && runners.isArray()) {
      int place = 2;
      for (JsonNode runner : runners) {
        runnersUp.add(
            new RunnerUp(
                text(runner, "Unknown", "Speaker", "speaker"),
                text(runner, "0:00", "Timestamp", "timestamp"),
                text(runner, "", "BriefDescription", "brief_description", "Quote", "quote"),
                integer(runner, place, "Place", "place")));
        place++;
      }
    }

    int score = integer(node, DEFAULT_SCORE, "EntertainmentScore", "entertainment_score", "Score");
    return new CategoryWinner(
        text(node, "Unknown", "Speaker", "speaker"),
        text(node, "0:00", "Timestamp", "timestamp"),
        text(node, "No quote available", "Quote", "quote"),
        text(node, "", "Setup", "setup"),
        text(node, "", "GroupReaction", "group_reaction"),
        text(node, "", "WhyItsGreat", "why_its_great"),
        AudioQuality.fromLabel(
            text(node, null, "AudioQualityString", "AudioQuality", "audio_quality")),
        Math.max(1, Math.min(10, score)),
        runnersUp,
        null,
        null);
  }

  private TopFiveList parseTopFive(JsonNode node) {
    JsonNode entries = node.isArray() ? node : field(node, "Entries", "entries");
    List<TopFiveEntry> parsed = new ArrayList<>();
    if (entries == null || !entries.isArray()) {
      return new TopFiveList(parsed);
    }
    int index = 1;
    for (JsonNode entry : entries) {
      if (!entry.isObject()) {
        continue;
      }
      Double start;
      Double end;
      JsonNode window = field(entry, "EstimatedStartEnd", "estimated_start_end");
      if (window != null
          && window.isArray()
          && window.size() == 2
          && window.get(0).isNumber()
          && window.get(1).isNumber()) {
        start = window.get(0).asDouble();
        end = window.get(1).asDouble();
      } else {
        start = decimal(entry, "StartSeconds", "start_seconds");
        end = decimal(entry, "EndSeconds", "end_seconds");
      }
      Double score = decimal(entry, "Score", "score", "entertainment_score");
      parsed.add(
          new TopFiveEntry(
              integer(entry, index, "Rank", "rank"),
              text(entry, "Unknown", "Speaker", "speaker"),
              text(entry, "0:00", "Timestamp", "timestamp"),
              text(entry, "No quote available", "Quote", "quote"),
              text(entry, "", "Context", "context", "setup"),
              AudioQuality.fromLabel(
                  text(entry, null, "AudioQualityString", "AudioQuality", "audio_quality")),
              score == null ? DEFAULT_SCORE : score,
              text(entry, "", "Reasoning", "reasoning", "why_its_great"),
              start,
              end,
              null,
              null));
      index++;
    }
    return new TopFiveList(parsed);
  }

  private List<QuestionAnswer> parseQuestions(JsonNode node) {
    List<QuestionAnswer> questions = new ArrayList<>();
    if (node == null) {
      return questions;
    }
    JsonNode items = node.isArray() ? node : field(node, "Questions", "questions");
    if (items == null || !items.isArray()) {
      return questions;
    }
    for (JsonNode item : items) {
      questions.add(
          new QuestionAnswer(
              text(item, "", "Question", "question"),
              text(item, "Unknown", "Speaker", "speaker"),
              text(item, "", "Answer", "answer"),
              text(item, "0:00", "Timestamp", "timestamp"),
              integer(item, DEFAULT_SCORE, "EntertainmentValue", "entertainment_value")));
    }
    return questions;
  }

  private static JsonNode field(JsonNode node, String... names) {
    for (String name : names) {
      JsonNode value = node.get(name);
      if (value != null && !value.isNull()) {
        return value;
      }
    }
    return null;
  }

  private static String text(JsonNode node, String fallback, String... names) {
    JsonNode value = field(node, names);
    return value != null && value.isValueNode() ? value.asText() : fallback;
  }

  private static int integer(JsonNode node, int fallback, String... names) {
    JsonNode value = field(node, names);
    if (value == null) {
      return fallback;
    }
    if (value.isNumber()) {
      return value.asInt();
    }
    if (value.isTextual()) {
      try {
        return (int) Math.round(Double.parseDouble(value.asText().trim()));
      } catch (NumberFormatException e) {
        return fallback;
      }
    }
    return fallback;
  }

  private static Double decimal(JsonNode node, String... names) {
    JsonNode value = field(node, names);
    if (value == null) {
      return null;
    }
    if (value.isNumber()) {
      return value.asDouble();
    }
    if (value.isTextual()) {
      try {
        return Double.parseDouble(value.asText().trim());
      } catch (NumberFormatException e) {
        return null;
      }
    }
    return null;
  }
}

package com.scholary.discussion.clip;

import com.scholary.discussion.analysis.model.CategoryResults;
import com.scholary.discussion.analysis.model.CategoryWinner;
import com.scholary.discussion.analysis.model.TopFiveEntry;
import com.scholary.discussion.session.AudioFile;
import com.scholary.discussion.session.Session;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Attaches audio clips to the highlights of an analysis.
 *
 * <p>Timestamps from the model refer to the master recording, so clips are always cut from the
 * master WAV. Category winners get three seconds before and seven after their timestamp; ranked
 * entries use their own start and end when given, otherwise ten seconds from their timestamp. A
 * highlight whose clip cannot be cut keeps no clip.
 */
@Service
public class HighlightClipService {

  private static final Logger LOGGER = LoggerFactory.getLogger(HighlightClipService.class);

  static final double WINNER_LEAD_SECONDS = 3;
  static final double WINNER_TAIL_SECONDS = 7;
  static final double ENTRY_DEFAULT_SECONDS = 10;

  private final ClipExtractor clipExtractor;

  public HighlightClipService(ClipExtractor clipExtractor) {
    this.clipExtractor = clipExtractor;
  }

  /** Results with clip URLs attached where a clip could be cut. */
  public CategoryResults attachClips(Session session, CategoryResults results) {
    if (results == null || results.degraded()) {
      return results;
    }
    Optional<Path> master = masterWav(session);
    if (master.isEmpty()) {
      LOGGER.warn("Session {} has no master WAV, skipping clip extraction", session.getId());
      return results;
    }
    Path wav = master.get();
    String source = wav.getFileName().toString();

    return results.mapHighlights(
        (category, winner) -> clipWinner(session.getId(), wav, source, winner),
        (category, entry) -> clipEntry(session.getId(), wav, source, entry));
  }

  private CategoryWinner clipWinner(
      String sessionId, Path wav, String source, CategoryWinner winner) {
    OptionalDouble at = TimestampParser.parse(winner.timestamp());
    if (at.isEmpty()) {
      LOGGER.debug("No usable timestamp '{}' for winner {}", winner.timestamp(), winner.speaker());
      return winner;
    }
    double start = Math.max(0, at.getAsDouble() - WINNER_LEAD_SECONDS);
    double end = at.getAsDouble() + WINNER_TAIL_SECONDS;
    return cut(sessionId, wav, start, end).map(url -> winner.withClip(url, source)).orElse(winner);
  }

  private TopFiveEntry clipEntry(String sessionId, Path wav, String source, TopFiveEntry entry) {
    double start;
    double end;
    if (entry.startSeconds() != null
        && entry.endSeconds() != null
        && entry.endSeconds() > entry.startSeconds()) {
      start = entry.startSeconds();
      end = entry.endSeconds();
    } else {
      OptionalDouble at = TimestampParser.parse(entry.timestamp());
      if (at.isEmpty()) {
        return entry;
      }
      start = at.getAsDouble();
      end = start + ENTRY_DEFAULT_SECONDS;
    }
    return cut(sessionId, wav, start, end).map(url -> entry.withClip(url, source)).orElse(entry);
  }

  private Optional<String> cut(String sessionId, Path wav, double start, double end) {
    try {
      return Optional.of(clipExtractor.extract(sessionId, wav, start, end));
    } catch (IllegalArgumentException | ClipExtractionException e) {
      LOGGER.warn(
          "Skipping clip {}-{}s from {}: {}", start, end, wav.getFileName(), e.getMessage());
      return Optional.empty();
    }
  }

  private static Optional<Path> masterWav(Session session) {
    return session
        .findMasterRecording()
        .map(AudioFile::getFilePath)
        .map(Path::of)
        .filter(path -> path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".wav"))
        .filter(Files::isRegularFile);
  }
}

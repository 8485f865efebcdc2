package com.scholary.discussion.pipeline;

import com.scholary.discussion.analysis.AnalysisOrchestrator;
import com.scholary.discussion.analysis.model.CategoryResults;
import com.scholary.discussion.archive.ArchivedArtifact;
import com.scholary.discussion.archive.ArtifactArchiver;
import com.scholary.discussion.classify.AudioFileNames;
import com.scholary.discussion.classify.ClassificationResult;
import com.scholary.discussion.classify.FileClassifier;
import com.scholary.discussion.clip.HighlightClipService;
import com.scholary.discussion.config.PipelineProperties;
import com.scholary.discussion.ffmpeg.AudioTranscoder;
import com.scholary.discussion.ffmpeg.TranscodingException;
import com.scholary.discussion.folder.StatusFolderOrganizer;
import com.scholary.discussion.folder.StatusFolderViolationException;
import com.scholary.discussion.gladia.GladiaException;
import com.scholary.discussion.gladia.GladiaService;
import com.scholary.discussion.gladia.GladiaUnavailableException;
import com.scholary.discussion.gladia.TranscriptionOptions;
import com.scholary.discussion.gladia.TranscriptionPoll;
import com.scholary.discussion.gladia.TranscriptionPoller;
import com.scholary.discussion.gladia.TranscriptionTimeoutException;
import com.scholary.discussion.gladia.UploadNames;
import com.scholary.discussion.logging.PipelineEventLogger;
import com.scholary.discussion.session.AudioFile;
import com.scholary.discussion.session.AudioProcessingStatus;
import com.scholary.discussion.session.ProcessingStatus;
import com.scholary.discussion.session.Session;
import com.scholary.discussion.session.SessionRepository;
import com.scholary.discussion.stats.SessionStatsCalculator;
import com.scholary.discussion.transcript.SpeakerLabelMapper;
import com.scholary.discussion.transcript.TranscriptSidecarWriter;
import com.scholary.discussion.transcript.UtteranceFormatter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Drives a session through Validate, Convert, Upload, Transcribe, Analyze and Complete.
 *
 * <p>Phases and files run sequentially. The session is persisted after every phase and after every
 * file update, and files that already finished a step (converted, uploaded, submitted or
 * transcribed) are skipped, so running a session again resumes where it stopped. A failing file
 * records its error on {@link AudioFile#getConversionError()} and never aborts the session; the
 * session only fails when the final completeness check does not hold or a phase cannot run at all.
 */
@Service
public class SessionPipelineDriver {

  private static final Logger LOGGER = LoggerFactory.getLogger(SessionPipelineDriver.class);
  private static final PipelineEventLogger EVENTS = new PipelineEventLogger(LOGGER);

  static final String FFMPEG_UNAVAILABLE = "FFMPEG_UNAVAILABLE";

  private final FileClassifier classifier;
  private final StatusFolderOrganizer organizer;
  private final AudioTranscoder transcoder;
  private final GladiaService gladiaService;
  private final TranscriptionPoller poller;
  private final SpeakerLabelMapper labelMapper;
  private final TranscriptSidecarWriter sidecarWriter;
  private final AnalysisOrchestrator analysisOrchestrator;
  private final HighlightClipService highlightClipService;
  private final SessionStatsCalculator statsCalculator;
  private final ArtifactArchiver archiver;
  private final SessionRepository repository;
  private final PipelineProperties properties;
  private final Clock clock;

  public SessionPipelineDriver(
      FileClassifier classifier,
      StatusFolderOrganizer organizer,
      AudioTranscoder transcoder,
      GladiaService gladiaService,
      TranscriptionPoller poller,
      SpeakerLabelMapper labelMapper,
      TranscriptSidecarWriter sidecarWriter,
      AnalysisOrchestrator analysisOrchestrator,
      HighlightClipService highlightClipService,
      SessionStatsCalculator statsCalculator,
      ArtifactArchiver archiver,
      SessionRepository repository,
      PipelineProperties properties,
      Clock clock) {
    this.classifier = classifier;
    this.organizer = organizer;
    this.transcoder = transcoder;
    this.gladiaService = gladiaService;
    this.poller = poller;
    this.labelMapper = labelMapper;
    this.sidecarWriter = sidecarWriter;
    this.analysisOrchestrator = analysisOrchestrator;
    this.highlightClipService = highlightClipService;
    this.statsCalculator = statsCalculator;
    this.archiver = archiver;
    this.repository = repository;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Run every phase for a session.
   *
   * @return the same session, {@link ProcessingStatus#COMPLETE} or {@link ProcessingStatus#FAILED}
   */
  public Session process(Session session) {
    PipelineEventLogger.setSessionContext(session.getId(), session.getSessionName());
    PipelinePhase phase = PipelinePhase.VALIDATE;
    try {
      validate(session);
      phase = PipelinePhase.CONVERT;
      convert(session);
      phase = PipelinePhase.UPLOAD;
      upload(session);
      phase = PipelinePhase.TRANSCRIBE;
      transcribe(session);
      phase = PipelinePhase.ANALYZE;
      analyze(session);
      phase = PipelinePhase.COMPLETE;
      complete(session);
    } catch (PipelineException e) {
      fail(session, e.getMessage());
    } catch (RuntimeException e) {
      LOGGER.error("Session {} failed during {}", session.getId(), phase.label(), e);
      fail(session, "Unexpected error during " + phase.label() + ": " + e.getMessage());
    } finally {
      PipelineEventLogger.clearSessionContext();
    }
    return session;
  }

  /**
   * Run only the analysis phase from the transcripts already stored on the session, then the
   * completeness check.
   */
  public Session reanalyze(Session session) {
    PipelineEventLogger.setSessionContext(session.getId(), session.getSessionName());
    try {
      session.setErrorMessage(null);
      analyze(session);
      complete(session);
    } catch (RuntimeException e) {
      LOGGER.error("Re-analysis of session {} failed", session.getId(), e);
      fail(session, "Unexpected error during analysis: " + e.getMessage());
    } finally {
      PipelineEventLogger.clearSessionContext();
    }
    return session;
  }

  /** Whether the session satisfies the conditions for {@link ProcessingStatus#COMPLETE}. */
  public static boolean isComplete(Session session) {
    return hasTranscribedFile(session) && session.getCategoryResults() != null;
  }

  private void validate(Session session) {
    startPhase(session, PipelinePhase.VALIDATE, ProcessingStatus.VALIDATING);
    session.setErrorMessage(null);
    if (session.getFolderPath() == null) {
      throw new PipelineException("Validation failed: session has no folder");
    }

    if (session.getAudioFiles().isEmpty()) {
      ClassificationResult result;
      try {
        result = classifier.classify(session);
      } catch (IllegalArgumentException | UncheckedIOException e) {
        throw new PipelineException("Validation failed: " + e.getMessage(), e);
      }
      for (String warning : result.warnings()) {
        LOGGER.warn("Data quality warning for session {}: {}", session.getId(), warning);
      }
    } else {
      LOGGER.info(
          "Session {} already classified with {} files, resuming",
          session.getId(),
          session.getAudioFiles().size());
    }

    if (session.getAudioFiles().isEmpty()) {
      throw new PipelineException(
          "Validation failed: no audio files in " + session.getFolderPath());
    }
    probeDurations(session);
    repository.upsert(session);
  }

  private void probeDurations(Session session) {
    boolean missing =
        session.getAudioFiles().stream().anyMatch(file -> file.getDurationSeconds() == null);
    if (!missing || !transcoder.isAvailable()) {
      return;
    }
    for (AudioFile file : session.getAudioFiles()) {
      if (file.getDurationSeconds() == null) {
        OptionalDouble duration = transcoder.probeDurationSeconds(Path.of(file.getFilePath()));
        if (duration.isPresent()) {
          file.setDurationSeconds(duration.getAsDouble());
        }
      }
    }
  }

  private void convert(Session session) {
    startPhase(session, PipelinePhase.CONVERT, ProcessingStatus.TRANSCRIBING);
    Path sessionFolder = Path.of(session.getFolderPath());
    Boolean ffmpegAvailable = null;

    for (AudioFile file : session.getAudioFiles()) {
      if (file.getProcessingStatus() != AudioProcessingStatus.PENDING
          || file.getMp3FilePath() != null
          || !requiresConversion(file)) {
        continue;
      }
      if (ffmpegAvailable == null) {
        ffmpegAvailable = transcoder.isAvailable();
      }
      if (!ffmpegAvailable) {
        markFailed(
            file,
            PipelinePhase.CONVERT,
            FFMPEG_UNAVAILABLE
                + ": ffmpeg is required to convert "
                + file.getFileSize()
                + " byte WAV file",
            false,
            sessionFolder);
        repository.upsert(session);
        continue;
      }

      Path output =
          organizer
              .folderFor(AudioProcessingStatus.PENDING_MP3, sessionFolder)
              .resolve(file.getBaseName() + ".mp3");
      try {
        transcoder.convertToMp3(Path.of(file.getFilePath()), output);
      } catch (TranscodingException e) {
        deletePartialOutput(output);
        String message = "Conversion failed: " + e.getMessage();
        markFailed(file, PipelinePhase.CONVERT, message, true, sessionFolder);
        repository.upsert(session);
        continue;
      }

      // The WAV stays in the session folder; clips are cut from it later.
      file.setMp3FilePath(output.toString());
      AudioProcessingStatus from = file.getProcessingStatus();
      file.setProcessingStatus(AudioProcessingStatus.PENDING_MP3);
      EVENTS.logFileStatusChanged(file.getFileName(), from.name(), "PENDING_MP3");
      repository.upsert(session);
    }
  }

  private static void deletePartialOutput(Path output) {
    try {
      if (Files.deleteIfExists(output)) {
        LOGGER.info("Deleted partial conversion output {}", output);
      }
    } catch (IOException e) {
      LOGGER.warn("Could not delete partial conversion output {}: {}", output, e.getMessage());
    }
  }

  private void upload(Session session) {
    startPhase(session, PipelinePhase.UPLOAD, null);
    Path sessionFolder = Path.of(session.getFolderPath());

    for (AudioFile file : session.getAudioFiles()) {
      if (!awaitingUpload(file)) {
        continue;
      }
      Path source = Path.of(file.getUploadPath());
      String displayName =
          UploadNames.displayName(session.getSessionName(), source.getFileName().toString());
      try {
        file.setAudioUrl(gladiaService.upload(source, displayName));
        transition(file, AudioProcessingStatus.UPLOADED_TO_GLADIA, sessionFolder);
      } catch (GladiaException e) {
        markFailed(
            file, PipelinePhase.UPLOAD, "Upload failed: " + e.getMessage(), true, sessionFolder);
      }
      repository.upsert(session);
    }
  }

  private void transcribe(Session session) {
    startPhase(session, PipelinePhase.TRANSCRIBE, null);
    Path sessionFolder = Path.of(session.getFolderPath());
    Map<Integer, String> assignments = session.getMicAssignments();

    for (AudioFile file : session.getAudioFiles()) {
      AudioProcessingStatus status = file.getProcessingStatus();
      if (status.isFailure() || status.isTranscribed() || file.getAudioUrl() == null) {
        continue;
      }
      try {
        if (file.getTranscriptId() == null) {
          TranscriptionOptions options =
              TranscriptionOptions.forFile(file.getFileName(), assignments.size());
          file.setTranscriptId(gladiaService.submit(file.getAudioUrl(), options));
          repository.upsert(session);
        }
        TranscriptionPoll poll = poller.awaitResult(file.getTranscriptId());
        String text =
            UtteranceFormatter.format(
                file.getFileName(), poll.job().result().transcription(), assignments);
        file.setTranscriptText(labelMapper.map(file.getFileName(), text, assignments));
        transition(file, AudioProcessingStatus.TRANSCRIPTION_COMPLETE, sessionFolder);
        writeSidecars(file, poll.rawJson());
      } catch (TranscriptionTimeoutException e) {
        // Keep the job id: a later run resumes polling the same job.
        String message = "Transcription timed out: " + e.getMessage();
        markFailed(file, PipelinePhase.TRANSCRIBE, message, true, sessionFolder);
      } catch (GladiaUnavailableException e) {
        String message = "Transcription service unreachable: " + e.getMessage();
        markFailed(file, PipelinePhase.TRANSCRIBE, message, true, sessionFolder);
      } catch (GladiaException e) {
        file.setTranscriptId(null);
        String message = "Transcription failed: " + e.getMessage();
        markFailed(file, PipelinePhase.TRANSCRIBE, message, true, sessionFolder);
      }
      repository.upsert(session);
    }

    updateParticipants(session);
    repository.upsert(session);
    if (!hasTranscribedFile(session)) {
      throw new PipelineException("Transcription failed: no audio file produced a transcript");
    }
  }

  private void analyze(Session session) {
    startPhase(session, PipelinePhase.ANALYZE, ProcessingStatus.ANALYZING);
    CategoryResults results = analysisOrchestrator.analyze(session);
    results = highlightClipService.attachClips(session, results);
    session.setCategoryResults(results);
    session.setSessionStats(statsCalculator.calculate(session, results));
    repository.upsert(session);

    List<ArchivedArtifact> archived = archiver.archive(session);
    if (!archived.isEmpty()) {
      LOGGER.info("Session {}: {} artifacts archived", session.getId(), archived.size());
    }
  }

  private void complete(Session session) {
    startPhase(session, PipelinePhase.COMPLETE, null);
    if (!hasTranscribedFile(session)) {
      fail(session, "Completion check failed after transcription: no transcribed audio file");
      return;
    }
    if (session.getCategoryResults() == null) {
      fail(session, "Completion check failed after analysis: no analysis results");
      return;
    }
    session.setStatus(ProcessingStatus.COMPLETE);
    session.setErrorMessage(null);
    session.setProcessedAt(clock.instant());
    repository.upsert(session);
    LOGGER.info(
        "Session {} complete: {} participants present, analysis {}",
        session.getId(),
        session.getParticipantsPresent().size(),
        session.getCategoryResults().degraded() ? "degraded" : "ok");
  }

  private void fail(Session session, String message) {
    LOGGER.error("Session {} failed: {}", session.getId(), message);
    session.setStatus(ProcessingStatus.FAILED);
    session.setErrorMessage(message);
    repository.upsert(session);
  }

  private void startPhase(Session session, PipelinePhase phase, ProcessingStatus status) {
    EVENTS.logPhaseStarted(session.getId(), phase.label());
    if (status != null) {
      session.setStatus(status);
      repository.upsert(session);
    }
  }

  private boolean requiresConversion(AudioFile file) {
    return AudioFileNames.extension(file.getFileName()).equals("wav")
        && file.getFileSize() > properties.largeFileThresholdBytes();
  }

  private boolean awaitingUpload(AudioFile file) {
    AudioProcessingStatus status = file.getProcessingStatus();
    if (status.isFailure() || status.isTranscribed()) {
      return false;
    }
    if (file.getAudioUrl() != null || file.getTranscriptId() != null) {
      return false;
    }
    return file.getMp3FilePath() != null || !requiresConversion(file);
  }

  private void transition(AudioFile file, AudioProcessingStatus to, Path sessionFolder) {
    AudioProcessingStatus from = file.getProcessingStatus();
    organizer.moveAudioFile(file, to, sessionFolder);
    EVENTS.logFileStatusChanged(file.getFileName(), from.name(), to.name());
  }

  private void markFailed(
      AudioFile file,
      PipelinePhase phase,
      String message,
      boolean retryEligible,
      Path sessionFolder) {
    file.setConversionError(message);
    file.setRetryEligible(retryEligible);
    EVENTS.logFileFailed(file.getFileName(), phase.label(), message);

    AudioProcessingStatus failed = failureStatusFor(file);
    try {
      transition(file, failed, sessionFolder);
    } catch (StatusFolderViolationException | UncheckedIOException e) {
      LOGGER.warn("Could not move {} to {}: {}", file.getFileName(), failed, e.getMessage());
      file.setProcessingStatus(failed);
    }
  }

  /** FAILED_MP3 for MP3 working copies, FAILED for everything else. */
  static AudioProcessingStatus failureStatusFor(AudioFile file) {
    String uploadName = Path.of(file.getUploadPath()).getFileName().toString();
    return AudioFileNames.extension(uploadName).equals("mp3")
        ? AudioProcessingStatus.FAILED_MP3
        : AudioProcessingStatus.FAILED;
  }

  private void writeSidecars(AudioFile file, String rawJson) {
    Path directory = Path.of(file.getUploadPath()).toAbsolutePath().getParent();
    try {
      sidecarWriter.write(file, directory, rawJson, file.getTranscriptText());
    } catch (IOException e) {
      LOGGER.warn(
          "Failed to write transcript sidecars for {}: {}", file.getFileName(), e.getMessage());
    }
  }

  /**
   * Present: assigned participants whose mic file produced a transcript. Absent: everyone else who
   * was assigned a mic.
   */
  static void updateParticipants(Session session) {
    List<String> present = new ArrayList<>();
    List<String> absent = new ArrayList<>();
    for (Map.Entry<Integer, String> assignment : session.getMicAssignments().entrySet()) {
      String name = assignment.getValue();
      if (name == null || name.isBlank()) {
        continue;
      }
      boolean spoke =
          session.getAudioFiles().stream()
              .anyMatch(
                  file ->
                      assignment.getKey().equals(file.getSpeakerNumber())
                          && file.hasTranscript());
      if (spoke) {
        present.add(name);
      } else {
        absent.add(name);
      }
    }
    session.setParticipantsPresent(present);
    session.setParticipantsAbsent(absent);
  }

  private static boolean hasTranscribedFile(Session session) {
    return session.getAudioFiles().stream()
        .anyMatch(file -> file.getProcessingStatus().isTranscribed() && file.hasTranscript());
  }
}

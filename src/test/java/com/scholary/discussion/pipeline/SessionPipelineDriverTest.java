package com.scholary.discussion.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.discussion.analysis.AnalysisOrchestrator;
import com.scholary.discussion.analysis.model.CategoryResults;
import com.scholary.discussion.archive.ArtifactArchiver;
import com.scholary.discussion.classify.FileClassifier;
import com.scholary.discussion.clip.HighlightClipService;
import com.scholary.discussion.config.PipelineProperties;
import com.scholary.discussion.ffmpeg.AudioTranscoder;
import com.scholary.discussion.ffmpeg.TranscodingException;
import com.scholary.discussion.folder.StatusFolderOrganizer;
import com.scholary.discussion.gladia.GladiaException;
import com.scholary.discussion.gladia.GladiaJob;
import com.scholary.discussion.gladia.GladiaService;
import com.scholary.discussion.gladia.GladiaUnavailableException;
import com.scholary.discussion.gladia.TranscriptionPoll;
import com.scholary.discussion.gladia.TranscriptionPoller;
import com.scholary.discussion.gladia.TranscriptionTimeoutException;
import com.scholary.discussion.session.AudioFile;
import com.scholary.discussion.session.AudioProcessingStatus;
import com.scholary.discussion.session.InMemorySessionRepository;
import com.scholary.discussion.session.ProcessingStatus;
import com.scholary.discussion.session.Session;
import com.scholary.discussion.session.SessionRepository;
import com.scholary.discussion.stats.SessionStatsCalculator;
import com.scholary.discussion.transcript.SpeakerLabelMapper;
import com.scholary.discussion.transcript.TranscriptSidecarWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SessionPipelineDriverTest {

  private static final Instant NOW = Instant.parse("2024-03-15T22:00:00Z");
  private static final String RAW_JSON = "{\"id\": \"job\", \"status\": \"done\"}";

  @Mock private AudioTranscoder transcoder;
  @Mock private GladiaService gladiaService;
  @Mock private TranscriptionPoller poller;
  @Mock private AnalysisOrchestrator analysisOrchestrator;
  @Mock private HighlightClipService highlightClipService;
  @Mock private SessionStatsCalculator statsCalculator;
  @Mock private ArtifactArchiver archiver;

  @TempDir Path tempDir;

  private SessionRepository repository;
  private SessionPipelineDriver driver;
  private Path sessionFolder;
  private Session session;

  @BeforeEach
  void setUp() throws IOException {
    Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    repository = new InMemorySessionRepository(100, 1, clock);
    PipelineProperties properties =
        new PipelineProperties(
            tempDir.toString(), tempDir.resolve("clips").toString(), 10_000, 1_000L, 1, 1, 60);
    driver =
        new SessionPipelineDriver(
            new FileClassifier(),
            new StatusFolderOrganizer(),
            transcoder,
            gladiaService,
            poller,
            new SpeakerLabelMapper(),
            new TranscriptSidecarWriter(new ObjectMapper()),
            analysisOrchestrator,
            highlightClipService,
            statsCalculator,
            archiver,
            repository,
            properties,
            clock);

    sessionFolder = Files.createDirectories(tempDir.resolve("movie-night"));
    session = new Session("s1", NOW);
    session.setFolderPath(sessionFolder.toString());
    session.setMicAssignments(Map.of(0, "Alice", 1, "Bob", 2, "Carol"));

    when(gladiaService.upload(any(Path.class), anyString()))
        .thenAnswer(invocation -> "https://upload/" + invocation.getArgument(1));
    when(gladiaService.submit(anyString(), any())).thenReturn("job-1");
    when(poller.awaitResult("job-1")).thenReturn(poll("hello there"));
    when(transcoder.probeDurationSeconds(any(Path.class))).thenReturn(OptionalDouble.empty());
    when(analysisOrchestrator.analyze(any(Session.class)))
        .thenReturn(CategoryResults.of(Map.of(), Map.of(), List.of()));
    when(highlightClipService.attachClips(any(Session.class), any()))
        .thenAnswer(invocation -> invocation.getArgument(1));
  }

  @Test
  void process_shouldCompleteWhenFilesAreTranscribed() throws IOException {
    writeAudio("MIC1.wav", 100);
    writeAudio("MIC2.wav", 100);
    writeAudio("MASTER_MIX.wav", 200);

    driver.process(session);

    assertThat(session.getStatus()).isEqualTo(ProcessingStatus.COMPLETE);
    assertThat(session.getProcessedAt()).isEqualTo(NOW);
    assertThat(session.getErrorMessage()).isNull();
    assertThat(session.getAudioFiles())
        .allSatisfy(
            file -> {
              assertThat(file.getProcessingStatus())
                  .isEqualTo(AudioProcessingStatus.TRANSCRIPTION_COMPLETE);
              assertThat(Path.of(file.getFilePath()))
                  .isRegularFile()
                  .hasParent(tempDir.resolve("processed_mp3").resolve("movie-night"));
              assertThat(file.getTranscriptionJsonPath()).isNotNull();
            });
    assertThat(transcript(session, "MIC2.wav")).isEqualTo("Bob: hello there");
    assertThat(session.getParticipantsPresent()).containsExactly("Alice", "Bob");
    assertThat(session.getParticipantsAbsent()).containsExactly("Carol");
    assertThat(repository.getById("s1")).containsSame(session);
    verify(archiver).archive(session);
  }

  @Test
  void process_shouldIsolateUploadFailureToItsFile() throws IOException {
    writeAudio("MIC1.wav", 100);
    writeAudio("MIC2.wav", 100);
    when(gladiaService.upload(argThat(path -> path.endsWith("MIC2.wav")), anyString()))
        .thenThrow(new GladiaException("HTTP 503"));

    driver.process(session);

    assertThat(session.getStatus()).isEqualTo(ProcessingStatus.COMPLETE);
    AudioFile failed = file(session, "MIC2.wav");
    assertThat(failed.getProcessingStatus()).isEqualTo(AudioProcessingStatus.FAILED);
    assertThat(failed.getConversionError()).isEqualTo("Upload failed: HTTP 503");
    assertThat(failed.isRetryEligible()).isTrue();
    assertThat(Path.of(failed.getFilePath()))
        .hasParent(tempDir.resolve("failed").resolve("movie-night"));
    assertThat(session.getParticipantsAbsent()).contains("Bob");
  }

  @Test
  void process_shouldFailLargeWavWhenFfmpegIsMissing() throws IOException {
    writeAudio("MIC1.wav", 5_000);
    writeAudio("MIC2.wav", 100);
    when(transcoder.isAvailable()).thenReturn(false);

    driver.process(session);

    AudioFile large = file(session, "MIC1.wav");
    assertThat(large.getProcessingStatus()).isEqualTo(AudioProcessingStatus.FAILED);
    assertThat(large.getConversionError())
        .startsWith(SessionPipelineDriver.FFMPEG_UNAVAILABLE + ":");
    assertThat(large.isRetryEligible()).isFalse();
    verify(gladiaService, never()).upload(eq(Path.of(large.getFilePath())), anyString());
    assertThat(session.getStatus()).isEqualTo(ProcessingStatus.COMPLETE);
  }

  @Test
  void process_shouldConvertLargeWavAndUploadTheMp3() throws IOException {
    Path wav = writeAudio("MIC1.wav", 5_000);
    when(transcoder.isAvailable()).thenReturn(true);
    doAnswer(
            invocation -> {
              Path output = invocation.getArgument(1);
              Files.write(output, new byte[64]);
              return null;
            })
        .when(transcoder)
        .convertToMp3(any(Path.class), any(Path.class));

    driver.process(session);

    AudioFile file = file(session, "MIC1.wav");
    assertThat(file.getProcessingStatus()).isEqualTo(AudioProcessingStatus.TRANSCRIPTION_COMPLETE);
    assertThat(Path.of(file.getMp3FilePath()))
        .isRegularFile()
        .hasParent(tempDir.resolve("processed_mp3").resolve("movie-night"));
    assertThat(wav).isRegularFile();
    verify(gladiaService)
        .upload(argThat(path -> path.getFileName().toString().equals("MIC1.mp3")), anyString());
  }

  @Test
  void process_shouldDeletePartialMp3WhenConversionFails() throws IOException {
    writeAudio("MIC1.wav", 5_000);
    writeAudio("MIC2.wav", 100);
    when(transcoder.isAvailable()).thenReturn(true);
    doAnswer(
            invocation -> {
              Path output = invocation.getArgument(1);
              Files.write(output, new byte[16]);
              throw new TranscodingException("ffmpeg exited with code 1");
            })
        .when(transcoder)
        .convertToMp3(any(Path.class), any(Path.class));

    driver.process(session);

    AudioFile large = file(session, "MIC1.wav");
    assertThat(large.getConversionError()).startsWith("Conversion failed:");
    assertThat(large.getMp3FilePath()).isNull();
    assertThat(tempDir.resolve("pending_mp3").resolve("movie-night").resolve("MIC1.mp3"))
        .doesNotExist();
    assertThat(session.getStatus()).isEqualTo(ProcessingStatus.COMPLETE);
  }

  @Test
  void process_shouldFailWhenNoFileIsTranscribed() throws IOException {
    writeAudio("MIC1.wav", 100);
    when(poller.awaitResult("job-1")).thenThrow(new GladiaException("job error: bad audio"));

    driver.process(session);

    assertThat(session.getStatus()).isEqualTo(ProcessingStatus.FAILED);
    assertThat(session.getErrorMessage())
        .isEqualTo("Transcription failed: no audio file produced a transcript");
    AudioFile file = file(session, "MIC1.wav");
    assertThat(file.getTranscriptId()).isNull();
    assertThat(file.getConversionError()).startsWith("Transcription failed:");
    verify(analysisOrchestrator, never()).analyze(any(Session.class));
  }

  @Test
  void process_shouldKeepJobIdWhenPollingTimesOut() throws IOException {
    writeAudio("MIC1.wav", 100);
    when(poller.awaitResult("job-1")).thenThrow(new TranscriptionTimeoutException("30 minutes"));

    driver.process(session);

    AudioFile file = file(session, "MIC1.wav");
    assertThat(file.getTranscriptId()).isEqualTo("job-1");
    assertThat(file.isRetryEligible()).isTrue();
    assertThat(file.getConversionError()).startsWith("Transcription timed out");
  }

  @Test
  void process_shouldKeepJobIdWhenServiceIsUnreachable() throws IOException {
    writeAudio("MIC1.wav", 100);
    when(poller.awaitResult("job-1"))
        .thenThrow(new GladiaUnavailableException("Fetch of job-1 failed after 3 attempts"));

    driver.process(session);

    AudioFile file = file(session, "MIC1.wav");
    assertThat(file.getTranscriptId()).isEqualTo("job-1");
    assertThat(file.isRetryEligible()).isTrue();
    assertThat(file.getConversionError()).startsWith("Transcription service unreachable");
  }

  @Test
  void process_shouldResumeWithoutUploadingAgain() throws IOException {
    Path wav = writeAudio("MIC1.wav", 100);
    AudioFile file = new AudioFile("MIC1.wav", wav.toString(), 100);
    file.setSpeakerNumber(0);
    file.setIdentified(true);
    file.setAudioUrl("https://upload/earlier");
    file.setTranscriptId("job-1");
    file.setProcessingStatus(AudioProcessingStatus.UPLOADED_TO_GLADIA);
    session.getAudioFiles().add(file);

    driver.process(session);

    verify(gladiaService, never()).upload(any(Path.class), anyString());
    verify(gladiaService, never()).submit(anyString(), any());
    assertThat(session.getStatus()).isEqualTo(ProcessingStatus.COMPLETE);
  }

  @Test
  void process_shouldFailValidationForEmptyFolder() {
    driver.process(session);

    assertThat(session.getStatus()).isEqualTo(ProcessingStatus.FAILED);
    assertThat(session.getErrorMessage()).startsWith("Validation failed");
  }

  @Test
  void process_shouldNameThePhaseOfUnexpectedErrors() throws IOException {
    writeAudio("MIC1.wav", 100);
    when(analysisOrchestrator.analyze(any(Session.class)))
        .thenThrow(new IllegalStateException("boom"));

    driver.process(session);

    assertThat(session.getStatus()).isEqualTo(ProcessingStatus.FAILED);
    assertThat(session.getErrorMessage()).isEqualTo("Unexpected error during analysis: boom");
  }

  @Test
  void reanalyze_shouldReplaceResultsAndComplete() {
    AudioFile file = new AudioFile("MIC1.wav", "/nowhere/MIC1.wav", 100);
    file.setProcessingStatus(AudioProcessingStatus.TRANSCRIPTION_COMPLETE);
    file.setTranscriptText("Alice: hi");
    session.getAudioFiles().add(file);
    session.setStatus(ProcessingStatus.FAILED);
    session.setErrorMessage("old error");

    driver.reanalyze(session);

    assertThat(session.getStatus()).isEqualTo(ProcessingStatus.COMPLETE);
    assertThat(session.getErrorMessage()).isNull();
    assertThat(session.getCategoryResults()).isNotNull();
  }

  @Test
  void isComplete_shouldRequireTranscriptAndResults() {
    AudioFile file = new AudioFile("MIC1.wav", "/nowhere/MIC1.wav", 100);
    session.getAudioFiles().add(file);
    assertThat(SessionPipelineDriver.isComplete(session)).isFalse();

    file.setProcessingStatus(AudioProcessingStatus.TRANSCRIPTION_COMPLETE);
    file.setTranscriptText("Alice: hi");
    assertThat(SessionPipelineDriver.isComplete(session)).isFalse();

    session.setCategoryResults(CategoryResults.degraded("call failed"));
    assertThat(SessionPipelineDriver.isComplete(session)).isTrue();
  }

  @Test
  void failureStatusFor_shouldFollowWorkingCopyType() {
    AudioFile file = new AudioFile("MIC1.wav", "/x/MIC1.wav", 100);
    assertThat(SessionPipelineDriver.failureStatusFor(file))
        .isEqualTo(AudioProcessingStatus.FAILED);

    file.setMp3FilePath("/x/pending_mp3/MIC1.mp3");
    assertThat(SessionPipelineDriver.failureStatusFor(file))
        .isEqualTo(AudioProcessingStatus.FAILED_MP3);
  }

  private Path writeAudio(String name, int size) throws IOException {
    return Files.write(sessionFolder.resolve(name), new byte[size]);
  }

  private static TranscriptionPoll poll(String text) {
    GladiaJob.Transcription transcription =
        new GladiaJob.Transcription(
            text, List.of(new GladiaJob.Utterance(0.0, 1.5, text, 0, 0.9)));
    return new TranscriptionPoll(
        new GladiaJob("job-1", GladiaJob.STATUS_DONE, new GladiaJob.Result(transcription), null),
        RAW_JSON);
  }

  private static AudioFile file(Session session, String name) {
    return session.getAudioFiles().stream()
        .filter(f -> f.getFileName().equals(name))
        .findFirst()
        .orElseThrow();
  }

  private static String transcript(Session session, String name) {
    return file(session, name).getTranscriptText();
  }
}

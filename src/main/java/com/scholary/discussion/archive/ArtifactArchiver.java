package com.scholary.discussion.archive;

import com.scholary.discussion.config.PipelineProperties;
import com.scholary.discussion.session.AudioFile;
import com.scholary.discussion.session.Session;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * Copies the artifacts of a processed session to the archive bucket.
 *
 * <p>Archived: transcript sidecars ({@code transcripts/}), analysis audit records ({@code
 * analysis/}) and clips ({@code clips/}), all under {@code sessions/{sessionId}/}. Does nothing
 * unless an {@link ObjectStoreClient} bean exists, i.e. {@code archive.enabled=true}. A failed
 * upload is logged and skipped; archiving never fails a session.
 */
@Component
public class ArtifactArchiver {

  private static final Logger LOGGER = LoggerFactory.getLogger(ArtifactArchiver.class);

  static final String AUDIT_PREFIX = "openai_analysis_";

  private final ObjectProvider<ObjectStoreClient> clientProvider;
  private final ObjectStoreProperties properties;
  private final PipelineProperties pipelineProperties;

  public ArtifactArchiver(
      ObjectProvider<ObjectStoreClient> clientProvider,
      ObjectStoreProperties properties,
      PipelineProperties pipelineProperties) {
    this.clientProvider = clientProvider;
    this.properties = properties;
    this.pipelineProperties = pipelineProperties;
  }

  public boolean isEnabled() {
    return clientProvider.getIfAvailable() != null;
  }

  /**
   * Archive everything the session has produced so far.
   *
   * @return the artifacts that were stored, empty when archiving is disabled
   */
  public List<ArchivedArtifact> archive(Session session) {
    ObjectStoreClient client = clientProvider.getIfAvailable();
    if (client == null) {
      LOGGER.debug("Archive disabled, skipping session {}", session.getId());
      return List.of();
    }

    Map<String, Path> artifacts = collect(session);
    List<ArchivedArtifact> archived = new ArrayList<>();
    Duration ttl = Duration.ofHours(properties.presignTtlHours());
    for (Map.Entry<String, Path> artifact : artifacts.entrySet()) {
      String key = artifact.getKey();
      Path file = artifact.getValue();
      try (InputStream data = Files.newInputStream(file)) {
        client.putObject(properties.bucket(), key, data, Files.size(file), contentType(file));
      } catch (IOException | ObjectStoreException e) {
        LOGGER.warn(
            "Failed to archive {} for session {}: {}", file, session.getId(), e.getMessage());
        continue;
      }
      archived.add(new ArchivedArtifact(key, presign(client, key, ttl)));
    }

    LOGGER.info(
        "Archived {}/{} artifacts for session {} to bucket {}",
        archived.size(),
        artifacts.size(),
        session.getId(),
        properties.bucket());
    return archived;
  }

  /** Object key for an artifact of the given kind. */
  static String keyFor(String sessionId, String kind, Path file) {
    return "sessions/" + sessionId + "/" + kind + "/" + file.getFileName();
  }

  Map<String, Path> collect(Session session) {
    Map<String, Path> artifacts = new LinkedHashMap<>();
    String sessionId = session.getId();

    for (AudioFile file : session.getAudioFiles()) {
      if (file.getTranscriptionJsonPath() == null) {
        continue;
      }
      Path json = Path.of(file.getTranscriptionJsonPath());
      Path text = json.resolveSibling(file.getBaseName() + ".txt");
      addIfPresent(artifacts, keyFor(sessionId, "transcripts", json), json);
      addIfPresent(artifacts, keyFor(sessionId, "transcripts", text), text);
    }

    if (session.getFolderPath() != null) {
      for (Path audit : list(Path.of(session.getFolderPath()))) {
        String name = audit.getFileName().toString();
        if (name.startsWith(AUDIT_PREFIX) && name.endsWith(".json")) {
          artifacts.put(keyFor(sessionId, "analysis", audit), audit);
        }
      }
    }

    for (Path clip : list(Path.of(pipelineProperties.clipsDir()).resolve(sessionId))) {
      if (clip.getFileName().toString().endsWith(".wav")) {
        artifacts.put(keyFor(sessionId, "clips", clip), clip);
      }
    }
    return artifacts;
  }

  private static void addIfPresent(Map<String, Path> artifacts, String key, Path file) {
    if (Files.isRegularFile(file)) {
      artifacts.put(key, file);
    }
  }

  private static List<Path> list(Path folder) {
    if (!Files.isDirectory(folder)) {
      return List.of();
    }
    try (Stream<Path> entries = Files.list(folder)) {
      return entries.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to list " + folder, e);
    }
  }

  private String presign(ObjectStoreClient client, String key, Duration ttl) {
    try {
      return client.presignGet(properties.bucket(), key, ttl).toString();
    } catch (ObjectStoreException e) {
      LOGGER.warn("No presigned URL for {}: {}", key, e.getMessage());
      return null;
    }
  }

  private static String contentType(Path file) {
    String name = file.getFileName().toString();
    if (name.endsWith(".json")) {
      return "application/json";
    }
    if (name.endsWith(".wav")) {
      return "audio/wav";
    }
    return "text/plain; charset=utf-8";
  }
}

package com.scholary.discussion.folder;

import com.scholary.discussion.classify.AudioFileNames;
import com.scholary.discussion.session.AudioFile;
import com.scholary.discussion.session.AudioProcessingStatus;
import com.scholary.discussion.session.AudioProcessingStatus.Stage;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Keeps each file in the folder that encodes its processing status.
 *
 * <p>Layout: {@code root/{status folder}/{session name}/{file}}, where root is the parent of the
 * session folder. Folders are created on demand. All path construction for status folders goes
 * through {@link #folderFor}; all moves go through {@link #moveToStatus}, which enforces that MP3
 * files never enter WAV-stage folders and vice versa.
 */
@Component
public class StatusFolderOrganizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(StatusFolderOrganizer.class);

  private static final Set<String> STATUS_FOLDER_NAMES =
      Arrays.stream(AudioProcessingStatus.values())
          .map(AudioProcessingStatus::folderName)
          .collect(Collectors.toUnmodifiableSet());

  /**
   * Folder for a status, creating it if needed.
   *
   * @param status the processing status
   * @param sessionFolder the session folder, either at root level or already inside a status folder
   */
  public Path folderFor(AudioProcessingStatus status, Path sessionFolder) {
    Path rootSession = rootSessionFolder(sessionFolder);
    Path root = rootSession.getParent();
    if (root == null) {
      throw new IllegalArgumentException("Session folder has no parent: " + sessionFolder);
    }
    Path folder = root.resolve(status.folderName()).resolve(rootSession.getFileName());
    try {
      Files.createDirectories(folder);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to create status folder " + folder, e);
    }
    return folder;
  }

  /**
   * Move a file into the folder of the given status.
   *
   * <p>Already in place: nothing happens. Name taken: {@code name_1.ext}, {@code name_2.ext}, ...
   * is used instead. With {@code cleanupSource}, the source session folder is deleted if the move
   * left it empty, and so is its status folder.
   *
   * @return the file's new path
   * @throws StatusFolderViolationException if the file's type does not belong in that status folder
   */
  public Path moveToStatus(
      Path file, AudioProcessingStatus status, Path sessionFolder, boolean cleanupSource) {
    checkStage(file, status);

    Path targetFolder = folderFor(status, sessionFolder);
    Path sourceFolder = file.toAbsolutePath().normalize().getParent();
    if (sourceFolder != null && sourceFolder.equals(targetFolder.toAbsolutePath())) {
      LOGGER.debug("{} already in {} folder", file.getFileName(), status.folderName());
      return file;
    }
    if (!Files.exists(file)) {
      throw new UncheckedIOException(new IOException("Source file not found for move: " + file));
    }

    Path target = freeTarget(targetFolder, file.getFileName().toString());
    try {
      Files.move(file, target);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to move " + file + " to " + target, e);
    }
    LOGGER.info("Moved {} to {} (status {})", file.getFileName(), target, status);

    if (cleanupSource && sourceFolder != null) {
      cleanupEmptyStatusFolder(sourceFolder);
    }
    return target;
  }

  /**
   * Move an audio file's current working copy (its MP3 if one exists, else the original) to the
   * folder of {@code newStatus}, then record the new path and status on the file.
   */
  public void moveAudioFile(
      AudioFile audioFile, AudioProcessingStatus newStatus, Path sessionFolder) {
    boolean movingMp3 = audioFile.getMp3FilePath() != null;
    Path current = Path.of(audioFile.getUploadPath());
    checkStage(current, newStatus);

    if (Files.exists(current)) {
      Path moved = moveToStatus(current, newStatus, sessionFolder, true);
      if (movingMp3) {
        audioFile.setMp3FilePath(moved.toString());
      } else {
        audioFile.setFilePath(moved.toString());
        audioFile.setFileName(moved.getFileName().toString());
      }
    } else {
      LOGGER.warn("File {} missing on disk, updating status only", current);
    }
    audioFile.setProcessingStatus(newStatus);
  }

  /** Status implied by a file's location; files outside any status folder count as pending. */
  public AudioProcessingStatus statusFromPath(Path file) {
    Path sessionFolder = file.toAbsolutePath().getParent();
    Path statusFolder = sessionFolder == null ? null : sessionFolder.getParent();
    if (statusFolder == null || statusFolder.getFileName() == null) {
      return AudioProcessingStatus.PENDING;
    }
    switch (statusFolder.getFileName().toString().toLowerCase(Locale.ROOT)) {
      case "failed":
        return AudioProcessingStatus.FAILED;
      case "pending_mp3":
        return AudioProcessingStatus.PENDING_MP3;
      case "failed_mp3":
        return AudioProcessingStatus.FAILED_MP3;
      case "processed_mp3":
        return AudioProcessingStatus.PROCESSED_MP3;
      default:
        return AudioProcessingStatus.PENDING;
    }
  }

  /** The root-level session folder, stripping a status folder if the path is inside one. */
  public Path rootSessionFolder(Path sessionFolder) {
    Path absolute = sessionFolder.toAbsolutePath().normalize();
    Path parent = absolute.getParent();
    if (parent != null && isStatusFolder(parent) && parent.getParent() != null) {
      return parent.getParent().resolve(absolute.getFileName());
    }
    return absolute;
  }

  /**
   * Fail fast if a file of this type may not enter the status's folder.
   *
   * @throws StatusFolderViolationException on a WAV-stage/MP3-stage mismatch
   */
  public void checkStage(Path file, AudioProcessingStatus status) {
    boolean mp3 = AudioFileNames.extension(file.getFileName().toString()).equals("mp3");
    if (mp3 && status.stage() == Stage.WAV) {
      throw new StatusFolderViolationException(
          String.format(
              "MP3 file %s cannot be moved to WAV-stage folder '%s' (status %s)",
              file.getFileName(), status.folderName(), status));
    }
    if (!mp3 && status.stage() == Stage.MP3) {
      throw new StatusFolderViolationException(
          String.format(
              "Non-MP3 file %s cannot be moved to MP3-stage folder '%s' (status %s)",
              file.getFileName(), status.folderName(), status));
    }
  }

  private Path freeTarget(Path folder, String fileName) {
    Path target = folder.resolve(fileName);
    if (!Files.exists(target)) {
      return target;
    }
    String base = AudioFileNames.baseName(fileName);
    String extension = fileName.substring(base.length());
    int counter = 1;
    do {
      target = folder.resolve(base + "_" + counter + extension);
      counter++;
    } while (Files.exists(target));
    return target;
  }

  private void cleanupEmptyStatusFolder(Path sessionFolder) {
    Path statusFolder = sessionFolder.getParent();
    if (statusFolder == null || !isStatusFolder(statusFolder)) {
      return;
    }
    try {
      if (isEmptyDirectory(sessionFolder)) {
        Files.delete(sessionFolder);
        LOGGER.debug("Removed empty session folder {}", sessionFolder);
        if (isEmptyDirectory(statusFolder)) {
          Files.delete(statusFolder);
          LOGGER.debug("Removed empty status folder {}", statusFolder);
        }
      }
    } catch (IOException e) {
      LOGGER.warn("Failed to clean up {}: {}", sessionFolder, e.getMessage());
    }
  }

  private boolean isEmptyDirectory(Path folder) throws IOException {
    if (!Files.isDirectory(folder)) {
      return false;
    }
    try (Stream<Path> entries = Files.list(folder)) {
      return entries.findAny().isEmpty();
    }
  }

  private boolean isStatusFolder(Path folder) {
    Path name = folder.getFileName();
    return name != null && STATUS_FOLDER_NAMES.contains(name.toString().toLowerCase(Locale.ROOT));
  }
}

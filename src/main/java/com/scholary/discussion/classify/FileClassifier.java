package com.scholary.discussion.classify;

import com.scholary.discussion.session.AudioFile;
import com.scholary.discussion.session.Session;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Classifies the recordings of a session folder.
 *
 * <p>Rules, first match wins:
 *
 * <ol>
 *   <li>{@code MIC<N>.<ext>} is an individual mic with speaker slot {@code N-1}
 *   <li>{@code <N>_Speaker...} (older recorder firmware) is handled the same way
 *   <li>{@code PHONE} and {@code SOUND_PAD} are auxiliary inputs without a slot
 *   <li>a timestamped name ({@code 2024_0315_1900.wav}) or one containing master, combined, full or
 *       group is the master recording
 * </ol>
 *
 * <p>If nothing qualifies as master, a single unidentified file becomes the master by elimination;
 * with several unidentified files the largest wins. The chosen master is renamed to {@code
 * MASTER_MIX.<ext>} unless a file of that name already exists.
 */
@Component
public class FileClassifier {

  private static final Logger LOGGER = LoggerFactory.getLogger(FileClassifier.class);

  /**
   * Classify every audio file in the session's folder and store the result on the session.
   *
   * @param session the session whose {@code folderPath} is scanned; its audio file list is replaced
   * @return the classification, including the chosen master and any warnings
   */
  public ClassificationResult classify(Session session) {
    Path folder = Path.of(session.getFolderPath());
    List<AudioFile> files = scan(folder);

    Map<String, FileRole> roles = new LinkedHashMap<>();
    List<AudioFile> masterCandidates = new ArrayList<>();
    List<AudioFile> unidentified = new ArrayList<>();
    List<String> warnings = new ArrayList<>();

    for (AudioFile file : files) {
      FileRole role = classifyByName(file);
      roles.put(file.getFileName(), role);
      if (role == FileRole.MASTER) {
        masterCandidates.add(file);
      } else if (role == FileRole.UNIDENTIFIED) {
        unidentified.add(file);
      }
    }

    AudioFile master = chooseMaster(masterCandidates, unidentified, roles, warnings);
    if (master != null) {
      master.setMasterRecording(true);
      master.setIdentified(true);
      String previousName = master.getFileName();
      renameToCanonical(master, folder, warnings);
      roles.remove(previousName);
      roles.put(master.getFileName(), FileRole.MASTER);
    } else {
      String warning = "No master recording identified in " + folder.getFileName();
      LOGGER.error("{} - analysis will fall back to individual microphones", warning);
      warnings.add(warning);
    }

    session.setAudioFiles(new ArrayList<>(files));
    LOGGER.info(
        "Classified {} files in {}: master={}, unidentified={}",
        files.size(),
        folder.getFileName(),
        master == null ? "none" : master.getFileName(),
        unidentified.stream().filter(f -> f != master).count());

    return new ClassificationResult(files, roles, Optional.ofNullable(master), warnings);
  }

  FileRole classifyByName(AudioFile file) {
    String name = file.getFileName();
    OptionalInt micNumber = AudioFileNames.micNumber(name);
    if (micNumber.isPresent()) {
      file.setSpeakerNumber(micNumber.getAsInt() - 1);
      file.setIdentified(true);
      return FileRole.INDIVIDUAL_MIC;
    }
    if (AudioFileNames.isAuxiliary(name)) {
      file.setIdentified(true);
      return FileRole.AUXILIARY;
    }
    if (AudioFileNames.looksLikeMaster(name)) {
      return FileRole.MASTER;
    }
    return FileRole.UNIDENTIFIED;
  }

  private AudioFile chooseMaster(
      List<AudioFile> candidates,
      List<AudioFile> unidentified,
      Map<String, FileRole> roles,
      List<String> warnings) {
    if (!candidates.isEmpty()) {
      AudioFile chosen = largest(candidates);
      if (candidates.size() > 1) {
        String warning =
            String.format(
                "%d files look like a master recording, using the largest: %s",
                candidates.size(), chosen.getFileName());
        LOGGER.warn(warning);
        warnings.add(warning);
        candidates.stream()
            .filter(f -> f != chosen)
            .forEach(f -> roles.put(f.getFileName(), FileRole.UNIDENTIFIED));
      }
      for (AudioFile leftover : unidentified) {
        String warning =
            String.format(
                "Unidentified file %s kept as an ordinary recording, master is %s",
                leftover.getFileName(), chosen.getFileName());
        LOGGER.warn(warning);
        warnings.add(warning);
      }
      return chosen;
    }
    if (unidentified.size() == 1) {
      AudioFile only = unidentified.get(0);
      LOGGER.info("Master recording identified by elimination: {}", only.getFileName());
      return only;
    }
    if (unidentified.size() > 1) {
      AudioFile chosen = largest(unidentified);
      LOGGER.info(
          "Master recording chosen by size among {} unidentified files: {} ({} bytes)",
          unidentified.size(),
          chosen.getFileName(),
          chosen.getFileSize());
      return chosen;
    }
    return null;
  }

  private AudioFile largest(List<AudioFile> files) {
    return files.stream().max(Comparator.comparingLong(AudioFile::getFileSize)).orElseThrow();
  }

  private void renameToCanonical(AudioFile master, Path folder, List<String> warnings) {
    String canonical = AudioFileNames.masterFileName(master.getFileName());
    if (master.getFileName().equals(canonical)) {
      return;
    }
    Path source = Path.of(master.getFilePath());
    Path target = folder.resolve(canonical);
    if (Files.exists(target)) {
      String warning =
          String.format(
              "%s already exists, keeping master recording name %s",
              canonical, master.getFileName());
      LOGGER.warn(warning);
      warnings.add(warning);
      return;
    }
    try {
      Files.move(source, target);
      LOGGER.info("Renamed master recording {} to {}", master.getFileName(), canonical);
      master.setFileName(canonical);
      master.setFilePath(target.toString());
    } catch (IOException e) {
      String warning =
          String.format(
              "Could not rename %s to %s: %s", master.getFileName(), canonical, e.getMessage());
      LOGGER.warn(warning);
      warnings.add(warning);
    }
  }

  private List<AudioFile> scan(Path folder) {
    if (!Files.isDirectory(folder)) {
      throw new IllegalArgumentException("Session folder does not exist: " + folder);
    }
    try (Stream<Path> entries = Files.list(folder)) {
      return entries
          .filter(Files::isRegularFile)
          .filter(p -> AudioFileNames.isAudioFile(p.getFileName().toString()))
          .filter(p -> !AudioFileNames.isTemporary(p.getFileName().toString()))
          .sorted(Comparator.comparing(p -> p.getFileName().toString()))
          .map(this::toAudioFile)
          .collect(Collectors.toList());
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to list session folder " + folder, e);
    }
  }

  private AudioFile toAudioFile(Path path) {
    try {
      return new AudioFile(path.getFileName().toString(), path.toString(), Files.size(path));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read size of " + path, e);
    }
  }
}

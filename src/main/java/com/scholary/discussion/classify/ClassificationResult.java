package com.scholary.discussion.classify;

import com.scholary.discussion.session.AudioFile;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of classifying a session folder.
 *
 * @param files every audio file found, in file-name order
 * @param roles role per file name (after any master rename)
 * @param master the master recording, if one could be chosen
 * @param warnings data-quality findings worth surfacing to the operator
 */
public record ClassificationResult(
    List<AudioFile> files,
    Map<String, FileRole> roles,
    Optional<AudioFile> master,
    List<String> warnings) {

  public ClassificationResult {
    files = List.copyOf(files);
    roles = Map.copyOf(roles);
    warnings = List.copyOf(warnings);
  }
}

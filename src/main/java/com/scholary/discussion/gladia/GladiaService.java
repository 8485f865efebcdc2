package com.scholary.discussion.gladia;

import java.nio.file.Path;

/**
 * Interface to the speech transcription service.
 *
 * <p>The three calls map to the service's upload, submit and poll endpoints; polling until
 * completion is left to {@link TranscriptionPoller}.
 */
public interface GladiaService {

  /**
   * Upload an audio file.
   *
   * @param audioFile the file to upload, streamed from disk
   * @param displayName the file name the service should see
   * @return the service-side audio URL
   * @throws GladiaException on an error response or after retries are exhausted
   */
  String upload(Path audioFile, String displayName);

  /**
   * Start a transcription job.
   *
   * @return the job id
   */
  String submit(String audioUrl, TranscriptionOptions options);

  /** Fetch the current state of a job. */
  TranscriptionPoll fetch(String transcriptId);
}

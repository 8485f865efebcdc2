package com.scholary.discussion.gladia;

import com.scholary.discussion.logging.PipelineEventLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Waits for a submitted transcription job to finish.
 *
 * <p>The job is fetched once per interval until it reports {@code done} or {@code error}, or until
 * the ceiling is reached. A poll that cannot reach the service counts as a missed poll; after
 * {@code maxRetries} of them in a row the job is given up. Elapsed time is counted from the number
 * of polls, so tests can replace the sleeper and run instantly.
 */
@Component
public class TranscriptionPoller {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptionPoller.class);
  private static final PipelineEventLogger EVENTS = new PipelineEventLogger(LOGGER);

  /** Blocks between polls. */
  @FunctionalInterface
  interface Sleeper {
    void sleep(long millis) throws InterruptedException;
  }

  private final GladiaService gladiaService;
  private final GladiaProperties properties;
  private final Sleeper sleeper;

  @Autowired
  public TranscriptionPoller(GladiaService gladiaService, GladiaProperties properties) {
    this(gladiaService, properties, Thread::sleep);
  }

  TranscriptionPoller(GladiaService gladiaService, GladiaProperties properties, Sleeper sleeper) {
    this.gladiaService = gladiaService;
    this.properties = properties;
    this.sleeper = sleeper;
  }

  /**
   * Poll until the job is done.
   *
   * @return the finished job with its raw response
   * @throws GladiaException if the job reports an error or the result has no transcription
   * @throws GladiaUnavailableException if the service stays unreachable for several polls
   * @throws TranscriptionTimeoutException if the job is still running at the ceiling
   */
  public TranscriptionPoll awaitResult(String transcriptId) {
    int intervalSeconds = properties.pollIntervalSeconds();
    long maxPolls = Math.max(1, (properties.pollTimeoutMinutes() * 60L) / intervalSeconds);

    int consecutiveFailures = 0;

    for (long poll = 1; poll <= maxPolls; poll++) {
      long elapsedSeconds = (poll - 1) * intervalSeconds;
      TranscriptionPoll response;
      try {
        response = gladiaService.fetch(transcriptId);
        consecutiveFailures = 0;
      } catch (GladiaUnavailableException e) {
        consecutiveFailures++;
        if (consecutiveFailures >= properties.maxRetries()) {
          throw e;
        }
        LOGGER.warn(
            "Poll {} of transcription {} failed ({} in a row): {}",
            poll,
            transcriptId,
            consecutiveFailures,
            e.getMessage());
        response = null;
      }

      if (response != null) {
        GladiaJob job = response.job();
        EVENTS.logPoll(transcriptId, job.status(), elapsedSeconds);

        if (job.isDone()) {
          if (job.result() == null || job.result().transcription() == null) {
            throw new GladiaException(
                "Transcription " + transcriptId + " is done but has no result.transcription");
          }
          LOGGER.info("Transcription {} done after {}s", transcriptId, elapsedSeconds);
          return response;
        }
        if (job.isError()) {
          throw new GladiaException(
              "Transcription " + transcriptId + " failed: " + job.errorMessage());
        }
      }

      if (poll < maxPolls) {
        try {
          sleeper.sleep(intervalSeconds * 1000L);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new GladiaException("Polling interrupted for " + transcriptId, e);
        }
      }
    }

    throw new TranscriptionTimeoutException(
        String.format(
            "Transcription %s not finished after %d minutes",
            transcriptId, properties.pollTimeoutMinutes()));
  }
}

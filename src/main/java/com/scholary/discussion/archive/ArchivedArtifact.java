package com.scholary.discussion.archive;

/**
 * One artifact copied to the archive bucket.
 *
 * @param key object key, {@code sessions/{sessionId}/{kind}/{file}}
 * @param url presigned download URL, null if it could not be generated
 */
public record ArchivedArtifact(String key, String url) {}

package com.scholary.discussion.session;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Persistence for sessions.
 *
 * <p>The pipeline calls {@link #upsert} after every phase and every per-file update. There is a
 * single writer per session, so implementations may keep the instance they are given.
 */
public interface SessionRepository {

  Session upsert(Session session);

  Optional<Session> getById(String id);

  List<Session> findBy(Predicate<Session> predicate);
}

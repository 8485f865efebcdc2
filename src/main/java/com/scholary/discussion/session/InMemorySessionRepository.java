package com.scholary.discussion.session;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory session store backed by a Caffeine cache.
 *
 * <p>Stands in for the document store the surrounding application owns. Old sessions are evicted
 * after {@code sessionstore.expireAfterDays}.
 */
@Repository
public class InMemorySessionRepository implements SessionRepository {

  private final Cache<String, Session> cache;
  private final Clock clock;

  public InMemorySessionRepository(
      @Value("${sessionstore.maxSize}") int maxSize,
      @Value("${sessionstore.expireAfterDays}") int expireAfterDays,
      Clock clock) {
    this.clock = clock;
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(Duration.ofDays(expireAfterDays))
            .build();
  }

  @Override
  public Session upsert(Session session) {
    session.setUpdatedAt(clock.instant());
    cache.put(session.getId(), session);
    return session;
  }

  @Override
  public Optional<Session> getById(String id) {
    return Optional.ofNullable(cache.getIfPresent(id));
  }

  @Override
  public List<Session> findBy(Predicate<Session> predicate) {
    return cache.asMap().values().stream()
        .filter(predicate)
        .sorted(Comparator.comparing(Session::getCreatedAt).reversed())
        .collect(Collectors.toList());
  }
}

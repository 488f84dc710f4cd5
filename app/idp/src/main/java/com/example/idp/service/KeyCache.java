/*
 * Where: IdP service layer
 * What: TTL cache of the decoded verification and consent-signing keys
 * Why: challenge requests read keys without touching the network
 */
package com.example.idp.service;

import com.example.idp.config.KeyCacheProperties;
import com.example.idp.model.KeyRole;
import java.security.Key;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Holds at most one key per {@link KeyRole}.
 *
 * <p>Entries past their expiry read as absent immediately; they are removed by {@link
 * #evictExpired()}, which then notifies the eviction listeners with each removed role. Listeners
 * run on the sweeping thread after the lock is released and must not block.
 */
@Component
public class KeyCache {

  private static final Logger logger = LoggerFactory.getLogger(KeyCache.class);

  private final Clock clock;
  private final Duration defaultTtl;
  private final Map<KeyRole, Entry> entries = new EnumMap<>(KeyRole.class);
  private final ReentrantLock lock = new ReentrantLock();
  private final List<Consumer<KeyRole>> evictionListeners = new CopyOnWriteArrayList<>();
  private long generation;

  @Autowired
  public KeyCache(Clock clock, KeyCacheProperties properties) {
    this(clock, properties.expiration());
  }

  public KeyCache(Clock clock, Duration defaultTtl) {
    this.clock = Objects.requireNonNull(clock, "clock is required");
    this.defaultTtl = Objects.requireNonNull(defaultTtl, "defaultTtl is required");
  }

  public Duration defaultTtl() {
    return defaultTtl;
  }

  public void set(KeyRole role, Key key) {
    set(role, key, defaultTtl);
  }

  public void set(KeyRole role, Key key, Duration ttl) {
    Objects.requireNonNull(role, "role is required");
    Objects.requireNonNull(key, "key is required");
    Objects.requireNonNull(ttl, "ttl is required");
    final Entry entry = new Entry(key, Instant.now(clock).plus(ttl));
    lock.lock();
    try {
      entries.put(role, entry);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Stores the key only if the cache has not been flushed since {@code expectedGeneration} was
   * read from {@link #generation()}.
   *
   * @return {@code false} when the key was discarded
   */
  public boolean setIfGeneration(KeyRole role, Key key, long expectedGeneration) {
    Objects.requireNonNull(role, "role is required");
    Objects.requireNonNull(key, "key is required");
    final Entry entry = new Entry(key, Instant.now(clock).plus(defaultTtl));
    lock.lock();
    try {
      if (generation != expectedGeneration) {
        return false;
      }
      entries.put(role, entry);
      return true;
    } finally {
      lock.unlock();
    }
  }

  /** Incremented by every {@link #flush()}. */
  public long generation() {
    lock.lock();
    try {
      return generation;
    } finally {
      lock.unlock();
    }
  }

  public Optional<Key> get(KeyRole role) {
    final Instant now = Instant.now(clock);
    lock.lock();
    try {
      final Entry entry = entries.get(role);
      if (entry == null || entry.isExpired(now)) {
        return Optional.empty();
      }
      return Optional.of(entry.key());
    } finally {
      lock.unlock();
    }
  }

  /** Registers a callback that receives every role removed by {@link #evictExpired()}. */
  public void onEvicted(Consumer<KeyRole> listener) {
    evictionListeners.add(Objects.requireNonNull(listener, "listener is required"));
  }

  /**
   * Removes every expired entry and notifies the eviction listeners.
   *
   * @return the evicted roles
   */
  public List<KeyRole> evictExpired() {
    final Instant now = Instant.now(clock);
    final List<KeyRole> evicted = new ArrayList<>();
    lock.lock();
    try {
      final Iterator<Map.Entry<KeyRole, Entry>> iterator = entries.entrySet().iterator();
      while (iterator.hasNext()) {
        final Map.Entry<KeyRole, Entry> current = iterator.next();
        if (current.getValue().isExpired(now)) {
          // EnumMap entries are invalid once removed
          final KeyRole role = current.getKey();
          iterator.remove();
          evicted.add(role);
        }
      }
    } finally {
      lock.unlock();
    }
    for (KeyRole role : evicted) {
      logger.info("key cache entry expired role={}", role.value());
      notifyEvicted(role);
    }
    return evicted;
  }

  /** Removes all entries without notifying the eviction listeners. */
  public void flush() {
    lock.lock();
    try {
      entries.clear();
      generation++;
    } finally {
      lock.unlock();
    }
  }

  private void notifyEvicted(KeyRole role) {
    for (Consumer<KeyRole> listener : evictionListeners) {
      try {
        listener.accept(role);
      } catch (RuntimeException ex) {
        logger.warn("key cache eviction listener failed role={}", role.value(), ex);
      }
    }
  }

  private record Entry(Key key, Instant expiresAt) {

    boolean isExpired(Instant now) {
      return !now.isBefore(expiresAt);
    }
  }
}

/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.service;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import lombok.NonNull;

/** In-process {@link RunQueryCache} bounded by entry count, with a time to live per entry. */
public class LocalRunQueryCache implements RunQueryCache {
  private final Cache<String, Entry> entries;
  private final Clock clock;

  public LocalRunQueryCache(final long maxEntries) {
    this(maxEntries, Clock.systemUTC());
  }

  LocalRunQueryCache(final long maxEntries, @NonNull final Clock clock) {
    this.entries = CacheBuilder.newBuilder().maximumSize(maxEntries).build();
    this.clock = clock;
  }

  @Override
  public Optional<Object> get(@NonNull final String key) {
    final Entry entry = entries.getIfPresent(key);
    if (entry == null) {
      return Optional.empty();
    }
    if (!clock.instant().isBefore(entry.expiresAt())) {
      entries.invalidate(key);
      return Optional.empty();
    }
    return Optional.of(entry.value());
  }

  @Override
  public void set(
      @NonNull final String key, @NonNull final Object value, @NonNull final Duration ttl) {
    entries.put(key, new Entry(value, clock.instant().plus(ttl)));
  }

  public long size() {
    return entries.size();
  }

  private record Entry(Object value, Instant expiresAt) {}
}

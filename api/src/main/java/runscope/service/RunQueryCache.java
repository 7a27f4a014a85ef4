/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.service;

import com.google.common.base.Joiner;
import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;
import lombok.NonNull;

/**
 * Read-through cache consulted by run query read paths. A miss always falls through to the loader,
 * so an implementation may drop entries at any time.
 */
public interface RunQueryCache {

  /** A cache that never holds anything. */
  RunQueryCache NOOP =
      new RunQueryCache() {
        @Override
        public Optional<Object> get(@NonNull String key) {
          return Optional.empty();
        }

        @Override
        public void set(@NonNull String key, @NonNull Object value, @NonNull Duration ttl) {}
      };

  Optional<Object> get(@NonNull String key);

  void set(@NonNull String key, @NonNull Object value, @NonNull Duration ttl);

  /**
   * Returns the cached value for {@code key}, or loads, caches and returns it. An entry of another
   * type than {@code type} counts as a miss.
   */
  default <T> T getOrLoad(
      @NonNull final String key,
      @NonNull final Duration ttl,
      @NonNull final Class<T> type,
      @NonNull final Supplier<T> loader) {
    final Optional<Object> cached = get(key);
    if (cached.isPresent() && type.isInstance(cached.get())) {
      return type.cast(cached.get());
    }
    final T loaded = loader.get();
    if (loaded != null) {
      set(key, loaded, ttl);
    }
    return loaded;
  }

  /** Builds a cache key from the procedure name and its parameters, organization first. */
  static String key(@NonNull final String procedure, final Object... parts) {
    return procedure + ":" + Joiner.on('|').useForNull("").join(parts);
  }
}

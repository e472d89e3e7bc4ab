package com.sharednotes.api.utils;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.ConcurrentMap;

public abstract class CollectionUtils {

	public static <T> @Nullable T firstOrNull(@Nullable Collection<T> collection) {
		return null == collection || collection.isEmpty() ? null : collection.iterator().next();
	}

	/**
	 * drops {@code null}s and duplicates, keeping the first-seen order.
	 */
	public static <T> Set<T> distinct(@Nullable Collection<T> collection) {
		var set = new LinkedHashSet<T>();
		if (collection != null)
			for (var t : collection)
				if (t != null)
					set.add(t);
		return set;
	}

	public static <K, V> ConcurrentMap<K, V> evictingConcurrentMap(int maxSize, Duration ttl) {
		return Caffeine.newBuilder() //
			.maximumSize(maxSize) //
			.expireAfterWrite(ttl) //
			.<K, V>build() //
			.asMap();
	}

}

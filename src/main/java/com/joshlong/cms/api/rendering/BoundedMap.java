package com.joshlong.cms.api.rendering;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiConsumer;

// not threadsafe: callers guard it with their own lock.
class BoundedMap<K, V> extends LinkedHashMap<K, V> {

	private final int maxEntries;

	private final BiConsumer<K, V> evictionListener;

	BoundedMap(int maxEntries) {
		this(maxEntries, (k, v) -> {
		});
	}

	/**
	 * iteration order is access order, least recently used first.
	 */
	BoundedMap(int maxEntries, BiConsumer<K, V> evictionListener) {
		super(maxEntries + 1, 0.75f, true);
		this.maxEntries = maxEntries;
		this.evictionListener = evictionListener;
	}

	@Override
	protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
		var evict = size() > this.maxEntries;
		if (evict)
			this.evictionListener.accept(eldest.getKey(), eldest.getValue());
		return evict;
	}

}

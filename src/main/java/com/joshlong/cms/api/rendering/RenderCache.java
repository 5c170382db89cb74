package com.joshlong.cms.api.rendering;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import java.util.function.ToIntFunction;

/**
 * keeps the results of the global + cacheable pass, least recently used first out.
 * <p>
 * a miss computes exactly once per key: callers that ask for a key while it's being
 * computed wait for that computation instead of starting their own. callers on
 * different keys never wait for each other's computations; the lock here only guards
 * the bookkeeping. a failed computation is never stored, and everyone waiting on it
 * sees the same failure.
 * <p>
 * the version is part of the key, so edits don't need a flush. when a newer version of
 * the same article (same collection, same cacheable variables) is stored, the older
 * entry is dropped on the spot; anything else stale just ages out.
 */
class RenderCache<V> {

	private final Logger log = LoggerFactory.getLogger(getClass());

	private final Object monitor = new Object();

	private final BoundedMap<RenderKey, Entry<V>> entries;

	private final Map<RenderKey.Lineage, RenderKey> latest = new HashMap<>();

	private final Map<RenderKey, CompletableFuture<V>> inflight = new ConcurrentHashMap<>();

	private final ToIntFunction<V> weigher;

	private final long maxWeight;

	private final AtomicLong hits = new AtomicLong(), misses = new AtomicLong(), evictions = new AtomicLong(),
			invalidations = new AtomicLong();

	private long weight;

	RenderCache(int maxEntries, long maxWeight, ToIntFunction<V> weigher) {
		Assert.state(maxEntries > 0, "the render cache must be able to hold at least one entry");
		Assert.notNull(weigher, "the weigher must not be null");
		this.maxWeight = maxWeight;
		this.weigher = weigher;
		this.entries = new BoundedMap<>(maxEntries, this::evicted);
	}

	V getOrCompute(RenderKey key, Supplier<V> computeFn) {
		Assert.notNull(key, "the key must not be null");
		var cached = this.get(key);
		if (cached != null) {
			this.hits.incrementAndGet();
			this.log.debug("render cache hit for {}", key);
			return cached;
		}
		var flight = new CompletableFuture<V>();
		var existing = this.inflight.putIfAbsent(key, flight);
		if (existing != null) {
			this.hits.incrementAndGet();
			this.log.debug("waiting for the render of {} that's already underway", key);
			return this.await(key, existing);
		}
		try {
			// whoever had the key before us may have finished in the meantime
			var raced = this.get(key);
			if (raced != null) {
				this.hits.incrementAndGet();
				flight.complete(raced);
				return raced;
			}
			this.misses.incrementAndGet();
			this.log.debug("render cache miss for {}", key);
			var value = computeFn.get();
			Assert.state(value != null, "the render of " + key + " produced nothing");
			this.put(key, value);
			flight.complete(value);
			return value;
		} //
		catch (Throwable throwable) {
			flight.completeExceptionally(throwable);
			throw throwable;
		} //
		finally {
			// stored before it's forgotten, so there's never a moment where neither has it
			this.inflight.remove(key, flight);
		}
	}

	RenderCacheStatistics statistics() {
		synchronized (this.monitor) {
			return new RenderCacheStatistics(this.entries.size(), this.weight, this.hits.get(), this.misses.get(),
					this.evictions.get(), this.invalidations.get());
		}
	}

	void clear() {
		synchronized (this.monitor) {
			this.entries.clear();
			this.latest.clear();
			this.weight = 0;
		}
		this.log.info("cleared the render cache");
	}

	private V await(RenderKey key, CompletableFuture<V> flight) {
		try {
			return flight.get();
		} //
		catch (InterruptedException e) {
			// we stop waiting; the computation carries on for everyone else
			Thread.currentThread().interrupt();
			throw new IllegalStateException("interrupted while waiting for the render of " + key, e);
		} //
		catch (ExecutionException e) {
			var cause = e.getCause();
			if (cause instanceof RuntimeException runtimeException)
				throw runtimeException;
			if (cause instanceof Error error)
				throw error;
			throw new IllegalStateException("the render of " + key + " failed", cause);
		}
	}

	private V get(RenderKey key) {
		synchronized (this.monitor) {
			var entry = this.entries.get(key);
			if (entry == null)
				return null;
			entry.lastAccessed = Instant.now();
			return entry.value;
		}
	}

	private void put(RenderKey key, V value) {
		var entry = new Entry<>(value, this.weigher.applyAsInt(value));
		synchronized (this.monitor) {
			var lineage = key.lineage();
			var previous = this.latest.get(lineage);
			if (previous != null && !previous.equals(key)) {
				if (previous.version().compareTo(key.version()) > 0) {
					this.log.debug("not caching {}, a newer version is already cached", key);
					return;
				}
				var superseded = this.entries.remove(previous);
				if (superseded != null) {
					this.weight -= superseded.weight;
					this.invalidations.incrementAndGet();
					this.log.debug("dropped {}, superseded by version {}", previous, key.version());
				}
			}
			this.latest.put(lineage, key);
			this.weight += entry.weight;
			var replaced = this.entries.put(key, entry);
			if (replaced != null)
				this.weight -= replaced.weight;
			while (this.maxWeight > 0 && this.weight > this.maxWeight && !this.entries.isEmpty()) {
				var eldest = this.entries.entrySet().iterator();
				var next = eldest.next();
				eldest.remove();
				this.evicted(next.getKey(), next.getValue());
			}
		}
	}

	// always called with the monitor held
	private void evicted(RenderKey key, Entry<V> entry) {
		this.weight -= entry.weight;
		this.latest.remove(key.lineage(), key);
		this.evictions.incrementAndGet();
		this.log.debug("evicted {} from the render cache (cached at {}, last used at {})", key, entry.created,
				entry.lastAccessed);
	}

	private static final class Entry<V> {

		private final V value;

		private final int weight;

		private final Instant created = Instant.now();

		private Instant lastAccessed = this.created;

		Entry(V value, int weight) {
			this.value = value;
			this.weight = weight;
		}

	}

}

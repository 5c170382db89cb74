package com.joshlong.cms.api.rendering;

import com.joshlong.cms.api.compositions.VersionToken;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RenderCacheTest {

	private static RenderKey key(long articleId, long lastModified) {
		return new RenderKey(null, articleId, new VersionToken(lastModified, "f" + lastModified), "sig", false);
	}

	private final RenderCache<String> cache = new RenderCache<>(3, 0, String::length);

	@Test
	void computesOnceAndThenHits() {
		var calls = new AtomicInteger();
		assertEquals("a", this.cache.getOrCompute(key(1, 1), () -> "a"));
		assertEquals("a", this.cache.getOrCompute(key(1, 1), () -> {
			calls.incrementAndGet();
			return "b";
		}));
		assertEquals(0, calls.get());
		var statistics = this.cache.statistics();
		assertEquals(1, statistics.size());
		assertEquals(1, statistics.hits());
		assertEquals(1, statistics.misses());
	}

	@Test
	void concurrentMissesComputeOnce() throws Exception {
		var threads = 8;
		var calls = new AtomicInteger();
		var started = new CountDownLatch(1);
		var release = new CountDownLatch(1);
		var executor = Executors.newFixedThreadPool(threads);
		try {
			var results = new ArrayList<Future<String>>();
			for (var i = 0; i < threads; i++) {
				results.add(executor.submit(() -> this.cache.getOrCompute(key(1, 1), () -> {
					calls.incrementAndGet();
					started.countDown();
					try {
						assertTrue(release.await(10, TimeUnit.SECONDS));
					} //
					catch (InterruptedException e) {
						throw new IllegalStateException(e);
					}
					return "rendered";
				})));
			}
			assertTrue(started.await(10, TimeUnit.SECONDS));
			// give the others a chance to pile up behind the first
			Thread.sleep(100);
			release.countDown();
			for (var result : results)
				assertEquals("rendered", result.get(10, TimeUnit.SECONDS));
		} //
		finally {
			executor.shutdownNow();
		}
		assertEquals(1, calls.get());
		assertEquals(1, this.cache.statistics().misses());
	}

	@Test
	void differentKeysDoNotWaitForEachOther() throws Exception {
		var release = new CountDownLatch(1);
		var started = new CountDownLatch(1);
		var executor = Executors.newSingleThreadExecutor();
		try {
			var slow = executor.submit(() -> this.cache.getOrCompute(key(1, 1), () -> {
				started.countDown();
				try {
					assertTrue(release.await(10, TimeUnit.SECONDS));
				} //
				catch (InterruptedException e) {
					throw new IllegalStateException(e);
				}
				return "slow";
			}));
			assertTrue(started.await(10, TimeUnit.SECONDS));
			assertEquals("fast", this.cache.getOrCompute(key(2, 1), () -> "fast"));
			release.countDown();
			assertEquals("slow", slow.get(10, TimeUnit.SECONDS));
		} //
		finally {
			executor.shutdownNow();
		}
	}

	@Test
	void failuresAreNotCached() {
		var boom = new IllegalStateException("boom");
		var thrown = assertThrows(IllegalStateException.class, () -> this.cache.getOrCompute(key(1, 1), () -> {
			throw boom;
		}));
		assertSame(boom, thrown);
		assertEquals(0, this.cache.statistics().size());
		assertEquals("ok", this.cache.getOrCompute(key(1, 1), () -> "ok"));
	}

	@Test
	void leastRecentlyUsedEntriesAreEvicted() {
		this.cache.getOrCompute(key(1, 1), () -> "1");
		this.cache.getOrCompute(key(2, 1), () -> "2");
		this.cache.getOrCompute(key(3, 1), () -> "3");
		this.cache.getOrCompute(key(1, 1), () -> "x");
		this.cache.getOrCompute(key(4, 1), () -> "4");
		var statistics = this.cache.statistics();
		assertEquals(3, statistics.size());
		assertEquals(1, statistics.evictions());
		assertEquals("1", this.cache.getOrCompute(key(1, 1), () -> "x"));
		assertEquals("two", this.cache.getOrCompute(key(2, 1), () -> "two"), "2 was the least recently used");
	}

	@Test
	void weightIsBounded() {
		var cache = new RenderCache<String>(100, 10, String::length);
		cache.getOrCompute(key(1, 1), () -> "aaaa");
		cache.getOrCompute(key(2, 1), () -> "bbbb");
		assertEquals(8, cache.statistics().weight());
		cache.getOrCompute(key(3, 1), () -> "cccc");
		var statistics = cache.statistics();
		assertEquals(2, statistics.size());
		assertEquals(8, statistics.weight());
		assertEquals(1, statistics.evictions());
	}

	@Test
	void aNewerVersionSupersedesTheOlderOne() {
		this.cache.getOrCompute(key(1, 1), () -> "old");
		this.cache.getOrCompute(key(2, 1), () -> "other");
		assertEquals("new", this.cache.getOrCompute(key(1, 2), () -> "new"));
		var statistics = this.cache.statistics();
		assertEquals(2, statistics.size());
		assertEquals(1, statistics.invalidations());
		assertEquals("other", this.cache.getOrCompute(key(2, 1), () -> "x"), "other articles are untouched");
	}

	@Test
	void anOlderVersionNeverReplacesANewerOne() {
		this.cache.getOrCompute(key(1, 2), () -> "new");
		assertEquals("old", this.cache.getOrCompute(key(1, 1), () -> "old"));
		assertEquals(1, this.cache.statistics().size());
		assertEquals("new", this.cache.getOrCompute(key(1, 2), () -> "x"));
	}

	@Test
	void otherCacheableVariablesAreAnotherLineage() {
		this.cache.getOrCompute(key(1, 1), () -> "a");
		var otherSignature = new RenderKey(null, 1L, new VersionToken(2, "f2"), "other", false);
		this.cache.getOrCompute(otherSignature, () -> "b");
		assertEquals(2, this.cache.statistics().size());
		assertEquals(0, this.cache.statistics().invalidations());
	}

	@Test
	void clear() {
		this.cache.getOrCompute(key(1, 1), () -> "a");
		this.cache.clear();
		assertEquals(0, this.cache.statistics().size());
		assertEquals(0, this.cache.statistics().weight());
		assertEquals("b", this.cache.getOrCompute(key(1, 1), () -> "b"));
	}

}

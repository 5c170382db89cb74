package com.joshlong.cms.api.rendering;

/**
 * @param invalidations entries dropped because a newer version of the same article was
 * cached
 */
public record RenderCacheStatistics(int size, long weight, long hits, long misses, long evictions,
		long invalidations) {
}

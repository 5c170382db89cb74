package com.joshlong.cms.api.rendering;

import com.joshlong.cms.api.collections.MenuEntry;

import java.util.List;

/**
 * what callers use to get content out: composition, then the global and cacheable
 * variables (cached), then the uncacheable variables (never cached).
 */
public interface RenderService {

	/**
	 * @throws com.joshlong.cms.api.ContentNotFoundException for an unknown article,
	 * collection or url, or one that belongs to another client
	 * @throws com.joshlong.cms.api.ContentIntegrityException when the article refers to
	 * content that doesn't exist
	 * @throws com.joshlong.cms.api.StoreUnavailableException when the store fails; this
	 * isn't retried here
	 */
	RenderedArticle render(RenderRequest request);

	List<MenuEntry> listMenu(Long clientId, Long menuId);

	RenderCacheStatistics cacheStatistics();

	void clearCache();

}

package com.joshlong.cms.api.collections;

import com.joshlong.cms.api.store.Collection;
import com.joshlong.cms.api.store.Menu;

import java.util.List;

/**
 * works out which article a request is about, and the navigation around it. nothing
 * here substitutes variables or caches anything.
 * <p>
 * every method takes the id of the client asking; entities belonging to another client
 * are reported as not found. a {@code null} client skips that check.
 */
public interface CollectionService {

	CollectionSlot resolveCollectionArticle(Long clientId, Long collectionId, String url);

	CollectionSlot resolveCollectionArticle(Long clientId, Long collectionId, Long articleId);

	/**
	 * the menu's entries by ascending sort order, then article id.
	 */
	List<MenuEntry> resolveMenu(Long clientId, Long menuId);

	CollectionOverview describeCollection(Long clientId, Long collectionId);

	Collection getCollectionByName(Long clientId, String name);

	Menu getMenuByName(Long clientId, Long collectionId, String name);

}

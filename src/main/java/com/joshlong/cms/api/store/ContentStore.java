package com.joshlong.cms.api.store;

import java.util.List;
import java.util.Map;

/**
 * read access to the atom / article / collection graph. the lookups by id return
 * {@code null} when nothing (visible) matches; deleted rows are never returned.
 * implementations report failures of the underlying store as
 * {@link com.joshlong.cms.api.StoreUnavailableException}.
 */
public interface ContentStore {

	Article getArticle(Long articleId);

	/**
	 * the atom references of an article. callers must not rely on the order.
	 */
	List<ArticleAtom> getArticleAtoms(Long articleId);

	Atom getAtom(Long atomId);

	AtomType getType(Long typeId);

	Collection getCollection(Long collectionId);

	Collection getCollectionByName(Long clientId, String name);

	List<CollectionArticle> getCollectionArticles(Long collectionId);

	Menu getMenu(Long menuId);

	Menu getMenuByName(Long collectionId, String name);

	List<Menu> getMenusByCollection(Long collectionId);

	List<MenuArticle> getMenuArticles(Long menuId);

	/**
	 * the stored tag → value pairs of a client.
	 */
	Map<String, String> getGlobalVariables(Long clientId);

}

package com.joshlong.cms.api.collections;

import com.joshlong.cms.api.ContentNotFoundException;
import com.joshlong.cms.api.store.Collection;
import com.joshlong.cms.api.store.CollectionArticle;
import com.joshlong.cms.api.store.ContentStore;
import com.joshlong.cms.api.store.Menu;
import com.joshlong.cms.api.store.MenuArticle;
import com.joshlong.cms.api.utils.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Service;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

@Service
class DefaultCollectionService implements CollectionService {

	private static final Comparator<CollectionArticle> SLOT_ORDER = Comparator
		.comparingInt(CollectionArticle::sortOrder)
		.thenComparing(CollectionArticle::articleId);

	private static final Comparator<MenuArticle> MENU_ORDER = Comparator.comparingInt(MenuArticle::sortOrder)
		.thenComparing(MenuArticle::articleId);

	private final Logger log = LoggerFactory.getLogger(getClass());

	private final ContentStore store;

	DefaultCollectionService(ContentStore store) {
		this.store = store;
	}

	@Override
	public CollectionSlot resolveCollectionArticle(Long clientId, Long collectionId, String url) {
		Assert.hasText(url, "the url must not be empty");
		var collection = this.collection(clientId, collectionId);
		return this.slots(collection)
			.stream()
			.filter(ca -> url.equals(ca.url()))
			.findFirst()
			.map(ca -> slot(collection, ca))
			.orElseThrow(() -> new ContentNotFoundException(
					"there is no article at [" + url + "] in collection #" + collectionId));
	}

	@Override
	public CollectionSlot resolveCollectionArticle(Long clientId, Long collectionId, Long articleId) {
		Assert.notNull(articleId, "the article id must not be null");
		var collection = this.collection(clientId, collectionId);
		return this.slots(collection)
			.stream()
			.filter(ca -> articleId.equals(ca.articleId()))
			.findFirst()
			.map(ca -> slot(collection, ca))
			.orElseThrow(() -> new ContentNotFoundException(
					"article #" + articleId + " is not part of collection #" + collectionId));
	}

	@Override
	public List<MenuEntry> resolveMenu(Long clientId, Long menuId) {
		Assert.notNull(menuId, "the menu id must not be null");
		var menu = this.store.getMenu(menuId);
		if (menu == null || !owns(clientId, menu.clientId()))
			throw new ContentNotFoundException("there is no menu #" + menuId);
		return this.entries(menu);
	}

	@Override
	public CollectionOverview describeCollection(Long clientId, Long collectionId) {
		var collection = this.collection(clientId, collectionId);
		var slots = this.slots(collection).stream().map(ca -> slot(collection, ca)).toList();
		var menus = new LinkedHashMap<String, List<MenuEntry>>();
		for (var menu : this.store.getMenusByCollection(collection.id()))
			menus.put(menu.name(), this.entries(menu));
		this.log.debug("collection #{} has {} articles and {} menus", collectionId, slots.size(), menus.size());
		return new CollectionOverview(collection, slots, menus);
	}

	@Override
	public Collection getCollectionByName(Long clientId, String name) {
		Assert.hasText(name, "the collection name must not be empty");
		var collection = this.store.getCollectionByName(clientId, name);
		if (collection == null)
			throw new ContentNotFoundException("there is no collection named [" + name + "]");
		return collection;
	}

	@Override
	public Menu getMenuByName(Long clientId, Long collectionId, String name) {
		Assert.hasText(name, "the menu name must not be empty");
		var collection = this.collection(clientId, collectionId);
		var menu = this.store.getMenuByName(collection.id(), name);
		if (menu == null)
			throw new ContentNotFoundException(
					"there is no menu named [" + name + "] in collection #" + collectionId);
		return menu;
	}

	private Collection collection(Long clientId, Long collectionId) {
		Assert.notNull(collectionId, "the collection id must not be null");
		var collection = this.store.getCollection(collectionId);
		if (collection == null || !owns(clientId, collection.clientId()))
			throw new ContentNotFoundException("there is no collection #" + collectionId);
		return collection;
	}

	private List<CollectionArticle> slots(Collection collection) {
		return this.store.getCollectionArticles(collection.id()).stream().sorted(SLOT_ORDER).toList();
	}

	private List<MenuEntry> entries(Menu menu) {
		return this.store.getMenuArticles(menu.id())
			.stream()
			.sorted(MENU_ORDER)
			.map(ma -> new MenuEntry(ma.articleId(), StringUtils.hasText(ma.name()) ? ma.name() : ma.articleName(),
					ma.url(), ma.sortOrder()))
			.toList();
	}

	private static CollectionSlot slot(Collection collection, CollectionArticle ca) {
		return new CollectionSlot(collection.id(), ca.articleId(), ca.sortOrder(), ca.url(), ca.template(),
				meta(ca.meta()));
	}

	private static Map<String, Object> meta(String meta) {
		var node = JsonUtils.readTreeOrNull(meta);
		if (node == null || !node.isObject())
			return null;
		return JsonUtils.read(meta, new ParameterizedTypeReference<Map<String, Object>>() {
		});
	}

	private static boolean owns(Long clientId, Long ownerId) {
		return clientId == null || Objects.equals(clientId, ownerId);
	}

}

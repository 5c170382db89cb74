package com.joshlong.cms.api.collections;

import com.joshlong.cms.api.ContentNotFoundException;
import com.joshlong.cms.api.store.InMemoryContentStore;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DefaultCollectionServiceTest {

	private final InMemoryContentStore store = new InMemoryContentStore()//
		.article(10, "home", 1, 0)
		.article(11, "about", 1, 0)
		.article(12, "contact", 1, 0)
		.collection(100, "site", 1)
		.slot(100, 12, 1, "contact", "default", "not json")
		.slot(100, 11, 1, "about", "default", "[1, 2]")
		.slot(100, 10, 0, "index", "home", "{\"title\":\"Home\",\"depth\":2}")
		.collection(200, "other", 2)
		.menu(7, "main", 100, 1)
		.menuEntry(7, 12, 2, "")
		.menuEntry(7, 11, 0, "About us")
		.menuEntry(7, 10, 0, null)
		.menu(8, "footer", 100, 1);

	private final DefaultCollectionService collections = new DefaultCollectionService(this.store);

	@Test
	void resolveByUrl() {
		var slot = this.collections.resolveCollectionArticle(1L, 100L, "index");
		assertEquals(10L, slot.articleId());
		assertEquals(100L, slot.collectionId());
		assertEquals("home", slot.template());
		assertEquals(Map.of("title", "Home", "depth", 2), slot.meta());
		assertThrows(ContentNotFoundException.class,
				() -> this.collections.resolveCollectionArticle(1L, 100L, "missing"));
	}

	@Test
	void resolveByArticle() {
		var slot = this.collections.resolveCollectionArticle(1L, 100L, 11L);
		assertEquals("about", slot.url());
		assertNull(slot.meta(), "metadata that isn't a json object is dropped");
		assertThrows(ContentNotFoundException.class,
				() -> this.collections.resolveCollectionArticle(1L, 100L, 404L));
	}

	@Test
	void otherClientsCollectionsAreNotFound() {
		assertThrows(ContentNotFoundException.class,
				() -> this.collections.resolveCollectionArticle(2L, 100L, "index"));
		assertThrows(ContentNotFoundException.class,
				() -> this.collections.resolveCollectionArticle(1L, 404L, "index"));
		assertThrows(ContentNotFoundException.class, () -> this.collections.describeCollection(1L, 200L));
		assertNotNull(this.collections.resolveCollectionArticle(null, 100L, "index"),
				"without a client there's nothing to check");
	}

	@Test
	void menusAreOrderedAndNamed() {
		var entries = this.collections.resolveMenu(1L, 7L);
		assertEquals(List.of(10L, 11L, 12L), entries.stream().map(MenuEntry::articleId).toList());
		assertEquals(List.of("home", "About us", "contact"), entries.stream().map(MenuEntry::displayName).toList());
		assertEquals(List.of("index", "about", "contact"), entries.stream().map(MenuEntry::url).toList());
		assertTrue(this.collections.resolveMenu(1L, 8L).isEmpty());
		assertThrows(ContentNotFoundException.class, () -> this.collections.resolveMenu(2L, 7L));
		assertThrows(ContentNotFoundException.class, () -> this.collections.resolveMenu(1L, 404L));
	}

	@Test
	void describeCollection() {
		var overview = this.collections.describeCollection(1L, 100L);
		assertEquals("site", overview.collection().name());
		assertEquals(List.of(10L, 11L, 12L), overview.articles().stream().map(CollectionSlot::articleId).toList());
		assertEquals(2, overview.menus().size());
		assertEquals(3, overview.menus().get("main").size());
		assertTrue(overview.menus().get("footer").isEmpty());
	}

	@Test
	void lookupsByName() {
		assertEquals(100L, this.collections.getCollectionByName(1L, "site").id());
		assertThrows(ContentNotFoundException.class, () -> this.collections.getCollectionByName(2L, "site"));
		assertEquals(7L, this.collections.getMenuByName(1L, 100L, "main").id());
		assertThrows(ContentNotFoundException.class, () -> this.collections.getMenuByName(1L, 100L, "nope"));
		assertThrows(ContentNotFoundException.class, () -> this.collections.getMenuByName(2L, 100L, "main"));
	}

}

package com.joshlong.cms.api.store;

import com.joshlong.cms.api.StoreUnavailableException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * a {@link ContentStore} for tests, with knobs for counting and failing reads.
 */
public class InMemoryContentStore implements ContentStore {

	private final Map<Long, Article> articles = new ConcurrentHashMap<>();

	private final Map<Long, List<ArticleAtom>> articleAtoms = new ConcurrentHashMap<>();

	private final Map<Long, Atom> atoms = new ConcurrentHashMap<>();

	private final Map<Long, AtomType> types = new ConcurrentHashMap<>();

	private final Map<Long, Collection> collections = new ConcurrentHashMap<>();

	private final Map<Long, List<CollectionArticle>> collectionArticles = new ConcurrentHashMap<>();

	private final Map<Long, Menu> menus = new ConcurrentHashMap<>();

	private final Map<Long, List<MenuArticle>> menuArticles = new ConcurrentHashMap<>();

	private final Map<Long, Map<String, String>> variables = new ConcurrentHashMap<>();

	private final AtomicInteger globalVariableReads = new AtomicInteger();

	private final AtomicBoolean unavailable = new AtomicBoolean();

	private volatile Runnable onGlobalVariableRead = () -> {
	};

	public InMemoryContentStore type(long id, String name, String schema, String template) {
		this.types.put(id, new AtomType(id, name, schema, template, Instant.ofEpochMilli(1_000)));
		return this;
	}

	public InMemoryContentStore atom(long id, String key, String content, long typeId, long published) {
		this.atoms.put(id, new Atom(id, key, content, typeId, Instant.ofEpochMilli(published)));
		return this;
	}

	public InMemoryContentStore article(long id, String name, long clientId, long published) {
		this.articles.put(id, new Article(id, name, clientId, Instant.ofEpochMilli(published)));
		this.articleAtoms.putIfAbsent(id, new CopyOnWriteArrayList<>());
		return this;
	}

	public InMemoryContentStore place(long articleId, long atomId, int sortOrder) {
		this.articleAtoms.computeIfAbsent(articleId, k -> new CopyOnWriteArrayList<>())
			.add(new ArticleAtom(atomId, sortOrder));
		return this;
	}

	public InMemoryContentStore unplace(long articleId, long atomId) {
		this.articleAtoms.get(articleId).removeIf(aa -> aa.atomId() == atomId);
		return this;
	}

	public InMemoryContentStore collection(long id, String name, long clientId) {
		this.collections.put(id, new Collection(id, name, clientId));
		this.collectionArticles.putIfAbsent(id, new CopyOnWriteArrayList<>());
		return this;
	}

	public InMemoryContentStore slot(long collectionId, long articleId, int sortOrder, String url, String template,
			String meta) {
		this.collectionArticles.computeIfAbsent(collectionId, k -> new CopyOnWriteArrayList<>())
			.add(new CollectionArticle(articleId, sortOrder, url, template, meta));
		return this;
	}

	public InMemoryContentStore menu(long id, String name, long collectionId, long clientId) {
		this.menus.put(id, new Menu(id, name, collectionId, clientId));
		this.menuArticles.putIfAbsent(id, new CopyOnWriteArrayList<>());
		return this;
	}

	public InMemoryContentStore menuEntry(long menuId, long articleId, int sortOrder, String name) {
		var menu = this.menus.get(menuId);
		var article = this.articles.get(articleId);
		var url = this.collectionArticles.getOrDefault(menu.collectionId(), List.of())
			.stream()
			.filter(ca -> ca.articleId() == articleId)
			.map(CollectionArticle::url)
			.findFirst()
			.orElse(null);
		this.menuArticles.get(menuId).add(new MenuArticle(articleId, sortOrder, name, article.name(), url));
		return this;
	}

	public InMemoryContentStore variable(long clientId, String tag, String value) {
		this.variables.computeIfAbsent(clientId, k -> new ConcurrentHashMap<>()).put(tag, value);
		return this;
	}

	public InMemoryContentStore onGlobalVariableRead(Runnable runnable) {
		this.onGlobalVariableRead = runnable;
		return this;
	}

	public void setUnavailable(boolean unavailable) {
		this.unavailable.set(unavailable);
	}

	public int globalVariableReads() {
		return this.globalVariableReads.get();
	}

	@Override
	public Article getArticle(Long articleId) {
		this.check();
		return this.articles.get(articleId);
	}

	@Override
	public List<ArticleAtom> getArticleAtoms(Long articleId) {
		this.check();
		return new ArrayList<>(this.articleAtoms.getOrDefault(articleId, List.of()));
	}

	@Override
	public Atom getAtom(Long atomId) {
		this.check();
		return this.atoms.get(atomId);
	}

	@Override
	public AtomType getType(Long typeId) {
		this.check();
		return this.types.get(typeId);
	}

	@Override
	public Collection getCollection(Long collectionId) {
		this.check();
		return this.collections.get(collectionId);
	}

	@Override
	public Collection getCollectionByName(Long clientId, String name) {
		this.check();
		return this.collections.values()
			.stream()
			.filter(c -> c.clientId().equals(clientId) && c.name().equals(name))
			.findFirst()
			.orElse(null);
	}

	@Override
	public List<CollectionArticle> getCollectionArticles(Long collectionId) {
		this.check();
		return new ArrayList<>(this.collectionArticles.getOrDefault(collectionId, List.of()));
	}

	@Override
	public Menu getMenu(Long menuId) {
		this.check();
		return this.menus.get(menuId);
	}

	@Override
	public Menu getMenuByName(Long collectionId, String name) {
		this.check();
		return this.menus.values()
			.stream()
			.filter(m -> m.collectionId().equals(collectionId) && m.name().equals(name))
			.findFirst()
			.orElse(null);
	}

	@Override
	public List<Menu> getMenusByCollection(Long collectionId) {
		this.check();
		return this.menus.values().stream().filter(m -> m.collectionId().equals(collectionId)).toList();
	}

	@Override
	public List<MenuArticle> getMenuArticles(Long menuId) {
		this.check();
		return new ArrayList<>(this.menuArticles.getOrDefault(menuId, List.of()));
	}

	@Override
	public Map<String, String> getGlobalVariables(Long clientId) {
		this.check();
		this.globalVariableReads.incrementAndGet();
		this.onGlobalVariableRead.run();
		return Map.copyOf(this.variables.getOrDefault(clientId, Map.of()));
	}

	private void check() {
		if (this.unavailable.get())
			throw new StoreUnavailableException("the store is down", new IllegalStateException("down"));
	}

}

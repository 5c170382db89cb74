package com.joshlong.cms.api.store;

import com.joshlong.cms.api.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;
import org.springframework.util.Assert;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * reads the content graph with {@link JdbcClient}. soft-deleted rows (those with a
 * {@code date_deleted}) are filtered out here so that nobody upstream has to care.
 */
@Repository
class JdbcContentStore implements ContentStore {

	private final Logger log = LoggerFactory.getLogger(getClass());

	private final JdbcClient db;

	private final RowMapper<Article> articleRowMapper = (rs, rowNum) -> new Article(rs.getLong("id"),
			rs.getString("name"), rs.getLong("client_id"), instant(rs, "published"));

	private final RowMapper<Atom> atomRowMapper = (rs, rowNum) -> new Atom(rs.getLong("id"),
			rs.getString("atom_key"), rs.getString("content"), rs.getLong("type_id"), instant(rs, "published"));

	private final RowMapper<AtomType> atomTypeRowMapper = (rs, rowNum) -> new AtomType(rs.getLong("id"),
			rs.getString("name"), rs.getString("field_schema"), rs.getString("template"), instant(rs, "updated"));

	private final RowMapper<Collection> collectionRowMapper = (rs, rowNum) -> new Collection(rs.getLong("id"),
			rs.getString("name"), rs.getLong("client_id"));

	private final RowMapper<Menu> menuRowMapper = (rs, rowNum) -> new Menu(rs.getLong("id"), rs.getString("name"),
			rs.getLong("collection_id"), rs.getLong("client_id"));

	JdbcContentStore(JdbcClient db) {
		this.db = db;
		Assert.notNull(this.db, "the db is null");
	}

	@Override
	public Article getArticle(Long articleId) {
		return this.read("article #" + articleId,
				() -> this.db.sql("select * from article where id = ? and date_deleted is null")
					.param(articleId)
					.query(this.articleRowMapper)
					.optional()
					.orElse(null));
	}

	@Override
	public List<ArticleAtom> getArticleAtoms(Long articleId) {
		return this.read("the atoms of article #" + articleId,
				() -> this.db.sql("select atom_id, sort_order from article_atom where article_id = ? ")
					.param(articleId)
					.query((rs, rowNum) -> new ArticleAtom(rs.getLong("atom_id"), rs.getInt("sort_order")))
					.list());
	}

	@Override
	public Atom getAtom(Long atomId) {
		return this.read("atom #" + atomId,
				() -> this.db.sql("select * from atom where id = ? ")
					.param(atomId)
					.query(this.atomRowMapper)
					.optional()
					.orElse(null));
	}

	@Override
	public AtomType getType(Long typeId) {
		return this.read("type #" + typeId,
				() -> this.db.sql("select * from atom_type where id = ? and date_deleted is null")
					.param(typeId)
					.query(this.atomTypeRowMapper)
					.optional()
					.orElse(null));
	}

	@Override
	public Collection getCollection(Long collectionId) {
		return this.read("collection #" + collectionId,
				() -> this.db.sql("select * from collection where id = ? and date_deleted is null")
					.param(collectionId)
					.query(this.collectionRowMapper)
					.optional()
					.orElse(null));
	}

	@Override
	public Collection getCollectionByName(Long clientId, String name) {
		return this.read("collection [" + name + "]",
				() -> this.db.sql("select * from collection where client_id = ? and name = ? and date_deleted is null")
					.params(clientId, name)
					.query(this.collectionRowMapper)
					.optional()
					.orElse(null));
	}

	@Override
	public List<CollectionArticle> getCollectionArticles(Long collectionId) {
		return this.read("the articles of collection #" + collectionId, () -> this.db.sql("""
				select ca.* from collection_article ca, article a
				where ca.collection_id = ? and ca.article_id = a.id and a.date_deleted is null
				""")
			.param(collectionId)
			.query((rs, rowNum) -> new CollectionArticle(rs.getLong("article_id"), rs.getInt("sort_order"),
					rs.getString("url"), rs.getString("template"), rs.getString("meta")))
			.list());
	}

	@Override
	public Menu getMenu(Long menuId) {
		return this.read("menu #" + menuId,
				() -> this.db.sql("select * from menu where id = ? and date_deleted is null")
					.param(menuId)
					.query(this.menuRowMapper)
					.optional()
					.orElse(null));
	}

	@Override
	public Menu getMenuByName(Long collectionId, String name) {
		return this.read("menu [" + name + "]",
				() -> this.db.sql("select * from menu where collection_id = ? and name = ? and date_deleted is null")
					.params(collectionId, name)
					.query(this.menuRowMapper)
					.optional()
					.orElse(null));
	}

	@Override
	public List<Menu> getMenusByCollection(Long collectionId) {
		return this.read("the menus of collection #" + collectionId,
				() -> this.db.sql("select * from menu where collection_id = ? and date_deleted is null order by id")
					.param(collectionId)
					.query(this.menuRowMapper)
					.list());
	}

	@Override
	public List<MenuArticle> getMenuArticles(Long menuId) {
		return this.read("the articles of menu #" + menuId, () -> this.db.sql("""
				select ma.article_id, ma.sort_order, ma.name, a.name as article_name, ca.url
				from menu_article ma
				join menu m on ma.menu_id = m.id
				join article a on ma.article_id = a.id
				join collection_article ca on ca.article_id = a.id and ca.collection_id = m.collection_id
				where ma.menu_id = ? and a.date_deleted is null
				""")
			.param(menuId)
			.query((rs, rowNum) -> new MenuArticle(rs.getLong("article_id"), rs.getInt("sort_order"),
					rs.getString("name"), rs.getString("article_name"), rs.getString("url")))
			.list());
	}

	@Override
	public Map<String, String> getGlobalVariables(Long clientId) {
		return this.read("the variables of client #" + clientId, () -> {
			var rows = this.db.sql("select tag, replacement from variable where client_id = ? order by id")
				.param(clientId)
				.query((rs, rowNum) -> Map.entry(rs.getString("tag"), rs.getString("replacement")))
				.list();
			// a tag defined twice resolves to the newest row
			var variables = new HashMap<String, String>();
			for (var row : rows)
				variables.put(row.getKey(), row.getValue());
			return variables;
		});
	}

	private <T> T read(String what, Supplier<T> query) {
		try {
			return query.get();
		} //
		catch (DataAccessException e) {
			this.log.warn("couldn't read {} from the store: {}", what, e.getMessage());
			throw new StoreUnavailableException("couldn't read " + what, e);
		}
	}

	private static Instant instant(ResultSet rs, String column) throws SQLException {
		var timestamp = rs.getTimestamp(column);
		return timestamp == null ? Instant.EPOCH : timestamp.toInstant();
	}

}

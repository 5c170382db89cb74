package com.joshlong.cms.api.compositions;

import com.joshlong.cms.api.ContentIntegrityException;
import com.joshlong.cms.api.ContentNotFoundException;
import com.joshlong.cms.api.store.ArticleAtom;
import com.joshlong.cms.api.store.AtomType;
import com.joshlong.cms.api.store.ContentStore;
import com.joshlong.cms.api.variables.Placeholders;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.Assert;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;

@Service
class DefaultCompositionService implements CompositionService {

	/**
	 * ascending sort order, and the atom id when two atoms claim the same slot.
	 */
	static final Comparator<ArticleAtom> ATOM_ORDER = Comparator.comparingInt(ArticleAtom::sortOrder)
		.thenComparing(ArticleAtom::atomId);

	private final Logger log = LoggerFactory.getLogger(getClass());

	private final ContentStore store;

	private final AtomRenderer atomRenderer;

	DefaultCompositionService(ContentStore store, Placeholders placeholders) {
		this.store = store;
		this.atomRenderer = new AtomRenderer(placeholders);
	}

	@Override
	public ComposedArticle compose(Long articleId) {
		return this.compose(articleId, false);
	}

	@Override
	public ComposedArticle compose(Long articleId, boolean raw) {
		Assert.notNull(articleId, "the article id must not be null");
		var article = this.store.getArticle(articleId);
		if (article == null)
			throw new ContentNotFoundException("there is no article #" + articleId);

		var references = new ArrayList<>(this.store.getArticleAtoms(articleId));
		references.sort(ATOM_ORDER);

		// an article usually has a handful of types, shared by many atoms
		var types = new HashMap<Long, AtomType>();
		var fragments = new ArrayList<Fragment>(references.size());
		var lastModified = article.published().toEpochMilli();
		var fingerprint = new StringBuilder()//
			.append(article.id())
			.append('@')
			.append(article.published().toEpochMilli());

		for (var reference : references) {
			var atom = this.store.getAtom(reference.atomId());
			if (atom == null)
				throw new ContentIntegrityException(
						"article #" + articleId + " refers to atom #" + reference.atomId() + ", which doesn't exist");
			var type = types.computeIfAbsent(atom.typeId(), this.store::getType);
			if (type == null)
				throw new ContentIntegrityException(
						"atom #" + atom.id() + " refers to type #" + atom.typeId() + ", which doesn't exist");

			var content = raw ? atom.content() : this.atomRenderer.render(atom, type);
			fragments.add(new Fragment(atom.id(), atom.key(), type.name(), reference.sortOrder(), content));

			lastModified = Math.max(lastModified,
					Math.max(atom.published().toEpochMilli(), type.updated().toEpochMilli()));
			fingerprint.append(';')
				.append(atom.id())
				.append(':')
				.append(reference.sortOrder())
				.append('@')
				.append(atom.published().toEpochMilli())
				.append('/')
				.append(type.id())
				.append('@')
				.append(type.updated().toEpochMilli());
		}

		var version = new VersionToken(lastModified,
				DigestUtils.md5DigestAsHex(fingerprint.toString().getBytes(StandardCharsets.UTF_8)));
		this.log.debug("composed article #{} from {} atoms at version {}", articleId, fragments.size(), version);
		return new ComposedArticle(article, fragments, version);
	}

}

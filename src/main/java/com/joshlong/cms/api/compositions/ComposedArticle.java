package com.joshlong.cms.api.compositions;

import com.joshlong.cms.api.store.Article;

import java.util.List;

/**
 * an article's atoms in order: ascending sort order, then ascending atom id.
 */
public record ComposedArticle(Article article, List<Fragment> fragments, VersionToken version) {

	public ComposedArticle {
		fragments = List.copyOf(fragments);
	}

	/**
	 * the fragments back to back. templates own their own boundaries, so there's no
	 * separator.
	 */
	public String content() {
		var sb = new StringBuilder();
		for (var fragment : this.fragments)
			sb.append(fragment.content());
		return sb.toString();
	}

}

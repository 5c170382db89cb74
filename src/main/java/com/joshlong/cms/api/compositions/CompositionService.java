package com.joshlong.cms.api.compositions;

/**
 * assembles an article from its atoms. nothing is cached here: every call goes back to
 * the store, so that a changed atom shows up as a changed {@link VersionToken}.
 */
public interface CompositionService {

	/**
	 * @throws com.joshlong.cms.api.ContentNotFoundException if there's no such article
	 * @throws com.joshlong.cms.api.ContentIntegrityException if the article refers to an
	 * atom, or an atom to a type, that the store doesn't have
	 */
	ComposedArticle compose(Long articleId);

	/**
	 * @param raw when true the atoms' stored content is used as is, without their type
	 * templates
	 */
	ComposedArticle compose(Long articleId, boolean raw);

}

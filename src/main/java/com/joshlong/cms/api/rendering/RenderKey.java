package com.joshlong.cms.api.rendering;

import com.joshlong.cms.api.compositions.VersionToken;

/**
 * identifies one cached global + cacheable pass.
 *
 * @param collectionId {@code null} when the article was rendered on its own
 * @param cacheableSignature a digest of the cacheable variables
 */
record RenderKey(Long collectionId, Long articleId, VersionToken version, String cacheableSignature, boolean raw) {

	/**
	 * everything but the version: a newer version of the same lineage supersedes the
	 * older one.
	 */
	record Lineage(Long collectionId, Long articleId, String cacheableSignature, boolean raw) {
	}

	Lineage lineage() {
		return new Lineage(this.collectionId, this.articleId, this.cacheableSignature, this.raw);
	}

}

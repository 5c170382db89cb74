package com.joshlong.cms.api.rendering;

import java.util.Map;

/**
 * what to render for whom. name the article either directly with {@code articleId}, or
 * through a collection with {@code collectionId} and either {@code url} or
 * {@code articleId}.
 *
 * @param cacheable variables that are stable for the collection; they are cached
 * together with the rendered content, keyed by their digest
 * @param uncacheable variables for this request only
 * @param raw use the atoms' stored content instead of rendering their templates
 */
public record RenderRequest(Long clientId, Long collectionId, Long articleId, String url,
		Map<String, String> cacheable, Map<String, String> uncacheable, boolean raw) {

	public RenderRequest {
		cacheable = cacheable == null ? Map.of() : cacheable;
		uncacheable = uncacheable == null ? Map.of() : uncacheable;
	}

	public static RenderRequest forArticle(Long clientId, Long articleId, Map<String, String> cacheable,
			Map<String, String> uncacheable) {
		return new RenderRequest(clientId, null, articleId, null, cacheable, uncacheable, false);
	}

	public static RenderRequest forCollectionUrl(Long clientId, Long collectionId, String url,
			Map<String, String> cacheable, Map<String, String> uncacheable) {
		return new RenderRequest(clientId, collectionId, null, url, cacheable, uncacheable, false);
	}

	public RenderRequest withRaw(boolean raw) {
		return new RenderRequest(this.clientId, this.collectionId, this.articleId, this.url, this.cacheable,
				this.uncacheable, raw);
	}

}

package com.joshlong.cms.api.store;

/**
 * an article's slot in a collection. {@code url} is unique within the collection when
 * present, and {@code meta} is free-form json.
 */
public record CollectionArticle(Long articleId, int sortOrder, String url, String template, String meta) {
}

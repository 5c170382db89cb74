package com.joshlong.cms.api.store;

/**
 * @param name the display name override, if any
 * @param articleName the name of the article itself
 * @param url the article's url in the menu's collection, if any
 */
public record MenuArticle(Long articleId, int sortOrder, String name, String articleName, String url) {
}

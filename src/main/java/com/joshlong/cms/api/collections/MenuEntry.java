package com.joshlong.cms.api.collections;

/**
 * @param displayName the menu's name for the article if it has one, else the article's
 * own
 */
public record MenuEntry(Long articleId, String displayName, String url, int sortOrder) {
}

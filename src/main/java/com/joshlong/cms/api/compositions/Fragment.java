package com.joshlong.cms.api.compositions;

/**
 * one atom, rendered through its type's template, in its place within an article.
 */
public record Fragment(Long atomId, String key, String typeName, int sortOrder, String content) {
}

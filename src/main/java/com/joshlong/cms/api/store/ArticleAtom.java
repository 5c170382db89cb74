package com.joshlong.cms.api.store;

/**
 * places an atom in an article. atoms are shared, so this is an association and not
 * ownership.
 */
public record ArticleAtom(Long atomId, int sortOrder) {
}

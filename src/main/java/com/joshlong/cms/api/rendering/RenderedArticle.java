package com.joshlong.cms.api.rendering;

import com.joshlong.cms.api.compositions.VersionToken;

import java.util.List;
import java.util.Map;

/**
 * an article with every variable tier applied.
 *
 * @param collectionId {@code null} unless the article was rendered through a collection,
 * and likewise {@code template} and {@code meta}
 * @param atomsByKey positions in {@code atoms}, for the atoms that have a key
 * @param atomsById positions in {@code atoms}
 * @param content the atoms' content back to back
 */
public record RenderedArticle(Long articleId, String name, Long collectionId, String template,
		Map<String, Object> meta, List<RenderedAtom> atoms, Map<String, Integer> atomsByKey,
		Map<Long, Integer> atomsById, String content, VersionToken version) {
}

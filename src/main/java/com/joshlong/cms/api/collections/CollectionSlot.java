package com.joshlong.cms.api.collections;

import java.util.Map;

/**
 * where an article sits in a collection and how the client should present it.
 *
 * @param meta the slot's metadata, or {@code null} when there is none or it isn't a json
 * object
 */
public record CollectionSlot(Long collectionId, Long articleId, int sortOrder, String url, String template,
		Map<String, Object> meta) {
}

package com.joshlong.cms.api.collections;

import com.joshlong.cms.api.store.Collection;

import java.util.List;
import java.util.Map;

/**
 * a collection with its article slots in order and its menus by name.
 */
public record CollectionOverview(Collection collection, List<CollectionSlot> articles,
		Map<String, List<MenuEntry>> menus) {
}

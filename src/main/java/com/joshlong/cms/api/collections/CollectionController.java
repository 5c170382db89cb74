package com.joshlong.cms.api.collections;

import com.joshlong.cms.api.utils.JsonUtils;
import org.springframework.graphql.data.method.annotation.Argument;
import org.springframework.graphql.data.method.annotation.QueryMapping;
import org.springframework.graphql.data.method.annotation.SchemaMapping;
import org.springframework.stereotype.Controller;

import java.util.List;

@Controller
class CollectionController {

	private final CollectionService collectionService;

	CollectionController(CollectionService collectionService) {
		this.collectionService = collectionService;
	}

	@QueryMapping
	CollectionOverview collection(@Argument Long client, @Argument Long collectionId) {
		return this.collectionService.describeCollection(client, collectionId);
	}

	@QueryMapping
	CollectionOverview collectionByName(@Argument Long client, @Argument String name) {
		var collection = this.collectionService.getCollectionByName(client, name);
		return this.collectionService.describeCollection(client, collection.id());
	}

	@QueryMapping
	List<MenuEntry> menu(@Argument Long client, @Argument Long menuId) {
		return this.collectionService.resolveMenu(client, menuId);
	}

	@SchemaMapping(typeName = "CollectionOverview")
	Long id(CollectionOverview overview) {
		return overview.collection().id();
	}

	@SchemaMapping(typeName = "CollectionOverview")
	String name(CollectionOverview overview) {
		return overview.collection().name();
	}

	@SchemaMapping(typeName = "CollectionOverview")
	List<NamedMenu> menus(CollectionOverview overview) {
		return overview.menus().entrySet().stream().map(e -> new NamedMenu(e.getKey(), e.getValue())).toList();
	}

	@SchemaMapping(typeName = "CollectionSlot")
	String meta(CollectionSlot slot) {
		return slot.meta() == null ? null : JsonUtils.write(slot.meta());
	}

}

package com.joshlong.cms.api.collections;

import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseBody;

@Controller
@ResponseBody
class CollectionJsonController {

	private final CollectionService collectionService;

	CollectionJsonController(CollectionService collectionService) {
		this.collectionService = collectionService;
	}

	@GetMapping("/json/collection/{collectionId}")
	CollectionOverview collection(@PathVariable Long collectionId, @RequestParam Long client) {
		return this.collectionService.describeCollection(client, collectionId);
	}

}

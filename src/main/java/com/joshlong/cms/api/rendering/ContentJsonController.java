package com.joshlong.cms.api.rendering;

import com.joshlong.cms.api.collections.MenuEntry;
import com.joshlong.cms.api.utils.JsonUtils;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Controller;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseBody;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Map;

/**
 * the same renders as the graphql api, for clients that just want json. variables
 * travel as base64-encoded json objects in the {@code cacheable} and
 * {@code uncacheable} parameters.
 */
@Controller
@ResponseBody
class ContentJsonController {

	private final RenderService renderService;

	ContentJsonController(RenderService renderService) {
		this.renderService = renderService;
	}

	@GetMapping("/json/article/{articleId}")
	RenderedArticle article(@PathVariable Long articleId, @RequestParam Long client,
			@RequestParam(required = false) String cacheable, @RequestParam(required = false) String uncacheable,
			@RequestParam(defaultValue = "false") boolean raw) {
		var request = RenderRequest.forArticle(client, articleId, variables(cacheable), variables(uncacheable))
			.withRaw(raw);
		return this.renderService.render(request);
	}

	@GetMapping("/json/collection/{collectionId}/{url}")
	RenderedArticle collectionArticle(@PathVariable Long collectionId, @PathVariable String url,
			@RequestParam Long client, @RequestParam(required = false) String cacheable,
			@RequestParam(required = false) String uncacheable, @RequestParam(defaultValue = "false") boolean raw) {
		var request = RenderRequest
			.forCollectionUrl(client, collectionId, url, variables(cacheable), variables(uncacheable))
			.withRaw(raw);
		return this.renderService.render(request);
	}

	@GetMapping("/json/menu/{menuId}")
	List<MenuEntry> menu(@PathVariable Long menuId, @RequestParam Long client) {
		return this.renderService.listMenu(client, menuId);
	}

	static Map<String, String> variables(String base64) {
		if (!StringUtils.hasText(base64))
			return Map.of();
		var json = new String(Base64.getDecoder().decode(base64.trim()), StandardCharsets.UTF_8);
		return JsonUtils.read(json, new ParameterizedTypeReference<Map<String, String>>() {
		});
	}

}

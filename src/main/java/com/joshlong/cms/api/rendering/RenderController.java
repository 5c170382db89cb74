package com.joshlong.cms.api.rendering;

import com.joshlong.cms.api.utils.JsonUtils;
import org.springframework.graphql.data.method.annotation.Argument;
import org.springframework.graphql.data.method.annotation.MutationMapping;
import org.springframework.graphql.data.method.annotation.QueryMapping;
import org.springframework.graphql.data.method.annotation.SchemaMapping;
import org.springframework.stereotype.Controller;

import java.util.List;

@Controller
class RenderController {

	private final RenderService renderService;

	RenderController(RenderService renderService) {
		this.renderService = renderService;
	}

	@QueryMapping
	RenderedArticle renderArticle(@Argument Long client, @Argument Long articleId,
			@Argument List<VariableInput> cacheable, @Argument List<VariableInput> uncacheable,
			@Argument Boolean raw) {
		var request = RenderRequest
			.forArticle(client, articleId, VariableInput.toMap(cacheable), VariableInput.toMap(uncacheable))
			.withRaw(Boolean.TRUE.equals(raw));
		return this.renderService.render(request);
	}

	@QueryMapping
	RenderedArticle renderCollectionArticle(@Argument Long client, @Argument Long collectionId, @Argument String url,
			@Argument List<VariableInput> cacheable, @Argument List<VariableInput> uncacheable,
			@Argument Boolean raw) {
		var request = RenderRequest
			.forCollectionUrl(client, collectionId, url, VariableInput.toMap(cacheable),
					VariableInput.toMap(uncacheable))
			.withRaw(Boolean.TRUE.equals(raw));
		return this.renderService.render(request);
	}

	@QueryMapping
	RenderCacheStatistics renderCacheStatistics() {
		return this.renderService.cacheStatistics();
	}

	@MutationMapping
	boolean clearRenderCache() {
		this.renderService.clearCache();
		return true;
	}

	@SchemaMapping(typeName = "RenderedArticle")
	String meta(RenderedArticle article) {
		return article.meta() == null ? null : JsonUtils.write(article.meta());
	}

}

package com.joshlong.cms.api.rendering;

import com.joshlong.cms.api.ContentNotFoundException;
import com.joshlong.cms.api.collections.CollectionService;
import com.joshlong.cms.api.collections.CollectionSlot;
import com.joshlong.cms.api.collections.MenuEntry;
import com.joshlong.cms.api.compositions.CompositionService;
import com.joshlong.cms.api.compositions.Fragment;
import com.joshlong.cms.api.utils.JsonUtils;
import com.joshlong.cms.api.variables.SubstitutedContent;
import com.joshlong.cms.api.variables.VariableService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.Assert;
import org.springframework.util.DigestUtils;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Service
class DefaultRenderService implements RenderService {

	private final Logger log = LoggerFactory.getLogger(getClass());

	private final CollectionService collectionService;

	private final CompositionService compositionService;

	private final VariableService variableService;

	private final RenderCache<List<SubstitutedContent>> renderCache;

	DefaultRenderService(CollectionService collectionService, CompositionService compositionService,
			VariableService variableService, RenderCache<List<SubstitutedContent>> renderCache) {
		this.collectionService = collectionService;
		this.compositionService = compositionService;
		this.variableService = variableService;
		this.renderCache = renderCache;
	}

	@Override
	public RenderedArticle render(RenderRequest request) {
		Assert.notNull(request, "the request must not be null");
		var clientId = request.clientId();
		Assert.notNull(clientId, "the client must not be null");

		var slot = (CollectionSlot) null;
		var articleId = request.articleId();
		if (request.collectionId() != null) {
			slot = StringUtils.hasText(request.url())
					? this.collectionService.resolveCollectionArticle(clientId, request.collectionId(), request.url())
					: this.collectionService.resolveCollectionArticle(clientId, request.collectionId(), articleId);
			articleId = slot.articleId();
		}
		Assert.notNull(articleId, "an article id, or a collection and a url, is required");

		var composed = this.compositionService.compose(articleId, request.raw());
		if (!clientId.equals(composed.article().clientId()))
			throw new ContentNotFoundException("there is no article #" + articleId);

		var fragments = composed.fragments();
		var key = new RenderKey(request.collectionId(), articleId, composed.version(),
				signature(request.cacheable()), request.raw());
		var substituted = this.renderCache.getOrCompute(key, () -> this.variableService
			.resolveGlobalAndCacheable(fragments.stream().map(Fragment::content).toList(), clientId,
					request.cacheable()));
		Assert.state(substituted.size() == fragments.size(),
				"the cached render of " + key + " doesn't match the composed article");

		var atoms = new ArrayList<RenderedAtom>(fragments.size());
		var atomsByKey = new LinkedHashMap<String, Integer>();
		var atomsById = new LinkedHashMap<Long, Integer>();
		var content = new StringBuilder();
		for (var i = 0; i < fragments.size(); i++) {
			var fragment = fragments.get(i);
			var text = this.variableService.resolveUncacheable(substituted.get(i), request.uncacheable());
			atoms.add(new RenderedAtom(fragment.atomId(), fragment.key(), fragment.typeName(), fragment.sortOrder(),
					text));
			if (StringUtils.hasText(fragment.key()))
				atomsByKey.put(fragment.key(), i);
			atomsById.put(fragment.atomId(), i);
			content.append(text);
		}
		this.log.debug("rendered article #{} for client #{} at version {}", articleId, clientId, composed.version());
		return new RenderedArticle(articleId, composed.article().name(), request.collectionId(),
				slot == null ? null : slot.template(), slot == null ? null : slot.meta(), atoms, atomsByKey,
				atomsById, content.toString(), composed.version());
	}

	@Override
	public List<MenuEntry> listMenu(Long clientId, Long menuId) {
		return this.collectionService.resolveMenu(clientId, menuId);
	}

	@Override
	public RenderCacheStatistics cacheStatistics() {
		return this.renderCache.statistics();
	}

	@Override
	public void clearCache() {
		this.renderCache.clear();
	}

	/**
	 * the same variables give the same digest regardless of map order.
	 */
	static String signature(Map<String, String> cacheable) {
		var sorted = new TreeMap<String, String>(cacheable == null ? Map.of() : cacheable);
		return DigestUtils.md5DigestAsHex(JsonUtils.write(sorted).getBytes(StandardCharsets.UTF_8));
	}

}

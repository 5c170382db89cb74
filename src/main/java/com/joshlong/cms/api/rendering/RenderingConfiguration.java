package com.joshlong.cms.api.rendering;

import com.joshlong.cms.api.ApiProperties;
import com.joshlong.cms.api.variables.SubstitutedContent;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
class RenderingConfiguration {

	@Bean
	RenderCache<List<SubstitutedContent>> renderCache(ApiProperties properties) {
		var cache = properties.cache();
		return new RenderCache<>(cache.maxEntries(), cache.maxWeight(),
				fragments -> fragments.stream().mapToInt(SubstitutedContent::weight).sum());
	}

}

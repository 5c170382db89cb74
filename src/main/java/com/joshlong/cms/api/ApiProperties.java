package com.joshlong.cms.api;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * settings for the render engine, bound from the {@code cms.*} properties.
 *
 * @param cache bounds for the render cache. {@code maxWeight} is the sum of the cached
 * content lengths, in characters; zero means only {@code maxEntries} applies.
 * @param variables the delimiters around a tag, used both by atom templates and by
 * variable substitution.
 */
@ConfigurationProperties(prefix = "cms")
public record ApiProperties(@DefaultValue Cache cache, @DefaultValue Variables variables) {

	public record Cache(@DefaultValue("1000") int maxEntries, @DefaultValue("0") long maxWeight) {
	}

	public record Variables(@DefaultValue("[") String open, @DefaultValue("]") String close) {
	}

}

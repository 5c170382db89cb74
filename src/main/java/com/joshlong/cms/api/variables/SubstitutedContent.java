package com.joshlong.cms.api.variables;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * content with the global and cacheable tiers applied. this is what the render cache
 * keeps: {@link #text()} still shows the placeholders that are left, and
 * {@link VariableService#resolveUncacheable} finishes the job per request.
 */
public record SubstitutedContent(List<Segment> segments) {

	public SubstitutedContent {
		segments = List.copyOf(segments);
	}

	public String text() {
		var sb = new StringBuilder();
		for (var segment : this.segments)
			sb.append(segment.text());
		return sb.toString();
	}

	public Set<String> unresolvedTags() {
		var tags = new LinkedHashSet<String>();
		for (var segment : this.segments)
			if (segment instanceof Segment.Placeholder placeholder)
				tags.add(placeholder.tag());
		return tags;
	}

	/**
	 * the length of the text, used to weigh cache entries.
	 */
	public int weight() {
		var weight = 0;
		for (var segment : this.segments)
			weight += segment.text().length();
		return weight;
	}

}

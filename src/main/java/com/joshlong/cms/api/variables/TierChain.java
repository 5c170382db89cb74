package com.joshlong.cms.api.variables;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * the tiers to consult, nearest first. lookups walk the list in order, so the order of
 * the list is the precedence.
 */
record TierChain(List<Link> links) {

	record Link(Tier tier, Map<String, String> values) {
	}

	TierChain {
		links = List.copyOf(links);
	}

	static TierChain of(Tier tier, Map<String, String> values) {
		return new TierChain(List.of(new Link(tier, values == null ? Map.of() : values)));
	}

	TierChain then(Tier tier, Map<String, String> values) {
		var next = new ArrayList<>(this.links);
		next.add(new Link(tier, values == null ? Map.of() : values));
		return new TierChain(next);
	}

	/**
	 * the nearest link that defines the tag, or {@code null}.
	 */
	Link lookup(String tag) {
		for (var link : this.links)
			if (link.values().get(tag) != null)
				return link;
		return null;
	}

	List<Tier> tiersDefining(String tag) {
		var tiers = new ArrayList<Tier>();
		for (var link : this.links)
			if (link.values().get(tag) != null)
				tiers.add(link.tier());
		return tiers;
	}

}

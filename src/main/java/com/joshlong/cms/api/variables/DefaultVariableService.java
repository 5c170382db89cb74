package com.joshlong.cms.api.variables;

import com.joshlong.cms.api.store.ContentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Service
class DefaultVariableService implements VariableService {

	private final Logger log = LoggerFactory.getLogger(getClass());

	private final ContentStore store;

	private final Placeholders placeholders;

	DefaultVariableService(ContentStore store, Placeholders placeholders) {
		this.store = store;
		this.placeholders = placeholders;
	}

	@Override
	public SubstitutedContent resolveGlobalAndCacheable(String content, Long clientId,
			Map<String, String> cacheable) {
		return this.resolveGlobalAndCacheable(List.of(content == null ? "" : content), clientId, cacheable).get(0);
	}

	@Override
	public List<SubstitutedContent> resolveGlobalAndCacheable(List<String> contents, Long clientId,
			Map<String, String> cacheable) {
		var globals = clientId == null ? Map.<String, String>of() : this.store.getGlobalVariables(clientId);
		var chain = TierChain.of(Tier.CACHEABLE, cacheable).then(Tier.GLOBAL, globals);
		var ambiguous = new LinkedHashSet<String>();
		var results = new ArrayList<SubstitutedContent>(contents.size());
		for (var content : contents) {
			var segments = new ArrayList<Segment>();
			for (var segment : this.placeholders.parse(content)) {
				if (segment instanceof Segment.Placeholder placeholder) {
					segments.add(substitute(chain, placeholder, ambiguous));
				} //
				else {
					segments.add(segment);
				}
			}
			results.add(new SubstitutedContent(segments));
		}
		this.warnIfAmbiguous(ambiguous, clientId);
		return results;
	}

	@Override
	public String resolveUncacheable(SubstitutedContent content, Map<String, String> uncacheable) {
		var values = uncacheable == null ? Map.<String, String>of() : uncacheable;
		var ambiguous = new LinkedHashSet<String>();
		var sb = new StringBuilder();
		for (var segment : content.segments()) {
			var tag = tagOf(segment);
			var value = tag == null ? null : values.get(tag);
			if (value != null) {
				if (segment instanceof Segment.Substitution)
					ambiguous.add(tag);
				sb.append(value);
			} //
			else {
				sb.append(segment.text());
			}
		}
		this.warnIfAmbiguous(ambiguous, null);
		return sb.toString();
	}

	private static String tagOf(Segment segment) {
		if (segment instanceof Segment.Placeholder placeholder)
			return placeholder.tag();
		if (segment instanceof Segment.Substitution substitution)
			return substitution.tag();
		return null;
	}

	private Segment substitute(TierChain chain, Segment.Placeholder placeholder, Set<String> ambiguous) {
		var tag = placeholder.tag();
		var link = chain.lookup(tag);
		if (link == null) {
			if (this.log.isTraceEnabled())
				this.log.trace("no cacheable or global value for [{}]", tag);
			return placeholder;
		}
		if (chain.tiersDefining(tag).size() > 1)
			ambiguous.add(tag);
		return new Segment.Substitution(tag, placeholder.raw(), link.values().get(tag), link.tier());
	}

	private void warnIfAmbiguous(Set<String> tags, Long clientId) {
		if (tags.isEmpty())
			return;
		if (clientId == null)
			this.log.warn("the tags {} are defined in more than one tier; the nearest tier wins", tags);
		else
			this.log.warn("the tags {} are defined in more than one tier for client #{}; the nearest tier wins", tags,
					clientId);
	}

}

package com.joshlong.cms.api.variables;

import java.util.List;
import java.util.Map;

/**
 * substitutes the three variable tiers into content. the first pass (global and
 * cacheable) produces what the render cache may keep, the second (uncacheable) is done
 * per request on top of it. where a tag is defined in several tiers the one nearest the
 * request wins: uncacheable, then cacheable, then global. tags that nothing defines are
 * left in place, delimiters and all.
 */
public interface VariableService {

	SubstitutedContent resolveGlobalAndCacheable(String content, Long clientId, Map<String, String> cacheable);

	/**
	 * like {@link #resolveGlobalAndCacheable(String, Long, Map)}, for several pieces of
	 * content at once; the client's variables are read once.
	 */
	List<SubstitutedContent> resolveGlobalAndCacheable(List<String> contents, Long clientId,
			Map<String, String> cacheable);

	String resolveUncacheable(SubstitutedContent content, Map<String, String> uncacheable);

}

package com.joshlong.cms.api.variables;

/**
 * where a substituted value came from, nearest to the request first. a tag defined in
 * more than one tier resolves to the first of them in this order.
 */
public enum Tier {

	/**
	 * pushed with a single request, never cached
	 */
	UNCACHEABLE,

	/**
	 * pushed once per collection and stable across requests, so it's cached
	 */
	CACHEABLE,

	/**
	 * stored, scoped to the client
	 */
	GLOBAL

}

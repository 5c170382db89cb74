package com.joshlong.cms.api;

/**
 * an article, collection, menu or url was requested directly and does not exist (or
 * belongs to another client). never retried.
 */
public class ContentNotFoundException extends ContentException {

	public ContentNotFoundException(String message) {
		super(message);
	}

}

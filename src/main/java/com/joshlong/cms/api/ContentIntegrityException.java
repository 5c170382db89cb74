package com.joshlong.cms.api;

/**
 * something refers to a child (an atom, an atom type) that isn't in the store. the
 * caller decides whether a partial render is acceptable; we don't.
 */
public class ContentIntegrityException extends ContentException {

	public ContentIntegrityException(String message) {
		super(message);
	}

}

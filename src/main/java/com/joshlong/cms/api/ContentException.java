package com.joshlong.cms.api;

/**
 * root of the failures the render engine surfaces to its callers.
 */
public abstract class ContentException extends RuntimeException {

	protected ContentException(String message) {
		super(message);
	}

	protected ContentException(String message, Throwable cause) {
		super(message, cause);
	}

}

package com.joshlong.cms.api;

/**
 * the persistence store failed. this is usually transient, and retrying is up to the
 * caller.
 */
public class StoreUnavailableException extends ContentException {

	public StoreUnavailableException(String message, Throwable cause) {
		super(message, cause);
	}

}

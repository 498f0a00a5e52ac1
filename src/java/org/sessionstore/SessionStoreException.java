package org.sessionstore;

/**
 * Failure of a persister that is not covered by a more specific exception, such as a session that
 * could not be serialized.
 */
public class SessionStoreException extends RuntimeException {

	private static final long serialVersionUID = 1;

	public SessionStoreException(String message) {
		super(message);
	}

	public SessionStoreException(String message, Throwable cause) {
		super(message, cause);
	}

}

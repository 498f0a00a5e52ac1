package org.sessionstore;

/**
 * Thrown when a {@link Session} is used after it has been committed.
 */
public class InvalidatedSessionException extends IllegalStateException {

	private static final long serialVersionUID = 2;

	/**
	 * Constructor.
	 */
	public InvalidatedSessionException(String message) {
		super(message);
	}

}

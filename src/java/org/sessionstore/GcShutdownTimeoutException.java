package org.sessionstore;

/**
 * Reported by {@link SessionManager#shutdown()} when the garbage collection loop did not acknowledge the stop
 * request in time. The persister has already been shut down when this is thrown.
 */
public class GcShutdownTimeoutException extends SessionStoreException {

	private static final long serialVersionUID = 1;

	public GcShutdownTimeoutException(String message) {
		super(message);
	}

}

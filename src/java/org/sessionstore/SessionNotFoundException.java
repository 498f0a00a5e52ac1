package org.sessionstore;

/**
 * Thrown by {@link Persister#getSessionData(String)} when nothing valid is stored under an id. This is the
 * normal outcome for new and expired sessions; callers start a fresh session.
 */
public class SessionNotFoundException extends SessionStoreException {

	private static final long serialVersionUID = 1;

	private final String sessionId;

	public SessionNotFoundException(String sessionId) {
		super("No session found for id " + sessionId);
		this.sessionId = sessionId;
	}

	public String getSessionId() {
		return sessionId;
	}

}

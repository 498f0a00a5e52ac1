package org.sessionstore;

/**
 * Storage backend for sessions. Every method except {@link #shutdown()} must be safe to call concurrently;
 * calls for the same session id are serialized by the {@link SessionManager}.
 *
 * @author sessionstore contributors
 */
public interface Persister {

	/**
	* Persists a session to the data store, replacing whatever was stored for its id and refreshing its
	* last-used time. A session with an empty id has never been initialized and is silently ignored.
	*/
	void persistSession(SessionData session);

	/**
	* Retrieves a copy of the stored data for the given session.
	*
	* @throws SessionNotFoundException if the id is not recognized or the record has expired
	*/
	SessionData getSessionData(String sessionId);

	/**
	 * Effectively delete a session. Succeeds when nothing is stored under the id.
	 *
	 * @param sessionId the session id
	 */
	void invalidate(String sessionId);

	/**
	* Removes every session whose last use is older than the configured maximum age.
	*/
	void cleanUp();

	/**
	* Releases the persister's resources. No other method may be called afterwards.
	*/
	void shutdown();

}

package org.sessionstore;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

import org.apache.log4j.Logger;

/**
 * The session of a single request, obtained from {@link SessionManager#beginSession(SessionTransport)}.
 * Values are a private working copy until {@link #commit()} writes them back; commit exactly once, at the
 * end of the request, whether or not the request succeeded. {@link #close()} commits a session that has not
 * been committed yet, so a try-with-resources block does the right thing.
 * <p>
 * A session may be shared by the threads serving its request, but not across requests.
 *
 * @author sessionstore contributors
 */
public class Session implements AutoCloseable {

	private static final Logger log = Logger.getLogger(Session.class);

	/**
	* Reserved key holding the action token.
	*/
	public static final String ACTION_TOKEN_KEY = "actionToken";

	/**
	* Request parameter that {@link #canAct()} checks against the action token.
	*/
	public static final String ACTION_TOKEN_PARAMETER = "actionToken";

	static final String MISSING_ACTION_TOKEN = "error";

	private final SessionManager manager;
	private final SessionTransport transport;
	private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

	private String sessionId;
	private Map<String,String> values;
	private SessionLockTable.Lease lease;
	private boolean committed = false;

	Session(final SessionManager manager, final SessionTransport transport, final String sessionId,
			final Map<String,String> values, final SessionLockTable.Lease lease) {
		this.manager = manager;
		this.transport = transport;
		this.sessionId = sessionId;
		this.values = new HashMap<String,String>(values);
		this.lease = lease;
	}

	private void checkAccess() {
		if(committed) {
			throw new InvalidatedSessionException("Session " + sessionId + " has been committed; cannot access/modify it.");
		}
	}

	public String getId() {
		lock.readLock().lock();
		try {
			return sessionId;
		} finally {
			lock.readLock().unlock();
		}
	}

	/**
	* @return the value stored under {@code key}, or {@code null} if there is none
	*/
	public String get(String key) {
		lock.readLock().lock();
		try {
			checkAccess();
			return values.get(key);
		} finally {
			lock.readLock().unlock();
		}
	}

	/**
	* Stores a value; a {@code null} value removes the key.
	*/
	public void set(String key, String value) {
		Preconditions.checkArgument(key != null, "Cannot store a null key into the session");
		if(value == null) {
			remove(key);
			return;
		}
		lock.writeLock().lock();
		try {
			checkAccess();
			values.put(key, value);
		} finally {
			lock.writeLock().unlock();
		}
	}

	public void remove(String key) {
		lock.writeLock().lock();
		try {
			checkAccess();
			values.remove(key);
		} finally {
			lock.writeLock().unlock();
		}
	}

	/**
	* Gets an immutable copy of all the values.
	*/
	public Map<String,String> getValues() {
		lock.readLock().lock();
		try {
			checkAccess();
			return ImmutableMap.copyOf(values);
		} finally {
			lock.readLock().unlock();
		}
	}

	/**
	* Writes the values back to the persister and releases the session id for the next request.
	* The id is released even when the persister fails.
	*
	* @throws InvalidatedSessionException if the session was already committed
	*/
	public void commit() {
		lock.writeLock().lock();
		try {
			checkAccess();
			committed = true;
			try {
				if(!sessionId.isEmpty()) {
					manager.getPersister().persistSession(new SessionData(sessionId, values));
				}
			} finally {
				releaseLease();
			}
		} finally {
			lock.writeLock().unlock();
		}
	}

	/**
	* Commits the session unless that has already happened.
	*/
	@Override
	public void close() {
		lock.writeLock().lock();
		try {
			if(!committed) {
				commit();
			}
		} finally {
			lock.writeLock().unlock();
		}
	}

	/**
	* Throws away the session and starts a new, empty one under a fresh id. If the persister fails to delete
	* the old session, the new session is still started before the failure is rethrown.
	*/
	public void clear() {
		final String newId = SessionIds.newId();
		RuntimeException failure = null;

		lock.writeLock().lock();
		try {
			checkAccess();
			if(!sessionId.isEmpty()) {
				try {
					manager.getPersister().invalidate(sessionId);
				} catch(RuntimeException e) {
					failure = e;
				}
			}
			releaseLease();
			log.debug("Replacing session " + (sessionId.isEmpty() ? "<none>" : sessionId) + " with " + newId);
			sessionId = newId;
			values = new HashMap<String,String>();
			lease = manager.getLocks().acquire(newId);
		} finally {
			lock.writeLock().unlock();
		}

		writeCookie();
		newActionToken();

		if(failure != null) {
			throw failure;
		}
	}

	/**
	* @return a token to embed into forms, checked by {@link #canAct()}
	*/
	public String getActionToken() {
		final String token = get(ACTION_TOKEN_KEY);
		return token == null ? MISSING_ACTION_TOKEN : token;
	}

	/**
	* Checks the {@value #ACTION_TOKEN_PARAMETER} request parameter against the action token.
	*
	* @return true if the request came from a page this session rendered
	*/
	public boolean canAct() {
		final String submitted = transport.getParameter(ACTION_TOKEN_PARAMETER);
		final String token = get(ACTION_TOKEN_KEY);
		return token != null && !MISSING_ACTION_TOKEN.equals(submitted) && token.equals(submitted);
	}

	/**
	* Replaces the action token. Call this after each checked action.
	*/
	public String newActionToken() {
		set(ACTION_TOKEN_KEY, SessionIds.newId());
		return getActionToken();
	}

	void writeCookie() {
		transport.writeToken(manager.getCookieName(), getId(), manager.isSecure());
	}

	private void releaseLease() {
		if(lease != null) {
			lease.close();
			lease = null;
		}
	}

	public String toString() {
		return "Session[" + getId() + "]";
	}

}

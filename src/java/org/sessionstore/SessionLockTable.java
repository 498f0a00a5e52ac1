package org.sessionstore;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import org.apache.log4j.Logger;

/**
 * Ensures each session id is in use by at most one request at a time. The table lock is only held while the
 * table itself is read or changed; a waiting request parks on the condition of the current holder.
 */
final class SessionLockTable {

	private static final Logger log = Logger.getLogger(SessionLockTable.class);

	private final Lock lock = new ReentrantLock();

	private final Map<String,Condition> active = new HashMap<String,Condition>();

	/**
	* Blocks until no one else holds the id, then takes it. Not interruptible.
	*/
	Lease acquire(final String sessionId) {
		lock.lock();
		try {
			Condition inUse;
			while((inUse = active.get(sessionId)) != null) {
				log.debug("Waiting for session " + sessionId + " to be released");
				inUse.awaitUninterruptibly();
			}
			active.put(sessionId, lock.newCondition());
		} finally {
			lock.unlock();
		}
		return new Lease(sessionId);
	}

	private void release(final String sessionId) {
		lock.lock();
		try {
			final Condition inUse = active.remove(sessionId);
			if(inUse != null) {
				inUse.signalAll();
			}
		} finally {
			lock.unlock();
		}
	}

	boolean isHeld(final String sessionId) {
		lock.lock();
		try {
			return active.containsKey(sessionId);
		} finally {
			lock.unlock();
		}
	}

	int size() {
		lock.lock();
		try {
			return active.size();
		} finally {
			lock.unlock();
		}
	}

	/**
	* Exclusive hold on one session id. Closing it more than once is harmless.
	*/
	final class Lease implements AutoCloseable {

		private final String sessionId;
		private final AtomicBoolean released = new AtomicBoolean(false);

		private Lease(final String sessionId) {
			this.sessionId = sessionId;
		}

		String getSessionId() {
			return sessionId;
		}

		@Override
		public void close() {
			if(released.compareAndSet(false, true)) {
				release(sessionId);
			}
		}

	}

}

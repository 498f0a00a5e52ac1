package org.sessionstore;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

import com.google.common.util.concurrent.Uninterruptibles;

/**
 * Wraps a persister and fails or stalls on demand.
 */
class FlakyPersister implements Persister {

	private final Persister delegate;

	volatile RuntimeException persistFailure;
	volatile RuntimeException fetchFailure;
	volatile RuntimeException invalidateFailure;
	volatile RuntimeException cleanUpFailure;
	volatile RuntimeException shutdownFailure;

	/**
	* When set, clean up waits for this latch before doing anything.
	*/
	volatile CountDownLatch cleanUpGate;

	final AtomicInteger cleanUps = new AtomicInteger();
	final CountDownLatch cleanUpEntered = new CountDownLatch(1);
	volatile boolean shutdownCalled = false;

	FlakyPersister(Persister delegate) {
		this.delegate = delegate;
	}

	@Override
	public void persistSession(SessionData session) {
		if(persistFailure != null) throw persistFailure;
		delegate.persistSession(session);
	}

	@Override
	public SessionData getSessionData(String sessionId) {
		if(fetchFailure != null) throw fetchFailure;
		return delegate.getSessionData(sessionId);
	}

	@Override
	public void invalidate(String sessionId) {
		if(invalidateFailure != null) throw invalidateFailure;
		delegate.invalidate(sessionId);
	}

	@Override
	public void cleanUp() {
		cleanUpEntered.countDown();
		CountDownLatch gate = cleanUpGate;
		if(gate != null) {
			Uninterruptibles.awaitUninterruptibly(gate);
		}
		cleanUps.incrementAndGet();
		RuntimeException failure = cleanUpFailure;
		if(failure != null) {
			cleanUpFailure = null;
			throw failure;
		}
		delegate.cleanUp();
	}

	@Override
	public void shutdown() {
		shutdownCalled = true;
		delegate.shutdown();
		if(shutdownFailure != null) throw shutdownFailure;
	}

}

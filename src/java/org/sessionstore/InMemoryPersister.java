package org.sessionstore;

import java.time.Clock;
import java.time.Duration;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Semaphore;

import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.SettableFuture;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.common.util.concurrent.Uninterruptibles;

import org.apache.log4j.Logger;

/**
 * Keeps sessions in memory, suitable for testing and small deployments. A single owning thread holds the
 * session map; every call is turned into a request on the queue for its operation and answered by that
 * thread, so the map is never touched concurrently and no lock guards it.
 * <p>
 * The fetch, commit and invalidate queues absorb bursts of up to {@value #QUEUE_DEPTH} requests. The
 * clean-up and shutdown queues hold a single request, so those callers hand off directly to the owning
 * thread. Calls made after {@link #shutdown()} fail with an {@link IllegalStateException}.
 *
 * @author sessionstore contributors
 */
public class InMemoryPersister extends AbstractPersister {

	private static final Logger log = Logger.getLogger(InMemoryPersister.class);

	static final int QUEUE_DEPTH = 10;

	private static final class StoredSession {
		final long lastUsed;
		final ImmutableMap<String,String> values;

		StoredSession(final long lastUsed, final ImmutableMap<String,String> values) {
			this.lastUsed = lastUsed;
			this.values = values;
		}
	}

	private static final class Request<T> {
		final String sessionId;
		final SessionData session;
		final SettableFuture<T> response = SettableFuture.create();

		Request(final String sessionId, final SessionData session) {
			this.sessionId = sessionId;
			this.session = session;
		}
	}

	private final BlockingQueue<Request<Void>> commitQueue = new ArrayBlockingQueue<Request<Void>>(QUEUE_DEPTH);
	private final BlockingQueue<Request<Void>> deleteQueue = new ArrayBlockingQueue<Request<Void>>(QUEUE_DEPTH);
	private final BlockingQueue<Request<SessionData>> getQueue = new ArrayBlockingQueue<Request<SessionData>>(QUEUE_DEPTH);
	private final BlockingQueue<Request<Void>> gcQueue = new ArrayBlockingQueue<Request<Void>>(1);
	private final BlockingQueue<Request<Void>> closeQueue = new ArrayBlockingQueue<Request<Void>>(1);

	/**
	* One permit per queued request, across all queues.
	*/
	private final Semaphore pending = new Semaphore(0);

	private volatile boolean closed = false;

	// Owned by the serving thread
	private Map<String,StoredSession> store = new HashMap<String,StoredSession>();

	public InMemoryPersister(final Duration maxAge) {
		this(maxAge, Clock.systemUTC());
	}

	public InMemoryPersister(final Duration maxAge, final Clock clock) {
		super(maxAge, clock);
		final Thread owner = new ThreadFactoryBuilder()
			.setNameFormat("session-store-%d")
			.setDaemon(true)
			.build()
			.newThread(new Runnable() {
				public void run() {
					serve();
				}
			});
		owner.start();
		log.debug("Started in-memory session store on " + owner.getName() + " with max age " + maxAge);
	}

	@Override
	public void persistSession(final SessionData session) {
		if(session == null || session.isUninitialized()) return;
		submit(commitQueue, new Request<Void>(session.sessionId, session));
	}

	@Override
	public SessionData getSessionData(final String sessionId) {
		return submit(getQueue, new Request<SessionData>(sessionId, null));
	}

	@Override
	public void invalidate(final String sessionId) {
		submit(deleteQueue, new Request<Void>(sessionId, null));
	}

	@Override
	public void cleanUp() {
		submit(gcQueue, new Request<Void>(null, null));
	}

	@Override
	public void shutdown() {
		submit(closeQueue, new Request<Void>(null, null));
	}

	private <T> T submit(final BlockingQueue<Request<T>> queue, final Request<T> request) {
		if(closed) {
			throw new IllegalStateException("In-memory session store is shut down");
		}
		Uninterruptibles.putUninterruptibly(queue, request);
		pending.release();
		// The serving thread drains every queue after marking itself closed, so a request that is still
		// queued here would never be answered.
		if(closed && queue.remove(request)) {
			throw new IllegalStateException("In-memory session store is shut down");
		}
		try {
			return Uninterruptibles.getUninterruptibly(request.response);
		} catch(ExecutionException e) {
			Throwables.throwIfUnchecked(e.getCause());
			throw new SessionStoreException("In-memory session store failed", e.getCause());
		}
	}

	/**
	* Main loop of the owning thread.
	*/
	private void serve() {
		while(true) {
			pending.acquireUninterruptibly();

			Request<Void> request;
			Request<SessionData> getRequest;
			if((request = commitQueue.poll()) != null) {
				final SessionData session = request.session;
				answer(request, new Op<Void>() {
					public Void run() {
						commit(session);
						return null;
					}
				});
			} else if((request = deleteQueue.poll()) != null) {
				final String sessionId = request.sessionId;
				answer(request, new Op<Void>() {
					public Void run() {
						delete(sessionId);
						return null;
					}
				});
			} else if((getRequest = getQueue.poll()) != null) {
				final String sessionId = getRequest.sessionId;
				answer(getRequest, new Op<SessionData>() {
					public SessionData run() {
						return get(sessionId);
					}
				});
			} else if((request = gcQueue.poll()) != null) {
				answer(request, new Op<Void>() {
					public Void run() {
						gc();
						return null;
					}
				});
			} else if((request = closeQueue.poll()) != null) {
				close(request);
				return;
			}
		}
	}

	private interface Op<T> {
		T run();
	}

	private static <T> void answer(final Request<T> request, final Op<T> op) {
		try {
			request.response.set(op.run());
		} catch(RuntimeException e) {
			request.response.setException(e);
		}
	}

	/* Below are the real work functions, only ever called on the owning thread. */

	private void close(final Request<Void> request) {
		closed = true;
		final int abandoned = failAll(commitQueue) + failAll(deleteQueue) + failAll(getQueue)
			+ failAll(gcQueue) + failAll(closeQueue);
		log.info("Shutting down in-memory session store holding " + store.size() + " sessions"
			+ (abandoned == 0 ? "" : ", rejected " + abandoned + " queued requests"));
		store = null;
		request.response.set(null);
	}

	private static <T> int failAll(final BlockingQueue<Request<T>> queue) {
		int count = 0;
		Request<T> request;
		while((request = queue.poll()) != null) {
			request.response.setException(new IllegalStateException("In-memory session store is shut down"));
			count++;
		}
		return count;
	}

	private void gc() {
		int removed = 0;
		final Iterator<Map.Entry<String,StoredSession>> it = store.entrySet().iterator();
		while(it.hasNext()) {
			final Map.Entry<String,StoredSession> entry = it.next();
			if(isExpired(entry.getValue().lastUsed)) {
				log.debug("Removing expired session " + entry.getKey());
				it.remove();
				removed++;
			}
		}
		log.debug("Session clean up removed " + removed + " sessions, " + store.size() + " remain");
	}

	private SessionData get(final String sessionId) {
		final StoredSession stored = store.get(sessionId);
		if(stored == null || isExpired(stored.lastUsed)) {
			log.debug("No stored session for " + sessionId);
			throw new SessionNotFoundException(sessionId);
		}
		return new SessionData(sessionId, stored.values, stored.lastUsed);
	}

	private void commit(final SessionData session) {
		log.debug("Persisting session: " + session);
		store.put(session.sessionId, new StoredSession(now(), ImmutableMap.copyOf(session.attrs)));
	}

	private void delete(final String sessionId) {
		if(store.remove(sessionId) != null) {
			log.debug("Invalidated session " + sessionId);
		}
	}

}

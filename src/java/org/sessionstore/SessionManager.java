package org.sessionstore;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.common.util.concurrent.Uninterruptibles;

import org.apache.log4j.Logger;

/**
 * Hands out {@link Session}s backed by a {@link Persister} and periodically removes expired sessions from it.
 * <p>
 * Only one request at a time may use a given session id: {@link #beginSession(SessionTransport)} blocks while
 * another request holds the same id, until that request commits or clears its session. Without this, two
 * concurrent requests of the same browser would both read the old values and the later commit would silently
 * discard the earlier one.
 *
 * @author sessionstore contributors
 */
public class SessionManager {

	private static final Logger log = Logger.getLogger(SessionManager.class);

	public static final Duration DEFAULT_GC_INTERVAL = Duration.ofHours(1);
	public static final Duration MINIMUM_GC_INTERVAL = Duration.ofMinutes(5);
	public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

	private final Persister persister;
	private final String cookieName;
	private final SessionLockTable locks = new SessionLockTable();

	private volatile boolean secure = false;
	private volatile Duration gcInterval;
	private volatile Duration shutdownTimeout = DEFAULT_SHUTDOWN_TIMEOUT;

	private final CountDownLatch stopSignal = new CountDownLatch(1);
	private final ListeningExecutorService gcExecutor;
	private final ListenableFuture<?> gcLoop;
	private final AtomicBoolean closed = new AtomicBoolean(false);

	/**
	 * Starts the session system. Expects a previously created persister and the name of the cookie to use.
	 *
	 * @param persister the persister, shut down together with this manager
	 * @param cookieName the cookie name
	 */
	public SessionManager(final Persister persister, final String cookieName) {
		this(persister, cookieName, DEFAULT_GC_INTERVAL);
	}

	@VisibleForTesting
	SessionManager(final Persister persister, final String cookieName, final Duration gcInterval) {
		Preconditions.checkNotNull(persister, "persister");
		Preconditions.checkArgument(!Strings.isNullOrEmpty(cookieName), "invalid cookie name");
		Preconditions.checkArgument(gcInterval != null && !gcInterval.isNegative() && !gcInterval.isZero(),
			"invalid gc interval: %s", gcInterval);
		this.persister = persister;
		this.cookieName = cookieName;
		this.gcInterval = gcInterval;

		gcExecutor = MoreExecutors.listeningDecorator(Executors.newSingleThreadExecutor(
			new ThreadFactoryBuilder().setNameFormat("session-gc-%d").setDaemon(true).build()
		));
		gcLoop = gcExecutor.submit(new Runnable() {
			public void run() {
				collectGarbage();
			}
		});
		log.info("Session manager started for cookie " + cookieName + " with " + persister.getClass().getSimpleName());
	}

	/**
	* Begins using a session, resuming the one named by the request's cookie if the persister still has it and
	* starting a new one otherwise. The cookie is (re)written either way. The returned session must be committed.
	*/
	public Session beginSession(final SessionTransport transport) {
		Preconditions.checkNotNull(transport, "transport");
		if(closed.get()) {
			throw new IllegalStateException("Session manager is shut down");
		}

		final String token = transport.readToken(cookieName);
		if(!Strings.isNullOrEmpty(token)) {
			final SessionLockTable.Lease lease = locks.acquire(token);
			try {
				final SessionData stored = persister.getSessionData(token);
				final Session session = new Session(this, transport, token, stored.attrs, lease);
				session.writeCookie();
				log.debug("Resumed session " + token);
				return session;
			} catch(SessionNotFoundException e) {
				log.debug("No stored session for " + token + ", starting a new one");
				lease.close();
			} catch(RuntimeException e) {
				lease.close();
				throw e;
			}
		}

		final Session session = new Session(this, transport, "", ImmutableMap.<String,String>of(), null);
		session.clear();
		return session;
	}

	/**
	* Sets the time between purges of expired sessions. The default is one hour. The new interval applies
	* from the next purge on.
	*
	* @throws IllegalArgumentException if the interval is shorter than five minutes
	*/
	public void setGcInterval(final Duration interval) {
		Preconditions.checkNotNull(interval, "interval");
		Preconditions.checkArgument(interval.compareTo(MINIMUM_GC_INTERVAL) >= 0,
			"gc interval too short: %s (minimum is %s)", interval, MINIMUM_GC_INTERVAL);
		this.gcInterval = interval;
	}

	public Duration getGcInterval() {
		return gcInterval;
	}

	/**
	* Whether session cookies are marked secure.
	*/
	public void setSecure(boolean secure) {
		this.secure = secure;
	}

	public boolean isSecure() {
		return secure;
	}

	public String getCookieName() {
		return cookieName;
	}

	@VisibleForTesting
	void setShutdownTimeout(final Duration shutdownTimeout) {
		this.shutdownTimeout = shutdownTimeout;
	}

	Persister getPersister() {
		return persister;
	}

	SessionLockTable getLocks() {
		return locks;
	}

	private void collectGarbage() {
		while(!Uninterruptibles.awaitUninterruptibly(stopSignal, gcInterval.toMillis(), TimeUnit.MILLISECONDS)) {
			try {
				persister.cleanUp();
			} catch(RuntimeException e) {
				log.error("Failed to clean up expired sessions, trying again in " + gcInterval, e);
			}
		}
		log.debug("Session garbage collector stopped");
	}

	/**
	* Stops the garbage collector and shuts the persister down. The persister is shut down even when the
	* garbage collector does not stop within the shutdown timeout (30 seconds).
	*
	* @throws GcShutdownTimeoutException if the garbage collector did not stop in time
	* @throws IllegalStateException if the manager was already shut down
	*/
	public void shutdown() {
		if(!closed.compareAndSet(false, true)) {
			throw new IllegalStateException("Session manager already shut down");
		}
		log.info("Shutting down session manager for cookie " + cookieName);

		stopSignal.countDown();
		boolean gcStopped = true;
		try {
			Uninterruptibles.getUninterruptibly(gcLoop, shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS);
		} catch(TimeoutException e) {
			gcStopped = false;
			Futures.addCallback(gcLoop, new FutureCallback<Object>() {
				public void onSuccess(Object result) {
					log.info("Session garbage collector stopped after the shutdown timeout");
				}

				public void onFailure(Throwable t) {
					log.error("Session garbage collector failed after the shutdown timeout", t);
				}
			}, MoreExecutors.directExecutor());
		} catch(ExecutionException e) {
			log.error("Session garbage collector failed", e.getCause());
		}
		gcExecutor.shutdown();

		persister.shutdown();

		if(!gcStopped) {
			throw new GcShutdownTimeoutException("gc failed to shut down within " + shutdownTimeout);
		}
	}

}

package org.sessionstore;

import java.time.Clock;
import java.time.Duration;

import com.google.common.base.Preconditions;

/**
 * Base for persisters that expire sessions a fixed time after their last use.
 */
public abstract class AbstractPersister implements Persister {

	/**
	* Shortest maximum age a persister accepts. Anything lower makes the garbage collector thrash.
	*/
	public static final Duration MINIMUM_MAX_AGE = Duration.ofMinutes(5);

	private final Duration maxAge;
	private final Clock clock;

	protected AbstractPersister(final Duration maxAge, final Clock clock) {
		checkMaxAge(maxAge);
		this.maxAge = maxAge;
		this.clock = Preconditions.checkNotNull(clock, "clock");
	}

	public static void checkMaxAge(Duration maxAge) {
		Preconditions.checkNotNull(maxAge, "maxAge");
		Preconditions.checkArgument(maxAge.compareTo(MINIMUM_MAX_AGE) >= 0,
			"maxAge duration too short: %s (minimum is %s)", maxAge, MINIMUM_MAX_AGE);
	}

	public Duration getMaxAge() {
		return maxAge;
	}

	protected long now() {
		return clock.millis();
	}

	/**
	* The oldest last-used time that is still alive right now.
	*/
	protected long expiryCutoff() {
		return now() - maxAge.toMillis();
	}

	/**
	* A session is expired once it is strictly older than the maximum age.
	*/
	protected boolean isExpired(long lastAccessedAt) {
		return lastAccessedAt < expiryCutoff();
	}

}

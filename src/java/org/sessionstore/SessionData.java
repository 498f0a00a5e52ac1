package org.sessionstore;

import java.util.Map;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;

/**
 * A deeply immutable holder for all the data that we need to pass to/from a persister.
 *
 * @author sessionstore contributors
 */
public class SessionData {

	public final String sessionId;
	public final Map<String,String> attrs;
	public final long lastAccessedAt;

	public SessionData(final String sessionId, final Map<String,String> attrs, final long lastAccessedAt) {
		this.sessionId = Strings.nullToEmpty(sessionId);
		if(attrs == null || attrs.isEmpty()) {
			this.attrs = ImmutableMap.of();
		} else {
			this.attrs = ImmutableMap.copyOf(attrs);
		}
		this.lastAccessedAt = lastAccessedAt;
	}

	public SessionData(final String sessionId, final Map<String,String> attrs) {
		this(sessionId, attrs, 0L);
	}

	/**
	* Whether this data belongs to a session that was never given an id.
	*/
	public boolean isUninitialized() {
		return sessionId.isEmpty();
	}

	public String toString() {
		return "SessionData[" + sessionId + "]";
	}

}

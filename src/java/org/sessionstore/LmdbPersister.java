package org.sessionstore;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.primitives.Longs;

import org.apache.log4j.Logger;

import org.lmdbjava.CursorIterable;
import org.lmdbjava.Dbi;
import org.lmdbjava.DbiFlags;
import org.lmdbjava.Env;
import org.lmdbjava.Txn;

/**
 * Persists sessions into an LMDB environment. Two named databases are used: {@value #LAST_USED_DB} maps a
 * session id to its last-used time (epoch millis, 8 bytes big-endian) and {@value #SESSIONS_DB} maps it to
 * its values as a JSON object. Both are written in the same transaction.
 * <p>
 * The environment must be opened by the caller with a byte array buffer proxy and room for at least two
 * named databases. It is closed by {@link #shutdown()}.
 */
public class LmdbPersister extends AbstractPersister {

	private static final Logger log = Logger.getLogger(LmdbPersister.class);

	public static final String LAST_USED_DB = "sessionsLastUsed";
	public static final String SESSIONS_DB = "sessions";

	private final Env<byte[]> env;
	private final Dbi<byte[]> lastUsed;
	private final Dbi<byte[]> sessions;

	public LmdbPersister(final Env<byte[]> env, final Duration maxAge) {
		this(env, maxAge, Clock.systemUTC());
	}

	public LmdbPersister(final Env<byte[]> env, final Duration maxAge, final Clock clock) {
		super(maxAge, clock);
		this.env = Preconditions.checkNotNull(env, "env");
		this.lastUsed = env.openDbi(LAST_USED_DB, DbiFlags.MDB_CREATE);
		this.sessions = env.openDbi(SESSIONS_DB, DbiFlags.MDB_CREATE);
	}

	private static byte[] key(String sessionId) {
		return sessionId.getBytes(StandardCharsets.UTF_8);
	}

	@Override
	public void persistSession(final SessionData session) {
		if(session == null || session.isUninitialized()) return;
		log.debug("Persisting session: " + session);

		final byte[] key = key(session.sessionId);
		final byte[] data = SessionValuesJson.write(session.sessionId, session.attrs).getBytes(StandardCharsets.UTF_8);
		try(Txn<byte[]> txn = env.txnWrite()) {
			lastUsed.put(txn, key, Longs.toByteArray(now()));
			sessions.put(txn, key, data);
			txn.commit();
		}
	}

	@Override
	public SessionData getSessionData(final String sessionId) {
		if(sessionId == null || sessionId.isEmpty()) {
			throw new SessionNotFoundException(sessionId);
		}
		final byte[] key = key(sessionId);
		final long stamp;
		final byte[] data;
		try(Txn<byte[]> txn = env.txnRead()) {
			final byte[] stampBytes = lastUsed.get(txn, key);
			if(stampBytes == null || stampBytes.length != Longs.BYTES) {
				throw new SessionNotFoundException(sessionId);
			}
			stamp = Longs.fromByteArray(stampBytes);
			data = sessions.get(txn, key);
		}
		if(data == null || isExpired(stamp)) {
			throw new SessionNotFoundException(sessionId);
		}

		final Map<String,String> values;
		try {
			values = SessionValuesJson.read(sessionId, new String(data, StandardCharsets.UTF_8));
		} catch(SessionStoreException e) {
			log.warn("Treating unreadable session " + sessionId + " as missing", e);
			throw new SessionNotFoundException(sessionId);
		}
		return new SessionData(sessionId, values, stamp);
	}

	@Override
	public void invalidate(final String sessionId) {
		if(sessionId == null || sessionId.isEmpty()) return;
		final byte[] key = key(sessionId);
		try(Txn<byte[]> txn = env.txnWrite()) {
			lastUsed.delete(txn, key);
			sessions.delete(txn, key);
			txn.commit();
		}
		log.debug("Invalidated session " + sessionId);
	}

	@Override
	public void cleanUp() {
		final List<byte[]> doomed = new ArrayList<byte[]>();
		try(Txn<byte[]> txn = env.txnWrite()) {
			try(CursorIterable<byte[]> records = lastUsed.iterate(txn)) {
				for(CursorIterable.KeyVal<byte[]> record : records) {
					try {
						if(isExpired(Longs.fromByteArray(record.val()))) {
							doomed.add(record.key());
						}
					} catch(RuntimeException e) {
						log.warn("Removing session " + new String(record.key(), StandardCharsets.UTF_8)
							+ " with an unreadable last-used time", e);
						doomed.add(record.key());
					}
				}
			}
			for(byte[] key : doomed) {
				lastUsed.delete(txn, key);
				sessions.delete(txn, key);
			}
			txn.commit();
		}
		log.debug("LMDB session cleanUp removed " + doomed.size() + " sessions");
	}

	@Override
	public void shutdown() {
		log.debug("Closing the LMDB session environment");
		env.close();
	}

}

package org.sessionstore;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;

import com.google.common.collect.ImmutableMap;

import org.junit.After;
import org.junit.Test;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;
import org.springframework.transaction.support.TransactionTemplate;

import static org.junit.Assert.*;

public class JdbcPersisterTest extends AbstractPersisterContract {

	private EmbeddedDatabase database;
	private JdbcTemplate jdbcTemplate;
	private TransactionTemplate transactionTemplate;

	@Override
	protected Persister createPersister(Duration maxAge, Clock clock) {
		if(database == null) {
			database = new EmbeddedDatabaseBuilder()
				.generateUniqueName(true)
				.setType(EmbeddedDatabaseType.H2)
				.build();
			jdbcTemplate = new JdbcTemplate(database);
			transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(database));
		}
		JdbcPersister jdbcPersister = new JdbcPersister(jdbcTemplate, transactionTemplate, "sessions", maxAge, clock);
		jdbcPersister.createTable();
		return jdbcPersister;
	}

	@After
	public void shutdownDatabase() {
		if(database != null) {
			database.shutdown();
		}
	}

	@Test
	public void storesValuesAsJson() {
		final String sid = SessionIds.newId();
		persister.persistSession(new SessionData(sid, ImmutableMap.of("color", "blue")));

		String data = jdbcTemplate.queryForObject("SELECT data FROM sessions WHERE sid = ?", String.class, sid);
		assertEquals("{\"color\":\"blue\"}", data);
	}

	@Test
	public void createTableIsRepeatable() {
		((JdbcPersister)persister).createTable();
		((JdbcPersister)persister).createTable();
		assertEquals(Integer.valueOf(0), jdbcTemplate.queryForObject("SELECT COUNT(*) FROM sessions", Integer.class));
	}

	@Test
	public void cleanUpDeletesRows() {
		persister.persistSession(new SessionData(SessionIds.newId(), ImmutableMap.of("k", "v")));
		persister.persistSession(new SessionData(SessionIds.newId(), ImmutableMap.of("k", "v")));
		clock.advance(MAX_AGE.plusMinutes(1));
		persister.cleanUp();

		assertEquals(Integer.valueOf(0), jdbcTemplate.queryForObject("SELECT COUNT(*) FROM sessions", Integer.class));
	}

	@Test
	public void insertRaceFallsBackToUpdate() {
		final String sid = SessionIds.newId();
		persister.persistSession(new SessionData(sid, ImmutableMap.of("color", "blue")));

		// Misses the existing row once, the way a concurrent insert would look
		JdbcPersister racing = new JdbcPersister(jdbcTemplate, transactionTemplate, "sessions", MAX_AGE, clock) {
			private boolean missed = false;

			@Override
			protected int updateSession(String sessionId, String json, Timestamp atime) {
				if(!missed) {
					missed = true;
					return 0;
				}
				return super.updateSession(sessionId, json, atime);
			}
		};
		racing.persistSession(new SessionData(sid, ImmutableMap.of("color", "red")));

		assertEquals(ImmutableMap.of("color", "red"), persister.getSessionData(sid).attrs);
		assertEquals(Integer.valueOf(1), jdbcTemplate.queryForObject("SELECT COUNT(*) FROM sessions", Integer.class));
	}

	@Test
	public void storedNullValueIsReportedAsAStoreFailure() {
		final String sid = SessionIds.newId();
		jdbcTemplate.update("INSERT INTO sessions (sid, atime, data) VALUES (?, ?, ?)",
			sid, new Timestamp(clock.millis()), "{\"k\":null}");
		try {
			persister.getSessionData(sid);
			fail("a null value must not reach the session data");
		} catch(SessionNotFoundException e) {
			fail("a corrupt row is a store failure, not a miss");
		} catch(SessionStoreException expected) {
		}
	}

	@Test(expected = IllegalArgumentException.class)
	public void rejectsEmptyTableName() {
		new JdbcPersister(jdbcTemplate, transactionTemplate, "", MAX_AGE);
	}

	@Test(expected = IllegalArgumentException.class)
	public void rejectsTableNameThatIsNotAnIdentifier() {
		new JdbcPersister(jdbcTemplate, transactionTemplate, "sessions; DROP TABLE users", MAX_AGE);
	}

	@Test
	public void textTypeFallsBackToDefault() {
		JdbcPersister jdbcPersister = (JdbcPersister)persister;
		jdbcPersister.setTextType("CLOB");
		assertEquals("CLOB", jdbcPersister.getTextType());
		jdbcPersister.setTextType(null);
		assertEquals("TEXT", jdbcPersister.getTextType());
	}

}

package org.sessionstore;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.regex.Pattern;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

import org.apache.log4j.Logger;

import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.TransactionCallbackWithoutResult;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Persists sessions using JDBC. This requires a table to be created: this can be done by calling
 * {@link #createTable()}, or by executing equivalent SQL yourself against the database. The table holds
 * one row per session: {@code sid} (primary key), {@code atime} (last use) and {@code data} (the values as
 * a JSON object).
 * <p>
 * The data source belongs to the caller and is left open by {@link #shutdown()}. Database failures surface
 * as Spring {@link org.springframework.dao.DataAccessException}s. The transaction manager must support
 * savepoints, as {@link org.springframework.jdbc.datasource.DataSourceTransactionManager} does.
 *
 * @author sessionstore contributors
 */
public class JdbcPersister extends AbstractPersister {

	private static final Logger log = Logger.getLogger(JdbcPersister.class);

	private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

	private final JdbcTemplate jdbcTemplate;
	private final TransactionTemplate transactionTemplate;
	private final String tableName;

	private volatile String textType = "TEXT";

	public JdbcPersister(final JdbcTemplate jdbcTemplate, final TransactionTemplate transactionTemplate,
			final String tableName, final Duration maxAge) {
		this(jdbcTemplate, transactionTemplate, tableName, maxAge, Clock.systemUTC());
	}

	public JdbcPersister(final JdbcTemplate jdbcTemplate, final TransactionTemplate transactionTemplate,
			final String tableName, final Duration maxAge, final Clock clock) {
		super(maxAge, clock);
		Preconditions.checkArgument(!Strings.isNullOrEmpty(tableName), "can not use empty table name");
		Preconditions.checkArgument(TABLE_NAME.matcher(tableName).matches(), "invalid table name: %s", tableName);
		this.jdbcTemplate = Preconditions.checkNotNull(jdbcTemplate, "jdbcTemplate");
		this.transactionTemplate = Preconditions.checkNotNull(transactionTemplate, "transactionTemplate");
		this.tableName = tableName;
	}

	public String getTableName() {
		return tableName;
	}

	/**
	* SQL type of the {@code data} column used by {@link #createTable()}.
	*/
	public String getTextType() {
		return textType;
	}

	public void setTextType(String textType) {
		if(textType == null) {
			this.textType = "TEXT";
		} else {
			this.textType = textType;
		}
	}

	public void createTable() {
		jdbcTemplate.execute(
			"CREATE TABLE IF NOT EXISTS " + tableName + " (\n" +
				"sid VARCHAR(64) NOT NULL PRIMARY KEY,\n" +
				"atime TIMESTAMP NOT NULL,\n" +
				"data " + textType + " NOT NULL\n" +
			")"
		);
		log.info("If not already present, created the table for sessions: " + tableName);
	}

	@Override
	public void persistSession(final SessionData session) {
		if(session == null || session.isUninitialized()) return;
		log.debug("Persisting session: " + session);

		final String json = SessionValuesJson.write(session.sessionId, session.attrs);
		final Timestamp atime = new Timestamp(now());

		transactionTemplate.execute(new TransactionCallbackWithoutResult() {
			@Override
			protected void doInTransactionWithoutResult(TransactionStatus status) {
				if(updateSession(session.sessionId, json, atime) > 0) {
					log.debug("Updated session: " + session.sessionId);
					return;
				}
				// Some databases abort the whole transaction on a constraint violation
				final Object savepoint = status.createSavepoint();
				try {
					jdbcTemplate.update(
						"INSERT INTO " + tableName + " (sid, atime, data) VALUES (?, ?, ?)",
						session.sessionId, atime, json
					);
					status.releaseSavepoint(savepoint);
					log.debug("Inserted session: " + session.sessionId);
				} catch(DuplicateKeyException dke) {
					// Someone else did an insert at the same time
					log.debug("Detected a duplicate key: " + session.sessionId + " (going to try for an update)");
					status.rollbackToSavepoint(savepoint);
					updateSession(session.sessionId, json, atime);
				}
			}
		});
	}

	protected int updateSession(final String sessionId, final String json, final Timestamp atime) {
		return jdbcTemplate.update(
			"UPDATE " + tableName + " SET atime = ?, data = ? WHERE sid = ?",
			atime, json, sessionId
		);
	}

	@Override
	public SessionData getSessionData(final String sessionId) {
		log.debug("Getting session data for " + sessionId);
		final List<SessionData> rows = jdbcTemplate.query(
			"SELECT sid, atime, data FROM " + tableName + " WHERE sid = ? AND atime >= ?",
			new RowMapper<SessionData>() {
				public SessionData mapRow(ResultSet rs, int rowNum) throws SQLException {
					return new SessionData(
						rs.getString(1),
						SessionValuesJson.read(sessionId, rs.getString(3)),
						rs.getTimestamp(2).getTime()
					);
				}
			},
			sessionId, new Timestamp(expiryCutoff())
		);
		if(rows.isEmpty()) {
			throw new SessionNotFoundException(sessionId);
		}
		return rows.get(0);
	}

	@Override
	public void invalidate(final String sessionId) {
		log.debug("Deleting the session " + sessionId);
		final int rows = jdbcTemplate.update("DELETE FROM " + tableName + " WHERE sid = ?", sessionId);
		if(rows == 0) {
			log.debug("No session with id " + sessionId + " found in the database to invalidate");
		}
	}

	@Override
	public void cleanUp() {
		log.debug("Executing database session cleanUp");
		final int rows = jdbcTemplate.update(
			"DELETE FROM " + tableName + " WHERE atime < ?", new Timestamp(expiryCutoff())
		);
		log.info("Database session cleanUp removed " + rows + " expired sessions");
	}

	@Override
	public void shutdown() {
		log.debug("Shutting down the database session persister for table " + tableName);
	}

}

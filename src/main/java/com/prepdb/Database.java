/*
 * Copyright 2015-2022 Transmogrify LLC, 2022-2026 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.prepdb;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLSyntaxErrorException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.lang.System.nanoTime;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.FINE;
import static java.util.logging.Level.WARNING;

/**
 * Main class for running SQL against a single database connection.
 * <p>
 * The connection is opened and the target database selected when the {@code Database} is built; failures there are
 * thrown as {@link ConnectionException} or {@link DatabaseSelectionException}. Failures of individual queries are
 * never thrown: {@link #runQuery(QueryRequest)} records them in the returned {@link QueryOutcome}, which is also
 * mirrored by {@link #getError()}, {@link #getAffectedRows()} and {@link #getResult()} until the next call.
 * <pre>{@code Database database = Database.connect("localhost", "app", "secret", "shop");
 *
 * database.runQuery("INSERT INTO logs (msg, level) VALUES", List.of("hello", 3), "insert failed: ", true, false, true);
 *
 * if (database.hasError())
 *   System.err.println(database.getError());}</pre>
 * A {@code Database} wraps one connection with no locking; callers on several threads must serialize access or use one
 * instance each.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public final class Database implements AutoCloseable {
	/**
	 * Prefix recorded on failure when the caller supplied no error message and asked for driver error text.
	 */
	@NonNull
	public static final String DEFAULT_ERROR_MESSAGE = "Error running query: ";
	/**
	 * Recorded on failure when the caller supplied no error message and suppressed driver error text.
	 */
	@NonNull
	public static final String FALLBACK_ERROR_MESSAGE = "Error running query";

	@NonNull
	private final Connection connection;
	@NonNull
	private final String databaseName;
	@NonNull
	private final DatabaseType databaseType;
	@NonNull
	private final ParameterBinder parameterBinder;
	@NonNull
	private final ResultSetMapper resultSetMapper;
	@NonNull
	private final StatementLogger statementLogger;
	@NonNull
	private final Logger logger;

	@NonNull
	private QueryOutcome lastOutcome;
	private boolean closed;

	protected Database(@NonNull Builder builder) {
		requireNonNull(builder);

		String host = requireNonNull(builder.host);
		String databaseName = requireNonNull(builder.databaseName, "A database name is required");
		DatabaseDriver databaseDriver = builder.databaseDriver == null
				? new JdbcDatabaseDriver(builder.urlTemplate == null ? JdbcDatabaseDriver.DEFAULT_URL_TEMPLATE : builder.urlTemplate, builder.connectionProperties)
				: builder.databaseDriver;

		this.logger = Logger.getLogger(getClass().getName());
		this.databaseName = databaseName;
		this.parameterBinder = builder.parameterBinder == null ? ParameterBinder.withDefaultConfiguration() : builder.parameterBinder;
		this.resultSetMapper = builder.resultSetMapper == null ? ResultSetMapper.withDefaultConfiguration() : builder.resultSetMapper;
		this.statementLogger = builder.statementLogger == null ? (statementLog) -> {} : builder.statementLogger;
		this.lastOutcome = QueryOutcome.empty();

		Connection connection;

		try {
			connection = databaseDriver.connect(host, builder.username, builder.password);
		} catch (SQLException e) {
			throw new ConnectionException(format("%d: %s", e.getErrorCode(), e.getMessage()), e);
		}

		DatabaseType databaseType;

		try {
			databaseType = builder.databaseType == null ? DatabaseType.fromConnection(connection) : builder.databaseType;
			databaseDriver.selectDatabase(connection, databaseType, databaseName);
		} catch (SQLException | DatabaseException e) {
			DatabaseSelectionException databaseSelectionException =
					new DatabaseSelectionException(format("Could not select the database %s", databaseName), e);

			try {
				connection.close();
			} catch (SQLException closeException) {
				databaseSelectionException.addSuppressed(closeException);
			}

			throw databaseSelectionException;
		}

		this.connection = connection;
		this.databaseType = databaseType;

		if (logger.isLoggable(FINE))
			logger.log(FINE, format("Connected to %s database '%s'", databaseType.name(), databaseName));
	}

	/**
	 * Provides a {@link Database} builder for the given host.
	 *
	 * @param host a host to substitute into the JDBC URL template, or a complete JDBC URL
	 * @return a {@link Database} builder
	 */
	@NonNull
	public static Builder withHost(@NonNull String host) {
		requireNonNull(host);
		return new Builder(host);
	}

	/**
	 * Connects with default configuration and selects {@code databaseName}.
	 *
	 * @param host         a host to substitute into the JDBC URL template, or a complete JDBC URL
	 * @param username     the user to authenticate as
	 * @param password     the user's password
	 * @param databaseName the database to select
	 * @return a connected {@code Database}
	 * @throws ConnectionException         if the connection cannot be established
	 * @throws DatabaseSelectionException if {@code databaseName} cannot be selected
	 */
	@NonNull
	public static Database connect(@NonNull String host,
																 @Nullable String username,
																 @Nullable String password,
																 @NonNull String databaseName) {
		requireNonNull(host);
		requireNonNull(databaseName);

		return withHost(host)
				.username(username)
				.password(password)
				.databaseName(databaseName)
				.build();
	}

	/**
	 * Runs {@code sql} without bind variables, fetching any returned rows.
	 *
	 * @param sql the SQL to run
	 * @return the outcome of the call
	 */
	@NonNull
	public QueryOutcome runQuery(@NonNull String sql) {
		requireNonNull(sql);
		return runQuery(QueryRequest.withSql(sql).build());
	}

	/**
	 * Runs {@code sql} with the given values bound to its placeholders, fetching any returned rows.
	 *
	 * @param sql       the SQL template
	 * @param variables values for the placeholders, in order
	 * @return the outcome of the call
	 * @throws BindTypeException if a value is {@code null} or of an unsupported type
	 */
	@NonNull
	public QueryOutcome runQuery(@NonNull String sql,
															 @NonNull List<?> variables) {
		requireNonNull(sql);
		requireNonNull(variables);

		// Values are checked before the request exists, so discard the previous outcome up front
		this.lastOutcome = QueryOutcome.empty();

		return runQuery(QueryRequest.withSql(sql).values(variables).build());
	}

	/**
	 * Runs {@code sql} with every option spelled out.
	 *
	 * @param sql          the SQL template
	 * @param variables    values for the placeholders, in order
	 * @param errorMessage recorded as the error if the call fails
	 * @param withSqlError whether the driver's error text is appended to {@code errorMessage}
	 * @param withResult   whether returned rows are fetched
	 * @param autoBrackets whether {@code (?,...,?)} sized to {@code variables} is appended to {@code sql}
	 * @return the outcome of the call
	 * @throws BindTypeException if a value is {@code null} or of an unsupported type
	 */
	@NonNull
	public QueryOutcome runQuery(@NonNull String sql,
															 @NonNull List<?> variables,
															 @Nullable String errorMessage,
															 @NonNull Boolean withSqlError,
															 @NonNull Boolean withResult,
															 @NonNull Boolean autoBrackets) {
		requireNonNull(sql);
		requireNonNull(variables);
		requireNonNull(withSqlError);
		requireNonNull(withResult);
		requireNonNull(autoBrackets);

		this.lastOutcome = QueryOutcome.empty();

		return runQuery(QueryRequest.withSql(sql)
				.values(variables)
				.errorMessage(errorMessage)
				.withSqlError(withSqlError)
				.withResult(withResult)
				.autoBrackets(autoBrackets)
				.build());
	}

	/**
	 * Prepares, binds and executes the request, fetching rows if asked to.
	 * <p>
	 * The previous outcome is discarded before anything else happens. Query failures are returned, not thrown.
	 *
	 * @param queryRequest the query to run
	 * @return the outcome of the call
	 * @throws IllegalStateException if this {@code Database} has been closed
	 */
	@NonNull
	public QueryOutcome runQuery(@NonNull QueryRequest queryRequest) {
		requireNonNull(queryRequest);

		this.lastOutcome = QueryOutcome.empty();

		if (this.closed)
			throw new IllegalStateException(format("Database '%s' has been closed", getDatabaseName()));

		String errorMessage = determineErrorMessage(queryRequest);
		List<BindVariable> variables = queryRequest.getVariables();
		String sql = queryRequest.getAutoBrackets()
				? StatementBuilder.appendPlaceholders(queryRequest.getSql(), variables.size())
				: queryRequest.getSql();

		StatementContext statementContext = StatementContext.with(sql, getDatabaseType())
				.boundParameters(BoundParameters.fromVariables(variables))
				.build();

		StatementLog.Builder statementLogBuilder = StatementLog.withStatementContext(statementContext);

		QueryOutcome queryOutcome = statementContext.getBoundParameters().isEmpty()
				? performRawQuery(statementContext, queryRequest, errorMessage, statementLogBuilder)
				: performPreparedQuery(statementContext, queryRequest, errorMessage, statementLogBuilder);

		this.lastOutcome = queryOutcome;

		logStatement(statementLogBuilder.build(), queryOutcome);

		return queryOutcome;
	}

	@NonNull
	protected QueryOutcome performPreparedQuery(@NonNull StatementContext statementContext,
																							@NonNull QueryRequest queryRequest,
																							@NonNull String errorMessage,
																							StatementLog.@NonNull Builder statementLogBuilder) {
		requireNonNull(statementContext);
		requireNonNull(queryRequest);
		requireNonNull(errorMessage);
		requireNonNull(statementLogBuilder);

		ExecutionPhase executionPhase = ExecutionPhase.PREPARING;
		long affectedRows = 0;
		long startTime = nanoTime();
		PreparedStatement preparedStatement = null;

		try {
			preparedStatement = getConnection().prepareStatement(statementContext.getSql());

			executionPhase = ExecutionPhase.BINDING;
			getParameterBinder().bind(statementContext, preparedStatement, statementContext.getBoundParameters());
			statementLogBuilder.preparationDuration(Duration.ofNanos(nanoTime() - startTime));

			executionPhase = ExecutionPhase.EXECUTING;
			startTime = nanoTime();
			boolean hasResultSet = preparedStatement.execute();
			affectedRows = preparedStatement.getUpdateCount();
			statementLogBuilder.executionDuration(Duration.ofNanos(nanoTime() - startTime)).affectedRows(affectedRows);

			List<Map<String, Object>> rows = List.of();

			if (queryRequest.getWithResult() && hasResultSet) {
				executionPhase = ExecutionPhase.FETCHING;
				rows = fetchRows(statementContext, preparedStatement, statementLogBuilder);
			}

			return QueryOutcome.success(affectedRows, rows);
		} catch (SQLException e) {
			// Drivers that prepare on the client only see the statement text at execution time
			if (executionPhase == ExecutionPhase.EXECUTING && isSyntaxError(e))
				executionPhase = ExecutionPhase.PREPARING;

			return failure(queryRequest, errorMessage, executionPhase, affectedRows, e, statementLogBuilder);
		} finally {
			closeStatement(preparedStatement);
		}
	}

	@NonNull
	protected QueryOutcome performRawQuery(@NonNull StatementContext statementContext,
																				 @NonNull QueryRequest queryRequest,
																				 @NonNull String errorMessage,
																				 StatementLog.@NonNull Builder statementLogBuilder) {
		requireNonNull(statementContext);
		requireNonNull(queryRequest);
		requireNonNull(errorMessage);
		requireNonNull(statementLogBuilder);

		ExecutionPhase executionPhase = ExecutionPhase.EXECUTING;
		long affectedRows = 0;
		long startTime = nanoTime();
		Statement statement = null;

		try {
			statement = getConnection().createStatement();
			boolean hasResultSet = statement.execute(statementContext.getSql());
			affectedRows = statement.getUpdateCount();
			statementLogBuilder.executionDuration(Duration.ofNanos(nanoTime() - startTime)).affectedRows(affectedRows);

			List<Map<String, Object>> rows = List.of();

			if (queryRequest.getWithResult() && hasResultSet) {
				executionPhase = ExecutionPhase.FETCHING;
				rows = fetchRows(statementContext, statement, statementLogBuilder);
			}

			return QueryOutcome.success(affectedRows, rows);
		} catch (SQLException e) {
			return failure(queryRequest, errorMessage, executionPhase, affectedRows, e, statementLogBuilder);
		} finally {
			closeStatement(statement);
		}
	}

	@NonNull
	protected List<Map<String, Object>> fetchRows(@NonNull StatementContext statementContext,
																								@NonNull Statement statement,
																								StatementLog.@NonNull Builder statementLogBuilder) throws SQLException {
		requireNonNull(statementContext);
		requireNonNull(statement);
		requireNonNull(statementLogBuilder);

		long startTime = nanoTime();
		List<Map<String, Object>> rows;

		try (ResultSet resultSet = statement.getResultSet()) {
			rows = resultSet == null ? new ArrayList<>() : getResultSetMapper().map(statementContext, resultSet);
		}

		statementLogBuilder.resultSetMappingDuration(Duration.ofNanos(nanoTime() - startTime)).rowCount(rows.size());

		return rows;
	}

	@NonNull
	protected QueryOutcome failure(@NonNull QueryRequest queryRequest,
																 @NonNull String errorMessage,
																 @NonNull ExecutionPhase executionPhase,
																 long affectedRows,
																 @NonNull SQLException sqlException,
																 StatementLog.@NonNull Builder statementLogBuilder) {
		requireNonNull(queryRequest);
		requireNonNull(errorMessage);
		requireNonNull(executionPhase);
		requireNonNull(sqlException);
		requireNonNull(statementLogBuilder);

		String dbmsMessage = sqlException.getMessage() == null ? sqlException.getClass().getSimpleName() : sqlException.getMessage();
		DatabaseException exception;
		String error;

		if (executionPhase == ExecutionPhase.PREPARING) {
			exception = new InvalidSyntaxException(format("Invalid SQL syntax: %s", dbmsMessage), sqlException);
			error = queryRequest.getWithSqlError() ? errorMessage + "Invalid SQL syntax: " + dbmsMessage : errorMessage;
		} else {
			exception = new StatementExecutionException(dbmsMessage, sqlException);
			error = queryRequest.getWithSqlError() ? errorMessage + dbmsMessage : errorMessage;
		}

		statementLogBuilder.failure(executionPhase, exception);

		return QueryOutcome.failure(error, affectedRows, exception, executionPhase);
	}

	/**
	 * Whether {@code sqlException} reports SQL the database could not compile, i.e. a
	 * {@link SQLSyntaxErrorException} or any SQLState of class {@code 42}.
	 *
	 * @param sqlException the failure to inspect
	 * @return {@code true} if the statement text was rejected
	 */
	protected boolean isSyntaxError(@NonNull SQLException sqlException) {
		requireNonNull(sqlException);

		if (sqlException instanceof SQLSyntaxErrorException)
			return true;

		String sqlState = sqlException.getSQLState();
		return sqlState != null && sqlState.startsWith("42");
	}

	@NonNull
	protected String determineErrorMessage(@NonNull QueryRequest queryRequest) {
		requireNonNull(queryRequest);

		if (queryRequest.getErrorMessage().length() > 0)
			return queryRequest.getErrorMessage();

		return queryRequest.getWithSqlError() ? DEFAULT_ERROR_MESSAGE : FALLBACK_ERROR_MESSAGE;
	}

	protected void logStatement(@NonNull StatementLog statementLog,
															@NonNull QueryOutcome queryOutcome) {
		requireNonNull(statementLog);
		requireNonNull(queryOutcome);

		try {
			getStatementLogger().log(statementLog);
		} catch (RuntimeException e) {
			DatabaseException exception = queryOutcome.getException().orElse(null);

			if (exception == null)
				throw e;

			exception.addSuppressed(e);
		}
	}

	protected void closeStatement(@Nullable Statement statement) {
		if (statement == null)
			return;

		try {
			statement.close();
		} catch (SQLException e) {
			logger.log(WARNING, "Unable to close statement", e);
		}
	}

	/**
	 * Closes the underlying connection. Calling this more than once has no effect.
	 *
	 * @throws DatabaseException if the driver fails to close the connection
	 */
	@Override
	public void close() {
		if (this.closed)
			return;

		this.closed = true;
		this.lastOutcome = QueryOutcome.empty();

		try {
			getConnection().close();
		} catch (SQLException e) {
			throw new DatabaseException("Unable to close database connection", e);
		}
	}

	/**
	 * @return {@code true} if the most recent call recorded an error
	 */
	public boolean hasError() {
		return getLastOutcome().hasError();
	}

	/**
	 * The error recorded by the most recent call.
	 *
	 * @return the error, or an empty string if the call succeeded or no call has been made
	 */
	@NonNull
	public String getError() {
		return getLastOutcome().getError();
	}

	/**
	 * The affected-row count reported by the driver for the most recent call.
	 * <p>
	 * {@code 0} and {@code -1} both mean that no rows were affected or that the count does not apply; which one a
	 * driver reports depends on the driver and statement.
	 *
	 * @return the affected-row count of the most recent call
	 */
	public long getAffectedRows() {
		return getLastOutcome().getAffectedRows();
	}

	/**
	 * The rows fetched by the most recent call.
	 *
	 * @return rows keyed by column label, empty if none were fetched
	 */
	@NonNull
	public List<Map<String, Object>> getResult() {
		return getLastOutcome().getRows();
	}

	@NonNull
	public QueryOutcome getLastOutcome() {
		return this.lastOutcome;
	}

	@NonNull
	public String getDatabaseName() {
		return this.databaseName;
	}

	@NonNull
	public DatabaseType getDatabaseType() {
		return this.databaseType;
	}

	public boolean isClosed() {
		return this.closed;
	}

	@NonNull
	protected Connection getConnection() {
		return this.connection;
	}

	@NonNull
	protected ParameterBinder getParameterBinder() {
		return this.parameterBinder;
	}

	@NonNull
	protected ResultSetMapper getResultSetMapper() {
		return this.resultSetMapper;
	}

	@NonNull
	protected StatementLogger getStatementLogger() {
		return this.statementLogger;
	}

	/**
	 * Builder used to construct instances of {@link Database}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final String host;
		@Nullable
		private String username;
		@Nullable
		private String password;
		@Nullable
		private String databaseName;
		@Nullable
		private DatabaseType databaseType;
		@Nullable
		private DatabaseDriver databaseDriver;
		@Nullable
		private String urlTemplate;
		@Nullable
		private Properties connectionProperties;
		@Nullable
		private ParameterBinder parameterBinder;
		@Nullable
		private ResultSetMapper resultSetMapper;
		@Nullable
		private StatementLogger statementLogger;

		private Builder(@NonNull String host) {
			this.host = requireNonNull(host);
		}

		@NonNull
		public Builder username(@Nullable String username) {
			this.username = username;
			return this;
		}

		@NonNull
		public Builder password(@Nullable String password) {
			this.password = password;
			return this;
		}

		@NonNull
		public Builder databaseName(@Nullable String databaseName) {
			this.databaseName = databaseName;
			return this;
		}

		/**
		 * Overrides automatic database type detection.
		 *
		 * @param databaseType the database type to use (null to enable auto-detection)
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder databaseType(@Nullable DatabaseType databaseType) {
			this.databaseType = databaseType;
			return this;
		}

		/**
		 * Replaces the {@link JdbcDatabaseDriver} used to connect and select the database.
		 * <p>
		 * When set, {@link #urlTemplate(String)} and {@link #connectionProperties(Properties)} are ignored.
		 *
		 * @param databaseDriver the driver to use (null for the JDBC default)
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder databaseDriver(@Nullable DatabaseDriver databaseDriver) {
			this.databaseDriver = databaseDriver;
			return this;
		}

		@NonNull
		public Builder urlTemplate(@Nullable String urlTemplate) {
			this.urlTemplate = urlTemplate;
			return this;
		}

		@NonNull
		public Builder connectionProperties(@Nullable Properties connectionProperties) {
			this.connectionProperties = connectionProperties;
			return this;
		}

		@NonNull
		public Builder parameterBinder(@Nullable ParameterBinder parameterBinder) {
			this.parameterBinder = parameterBinder;
			return this;
		}

		@NonNull
		public Builder resultSetMapper(@Nullable ResultSetMapper resultSetMapper) {
			this.resultSetMapper = resultSetMapper;
			return this;
		}

		@NonNull
		public Builder statementLogger(@Nullable StatementLogger statementLogger) {
			this.statementLogger = statementLogger;
			return this;
		}

		/**
		 * Connects and selects the database.
		 *
		 * @return a connected {@code Database}
		 * @throws ConnectionException         if the connection cannot be established
		 * @throws DatabaseSelectionException if the database cannot be selected
		 */
		@NonNull
		public Database build() {
			return new Database(this);
		}
	}
}

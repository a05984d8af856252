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

import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.lang.String.format;

/**
 * Thrown when an error occurs when interacting with a {@link Database}.
 * <p>
 * If the {@code cause} of this exception is a {@link SQLException}, the {@link #getErrorCode()} and {@link #getSqlState()}
 * accessors are shorthand for retrieving the corresponding {@link SQLException} values.
 * <p>
 * Subclasses identify where in the connection or query pipeline the failure happened.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class DatabaseException extends RuntimeException {
	@Nullable
	private final Integer errorCode;
	@Nullable
	private final String sqlState;
	@Nullable
	private final String dbmsMessage;
	@Nullable
	private final String detail;
	@Nullable
	private final String hint;
	@Nullable
	private final Integer position;
	@Nullable
	private final String table;

	/**
	 * Creates a {@code DatabaseException} with the given {@code message}.
	 *
	 * @param message a message describing this exception
	 */
	public DatabaseException(@Nullable String message) {
		this(message, null);
	}

	/**
	 * Creates a {@code DatabaseException} which wraps the given {@code cause}.
	 *
	 * @param cause the cause of this exception
	 */
	public DatabaseException(@Nullable Throwable cause) {
		this(cause == null ? null : cause.getMessage(), cause);
	}

	/**
	 * Creates a {@code DatabaseException} which wraps the given {@code cause}.
	 *
	 * @param message a message describing this exception
	 * @param cause   the cause of this exception
	 */
	public DatabaseException(@Nullable String message,
													 @Nullable Throwable cause) {
		super(message, cause);

		Integer errorCode = null;
		String sqlState = null;
		String dbmsMessage = null;
		String detail = null;
		String hint = null;
		Integer position = null;
		String table = null;

		if (cause != null) {
			// Special handling for Postgres
			if ("org.postgresql.util.PSQLException".equals(cause.getClass().getName())) {
				org.postgresql.util.PSQLException psqlException = (org.postgresql.util.PSQLException) cause;
				org.postgresql.util.ServerErrorMessage serverErrorMessage = psqlException.getServerErrorMessage();

				errorCode = psqlException.getErrorCode();
				sqlState = psqlException.getSQLState();

				if (serverErrorMessage != null) {
					dbmsMessage = serverErrorMessage.getMessage();
					detail = serverErrorMessage.getDetail();
					hint = serverErrorMessage.getHint();
					position = serverErrorMessage.getPosition();
					table = serverErrorMessage.getTable();
				}
			} else if (cause instanceof SQLException) {
				SQLException sqlException = (SQLException) cause;
				errorCode = sqlException.getErrorCode();
				sqlState = sqlException.getSQLState();
				dbmsMessage = sqlException.getMessage();
			}
		}

		this.errorCode = errorCode;
		this.sqlState = sqlState;
		this.dbmsMessage = dbmsMessage;
		this.detail = detail;
		this.hint = hint;
		this.position = position;
		this.table = table;
	}

	@Override
	public String toString() {
		List<String> components = new ArrayList<>(8);

		if (getMessage() != null && getMessage().trim().length() > 0)
			components.add(format("message=%s", getMessage()));

		if (getErrorCode().isPresent())
			components.add(format("errorCode=%s", getErrorCode().get()));
		if (getSqlState().isPresent())
			components.add(format("sqlState=%s", getSqlState().get()));
		if (getDetail().isPresent())
			components.add(format("detail=%s", getDetail().get()));
		if (getHint().isPresent())
			components.add(format("hint=%s", getHint().get()));
		if (getPosition().isPresent())
			components.add(format("position=%s", getPosition().get()));
		if (getTable().isPresent())
			components.add(format("table=%s", getTable().get()));

		return format("%s: %s", getClass().getName(), components.stream().collect(Collectors.joining(", ")));
	}

	/**
	 * Shorthand for {@link SQLException#getErrorCode()} if this exception was caused by a {@link SQLException}.
	 *
	 * @return the value of {@link SQLException#getErrorCode()}, or empty if not available
	 */
	public Optional<Integer> getErrorCode() {
		return Optional.ofNullable(this.errorCode);
	}

	/**
	 * Shorthand for {@link SQLException#getSQLState()} if this exception was caused by a {@link SQLException}.
	 *
	 * @return the value of {@link SQLException#getSQLState()}, or empty if not available
	 */
	public Optional<String> getSqlState() {
		return Optional.ofNullable(this.sqlState);
	}

	/**
	 * The error text reported by the driver, without any caller-supplied prefix.
	 *
	 * @return the driver's native error text, or empty if not available
	 */
	public Optional<String> getDbmsMessage() {
		return Optional.ofNullable(this.dbmsMessage);
	}

	/**
	 * @return the value of the offending {@code detail}, or empty if not available
	 */
	public Optional<String> getDetail() {
		return Optional.ofNullable(this.detail);
	}

	/**
	 * @return the value of the offending {@code hint}, or empty if not available
	 */
	public Optional<String> getHint() {
		return Optional.ofNullable(this.hint);
	}

	/**
	 * @return the value of the offending {@code position}, or empty if not available
	 */
	public Optional<Integer> getPosition() {
		return Optional.ofNullable(this.position);
	}

	/**
	 * @return the value of the offending {@code table}, or empty if not available
	 */
	public Optional<String> getTable() {
		return Optional.ofNullable(this.table);
	}
}

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

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The result of one {@link Database#runQuery(QueryRequest)} call: either a success carrying the affected-row count and
 * fetched rows, or a failure carrying the error text and the exception that caused it.
 * <p>
 * A failed outcome never has rows. A successful outcome always has an empty error string.
 * <p>
 * The affected-row count is whatever the driver reports. {@code 0} and {@code -1} both mean no rows were affected or
 * that the count does not apply; JDBC drivers report {@code -1} for statements that produced a result set.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class QueryOutcome {
	@NonNull
	private static final QueryOutcome EMPTY = new QueryOutcome("", 0L, List.of(), null, null);

	@NonNull
	private final String error;
	private final long affectedRows;
	@NonNull
	private final List<Map<String, Object>> rows;
	@Nullable
	private final DatabaseException exception;
	@Nullable
	private final ExecutionPhase failedPhase;

	private QueryOutcome(@NonNull String error,
											 long affectedRows,
											 @NonNull List<Map<String, Object>> rows,
											 @Nullable DatabaseException exception,
											 @Nullable ExecutionPhase failedPhase) {
		this.error = error;
		this.affectedRows = affectedRows;
		this.rows = rows;
		this.exception = exception;
		this.failedPhase = failedPhase;
	}

	/**
	 * The outcome every call starts from: no error, no affected rows, no result rows.
	 *
	 * @return the empty outcome
	 */
	@NonNull
	public static QueryOutcome empty() {
		return EMPTY;
	}

	@NonNull
	public static QueryOutcome success(long affectedRows,
																		 @NonNull List<Map<String, Object>> rows) {
		requireNonNull(rows);

		List<Map<String, Object>> copy = new ArrayList<>(rows.size());

		for (Map<String, Object> row : rows)
			copy.add(Collections.unmodifiableMap(requireNonNull(row)));

		return new QueryOutcome("", affectedRows, Collections.unmodifiableList(copy), null, null);
	}

	@NonNull
	public static QueryOutcome failure(@NonNull String error,
																		 long affectedRows,
																		 @NonNull DatabaseException exception,
																		 @NonNull ExecutionPhase failedPhase) {
		requireNonNull(error);
		requireNonNull(exception);
		requireNonNull(failedPhase);

		if (error.length() == 0)
			throw new IllegalArgumentException("A failed outcome requires a non-empty error");

		return new QueryOutcome(error, affectedRows, List.of(), exception, failedPhase);
	}

	public boolean isSuccessful() {
		return this.exception == null;
	}

	/**
	 * @return {@code true} if and only if {@link #getError()} is non-empty
	 */
	public boolean hasError() {
		return getError().length() > 0;
	}

	/**
	 * The error recorded for this call: the caller's message, optionally followed by the driver's error text.
	 *
	 * @return the error, or an empty string on success
	 */
	@NonNull
	public String getError() {
		return this.error;
	}

	public long getAffectedRows() {
		return this.affectedRows;
	}

	/**
	 * Rows returned by the statement, in the order the database produced them, each keyed by column label.
	 *
	 * @return the fetched rows, empty if none were fetched or the call failed
	 */
	@NonNull
	public List<Map<String, Object>> getRows() {
		return this.rows;
	}

	@NonNull
	public Optional<DatabaseException> getException() {
		return Optional.ofNullable(this.exception);
	}

	@NonNull
	public Optional<ExecutionPhase> getFailedPhase() {
		return Optional.ofNullable(this.failedPhase);
	}

	@Override
	public String toString() {
		List<String> components = new ArrayList<>(5);

		if (hasError())
			components.add(format("error=%s", getError()));

		components.add(format("affectedRows=%d", getAffectedRows()));
		components.add(format("rows=%d", getRows().size()));

		getFailedPhase().ifPresent(failedPhase -> components.add(format("failedPhase=%s", failedPhase.name())));

		return format("%s{%s}", getClass().getSimpleName(), components.stream().collect(Collectors.joining(", ")));
	}
}

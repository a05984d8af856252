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
import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Diagnostics for one statement run through a {@link Database}.
 * <p>
 * Durations are only present for the phases the statement actually reached.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class StatementLog {
	@NonNull
	private final StatementContext statementContext;
	@NonNull
	private final Duration totalDuration;
	@Nullable
	private final Duration preparationDuration;
	@Nullable
	private final Duration executionDuration;
	@Nullable
	private final Duration resultSetMappingDuration;
	@Nullable
	private final Long affectedRows;
	@Nullable
	private final Integer rowCount;
	@Nullable
	private final ExecutionPhase failedPhase;
	@Nullable
	private final DatabaseException exception;

	private StatementLog(@NonNull Builder builder) {
		requireNonNull(builder);

		this.statementContext = requireNonNull(builder.statementContext);
		this.preparationDuration = builder.preparationDuration;
		this.executionDuration = builder.executionDuration;
		this.resultSetMappingDuration = builder.resultSetMappingDuration;
		this.affectedRows = builder.affectedRows;
		this.rowCount = builder.rowCount;
		this.failedPhase = builder.failedPhase;
		this.exception = builder.exception;

		Duration totalDuration = Duration.ZERO;

		if (this.preparationDuration != null)
			totalDuration = totalDuration.plus(this.preparationDuration);

		if (this.executionDuration != null)
			totalDuration = totalDuration.plus(this.executionDuration);

		if (this.resultSetMappingDuration != null)
			totalDuration = totalDuration.plus(this.resultSetMappingDuration);

		this.totalDuration = totalDuration;
	}

	/**
	 * Creates a {@link StatementLog} builder for the given {@code statementContext}.
	 *
	 * @param statementContext current SQL context
	 * @return a {@link StatementLog} builder
	 */
	@NonNull
	public static Builder withStatementContext(@NonNull StatementContext statementContext) {
		requireNonNull(statementContext);
		return new Builder(statementContext);
	}

	@Override
	public String toString() {
		List<String> components = new ArrayList<>(9);

		components.add(format("statementContext=%s", getStatementContext()));
		components.add(format("totalDuration=%s", getTotalDuration()));

		getPreparationDuration().ifPresent(duration -> components.add(format("preparationDuration=%s", duration)));
		getExecutionDuration().ifPresent(duration -> components.add(format("executionDuration=%s", duration)));
		getResultSetMappingDuration().ifPresent(duration -> components.add(format("resultSetMappingDuration=%s", duration)));
		getAffectedRows().ifPresent(affectedRows -> components.add(format("affectedRows=%d", affectedRows)));
		getRowCount().ifPresent(rowCount -> components.add(format("rowCount=%d", rowCount)));
		getFailedPhase().ifPresent(failedPhase -> components.add(format("failedPhase=%s", failedPhase.name())));
		getException().ifPresent(exception -> components.add(format("exception=%s", exception)));

		return format("%s{%s}", getClass().getSimpleName(), components.stream().collect(Collectors.joining(", ")));
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof StatementLog))
			return false;

		StatementLog statementLog = (StatementLog) object;

		return Objects.equals(getStatementContext(), statementLog.getStatementContext())
				&& Objects.equals(getPreparationDuration(), statementLog.getPreparationDuration())
				&& Objects.equals(getExecutionDuration(), statementLog.getExecutionDuration())
				&& Objects.equals(getResultSetMappingDuration(), statementLog.getResultSetMappingDuration())
				&& Objects.equals(getAffectedRows(), statementLog.getAffectedRows())
				&& Objects.equals(getRowCount(), statementLog.getRowCount())
				&& Objects.equals(getFailedPhase(), statementLog.getFailedPhase())
				&& Objects.equals(getException(), statementLog.getException());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getStatementContext(), getPreparationDuration(), getExecutionDuration(),
				getResultSetMappingDuration(), getAffectedRows(), getRowCount(), getFailedPhase(), getException());
	}

	/**
	 * How long did it take to prepare the statement and bind its parameters?
	 * <p>
	 * Absent for statements without bind variables, which are not prepared.
	 *
	 * @return how long preparation and binding took, if available
	 */
	@NonNull
	public Optional<Duration> getPreparationDuration() {
		return Optional.ofNullable(this.preparationDuration);
	}

	/**
	 * How long did it take to execute the SQL statement?
	 *
	 * @return how long it took to execute the SQL statement, if available
	 */
	@NonNull
	public Optional<Duration> getExecutionDuration() {
		return Optional.ofNullable(this.executionDuration);
	}

	/**
	 * How long did it take to turn the {@link java.sql.ResultSet} into rows?
	 *
	 * @return how long it took to read the {@link java.sql.ResultSet}, if available
	 */
	@NonNull
	public Optional<Duration> getResultSetMappingDuration() {
		return Optional.ofNullable(this.resultSetMappingDuration);
	}

	/**
	 * The sum of {@link #getPreparationDuration()}, {@link #getExecutionDuration()} and
	 * {@link #getResultSetMappingDuration()}.
	 *
	 * @return how long the statement took in total
	 */
	@NonNull
	public Duration getTotalDuration() {
		return this.totalDuration;
	}

	@NonNull
	public StatementContext getStatementContext() {
		return this.statementContext;
	}

	/**
	 * @return the affected-row count reported by the driver, if execution completed
	 */
	@NonNull
	public Optional<Long> getAffectedRows() {
		return Optional.ofNullable(this.affectedRows);
	}

	/**
	 * @return how many rows were fetched, if rows were fetched
	 */
	@NonNull
	public Optional<Integer> getRowCount() {
		return Optional.ofNullable(this.rowCount);
	}

	@NonNull
	public Optional<ExecutionPhase> getFailedPhase() {
		return Optional.ofNullable(this.failedPhase);
	}

	/**
	 * The exception that caused the statement to fail.
	 *
	 * @return the failure, if the statement failed
	 */
	@NonNull
	public Optional<DatabaseException> getException() {
		return Optional.ofNullable(this.exception);
	}

	/**
	 * Builder used to construct instances of {@link StatementLog}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final StatementContext statementContext;
		@Nullable
		private Duration preparationDuration;
		@Nullable
		private Duration executionDuration;
		@Nullable
		private Duration resultSetMappingDuration;
		@Nullable
		private Long affectedRows;
		@Nullable
		private Integer rowCount;
		@Nullable
		private ExecutionPhase failedPhase;
		@Nullable
		private DatabaseException exception;

		private Builder(@NonNull StatementContext statementContext) {
			requireNonNull(statementContext);
			this.statementContext = statementContext;
		}

		@NonNull
		public Builder preparationDuration(@Nullable Duration preparationDuration) {
			this.preparationDuration = preparationDuration;
			return this;
		}

		@NonNull
		public Builder executionDuration(@Nullable Duration executionDuration) {
			this.executionDuration = executionDuration;
			return this;
		}

		@NonNull
		public Builder resultSetMappingDuration(@Nullable Duration resultSetMappingDuration) {
			this.resultSetMappingDuration = resultSetMappingDuration;
			return this;
		}

		@NonNull
		public Builder affectedRows(@Nullable Long affectedRows) {
			this.affectedRows = affectedRows;
			return this;
		}

		@NonNull
		public Builder rowCount(@Nullable Integer rowCount) {
			this.rowCount = rowCount;
			return this;
		}

		/**
		 * Specifies the failure and the phase in which it happened.
		 *
		 * @param failedPhase the phase the statement failed in, if it failed
		 * @param exception   the failure, if the statement failed
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder failure(@Nullable ExecutionPhase failedPhase,
													 @Nullable DatabaseException exception) {
			this.failedPhase = failedPhase;
			this.exception = exception;
			return this;
		}

		@NonNull
		public StatementLog build() {
			return new StatementLog(this);
		}
	}
}

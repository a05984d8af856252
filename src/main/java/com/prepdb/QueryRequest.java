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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A single call to {@link Database#runQuery(QueryRequest)}: the SQL template, its bind variables and the flags that
 * control error reporting, result fetching and placeholder generation.
 * <p>
 * <pre>{@code QueryRequest request = QueryRequest.withSql("INSERT INTO logs (msg, level) VALUES")
 *   .values("hello", 3)
 *   .errorMessage("insert failed: ")
 *   .withResult(false)
 *   .autoBrackets(true)
 *   .build();}</pre>
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class QueryRequest {
	@NonNull
	private final String sql;
	@NonNull
	private final List<BindVariable> variables;
	@NonNull
	private final String errorMessage;
	@NonNull
	private final Boolean withSqlError;
	@NonNull
	private final Boolean withResult;
	@NonNull
	private final Boolean autoBrackets;

	private QueryRequest(@NonNull Builder builder) {
		requireNonNull(builder);

		this.sql = builder.sql;
		this.variables = Collections.unmodifiableList(new ArrayList<>(builder.variables));
		this.errorMessage = builder.errorMessage == null ? "" : builder.errorMessage;
		this.withSqlError = builder.withSqlError == null ? true : builder.withSqlError;
		this.withResult = builder.withResult == null ? true : builder.withResult;
		this.autoBrackets = builder.autoBrackets == null ? false : builder.autoBrackets;
	}

	/**
	 * Provides a {@link QueryRequest} builder for the given SQL template.
	 *
	 * @param sql the SQL template, with {@code ?} placeholders
	 * @return a {@link QueryRequest} builder
	 */
	@NonNull
	public static Builder withSql(@NonNull String sql) {
		requireNonNull(sql);
		return new Builder(sql);
	}

	@NonNull
	public String getSql() {
		return this.sql;
	}

	@NonNull
	public List<BindVariable> getVariables() {
		return this.variables;
	}

	/**
	 * Text recorded as the error when the query fails, possibly followed by the driver's own error text.
	 *
	 * @return the caller-supplied error message, empty if none was supplied
	 */
	@NonNull
	public String getErrorMessage() {
		return this.errorMessage;
	}

	/**
	 * Whether the driver's error text is appended to {@link #getErrorMessage()} on failure.
	 * <p>
	 * Turn this off when the error may reach callers that should not see schema or query details.
	 *
	 * @return {@code true} if driver error text is included
	 */
	@NonNull
	public Boolean getWithSqlError() {
		return this.withSqlError;
	}

	/**
	 * @return {@code true} if returned rows should be fetched
	 */
	@NonNull
	public Boolean getWithResult() {
		return this.withResult;
	}

	/**
	 * @return {@code true} if a {@code (?,...,?)} list sized to the variables is appended to the SQL
	 */
	@NonNull
	public Boolean getAutoBrackets() {
		return this.autoBrackets;
	}

	@Override
	public int hashCode() {
		return Objects.hash(getSql(), getVariables(), getErrorMessage(), getWithSqlError(), getWithResult(), getAutoBrackets());
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof QueryRequest))
			return false;

		QueryRequest queryRequest = (QueryRequest) object;

		return Objects.equals(queryRequest.getSql(), getSql())
				&& Objects.equals(queryRequest.getVariables(), getVariables())
				&& Objects.equals(queryRequest.getErrorMessage(), getErrorMessage())
				&& Objects.equals(queryRequest.getWithSqlError(), getWithSqlError())
				&& Objects.equals(queryRequest.getWithResult(), getWithResult())
				&& Objects.equals(queryRequest.getAutoBrackets(), getAutoBrackets());
	}

	@Override
	public String toString() {
		List<String> components = new ArrayList<>(6);

		components.add(format("sql=%s", getSql().replaceAll("\n+", " ").trim()));

		if (getVariables().size() > 0)
			components.add(format("variables=%s", getVariables()));

		if (getErrorMessage().length() > 0)
			components.add(format("errorMessage=%s", getErrorMessage()));

		components.add(format("withSqlError=%s", getWithSqlError()));
		components.add(format("withResult=%s", getWithResult()));
		components.add(format("autoBrackets=%s", getAutoBrackets()));

		return format("%s{%s}", getClass().getSimpleName(), components.stream().collect(Collectors.joining(", ")));
	}

	/**
	 * Builder used to construct instances of {@link QueryRequest}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final String sql;
		@NonNull
		private final List<BindVariable> variables;
		@Nullable
		private String errorMessage;
		@Nullable
		private Boolean withSqlError;
		@Nullable
		private Boolean withResult;
		@Nullable
		private Boolean autoBrackets;

		private Builder(@NonNull String sql) {
			this.sql = requireNonNull(sql);
			this.variables = new ArrayList<>();
		}

		/**
		 * Appends bind variables, in placeholder order.
		 *
		 * @param variables the variables to append
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder variables(@NonNull List<BindVariable> variables) {
			requireNonNull(variables);

			for (BindVariable variable : variables)
				this.variables.add(requireNonNull(variable));

			return this;
		}

		/**
		 * Appends plain values as bind variables, in placeholder order.
		 *
		 * @param values the values to append
		 * @return this {@code Builder}, for chaining
		 * @throws BindTypeException if a value is {@code null} or of an unsupported type
		 */
		@NonNull
		public Builder values(Object @NonNull ... values) {
			requireNonNull(values);
			return values(Arrays.asList(values));
		}

		/**
		 * Appends plain values as bind variables, in placeholder order.
		 *
		 * @param values the values to append
		 * @return this {@code Builder}, for chaining
		 * @throws BindTypeException if a value is {@code null} or of an unsupported type
		 */
		@NonNull
		public Builder values(@NonNull List<?> values) {
			requireNonNull(values);

			for (Object value : values)
				this.variables.add(BindVariable.of(value));

			return this;
		}

		@NonNull
		public Builder errorMessage(@Nullable String errorMessage) {
			this.errorMessage = errorMessage;
			return this;
		}

		@NonNull
		public Builder withSqlError(@Nullable Boolean withSqlError) {
			this.withSqlError = withSqlError;
			return this;
		}

		@NonNull
		public Builder withResult(@Nullable Boolean withResult) {
			this.withResult = withResult;
			return this;
		}

		@NonNull
		public Builder autoBrackets(@Nullable Boolean autoBrackets) {
			this.autoBrackets = autoBrackets;
			return this;
		}

		@NonNull
		public QueryRequest build() {
			return new QueryRequest(this);
		}
	}
}

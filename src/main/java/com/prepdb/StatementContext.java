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

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Data that represents a SQL statement as it is sent to the database.
 *
 * @since 1.0.0
 */
@ThreadSafe
public class StatementContext {
	@Nonnull
	private final String sql;
	@Nonnull
	private final BoundParameters boundParameters;
	@Nonnull
	private final DatabaseType databaseType;

	protected StatementContext(@Nonnull Builder builder) {
		requireNonNull(builder);

		this.sql = builder.sql;
		this.boundParameters = builder.boundParameters == null ? BoundParameters.empty() : builder.boundParameters;
		this.databaseType = builder.databaseType;
	}

	@Override
	public int hashCode() {
		return Objects.hash(getSql(), getBoundParameters(), getDatabaseType());
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof StatementContext))
			return false;

		StatementContext statementContext = (StatementContext) object;

		return Objects.equals(statementContext.getSql(), getSql())
				&& Objects.equals(statementContext.getBoundParameters(), getBoundParameters())
				&& Objects.equals(statementContext.getDatabaseType(), getDatabaseType());
	}

	@Override
	public String toString() {
		List<String> components = new ArrayList<>(3);

		// Strip out newlines for more compact SQL representation
		components.add(format("sql=%s", getSql().replaceAll("\n+", " ").trim()));

		if (!getBoundParameters().isEmpty())
			components.add(format("boundParameters=%s", getBoundParameters()));

		components.add(format("databaseType=%s", getDatabaseType().name()));

		return format("%s{%s}", getClass().getSimpleName(), components.stream().collect(Collectors.joining(", ")));
	}

	/**
	 * The final SQL, after any placeholder list was appended.
	 *
	 * @return the SQL sent to the driver
	 */
	@Nonnull
	public String getSql() {
		return this.sql;
	}

	@Nonnull
	public BoundParameters getBoundParameters() {
		return this.boundParameters;
	}

	@Nonnull
	public DatabaseType getDatabaseType() {
		return this.databaseType;
	}

	@Nonnull
	public static Builder with(@Nonnull String sql,
														 @Nonnull DatabaseType databaseType) {
		requireNonNull(sql);
		requireNonNull(databaseType);

		return new Builder(sql, databaseType);
	}

	/**
	 * Builder used to construct instances of {@link StatementContext}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@Nonnull
		private final String sql;
		@Nonnull
		private final DatabaseType databaseType;
		@Nullable
		private BoundParameters boundParameters;

		private Builder(@Nonnull String sql,
										@Nonnull DatabaseType databaseType) {
			requireNonNull(sql);
			requireNonNull(databaseType);

			this.sql = sql;
			this.databaseType = databaseType;
		}

		@Nonnull
		public Builder boundParameters(@Nullable BoundParameters boundParameters) {
			this.boundParameters = boundParameters;
			return this;
		}

		@Nonnull
		public StatementContext build() {
			return new StatementContext(this);
		}
	}
}

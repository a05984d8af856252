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
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;

/**
 * Contract for turning a {@link ResultSet} into plain rows keyed by column label.
 * <p>
 * A production-ready concrete implementation is available via {@link #withDefaultConfiguration()}.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface ResultSetMapper {
	/**
	 * Reads {@code resultSet} to completion.
	 * <p>
	 * Rows must be returned in cursor order. The caller closes {@code resultSet}.
	 *
	 * @param statementContext current SQL context
	 * @param resultSet        provides raw row data to pull from
	 * @return every remaining row of {@code resultSet}, each keyed by column label
	 * @throws SQLException if an error occurs while reading
	 */
	@Nonnull
	List<Map<String, Object>> map(@Nonnull StatementContext statementContext,
																@Nonnull ResultSet resultSet) throws SQLException;

	/**
	 * Acquires a concrete implementation of this interface with out-of-the-box defaults.
	 * <p>
	 * The returned instance is thread-safe.
	 *
	 * @return a concrete implementation of this interface with out-of-the-box defaults
	 */
	@Nonnull
	static ResultSetMapper withDefaultConfiguration() {
		return new DefaultResultSetMapper();
	}
}

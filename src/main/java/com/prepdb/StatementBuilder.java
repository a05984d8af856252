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

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Textual helpers for SQL templates.
 *
 * @since 1.0.0
 */
public final class StatementBuilder {
	private StatementBuilder() {
		// Non-instantiable
	}

	/**
	 * Appends a parenthesized placeholder list sized to {@code placeholderCount}, e.g. {@code (?,?,?)} for 3.
	 * <p>
	 * A count of zero appends {@code ()}. The template itself is not inspected.
	 *
	 * @param sql              the SQL template
	 * @param placeholderCount the number of {@code ?} placeholders to append
	 * @return {@code sql} followed by the placeholder list
	 */
	@NonNull
	public static String appendPlaceholders(@NonNull String sql,
																					int placeholderCount) {
		requireNonNull(sql);

		if (placeholderCount < 0)
			throw new IllegalArgumentException(format("Placeholder count must be non-negative, was %d", placeholderCount));

		StringBuilder sqlBuilder = new StringBuilder(sql.length() + placeholderCount * 2 + 1);
		sqlBuilder.append(sql).append('(');

		for (int i = 0; i < placeholderCount; ++i) {
			if (i > 0)
				sqlBuilder.append(',');

			sqlBuilder.append('?');
		}

		return sqlBuilder.append(')').toString();
	}
}

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
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Maps each row to a {@link LinkedHashMap} of column label to {@link ResultSet#getObject(int)} value.
 * <p>
 * Column labels are read once per result set. When two columns share a label, the later column's value wins.
 * SQL {@code NULL} becomes a {@code null} map value.
 *
 * @since 1.0.0
 */
@ThreadSafe
class DefaultResultSetMapper implements ResultSetMapper {
	@NonNull
	@Override
	public List<Map<String, Object>> map(@NonNull StatementContext statementContext,
																			 @NonNull ResultSet resultSet) throws SQLException {
		requireNonNull(statementContext);
		requireNonNull(resultSet);

		ResultSetMetaData resultSetMetaData = resultSet.getMetaData();
		int columnCount = resultSetMetaData.getColumnCount();
		List<String> columnLabels = new ArrayList<>(columnCount);

		for (int i = 1; i <= columnCount; ++i)
			columnLabels.add(resultSetMetaData.getColumnLabel(i));

		List<Map<String, Object>> rows = new ArrayList<>();

		while (resultSet.next()) {
			Map<String, Object> row = new LinkedHashMap<>(columnCount * 2);

			for (int i = 1; i <= columnCount; ++i)
				row.put(columnLabels.get(i - 1), extractColumnValue(statementContext, resultSet, i));

			rows.add(row);
		}

		return rows;
	}

	@Nullable
	protected Object extractColumnValue(@NonNull StatementContext statementContext,
																			@NonNull ResultSet resultSet,
																			int columnIndex) throws SQLException {
		requireNonNull(statementContext);
		requireNonNull(resultSet);

		Object value = resultSet.getObject(columnIndex);
		return resultSet.wasNull() ? null : value;
	}
}

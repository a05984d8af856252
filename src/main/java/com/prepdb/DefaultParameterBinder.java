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

import javax.annotation.concurrent.ThreadSafe;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Binds each variable with the JDBC setter selected by its type tag: {@code 'i'} uses
 * {@link PreparedStatement#setLong(int, long)}, {@code 'd'} uses {@link PreparedStatement#setDouble(int, double)} and
 * {@code 's'} uses {@link PreparedStatement#setString(int, String)}.
 *
 * @since 1.0.0
 */
@ThreadSafe
class DefaultParameterBinder implements ParameterBinder {
	@Override
	public void bind(@NonNull StatementContext statementContext,
									 @NonNull PreparedStatement preparedStatement,
									 @NonNull BoundParameters boundParameters) throws SQLException {
		requireNonNull(statementContext);
		requireNonNull(preparedStatement);
		requireNonNull(boundParameters);

		String typeTags = boundParameters.getTypeTags();
		List<BindVariable> variables = boundParameters.getVariables();

		if (typeTags.length() != variables.size())
			throw new IllegalStateException(format("Refusing to bind %d variables with %d type tags", variables.size(), typeTags.length()));

		for (int i = 0; i < variables.size(); ++i) {
			char tag = typeTags.charAt(i);
			BindType bindType = BindType.fromTag(tag)
					.orElseThrow(() -> new IllegalStateException(format("Unknown type tag '%s'", tag)));

			bindVariable(preparedStatement, i + 1, bindType, variables.get(i));
		}
	}

	protected void bindVariable(@NonNull PreparedStatement preparedStatement,
															int parameterIndex,
															@NonNull BindType bindType,
															@NonNull BindVariable variable) throws SQLException {
		requireNonNull(preparedStatement);
		requireNonNull(bindType);
		requireNonNull(variable);

		switch (bindType) {
			case INTEGER:
				preparedStatement.setLong(parameterIndex, variable.toLong());
				break;
			case DOUBLE:
				preparedStatement.setDouble(parameterIndex, variable.toDouble());
				break;
			case STRING:
				preparedStatement.setString(parameterIndex, variable.toText());
				break;
			default:
				throw new IllegalStateException(format("Unsupported bind type %s", bindType.name()));
		}
	}
}

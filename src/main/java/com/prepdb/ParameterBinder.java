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

import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * Contract for binding an ordered list of tagged variables to a SQL prepared statement in one operation.
 * <p>
 * A production-ready concrete implementation is available via {@link #withDefaultConfiguration()}.
 * Or, implement your own: <pre>{@code  ParameterBinder myImpl = (statementContext, preparedStatement, boundParameters) -> {
 *   // TODO: your own code that binds each variable to the PreparedStatement according to its type tag
 * };}</pre>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface ParameterBinder {
	/**
	 * Binds every variable of {@code boundParameters} to {@code preparedStatement}, the first variable going to
	 * parameter index 1.
	 *
	 * @param statementContext  current SQL context
	 * @param preparedStatement the prepared statement to bind to
	 * @param boundParameters   the variables and their type tags
	 * @throws SQLException if the driver rejects a value
	 */
	void bind(@NonNull StatementContext statementContext,
						@NonNull PreparedStatement preparedStatement,
						@NonNull BoundParameters boundParameters) throws SQLException;

	/**
	 * Acquires a concrete implementation of this interface with out-of-the-box defaults.
	 * <p>
	 * The returned instance is thread-safe.
	 *
	 * @return a concrete implementation of this interface with out-of-the-box defaults
	 */
	@NonNull
	static ParameterBinder withDefaultConfiguration() {
		return new DefaultParameterBinder();
	}
}

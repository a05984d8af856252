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

import java.sql.Connection;
import java.sql.SQLException;

/**
 * The session-level operations a {@link Database} needs from the underlying database client.
 * <p>
 * Statement preparation, execution and result iteration go through the returned {@link Connection} directly.
 * The default implementation is {@link JdbcDatabaseDriver}.
 *
 * @since 1.0.0
 */
public interface DatabaseDriver {
	/**
	 * Opens a session.
	 *
	 * @param host     where to connect, interpretation is up to the implementation
	 * @param username the user to authenticate as
	 * @param password the user's password
	 * @return an open connection
	 * @throws SQLException if the session cannot be established
	 */
	@NonNull
	Connection connect(@NonNull String host,
										 @Nullable String username,
										 @Nullable String password) throws SQLException;

	/**
	 * Makes {@code databaseName} the target of all subsequent statements on {@code connection}.
	 *
	 * @param connection   an open connection returned by {@link #connect(String, String, String)}
	 * @param databaseType the type of database {@code connection} talks to
	 * @param databaseName the database to select
	 * @throws SQLException if the database cannot be selected
	 */
	void selectDatabase(@NonNull Connection connection,
											@NonNull DatabaseType databaseType,
											@NonNull String databaseName) throws SQLException;
}

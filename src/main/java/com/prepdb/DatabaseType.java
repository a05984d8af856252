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

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import java.util.Locale;

import static java.util.Objects.requireNonNull;

/**
 * Identifies different types of databases, which allows for special platform-specific handling.
 * <p>
 * The type decides how {@link JdbcDatabaseDriver} selects the target database: MySQL (and MariaDB) select a catalog,
 * everything else selects a schema.
 *
 * @since 1.0.0
 */
public enum DatabaseType {
	/**
	 * A database which requires no special handling.
	 */
	GENERIC,
	/**
	 * A MySQL or MariaDB database.
	 */
	MYSQL,
	/**
	 * A PostgreSQL database.
	 */
	POSTGRESQL,
	/**
	 * An HSQLDB database.
	 */
	HSQLDB;

	/**
	 * Determines the type of database the given {@code connection} talks to.
	 *
	 * @param connection an open connection
	 * @return the type of database
	 * @throws DatabaseException if an exception occurs while attempting to read database metadata
	 */
	@NonNull
	public static DatabaseType fromConnection(@NonNull Connection connection) {
		requireNonNull(connection);

		try {
			DatabaseMetaData databaseMetaData = connection.getMetaData();
			String databaseProductName = databaseMetaData.getDatabaseProductName();
			String url = databaseMetaData.getURL();

			// All of our checks are against databases with English names
			String databaseProductNameLowercase = databaseProductName == null ? "" : databaseProductName.toLowerCase(Locale.ENGLISH);
			String urlLowercase = url == null ? "" : url.toLowerCase(Locale.ENGLISH);

			// Prefer product name
			if (databaseProductNameLowercase.contains("mysql") || databaseProductNameLowercase.contains("mariadb"))
				return DatabaseType.MYSQL;

			if (databaseProductNameLowercase.contains("postgresql") || databaseProductNameLowercase.equals("postgres"))  // some proxies shorten it
				return DatabaseType.POSTGRESQL;

			if (databaseProductNameLowercase.contains("hsql"))
				return DatabaseType.HSQLDB;

			// Fallbacks if product name is absent/weird
			if (urlLowercase.startsWith("jdbc:mysql:") || urlLowercase.startsWith("jdbc:mariadb:"))
				return DatabaseType.MYSQL;

			if (urlLowercase.startsWith("jdbc:postgresql:"))
				return DatabaseType.POSTGRESQL;

			if (urlLowercase.startsWith("jdbc:hsqldb:"))
				return DatabaseType.HSQLDB;

			return DatabaseType.GENERIC;
		} catch (SQLException e) {
			throw new DatabaseException("Unable to read database metadata to determine its type", e);
		}
	}
}

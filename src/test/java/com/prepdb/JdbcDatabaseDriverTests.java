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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Properties;

/**
 * @since 1.0.0
 */
@ThreadSafe
public class JdbcDatabaseDriverTests {
	@Test
	public void testDetermineUrl() {
		JdbcDatabaseDriver defaultDriver = new JdbcDatabaseDriver();

		Assertions.assertEquals("jdbc:mysql://db.example.com:3306/", defaultDriver.determineUrl("db.example.com:3306"));
		Assertions.assertEquals("jdbc:hsqldb:mem:x", defaultDriver.determineUrl("jdbc:hsqldb:mem:x"), "JDBC URLs are used as-is");

		JdbcDatabaseDriver templatedDriver = new JdbcDatabaseDriver("jdbc:hsqldb:mem:%s", null);

		Assertions.assertEquals("jdbc:hsqldb:mem:inventory", templatedDriver.determineUrl("inventory"));
		Assertions.assertThrows(IllegalArgumentException.class, () -> new JdbcDatabaseDriver("jdbc:hsqldb:mem:fixed", null));
	}

	@Test
	public void testConnectAndSelectSchema() throws SQLException {
		Properties connectionProperties = new Properties();
		connectionProperties.setProperty("hsqldb.default_table_type", "memory");

		JdbcDatabaseDriver databaseDriver = new JdbcDatabaseDriver("jdbc:hsqldb:mem:%s", connectionProperties);

		try (Connection connection = databaseDriver.connect("testConnectAndSelectSchema", "sa", "")) {
			Assertions.assertEquals(DatabaseType.HSQLDB, DatabaseType.fromConnection(connection));

			databaseDriver.selectDatabase(connection, DatabaseType.HSQLDB, "PUBLIC");
			Assertions.assertEquals("PUBLIC", connection.getSchema());

			Assertions.assertThrows(SQLException.class, () -> databaseDriver.selectDatabase(connection, DatabaseType.HSQLDB, "NO_SUCH_SCHEMA"));
		}
	}

	@Test
	public void testDatabaseTypeOverrideAndTemplate() {
		try (Database database = Database.withHost("testDatabaseTypeOverrideAndTemplate")
				.urlTemplate("jdbc:hsqldb:mem:%s")
				.username("sa")
				.password("")
				.databaseName("PUBLIC")
				.databaseType(DatabaseType.GENERIC)
				.build()) {
			Assertions.assertEquals(DatabaseType.GENERIC, database.getDatabaseType());

			QueryOutcome outcome = database.runQuery("VALUES (1)");

			Assertions.assertTrue(outcome.isSuccessful(), outcome.getError());
			Assertions.assertEquals(1, outcome.getRows().size());
		}
	}
}

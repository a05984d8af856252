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
import org.postgresql.util.PSQLException;
import org.postgresql.util.ServerErrorMessage;

import javax.annotation.concurrent.ThreadSafe;
import java.sql.SQLException;

/**
 * @since 1.0.0
 */
@ThreadSafe
public class DatabaseExceptionTests {
	@Test
	public void testPostgresServerErrorDetails() {
		ServerErrorMessage serverErrorMessage = new ServerErrorMessage(
				"SERROR\0C23505\0Mduplicate key value violates unique constraint \"users_pkey\"\0"
						+ "DKey (id)=(42) already exists.\0HChoose another id.\0P15\0tusers\0");

		StatementExecutionException e = new StatementExecutionException("insert failed", new PSQLException(serverErrorMessage));

		Assertions.assertEquals("23505", e.getSqlState().orElse(null));
		Assertions.assertEquals("duplicate key value violates unique constraint \"users_pkey\"", e.getDbmsMessage().orElse(null));
		Assertions.assertEquals("Key (id)=(42) already exists.", e.getDetail().orElse(null));
		Assertions.assertEquals("Choose another id.", e.getHint().orElse(null));
		Assertions.assertEquals(15, e.getPosition().orElse(null));
		Assertions.assertEquals("users", e.getTable().orElse(null));
		Assertions.assertTrue(e.toString().contains("detail=Key (id)=(42) already exists."), e.toString());
	}

	@Test
	public void testGenericSqlExceptionDetails() {
		SQLException cause = new SQLException("Table 'shop.orders' doesn't exist", "42S02", 1146);
		InvalidSyntaxException e = new InvalidSyntaxException("Invalid SQL syntax", cause);

		Assertions.assertEquals(1146, e.getErrorCode().orElse(null));
		Assertions.assertEquals("42S02", e.getSqlState().orElse(null));
		Assertions.assertEquals("Table 'shop.orders' doesn't exist", e.getDbmsMessage().orElse(null));
		Assertions.assertTrue(e.getDetail().isEmpty(), "Only PostgreSQL supplies server detail");
		Assertions.assertTrue(e.getTable().isEmpty());
	}

	@Test
	public void testMessageOnlyException() {
		DatabaseException e = new ConnectionException("0: No suitable driver");

		Assertions.assertTrue(e.getErrorCode().isEmpty());
		Assertions.assertTrue(e.getSqlState().isEmpty());
		Assertions.assertEquals("0: No suitable driver", e.getMessage());
	}
}

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
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * @since 1.0.0
 */
@ThreadSafe
public class DefaultStatementLoggerTests {
	@Test
	public void testFormatsSuccessfulStatement() {
		StatementContext statementContext = StatementContext.with("INSERT INTO logs (msg, level) VALUES(?,?)", DatabaseType.GENERIC)
				.boundParameters(BoundParameters.fromVariables(List.of(BindVariable.of("hello"), BindVariable.of(3))))
				.build();

		StatementLog statementLog = StatementLog.withStatementContext(statementContext)
				.preparationDuration(Duration.ofMillis(2))
				.executionDuration(Duration.ofMillis(5))
				.affectedRows(1L)
				.build();

		Assertions.assertEquals(Duration.ofMillis(7), statementLog.getTotalDuration());

		String formatted = new DefaultStatementLogger().formatStatementLog(statementLog);
		String[] lines = formatted.split("\n");

		Assertions.assertEquals(4, lines.length, formatted);
		Assertions.assertEquals("INSERT INTO logs (msg, level) VALUES(?,?)", lines[0]);
		Assertions.assertEquals("Parameters (si): 'hello', 3", lines[1]);
		Assertions.assertEquals("PT0.002S preparing statement, PT0.005S executing statement", lines[2]);
		Assertions.assertEquals("Rows: 1 affected", lines[3]);
	}

	@Test
	public void testFormatsFailedStatement() {
		StatementContext statementContext = StatementContext.with("SELEC 1", DatabaseType.GENERIC).build();
		SQLException cause = new SQLException("unexpected token: SELEC", "42581", -5581);

		StatementLog statementLog = StatementLog.withStatementContext(statementContext)
				.failure(ExecutionPhase.EXECUTING, new StatementExecutionException(cause.getMessage(), cause))
				.build();

		String formatted = new DefaultStatementLogger().formatStatementLog(statementLog);

		Assertions.assertEquals("SELEC 1\nFailed while executing due to " + cause, formatted);
	}

	@Test
	public void testEllipsizesLongText() {
		DefaultStatementLogger statementLogger = new DefaultStatementLogger();
		String longText = "x".repeat(150);

		Assertions.assertEquals("x".repeat(100) + "...", statementLogger.ellipsize(longText, 100));
		Assertions.assertEquals("short", statementLogger.ellipsize("  short  ", 100));
	}

	@Test
	public void testLogsThroughJavaUtilLogging() {
		String loggerName = "com.prepdb.test.SQL";
		Logger logger = Logger.getLogger(loggerName);
		List<LogRecord> logRecords = new CopyOnWriteArrayList<>();

		Handler handler = new Handler() {
			@Override
			public void publish(LogRecord record) {
				logRecords.add(record);
			}

			@Override
			public void flush() {}

			@Override
			public void close() {}
		};

		logger.setLevel(Level.FINE);
		logger.addHandler(handler);

		try {
			StatementLog statementLog = StatementLog.withStatementContext(StatementContext.with("VALUES (1)", DatabaseType.HSQLDB).build())
					.rowCount(1)
					.build();

			new DefaultStatementLogger(loggerName, Level.FINE).log(statementLog);

			Assertions.assertEquals(1, logRecords.size());
			Assertions.assertEquals(Level.FINE, logRecords.get(0).getLevel());
			Assertions.assertEquals("VALUES (1)\nRows: 1 fetched", logRecords.get(0).getMessage());

			new DefaultStatementLogger(loggerName, Level.FINEST).log(statementLog);

			Assertions.assertEquals(1, logRecords.size(), "Statements below the logger's level should not be logged");
		} finally {
			logger.removeHandler(handler);
		}
	}
}

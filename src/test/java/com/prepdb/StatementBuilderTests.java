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

/**
 * @since 1.0.0
 */
@ThreadSafe
public class StatementBuilderTests {
	@Test
	public void testAppendPlaceholders() {
		Assertions.assertEquals("INSERT INTO t VALUES(?)", StatementBuilder.appendPlaceholders("INSERT INTO t VALUES", 1));
		Assertions.assertEquals("INSERT INTO t VALUES(?,?,?)", StatementBuilder.appendPlaceholders("INSERT INTO t VALUES", 3));
		Assertions.assertEquals("SELECT * FROM t WHERE id IN ()", StatementBuilder.appendPlaceholders("SELECT * FROM t WHERE id IN ", 0));
	}

	@Test
	public void testPlaceholderShape() {
		for (int n = 1; n <= 50; ++n) {
			String sql = StatementBuilder.appendPlaceholders("X", n);
			String placeholders = sql.substring(1);

			Assertions.assertTrue(placeholders.startsWith("("));
			Assertions.assertTrue(placeholders.endsWith("?)"), "No trailing comma before the closing parenthesis");
			Assertions.assertEquals(n, placeholders.chars().filter(c -> c == '?').count());
			Assertions.assertEquals(n - 1, placeholders.chars().filter(c -> c == ',').count());
			Assertions.assertEquals(1, placeholders.chars().filter(c -> c == ')').count());
		}
	}

	@Test
	public void testTemplateIsNotInspected() {
		Assertions.assertEquals("not even sql(?,?)", StatementBuilder.appendPlaceholders("not even sql", 2));
		Assertions.assertThrows(IllegalArgumentException.class, () -> StatementBuilder.appendPlaceholders("X", -1));
	}
}

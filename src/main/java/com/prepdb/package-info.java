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

/**
 * Prepdb is a small prepared-statement layer over a single JDBC connection.
 * <p>
 * Queries never throw on failure. Each call returns a {@link com.prepdb.QueryOutcome}, and the {@link com.prepdb.Database}
 * mirrors the most recent one until the next call.
 *
 * <pre>
 * // Connect and select the database; throws ConnectionException or DatabaseSelectionException
 * Database database = Database.connect("localhost", "app", "secret", "shop");
 *
 * // Reads
 * QueryOutcome outcome = database.runQuery("SELECT * FROM users WHERE id IN", List.of(42), "", true, true, true);
 * List&lt;Map&lt;String, Object&gt;&gt; rows = outcome.getRows();
 *
 * // Writes
 * database.runQuery("INSERT INTO logs (msg) VALUES", List.of("hello"), "insert failed: ", true, false, true);
 *
 * if (database.hasError())
 *   System.err.println(database.getError());
 * else
 *   System.out.println(database.getAffectedRows() + " row(s) inserted");</pre>
 *
 * @since 1.0.0
 */
package com.prepdb;

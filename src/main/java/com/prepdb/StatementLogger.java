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

/**
 * Receives one {@link StatementLog} per {@link Database#runQuery(QueryRequest)} call, whether the call succeeded or not.
 * <p>
 * Exceptions thrown by a logger are attached as suppressed exceptions to the call's {@link DatabaseException}, or
 * propagate to the caller if the call itself succeeded.
 *
 * @since 1.0.0
 */
@ThreadSafe
@FunctionalInterface
public interface StatementLogger {
	/**
	 * Handles the diagnostics of a single statement, e.g. by writing them to a logging framework or flagging slow
	 * statements.
	 *
	 * @param statementLog the diagnostics to log
	 */
	void log(@NonNull StatementLog statementLog);
}

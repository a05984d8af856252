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

import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * Thrown when a {@link Database} cannot establish its connection.
 * <p>
 * Raised from construction; the {@link Database} is never handed to the caller.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class ConnectionException extends DatabaseException {
	/**
	 * Creates a {@code ConnectionException} with the given {@code message}.
	 *
	 * @param message a message describing this exception
	 */
	public ConnectionException(@Nullable String message) {
		super(message);
	}

	/**
	 * Creates a {@code ConnectionException} which wraps the given {@code cause}.
	 *
	 * @param message a message describing this exception
	 * @param cause   the cause of this exception
	 */
	public ConnectionException(@Nullable String message,
			@Nullable Throwable cause) {
		super(message, cause);
	}
}

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

import javax.annotation.concurrent.NotThreadSafe;
import java.util.Optional;

/**
 * Thrown when a value cannot be used as a bind variable, or cannot be bound with the type tag it was given.
 * <p>
 * Supported kinds are integers, booleans, floating-point numbers and text.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class BindTypeException extends DatabaseException {
	@Nullable
	private final Class<?> rejectedType;

	/**
	 * Creates a {@code BindTypeException} for a value of the given type.
	 *
	 * @param message      a message describing this exception
	 * @param rejectedType the runtime type of the rejected value, or {@code null} if the value was {@code null}
	 */
	public BindTypeException(@Nullable String message,
													 @Nullable Class<?> rejectedType) {
		super(message);
		this.rejectedType = rejectedType;
	}

	/**
	 * The runtime type of the value that could not be bound.
	 *
	 * @return the rejected type, or empty if the rejected value was {@code null}
	 */
	@NonNull
	public Optional<Class<?>> getRejectedType() {
		return Optional.ofNullable(this.rejectedType);
	}
}

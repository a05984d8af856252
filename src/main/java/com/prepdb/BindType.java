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

import com.prepdb.BindVariable.Kind;
import org.jspecify.annotations.NonNull;

import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * One-character codes describing how a bind variable is sent to the database.
 *
 * @since 1.0.0
 */
public enum BindType {
	/**
	 * Integers and booleans, bound as {@code long}.
	 */
	INTEGER('i'),
	/**
	 * Floating-point numbers, bound as {@code double}.
	 */
	DOUBLE('d'),
	/**
	 * Text, bound as {@link String}.
	 */
	STRING('s');

	private final char tag;

	BindType(char tag) {
		this.tag = tag;
	}

	/**
	 * The tag character for this type.
	 *
	 * @return the tag character
	 */
	public char getTag() {
		return this.tag;
	}

	/**
	 * Determines the bind type for a variable kind.
	 *
	 * @param kind the kind of bind variable
	 * @return the bind type used for {@code kind}
	 */
	@NonNull
	public static BindType forKind(@NonNull Kind kind) {
		requireNonNull(kind);

		switch (kind) {
			case INTEGER:
			case BOOLEAN:
				return INTEGER;
			case FLOATING_POINT:
				return DOUBLE;
			case TEXT:
				return STRING;
			default:
				throw new IllegalArgumentException("Unsupported bind variable kind " + kind.name());
		}
	}

	/**
	 * Looks up the bind type for a tag character.
	 *
	 * @param tag the tag character
	 * @return the matching bind type, or empty if {@code tag} is not a known tag
	 */
	@NonNull
	public static Optional<BindType> fromTag(char tag) {
		for (BindType bindType : values())
			if (bindType.getTag() == tag)
				return Optional.of(bindType);

		return Optional.empty();
	}

	/**
	 * Builds the tag string for the given variables, one character per variable in positional order.
	 *
	 * @param variables the bind variables
	 * @return the tag string, e.g. {@code "isd"} for an integer, a string and a double
	 */
	@NonNull
	public static String tagStringFor(@NonNull List<BindVariable> variables) {
		requireNonNull(variables);

		StringBuilder tags = new StringBuilder(variables.size());

		for (BindVariable variable : variables)
			tags.append(variable.getBindType().getTag());

		return tags.toString();
	}
}

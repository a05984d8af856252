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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The ordered bind variables of a statement together with their type tag string.
 * <p>
 * The tag string always has exactly one character per variable, in placeholder order.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class BoundParameters {
	@NonNull
	private static final BoundParameters EMPTY = new BoundParameters("", List.of());

	@NonNull
	private final String typeTags;
	@NonNull
	private final List<BindVariable> variables;

	private BoundParameters(@NonNull String typeTags,
													@NonNull List<BindVariable> variables) {
		this.typeTags = typeTags;
		this.variables = variables;
	}

	@NonNull
	public static BoundParameters empty() {
		return EMPTY;
	}

	/**
	 * Infers the type tag of each variable and pairs the resulting tag string with the variables.
	 *
	 * @param variables the bind variables, in placeholder order
	 * @return bound parameters for {@code variables}
	 */
	@NonNull
	public static BoundParameters fromVariables(@NonNull List<BindVariable> variables) {
		requireNonNull(variables);

		if (variables.isEmpty())
			return EMPTY;

		List<BindVariable> copy = Collections.unmodifiableList(new ArrayList<>(variables));
		return new BoundParameters(BindType.tagStringFor(copy), copy);
	}

	/**
	 * Pairs an explicit tag string with the variables.
	 *
	 * @param typeTags  one tag character per variable
	 * @param variables the bind variables, in placeholder order
	 * @return bound parameters for {@code variables}
	 * @throws IllegalArgumentException if the tag count differs from the variable count, or a tag is unknown
	 */
	@NonNull
	public static BoundParameters of(@NonNull String typeTags,
																	 @NonNull List<BindVariable> variables) {
		requireNonNull(typeTags);
		requireNonNull(variables);

		if (typeTags.length() != variables.size())
			throw new IllegalArgumentException(format("Type tag string '%s' has %d tags but %d variables were supplied",
					typeTags, typeTags.length(), variables.size()));

		for (int i = 0; i < typeTags.length(); ++i)
			if (BindType.fromTag(typeTags.charAt(i)).isEmpty())
				throw new IllegalArgumentException(format("Unknown type tag '%s' at position %d", typeTags.charAt(i), i));

		if (variables.isEmpty())
			return EMPTY;

		return new BoundParameters(typeTags, Collections.unmodifiableList(new ArrayList<>(variables)));
	}

	@NonNull
	public String getTypeTags() {
		return this.typeTags;
	}

	@NonNull
	public List<BindVariable> getVariables() {
		return this.variables;
	}

	public int size() {
		return this.variables.size();
	}

	public boolean isEmpty() {
		return this.variables.isEmpty();
	}

	@Override
	public int hashCode() {
		return Objects.hash(getTypeTags(), getVariables());
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof BoundParameters))
			return false;

		BoundParameters boundParameters = (BoundParameters) object;

		return Objects.equals(boundParameters.getTypeTags(), getTypeTags())
				&& Objects.equals(boundParameters.getVariables(), getVariables());
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{typeTags=%s, variables=%s}", getClass().getSimpleName(), getTypeTags(), getVariables());
	}
}

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

import javax.annotation.concurrent.Immutable;
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A value supplied positionally to fill a {@code ?} placeholder.
 * <p>
 * Exactly four kinds exist: integer, boolean, floating-point and text. Instances are acquired through the typed
 * factory methods, or through {@link #of(Object)} which inspects the runtime type of an arbitrary value and rejects
 * anything else with a {@link BindTypeException}.
 *
 * @since 1.0.0
 */
@Immutable
public final class BindVariable {
	/**
	 * The runtime kind of a bind variable.
	 */
	public enum Kind {
		INTEGER,
		BOOLEAN,
		FLOATING_POINT,
		TEXT
	}

	@NonNull
	private final Kind kind;
	@NonNull
	private final Object value;

	private BindVariable(@NonNull Kind kind,
											 @NonNull Object value) {
		this.kind = requireNonNull(kind);
		this.value = requireNonNull(value);
	}

	@NonNull
	public static BindVariable ofInteger(long value) {
		return new BindVariable(Kind.INTEGER, value);
	}

	@NonNull
	public static BindVariable ofBoolean(boolean value) {
		return new BindVariable(Kind.BOOLEAN, value);
	}

	@NonNull
	public static BindVariable ofDouble(double value) {
		return new BindVariable(Kind.FLOATING_POINT, value);
	}

	@NonNull
	public static BindVariable ofString(@NonNull String value) {
		requireNonNull(value);
		return new BindVariable(Kind.TEXT, value);
	}

	/**
	 * Wraps an arbitrary value, choosing its kind from its runtime type.
	 * <p>
	 * {@link Byte}, {@link Short}, {@link Integer} and {@link Long} are integers, {@link Float} and {@link Double} are
	 * floating-point, {@link CharSequence} is text. A {@code BindVariable} is returned as-is.
	 *
	 * @param value the value to wrap
	 * @return a bind variable for {@code value}
	 * @throws BindTypeException if {@code value} is {@code null} or of an unsupported type
	 */
	@NonNull
	public static BindVariable of(@Nullable Object value) {
		if (value == null)
			throw new BindTypeException("Unable to bind a null value; only integer, boolean, floating-point and text values are supported", null);

		if (value instanceof BindVariable)
			return (BindVariable) value;

		if (value instanceof Boolean)
			return ofBoolean((Boolean) value);

		if (value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long)
			return ofInteger(((Number) value).longValue());

		if (value instanceof Float || value instanceof Double)
			return ofDouble(((Number) value).doubleValue());

		if (value instanceof CharSequence)
			return ofString(value.toString());

		throw new BindTypeException(format("Unable to bind a value of type %s; only integer, boolean, floating-point and text values are supported",
				value.getClass().getName()), value.getClass());
	}

	@NonNull
	public Kind getKind() {
		return this.kind;
	}

	@NonNull
	public BindType getBindType() {
		return BindType.forKind(getKind());
	}

	/**
	 * The wrapped value: a {@link Long}, {@link Boolean}, {@link Double} or {@link String} depending on {@link #getKind()}.
	 *
	 * @return the wrapped value
	 */
	@NonNull
	public Object getValue() {
		return this.value;
	}

	/**
	 * This value as a {@code long}, booleans becoming {@code 1} or {@code 0}.
	 *
	 * @return the integer form of this value
	 * @throws BindTypeException if this value is text or floating-point
	 */
	public long toLong() {
		if (getKind() == Kind.BOOLEAN)
			return ((Boolean) getValue()) ? 1L : 0L;

		if (getKind() == Kind.INTEGER)
			return (Long) getValue();

		throw new BindTypeException(format("Unable to bind %s value as %s", getKind().name(), BindType.INTEGER.name()), getValue().getClass());
	}

	/**
	 * This value as a {@code double}.
	 *
	 * @return the floating-point form of this value
	 * @throws BindTypeException if this value is text
	 */
	public double toDouble() {
		if (getKind() == Kind.TEXT)
			throw new BindTypeException(format("Unable to bind %s value as %s", getKind().name(), BindType.DOUBLE.name()), getValue().getClass());

		if (getKind() == Kind.FLOATING_POINT)
			return (Double) getValue();

		return toLong();
	}

	/**
	 * This value as text. Booleans become {@code "1"} or {@code "0"}, matching their integer form.
	 *
	 * @return the text form of this value
	 */
	@NonNull
	public String toText() {
		if (getKind() == Kind.BOOLEAN)
			return String.valueOf(toLong());

		return getValue().toString();
	}

	@Override
	public int hashCode() {
		return Objects.hash(getKind(), getValue());
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof BindVariable))
			return false;

		BindVariable bindVariable = (BindVariable) object;

		return Objects.equals(bindVariable.getKind(), getKind())
				&& Objects.equals(bindVariable.getValue(), getValue());
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{kind=%s, value=%s}", getClass().getSimpleName(), getKind().name(), getValue());
	}
}

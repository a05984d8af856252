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
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * @since 1.0.0
 */
@ThreadSafe
public class BindVariableTests {
	@Test
	public void testKindsFromRuntimeTypes() {
		Assertions.assertEquals(BindVariable.Kind.INTEGER, BindVariable.of((byte) 1).getKind());
		Assertions.assertEquals(BindVariable.Kind.INTEGER, BindVariable.of((short) 1).getKind());
		Assertions.assertEquals(BindVariable.Kind.INTEGER, BindVariable.of(1).getKind());
		Assertions.assertEquals(BindVariable.Kind.INTEGER, BindVariable.of(1L).getKind());
		Assertions.assertEquals(BindVariable.Kind.BOOLEAN, BindVariable.of(true).getKind());
		Assertions.assertEquals(BindVariable.Kind.FLOATING_POINT, BindVariable.of(1.5f).getKind());
		Assertions.assertEquals(BindVariable.Kind.FLOATING_POINT, BindVariable.of(1.5).getKind());
		Assertions.assertEquals(BindVariable.Kind.TEXT, BindVariable.of("text").getKind());
		Assertions.assertEquals(BindVariable.Kind.TEXT, BindVariable.of(new StringBuilder("built")).getKind());

		BindVariable existing = BindVariable.ofString("as-is");
		Assertions.assertSame(existing, BindVariable.of(existing), "Bind variables should pass through unchanged");
	}

	@Test
	public void testUnsupportedTypesAreRejected() {
		for (Object value : List.of(BigInteger.ONE, UUID.randomUUID(), 'c', new Object(), new int[0])) {
			BindTypeException e = Assertions.assertThrows(BindTypeException.class, () -> BindVariable.of(value));
			Assertions.assertEquals(value.getClass(), e.getRejectedType().orElse(null));
		}

		BindTypeException e = Assertions.assertThrows(BindTypeException.class, () -> BindVariable.of(null));
		Assertions.assertTrue(e.getRejectedType().isEmpty());
	}

	@Test
	public void testTagStringMatchesVariables() {
		List<BindVariable> variables = List.of(
				BindVariable.of(42),
				BindVariable.of(false),
				BindVariable.of(2.5),
				BindVariable.of("hello"),
				BindVariable.of(7L));

		String tags = BindType.tagStringFor(variables);

		Assertions.assertEquals("iidsi", tags);
		Assertions.assertEquals("", BindType.tagStringFor(List.of()));
	}

	@Test
	public void testTagStringLengthAlwaysMatches() {
		Object[] samples = {1, true, 0.25, "s", -3L, false, "", Double.NaN};
		List<BindVariable> variables = new ArrayList<>();

		for (int n = 0; n < 40; ++n) {
			String tags = BindType.tagStringFor(variables);

			Assertions.assertEquals(variables.size(), tags.length());

			for (int i = 0; i < tags.length(); ++i)
				Assertions.assertEquals(variables.get(i).getBindType(), BindType.fromTag(tags.charAt(i)).orElseThrow(),
						"Tag should match the variable at the same position");

			variables.add(BindVariable.of(samples[n % samples.length]));
		}
	}

	@Test
	public void testConversions() {
		Assertions.assertEquals(1L, BindVariable.ofBoolean(true).toLong());
		Assertions.assertEquals(0L, BindVariable.ofBoolean(false).toLong());
		Assertions.assertEquals("1", BindVariable.ofBoolean(true).toText());
		Assertions.assertEquals(3.0, BindVariable.ofInteger(3).toDouble());
		Assertions.assertEquals("2.5", BindVariable.ofDouble(2.5).toText());

		Assertions.assertThrows(BindTypeException.class, () -> BindVariable.ofString("3").toLong());
		Assertions.assertThrows(BindTypeException.class, () -> BindVariable.ofDouble(3.0).toLong());
		Assertions.assertThrows(BindTypeException.class, () -> BindVariable.ofString("3.0").toDouble());
	}

	@Test
	public void testBoundParameters() {
		List<BindVariable> variables = List.of(BindVariable.of(1), BindVariable.of("a"));

		BoundParameters inferred = BoundParameters.fromVariables(variables);

		Assertions.assertEquals("is", inferred.getTypeTags());
		Assertions.assertEquals(variables, inferred.getVariables());
		Assertions.assertEquals(inferred, BoundParameters.of("is", variables));
		Assertions.assertTrue(BoundParameters.fromVariables(List.of()).isEmpty());

		Assertions.assertThrows(IllegalArgumentException.class, () -> BoundParameters.of("i", variables),
				"Tag count must match variable count");
		Assertions.assertThrows(IllegalArgumentException.class, () -> BoundParameters.of("isd", variables),
				"Tag count must match variable count");
		Assertions.assertThrows(IllegalArgumentException.class, () -> BoundParameters.of("ix", variables),
				"Unknown tags must be rejected");
	}
}

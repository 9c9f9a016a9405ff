// Copyright 2020 The Whiley Project Developers
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package solboogie.tasks;

import static org.junit.jupiter.api.Assertions.*;
import static solboogie.core.SolidityType.*;

import org.junit.jupiter.api.Test;

import solboogie.core.SolidityType;
import solboogie.util.InternalFailure;

public class TypeClassifierTest {

	@Test
	public void fixedWidthTypes() {
		assertTrue(TypeClassifier.isBitPrecise(UINT(8)));
		assertTrue(TypeClassifier.isBitPrecise(INT(256)));
		assertTrue(TypeClassifier.isBitPrecise(BYTES(4)));
		assertTrue(TypeClassifier.isBitPrecise(ENUM("Colour", 3)));
		assertFalse(TypeClassifier.isBitPrecise(ADDRESS));
		assertFalse(TypeClassifier.isBitPrecise(BOOL));
		assertFalse(TypeClassifier.isBitPrecise(OTHER("mapping(address => uint256)")));
	}

	@Test
	public void tuples() {
		assertTrue(TypeClassifier.isBitPrecise(TUPLE(UINT(8), INT(16))));
		assertTrue(TypeClassifier.isBitPrecise(TUPLE(UINT(8), null)));
		assertTrue(TypeClassifier.isBitPrecise(TUPLE(TUPLE(BYTES(1)), ENUM("E", 2))));
		assertFalse(TypeClassifier.isBitPrecise(TUPLE(UINT(8), ADDRESS)));
		assertTrue(TypeClassifier.isBitPrecise(TUPLE()));
	}

	@Test
	public void bits() {
		assertEquals(8, TypeClassifier.getBits(UINT(8)));
		assertEquals(128, TypeClassifier.getBits(INT(128)));
		assertEquals(32, TypeClassifier.getBits(BYTES(4)));
		assertEquals(256, TypeClassifier.getBits(BYTES(32)));
		assertEquals(256, TypeClassifier.getBits(ENUM("Colour", 3)));
	}

	@Test
	public void sign() {
		assertFalse(TypeClassifier.isSigned(UINT(64)));
		assertTrue(TypeClassifier.isSigned(INT(64)));
		assertFalse(TypeClassifier.isSigned(BYTES(2)));
		assertFalse(TypeClassifier.isSigned(ENUM("Colour", 3)));
	}

	@Test
	public void notFixedWidth() {
		assertThrows(InternalFailure.class, () -> TypeClassifier.getBits(ADDRESS));
		assertThrows(InternalFailure.class, () -> TypeClassifier.isSigned(BOOL));
		SolidityType tuple = TUPLE(UINT(8));
		assertThrows(InternalFailure.class, () -> TypeClassifier.getBits(tuple));
	}

	@Test
	public void invalidWidths() {
		assertThrows(IllegalArgumentException.class, () -> UINT(7));
		assertThrows(IllegalArgumentException.class, () -> INT(264));
		assertThrows(IllegalArgumentException.class, () -> BYTES(33));
	}
}

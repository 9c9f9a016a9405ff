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
import static solboogie.core.BoogieFile.CONST;
import static solboogie.core.BoogieFile.VAR;

import java.math.BigInteger;

import org.junit.jupiter.api.Test;

import solboogie.core.BoogieFile.Expr;
import solboogie.core.SolidityType;
import solboogie.testing.BoogieEvaluator;
import solboogie.util.InternalFailure;

public class RangeConditionsTest {

	private static boolean inRange(long value, SolidityType type) {
		return inRange(BigInteger.valueOf(value), type);
	}

	private static boolean inRange(BigInteger value, SolidityType type) {
		Expr.Logical tcc = RangeConditions.getTCCforExpr(VAR("x"), type);
		return new BoogieEvaluator().set("x", value).evalBool(tcc);
	}

	@Test
	public void unsigned() {
		SolidityType u8 = SolidityType.UINT(8);
		assertTrue(inRange(0, u8));
		assertTrue(inRange(255, u8));
		assertFalse(inRange(256, u8));
		assertFalse(inRange(-1, u8));
	}

	@Test
	public void signed() {
		SolidityType s8 = SolidityType.INT(8);
		assertTrue(inRange(-128, s8));
		assertTrue(inRange(127, s8));
		assertFalse(inRange(128, s8));
		assertFalse(inRange(-129, s8));
	}

	@Test
	public void wideIntegers() {
		SolidityType u256 = SolidityType.UINT(256);
		BigInteger max = BigInteger.TWO.pow(256).subtract(BigInteger.ONE);
		assertTrue(inRange(max, u256));
		assertFalse(inRange(max.add(BigInteger.ONE), u256));
		SolidityType s256 = SolidityType.INT(256);
		assertTrue(inRange(BigInteger.TWO.pow(255).negate(), s256));
		assertFalse(inRange(BigInteger.TWO.pow(255), s256));
	}

	@Test
	public void fixedBytes() {
		SolidityType b2 = SolidityType.BYTES(2);
		assertTrue(inRange(65535, b2));
		assertFalse(inRange(65536, b2));
		assertFalse(inRange(-1, b2));
	}

	@Test
	public void enumeration() {
		SolidityType e = SolidityType.ENUM("Colour", 3);
		assertTrue(inRange(0, e));
		assertTrue(inRange(2, e));
		assertFalse(inRange(3, e));
		assertFalse(inRange(-1, e));
	}

	@Test
	public void otherTypesAreUnconstrained() {
		Expr.Logical tcc = RangeConditions.getTCCforExpr(VAR("x"), SolidityType.ADDRESS);
		assertTrue(tcc instanceof Expr.Boolean);
		assertTrue(((Expr.Boolean) tcc).getValue());
		assertTrue(((Expr.Boolean) RangeConditions.getTCCforExpr(CONST(1), SolidityType.BOOL)).getValue());
	}

	@Test
	public void tuplesHaveNoSingleRange() {
		SolidityType tuple = SolidityType.TUPLE(SolidityType.UINT(8));
		assertThrows(InternalFailure.class, () -> RangeConditions.getTCCforExpr(VAR("x"), tuple));
	}

	@Test
	public void bounds() {
		assertEquals(BigInteger.valueOf(256), RangeConditions.modulus(8));
		assertEquals(BigInteger.valueOf(255), RangeConditions.largestUnsigned(8));
		assertEquals(BigInteger.valueOf(127), RangeConditions.largestSigned(8));
		assertEquals(BigInteger.valueOf(-128), RangeConditions.smallestSigned(8));
	}
}

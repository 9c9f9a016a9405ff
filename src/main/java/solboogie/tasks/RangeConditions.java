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

import static solboogie.core.BoogieFile.*;

import java.math.BigInteger;

import solboogie.core.BoogieFile.Expr;
import solboogie.core.SolidityType;
import solboogie.core.SolidityType.EnumType;

/**
 * Generates type-correctness conditions (TCCs). A TCC states that an unbounded
 * integer lies within the range of values representable by a given Solidity
 * type. They are used by the modular encoding, where values are held in
 * mathematical integers and the range is otherwise lost.
 */
public class RangeConditions {
	private static final BigInteger TWO = BigInteger.valueOf(2);

	private RangeConditions() {

	}

	/**
	 * Construct the condition under which <code>expr</code> holds a valid value of
	 * type <code>type</code>. For types which are not bit precise this is simply
	 * <code>true</code>.
	 *
	 * @param expr
	 * @param type
	 * @return
	 */
	public static Expr.Logical getTCCforExpr(Expr expr, SolidityType type) {
		if (type instanceof EnumType) {
			int members = ((EnumType) type).getMemberCount();
			return AND(LTEQ(CONST(0), expr), LT(expr, CONST(members)));
		} else if (TypeClassifier.isBitPrecise(type)) {
			int bits = TypeClassifier.getBits(type);
			if (TypeClassifier.isSigned(type)) {
				return AND(LTEQ(CONST(smallestSigned(bits)), expr), LTEQ(expr, CONST(largestSigned(bits))));
			} else {
				return AND(LTEQ(CONST(0), expr), LTEQ(expr, CONST(largestUnsigned(bits))));
			}
		}
		return CONST(true);
	}

	/**
	 * Returns <code>2^bits</code>, the number of distinct values of the given
	 * width.
	 */
	public static BigInteger modulus(int bits) {
		return TWO.pow(bits);
	}

	public static BigInteger largestUnsigned(int bits) {
		return modulus(bits).subtract(BigInteger.ONE);
	}

	public static BigInteger largestSigned(int bits) {
		return TWO.pow(bits - 1).subtract(BigInteger.ONE);
	}

	public static BigInteger smallestSigned(int bits) {
		return TWO.pow(bits - 1).negate();
	}
}

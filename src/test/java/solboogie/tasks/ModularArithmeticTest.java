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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BinaryOperator;
import java.util.stream.Stream;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import solboogie.core.BoogieFile.Expr;
import solboogie.core.SourceLocation;
import solboogie.core.SourceNode;
import solboogie.core.Token;
import solboogie.tasks.ArithmeticEncoder.ExprWithCC;
import solboogie.tasks.BoogieContext.Encoding;
import solboogie.testing.BoogieEvaluator;
import solboogie.util.Diagnostics;

/**
 * Checks every pair of 8-bit operands against two's complement semantics. The
 * modular encoding must produce the wrapped value, with an overflow condition
 * that holds exactly when no wrapping occurred. The bit-vector encoding must
 * agree with it bit for bit.
 */
public class ModularArithmeticTest {
	private static final int BITS = 8;
	private static final SourceNode NODE = () -> new SourceLocation("Overflow.sol", 1, 1);

	private static Stream<Arguments> operators() {
		List<Arguments> args = new ArrayList<>();
		for (boolean signed : new boolean[] { false, true }) {
			args.add(Arguments.of(Token.ADD, signed, (BinaryOperator<BigInteger>) BigInteger::add));
			args.add(Arguments.of(Token.SUB, signed, (BinaryOperator<BigInteger>) BigInteger::subtract));
			args.add(Arguments.of(Token.MUL, signed, (BinaryOperator<BigInteger>) BigInteger::multiply));
			args.add(Arguments.of(Token.DIV, signed, (BinaryOperator<BigInteger>) BigInteger::divide));
		}
		return args.stream();
	}

	@ParameterizedTest
	@MethodSource("operators")
	public void exhaustive(Token op, boolean signed, BinaryOperator<BigInteger> semantics) {
		Diagnostics diagnostics = new Diagnostics();
		BoogieContext mod = new BoogieContext(Encoding.MOD, true, diagnostics);
		BoogieContext bv = new BoogieContext(Encoding.BV, true, diagnostics);
		BigInteger min = signed ? RangeConditions.smallestSigned(BITS) : BigInteger.ZERO;
		BigInteger max = signed ? RangeConditions.largestSigned(BITS) : RangeConditions.largestUnsigned(BITS);
		BoogieEvaluator evaluator = new BoogieEvaluator();
		for (BigInteger x = min; x.compareTo(max) <= 0; x = x.add(BigInteger.ONE)) {
			for (BigInteger y = min; y.compareTo(max) <= 0; y = y.add(BigInteger.ONE)) {
				if (op == Token.DIV && y.signum() == 0) {
					continue;
				}
				BigInteger exact = semantics.apply(x, y);
				BigInteger unsigned = BoogieEvaluator.toUnsigned(exact, BITS);
				BigInteger expected = signed ? BoogieEvaluator.toSigned(unsigned, BITS) : unsigned;
				boolean inRange = exact.compareTo(min) >= 0 && exact.compareTo(max) <= 0;
				//
				ExprWithCC m = ArithmeticEncoder.encodeArithBinaryOp(mod, NODE, op, CONST(x), CONST(y), BITS, signed);
				String what = x + " " + op + " " + y;
				assertEquals(expected, evaluator.evalInt(m.getExpr()), what);
				assertEquals(inRange, evaluator.evalBool(m.getCC()), what);
				//
				Expr lhs = CONST(BoogieEvaluator.toUnsigned(x, BITS), BITS);
				Expr rhs = CONST(BoogieEvaluator.toUnsigned(y, BITS), BITS);
				ExprWithCC b = ArithmeticEncoder.encodeArithBinaryOp(bv, NODE, op, lhs, rhs, BITS, signed);
				assertFalse(b.hasCC());
				assertEquals(unsigned, evaluator.evalInt(b.getExpr()), what);
			}
		}
		assertFalse(diagnostics.hasErrors());
	}
}

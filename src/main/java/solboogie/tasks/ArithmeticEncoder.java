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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import solboogie.core.BoogieFile.Expr;
import solboogie.core.SourceNode;
import solboogie.core.Token;
import solboogie.util.InternalFailure;

/**
 * Encodes Solidity arithmetic and comparison operators as Boogie expressions
 * under the arithmetic encoding selected by the {@link BoogieContext}. Three
 * encodings are supported:
 *
 * <ul>
 * <li><b>int</b>. Operators map directly onto Boogie's unbounded integers.
 * Overflow is not modelled.</li>
 * <li><b>bv</b>. Operators map onto bit-vector primitives of the operand
 * width, which wrap around exactly as the EVM does.</li>
 * <li><b>mod</b>. Operands are unbounded integers, but each result is brought
 * back into range with an explicit wraparound. The exact result is compared
 * against the wrapped one to give a <i>computation condition</i>, which holds
 * only when no overflow occurred.</li>
 * </ul>
 *
 * Operators which an encoding cannot express are reported through the context
 * and yield the {@link BoogieNames#ERR_EXPR} placeholder, so translation can
 * carry on and report further errors.
 */
public class ArithmeticEncoder {
	private static final Logger logger = LoggerFactory.getLogger(ArithmeticEncoder.class);

	/**
	 * Upper bound on the size (in bits) of a constant-folded power.
	 */
	private static final long MAX_POWER_BITS = 1 << 16;

	/**
	 * The result of encoding an operator, along with its computation condition.
	 * A <code>null</code> condition means the result is always exact.
	 */
	public static final class ExprWithCC {
		private final Expr expr;
		private final Expr.Logical cc;

		public ExprWithCC(Expr expr, Expr.Logical cc) {
			if (expr == null) {
				throw new IllegalArgumentException("expression cannot be null");
			}
			this.expr = expr;
			this.cc = cc;
		}

		public Expr getExpr() {
			return expr;
		}

		public Expr.Logical getCC() {
			return cc;
		}

		public boolean hasCC() {
			return cc != null;
		}

		@Override
		public String toString() {
			return "(" + expr + ", " + cc + ")";
		}
	}

	private ArithmeticEncoder() {

	}

	/**
	 * Encode a binary operator. Compound assignments (e.g. <code>+=</code>) are
	 * encoded as their underlying operator.
	 *
	 * @param context        Determines the encoding, and receives any errors.
	 * @param associatedNode Source node errors are attributed to.
	 * @param op             The operator being encoded.
	 * @param lhs            Encoded left operand.
	 * @param rhs            Encoded right operand.
	 * @param bits           Width of the operands.
	 * @param isSigned       Whether the operands are signed.
	 * @return
	 */
	public static ExprWithCC encodeArithBinaryOp(BoogieContext context, SourceNode associatedNode, Token op, Expr lhs,
			Expr rhs, int bits, boolean isSigned) {
		logger.debug("encoding {} ({} bits, signed={}) in '{}' encoding", op, bits, isSigned, context.encoding());
		switch (context.encoding()) {
		case INT:
			return new ExprWithCC(encodeIntBinaryOp(context, associatedNode, op, lhs, rhs), null);
		case BV:
			return new ExprWithCC(encodeBvBinaryOp(context, associatedNode, op, lhs, rhs, bits, isSigned), null);
		case MOD:
			return encodeModBinaryOp(context, associatedNode, op, lhs, rhs, bits, isSigned);
		default:
			throw new InternalFailure("Unknown arithmetic encoding", associatedNode);
		}
	}

	/**
	 * Encode a unary operator, namely negation (<code>-</code>) or bitwise
	 * complement (<code>~</code>).
	 *
	 * @param context
	 * @param associatedNode
	 * @param op
	 * @param operand
	 * @param bits
	 * @param isSigned
	 * @return
	 */
	public static ExprWithCC encodeArithUnaryOp(BoogieContext context, SourceNode associatedNode, Token op,
			Expr operand, int bits, boolean isSigned) {
		logger.debug("encoding unary {} ({} bits, signed={}) in '{}' encoding", op, bits, isSigned,
				context.encoding());
		switch (context.encoding()) {
		case INT:
			if (op == Token.SUB) {
				return new ExprWithCC(NEG(operand), null);
			}
			break;
		case BV:
			if (op == Token.SUB) {
				return new ExprWithCC(context.bvNeg(bits, operand), null);
			} else if (op == Token.BIT_NOT) {
				return new ExprWithCC(context.bvNot(bits, operand), null);
			}
			break;
		case MOD:
			if (op == Token.SUB) {
				Expr neg = NEG(operand);
				Expr result;
				if (isSigned) {
					Expr smallest = CONST(RangeConditions.smallestSigned(bits));
					result = ITE(EQ(operand, smallest), smallest, neg);
				} else {
					Expr modulo = CONST(RangeConditions.modulus(bits));
					result = ITE(EQ(operand, CONST(0)), CONST(0), SUB(modulo, operand));
				}
				return new ExprWithCC(result, EQ(neg, result));
			}
			break;
		default:
			throw new InternalFailure("Unknown arithmetic encoding", associatedNode);
		}
		return error(context, associatedNode, "Unsupported unary operator in '" + context.encoding() + "' encoding " + op);
	}

	// =========================================================================
	// Mathematical integers
	// =========================================================================

	private static Expr encodeIntBinaryOp(BoogieContext context, SourceNode node, Token op, Expr lhs, Expr rhs) {
		switch (op.getOperator()) {
		case ADD:
			return ADD(lhs, rhs);
		case SUB:
			return SUB(lhs, rhs);
		case MUL:
			return MUL(lhs, rhs);
		case DIV:
			return truncatingDiv(lhs, rhs);
		case MOD:
			return truncatingRem(lhs, rhs);
		case LESS_THAN:
			return LT(lhs, rhs);
		case GREATER_THAN:
			return GT(lhs, rhs);
		case LESS_THAN_OR_EQUAL:
			return LTEQ(lhs, rhs);
		case GREATER_THAN_OR_EQUAL:
			return GTEQ(lhs, rhs);
		case EXP: {
			BigInteger power = foldPower(lhs, rhs);
			if (power != null) {
				return CONST(power);
			}
			return error(context, node, "Exponentiation is not supported in 'int' encoding").getExpr();
		}
		default:
			return error(context, node, "Unsupported binary operator in 'int' encoding " + op).getExpr();
		}
	}

	// =========================================================================
	// Bit-vectors
	// =========================================================================

	private static Expr encodeBvBinaryOp(BoogieContext context, SourceNode node, Token op, Expr lhs, Expr rhs,
			int bits, boolean isSigned) {
		switch (op.getOperator()) {
		case ADD:
			return context.bvAdd(bits, lhs, rhs);
		case SUB:
			return context.bvSub(bits, lhs, rhs);
		case MUL:
			return context.bvMul(bits, lhs, rhs);
		case DIV:
			return isSigned ? context.bvSDiv(bits, lhs, rhs) : context.bvUDiv(bits, lhs, rhs);
		case BIT_AND:
			return context.bvAnd(bits, lhs, rhs);
		case BIT_OR:
			return context.bvOr(bits, lhs, rhs);
		case BIT_XOR:
			return context.bvXor(bits, lhs, rhs);
		case SAR:
			return isSigned ? context.bvAShr(bits, lhs, rhs) : context.bvLShr(bits, lhs, rhs);
		case SHL:
			return context.bvShl(bits, lhs, rhs);
		case LESS_THAN:
			return isSigned ? context.bvSlt(bits, lhs, rhs) : context.bvUlt(bits, lhs, rhs);
		case GREATER_THAN:
			return isSigned ? context.bvSgt(bits, lhs, rhs) : context.bvUgt(bits, lhs, rhs);
		case LESS_THAN_OR_EQUAL:
			return isSigned ? context.bvSle(bits, lhs, rhs) : context.bvUle(bits, lhs, rhs);
		case GREATER_THAN_OR_EQUAL:
			return isSigned ? context.bvSge(bits, lhs, rhs) : context.bvUge(bits, lhs, rhs);
		case EXP: {
			if (lhs instanceof Expr.BitVector && rhs instanceof Expr.BitVector) {
				BigInteger base = ((Expr.BitVector) lhs).getValue();
				BigInteger exponent = ((Expr.BitVector) rhs).getValue();
				BigInteger power = base.modPow(exponent, RangeConditions.modulus(bits));
				return context.intLit(power, bits);
			}
			return error(context, node, "Exponentiation is not supported in 'bv' encoding").getExpr();
		}
		default:
			return error(context, node, "Unsupported binary operator in 'bv' encoding " + op).getExpr();
		}
	}

	// =========================================================================
	// Modular arithmetic
	// =========================================================================

	private static ExprWithCC encodeModBinaryOp(BoogieContext context, SourceNode node, Token op, Expr lhs, Expr rhs,
			int bits, boolean isSigned) {
		Expr modulo = CONST(RangeConditions.modulus(bits));
		Expr largestSigned = CONST(RangeConditions.largestSigned(bits));
		Expr smallestSigned = CONST(RangeConditions.smallestSigned(bits));
		switch (op.getOperator()) {
		case ADD: {
			Expr sum = ADD(lhs, rhs);
			Expr result;
			if (isSigned) {
				result = wrapSigned(sum, modulo, largestSigned, smallestSigned);
			} else {
				result = ITE(GTEQ(sum, modulo), SUB(sum, modulo), sum);
			}
			return new ExprWithCC(result, EQ(sum, result));
		}
		case SUB: {
			Expr diff = SUB(lhs, rhs);
			Expr result;
			if (isSigned) {
				result = wrapSigned(diff, modulo, largestSigned, smallestSigned);
			} else {
				result = ITE(GTEQ(lhs, rhs), diff, ADD(diff, modulo));
			}
			return new ExprWithCC(result, EQ(diff, result));
		}
		case MUL: {
			Expr prod = MUL(lhs, rhs);
			Expr result;
			if (isSigned) {
				// Multiply the two's complement representations, then map back
				Expr lhs1 = ITE(GTEQ(lhs, CONST(0)), lhs, ADD(modulo, lhs));
				Expr rhs1 = ITE(GTEQ(rhs, CONST(0)), rhs, ADD(modulo, rhs));
				Expr wrapped = REM(MUL(lhs1, rhs1), modulo);
				result = ITE(GT(wrapped, largestSigned), SUB(wrapped, modulo), wrapped);
			} else {
				result = ITE(GTEQ(prod, modulo), REM(prod, modulo), prod);
			}
			return new ExprWithCC(result, EQ(prod, result));
		}
		case DIV: {
			Expr div = truncatingDiv(lhs, rhs);
			Expr result;
			if (isSigned) {
				result = wrapSigned(div, modulo, largestSigned, smallestSigned);
			} else {
				result = div;
			}
			return new ExprWithCC(result, EQ(div, result));
		}
		case LESS_THAN:
			return new ExprWithCC(LT(lhs, rhs), null);
		case GREATER_THAN:
			return new ExprWithCC(GT(lhs, rhs), null);
		case LESS_THAN_OR_EQUAL:
			return new ExprWithCC(LTEQ(lhs, rhs), null);
		case GREATER_THAN_OR_EQUAL:
			return new ExprWithCC(GTEQ(lhs, rhs), null);
		case EXP: {
			BigInteger power = foldPower(lhs, rhs);
			if (power != null) {
				BigInteger range = RangeConditions.modulus(isSigned ? bits - 1 : bits);
				// The wrapped power keeps the sign of the base
				Expr result = context.intLit(power.remainder(range), bits);
				return new ExprWithCC(result, EQ(context.intLit(power, bits), result));
			}
			return error(context, node, "Exponentiation is not supported in 'mod' encoding");
		}
		default:
			return error(context, node, "Unsupported binary operator in 'mod' encoding " + op);
		}
	}

	/**
	 * Bring a value which is at most one modulus out of the signed range back into
	 * it.
	 */
	private static Expr wrapSigned(Expr value, Expr modulo, Expr largestSigned, Expr smallestSigned) {
		return ITE(GT(value, largestSigned), SUB(value, modulo),
				ITE(LT(value, smallestSigned), ADD(value, modulo), value));
	}

	/**
	 * Integer division rounding towards zero. Boogie's <code>div</code> is
	 * Euclidean, so its quotient is one too small (for a positive divisor) or one
	 * too large (for a negative divisor) when the dividend is negative and the
	 * division is inexact.
	 */
	private static Expr truncatingDiv(Expr lhs, Expr rhs) {
		Expr quotient = IDIV(lhs, rhs);
		Expr.Logical exact = OR(GTEQ(lhs, CONST(0)), EQ(MUL(quotient, rhs), lhs));
		return ITE(exact, quotient, ADD(quotient, ITE(GT(rhs, CONST(0)), CONST(1), CONST(-1))));
	}

	/**
	 * Remainder taking the sign of the dividend, such that
	 * <code>lhs == rhs * truncatingDiv(lhs, rhs) + truncatingRem(lhs, rhs)</code>.
	 * Boogie's <code>mod</code> is never negative.
	 */
	private static Expr truncatingRem(Expr lhs, Expr rhs) {
		Expr remainder = REM(lhs, rhs);
		Expr.Logical exact = OR(GTEQ(lhs, CONST(0)), EQ(remainder, CONST(0)));
		Expr magnitude = ITE(GTEQ(rhs, CONST(0)), rhs, NEG(rhs));
		return ITE(exact, remainder, SUB(remainder, magnitude));
	}

	/**
	 * Fold an exponentiation of two integer literals, returning <code>null</code>
	 * when either operand is not a literal, the exponent is out of range or the
	 * result would be unreasonably large.
	 */
	private static BigInteger foldPower(Expr lhs, Expr rhs) {
		if (lhs instanceof Expr.Integer && rhs instanceof Expr.Integer) {
			BigInteger base = ((Expr.Integer) lhs).getValue();
			BigInteger exponent = ((Expr.Integer) rhs).getValue();
			if (exponent.signum() < 0 || exponent.bitLength() >= 32) {
				return null;
			} else if (base.abs().compareTo(BigInteger.ONE) > 0
					&& (long) (base.abs().bitLength() - 1) * exponent.intValue() > MAX_POWER_BITS) {
				logger.debug("refusing to fold {} ** {}", base, exponent);
				return null;
			}
			return base.pow(exponent.intValue());
		}
		return null;
	}

	private static ExprWithCC error(BoogieContext context, SourceNode node, String message) {
		context.reportError(node, message);
		return new ExprWithCC(VAR(BoogieNames.ERR_EXPR), null);
	}
}

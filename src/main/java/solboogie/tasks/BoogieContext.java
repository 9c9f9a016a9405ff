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
import java.util.Map;

import solboogie.core.BoogieFile.Decl;
import solboogie.core.BoogieFile.Expr;
import solboogie.core.BoogieFile.Type;
import solboogie.core.SourceNode;
import solboogie.util.Diagnostics;

/**
 * Configuration for one translation run. A context is immutable: the
 * <code>with</code> methods return an adjusted copy, leaving the original
 * untouched. The only mutable object reachable from a context is the
 * {@link Diagnostics} sink, which is append-only.
 */
public final class BoogieContext {

	/**
	 * The arithmetic encodings available for integer operations.
	 */
	public enum Encoding {
		/**
		 * Unbounded mathematical integers.
		 */
		INT("int"),
		/**
		 * Fixed-width bit-vectors.
		 */
		BV("bv"),
		/**
		 * Unbounded integers with explicit modular wraparound.
		 */
		MOD("mod");

		private final String name;

		private Encoding(String name) {
			this.name = name;
		}

		/**
		 * Parse an encoding from its command-line name (<code>int</code>,
		 * <code>bv</code> or <code>mod</code>).
		 *
		 * @param name
		 * @return
		 */
		public static Encoding fromString(String name) {
			for (Encoding e : values()) {
				if (e.name.equals(name)) {
					return e;
				}
			}
			throw new IllegalArgumentException("unknown arithmetic encoding \"" + name + "\"");
		}

		@Override
		public String toString() {
			return name;
		}
	}

	/**
	 * Option key selecting the arithmetic encoding.
	 */
	public static final String OPTION_ARITHMETIC = "arithmetic";
	/**
	 * Option key enabling overflow checking.
	 */
	public static final String OPTION_OVERFLOW = "overflow";

	private final Encoding encoding;
	private final boolean overflow;
	private final Diagnostics diagnostics;
	private final Decl.Variable boogieThis;
	private final Decl.Variable boogieMsgSender;
	private final Decl.Variable boogieMsgValue;
	private final Decl.Variable boogieBalance;

	public BoogieContext(Encoding encoding, boolean overflow, Diagnostics diagnostics) {
		this.encoding = encoding;
		this.overflow = overflow;
		this.diagnostics = diagnostics;
		Type value = intType(encoding, 256);
		this.boogieThis = new Decl.Variable("__this", addressType());
		this.boogieMsgSender = new Decl.Variable("__msg_sender", addressType());
		this.boogieMsgValue = new Decl.Variable("__msg_value", value);
		this.boogieBalance = new Decl.Variable("__balance", new Type.Dictionary(addressType(), value));
	}

	/**
	 * Construct a context from a set of parsed options. Recognised keys are
	 * {@link #OPTION_ARITHMETIC} (defaulting to <code>int</code>) and
	 * {@link #OPTION_OVERFLOW} (defaulting to <code>false</code>).
	 *
	 * @param options
	 * @param diagnostics
	 * @return
	 */
	public static BoogieContext fromOptions(Map<String, String> options, Diagnostics diagnostics) {
		String arithmetic = options.getOrDefault(OPTION_ARITHMETIC, Encoding.INT.toString());
		boolean overflow = Boolean.parseBoolean(options.getOrDefault(OPTION_OVERFLOW, "false"));
		return new BoogieContext(Encoding.fromString(arithmetic.trim()), overflow, diagnostics);
	}

	public BoogieContext withEncoding(Encoding encoding) {
		return new BoogieContext(encoding, overflow, diagnostics);
	}

	public BoogieContext withOverflow(boolean flag) {
		return new BoogieContext(encoding, flag, diagnostics);
	}

	public Encoding encoding() {
		return encoding;
	}

	/**
	 * Check whether overflow conditions should be generated for this run.
	 *
	 * @return
	 */
	public boolean overflow() {
		return overflow;
	}

	/**
	 * Check whether integers are modelled with fixed width (i.e. either the
	 * bit-vector or modular encoding is active).
	 *
	 * @return
	 */
	public boolean isBitPrecise() {
		return encoding != Encoding.INT;
	}

	public Diagnostics getDiagnostics() {
		return diagnostics;
	}

	public void reportError(SourceNode associatedNode, String message) {
		diagnostics.report(associatedNode, message);
	}

	// =========================================================================
	// Global symbols
	// =========================================================================

	public Decl.Variable boogieThis() {
		return boogieThis;
	}

	public Decl.Variable boogieMsgSender() {
		return boogieMsgSender;
	}

	public Decl.Variable boogieMsgValue() {
		return boogieMsgValue;
	}

	public Decl.Variable boogieBalance() {
		return boogieBalance;
	}

	public static Expr.VariableAccess refTo(Decl.Parameter p) {
		return VAR(p.getName());
	}

	// =========================================================================
	// Types
	// =========================================================================

	public Type intType(int bits) {
		return intType(encoding, bits);
	}

	private static Type intType(Encoding encoding, int bits) {
		return encoding == Encoding.BV ? new Type.BitVector(bits) : Type.Int;
	}

	public Type boolType() {
		return Type.Bool;
	}

	public Type addressType() {
		return new Type.Synonym(BoogieNames.BOOGIE_ADDRESS_TYPE);
	}

	public Type bytesType() {
		return new Type.Synonym(BoogieNames.BOOGIE_BYTES_TYPE);
	}

	/**
	 * Construct an integer literal of a given width. Under the bit-vector encoding
	 * this is a bit-vector literal, otherwise it is an unbounded integer.
	 *
	 * @param value
	 * @param bits
	 * @return
	 */
	public Expr intLit(BigInteger value, int bits) {
		if (encoding == Encoding.BV) {
			return CONST(value, bits);
		} else {
			return CONST(value);
		}
	}

	// =========================================================================
	// Bit-vector primitives
	// =========================================================================

	public Expr.Invoke bvAdd(int bits, Expr lhs, Expr rhs) {
		return bvBinaryOp("bvadd", bits, lhs, rhs);
	}

	public Expr.Invoke bvSub(int bits, Expr lhs, Expr rhs) {
		return bvBinaryOp("bvsub", bits, lhs, rhs);
	}

	public Expr.Invoke bvMul(int bits, Expr lhs, Expr rhs) {
		return bvBinaryOp("bvmul", bits, lhs, rhs);
	}

	public Expr.Invoke bvSDiv(int bits, Expr lhs, Expr rhs) {
		return bvBinaryOp("bvsdiv", bits, lhs, rhs);
	}

	public Expr.Invoke bvUDiv(int bits, Expr lhs, Expr rhs) {
		return bvBinaryOp("bvudiv", bits, lhs, rhs);
	}

	public Expr.Invoke bvAnd(int bits, Expr lhs, Expr rhs) {
		return bvBinaryOp("bvand", bits, lhs, rhs);
	}

	public Expr.Invoke bvOr(int bits, Expr lhs, Expr rhs) {
		return bvBinaryOp("bvor", bits, lhs, rhs);
	}

	public Expr.Invoke bvXor(int bits, Expr lhs, Expr rhs) {
		return bvBinaryOp("bvxor", bits, lhs, rhs);
	}

	public Expr.Invoke bvShl(int bits, Expr lhs, Expr rhs) {
		return bvBinaryOp("bvshl", bits, lhs, rhs);
	}

	public Expr.Invoke bvLShr(int bits, Expr lhs, Expr rhs) {
		return bvBinaryOp("bvlshr", bits, lhs, rhs);
	}

	public Expr.Invoke bvAShr(int bits, Expr lhs, Expr rhs) {
		return bvBinaryOp("bvashr", bits, lhs, rhs);
	}

	public Expr.Invoke bvSlt(int bits, Expr lhs, Expr rhs) {
		return bvComparison("bvslt", bits, lhs, rhs);
	}

	public Expr.Invoke bvUlt(int bits, Expr lhs, Expr rhs) {
		return bvComparison("bvult", bits, lhs, rhs);
	}

	public Expr.Invoke bvSgt(int bits, Expr lhs, Expr rhs) {
		return bvComparison("bvsgt", bits, lhs, rhs);
	}

	public Expr.Invoke bvUgt(int bits, Expr lhs, Expr rhs) {
		return bvComparison("bvugt", bits, lhs, rhs);
	}

	public Expr.Invoke bvSle(int bits, Expr lhs, Expr rhs) {
		return bvComparison("bvsle", bits, lhs, rhs);
	}

	public Expr.Invoke bvUle(int bits, Expr lhs, Expr rhs) {
		return bvComparison("bvule", bits, lhs, rhs);
	}

	public Expr.Invoke bvSge(int bits, Expr lhs, Expr rhs) {
		return bvComparison("bvsge", bits, lhs, rhs);
	}

	public Expr.Invoke bvUge(int bits, Expr lhs, Expr rhs) {
		return bvComparison("bvuge", bits, lhs, rhs);
	}

	public Expr.Invoke bvNeg(int bits, Expr operand) {
		return bvUnaryOp("bvneg", bits, operand);
	}

	public Expr.Invoke bvNot(int bits, Expr operand) {
		return bvUnaryOp("bvnot", bits, operand);
	}

	/**
	 * Extend a bit-vector to a larger width by filling with zeros.
	 */
	public Expr.Invoke bvZeroExt(Expr operand, int bits, int resultBits) {
		String name = "bvzeroext_" + bits + "_to_" + resultBits;
		String builtin = "(_ zero_extend " + (resultBits - bits) + ")";
		return bvFunction(name, builtin, operand, new Type.BitVector(bits), new Type.BitVector(resultBits));
	}

	/**
	 * Extend a bit-vector to a larger width by replicating its sign bit.
	 */
	public Expr.Invoke bvSignExt(Expr operand, int bits, int resultBits) {
		String name = "bvsignext_" + bits + "_to_" + resultBits;
		String builtin = "(_ sign_extend " + (resultBits - bits) + ")";
		return bvFunction(name, builtin, operand, new Type.BitVector(bits), new Type.BitVector(resultBits));
	}

	/**
	 * Extract bits <code>high</code> down to <code>low</code> (inclusive) of a
	 * bit-vector.
	 */
	public Expr.Invoke bvExtract(Expr operand, int bits, int high, int low) {
		String name = "bvextract_" + high + "_" + low + "_" + bits;
		String builtin = "(_ extract " + high + " " + low + ")";
		return bvFunction(name, builtin, operand, new Type.BitVector(bits), new Type.BitVector(high - low + 1));
	}

	private static Expr.Invoke bvBinaryOp(String op, int bits, Expr lhs, Expr rhs) {
		Type bv = new Type.BitVector(bits);
		Decl.Function fn = FUNCTION(op + bits, bv, bv, bv, ":bvbuiltin", quote(op));
		return INVOKE(fn.getName(), lhs, rhs, ATTRIBUTE(fn));
	}

	private static Expr.Invoke bvComparison(String op, int bits, Expr lhs, Expr rhs) {
		Type bv = new Type.BitVector(bits);
		Decl.Function fn = FUNCTION(op + bits, bv, bv, Type.Bool, ":bvbuiltin", quote(op));
		return INVOKE(fn.getName(), lhs, rhs, ATTRIBUTE(fn));
	}

	private static Expr.Invoke bvUnaryOp(String op, int bits, Expr operand) {
		Type bv = new Type.BitVector(bits);
		return bvFunction(op + bits, op, operand, bv, bv);
	}

	private static Expr.Invoke bvFunction(String name, String builtin, Expr operand, Type parameter, Type returns) {
		Decl.Function fn = FUNCTION(name, parameter, returns, ":bvbuiltin", quote(builtin));
		return INVOKE(fn.getName(), operand, ATTRIBUTE(fn));
	}

	private static String quote(String s) {
		return "\"" + s + "\"";
	}

	@Override
	public String toString() {
		return "encoding=" + encoding + ", overflow=" + overflow;
	}
}

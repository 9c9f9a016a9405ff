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
package solboogie.testing;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import solboogie.core.BoogieFile.Decl;
import solboogie.core.BoogieFile.Expr;
import solboogie.core.BoogieFile.Stmt;
import solboogie.core.BoogieFile.Type;

/**
 * A small interpreter for the generated Boogie, used to check the meaning of
 * encoded expressions on concrete values. Integers and bit-vectors are both
 * held as <code>BigInteger</code> (bit-vectors as their unsigned value), maps
 * as {@link BoogieMap}. Bit-vector primitives are interpreted according to the
 * <code>bvbuiltin</code> modifier of the function declaration attached to each
 * invocation.
 */
public class BoogieEvaluator {
	private final Map<String, Object> environment = new HashMap<>();
	private final Deque<Boolean> choices = new ArrayDeque<>();

	public BoogieEvaluator set(String var, Object value) {
		if (value instanceof Long || value instanceof java.lang.Integer) {
			value = BigInteger.valueOf(((Number) value).longValue());
		}
		environment.put(var, value);
		return this;
	}

	public Object get(String var) {
		return environment.get(var);
	}

	/**
	 * Determine the outcome of subsequent non-deterministic choices, in order.
	 * The true branch is taken when a choice is <code>true</code>.
	 */
	public BoogieEvaluator choose(boolean... outcomes) {
		for (boolean b : outcomes) {
			choices.add(b);
		}
		return this;
	}

	public BigInteger evalInt(Expr e) {
		return (BigInteger) eval(e);
	}

	public boolean evalBool(Expr e) {
		return (Boolean) eval(e);
	}

	// =========================================================================
	// Statements
	// =========================================================================

	/**
	 * Execute a procedure body with the given arguments bound to its
	 * parameters. Returns <code>false</code> if execution was blocked by an
	 * <code>assume</code> statement.
	 */
	public boolean execute(Decl.Procedure p, Object... arguments) {
		List<Decl.Parameter> params = p.getParmeters();
		if (params.size() != arguments.length) {
			throw new IllegalArgumentException("incorrect number of arguments");
		}
		for (int i = 0; i != arguments.length; ++i) {
			set(params.get(i).getName(), arguments[i]);
		}
		return execute(p.getBody());
	}

	public boolean execute(Stmt s) {
		if (s instanceof Stmt.Assume) {
			return evalBool(((Stmt.Assume) s).getCondition());
		} else if (s instanceof Stmt.Assert) {
			if (!evalBool(((Stmt.Assert) s).getCondition())) {
				throw new AssertionError("assertion failed");
			}
			return true;
		} else if (s instanceof Stmt.Assignment) {
			Stmt.Assignment a = (Stmt.Assignment) s;
			Expr lhs = a.getLeftHandSide();
			if (!(lhs instanceof Expr.VariableAccess)) {
				throw new IllegalArgumentException("can only assign variables");
			}
			environment.put(((Expr.VariableAccess) lhs).getVariable(), eval(a.getRightHandSide()));
			return true;
		} else if (s instanceof Stmt.IfElse) {
			Stmt.IfElse ite = (Stmt.IfElse) s;
			boolean branch;
			if (ite.isNondeterministic()) {
				if (choices.isEmpty()) {
					throw new IllegalStateException("no choice available for if (*)");
				}
				branch = choices.poll();
			} else {
				branch = evalBool(ite.getCondition());
			}
			if (branch) {
				return execute(ite.getTrueBranch());
			} else if (ite.getFalseBranch() != null) {
				return execute(ite.getFalseBranch());
			}
			return true;
		} else if (s instanceof Stmt.Sequence) {
			for (Stmt ith : ((Stmt.Sequence) s).getAll()) {
				if (!execute(ith)) {
					return false;
				}
			}
			return true;
		} else if (s instanceof Stmt.LineComment) {
			return true;
		} else {
			throw new IllegalArgumentException("cannot execute " + s.getClass().getName());
		}
	}

	// =========================================================================
	// Expressions
	// =========================================================================

	public Object eval(Expr e) {
		if (e instanceof Expr.Integer) {
			return ((Expr.Integer) e).getValue();
		} else if (e instanceof Expr.BitVector) {
			return ((Expr.BitVector) e).getValue();
		} else if (e instanceof Expr.Boolean) {
			return ((Expr.Boolean) e).getValue();
		} else if (e instanceof Expr.VariableAccess) {
			String name = ((Expr.VariableAccess) e).getVariable();
			if (!environment.containsKey(name)) {
				throw new IllegalArgumentException("undefined variable " + name);
			}
			return environment.get(name);
		} else if (e instanceof Expr.Addition) {
			Expr.Addition b = (Expr.Addition) e;
			return evalInt(b.getLeftHandSide()).add(evalInt(b.getRightHandSide()));
		} else if (e instanceof Expr.Subtraction) {
			Expr.Subtraction b = (Expr.Subtraction) e;
			return evalInt(b.getLeftHandSide()).subtract(evalInt(b.getRightHandSide()));
		} else if (e instanceof Expr.Multiplication) {
			Expr.Multiplication b = (Expr.Multiplication) e;
			return evalInt(b.getLeftHandSide()).multiply(evalInt(b.getRightHandSide()));
		} else if (e instanceof Expr.IntegerDivision) {
			Expr.IntegerDivision b = (Expr.IntegerDivision) e;
			// Euclidean, as in SMT-LIB, so that lhs == rhs * (lhs div rhs) + lhs mod rhs
			BigInteger lhs = evalInt(b.getLeftHandSide());
			BigInteger rhs = evalInt(b.getRightHandSide());
			return lhs.subtract(lhs.mod(rhs.abs())).divide(rhs);
		} else if (e instanceof Expr.Remainder) {
			Expr.Remainder b = (Expr.Remainder) e;
			return evalInt(b.getLeftHandSide()).mod(evalInt(b.getRightHandSide()).abs());
		} else if (e instanceof Expr.Negation) {
			return evalInt(((Expr.Negation) e).getOperand()).negate();
		} else if (e instanceof Expr.Equals) {
			Expr.Equals b = (Expr.Equals) e;
			return eval(b.getLeftHandSide()).equals(eval(b.getRightHandSide()));
		} else if (e instanceof Expr.NotEquals) {
			Expr.NotEquals b = (Expr.NotEquals) e;
			return !eval(b.getLeftHandSide()).equals(eval(b.getRightHandSide()));
		} else if (e instanceof Expr.LessThan) {
			Expr.LessThan b = (Expr.LessThan) e;
			return evalInt(b.getLeftHandSide()).compareTo(evalInt(b.getRightHandSide())) < 0;
		} else if (e instanceof Expr.LessThanOrEqual) {
			Expr.LessThanOrEqual b = (Expr.LessThanOrEqual) e;
			return evalInt(b.getLeftHandSide()).compareTo(evalInt(b.getRightHandSide())) <= 0;
		} else if (e instanceof Expr.GreaterThan) {
			Expr.GreaterThan b = (Expr.GreaterThan) e;
			return evalInt(b.getLeftHandSide()).compareTo(evalInt(b.getRightHandSide())) > 0;
		} else if (e instanceof Expr.GreaterThanOrEqual) {
			Expr.GreaterThanOrEqual b = (Expr.GreaterThanOrEqual) e;
			return evalInt(b.getLeftHandSide()).compareTo(evalInt(b.getRightHandSide())) >= 0;
		} else if (e instanceof Expr.LogicalAnd) {
			for (Expr.Logical l : ((Expr.LogicalAnd) e).getOperands()) {
				if (!evalBool(l)) {
					return false;
				}
			}
			return true;
		} else if (e instanceof Expr.LogicalOr) {
			for (Expr.Logical l : ((Expr.LogicalOr) e).getOperands()) {
				if (evalBool(l)) {
					return true;
				}
			}
			return false;
		} else if (e instanceof Expr.LogicalNot) {
			return !evalBool(((Expr.LogicalNot) e).getOperand());
		} else if (e instanceof Expr.Conditional) {
			Expr.Conditional c = (Expr.Conditional) e;
			return evalBool(c.getCondition()) ? eval(c.getTrueBranch()) : eval(c.getFalseBranch());
		} else if (e instanceof Expr.DictionaryAccess) {
			Expr.DictionaryAccess d = (Expr.DictionaryAccess) e;
			return ((BoogieMap) eval(d.getSource())).get(eval(d.getIndex()));
		} else if (e instanceof Expr.DictionaryUpdate) {
			Expr.DictionaryUpdate d = (Expr.DictionaryUpdate) e;
			return ((BoogieMap) eval(d.getSource())).put(eval(d.getIndex()), eval(d.getValue()));
		} else if (e instanceof Expr.Tuple) {
			ArrayList<Object> values = new ArrayList<>();
			for (Expr ith : ((Expr.Tuple) e).getElements()) {
				values.add(ith == null ? null : eval(ith));
			}
			return values;
		} else if (e instanceof Expr.Invoke) {
			return evalInvoke((Expr.Invoke) e);
		} else {
			throw new IllegalArgumentException("cannot evaluate " + e.getClass().getName());
		}
	}

	private Object evalInvoke(Expr.Invoke e) {
		Decl.Function fn = e.getAttribute(Decl.Function.class);
		if (fn == null) {
			throw new IllegalArgumentException("uninterpreted function " + e.getName());
		}
		String builtin = getBuiltin(fn);
		int bits = ((Type.BitVector) fn.getParmeters().get(0).getType()).getDigits();
		BigInteger modulus = BigInteger.ONE.shiftLeft(bits);
		List<Expr> args = e.getArguments();
		BigInteger x = evalInt(args.get(0));
		if (args.size() == 1) {
			if (builtin.equals("bvneg")) {
				return x.negate().mod(modulus);
			} else if (builtin.equals("bvnot")) {
				return modulus.subtract(BigInteger.ONE).subtract(x);
			} else if (builtin.startsWith("(_ zero_extend")) {
				return x;
			} else if (builtin.startsWith("(_ sign_extend")) {
				int k = Integer.parseInt(builtin.replaceAll("[^0-9]", ""));
				return toUnsigned(toSigned(x, bits), bits + k);
			} else if (builtin.startsWith("(_ extract")) {
				String[] parts = builtin.replace(")", "").split(" ");
				int high = Integer.parseInt(parts[2]);
				int low = Integer.parseInt(parts[3]);
				return x.shiftRight(low).mod(BigInteger.ONE.shiftLeft(high - low + 1));
			}
		} else {
			BigInteger y = evalInt(args.get(1));
			switch (builtin) {
			case "bvadd":
				return x.add(y).mod(modulus);
			case "bvsub":
				return x.subtract(y).mod(modulus);
			case "bvmul":
				return x.multiply(y).mod(modulus);
			case "bvudiv":
				return x.divide(y);
			case "bvsdiv":
				return toUnsigned(toSigned(x, bits).divide(toSigned(y, bits)), bits);
			case "bvand":
				return x.and(y);
			case "bvor":
				return x.or(y);
			case "bvxor":
				return x.xor(y);
			case "bvshl":
				return y.compareTo(BigInteger.valueOf(bits)) >= 0 ? BigInteger.ZERO : x.shiftLeft(y.intValue()).mod(modulus);
			case "bvlshr":
				return y.compareTo(BigInteger.valueOf(bits)) >= 0 ? BigInteger.ZERO : x.shiftRight(y.intValue());
			case "bvashr": {
				int shift = Math.min(y.min(BigInteger.valueOf(bits)).intValue(), bits);
				return toUnsigned(toSigned(x, bits).shiftRight(shift), bits);
			}
			case "bvult":
				return x.compareTo(y) < 0;
			case "bvule":
				return x.compareTo(y) <= 0;
			case "bvugt":
				return x.compareTo(y) > 0;
			case "bvuge":
				return x.compareTo(y) >= 0;
			case "bvslt":
				return toSigned(x, bits).compareTo(toSigned(y, bits)) < 0;
			case "bvsle":
				return toSigned(x, bits).compareTo(toSigned(y, bits)) <= 0;
			case "bvsgt":
				return toSigned(x, bits).compareTo(toSigned(y, bits)) > 0;
			case "bvsge":
				return toSigned(x, bits).compareTo(toSigned(y, bits)) >= 0;
			}
		}
		throw new IllegalArgumentException("unknown builtin " + builtin);
	}

	private static String getBuiltin(Decl.Function fn) {
		List<String> modifiers = fn.getModifiers();
		for (int i = 0; i < modifiers.size() - 1; ++i) {
			if (modifiers.get(i).equals(":bvbuiltin")) {
				String quoted = modifiers.get(i + 1);
				return quoted.substring(1, quoted.length() - 1);
			}
		}
		throw new IllegalArgumentException("function " + fn.getName() + " is not a builtin");
	}

	public static BigInteger toSigned(BigInteger x, int bits) {
		return x.testBit(bits - 1) ? x.subtract(BigInteger.ONE.shiftLeft(bits)) : x;
	}

	public static BigInteger toUnsigned(BigInteger x, int bits) {
		return x.mod(BigInteger.ONE.shiftLeft(bits));
	}

	/**
	 * An immutable total map, where keys not explicitly stored map to a default
	 * value.
	 */
	public static final class BoogieMap {
		private final Map<Object, Object> entries;
		private final Object defaultValue;

		public BoogieMap(Object defaultValue) {
			this(new HashMap<>(), defaultValue);
		}

		private BoogieMap(Map<Object, Object> entries, Object defaultValue) {
			this.entries = entries;
			this.defaultValue = defaultValue;
		}

		public Object get(Object key) {
			return entries.containsKey(key) ? entries.get(key) : defaultValue;
		}

		public BoogieMap put(Object key, Object value) {
			HashMap<Object, Object> nentries = new HashMap<>(entries);
			nentries.put(key, value);
			return new BoogieMap(nentries, defaultValue);
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof BoogieMap) {
				BoogieMap m = (BoogieMap) o;
				return entries.equals(m.entries) && defaultValue.equals(m.defaultValue);
			}
			return false;
		}

		@Override
		public int hashCode() {
			return entries.hashCode();
		}

		@Override
		public String toString() {
			return entries + " default " + defaultValue;
		}
	}
}

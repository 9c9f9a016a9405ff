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
package solboogie.core;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * The intermediate verification representation produced for Solidity
 * operations. Every item is immutable once constructed, hence sub-trees can be
 * shared freely between expressions (e.g. a balance lookup reused in both
 * branches of a conditional).
 *
 * @author David J. Pearce
 *
 */
public class BoogieFile {
	/**
	 * The list of top-level declarations within this file.
	 */
	private List<Decl> declarations;

	public BoogieFile() {
		this.declarations = new ArrayList<>();
	}

	public List<Decl> getDeclarations() {
		return declarations;
	}

	// =========================================================================
	// Top-Level Item
	// =========================================================================

	public interface Item {
		/**
		 * Get a particular attribute associated with this item.
		 * @param kind
		 * @param <T>
		 * @return
		 */
		public <T> T getAttribute(Class<T> kind);

		/**
		 * Get all attributes within this item.
		 * @return
		 */
		public Attribute[] getAttributes();
	}

	public static class AbstractItem implements Item {
		private final Attribute[] attributes;

		public AbstractItem(Attribute[] attributes) {
			this.attributes = attributes;
		}

		@Override
		public <T> T getAttribute(Class<T> kind) {
			for(int i=0;i!=attributes.length;++i) {
				T ith = attributes[i].as(kind);
				if(ith != null) {
					return ith;
				}
			}
			return null;
		}

		/**
		 * Get all attributes of a given kind, in the order they were attached.
		 *
		 * @param kind
		 * @param <T>
		 * @return
		 */
		public <T> List<T> getAttributes(Class<T> kind) {
			ArrayList<T> matches = new ArrayList<>();
			for(int i=0;i!=attributes.length;++i) {
				T ith = attributes[i].as(kind);
				if(ith != null) {
					matches.add(ith);
				}
			}
			return matches;
		}

		public Attribute[] getAttributes() {
			return attributes;
		}

		public boolean isFalse() {
			return (this instanceof Expr.Boolean) && !((Expr.Boolean) this).getValue();
		}

		public boolean isTrue() {
			return (this instanceof Expr.Boolean) && ((Expr.Boolean) this).getValue();
		}
	}

	// =========================================================================
	// Declarations
	// =========================================================================

	public interface Decl extends Item {

		/**
		 * A function declaration. Functions without a body are uninterpreted unless
		 * a modifier binds them to a solver builtin, such as
		 * <code>{:bvbuiltin "bvadd"}</code> for bit-vector primitives.
		 */
		public static class Function extends AbstractItem implements Decl {
			private final String name;
			private final List<String> modifiers;
			private final List<Parameter> parameters;
			private final Type returns;
			private final Expr body;

			public Function(List<String> modifiers, String name, List<Parameter> parameters, Type returns, Expr body, Attribute... attributes) {
				super(attributes);
				this.modifiers = new ArrayList<>(modifiers);
				this.name = name;
				this.parameters = new ArrayList<>(parameters);
				this.returns = returns;
				this.body = body;
			}

			public String getName() {
				return name;
			}

			public List<String> getModifiers() {
				return modifiers;
			}

			public List<Parameter> getParmeters() {
				return parameters;
			}

			public Type getReturns() {
				return returns;
			}

			public Expr getBody() {
				return body;
			}
		}

		public static class Procedure extends AbstractItem implements Decl {
			private final String name;
			private final List<Parameter> parameters;
			private final List<Parameter> returns;
			private final List<Expr.Logical> requires;
			private final List<Expr.Logical> ensures;
			private final List<String> modifies;
			private final List<Decl.Variable> locals;
			private final Stmt body;

			public Procedure(String name, List<Parameter> parameters, List<Parameter> returns, List<Expr.Logical> requires,
					List<Expr.Logical> ensures, List<String> modifies, Attribute... attributes) {
				this(name, parameters, returns, requires, ensures, Collections.emptyList(), modifies, null, attributes);
			}

			public Procedure(String name, List<Parameter> parameters, List<Parameter> returns, List<Expr.Logical> requires,
							 List<Expr.Logical> ensures, List<Decl.Variable> locals, List<String> modifies, Stmt body, Attribute... attributes) {
				super(attributes);
				if (body == null && locals.size() > 0) {
					throw new IllegalArgumentException("Cannot specify local variables for procedure prototype");
				}
				this.name = name;
				this.parameters = new ArrayList<>(parameters);
				this.returns = new ArrayList<>(returns);
				this.requires = new ArrayList<>(requires);
				this.ensures = new ArrayList<>(ensures);
				this.modifies = new ArrayList<>(modifies);
				this.locals = new ArrayList<>(locals);
				this.body = body;
			}

			public String getName() {
				return name;
			}

			public List<Parameter> getParmeters() {
				return parameters;
			}

			public List<Parameter> getReturns() {
				return returns;
			}

			public List<Expr.Logical> getRequires() {
				return requires;
			}

			public List<Expr.Logical> getEnsures() {
				return ensures;
			}

			public List<String> getModifies() {
				return modifies;
			}

			public List<Decl.Variable> getLocals() {
				return locals;
			}

			public Stmt getBody() {
				return body;
			}
		}

		public static class Parameter extends AbstractItem implements Item {
			private final String name;
			private final Type type;

			public Parameter(String name, Type type, Attribute... attributes) {
				super(attributes);
				this.name = name;
				this.type = type;
			}

			public String getName() {
				return name;
			}

			public Type getType() {
				return type;
			}
		}

		public static class Sequence extends AbstractItem implements Decl {
			private final List<Decl> decls;

			public Sequence(Decl... decls) {
				this(Arrays.asList(decls));
			}

			public Sequence(Collection<? extends Decl> decls, Attribute... attributes) {
				super(attributes);
				this.decls = new ArrayList<>(decls);
			}

			public int size() {
				return decls.size();
			}

			public Decl get(int i) {
				return decls.get(i);
			}

			public List<Decl> getAll() {
				return decls;
			}
		}

		public static class Variable extends Parameter implements Decl {
			public Variable(String name, Type type, Attribute... attributes) {
				super(name, type, attributes);
			}
		}
	};

	// =========================================================================
	// Statements
	// =========================================================================

	public interface Stmt extends Item {

		public static class Assert extends AbstractItem implements Stmt {
			private final Expr.Logical condition;

			private Assert(Expr.Logical condition, Attribute[] attributes) {
				super(attributes);
				this.condition = condition;
			}

			public Expr.Logical getCondition() {
				return condition;
			}
		}

		public static class Assume extends AbstractItem implements Stmt {
			private final Expr.Logical condition;

			private Assume(Expr.Logical condition, Attribute[] attributes) {
				super(attributes);
				this.condition = condition;
			}

			public Expr.Logical getCondition() {
				return condition;
			}
		}

		public static class Assignment extends AbstractItem implements Stmt {
			private final LVal lhs;
			private final Expr rhs;

			private Assignment(LVal lhs, Expr rhs, Attribute[] attributes) {
				super(attributes);
				this.lhs = lhs;
				this.rhs = rhs;
			}

			public LVal getLeftHandSide() {
				return lhs;
			}

			public Expr getRightHandSide() {
				return rhs;
			}
		}

		public static class Call extends AbstractItem implements Stmt {
			private final String name;
			private final List<LVal> lvals;
			private final List<Expr> arguments;

			private Call(String name, List<LVal> lvals, Collection<Expr> arguments, Attribute[] attributes) {
				super(attributes);
				this.name = name;
				this.lvals = new ArrayList<>(lvals);
				this.arguments = new ArrayList<>(arguments);
			}

			public String getName() {
				return name;
			}

			public List<LVal> getLVals() {
				return lvals;
			}

			public List<Expr> getArguments() {
				return arguments;
			}
		}

		/**
		 * A conditional statement. A <code>null</code> condition denotes the
		 * non-deterministic choice <code>if (*)</code>, where either branch may be
		 * taken.
		 */
		public static class IfElse extends AbstractItem implements Stmt {
			private final Expr.Logical condition;
			private final Stmt trueBranch;
			private final Stmt falseBranch;

			private IfElse(Expr.Logical condition, Stmt trueBranch, Stmt falseBranch, Attribute... attributes) {
				super(attributes);
				this.condition = condition;
				this.trueBranch = trueBranch;
				this.falseBranch = falseBranch;
			}

			public Expr.Logical getCondition() {
				return condition;
			}

			public boolean isNondeterministic() {
				return condition == null;
			}

			public Stmt getTrueBranch() {
				return trueBranch;
			}

			public Stmt getFalseBranch() {
				return falseBranch;
			}
		}

		public static class LineComment extends AbstractItem implements Stmt {
			private final String message;

			private LineComment(String message, Attribute[] attributes) {
				super(attributes);
				this.message = message;
			}

			public String getMessage() {
				return message;
			}
		}

		public static class Sequence extends AbstractItem implements Stmt {
			private final List<Stmt> stmts;

			private Sequence(Collection<? extends Stmt> stmts, Attribute[] attributes) {
				super(attributes); this.stmts = new ArrayList<>(stmts);
			}

			public int size() {
				return stmts.size();
			}

			public Stmt get(int i) {
				return stmts.get(i);
			}

			public List<Stmt> getAll() {
				return stmts;
			}
		}
	}

	// =========================================================================
	// Expressions
	// =========================================================================

	public interface Expr extends Item {

		public interface Logical extends Expr {
			public boolean isFalse();
			public boolean isTrue();
		}

		public interface UnaryOperator {
			Expr getOperand();
		}

		public interface BinaryOperator {
			Expr getLeftHandSide();
			Expr getRightHandSide();
		}

		public interface NaryOperator {
			List<? extends Expr> getOperands();
		}

		public static class Equals extends AbstractItem implements Logical,  BinaryOperator {
			private final Expr lhs;
			private final Expr rhs;

			private Equals(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(attributes);
				this.lhs = lhs;
				this.rhs = rhs;
			}

			public Expr getLeftHandSide() {
				return lhs;
			}

			public Expr getRightHandSide() {
				return rhs;
			}
		}

		public static class NotEquals extends AbstractItem implements Logical,  BinaryOperator {
			private final Expr lhs;
			private final Expr rhs;

			private NotEquals(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(attributes);
				this.lhs = lhs;
				this.rhs = rhs;
			}

			public Expr getLeftHandSide() {
				return lhs;
			}

			public Expr getRightHandSide() {
				return rhs;
			}
		}

		public static class LessThan extends AbstractItem implements Logical,  BinaryOperator {
			private final Expr lhs;
			private final Expr rhs;

			private LessThan(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(attributes);
				this.lhs = lhs;
				this.rhs = rhs;
			}

			public Expr getLeftHandSide() {
				return lhs;
			}

			public Expr getRightHandSide() {
				return rhs;
			}
		}

		public static class LessThanOrEqual extends AbstractItem implements Logical,  BinaryOperator {
			private final Expr lhs;
			private final Expr rhs;

			private LessThanOrEqual(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(attributes);
				this.lhs = lhs;
				this.rhs = rhs;
			}

			public Expr getLeftHandSide() {
				return lhs;
			}

			public Expr getRightHandSide() {
				return rhs;
			}
		}

		public static class GreaterThan extends AbstractItem implements Logical,  BinaryOperator {
			private final Expr lhs;
			private final Expr rhs;

			private GreaterThan(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(attributes);
				this.lhs = lhs;
				this.rhs = rhs;
			}

			public Expr getLeftHandSide() {
				return lhs;
			}

			public Expr getRightHandSide() {
				return rhs;
			}
		}

		public static class GreaterThanOrEqual extends AbstractItem implements Logical,  BinaryOperator {
			private final Expr lhs;
			private final Expr rhs;

			private GreaterThanOrEqual(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(attributes);
				this.lhs = lhs;
				this.rhs = rhs;
			}

			public Expr getLeftHandSide() {
				return lhs;
			}

			public Expr getRightHandSide() {
				return rhs;
			}
		}

		public static class Addition extends AbstractItem implements Expr, BinaryOperator {
			private final Expr lhs;
			private final Expr rhs;

			private Addition(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(attributes);
				this.lhs = lhs;
				this.rhs = rhs;
			}

			public Expr getLeftHandSide() {
				return lhs;
			}

			public Expr getRightHandSide() {
				return rhs;
			}
		}

		public static class Subtraction extends AbstractItem implements Expr, BinaryOperator {
			private final Expr lhs;
			private final Expr rhs;

			private Subtraction(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(attributes);
				this.lhs = lhs;
				this.rhs = rhs;
			}

			public Expr getLeftHandSide() {
				return lhs;
			}

			public Expr getRightHandSide() {
				return rhs;
			}
		}

		public static class Multiplication extends AbstractItem implements Expr, BinaryOperator {
			private final Expr lhs;
			private final Expr rhs;

			private Multiplication(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(attributes);
				this.lhs = lhs;
				this.rhs = rhs;
			}

			public Expr getLeftHandSide() {
				return lhs;
			}

			public Expr getRightHandSide() {
				return rhs;
			}
		}

		/**
		 * Integer division which rounds towards zero, as Solidity's
		 * <code>/</code> does on integers.
		 */
		public static class IntegerDivision extends AbstractItem implements Expr, BinaryOperator {
			private final Expr lhs;
			private final Expr rhs;

			private IntegerDivision(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(attributes);
				this.lhs = lhs;
				this.rhs = rhs;
			}

			public Expr getLeftHandSide() {
				return lhs;
			}

			public Expr getRightHandSide() {
				return rhs;
			}
		}

		public static class Remainder extends AbstractItem implements Expr, BinaryOperator {
			private final Expr lhs;
			private final Expr rhs;

			private Remainder(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(attributes);
				this.lhs = lhs;
				this.rhs = rhs;
			}

			public Expr getLeftHandSide() {
				return lhs;
			}

			public Expr getRightHandSide() {
				return rhs;
			}
		}

		public static class Boolean extends AbstractItem implements Logical {
			private final boolean value;

			private Boolean(boolean v, Attribute[] attributes) {
				super(attributes);
				this.value = v;
			}

			public boolean getValue() {
				return value;
			}
		}

		public static class Integer extends AbstractItem implements Expr {
			private final BigInteger value;

			private Integer(BigInteger v, Attribute[] attributes) {
				super(attributes);this.value = v;
			}

			public BigInteger getValue() {
				return value;
			}

			public String toString() {
				return "INT(" + value + ")";
			}
		}

		/**
		 * A bit-vector literal of a fixed width, such as <code>5bv8</code>. The value
		 * is always the unsigned interpretation of the bit pattern.
		 */
		public static class BitVector extends AbstractItem implements Expr {
			private final BigInteger value;
			private final int bits;

			private BitVector(BigInteger v, int bits, Attribute[] attributes) {
				super(attributes);
				if(v.signum() < 0 || v.bitLength() > bits) {
					throw new IllegalArgumentException("bit-vector literal " + v + " does not fit in " + bits + " bits");
				}
				this.value = v;
				this.bits = bits;
			}

			public BigInteger getValue() {
				return value;
			}

			public int getBits() {
				return bits;
			}

			public String toString() {
				return "BV(" + value + "," + bits + ")";
			}
		}

		public static class DictionaryAccess extends AbstractItem implements LVal {
			private final Expr source;
			private final Expr index;

			private DictionaryAccess(Expr source, Expr index, Attribute[] attributes) {
				super(attributes);
				this.source = source;
				this.index = index;
			}

			public Expr getSource() {
				return source;
			}

			public Expr getIndex() {
				return index;
			}

			public String toString() {
				return "GET(" + source + ", " + index + ")";
			}
		}

		public static class DictionaryUpdate extends AbstractItem implements LVal {
			private final Expr source;
			private final Expr index;
			private final Expr value;

			private DictionaryUpdate(Expr source, Expr index, Expr value, Attribute[] attributes) {
				super(attributes);
				this.source = source;
				this.index = index;
				this.value = value;
			}

			public Expr getSource() {
				return source;
			}

			public Expr getIndex() {
				return index;
			}

			public Expr getValue() {
				return value;
			}

			public String toString() {
				return "PUT(" + source + ", " + index + "," + value + ")";
			}
		}

		public static class Invoke extends AbstractItem implements Logical {
			private final String name;
			private final List<Expr> arguments;

			private Invoke(String name, Collection<Expr> arguments, Attribute[] attributes) {
				super(attributes);
				this.name = name;
				this.arguments = new ArrayList<>(arguments);
			}

			public String getName() {
				return name;
			}

			public List<Expr> getArguments() {
				return arguments;
			}

			public String toString() {
				return "FNCALL(" + name + "," + arguments.toString() + ")";
			}
		}

		/**
		 * A conditional expression <code>if c then a else b</code>.
		 */
		public static class Conditional extends AbstractItem implements Expr {
			private final Expr.Logical condition;
			private final Expr trueBranch;
			private final Expr falseBranch;

			private Conditional(Expr.Logical condition, Expr trueBranch, Expr falseBranch, Attribute[] attributes) {
				super(attributes);
				this.condition = condition;
				this.trueBranch = trueBranch;
				this.falseBranch = falseBranch;
			}

			public Expr.Logical getCondition() {
				return condition;
			}

			public Expr getTrueBranch() {
				return trueBranch;
			}

			public Expr getFalseBranch() {
				return falseBranch;
			}

			public String toString() {
				return "ITE(" + condition + "," + trueBranch + "," + falseBranch + ")";
			}
		}

		/**
		 * A tuple of expressions. Elements may be <code>null</code> to indicate a
		 * component which is not assigned (e.g. <code>(x, ) = f()</code>).
		 */
		public static class Tuple extends AbstractItem implements Expr {
			private final List<Expr> elements;

			private Tuple(Collection<Expr> elements, Attribute[] attributes) {
				super(attributes);
				this.elements = new ArrayList<>(elements);
			}

			public int size() {
				return elements.size();
			}

			public Expr get(int i) {
				return elements.get(i);
			}

			public List<Expr> getElements() {
				return elements;
			}

			public String toString() {
				return "TUPLE" + elements;
			}
		}

		public static class Negation extends AbstractItem implements Expr, UnaryOperator {
			private final Expr operand;

			private Negation(Expr operand, Attribute[] attributes) {
				super(attributes);this.operand = operand;
			}

			public Expr getOperand() {
				return operand;
			}
		}

		public static class LogicalNot extends AbstractItem implements Logical,  UnaryOperator {
			private final Expr.Logical operand;

			private LogicalNot(Expr.Logical operand, Attribute[] attributes) {
				super(attributes);
				this.operand = operand;
			}

			public Expr.Logical getOperand() {
				return operand;
			}
		}

		public static class LogicalAnd extends AbstractItem implements Logical,  NaryOperator {
			private final List<Expr.Logical> operands;

			private LogicalAnd(Collection<Expr.Logical> operands, Attribute[] attributes) {
				super(attributes);
				this.operands = new ArrayList<>(operands);
			}

			public List<Expr.Logical> getOperands() {
				return operands;
			}
		}

		public static class LogicalOr extends AbstractItem implements Logical,  NaryOperator {
			private final List<Expr.Logical> operands;

			private LogicalOr(Collection<Expr.Logical> operands, Attribute[] attributes) {
				super(attributes);
				this.operands = new ArrayList<>(operands);
			}

			public List<Expr.Logical> getOperands() {
				return operands;
			}
		}

		public static class VariableAccess extends AbstractItem implements Logical,  LVal {
			private final String variable;

			private VariableAccess(String var, Attribute[] attributes) {
				super(attributes);
				if(var == null) {
					throw new IllegalArgumentException();
				}
				this.variable = var;
			}

			public String getVariable() {
				return variable;
			}

			public String toString() {
				return "VAR(" + variable + ")";
			}
		}
	}

	public interface LVal extends Expr {

	}

	// =========================================================================
	// Types
	// =========================================================================

	public interface Type extends Item {
		public static final Type Bool = new Bool();
		public static final Type Int = new Int();

		public static class Bool extends AbstractItem implements Type {
			public Bool(Attribute... attributes) {
				super(attributes);
			}
		}

		public static class Int extends AbstractItem  implements Type {
			public Int(Attribute... attributes) {
				super(attributes);
			}
		}

		public static class Synonym extends AbstractItem implements Type {
			private final String name;

			public Synonym(String name, Attribute... attributes) {
				super(attributes); this.name = name;
			}

			public String getSynonym() {
				return name;
			}
		}

		public static class BitVector extends AbstractItem implements Type {
			private final int digits;

			public BitVector(int digits, Attribute... attributes) {
				super(attributes); this.digits = digits;
			}

			public int getDigits() {
				return digits;
			}
		}

		public static class Dictionary extends AbstractItem implements Type {
			private final Type key;
			private final Type value;

			public Dictionary(Type key, Type value, Attribute... attributes) {
				super(attributes);
				this.key = key;
				this.value = value;
			}

			public Type getKey() {
				return key;
			}

			public Type getValue() {
				return value;
			}
		}
	}

	// =========================================================================
	// Attributes
	// =========================================================================

	public interface Attribute {
		/**
		 * Get the contents of this attribute as a given kind.  If that doesn't match, then return <code>null</code>.
		 * @param kind
		 * @param <T>
		 * @return
		 */
		public <T> T as(Class<T> kind);
	}

	/**
	 * An attribute which is emitted into the generated Boogie, such as
	 * <code>{:inline 1}</code> or <code>{:message "transfer"}</code>. String
	 * values are quoted when printed, others are printed as is.
	 */
	public static class BoogieAttribute implements Attribute {
		private final String name;
		private final List<Object> values;

		public BoogieAttribute(String name, Object... values) {
			this.name = name;
			this.values = Arrays.asList(values);
		}

		public String getName() {
			return name;
		}

		public List<Object> getValues() {
			return values;
		}

		@Override
		public <T> T as(Class<T> kind) {
			if(kind.isInstance(this)) {
				return (T) this;
			} else {
				return null;
			}
		}

		@Override
		public String toString() {
			return "{:" + name + " " + values + "}";
		}
	}

	// =======================================================
	// Constructor API (for convenience)
	// =======================================================

	public static Attribute ATTRIBUTE(Object o) {
		return new Attribute() {
			@Override
			public <T> T as(Class<T> kind) {
				if(kind.isInstance(o)) {
					return (T) o;
				} else {
					return null;
				}
			}
			@Override
			public String toString() {
				return "ATTR(" + o + ")";
			}
		};
	}

	public static BoogieAttribute ATTRIBUTE(String name, Object... values) {
		return new BoogieAttribute(name, values);
	}

	// Declarations

	public static Decl.Function FUNCTION(String name, BoogieFile.Type parameter, BoogieFile.Type returns, String... attributes) {
		ArrayList<Decl.Parameter> parameters = new ArrayList<>();
		parameters.add(new Decl.Parameter(null, parameter));
		return new Decl.Function(Arrays.asList(attributes), name, parameters, returns, null);
	}

	public static Decl.Function FUNCTION(String name, BoogieFile.Type param1, BoogieFile.Type param2,
			BoogieFile.Type returns, String... attributes) {
		ArrayList<Decl.Parameter> parameters = new ArrayList<>();
		parameters.add(new Decl.Parameter(null, param1));
		parameters.add(new Decl.Parameter(null, param2));
		return new Decl.Function(Arrays.asList(attributes), name, parameters, returns, null);
	}

	public static Decl.Procedure PROCEDURE(String name, List<Decl.Parameter> parameters, List<Decl.Parameter> returns,
			List<String> modifies, Stmt body, Attribute... attributes) {
		return new Decl.Procedure(name, parameters, returns, Collections.emptyList(), Collections.emptyList(),
				Collections.emptyList(), modifies, body, attributes);
	}

	// Statement
	public static Stmt.Assert ASSERT(Expr.Logical condition, Attribute... attributes) {
		return new Stmt.Assert(condition,attributes);
	}
	public static Stmt.Assignment ASSIGN(LVal lhs, Expr rhs, Attribute... attributes) {
		return new Stmt.Assignment(lhs,rhs,attributes);
	}
	public static Stmt.Assume ASSUME(Expr.Logical condition, Attribute... attributes) {
		return new Stmt.Assume(condition,attributes);
	}
	public static Stmt.Call CALL(String name, List<Expr> parameters, Attribute... attributes) {
		return new Stmt.Call(name, Collections.emptyList(), parameters,attributes);
	}
	public static Stmt.Call CALL(String name, List<LVal> lvals, List<Expr> parameters, Attribute... attributes) {
		return new Stmt.Call(name, lvals, parameters,attributes);
	}
	public static Stmt.IfElse IFELSE(Expr.Logical condition, Stmt trueBranch, Stmt falseBranch, Attribute... attributes) {
		return new Stmt.IfElse(condition, trueBranch, falseBranch, attributes);
	}
	/**
	 * Construct a non-deterministic choice between two branches (i.e.
	 * <code>if (*) { ... } else { ... }</code>).
	 */
	public static Stmt.IfElse IFELSE(Stmt trueBranch, Stmt falseBranch, Attribute... attributes) {
		return new Stmt.IfElse(null, trueBranch, falseBranch, attributes);
	}
	public static Stmt.LineComment COMMENT(String message, Attribute... attributes) {
		return new Stmt.LineComment(message, attributes);
	}

	public static Stmt.Sequence SEQUENCE(List<? extends Stmt> stmts, Attribute... attributes) {
		return new Stmt.Sequence(stmts,attributes);
	}

	public static Stmt.Sequence SEQUENCE(Stmt... stmts) {
		return new Stmt.Sequence(Arrays.asList(stmts),new Attribute[0]);
	}

	// Logical Operators
	public static Expr.Logical AND(List<Expr.Logical> operands, Attribute... attributes) {
		ArrayList<Expr.Logical> noperands = new ArrayList<>();
		for(int i=0;i!=operands.size();++i) {
			Expr.Logical ith = operands.get(i);
			if (ith.isFalse()) {
				return new Expr.Boolean(false, attributes);
			} else if (!ith.isTrue()) {
				noperands.add(ith);
			}
		}
		switch (noperands.size()) {
			case 0:
				return new Expr.Boolean(true,attributes);
			case 1:
				return noperands.get(0);
			default:
				return new Expr.LogicalAnd(noperands, attributes);
		}
	}

	public static Expr.Logical AND(Expr.Logical operand1, Expr.Logical operand2, Attribute... attributes) {
		return AND(Arrays.asList(operand1, operand2),attributes);
	}

	public static Expr.Logical NOT(Expr.Logical lhs, Attribute... attributes) {
		if(lhs.isFalse()) {
			return new Expr.Boolean(true,attributes);
		} else if(lhs.isTrue()) {
			return new Expr.Boolean(false,attributes);
		} else {
			return new Expr.LogicalNot(lhs, attributes);
		}
	}

	public static Expr.Logical OR(List<Expr.Logical> operands, Attribute... attributes) {
		ArrayList<Expr.Logical> noperands = new ArrayList<>();
		for(int i=0;i!=operands.size();++i) {
			Expr.Logical ith = operands.get(i);
			if(ith.isTrue()) {
				return new Expr.Boolean(true,attributes);
			} else if(!ith.isFalse()) {
				noperands.add(ith);
			}
		}
		switch (noperands.size()) {
			case 0:
				return new Expr.Boolean(false,attributes);
			case 1:
				return noperands.get(0);
			default:
				return new Expr.LogicalOr(noperands, attributes);
		}
	}

	public static Expr.Logical OR(Expr.Logical operand1, Expr.Logical operand2, Attribute... attributes) {
		return OR(Arrays.asList(operand1, operand2), attributes);
	}

	// Relational Operators

	public static Expr.Equals EQ(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Equals(lhs, rhs,attributes);
	}

	public static Expr.NotEquals NEQ(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.NotEquals(lhs, rhs,attributes);
	}

	public static Expr.GreaterThanOrEqual GTEQ(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.GreaterThanOrEqual(lhs, rhs,attributes);
	}

	public static Expr.GreaterThan GT(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.GreaterThan(lhs, rhs,attributes);
	}

	public static Expr.LessThanOrEqual LTEQ(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.LessThanOrEqual(lhs, rhs,attributes);
	}

	public static Expr.LessThan LT(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.LessThan(lhs, rhs, attributes);
	}

	// Arithmetic Operators
	public static Expr.Addition ADD(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Addition(lhs, rhs, attributes);
	}

	public static Expr.Negation NEG(Expr lhs, Attribute... attributes) {
		return new Expr.Negation(lhs, attributes);
	}

	public static Expr.Subtraction SUB(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Subtraction(lhs, rhs, attributes);
	}
	public static Expr.Multiplication MUL(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Multiplication(lhs, rhs, attributes);
	}
	public static Expr.IntegerDivision IDIV(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.IntegerDivision(lhs, rhs, attributes);
	}
	public static Expr.Remainder REM(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Remainder(lhs, rhs, attributes);
	}
	// Dictionaries
	public static Expr.DictionaryAccess GET(Expr src, Expr index, Attribute... attributes) {
		return new Expr.DictionaryAccess(src, index, attributes);
	}
	public static Expr.DictionaryUpdate PUT(Expr src, Expr index, Expr value, Attribute... attributes) {
		return new Expr.DictionaryUpdate(src, index, value, attributes);
	}
	// Misc
	public static Expr.Logical CONST(boolean b, Attribute... attributes) {
		return new Expr.Boolean(b,attributes);
	}

	public static Expr.Integer CONST(long i, Attribute... attributes) {
		return new Expr.Integer(BigInteger.valueOf(i), attributes);
	}

	public static Expr.Integer CONST(BigInteger i, Attribute... attributes) {
		return new Expr.Integer(i, attributes);
	}

	public static Expr.BitVector CONST(BigInteger i, int bits, Attribute... attributes) {
		return new Expr.BitVector(i, bits, attributes);
	}

	public static Expr.Conditional ITE(Expr.Logical condition, Expr trueBranch, Expr falseBranch, Attribute... attributes) {
		return new Expr.Conditional(condition, trueBranch, falseBranch, attributes);
	}

	public static Expr.Tuple TUPLE(List<Expr> elements, Attribute... attributes) {
		return new Expr.Tuple(elements, attributes);
	}

	public static Expr.Invoke INVOKE(String name, Expr parameter, Attribute... attributes) {
		return new Expr.Invoke(name, Arrays.asList(parameter),attributes);
	}
	public static Expr.Invoke INVOKE(String name, Expr parameter1, Expr parameter2, Attribute... attributes) {
		return new Expr.Invoke(name, Arrays.asList(parameter1,parameter2),attributes);
	}
	public static Expr.Invoke INVOKE(String name, List<Expr> parameters, Attribute... attributes) {
		return new Expr.Invoke(name, parameters,attributes);
	}
	public static Expr.VariableAccess VAR(String name, Attribute... attributes) {
		return new Expr.VariableAccess(name,attributes);
	}
}

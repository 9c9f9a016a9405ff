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

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import solboogie.core.BoogieFile.Expr;
import solboogie.core.SolidityType;
import solboogie.core.SolidityType.TupleType;
import solboogie.util.InternalFailure;

/**
 * Inserts the conversions needed between bit-vectors of different width or
 * signedness. These are only relevant under the bit-vector encoding, since
 * Boogie bit-vectors carry a width but no sign. Conversions which the Solidity
 * type checker should have rejected are reported as internal failures.
 */
public class BvConversions {
	private static final Logger logger = LoggerFactory.getLogger(BvConversions.class);

	private BvConversions() {

	}

	/**
	 * Convert an expression for an implicit (i.e. widening) conversion from one
	 * type to another. Integer literals are materialised as bit-vector literals of
	 * the target width.
	 *
	 * @param expr     The expression being converted.
	 * @param fromType The type of the expression.
	 * @param toType   The type being converted to.
	 * @param context
	 * @return
	 */
	public static Expr checkImplicitBvConversion(Expr expr, SolidityType fromType, SolidityType toType,
			BoogieContext context) {
		if (fromType == null || toType == null) {
			throw new InternalFailure("Implicit conversion requires known types");
		}
		if (toType.getCategory() == SolidityType.Category.TUPLE) {
			return convertTuple(expr, fromType, (TupleType) toType, context);
		}
		if (TypeClassifier.isBitPrecise(toType)) {
			int toBits = TypeClassifier.getBits(toType);
			if (expr instanceof Expr.Integer) {
				Expr.Integer lit = (Expr.Integer) expr;
				if (lit.getValue().signum() < 0) {
					return context.bvNeg(toBits, CONST(lit.getValue().negate(), toBits));
				} else {
					return CONST(lit.getValue(), toBits);
				}
			} else if (TypeClassifier.isBitPrecise(fromType)) {
				int fromBits = TypeClassifier.getBits(fromType);
				boolean toSigned = TypeClassifier.isSigned(toType);
				boolean fromSigned = TypeClassifier.isSigned(fromType);
				if (toBits == fromBits && toSigned == fromSigned) {
					return expr;
				} else if (toBits < fromBits) {
					throw new InternalFailure("Implicit conversion to smaller type");
				} else if (!fromSigned) {
					logger.debug("zero extending {} to {}", fromType, toType);
					return context.bvZeroExt(expr, fromBits, toBits);
				} else if (toSigned) {
					logger.debug("sign extending {} to {}", fromType, toType);
					return context.bvSignExt(expr, fromBits, toBits);
				} else {
					throw new InternalFailure("Implicit conversion from signed to unsigned");
				}
			}
		}
		return expr;
	}

	/**
	 * Convert an expression for an explicit conversion (i.e. a cast). Casts which
	 * narrow, or change the sign of, a value reinterpret its bits. Any other
	 * cast is handled as an implicit conversion. Tuples are cast component-wise.
	 *
	 * @param expr     The expression being converted.
	 * @param fromType The type of the expression, or <code>null</code> if unknown.
	 * @param toType   The type being converted to, or <code>null</code> if unknown.
	 * @param context
	 * @return
	 */
	public static Expr checkExplicitBvConversion(Expr expr, SolidityType fromType, SolidityType toType,
			BoogieContext context) {
		if (fromType == null || toType == null) {
			return expr;
		}
		if (toType.getCategory() == SolidityType.Category.TUPLE) {
			return castTuple(expr, fromType, (TupleType) toType, context);
		}
		if (TypeClassifier.isBitPrecise(toType)) {
			int toBits = TypeClassifier.getBits(toType);
			if (expr instanceof Expr.Integer) {
				return checkImplicitBvConversion(expr, fromType, toType, context);
			} else if (TypeClassifier.isBitPrecise(fromType)) {
				int fromBits = TypeClassifier.getBits(fromType);
				boolean toSigned = TypeClassifier.isSigned(toType);
				boolean fromSigned = TypeClassifier.isSigned(fromType);
				if (toBits < fromBits || (fromSigned && !toSigned) || (toBits == fromBits && !fromSigned && toSigned)) {
					logger.debug("reinterpreting {} as {}", fromType, toType);
					if (toBits == fromBits) {
						// Boogie bit-vectors have no sign
						return expr;
					} else if (toBits > fromBits) {
						return context.bvSignExt(expr, fromBits, toBits);
					} else {
						return context.bvExtract(expr, fromBits, toBits - 1, 0);
					}
				} else {
					return checkImplicitBvConversion(expr, fromType, toType, context);
				}
			}
		}
		return expr;
	}

	private static Expr.Tuple convertTuple(Expr expr, SolidityType fromType, TupleType toType, BoogieContext context) {
		Expr.Tuple tuple = checkTuple(expr, fromType, toType);
		TupleType from = (TupleType) fromType;
		List<Expr> elements = new ArrayList<>();
		for (int i = 0; i != toType.size(); ++i) {
			SolidityType ith = toType.get(i);
			if (ith == null) {
				elements.add(null);
			} else {
				elements.add(checkImplicitBvConversion(tuple.get(i), from.get(i), ith, context));
			}
		}
		return TUPLE(elements);
	}

	private static Expr.Tuple castTuple(Expr expr, SolidityType fromType, TupleType toType, BoogieContext context) {
		Expr.Tuple tuple = checkTuple(expr, fromType, toType);
		TupleType from = (TupleType) fromType;
		List<Expr> elements = new ArrayList<>();
		for (int i = 0; i != toType.size(); ++i) {
			SolidityType ith = toType.get(i);
			if (ith == null) {
				// Component is discarded
				elements.add(null);
			} else {
				elements.add(checkExplicitBvConversion(tuple.get(i), from.get(i), ith, context));
			}
		}
		return TUPLE(elements);
	}

	private static Expr.Tuple checkTuple(Expr expr, SolidityType fromType, TupleType toType) {
		if (!(expr instanceof Expr.Tuple) || !(fromType instanceof TupleType)) {
			throw new InternalFailure("Expected tuple expression for conversion to " + toType);
		}
		Expr.Tuple tuple = (Expr.Tuple) expr;
		if (tuple.size() < toType.size() || ((TupleType) fromType).size() < toType.size()) {
			throw new InternalFailure("Tuple arity mismatch in conversion to " + toType);
		}
		return tuple;
	}
}

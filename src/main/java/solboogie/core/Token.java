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

/**
 * Solidity operator tokens, as classified by the parser. Compound assignments
 * (e.g. <code>+=</code>) are encoded in the same way as their underlying binary
 * operator.
 */
public enum Token {
	// Arithmetic
	ADD("+"),
	SUB("-"),
	MUL("*"),
	DIV("/"),
	MOD("%"),
	EXP("**"),
	// Bitwise
	BIT_AND("&"),
	BIT_OR("|"),
	BIT_XOR("^"),
	BIT_NOT("~"),
	SHL("<<"),
	SAR(">>"),
	// Relational
	EQUAL("=="),
	NOT_EQUAL("!="),
	LESS_THAN("<"),
	GREATER_THAN(">"),
	LESS_THAN_OR_EQUAL("<="),
	GREATER_THAN_OR_EQUAL(">="),
	// Logical
	NOT("!"),
	AND("&&"),
	OR("||"),
	// Increments
	INC("++"),
	DEC("--"),
	// Compound assignments
	ASSIGN_ADD("+=", ADD),
	ASSIGN_SUB("-=", SUB),
	ASSIGN_MUL("*=", MUL),
	ASSIGN_DIV("/=", DIV),
	ASSIGN_MOD("%=", MOD),
	ASSIGN_BIT_AND("&=", BIT_AND),
	ASSIGN_BIT_OR("|=", BIT_OR),
	ASSIGN_BIT_XOR("^=", BIT_XOR),
	ASSIGN_SHL("<<=", SHL),
	ASSIGN_SAR(">>=", SAR);

	private final String symbol;
	private final Token operator;

	private Token(String symbol) {
		this.symbol = symbol;
		this.operator = null;
	}

	private Token(String symbol, Token operator) {
		this.symbol = symbol;
		this.operator = operator;
	}

	public String getSymbol() {
		return symbol;
	}

	/**
	 * Check whether this is a compound assignment, such as <code>*=</code>.
	 *
	 * @return
	 */
	public boolean isCompoundAssignment() {
		return operator != null;
	}

	/**
	 * Get the operator applied by this token. For compound assignments this is
	 * the underlying binary operator (e.g. <code>+</code> for <code>+=</code>),
	 * otherwise it is the token itself.
	 *
	 * @return
	 */
	public Token getOperator() {
		return operator == null ? this : operator;
	}

	@Override
	public String toString() {
		return symbol;
	}
}

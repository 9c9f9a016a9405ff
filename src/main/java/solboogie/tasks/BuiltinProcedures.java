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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import solboogie.core.BoogieFile.Decl;
import solboogie.core.BoogieFile.Expr;
import solboogie.core.BoogieFile.LVal;
import solboogie.core.BoogieFile.Stmt;
import solboogie.core.SolidityType;
import solboogie.core.Token;
import solboogie.tasks.ArithmeticEncoder.ExprWithCC;
import solboogie.util.InternalFailure;

/**
 * Synthesises the Boogie procedures which model Solidity's ether transferring
 * members of <code>address</code>, namely <code>transfer</code>,
 * <code>send</code> and <code>call</code>. The procedures are built once for a
 * given context and shared by every call site. Each takes the receiving
 * address as <code>__this</code>, the paying contract as
 * <code>__msg_sender</code> and updates the global <code>__balance</code>
 * map. Execution of the receiver's fallback function is not modelled.
 */
public class BuiltinProcedures {
	private static final Logger logger = LoggerFactory.getLogger(BuiltinProcedures.class);

	private static final String OVERFLOW_COMMENT = "Implicit assumption that balances cannot overflow";
	private static final String AMOUNT = "amount";
	private static final String RESULT = "__result";
	private static final String CALLDATA = "__calldata";
	private static final SolidityType UINT256 = SolidityType.UINT(256);

	private final BoogieContext context;
	private final Decl.Procedure transfer;
	private final Decl.Procedure send;
	private final Decl.Procedure call;

	public BuiltinProcedures(BoogieContext context) {
		this.context = context;
		this.transfer = createTransferProc(context);
		this.send = createSendProc(context);
		this.call = createCallProc(context);
	}

	public Decl.Procedure getTransfer() {
		return transfer;
	}

	public Decl.Procedure getSend() {
		return send;
	}

	public Decl.Procedure getCall() {
		return call;
	}

	/**
	 * Get all built-in procedures, in the order they should be emitted.
	 *
	 * @return
	 */
	public List<Decl.Procedure> getAll() {
		return Arrays.asList(transfer, send, call);
	}

	// =========================================================================
	// Call sites
	// =========================================================================

	/**
	 * Translate <code>receiver.transfer(amount)</code>, made from within the
	 * current contract.
	 *
	 * @param receiver
	 * @param amount
	 * @return
	 */
	public Stmt.Call callTransfer(Expr receiver, Expr amount) {
		return CALL(transfer.getName(), arguments(receiver, zero(), amount));
	}

	/**
	 * Translate <code>result = receiver.send(amount)</code>.
	 *
	 * @param result Variable assigned the outcome of the send.
	 * @param receiver
	 * @param amount
	 * @return
	 */
	public Stmt.Call callSend(LVal result, Expr receiver, Expr amount) {
		return CALL(send.getName(), Arrays.asList(result), arguments(receiver, zero(), amount));
	}

	/**
	 * Translate <code>(result, data) = receiver.call.value(value)(...)</code>.
	 * The call data itself is not passed on.
	 *
	 * @param result
	 * @param data
	 * @param receiver
	 * @param value
	 * @return
	 */
	public Stmt.Call callCall(LVal result, LVal data, Expr receiver, Expr value) {
		return CALL(call.getName(), Arrays.asList(result, data), arguments(receiver, value));
	}

	private List<Expr> arguments(Expr receiver, Expr... rest) {
		ArrayList<Expr> args = new ArrayList<>();
		args.add(receiver);
		args.add(BoogieContext.refTo(context.boogieThis()));
		args.addAll(Arrays.asList(rest));
		return args;
	}

	private Expr zero() {
		return context.intLit(BigInteger.ZERO, 256);
	}

	// =========================================================================
	// Procedures
	// =========================================================================

	/**
	 * Construct <code>__transfer(__this, __msg_sender, __msg_value, amount)</code>,
	 * which moves <code>amount</code> from the sender to the receiver. The sender
	 * is assumed to have sufficient funds, since a failing transfer reverts.
	 *
	 * @param context
	 * @return
	 */
	public static Decl.Procedure createTransferProc(BoogieContext context) {
		Expr amount = VAR(AMOUNT);
		List<Decl.Parameter> params = parameters(context);
		params.add(new Decl.Parameter(AMOUNT, context.intType(256)));
		ArrayList<Stmt> body = new ArrayList<>();
		body.add(ASSUME(sufficientFunds(context, amount)));
		body.addAll(credit(context, amount));
		body.addAll(debit(context, amount));
		logger.debug("synthesized {} for {}", BoogieNames.BOOGIE_TRANSFER, context);
		return PROCEDURE(BoogieNames.BOOGIE_TRANSFER, params, Collections.emptyList(), modifies(context),
				SEQUENCE(body), ATTRIBUTE("inline", 1), ATTRIBUTE("message", BoogieNames.SOLIDITY_TRANSFER));
	}

	/**
	 * Construct
	 * <code>__call(__this, __msg_sender, __msg_value) returns (__result, __calldata)</code>.
	 * The call either succeeds, crediting the receiver with
	 * <code>__msg_value</code>, or fails leaving balances untouched.
	 *
	 * @param context
	 * @return
	 */
	public static Decl.Procedure createCallProc(BoogieContext context) {
		Expr.VariableAccess result = VAR(RESULT);
		List<Decl.Parameter> params = parameters(context);
		List<Decl.Parameter> returns = Arrays.asList(new Decl.Parameter(RESULT, context.boolType()),
				new Decl.Parameter(CALLDATA, context.bytesType()));
		ArrayList<Stmt> success = new ArrayList<>();
		success.addAll(credit(context, BoogieContext.refTo(context.boogieMsgValue())));
		success.add(ASSIGN(result, CONST(true)));
		Stmt failure = ASSIGN(result, CONST(false));
		Stmt body = SEQUENCE(COMMENT("Fallback function of the receiver is not executed"),
				IFELSE(SEQUENCE(success), failure));
		logger.debug("synthesized {} for {}", BoogieNames.BOOGIE_CALL, context);
		return PROCEDURE(BoogieNames.BOOGIE_CALL, params, returns, modifies(context), body, ATTRIBUTE("inline", 1),
				ATTRIBUTE("message", BoogieNames.SOLIDITY_CALL));
	}

	/**
	 * Construct
	 * <code>__send(__this, __msg_sender, __msg_value, amount) returns (__result)</code>.
	 * Like <code>__transfer</code>, except that the transfer may fail in which case
	 * <code>__result</code> is <code>false</code> and balances are unchanged.
	 *
	 * @param context
	 * @return
	 */
	public static Decl.Procedure createSendProc(BoogieContext context) {
		Expr amount = VAR(AMOUNT);
		Expr.VariableAccess result = VAR(RESULT);
		List<Decl.Parameter> params = parameters(context);
		params.add(new Decl.Parameter(AMOUNT, context.intType(256)));
		List<Decl.Parameter> returns = Arrays.asList(new Decl.Parameter(RESULT, context.boolType()));
		ArrayList<Stmt> success = new ArrayList<>();
		success.addAll(credit(context, amount));
		success.addAll(debit(context, amount));
		success.add(ASSIGN(result, CONST(true)));
		Stmt failure = ASSIGN(result, CONST(false));
		Stmt body = SEQUENCE(ASSUME(sufficientFunds(context, amount)),
				COMMENT("Fallback function of the receiver is not executed"), IFELSE(SEQUENCE(success), failure));
		logger.debug("synthesized {} for {}", BoogieNames.BOOGIE_SEND, context);
		return PROCEDURE(BoogieNames.BOOGIE_SEND, params, returns, modifies(context), body, ATTRIBUTE("inline", 1),
				ATTRIBUTE("message", BoogieNames.SOLIDITY_SEND));
	}

	// =========================================================================
	// Helpers
	// =========================================================================

	private static List<Decl.Parameter> parameters(BoogieContext context) {
		ArrayList<Decl.Parameter> params = new ArrayList<>();
		params.add(context.boogieThis());
		params.add(context.boogieMsgSender());
		params.add(context.boogieMsgValue());
		return params;
	}

	private static List<String> modifies(BoogieContext context) {
		return Arrays.asList(context.boogieBalance().getName());
	}

	/**
	 * Construct <code>__balance[__msg_sender] >= amount</code>.
	 */
	private static Expr.Logical sufficientFunds(BoogieContext context, Expr amount) {
		Expr senderBalance = balanceOf(context, context.boogieMsgSender());
		ExprWithCC geq = ArithmeticEncoder.encodeArithBinaryOp(context, null, Token.GREATER_THAN_OR_EQUAL,
				senderBalance, amount, 256, false);
		return asLogical(geq.getExpr());
	}

	/**
	 * Construct the statements for <code>__balance[__this] += amount</code>.
	 */
	private static List<Stmt> credit(BoogieContext context, Expr amount) {
		return updateBalance(context, context.boogieThis(), Token.ADD, amount);
	}

	/**
	 * Construct the statements for <code>__balance[__msg_sender] -= amount</code>.
	 */
	private static List<Stmt> debit(BoogieContext context, Expr amount) {
		return updateBalance(context, context.boogieMsgSender(), Token.SUB, amount);
	}

	private static List<Stmt> updateBalance(BoogieContext context, Decl.Variable account, Token op, Expr amount) {
		ArrayList<Stmt> stmts = new ArrayList<>();
		Expr balance = balanceOf(context, account);
		if (context.encoding() == BoogieContext.Encoding.MOD) {
			stmts.add(ASSUME(RangeConditions.getTCCforExpr(balance, UINT256)));
			stmts.add(ASSUME(RangeConditions.getTCCforExpr(amount, UINT256)));
		}
		ExprWithCC update = ArithmeticEncoder.encodeArithBinaryOp(context, null, op, balance, amount, 256, false);
		if (context.overflow() && update.hasCC()) {
			stmts.add(COMMENT(OVERFLOW_COMMENT));
			stmts.add(ASSUME(update.getCC()));
		}
		Expr.VariableAccess balances = BoogieContext.refTo(context.boogieBalance());
		stmts.add(ASSIGN(balances, PUT(balances, BoogieContext.refTo(account), update.getExpr())));
		return stmts;
	}

	private static Expr balanceOf(BoogieContext context, Decl.Variable account) {
		return GET(BoogieContext.refTo(context.boogieBalance()), BoogieContext.refTo(account));
	}

	private static Expr.Logical asLogical(Expr e) {
		if (e instanceof Expr.Logical) {
			return (Expr.Logical) e;
		}
		throw new InternalFailure("Expected boolean expression, found " + e);
	}
}

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

import solboogie.core.BoogieFile.Type;
import solboogie.core.DataLocation;
import solboogie.core.SourceLocation;
import solboogie.util.InternalFailure;

/**
 * Identifiers shared between the generated Boogie and the rest of the
 * translator. Names starting with <code>__</code> are reserved for the
 * translator and cannot clash with Solidity identifiers.
 */
public class BoogieNames {
	// Solidity built-ins
	public static final String SOLIDITY_BALANCE = "balance";
	public static final String SOLIDITY_TRANSFER = "transfer";
	public static final String SOLIDITY_SEND = "send";
	public static final String SOLIDITY_CALL = "call";
	public static final String SOLIDITY_SUPER = "super";
	public static final String SOLIDITY_SENDER = "sender";
	public static final String SOLIDITY_VALUE = "value";
	public static final String SOLIDITY_THIS = "this";
	public static final String SOLIDITY_ASSERT = "assert";
	public static final String SOLIDITY_REQUIRE = "require";
	public static final String SOLIDITY_REVERT = "revert";
	public static final String SOLIDITY_NOW = "now";
	public static final String SOLIDITY_NUMBER = "number";

	// Generated procedures
	public static final String BOOGIE_TRANSFER = "__transfer";
	public static final String BOOGIE_SEND = "__send";
	public static final String BOOGIE_CALL = "__call";
	public static final String BOOGIE_CONSTRUCTOR = "__constructor";

	// Generated variables and types
	public static final String BOOGIE_NOW = "__now";
	public static final String BOOGIE_BLOCKNO = "__block__number";
	public static final String BOOGIE_LENGTH = "#length";
	public static final String BOOGIE_SUM = "#sum";
	public static final String BOOGIE_INT_CONST_TYPE = "int_const";
	public static final String BOOGIE_ADDRESS_TYPE = "address_t";
	public static final String BOOGIE_BYTES_TYPE = "bytes_t";
	public static final String BOOGIE_STOR = "stor";
	public static final String BOOGIE_MEM = "mem";

	// Specification functions
	public static final String VERIFIER_SUM = "__verifier_sum";
	public static final String VERIFIER_OLD = "__verifier_old";
	public static final String VERIFIER_OVERFLOW = "__verifier_overflow";

	/**
	 * Placeholder expression returned after a translation error has been
	 * reported. It is never declared, hence any Boogie file containing it is
	 * rejected.
	 */
	public static final String ERR_EXPR = "__ERROR";
	public static final String ERR_TYPE = "__ERROR_UNSUPPORTED_TYPE";

	// Documentation tags
	public static final String DOCTAG_CONTRACT_INVAR = "invariant";
	public static final String DOCTAG_CONTRACT_INVARS_INCLUDE = "{contractInvariants}";
	public static final String DOCTAG_LOOP_INVAR = "invariant";
	public static final String DOCTAG_PRECOND = "precondition";
	public static final String DOCTAG_POSTCOND = "postcondition";
	public static final String DOCTAG_MODIFIES = "modifies";
	public static final String DOCTAG_MODIFIES_ALL = DOCTAG_MODIFIES + " *";
	public static final String DOCTAG_MODIFIES_COND = " if ";

	private BoogieNames() {

	}

	/**
	 * Get the suffix used for variables in a given data location.
	 *
	 * @param loc
	 * @return
	 */
	public static String dataLocToStr(DataLocation loc) {
		switch (loc) {
		case STORAGE:
			return BOOGIE_STOR;
		case MEMORY:
			return BOOGIE_MEM;
		case CALLDATA:
			throw new InternalFailure("CallData storage location is not supported.");
		default:
			throw new InternalFailure("Unknown storage location.");
		}
	}

	/**
	 * Get the name of the procedure implementing the constructor of the contract
	 * with the given identifier.
	 *
	 * @param contractId
	 * @return
	 */
	public static String getConstructorName(long contractId) {
		return BOOGIE_CONSTRUCTOR + "#" + contractId;
	}

	public static Type.Dictionary mappingType(Type key, Type value) {
		return new Type.Dictionary(key, value);
	}

	/**
	 * Construct the attributes which tie a generated statement back to its
	 * source, namely <code>{:sourceloc "file", line, col}</code> and
	 * <code>{:message "..."}</code>.
	 *
	 * @param loc
	 * @param message
	 * @return
	 */
	public static BoogieAttribute[] createAttrs(SourceLocation loc, String message) {
		return new BoogieAttribute[] {
				ATTRIBUTE("sourceloc", loc.getSource(), loc.getLine(), loc.getColumn()),
				ATTRIBUTE("message", message) };
	}
}

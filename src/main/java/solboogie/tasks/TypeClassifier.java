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

import solboogie.core.SolidityType;
import solboogie.core.SolidityType.EnumType;
import solboogie.core.SolidityType.FixedBytesType;
import solboogie.core.SolidityType.IntegerType;
import solboogie.core.SolidityType.TupleType;
import solboogie.util.InternalFailure;

/**
 * Answers the questions the encoders ask about a Solidity type: is it modelled
 * with a fixed width, how many bits does it have, and is it signed. Only
 * integers, fixed size byte arrays and enums have a fixed width. A tuple is
 * considered to have a fixed width when every known component does.
 */
public class TypeClassifier {

	private TypeClassifier() {

	}

	public static boolean isBitPrecise(SolidityType type) {
		switch (type.getCategory()) {
		case INTEGER:
		case FIXED_BYTES:
		case ENUM:
			return true;
		case TUPLE: {
			TupleType tuple = (TupleType) type;
			for (SolidityType component : tuple.getComponents()) {
				if (component != null && !isBitPrecise(component)) {
					return false;
				}
			}
			return true;
		}
		default:
			return false;
		}
	}

	/**
	 * Get the number of bits used to represent a value of the given type.
	 * Enumerations are stored as 256 bit words.
	 *
	 * @param type A bit-precise, non-tuple type.
	 * @return
	 */
	public static int getBits(SolidityType type) {
		if (type instanceof IntegerType) {
			return ((IntegerType) type).getBits();
		} else if (type instanceof FixedBytesType) {
			return 8 * ((FixedBytesType) type).getBytes();
		} else if (type instanceof EnumType) {
			return 256;
		}
		throw new InternalFailure("Trying to get bits for non-bitprecise type");
	}

	public static boolean isSigned(SolidityType type) {
		if (type instanceof IntegerType) {
			return ((IntegerType) type).isSigned();
		} else if (type instanceof FixedBytesType || type instanceof EnumType) {
			return false;
		}
		throw new InternalFailure("Trying to get sign for non-bitprecise type");
	}
}

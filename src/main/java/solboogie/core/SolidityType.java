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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Describes the static type of a Solidity operand, as determined by the type
 * checker. Only the information needed for encoding arithmetic is retained:
 * bit widths and signedness for integers, the number of bytes for fixed byte
 * arrays, member counts for enums and the component types of tuples. All other
 * types (address, bool, mappings, etc) are represented by name only.
 */
public abstract class SolidityType {

	/**
	 * The closed set of type categories relevant for arithmetic encoding.
	 */
	public enum Category {
		INTEGER, FIXED_BYTES, ENUM, TUPLE, OTHER
	}

	private final Category category;

	private SolidityType(Category category) {
		this.category = category;
	}

	public Category getCategory() {
		return category;
	}

	// =========================================================================
	// Integers
	// =========================================================================

	public static final class IntegerType extends SolidityType {
		private final int bits;
		private final boolean signed;

		private IntegerType(int bits, boolean signed) {
			super(Category.INTEGER);
			if (bits <= 0 || bits > 256 || bits % 8 != 0) {
				throw new IllegalArgumentException("invalid integer width " + bits);
			}
			this.bits = bits;
			this.signed = signed;
		}

		public int getBits() {
			return bits;
		}

		public boolean isSigned() {
			return signed;
		}

		@Override
		public String toString() {
			return (signed ? "int" : "uint") + bits;
		}
	}

	/**
	 * Fixed size byte arrays (<code>bytes1</code> ... <code>bytes32</code>).
	 */
	public static final class FixedBytesType extends SolidityType {
		private final int bytes;

		private FixedBytesType(int bytes) {
			super(Category.FIXED_BYTES);
			if (bytes <= 0 || bytes > 32) {
				throw new IllegalArgumentException("invalid number of bytes " + bytes);
			}
			this.bytes = bytes;
		}

		public int getBytes() {
			return bytes;
		}

		@Override
		public String toString() {
			return "bytes" + bytes;
		}
	}

	public static final class EnumType extends SolidityType {
		private final String name;
		private final int members;

		private EnumType(String name, int members) {
			super(Category.ENUM);
			this.name = name;
			this.members = members;
		}

		public String getName() {
			return name;
		}

		/**
		 * Get the number of members declared for this enumeration.
		 *
		 * @return
		 */
		public int getMemberCount() {
			return members;
		}

		@Override
		public String toString() {
			return "enum " + name;
		}
	}

	/**
	 * A tuple type. Components may be <code>null</code> when their type is not
	 * known, for example in <code>(x, ) = f()</code>.
	 */
	public static final class TupleType extends SolidityType {
		private final List<SolidityType> components;

		private TupleType(List<SolidityType> components) {
			super(Category.TUPLE);
			this.components = new ArrayList<>(components);
		}

		public int size() {
			return components.size();
		}

		public SolidityType get(int i) {
			return components.get(i);
		}

		public List<SolidityType> getComponents() {
			return components;
		}

		@Override
		public String toString() {
			return "tuple" + components;
		}
	}

	public static final class OtherType extends SolidityType {
		private final String name;

		private OtherType(String name) {
			super(Category.OTHER);
			this.name = name;
		}

		public String getName() {
			return name;
		}

		@Override
		public String toString() {
			return name;
		}
	}

	// =======================================================
	// Constructor API (for convenience)
	// =======================================================

	public static IntegerType UINT(int bits) {
		return new IntegerType(bits, false);
	}

	public static IntegerType INT(int bits) {
		return new IntegerType(bits, true);
	}

	public static FixedBytesType BYTES(int bytes) {
		return new FixedBytesType(bytes);
	}

	public static EnumType ENUM(String name, int members) {
		return new EnumType(name, members);
	}

	public static TupleType TUPLE(SolidityType... components) {
		return new TupleType(Arrays.asList(components));
	}

	public static TupleType TUPLE(List<SolidityType> components) {
		return new TupleType(components);
	}

	public static OtherType OTHER(String name) {
		return new OtherType(name);
	}

	public static final OtherType ADDRESS = new OtherType("address");

	public static final OtherType BOOL = new OtherType("bool");
}

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

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import solboogie.core.BoogieFile.Decl;
import solboogie.core.BoogieFile.Expr;
import solboogie.core.BoogieFile.Type;
import solboogie.core.SourceLocation;
import solboogie.tasks.BoogieContext.Encoding;
import solboogie.util.Diagnostics;

public class BoogieContextTest {

	@Test
	public void encodingNames() {
		assertEquals(Encoding.INT, Encoding.fromString("int"));
		assertEquals(Encoding.BV, Encoding.fromString("bv"));
		assertEquals(Encoding.MOD, Encoding.fromString("mod"));
		assertEquals("mod", Encoding.MOD.toString());
		assertThrows(IllegalArgumentException.class, () -> Encoding.fromString("float"));
	}

	@Test
	public void defaultOptions() {
		BoogieContext context = BoogieContext.fromOptions(new HashMap<>(), new Diagnostics());
		assertEquals(Encoding.INT, context.encoding());
		assertFalse(context.overflow());
		assertFalse(context.isBitPrecise());
	}

	@Test
	public void options() {
		Map<String, String> options = new HashMap<>();
		options.put(BoogieContext.OPTION_ARITHMETIC, "bv");
		options.put(BoogieContext.OPTION_OVERFLOW, "true");
		BoogieContext context = BoogieContext.fromOptions(options, new Diagnostics());
		assertEquals(Encoding.BV, context.encoding());
		assertTrue(context.overflow());
		assertTrue(context.isBitPrecise());
		assertEquals("encoding=bv, overflow=true", context.toString());
	}

	@Test
	public void unknownEncodingOption() {
		Map<String, String> options = new HashMap<>();
		options.put(BoogieContext.OPTION_ARITHMETIC, "real");
		assertThrows(IllegalArgumentException.class, () -> BoogieContext.fromOptions(options, new Diagnostics()));
	}

	@Test
	public void withMethodsShareDiagnostics() {
		Diagnostics diagnostics = new Diagnostics();
		BoogieContext base = new BoogieContext(Encoding.INT, false, diagnostics);
		BoogieContext mod = base.withEncoding(Encoding.MOD).withOverflow(true);
		assertEquals(Encoding.INT, base.encoding());
		assertFalse(base.overflow());
		assertEquals(Encoding.MOD, mod.encoding());
		assertTrue(mod.overflow());
		assertTrue(mod.isBitPrecise());
		mod.reportError(() -> new SourceLocation("A.sol", 2, 3), "oops");
		assertSame(diagnostics, base.getDiagnostics());
		assertEquals(1, base.getDiagnostics().size());
	}

	@Test
	public void integerTypes() {
		BoogieContext bv = new BoogieContext(Encoding.BV, false, new Diagnostics());
		assertEquals(64, ((Type.BitVector) bv.intType(64)).getDigits());
		BoogieContext mod = new BoogieContext(Encoding.MOD, false, new Diagnostics());
		assertEquals(Type.Int, mod.intType(64));
		assertEquals(Type.Bool, mod.boolType());
		assertEquals("address_t", ((Type.Synonym) mod.addressType()).getSynonym());
		assertEquals("bytes_t", ((Type.Synonym) mod.bytesType()).getSynonym());
	}

	@Test
	public void integerLiterals() {
		BoogieContext bv = new BoogieContext(Encoding.BV, false, new Diagnostics());
		Expr.BitVector lit = (Expr.BitVector) bv.intLit(BigInteger.TEN, 16);
		assertEquals(16, lit.getBits());
		BoogieContext integers = new BoogieContext(Encoding.INT, false, new Diagnostics());
		assertEquals(BigInteger.TEN, ((Expr.Integer) integers.intLit(BigInteger.TEN, 16)).getValue());
	}

	@Test
	public void globals() {
		BoogieContext bv = new BoogieContext(Encoding.BV, false, new Diagnostics());
		assertEquals("__this", bv.boogieThis().getName());
		assertEquals("__msg_sender", bv.boogieMsgSender().getName());
		assertEquals("__msg_value", bv.boogieMsgValue().getName());
		assertEquals(256, ((Type.BitVector) bv.boogieMsgValue().getType()).getDigits());
		Decl.Variable balance = bv.boogieBalance();
		assertEquals("__balance", balance.getName());
		Type.Dictionary type = (Type.Dictionary) balance.getType();
		assertEquals("address_t", ((Type.Synonym) type.getKey()).getSynonym());
		assertEquals(256, ((Type.BitVector) type.getValue()).getDigits());
		assertEquals("__balance", BoogieContext.refTo(balance).getVariable());
	}

	@Test
	public void bitVectorPrimitives() {
		BoogieContext bv = new BoogieContext(Encoding.BV, false, new Diagnostics());
		Expr value = BoogieContext.refTo(bv.boogieMsgValue());
		Expr.Invoke add = bv.bvAdd(32, value, value);
		Decl.Function fn = add.getAttribute(Decl.Function.class);
		assertEquals("bvadd32", fn.getName());
		assertEquals(Arrays.asList(":bvbuiltin", "\"bvadd\""), fn.getModifiers());
		assertEquals(2, fn.getParmeters().size());
		assertEquals(32, ((Type.BitVector) fn.getReturns()).getDigits());
		Decl.Function lt = bv.bvUlt(8, add, add).getAttribute(Decl.Function.class);
		assertEquals(Type.Bool, lt.getReturns());
		Decl.Function ext = bv.bvZeroExt(add, 8, 256).getAttribute(Decl.Function.class);
		assertEquals("bvzeroext_8_to_256", ext.getName());
		assertEquals("\"(_ zero_extend 248)\"", ext.getModifiers().get(1));
		assertEquals(256, ((Type.BitVector) ext.getReturns()).getDigits());
		Decl.Function extract = bv.bvExtract(add, 256, 7, 0).getAttribute(Decl.Function.class);
		assertEquals("\"(_ extract 7 0)\"", extract.getModifiers().get(1));
		assertEquals(8, ((Type.BitVector) extract.getReturns()).getDigits());
	}
}

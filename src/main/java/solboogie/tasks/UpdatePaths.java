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

import solboogie.core.BoogieFile.Expr;
import solboogie.util.InternalFailure;

/**
 * Rewrites assignments to nested map selections into whole-map updates. Boogie
 * only allows a variable on the left-hand side of an assignment, so an
 * assignment <code>m[i][j] := v</code> becomes
 * <code>m := m[i := m[i][j := v]]</code>.
 */
public class UpdatePaths {

	private UpdatePaths() {

	}

	/**
	 * Convert a selection <code>sel</code>, being assigned <code>value</code>, into
	 * the update expression for the outermost map.
	 *
	 * @param sel   A (possibly nested) map selection.
	 * @param value The value being assigned.
	 * @return
	 */
	public static Expr selectToUpdate(Expr sel, Expr value) {
		if (sel instanceof Expr.DictionaryAccess) {
			Expr.DictionaryAccess access = (Expr.DictionaryAccess) sel;
			Expr update = PUT(access.getSource(), access.getIndex(), value);
			if (access.getSource() instanceof Expr.DictionaryAccess) {
				return selectToUpdate(access.getSource(), update);
			} else {
				return update;
			}
		}
		throw new InternalFailure("Expected datatype/array select");
	}

	/**
	 * Get the variable at the root of a (possibly nested) selection. This is the
	 * variable assigned the result of {@link #selectToUpdate(Expr, Expr)}.
	 *
	 * @param sel
	 * @return
	 */
	public static Expr getBase(Expr sel) {
		while (sel instanceof Expr.DictionaryAccess) {
			sel = ((Expr.DictionaryAccess) sel).getSource();
		}
		return sel;
	}
}

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import solboogie.core.BoogieFile.Decl;
import solboogie.core.BoogieFile.Expr;
import solboogie.core.BoogieFile.Stmt;
import solboogie.util.AbstractExpressionFold;

/**
 * Collects the declarations of the bit-vector primitives used within some
 * generated Boogie, so that exactly those functions can be declared in the
 * output file. Each primitive invocation carries its own declaration as an
 * attribute. Functions are returned in order of first use and identified by
 * name, so each is declared once.
 */
public class BvFunctionCollector extends AbstractExpressionFold<Map<String, Decl.Function>> {

	public static List<Decl.Function> collect(Expr expr) {
		return new ArrayList<>(new BvFunctionCollector().visitExpression(expr).values());
	}

	public static List<Decl.Function> collect(List<? extends Decl> decls) {
		BvFunctionCollector collector = new BvFunctionCollector();
		Map<String, Decl.Function> result = collector.BOTTOM();
		for (Decl d : decls) {
			result = collector.join(result, collector.visitDeclaration(d));
		}
		return new ArrayList<>(result.values());
	}

	public Map<String, Decl.Function> visitDeclaration(Decl decl) {
		if (decl instanceof Decl.Procedure) {
			Decl.Procedure p = (Decl.Procedure) decl;
			Map<String, Decl.Function> result = BOTTOM();
			for (Expr.Logical e : p.getRequires()) {
				result = join(result, visitLogical(e));
			}
			for (Expr.Logical e : p.getEnsures()) {
				result = join(result, visitLogical(e));
			}
			if (p.getBody() != null) {
				result = join(result, visitStatement(p.getBody()));
			}
			return result;
		} else if (decl instanceof Decl.Function) {
			Decl.Function f = (Decl.Function) decl;
			return f.getBody() == null ? BOTTOM() : visitExpression(f.getBody());
		} else if (decl instanceof Decl.Sequence) {
			Map<String, Decl.Function> result = BOTTOM();
			for (Decl d : ((Decl.Sequence) decl).getAll()) {
				result = join(result, visitDeclaration(d));
			}
			return result;
		} else {
			return BOTTOM();
		}
	}

	public Map<String, Decl.Function> visitStatement(Stmt stmt) {
		if (stmt instanceof Stmt.Assert) {
			return visitLogical(((Stmt.Assert) stmt).getCondition());
		} else if (stmt instanceof Stmt.Assume) {
			return visitLogical(((Stmt.Assume) stmt).getCondition());
		} else if (stmt instanceof Stmt.Assignment) {
			Stmt.Assignment s = (Stmt.Assignment) stmt;
			return join(visitExpression(s.getLeftHandSide()), visitExpression(s.getRightHandSide()));
		} else if (stmt instanceof Stmt.Call) {
			return join(visitExpressions(((Stmt.Call) stmt).getArguments()));
		} else if (stmt instanceof Stmt.IfElse) {
			Stmt.IfElse s = (Stmt.IfElse) stmt;
			Map<String, Decl.Function> result = s.isNondeterministic() ? BOTTOM() : visitLogical(s.getCondition());
			result = join(result, visitStatement(s.getTrueBranch()));
			if (s.getFalseBranch() != null) {
				result = join(result, visitStatement(s.getFalseBranch()));
			}
			return result;
		} else if (stmt instanceof Stmt.Sequence) {
			Map<String, Decl.Function> result = BOTTOM();
			for (Stmt s : ((Stmt.Sequence) stmt).getAll()) {
				result = join(result, visitStatement(s));
			}
			return result;
		} else {
			return BOTTOM();
		}
	}

	@Override
	protected Map<String, Decl.Function> constructInvoke(Expr.Invoke expr, List<Map<String, Decl.Function>> operands) {
		Map<String, Decl.Function> result = join(operands);
		Decl.Function fn = expr.getAttribute(Decl.Function.class);
		if (fn != null && !result.containsKey(fn.getName())) {
			result = join(Collections.singletonMap(fn.getName(), fn), result);
		}
		return result;
	}

	@Override
	protected Map<String, Decl.Function> BOTTOM() {
		return Collections.emptyMap();
	}

	@Override
	protected Map<String, Decl.Function> join(Map<String, Decl.Function> lhs, Map<String, Decl.Function> rhs) {
		if (rhs.isEmpty()) {
			return lhs;
		} else if (lhs.isEmpty()) {
			return rhs;
		}
		LinkedHashMap<String, Decl.Function> result = new LinkedHashMap<>(lhs);
		for (Map.Entry<String, Decl.Function> e : rhs.entrySet()) {
			result.putIfAbsent(e.getKey(), e.getValue());
		}
		return result;
	}

	@Override
	protected Map<String, Decl.Function> join(List<Map<String, Decl.Function>> operands) {
		Map<String, Decl.Function> result = BOTTOM();
		for (Map<String, Decl.Function> operand : operands) {
			result = join(result, operand);
		}
		return result;
	}
}

package org.javai.jsonui.expr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.javai.jsonui.expr.Expression.And;
import org.javai.jsonui.expr.Expression.ArrayExpr;
import org.javai.jsonui.expr.Expression.BindItem;
import org.javai.jsonui.expr.Expression.BindState;
import org.javai.jsonui.expr.Expression.Compare;
import org.javai.jsonui.expr.Expression.Computed;
import org.javai.jsonui.expr.Expression.Cond;
import org.javai.jsonui.expr.Expression.IndexRef;
import org.javai.jsonui.expr.Expression.ItemRef;
import org.javai.jsonui.expr.Expression.Literal;
import org.javai.jsonui.expr.Expression.Not;
import org.javai.jsonui.expr.Expression.ObjectExpr;
import org.javai.jsonui.expr.Expression.Or;
import org.javai.jsonui.expr.Expression.StateRef;
import org.javai.jsonui.state.JsonPointer;
import org.javai.jsonui.state.JsonValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates property, visibility and binding expressions against a {@link ResolutionContext}.
 *
 * <p>Resolution is a pure tree walk with no caching: results depend on the snapshot and scope
 * passed in, and callers re-resolve whenever either changes. Generated input is untrusted, so
 * nothing here throws for a bad reference: missing paths, unknown functions and out-of-scope
 * item references all resolve to {@code null}.</p>
 */
public class ExpressionResolver {

	private static final Logger logger = LoggerFactory.getLogger(ExpressionResolver.class);

	/**
	 * Resolve a raw JSON value (or an already parsed expression) to a concrete value.
	 * Two-way binding forms resolve to the value currently at their path.
	 */
	public Object resolve(Object raw, ResolutionContext ctx) {
		return ExpressionParser.parse(raw).accept(new Evaluator(ctx));
	}

	/**
	 * Evaluate a raw condition. {@code null} is true.
	 */
	public boolean evaluate(Object rawCondition, ResolutionContext ctx) {
		Expression condition = ExpressionParser.parseCondition(rawCondition);
		return JsonValues.isTruthy(condition.accept(new Evaluator(ctx)));
	}

	public Map<String, Object> resolveProps(Map<String, ?> props, ResolutionContext ctx) {
		Map<String, Object> resolved = new LinkedHashMap<>();
		if (props == null) {
			return resolved;
		}
		Evaluator evaluator = new Evaluator(ctx);
		for (Map.Entry<String, ?> entry : props.entrySet()) {
			resolved.put(entry.getKey(), ExpressionParser.parse(entry.getValue()).accept(evaluator));
		}
		return resolved;
	}

	/**
	 * Extract the write-back path of every top-level property declared as {@code $bindState} or
	 * {@code $bindItem}. Item bindings are made absolute against the repeat scope's base path and
	 * are skipped outside a repeat scope.
	 */
	public Map<String, String> resolveBindings(Map<String, ?> props, ResolutionContext ctx) {
		Map<String, String> bindings = new LinkedHashMap<>();
		if (props == null) {
			return bindings;
		}
		for (Map.Entry<String, ?> entry : props.entrySet()) {
			Expression expression = ExpressionParser.parse(entry.getValue());
			String path = bindingPath(expression, ctx);
			if (path != null) {
				bindings.put(entry.getKey(), path);
			}
		}
		return bindings;
	}

	private String bindingPath(Expression expression, ResolutionContext ctx) {
		if (expression instanceof BindState bind) {
			return JsonPointer.format(JsonPointer.parse(bind.path()));
		}
		if (expression instanceof BindItem bind) {
			if (!ctx.inRepeatScope()) {
				logger.debug("$bindItem '{}' used outside a repeat scope", bind.field());
				return null;
			}
			return itemPath(ctx.scope(), bind.field());
		}
		return null;
	}

	private static String itemPath(RepeatScope scope, String field) {
		if (field.isEmpty() || "/".equals(field)) {
			return scope.basePath();
		}
		return JsonPointer.join(scope.basePath(), field);
	}

	private static final class Evaluator implements Expression.Visitor<Object> {

		private final ResolutionContext ctx;

		private Evaluator(ResolutionContext ctx) {
			this.ctx = ctx;
		}

		@Override
		public Object visitLiteral(Literal literal) {
			return literal.value();
		}

		@Override
		public Object visitStateRef(StateRef ref) {
			return JsonValues.get(ctx.state(), ref.path());
		}

		@Override
		public Object visitItemRef(ItemRef ref) {
			if (!ctx.inRepeatScope()) {
				logger.debug("$item '{}' resolved outside a repeat scope", ref.field());
				return null;
			}
			Object item = ctx.scope().item();
			return ref.wholeItem() ? item : JsonValues.get(item, ref.field());
		}

		@Override
		public Object visitIndexRef(IndexRef ref) {
			if (!ctx.inRepeatScope()) {
				logger.debug("$index resolved outside a repeat scope");
				return null;
			}
			return ctx.scope().index();
		}

		@Override
		public Object visitComputed(Computed computed) {
			ComputedFunction function = ctx.functions().get(computed.name());
			if (function == null) {
				logger.warn("Unknown computed function '{}'", computed.name());
				return null;
			}
			Map<String, Object> args = new LinkedHashMap<>();
			computed.args().forEach((name, arg) -> args.put(name, arg.accept(this)));
			try {
				return function.apply(Collections.unmodifiableMap(args));
			}
			catch (RuntimeException ex) {
				logger.warn("Computed function '{}' failed: {}", computed.name(), ex.getMessage());
				return null;
			}
		}

		@Override
		public Object visitCond(Cond cond) {
			boolean test = JsonValues.isTruthy(cond.condition().accept(this));
			return test ? cond.then().accept(this) : cond.otherwise().accept(this);
		}

		@Override
		public Object visitAnd(And and) {
			for (Expression operand : and.operands()) {
				if (!JsonValues.isTruthy(operand.accept(this))) {
					return false;
				}
			}
			return true;
		}

		@Override
		public Object visitOr(Or or) {
			for (Expression operand : or.operands()) {
				if (JsonValues.isTruthy(operand.accept(this))) {
					return true;
				}
			}
			return false;
		}

		@Override
		public Object visitNot(Not not) {
			return !JsonValues.isTruthy(not.operand().accept(this));
		}

		@Override
		public Object visitCompare(Compare compare) {
			Object left = compare.subject().accept(this);
			if (compare.op() == CompareOp.TRUTHY) {
				return JsonValues.isTruthy(left);
			}
			Object right = compare.operand().accept(this);
			if (compare.op().isOrdering()) {
				if (!(left instanceof Number l) || !(right instanceof Number r)) {
					return false;
				}
				int cmp = JsonValues.compareNumbers(l, r);
				switch (compare.op()) {
					case GT:
						return cmp > 0;
					case GTE:
						return cmp >= 0;
					case LT:
						return cmp < 0;
					default:
						return cmp <= 0;
				}
			}
			boolean equal = JsonValues.jsonEquals(left, right);
			return compare.op() == CompareOp.EQ ? equal : !equal;
		}

		@Override
		public Object visitBindState(BindState bind) {
			return JsonValues.get(ctx.state(), bind.path());
		}

		@Override
		public Object visitBindItem(BindItem bind) {
			if (!ctx.inRepeatScope()) {
				logger.debug("$bindItem '{}' resolved outside a repeat scope", bind.field());
				return null;
			}
			Object item = ctx.scope().item();
			return bind.field().isEmpty() || "/".equals(bind.field()) ? item : JsonValues.get(item, bind.field());
		}

		@Override
		public Object visitObject(ObjectExpr object) {
			Map<String, Object> resolved = new LinkedHashMap<>();
			object.members().forEach((name, member) -> resolved.put(name, member.accept(this)));
			return resolved;
		}

		@Override
		public Object visitArray(ArrayExpr array) {
			List<Object> resolved = new ArrayList<>(array.elements().size());
			for (Expression element : array.elements()) {
				resolved.add(element.accept(this));
			}
			return resolved;
		}
	}
}

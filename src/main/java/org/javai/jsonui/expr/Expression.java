package org.javai.jsonui.expr;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Closed set of value and condition expressions that may appear in a generated node.
 *
 * <p>Instances are produced by {@link ExpressionParser} from the raw JSON tree and evaluated by
 * {@link ExpressionResolver}. Callers that need to inspect an expression should go through
 * {@link Visitor} so that adding a variant is a compile error everywhere it matters.</p>
 */
public sealed interface Expression {

	<R> R accept(Visitor<R> visitor);

	interface Visitor<R> {
		R visitLiteral(Literal literal);

		R visitStateRef(StateRef ref);

		R visitItemRef(ItemRef ref);

		R visitIndexRef(IndexRef ref);

		R visitComputed(Computed computed);

		R visitCond(Cond cond);

		R visitAnd(And and);

		R visitOr(Or or);

		R visitNot(Not not);

		R visitCompare(Compare compare);

		R visitBindState(BindState bind);

		R visitBindItem(BindItem bind);

		R visitObject(ObjectExpr object);

		R visitArray(ArrayExpr array);
	}

	/**
	 * A plain JSON value with no embedded expression.
	 */
	record Literal(Object value) implements Expression {
		public static final Literal NULL = new Literal(null);
		public static final Literal TRUE = new Literal(Boolean.TRUE);

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitLiteral(this);
		}
	}

	record StateRef(String path) implements Expression {
		public StateRef {
			Objects.requireNonNull(path, "path must not be null");
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitStateRef(this);
		}
	}

	/**
	 * Field of the current repeat item; {@code ""} or {@code "/"} selects the whole item.
	 */
	record ItemRef(String field) implements Expression {
		public ItemRef {
			field = field != null ? field : "";
		}

		public boolean wholeItem() {
			return field.isEmpty() || "/".equals(field);
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitItemRef(this);
		}
	}

	record IndexRef() implements Expression {
		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitIndexRef(this);
		}
	}

	record Computed(String name, Map<String, Expression> args) implements Expression {
		public Computed {
			Objects.requireNonNull(name, "name must not be null");
			args = args != null ? Collections.unmodifiableMap(new LinkedHashMap<>(args)) : Map.of();
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitComputed(this);
		}
	}

	record Cond(Expression condition, Expression then, Expression otherwise) implements Expression {
		public Cond {
			Objects.requireNonNull(condition, "condition must not be null");
			then = then != null ? then : Literal.NULL;
			otherwise = otherwise != null ? otherwise : Literal.NULL;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitCond(this);
		}
	}

	record And(List<Expression> operands) implements Expression {
		public And {
			operands = operands != null ? List.copyOf(operands) : List.of();
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitAnd(this);
		}
	}

	record Or(List<Expression> operands) implements Expression {
		public Or {
			operands = operands != null ? List.copyOf(operands) : List.of();
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitOr(this);
		}
	}

	record Not(Expression operand) implements Expression {
		public Not {
			Objects.requireNonNull(operand, "operand must not be null");
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitNot(this);
		}
	}

	/**
	 * {@code subject op operand}; for {@link CompareOp#TRUTHY} the operand is ignored.
	 */
	record Compare(Expression subject, CompareOp op, Expression operand) implements Expression {
		public Compare {
			Objects.requireNonNull(subject, "subject must not be null");
			op = op != null ? op : CompareOp.TRUTHY;
			operand = operand != null ? operand : Literal.NULL;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitCompare(this);
		}
	}

	record BindState(String path) implements Expression {
		public BindState {
			Objects.requireNonNull(path, "path must not be null");
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitBindState(this);
		}
	}

	record BindItem(String field) implements Expression {
		public BindItem {
			field = field != null ? field : "";
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitBindItem(this);
		}
	}

	/**
	 * Object literal with at least one member that is itself an expression.
	 */
	record ObjectExpr(Map<String, Expression> members) implements Expression {
		public ObjectExpr {
			members = members != null ? Collections.unmodifiableMap(new LinkedHashMap<>(members)) : Map.of();
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitObject(this);
		}
	}

	record ArrayExpr(List<Expression> elements) implements Expression {
		public ArrayExpr {
			elements = elements != null ? List.copyOf(elements) : List.of();
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitArray(this);
		}
	}
}

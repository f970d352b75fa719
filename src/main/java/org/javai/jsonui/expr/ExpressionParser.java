package org.javai.jsonui.expr;

import java.util.ArrayList;
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
import org.javai.jsonui.state.JsonValues;

/**
 * Turns the raw JSON stored in a node (maps, lists, scalars) into {@link Expression} trees.
 *
 * <p>Recognition is by reserved {@code $}-prefixed keys. Anything not recognised is treated as
 * literal data, so generated documents with unexpected shapes degrade to plain values rather
 * than failing.</p>
 */
public final class ExpressionParser {

	public static final String STATE = "$state";
	public static final String ITEM = "$item";
	public static final String INDEX = "$index";
	public static final String COMPUTED = "$computed";
	public static final String ARGS = "args";
	public static final String COND = "$cond";
	public static final String THEN = "$then";
	public static final String ELSE = "$else";
	public static final String AND = "$and";
	public static final String OR = "$or";
	public static final String NOT = "not";
	public static final String BIND_STATE = "$bindState";
	public static final String BIND_ITEM = "$bindItem";

	private ExpressionParser() {
	}

	/**
	 * Parse a value in property position.
	 */
	public static Expression parse(Object raw) {
		if (raw instanceof Expression expression) {
			return expression;
		}
		if (raw instanceof Map<?, ?> map) {
			return parseObject(map);
		}
		if (raw instanceof List<?> list) {
			List<Expression> elements = new ArrayList<>(list.size());
			for (Object element : list) {
				elements.add(parse(element));
			}
			return allLiteral(elements) ? new Literal(JsonValues.freeze(raw)) : new ArrayExpr(elements);
		}
		return new Literal(raw);
	}

	/**
	 * Parse a value in condition position: {@code null} means "always", an array is an implicit AND.
	 */
	public static Expression parseCondition(Object raw) {
		if (raw == null) {
			return Literal.TRUE;
		}
		if (raw instanceof Expression expression) {
			return expression;
		}
		if (raw instanceof List<?> list) {
			List<Expression> operands = new ArrayList<>(list.size());
			for (Object element : list) {
				operands.add(parseCondition(element));
			}
			return new And(operands);
		}
		if (raw instanceof Map<?, ?> map) {
			if (map.containsKey(AND)) {
				return new And(conditionList(map.get(AND)));
			}
			if (map.containsKey(OR)) {
				return new Or(conditionList(map.get(OR)));
			}
			if (hasSubject(map)) {
				return comparison(map);
			}
			return new Compare(parseObject(map), CompareOp.TRUTHY, null);
		}
		if (raw instanceof Boolean) {
			return new Literal(raw);
		}
		return new Compare(new Literal(raw), CompareOp.TRUTHY, null);
	}

	private static Expression parseObject(Map<?, ?> map) {
		if (map.containsKey(AND)) {
			return new And(conditionList(map.get(AND)));
		}
		if (map.containsKey(OR)) {
			return new Or(conditionList(map.get(OR)));
		}
		if (map.containsKey(COND)) {
			return new Cond(parseCondition(map.get(COND)), parse(map.get(THEN)), parse(map.get(ELSE)));
		}
		if (map.get(BIND_STATE) instanceof String path) {
			return new BindState(path);
		}
		if (map.containsKey(BIND_ITEM) && (map.get(BIND_ITEM) == null || map.get(BIND_ITEM) instanceof String)) {
			return new BindItem((String) map.get(BIND_ITEM));
		}
		if (map.get(COMPUTED) instanceof String name) {
			Map<String, Expression> args = new LinkedHashMap<>();
			if (map.get(ARGS) instanceof Map<?, ?> rawArgs) {
				for (Map.Entry<?, ?> entry : rawArgs.entrySet()) {
					args.put(String.valueOf(entry.getKey()), parse(entry.getValue()));
				}
			}
			return new Computed(name, args);
		}
		if (hasSubject(map)) {
			if (hasOperator(map)) {
				return comparison(map);
			}
			return subject(map);
		}
		Map<String, Expression> members = new LinkedHashMap<>();
		for (Map.Entry<?, ?> entry : map.entrySet()) {
			members.put(String.valueOf(entry.getKey()), parse(entry.getValue()));
		}
		return allLiteral(members.values()) ? new Literal(JsonValues.freeze(map)) : new ObjectExpr(members);
	}

	private static Expression comparison(Map<?, ?> map) {
		Expression subject = subject(map);
		CompareOp op = CompareOp.TRUTHY;
		Expression operand = null;
		for (CompareOp candidate : CompareOp.values()) {
			if (candidate.key() != null && map.containsKey(candidate.key())) {
				op = candidate;
				operand = parse(map.get(candidate.key()));
				break;
			}
		}
		Expression compare = new Compare(subject, op, operand);
		return Boolean.TRUE.equals(map.get(NOT)) ? new Not(compare) : compare;
	}

	private static Expression subject(Map<?, ?> map) {
		if (map.get(STATE) instanceof String path) {
			return new StateRef(path);
		}
		if (map.get(ITEM) instanceof String field) {
			return new ItemRef(field);
		}
		return new IndexRef();
	}

	private static boolean hasSubject(Map<?, ?> map) {
		return map.get(STATE) instanceof String || map.get(ITEM) instanceof String || Boolean.TRUE.equals(map.get(INDEX));
	}

	private static boolean hasOperator(Map<?, ?> map) {
		if (Boolean.TRUE.equals(map.get(NOT))) {
			return true;
		}
		for (CompareOp op : CompareOp.values()) {
			if (op.key() != null && map.containsKey(op.key())) {
				return true;
			}
		}
		return false;
	}

	private static List<Expression> conditionList(Object raw) {
		List<Expression> operands = new ArrayList<>();
		if (raw instanceof List<?> list) {
			for (Object element : list) {
				operands.add(parseCondition(element));
			}
		} else if (raw != null) {
			operands.add(parseCondition(raw));
		}
		return operands;
	}

	private static boolean allLiteral(Iterable<Expression> expressions) {
		for (Expression expression : expressions) {
			if (!(expression instanceof Literal)) {
				return false;
			}
		}
		return true;
	}
}

package org.javai.jsonui.expr;

/**
 * Operators of a single comparison condition. {@link #TRUTHY} is used when a condition names a
 * subject but no operator.
 */
public enum CompareOp {

	EQ("eq"),
	NEQ("neq"),
	GT("gt"),
	GTE("gte"),
	LT("lt"),
	LTE("lte"),
	TRUTHY(null);

	private final String key;

	CompareOp(String key) {
		this.key = key;
	}

	/**
	 * Property name of this operator in a condition object, {@code null} for {@link #TRUTHY}.
	 */
	public String key() {
		return key;
	}

	public boolean isOrdering() {
		return this == GT || this == GTE || this == LT || this == LTE;
	}
}

package org.javai.jsonui.spec;

/**
 * Machine-readable classification of a structural problem.
 */
public enum SpecIssueCode {

	/** No root id has been set. */
	MISSING_ROOT(false),

	/** The root id names a node that does not exist. */
	ROOT_NOT_FOUND(false),

	/** The document has no nodes at all. */
	EMPTY_SPEC(false),

	/** A node lists a child id with no node behind it; the generation is incomplete. */
	MISSING_CHILD(false),

	/** A visibility condition was placed inside {@code props}. */
	VISIBLE_IN_PROPS(true),

	/** An event binding map was placed inside {@code props}. */
	ON_IN_PROPS(true),

	/** A watch binding map was placed inside {@code props}. */
	WATCH_IN_PROPS(true),

	/** A node cannot be reached from the root. Only reported on request. */
	ORPHANED_NODE(false);

	private final boolean autoFixable;

	SpecIssueCode(boolean autoFixable) {
		this.autoFixable = autoFixable;
	}

	public boolean autoFixable() {
		return autoFixable;
	}
}

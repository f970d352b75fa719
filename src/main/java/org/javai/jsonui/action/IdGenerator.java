package org.javai.jsonui.action;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Source of the ids substituted for {@code "$id"} tokens by {@code pushState}.
 */
@FunctionalInterface
public interface IdGenerator {

	String nextId();

	/**
	 * {@code <epoch millis>-<counter>}; unique within the generator even for calls in the same
	 * millisecond.
	 */
	static IdGenerator timestamped() {
		AtomicLong counter = new AtomicLong();
		return () -> System.currentTimeMillis() + "-" + counter.incrementAndGet();
	}
}

package org.javai.jsonui.state;

/**
 * Handle returned by {@link StateStore#subscribe}. Unsubscribing twice is harmless.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

	void unsubscribe();

	@Override
	default void close() {
		unsubscribe();
	}
}

package org.javai.jsonui.action;

import java.util.Map;
import java.util.concurrent.CompletionStage;

/**
 * Host implementation of a named, non built-in action.
 */
@FunctionalInterface
public interface ActionHandler {

	/**
	 * @param params parameters resolved against the state at the time the action started
	 * @param context the session's state store and re-entrant dispatch
	 * @return a stage that completes when the action is done; exceptional completion is an action failure
	 */
	CompletionStage<Void> handle(Map<String, Object> params, ActionContext context);
}

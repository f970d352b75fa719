package org.javai.jsonui.action;

@FunctionalInterface
public interface ActionEventListener {

	void onEvent(ActionEvent event);
}

package org.javai.jsonui.state;

@FunctionalInterface
public interface StateListener {

	void onChange(StateChangeEvent event);
}

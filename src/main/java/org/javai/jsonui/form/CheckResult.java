package org.javai.jsonui.form;

public record CheckResult(String fn, boolean valid, String message) {
}

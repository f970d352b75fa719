package org.javai.jsonui;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import com.fasterxml.jackson.core.JsonProcessingException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.javai.jsonui.expr.RepeatScope;
import org.javai.jsonui.spec.Spec;
import org.javai.jsonui.spec.SpecJson;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class UiSessionTest {

	private static final String DOCUMENT = """
			{
			  "root": "page",
			  "nodes": {
			    "page": {
			      "type": "Stack",
			      "props": {},
			      "children": ["greeting", "name", "todo", "save"]
			    },
			    "greeting": {
			      "type": "Text",
			      "props": { "text": { "$computed": "greet", "args": { "name": { "$state": "/user/name" } } } },
			      "visible": { "$state": "/showGreeting" }
			    },
			    "name": {
			      "type": "Input",
			      "props": { "value": { "$bindState": "/user/name" } }
			    },
			    "todo": {
			      "type": "Row",
			      "props": { "label": { "$item": "title" } },
			      "repeat": { "statePath": "/todos", "key": "id" },
			      "on": { "press": { "action": "setState", "params": { "statePath": "/selected", "value": { "$item": "id" } } } }
			    },
			    "save": {
			      "type": "Button",
			      "props": { "label": "Save" },
			      "on": { "press": [
			        { "action": "save", "params": { "name": { "$state": "/user/name" } } },
			        { "action": "setState", "params": { "statePath": "/saved", "value": true } }
			      ] },
			      "watch": { "/user/name": { "action": "setState", "params": { "statePath": "/saved", "value": false } } }
			    }
			  },
			  "state": {
			    "user": { "name": "Ada" },
			    "showGreeting": true,
			    "todos": [ { "id": "t1", "title": "Write" }, { "id": "t2", "title": "Test" } ]
			  }
			}
			""";

	private List<Object> saved;
	private UiSession session;

	@BeforeEach
	void setup() throws JsonProcessingException {
		saved = new ArrayList<>();
		Spec spec = SpecJson.fromJson(DOCUMENT);
		session = UiSession.builder(spec)
				.withFunction("greet", args -> "Hello, " + args.get("name"))
				.handler("save", (params, ctx) -> {
					saved.add(params.get("name"));
					return CompletableFuture.completedFuture(null);
				})
				.build();
	}

	@AfterEach
	void tearDown() {
		session.close();
	}

	@Test
	void stateIsSeededFromDocument() {
		assertThat(session.stateStore().get("/user/name")).isEqualTo("Ada");
	}

	@Test
	void resolvesPropsAgainstState() {
		assertThat(session.resolveProps("greeting", null)).containsEntry("text", "Hello, Ada");
		assertThat(session.resolveProps("name", null)).containsEntry("value", "Ada");
		assertThat(session.resolveBindings("name", null)).containsEntry("value", "/user/name");
	}

	@Test
	void visibilityFollowsState() {
		assertThat(session.isVisible("greeting", null)).isTrue();
		session.stateStore().set("/showGreeting", false);
		assertThat(session.isVisible("greeting", null)).isFalse();
		assertThat(session.isVisible("save", null)).isTrue();
	}

	@Test
	void repeatedNodeResolvesPerItem() {
		List<RepeatScope> scopes = session.repeatScopes("todo");

		assertThat(scopes).hasSize(2);
		assertThat(session.resolveProps("todo", scopes.get(1))).containsEntry("label", "Test");
		assertThat(session.repeatScopes("page")).isEmpty();
	}

	@Test
	void dispatchRunsBindingsInOrder() {
		session.dispatch("save", "press", null).join();

		assertThat(saved).containsExactly("Ada");
		assertThat(session.stateStore().get("/saved")).isEqualTo(true);
	}

	@Test
	void dispatchResolvesItemParameters() {
		RepeatScope first = session.repeatScopes("todo").get(0);

		session.dispatch("todo", "press", first).join();

		assertThat(session.stateStore().get("/selected")).isEqualTo("t1");
	}

	@Test
	void dispatchWithoutBindingsCompletes() {
		assertThat(session.dispatch("greeting", "press", null)).isCompleted();
	}

	@Test
	void watchersFireOnStateChange() {
		session.stateStore().set("/saved", true);
		session.stateStore().set("/user/name", "Grace");

		assertThat(session.stateStore().get("/saved")).isEqualTo(false);
		assertThat(session.resolveProps("greeting", null)).containsEntry("text", "Hello, Grace");
	}

	@Test
	void unknownNodeIsRejected() {
		assertThatThrownBy(() -> session.resolveProps("missing", null))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("Unknown node: missing");
	}
}

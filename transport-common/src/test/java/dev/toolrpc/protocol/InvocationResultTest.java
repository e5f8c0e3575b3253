package dev.toolrpc.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class InvocationResultTest {

	private final ObjectMapper mapper = new ObjectMapper();

	@Test
	void textResultIsNotAnError() {
		InvocationResult result = InvocationResult.text("5");

		assertThat(result.isError()).isFalse();
		assertThat(result.joinedText()).isEqualTo("5");
	}

	@Test
	void errorItemMarksToolLevelFailure() throws Exception {
		JsonNode node = mapper.valueToTree(InvocationResult.error("Weather API unavailable"));

		assertThat(node.path("isError").asBoolean()).isTrue();
		assertThat(node.path("content").get(0).path("type").asText()).isEqualTo("error");
		assertThat(node.path("content").get(0).path("text").asText()).isEqualTo("Weather API unavailable");
		assertThat(node.path("content").get(0).has("error")).isFalse();
	}

	@Test
	void readsResultFromWire() throws Exception {
		String json = "{\"content\":[{\"type\":\"text\",\"text\":\"a\"},{\"type\":\"error\",\"text\":\"b\"}],\"isError\":true}";

		InvocationResult result = mapper.readValue(json, InvocationResult.class);

		assertThat(result.content()).containsExactly(ContentItem.text("a"), ContentItem.error("b"));
		assertThat(result.isError()).isTrue();
	}

}

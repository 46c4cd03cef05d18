package hu.advjava.crossword.bonus;

import static org.junit.jupiter.api.Assertions.*;

import java.io.StringReader;

import org.junit.jupiter.api.Test;

import hu.advjava.crossword.ExampleCrossword;
import jakarta.json.Json;
import jakarta.json.JsonObject;
import jakarta.json.JsonReader;

public class McpResourceTest {
	private final McpResource resource = new McpResource();

	private static JsonObject request(int id, String method, JsonObject params) {
		var builder = Json.createObjectBuilder().add("jsonrpc", "2.0").add("id", id).add("method", method);
		if (params != null) builder.add("params", params);
		return builder.build();
	}

	// The tool result is JSON serialized into the text content item.
	private static JsonObject toolText(JsonObject response) {
		String text = response.getJsonObject("result").getJsonArray("content").getJsonObject(0).getString("text");
		try (JsonReader reader = Json.createReader(new StringReader(text))) {
			return reader.readObject();
		}
	}

	@Test
	public void initializeAnnouncesTheServer() {
		JsonObject response = resource.dispatch(request(1, "initialize", null));
		assertAll(
				() -> assertEquals("2.0", response.getString("jsonrpc")),
				() -> assertEquals(1, response.getInt("id")),
				() -> assertEquals("CrosswordMCP",
						response.getJsonObject("result").getJsonObject("serverInfo").getString("name"))
		);
	}

	@Test
	public void listsTheSolveTool() {
		JsonObject response = resource.dispatch(request(2, "tools/list", null));
		assertEquals("solve_crossword",
				response.getJsonObject("result").getJsonArray("tools").getJsonObject(0).getString("name"));
	}

	@Test
	public void solvesACrosswordGivenAsText() {
		JsonObject args = Json.createObjectBuilder()
				.add("structure", ExampleCrossword.NUMBERS.getStructure())
				.add("words", ExampleCrossword.NUMBERS.getWords())
				.build();
		JsonObject response = resource.dispatch(request(3, "tools/call",
				Json.createObjectBuilder().add("name", "solve_crossword").add("arguments", args).build()));

		JsonObject res = toolText(response);
		assertAll(
				() -> assertEquals("SOLVED", res.getString("state")),
				() -> assertEquals(ExampleCrossword.NUMBERS.getSolution().orElseThrow(), res.getString("grid")),
				() -> assertEquals(4, res.getJsonArray("slots").size())
		);
	}

	@Test
	public void reportsCrosswordsWithoutSolution() {
		JsonObject args = Json.createObjectBuilder()
				.add("structure", "____")
				.add("words", Json.createArrayBuilder().add("cat").add("dog"))
				.build();
		JsonObject response = resource.dispatch(request(4, "tools/call",
				Json.createObjectBuilder().add("name", "solve_crossword").add("arguments", args).build()));

		JsonObject res = toolText(response);
		assertEquals("INFEASIBLE", res.getString("state"));
		assertFalse(res.containsKey("grid"));
	}

	@Test
	public void rejectsMissingArguments() {
		JsonObject response = resource.dispatch(request(5, "tools/call",
				Json.createObjectBuilder().add("name", "solve_crossword")
						.add("arguments", Json.createObjectBuilder().add("structure", "___")).build()));
		assertEquals(McpResource.INVALID_PARAMS, response.getJsonObject("error").getInt("code"));
	}

	@Test
	public void rejectsRequestsWithoutParamsObjects() {
		JsonObject noParams = resource.dispatch(request(11, "tools/call", null));
		JsonObject noUri = resource.dispatch(request(12, "resources/read", null));
		JsonObject textArguments = resource.dispatch(request(13, "tools/call",
				Json.createObjectBuilder().add("name", "solve_crossword").add("arguments", "___").build()));
		JsonObject noStructure = resource.dispatch(request(14, "tools/call",
				Json.createObjectBuilder().add("name", "solve_crossword")
						.add("arguments", Json.createObjectBuilder().add("words", "cat")).build()));
		assertAll(
				() -> assertEquals(McpResource.INVALID_PARAMS, noParams.getJsonObject("error").getInt("code")),
				() -> assertEquals(McpResource.INVALID_PARAMS, noUri.getJsonObject("error").getInt("code")),
				() -> assertEquals(McpResource.INVALID_PARAMS, textArguments.getJsonObject("error").getInt("code")),
				() -> assertEquals(McpResource.INVALID_PARAMS, noStructure.getJsonObject("error").getInt("code")),
				() -> assertEquals(14, noStructure.getInt("id"))
		);
	}

	@Test
	public void unknownMethodsAndToolsAreNotFound() {
		JsonObject method = resource.dispatch(request(6, "prompts/list", null));
		JsonObject tool = resource.dispatch(request(7, "tools/call",
				Json.createObjectBuilder().add("name", "generate_crossword").build()));
		assertAll(
				() -> assertEquals(McpResource.METHOD_NOT_FOUND, method.getJsonObject("error").getInt("code")),
				() -> assertEquals(McpResource.METHOD_NOT_FOUND, tool.getJsonObject("error").getInt("code"))
		);
	}

	@Test
	public void servesExamplesAsResources() {
		JsonObject list = resource.dispatch(request(8, "resources/list", null));
		assertEquals(ExampleCrossword.values().length, list.getJsonObject("result").getJsonArray("resources").size());

		String uri = McpResource.nameToUri.apply(ExampleCrossword.SQUARE.name());
		assertEquals("crossword://examples/square", uri);
		JsonObject read = resource.dispatch(request(9, "resources/read", Json.createObjectBuilder().add("uri", uri).build()));
		String text = read.getJsonObject("result").getJsonArray("contents").getJsonObject(0).getString("text");
		assertTrue(text.contains("structure"));

		JsonObject missing = resource.dispatch(request(10, "resources/read",
				Json.createObjectBuilder().add("uri", "crossword://examples/nope").build()));
		assertEquals(McpResource.METHOD_NOT_FOUND, missing.getJsonObject("error").getInt("code"));
	}
}

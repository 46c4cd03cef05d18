package hu.advjava.crossword.bonus;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import hu.advjava.crossword.Crossword;
import hu.advjava.crossword.CrosswordRenderer;
import hu.advjava.crossword.CrosswordSolver;
import hu.advjava.crossword.ExampleCrossword;
import hu.advjava.crossword.Variable;
import jakarta.json.Json;
import jakarta.json.JsonArrayBuilder;
import jakarta.json.JsonObject;
import jakarta.json.JsonString;
import jakarta.json.JsonValue;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.sse.OutboundSseEvent;
import jakarta.ws.rs.sse.Sse;
import jakarta.ws.rs.sse.SseEventSink;

@Path("/mcp")
public class McpResource {
	private static final Logger log = LogManager.getFormatterLogger(McpResource.class);

	static final int METHOD_NOT_FOUND = -32601;
	static final int INVALID_PARAMS = -32602;
	static final int SERVER_ERROR = -32000;

	public static final Function<String, String> nameToUri = name ->
		"crossword://examples/%s".formatted(name.toLowerCase().replaceAll("_", "-"));

	@Context
	private Sse sse;

	/* -------------------- POST (JSON) -------------------- */

	@POST
	@Consumes(MediaType.APPLICATION_JSON)
	@Produces(MediaType.APPLICATION_JSON)
	public Response handleJson(JsonObject request, @Context HttpHeaders headers, @Context UriInfo ui) {
		logRequest("POST", ui, headers);
		return Response.ok(dispatch(request), MediaType.APPLICATION_JSON_TYPE)
				.header("Cache-Control", "no-cache")
				.build();
	}

	/* -------------------- POST (SSE) -------------------- */

	// Same path, different negotiated media type
	@POST
	@Consumes(MediaType.APPLICATION_JSON)
	@Produces(MediaType.SERVER_SENT_EVENTS)
	public void handleSse(JsonObject request, @Context SseEventSink sink) {
		// dispatch never throws, faults come back as error envelopes
		OutboundSseEvent evt = sse.newEventBuilder()
				.name("jsonrpc")
				.mediaType(MediaType.APPLICATION_JSON_TYPE)
				.data(JsonObject.class, dispatch(request))
				.build();
		sink.send(evt);
	}

	@GET
	@Path("/stream")
	@Produces(MediaType.SERVER_SENT_EVENTS)
	public void stream(@Context SseEventSink sink) {
		JsonObject ready = Json.createObjectBuilder()
				.add("jsonrpc", "2.0")
				.add("method", "server/ready")
				.add("params", Json.createObjectBuilder())
				.build();

		sink.send(sse.newEventBuilder()
				.name("jsonrpc")
				.mediaType(MediaType.APPLICATION_JSON_TYPE)
				.data(JsonObject.class, ready)
				.build());
	}

	/* -------------------- Core dispatcher -------------------- */

	public JsonObject dispatch(JsonObject request) {
		String method = request.getString("method", "");
		int id = request.getInt("id", -1);

		log.info("MCP <- %s (id=%d)", method, id);
		try {
			return switch (method) {
				case "initialize" -> okEnvelope(id, Json.createObjectBuilder()
						.add("protocolVersion", "2025-06-18")
						.add("capabilities", Json.createObjectBuilder().build())
						.add("serverInfo", Json.createObjectBuilder()
								.add("name", "CrosswordMCP")
								.add("version", "1.0").build())
						.add("instructions",
								"This server fills crossword grids (solve_crossword) "
								+ "and offers a few example puzzles as resources.")
						.build());
				case "tools/list" -> okEnvelope(id, toolList());
				case "tools/call" -> callTool(id, required(request, "params"));
				case "resources/list" -> okEnvelope(id, resourceList());
				case "resources/read" -> readResource(id, required(request, "params"));
				default -> errorEnvelope(id, METHOD_NOT_FOUND, "Method not found: " + method);
			};
		} catch (IllegalArgumentException | ClassCastException e) {
			log.warn("Rejected %s request: %s", method, e.toString());
			return errorEnvelope(id, INVALID_PARAMS, "Invalid params: " + e.getMessage());
		} catch (RuntimeException e) {
			log.error("Failed to handle %s", method, e);
			return errorEnvelope(id, SERVER_ERROR, "Server error: " + e.getMessage());
		}
	}

	private static JsonObject toolList() {
		return Json.createObjectBuilder()
				.add("tools", Json.createArrayBuilder()
						.add(Json.createObjectBuilder()
								.add("name", "solve_crossword")
								.add("description", "Fill a crossword grid. Structure rows use '_' for open cells; "
										+ "any other character is a block.")
								.add("inputSchema", Json.createObjectBuilder()
										.add("type", "object")
										.add("properties", Json.createObjectBuilder()
												.add("structure", Json.createObjectBuilder()
														.add("type", "string"))
												.add("words", Json.createObjectBuilder()
														.add("type", "array")
														.add("items", Json.createObjectBuilder()
																.add("type", "string"))))
										.add("required", Json.createArrayBuilder().add("structure").add("words")))))
				.build();
	}

	private JsonObject callTool(int id, JsonObject params) {
		String toolName = params.getString("name", "");
		if (!"solve_crossword".equals(toolName)) return errorEnvelope(id, METHOD_NOT_FOUND, "Unknown tool: " + toolName);

		JsonObject args = required(params, "arguments");
		String structure = args.getString("structure", null);
		if (structure == null) throw new IllegalArgumentException("structure is required");
		Crossword crossword = new Crossword(structure.lines().toList(), wordsArgument(args.get("words")));
		CrosswordSolver solver = new CrosswordSolver(crossword);
		var assignment = solver.solve();

		var res = Json.createObjectBuilder().add("state", solver.getState().toString());
		assignment.ifPresent(a -> res
				.add("grid", new CrosswordRenderer(crossword).render(a))
				.add("slots", slotsToJson(a)));

		JsonObject result = Json.createObjectBuilder().add("content",
				Json.createArrayBuilder().add(
						Json.createObjectBuilder().add("type", "text").add("text", res.build().toString())))
				.build();
		return okEnvelope(id, result);
	}

	// Either a JSON array of words or one string with a word per line.
	private static List<String> wordsArgument(JsonValue words) {
		if (words == null) throw new IllegalArgumentException("words is required");
		if (words.getValueType() == JsonValue.ValueType.STRING) return ((JsonString) words).getString().lines().toList();
		return words.asJsonArray().getValuesAs(JsonString.class).stream().map(JsonString::getString).toList();
	}

	private static JsonArrayBuilder slotsToJson(Map<Variable, String> assignment) {
		JsonArrayBuilder ab = Json.createArrayBuilder();
		assignment.forEach((variable, word) -> ab.add(Json.createObjectBuilder()
				.add("row", variable.row())
				.add("column", variable.column())
				.add("direction", variable.direction().toString())
				.add("length", variable.length())
				.add("word", word)));
		return ab;
	}

	private static JsonObject resourceList() {
		JsonArrayBuilder resources = Json.createArrayBuilder();
		Arrays.stream(ExampleCrossword.values()).forEach(example -> resources.add(Json.createObjectBuilder()
				.add("uri", nameToUri.apply(example.name()))
				.add("name", "Example " + example.name().toLowerCase())
				.add("mimeType", "application/json")));
		return Json.createObjectBuilder().add("resources", resources).build();
	}

	private JsonObject readResource(int id, JsonObject params) {
		String uri = params.getString("uri", "");
		var maybeExample = ExampleCrossword.findByName.apply(uri, nameToUri);
		if (maybeExample.isEmpty()) return errorEnvelope(id, METHOD_NOT_FOUND, "Unknown resource: " + uri);

		var example = maybeExample.get();
		JsonObject result = Json.createObjectBuilder()
				.add("uri", uri)
				.add("mimeType", "application/json")
				.add("contents", Json.createArrayBuilder()
						.add(Json.createObjectBuilder()
								.add("uri", uri)
								.add("mimeType", "application/json")
								.add("text", Json.createObjectBuilder()
										.add("structure", example.getStructure())
										.add("words", example.getWords())
										.build()
										.toString())))
				.build();
		return okEnvelope(id, result);
	}

	/* -------------------- JSON helpers -------------------- */

	private static JsonObject required(JsonObject parent, String key) {
		JsonValue value = parent.get(key);
		if (value == null || value.getValueType() != JsonValue.ValueType.OBJECT)
			throw new IllegalArgumentException(key + " must be an object");
		return value.asJsonObject();
	}

	private static JsonObject okEnvelope(int id, JsonObject result) {
		return Json.createObjectBuilder()
				.add("jsonrpc", "2.0")
				.add("id", id)
				.add("result", result)
				.build();
	}

	private static JsonObject errorEnvelope(int id, int code, String message) {
		return Json.createObjectBuilder()
				.add("jsonrpc", "2.0")
				.add("id", id)
				.add("error", Json.createObjectBuilder()
						.add("code", code)
						.add("message", String.valueOf(message)))
				.build();
	}

	private static void logRequest(String method, UriInfo ui, HttpHeaders h) {
		log.debug("%s %s Accept=%s Content-Type=%s", method, ui.getRequestUri(),
				h.getHeaderString("Accept"), h.getHeaderString("Content-Type"));
	}
}

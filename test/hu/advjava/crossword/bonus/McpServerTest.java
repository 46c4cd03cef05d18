package hu.advjava.crossword.bonus;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import org.glassfish.grizzly.http.server.HttpServer;
import org.junit.jupiter.api.Test;

import hu.advjava.crossword.bonus.McpServer.ServerConfig;

public class McpServerTest {

	@Test
	public void configDefaultsToLocalhost() {
		ServerConfig cfg = ServerConfig.fromEnvironment(Map.of());
		assertEquals(new ServerConfig("127.0.0.1", 8080), cfg);
		assertEquals("http://127.0.0.1:8080", cfg.baseUri());
	}

	@Test
	public void configReadsHostAndPort() {
		assertEquals(new ServerConfig("0.0.0.0", 9090),
				ServerConfig.fromEnvironment(Map.of("MCP_HOST", "0.0.0.0", "MCP_PORT", " 9090 ")));
	}

	@Test
	public void configRejectsBadPorts() {
		assertAll(
				() -> assertThrows(IllegalStateException.class, () -> ServerConfig.fromEnvironment(Map.of("MCP_PORT", "http"))),
				() -> assertThrows(IllegalStateException.class, () -> ServerConfig.fromEnvironment(Map.of("MCP_PORT", "70000")))
		);
	}

	@Test
	public void serverAnswersJsonRpcOverHttp() throws IOException, InterruptedException {
		int port;
		try (ServerSocket socket = new ServerSocket(0)) {
			port = socket.getLocalPort();
		}
		String baseUri = new ServerConfig("127.0.0.1", port).baseUri();
		HttpServer server = McpServer.runServer(baseUri);
		try {
			HttpRequest req = HttpRequest.newBuilder()
					.uri(URI.create(baseUri + "/mcp"))
					.header("Content-Type", "application/json")
					.header("Accept", "application/json")
					.POST(HttpRequest.BodyPublishers.ofString(
							"{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"initialize\"}", StandardCharsets.UTF_8))
					.build();
			HttpResponse<String> res = HttpClient.newHttpClient().send(req, HttpResponse.BodyHandlers.ofString());
			assertAll(
					() -> assertEquals(200, res.statusCode()),
					() -> assertTrue(res.body().contains("CrosswordMCP"), res.body())
			);
		} finally {
			server.shutdownNow();
		}
	}
}

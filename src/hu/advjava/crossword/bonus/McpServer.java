package hu.advjava.crossword.bonus;

import java.net.URI;
import java.util.Map;
import java.util.concurrent.CountDownLatch;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.glassfish.grizzly.http.server.HttpServer;
import org.glassfish.jersey.grizzly2.httpserver.GrizzlyHttpServerFactory;
import org.glassfish.jersey.jsonp.JsonProcessingFeature;
import org.glassfish.jersey.media.sse.SseFeature;
import org.glassfish.jersey.server.ResourceConfig;
import org.glassfish.jersey.server.ServerProperties;

public class McpServer {
	private static final Logger log = LogManager.getFormatterLogger(McpServer.class);

	record ServerConfig(String host, int port) {
		static final String DEFAULT_HOST = "127.0.0.1";
		static final int DEFAULT_PORT = 8080;

		String baseUri() {
			return "http://%s:%d".formatted(host, port);
		}

		static ServerConfig fromEnvironment(Map<String, String> env) {
			String host = env.getOrDefault("MCP_HOST", DEFAULT_HOST);
			if (host.isBlank()) host = DEFAULT_HOST;

			String portValue = env.get("MCP_PORT");
			if (portValue == null || portValue.isBlank()) return new ServerConfig(host, DEFAULT_PORT);
			try {
				int port = Integer.parseInt(portValue.trim());
				if (port < 1 || port > 65535) throw new IllegalStateException("MCP_PORT out of range: " + port);
				return new ServerConfig(host, port);
			} catch (NumberFormatException e) {
				throw new IllegalStateException("MCP_PORT is not a number: " + portValue, e);
			}
		}
	}

	public static void main(String[] args) throws InterruptedException {
		var cfg = ServerConfig.fromEnvironment(System.getenv());
		HttpServer server = runServer(cfg.baseUri());
		log.info("Crossword MCP server listening on %s/mcp", cfg.baseUri());

		CountDownLatch stopped = new CountDownLatch(1);
		Runtime.getRuntime().addShutdownHook(new Thread(() -> {
			server.shutdownNow();
			stopped.countDown();
		}));
		stopped.await();
	}

	static HttpServer runServer(String baseUri) {
		ResourceConfig rc = new ResourceConfig()
				.register(McpResource.class)
				.register(SseFeature.class)
				.register(JsonProcessingFeature.class)
				.property(ServerProperties.WADL_FEATURE_DISABLE, true);
		return GrizzlyHttpServerFactory.createHttpServer(URI.create(baseUri), rc);
	}
}

package io.penguin.metrics.agent.probe;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class DockerSocketClientTest {

    private static byte[] response(String statusLine, String body) {
        return (statusLine + "\r\nContent-Type: application/json\r\n\r\n" + body).getBytes(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Should parse the JSON body of a successful response")
    void ok() throws IOException {
        Optional<JsonNode> node = DockerSocketClient.parseResponse(
                response("HTTP/1.0 200 OK", "{\"Id\":\"abc\",\"Name\":\"/redis\"}"), "/containers/redis/json");

        assertEquals("abc", node.orElseThrow().get("Id").asText());
    }

    @Test
    @DisplayName("Should map 404 to empty")
    void notFound() throws IOException {
        assertTrue(DockerSocketClient.parseResponse(
                response("HTTP/1.0 404 Not Found", "{\"message\":\"No such container\"}"), "/x").isEmpty());
    }

    @Test
    @DisplayName("Should fail on server errors and malformed responses")
    void errors() {
        IOException e = assertThrows(IOException.class, () -> DockerSocketClient.parseResponse(
                response("HTTP/1.0 500 Internal Server Error", "boom"), "/containers/json"));
        assertTrue(e.getMessage().contains("500"));
        assertThrows(IOException.class, () -> DockerSocketClient.parseResponse(
                "garbage".getBytes(StandardCharsets.UTF_8), "/containers/json"));
    }
}

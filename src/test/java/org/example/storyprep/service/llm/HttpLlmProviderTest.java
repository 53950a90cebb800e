package org.example.storyprep.service.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HttpLlmProviderTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final XaiLlmProvider xai = new XaiLlmProvider("key", "grok-test", 30);
    private final AnthropicLlmProvider anthropic = new AnthropicLlmProvider("key", "claude-test", 30);
    private final OllamaLlmProvider ollama = new OllamaLlmProvider("http://localhost:11434", "llama-test", 30);

    @Test
    void xai_jsonOptions_requestJsonObjectFormat() {
        Map<String, Object> body = xai.requestBody("Find breaks", LlmOptions.json(800));

        assertEquals("grok-test", body.get("model"));
        assertEquals(800, body.get("max_tokens"));
        assertEquals(Map.of("type", "json_object"), body.get("response_format"));
    }

    @Test
    void xai_parse_readsFirstChoice() {
        String text = xai.parse("{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"BREAK_PARA: 12\"}}]}");

        assertEquals("BREAK_PARA: 12", text);
    }

    @Test
    void anthropic_jsonOptions_appendInstructionAndDefaultMaxTokens() {
        Map<String, Object> body = anthropic.requestBody("Find breaks", new LlmOptions(0.0, null, true));

        assertEquals(4096, body.get("max_tokens"));
        JsonNode json = objectMapper.valueToTree(body);
        assertEquals("user", json.path("messages").path(0).path("role").asText());
        assertEquals("Find breaks" + AnthropicLlmProvider.JSON_INSTRUCTION,
                json.path("messages").path(0).path("content").asText());
    }

    @Test
    void anthropic_parse_joinsTextBlocks() {
        String text = anthropic.parse("{\"content\":[{\"type\":\"text\",\"text\":\"Ada \"},"
                + "{\"type\":\"tool_use\",\"id\":\"x\"},{\"type\":\"text\",\"text\":\"waited.\"}]}");

        assertEquals("Ada waited.", text);
    }

    @Test
    void ollama_requestBody_setsContextWindowAndTokenBudget() {
        Map<String, Object> body = ollama.requestBody("Summarize", LlmOptions.withTemperature(0.3, 300));

        assertEquals(false, body.get("stream"));
        JsonNode options = objectMapper.valueToTree(body).path("options");
        assertEquals(OllamaLlmProvider.CONTEXT_WINDOW, options.path("num_ctx").asInt());
        assertEquals(300, options.path("num_predict").asInt());
        assertFalse(body.containsKey("format"));
    }

    @Test
    void parse_missingTextOrBadJson_throwsProviderException() {
        assertThrows(LlmProviderException.class, () -> ollama.parse("{\"done\":true}"));
        assertThrows(LlmProviderException.class, () -> xai.parse("{\"choices\":[]}"));
        assertThrows(LlmProviderException.class, () -> anthropic.parse("not json"));
        assertThrows(LlmProviderException.class, () -> anthropic.parse(""));
    }

    @Test
    void availability_followsApiKey() {
        assertTrue(xai.isAvailable());
        assertFalse(new XaiLlmProvider(" ", "grok-test", 30).isAvailable());
        assertFalse(new AnthropicLlmProvider(null, "claude-test", 30).isAvailable());
        assertEquals("anthropic:claude-test", anthropic.getProviderName());
    }
}

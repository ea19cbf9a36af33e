package com.overseer.test;

import com.overseer.domain.workflow.adapter.gateway.IAgentGateway;
import com.overseer.infrastructure.gateway.GatewayReplyReader;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class GatewayReplyReaderTest {

    @Test
    public void shouldReadLastAssistantStringContent() {
        RecordingHistoryGateway gateway = new RecordingHistoryGateway(List.of(
                message("assistant", "first answer"),
                message("user", "follow up"),
                message("assistant", "  final answer  "),
                message("user", "thanks")));

        String reply = new GatewayReplyReader(gateway, 20, 10000L).readLatestReply("agent:main:workflow:wi-1:plan");

        Assertions.assertEquals("final answer", reply);
        Assertions.assertEquals("chat.history", gateway.method);
        Assertions.assertEquals("agent:main:workflow:wi-1:plan", gateway.params.get("sessionKey"));
        Assertions.assertEquals(20, gateway.params.get("limit"));
        Assertions.assertEquals(10000L, gateway.timeoutMs);
    }

    @Test
    public void shouldJoinTextBlocksAndSkipOtherBlockTypes() {
        List<Object> blocks = new ArrayList<>();
        blocks.add(block("thinking", "internal"));
        blocks.add(block("text", "part one"));
        blocks.add(block("tool_use", "ignored"));
        blocks.add(block("output_text", "part two"));
        RecordingHistoryGateway gateway = new RecordingHistoryGateway(List.of(message("assistant", blocks)));

        String reply = new GatewayReplyReader(gateway, 20, 10000L).readLatestReply("s");

        Assertions.assertEquals("part one\npart two", reply);
    }

    @Test
    public void shouldSkipAssistantMessagesWithoutText() {
        List<Object> toolOnly = new ArrayList<>();
        toolOnly.add(block("tool_use", "call"));
        RecordingHistoryGateway gateway = new RecordingHistoryGateway(List.of(
                message("assistant", "earlier text"),
                message("assistant", toolOnly)));

        String reply = new GatewayReplyReader(gateway, 20, 10000L).readLatestReply("s");

        Assertions.assertEquals("earlier text", reply);
    }

    @Test
    public void shouldReturnNullWithoutAssistantReply() {
        RecordingHistoryGateway gateway = new RecordingHistoryGateway(List.of(message("user", "hello")));

        Assertions.assertNull(new GatewayReplyReader(gateway, 20, 10000L).readLatestReply("s"));
        Assertions.assertNull(new GatewayReplyReader((method, params, timeoutMs) -> new HashMap<>(), 20, 10000L)
                .readLatestReply("s"));
    }

    private static Map<String, Object> message(String role, Object content) {
        Map<String, Object> message = new HashMap<>();
        message.put("role", role);
        message.put("content", content);
        return message;
    }

    private static Map<String, Object> block(String type, String text) {
        Map<String, Object> block = new HashMap<>();
        block.put("type", type);
        block.put("text", text);
        return block;
    }

    private static class RecordingHistoryGateway implements IAgentGateway {

        private final List<Map<String, Object>> messages;
        private String method;
        private Map<String, Object> params;
        private long timeoutMs;

        private RecordingHistoryGateway(List<Map<String, Object>> messages) {
            this.messages = messages;
        }

        @Override
        public Map<String, Object> call(String method, Map<String, Object> params, long timeoutMs) {
            this.method = method;
            this.params = params;
            this.timeoutMs = timeoutMs;
            Map<String, Object> payload = new HashMap<>();
            payload.put("messages", new ArrayList<>(messages));
            return payload;
        }
    }
}

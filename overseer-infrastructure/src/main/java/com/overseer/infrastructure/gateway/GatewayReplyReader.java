package com.overseer.infrastructure.gateway;

import com.overseer.domain.workflow.adapter.gateway.IAgentGateway;
import com.overseer.domain.workflow.adapter.gateway.IReplyReader;
import com.overseer.types.common.Constants;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 基于 chat.history 的回复读取：取会话中最后一条 assistant 消息的文本。
 * content 可以是字符串，也可以是 {@code [{type:"text", text}]} 文本块数组。
 */
@Component
public class GatewayReplyReader implements IReplyReader {

    private static final String ASSISTANT_ROLE = "assistant";

    private final IAgentGateway agentGateway;
    private final int historyLimit;
    private final long historyTimeoutMs;

    public GatewayReplyReader(IAgentGateway agentGateway,
                              @Value("${overseer.gateway.history-limit:20}") int historyLimit,
                              @Value("${overseer.gateway.history-timeout-ms:10000}") long historyTimeoutMs) {
        this.agentGateway = agentGateway;
        this.historyLimit = historyLimit;
        this.historyTimeoutMs = historyTimeoutMs;
    }

    @Override
    public String readLatestReply(String sessionKey) {
        Map<String, Object> params = new HashMap<>();
        params.put("sessionKey", sessionKey);
        params.put("limit", historyLimit);
        Map<String, Object> history = agentGateway.call(Constants.METHOD_CHAT_HISTORY, params, historyTimeoutMs);
        if (history == null || !(history.get("messages") instanceof List<?>)) {
            return null;
        }
        List<?> messages = (List<?>) history.get("messages");
        for (int i = messages.size() - 1; i >= 0; i--) {
            Object item = messages.get(i);
            if (!(item instanceof Map<?, ?>)) {
                continue;
            }
            Map<?, ?> message = (Map<?, ?>) item;
            if (!ASSISTANT_ROLE.equals(message.get("role"))) {
                continue;
            }
            String text = extractText(message.get("content"));
            if (text != null) {
                return text;
            }
        }
        return null;
    }

    private String extractText(Object content) {
        if (content instanceof String) {
            return StringUtils.trimToNull((String) content);
        }
        if (!(content instanceof List<?>)) {
            return null;
        }
        List<String> parts = new ArrayList<>();
        for (Object block : (List<?>) content) {
            if (!(block instanceof Map<?, ?>)) {
                continue;
            }
            Map<?, ?> part = (Map<?, ?>) block;
            Object type = part.get("type");
            Object text = part.get("text");
            if (!(text instanceof String) || !("text".equals(type) || "output_text".equals(type))) {
                continue;
            }
            String trimmed = StringUtils.trimToNull((String) text);
            if (trimmed != null) {
                parts.add(trimmed);
            }
        }
        return parts.isEmpty() ? null : String.join("\n", parts);
    }
}

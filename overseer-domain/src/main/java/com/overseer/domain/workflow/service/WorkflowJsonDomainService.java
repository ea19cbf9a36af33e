package com.overseer.domain.workflow.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 工作流 JSON 领域服务：解析子 Agent 回复中的 JSON 对象，并提供宽松取值。
 * <p>
 * 回复可能是纯 JSON、markdown 代码块包裹的 JSON，或前后夹带说明文字的 JSON，
 * 依次按 严格解析 → 代码块 → 首尾花括号片段 兜底。
 * </p>
 */
@Service
public class WorkflowJsonDomainService {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<Map<String, Object>>() {};
    private static final Pattern CODE_BLOCK = Pattern.compile("```(?:json|JSON)?\\s*\\n?([\\s\\S]*?)```");

    private final ObjectMapper objectMapper;

    public WorkflowJsonDomainService(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Map<String, Object> parseEmbeddedJsonObject(String text) {
        if (isBlank(text)) {
            return null;
        }
        String trimmed = text.trim();
        Map<String, Object> parsed = parseStrict(trimmed);
        if (parsed != null) {
            return parsed;
        }

        Matcher matcher = CODE_BLOCK.matcher(trimmed);
        if (matcher.find()) {
            parsed = parseStrict(matcher.group(1).trim());
            if (parsed != null) {
                return parsed;
            }
        }

        int start = trimmed.indexOf('{');
        int end = trimmed.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return null;
        }
        return parseStrict(trimmed.substring(start, end + 1));
    }

    public String toJson(Object value) {
        if (value == null) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            return String.valueOf(value);
        }
    }

    public String getString(Map<String, Object> source, String... keys) {
        if (source == null || source.isEmpty()) {
            return null;
        }
        for (String key : keys) {
            Object value = source.get(key);
            if (value == null) {
                continue;
            }
            String text = String.valueOf(value);
            if (!isBlank(text)) {
                return text.trim();
            }
        }
        return null;
    }

    /**
     * 读取字符串列表；字段缺失时返回 null，以便区分“未给出”和“给出空列表”。
     */
    public List<String> getStringList(Map<String, Object> source, String... keys) {
        if (source == null || source.isEmpty()) {
            return null;
        }
        for (String key : keys) {
            if (!source.containsKey(key)) {
                continue;
            }
            Object value = source.get(key);
            if (value instanceof List<?>) {
                List<String> result = new ArrayList<>();
                for (Object item : (List<?>) value) {
                    if (item != null && !isBlank(String.valueOf(item))) {
                        result.add(String.valueOf(item).trim());
                    }
                }
                return result;
            }
            if (value instanceof String && !isBlank((String) value)) {
                List<String> result = new ArrayList<>();
                result.add(((String) value).trim());
                return result;
            }
        }
        return null;
    }

    public Boolean getBoolean(Map<String, Object> source, String... keys) {
        if (source == null || source.isEmpty()) {
            return null;
        }
        for (String key : keys) {
            Object value = source.get(key);
            if (value instanceof Boolean) {
                return (Boolean) value;
            }
            if (value != null) {
                return Boolean.parseBoolean(String.valueOf(value).trim());
            }
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getMap(Map<String, Object> source, String... keys) {
        if (source == null || source.isEmpty()) {
            return null;
        }
        for (String key : keys) {
            Object value = source.get(key);
            if (value instanceof Map<?, ?>) {
                return new HashMap<>((Map<String, Object>) value);
            }
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    public List<Map<String, Object>> getMapList(Map<String, Object> source, String... keys) {
        if (source == null || source.isEmpty()) {
            return Collections.emptyList();
        }
        for (String key : keys) {
            Object value = source.get(key);
            if (!(value instanceof List<?>)) {
                continue;
            }
            List<Map<String, Object>> result = new ArrayList<>();
            for (Object item : (List<?>) value) {
                if (item instanceof Map<?, ?>) {
                    result.add((Map<String, Object>) item);
                }
            }
            return result;
        }
        return Collections.emptyList();
    }

    private Map<String, Object> parseStrict(String text) {
        if (!text.startsWith("{")) {
            return null;
        }
        try {
            return objectMapper.readValue(text, MAP_TYPE);
        } catch (JsonProcessingException ex) {
            return null;
        }
    }

    private boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}

package com.overseer.infrastructure.gateway;

import com.overseer.domain.workflow.adapter.gateway.IAgentGateway;
import com.overseer.infrastructure.util.JsonCodec;
import com.overseer.types.enums.ResponseCode;
import com.overseer.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 基于 HTTP 的网关 RPC 适配器。
 * <p>
 * 请求体 {@code {method, params, timeoutMs}}，响应体 {@code {ok, payload, error}}；
 * ok=false 或传输失败时抛出 AppException，由调用方决定失败粒度。
 * 每次调用按 RPC 超时单独设置读超时。
 * </p>
 */
@Slf4j
@Component
public class HttpAgentGateway implements IAgentGateway {

    private final RestTemplateBuilder restTemplateBuilder;
    private final JsonCodec jsonCodec;
    private final String gatewayUrl;
    private final String gatewayToken;
    private final long connectTimeoutMs;

    public HttpAgentGateway(RestTemplateBuilder restTemplateBuilder,
                            JsonCodec jsonCodec,
                            @Value("${overseer.gateway.url:http://127.0.0.1:18789/rpc}") String gatewayUrl,
                            @Value("${overseer.gateway.token:}") String gatewayToken,
                            @Value("${overseer.gateway.connect-timeout-ms:5000}") long connectTimeoutMs) {
        this.restTemplateBuilder = restTemplateBuilder;
        this.jsonCodec = jsonCodec;
        this.gatewayUrl = gatewayUrl;
        this.gatewayToken = gatewayToken;
        this.connectTimeoutMs = connectTimeoutMs;
    }

    @Override
    public Map<String, Object> call(String method, Map<String, Object> params, long timeoutMs) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("method", method);
        body.put("params", params == null ? new HashMap<>() : params);
        body.put("timeoutMs", timeoutMs);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (StringUtils.isNotBlank(gatewayToken)) {
            headers.setBearerAuth(gatewayToken.trim());
        }

        String responseBody;
        try {
            responseBody = buildRestTemplate(timeoutMs)
                    .postForObject(gatewayUrl, new HttpEntity<>(jsonCodec.writeValue(body), headers), String.class);
        } catch (RestClientException ex) {
            log.warn("Gateway call failed. method={}, timeoutMs={}, error={}", method, timeoutMs, ex.getMessage());
            throw new AppException(ResponseCode.GATEWAY_CALL_FAILED.getCode(),
                    StringUtils.defaultIfBlank(ex.getMessage(), "gateway call failed: " + method), ex);
        }
        return unwrap(method, jsonCodec.readMap(responseBody));
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> unwrap(String method, Map<String, Object> response) {
        if (response == null) {
            throw new AppException(ResponseCode.GATEWAY_CALL_FAILED.getCode(), "gateway returned empty response: " + method);
        }
        if (!Boolean.TRUE.equals(response.get("ok"))) {
            throw new AppException(ResponseCode.GATEWAY_CALL_FAILED.getCode(), resolveError(method, response.get("error")));
        }
        Object payload = response.get("payload");
        if (payload instanceof Map<?, ?>) {
            return (Map<String, Object>) payload;
        }
        return new HashMap<>();
    }

    private String resolveError(String method, Object error) {
        if (error instanceof Map<?, ?>) {
            Object message = ((Map<?, ?>) error).get("message");
            if (message != null && StringUtils.isNotBlank(String.valueOf(message))) {
                return String.valueOf(message);
            }
        } else if (error != null && StringUtils.isNotBlank(String.valueOf(error))) {
            return String.valueOf(error);
        }
        return "gateway call failed: " + method;
    }

    private RestTemplate buildRestTemplate(long timeoutMs) {
        return restTemplateBuilder
                .setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
                .setReadTimeout(Duration.ofMillis(Math.max(timeoutMs, connectTimeoutMs)))
                .build();
    }
}

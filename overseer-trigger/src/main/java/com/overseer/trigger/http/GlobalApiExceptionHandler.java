package com.overseer.trigger.http;

import com.overseer.api.response.Response;
import com.overseer.types.enums.ResponseCode;
import com.overseer.types.exception.AppException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.MDC;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * 统一 API 异常处理：所有错误以 Response 信封返回，code 取自 ResponseCode。
 */
@Slf4j
@RestControllerAdvice
public class GlobalApiExceptionHandler {

    private static final int MAX_INFO_LENGTH = 300;

    @ExceptionHandler(AppException.class)
    public Response<Object> handleAppException(AppException ex, HttpServletRequest request) {
        String code = StringUtils.defaultIfBlank(ex.getCode(), ResponseCode.UN_ERROR.getCode());
        String info = StringUtils.defaultIfBlank(ex.getInfo(), ResponseCode.UN_ERROR.getInfo());
        logError(request, ex, code, info, false);
        return failure(code, info);
    }

    /**
     * 请求体/参数错误与实体状态冲突（例如取消已结束的工作项）均按非法参数返回。
     */
    @ExceptionHandler({
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class,
            HttpMessageNotReadableException.class,
            IllegalArgumentException.class,
            IllegalStateException.class
    })
    public Response<Object> handleBadRequestException(Exception ex, HttpServletRequest request) {
        String info = truncate(StringUtils.defaultIfBlank(ex.getMessage(), ResponseCode.ILLEGAL_PARAMETER.getInfo()));
        logError(request, ex, ResponseCode.ILLEGAL_PARAMETER.getCode(), info, false);
        return failure(ResponseCode.ILLEGAL_PARAMETER.getCode(), info);
    }

    @ExceptionHandler(Exception.class)
    public Response<Object> handleUnknownException(Exception ex, HttpServletRequest request) {
        logError(request, ex, ResponseCode.UN_ERROR.getCode(), truncate(ex.getMessage()), true);
        return failure(ResponseCode.UN_ERROR.getCode(), ResponseCode.UN_ERROR.getInfo());
    }

    private void logError(HttpServletRequest request, Exception ex, String code, String info, boolean unexpected) {
        String path = request == null ? "-" : StringUtils.defaultIfBlank(request.getRequestURI(), "-");
        String method = request == null ? "-" : StringUtils.defaultIfBlank(request.getMethod(), "-");
        String traceId = StringUtils.defaultIfBlank(MDC.get("traceId"), "-");
        if (unexpected) {
            log.error("HTTP_ERROR path={}, method={}, traceId={}, errorType={}, errorCode={}, errorMessage={}",
                    path, method, traceId, ex.getClass().getSimpleName(), code, info, ex);
            return;
        }
        log.warn("HTTP_ERROR path={}, method={}, traceId={}, errorType={}, errorCode={}, errorMessage={}",
                path, method, traceId, ex.getClass().getSimpleName(), code, info);
    }

    private Response<Object> failure(String code, String info) {
        return Response.<Object>builder()
                .code(code)
                .info(info)
                .build();
    }

    private String truncate(String text) {
        if (StringUtils.isBlank(text) || text.length() <= MAX_INFO_LENGTH) {
            return text;
        }
        return text.substring(0, MAX_INFO_LENGTH);
    }
}

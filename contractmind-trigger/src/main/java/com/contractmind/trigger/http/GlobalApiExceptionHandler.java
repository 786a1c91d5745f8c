package com.contractmind.trigger.http;

import com.contractmind.api.response.Response;
import com.contractmind.types.enums.ResponseCode;
import com.contractmind.types.exception.AppException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.MDC;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * 统一 API 异常处理：HTTP 状态恒为 200，错误通过 {@link Response#getCode()} 区分。
 */
@Slf4j
@RestControllerAdvice
public class GlobalApiExceptionHandler {

    private static final int MAX_INFO_LENGTH = 300;

    @ExceptionHandler(AppException.class)
    public Response<Object> handleAppException(AppException ex, HttpServletRequest request) {
        String code = StringUtils.defaultIfBlank(ex.getCode(), ResponseCode.UN_ERROR.getCode());
        String info = truncate(StringUtils.defaultIfBlank(ex.getInfo(), ResponseCode.UN_ERROR.getInfo()));
        if (ex.is(ResponseCode.RPC_ERROR) || ex.is(ResponseCode.LLM_ERROR) || ex.is(ResponseCode.UN_ERROR)) {
            log.error(logFormat(), describe(request, ex, code, info), ex);
        } else {
            log.warn(logFormat(), describe(request, ex, code, info));
        }
        return Response.<Object>builder()
                .code(code)
                .info(info)
                .build();
    }

    @ExceptionHandler({
            BindException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class,
            HttpMessageNotReadableException.class,
            IllegalArgumentException.class
    })
    public Response<Object> handleBadRequestException(Exception ex, HttpServletRequest request) {
        String info = truncate(StringUtils.defaultIfBlank(ex.getMessage(), ResponseCode.ILLEGAL_PARAMETER.getInfo()));
        log.warn(logFormat(), describe(request, ex, ResponseCode.ILLEGAL_PARAMETER.getCode(), info));
        return Response.fail(ResponseCode.ILLEGAL_PARAMETER, info);
    }

    @ExceptionHandler(Exception.class)
    public Response<Object> handleUnknownException(Exception ex, HttpServletRequest request) {
        log.error(logFormat(), describe(request, ex, ResponseCode.UN_ERROR.getCode(), truncate(ex.getMessage())), ex);
        return Response.fail(ResponseCode.UN_ERROR, ResponseCode.UN_ERROR.getInfo());
    }

    private String logFormat() {
        return "HTTP_ERROR {}";
    }

    private String describe(HttpServletRequest request, Exception ex, String code, String info) {
        return "path=" + resolve(request == null ? null : request.getRequestURI())
                + ", method=" + resolve(request == null ? null : request.getMethod())
                + ", traceId=" + resolve(MDC.get("traceId"))
                + ", requestId=" + resolve(MDC.get("requestId"))
                + ", errorType=" + ex.getClass().getSimpleName()
                + ", errorCode=" + code
                + ", errorMessage=" + info;
    }

    private String resolve(String value) {
        return StringUtils.defaultIfBlank(value, "-");
    }

    private String truncate(String text) {
        if (StringUtils.isBlank(text) || text.length() <= MAX_INFO_LENGTH) {
            return text;
        }
        return text.substring(0, MAX_INFO_LENGTH);
    }
}

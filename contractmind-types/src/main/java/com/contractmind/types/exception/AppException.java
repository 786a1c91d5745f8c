package com.contractmind.types.exception;

import com.contractmind.types.enums.ResponseCode;
import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * 应用自定义异常类。
 * <p>
 * 管线中的各类失败统一通过此类抛出，异常码取自 {@link ResponseCode}：
 * <ul>
 *   <li>{@code ABI_ENCODING_ERROR}：参数数量或类型与 ABI 不匹配</li>
 *   <li>{@code RPC_ERROR}：节点调用失败</li>
 *   <li>{@code LLM_ERROR}：模型超时或返回非法 JSON</li>
 *   <li>{@code NOT_FOUND}：Agent 或函数不存在</li>
 * </ul>
 * </p>
 *
 * @author getoffer
 * @since 2025-10-02
 */
@EqualsAndHashCode(callSuper = true)
@Data
public class AppException extends RuntimeException {

    private static final long serialVersionUID = 3920418550714162730L;

    /** 异常码 */
    private String code;

    /** 异常信息 */
    private String info;

    public AppException(String code) {
        super(code);
        this.code = code;
        this.info = code;
    }

    public AppException(String code, String message) {
        super(message);
        this.code = code;
        this.info = message;
    }

    public AppException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.info = message;
    }

    /**
     * 按响应码创建异常。
     *
     * @param responseCode 响应码
     * @param message 异常描述信息
     */
    public AppException(ResponseCode responseCode, String message) {
        this(responseCode.getCode(), message);
    }

    /**
     * 按响应码创建带原因的异常。
     *
     * @param responseCode 响应码
     * @param message 异常描述信息
     * @param cause 异常原因
     */
    public AppException(ResponseCode responseCode, String message, Throwable cause) {
        this(responseCode.getCode(), message, cause);
    }

    /**
     * 判断异常是否属于指定响应码。
     */
    public boolean is(ResponseCode responseCode) {
        return responseCode != null && responseCode.getCode().equals(code);
    }

    @Override
    public String getMessage() {
        return info != null ? info : super.getMessage();
    }

    @Override
    public String toString() {
        return "AppException{" +
                "code='" + code + '\'' +
                ", info='" + info + '\'' +
                '}';
    }

}

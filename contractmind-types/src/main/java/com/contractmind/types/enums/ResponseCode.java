package com.contractmind.types.enums;

import lombok.Getter;

/**
 * 统一响应码枚举。
 * <p>
 * 定义系统中所有API响应的响应码和对应描述信息。
 * 链上调用、ABI 编码和 LLM 调用各自拥有独立的错误码，便于前端区分处理。
 * </p>
 *
 * @author getoffer
 * @since 2025-10-02
 */
@Getter
public enum ResponseCode {

    /** 成功 */
    SUCCESS("0000", "成功"),

    /** 未知错误 */
    UN_ERROR("0001", "未知失败"),

    /** 非法参数 */
    ILLEGAL_PARAMETER("0002", "非法参数"),

    /** LLM 调用失败或返回格式非法 */
    LLM_ERROR("0003", "LLM调用失败"),

    /** 资源不存在（Agent、函数等） */
    NOT_FOUND("0004", "资源不存在"),

    /** ABI 编码失败（参数数量或类型不匹配） */
    ABI_ENCODING_ERROR("0005", "ABI编码失败"),

    /** 区块链 RPC 调用失败 */
    RPC_ERROR("0006", "链上调用失败");

    private final String code;
    private final String info;

    ResponseCode(String code, String info) {
        this.code = code;
        this.info = info;
    }

}

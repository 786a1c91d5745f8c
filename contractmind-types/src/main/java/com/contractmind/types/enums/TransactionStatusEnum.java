package com.contractmind.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 交易状态枚举
 *
 * @author getoffer
 * @since 2025-10-02
 */
public enum TransactionStatusEnum {

    /**
     * 已提交 - 用户已签名广播，尚未出块
     */
    PENDING("pending"),

    /**
     * 已确认 - 回执 status=1
     */
    CONFIRMED("confirmed"),

    /**
     * 失败 - 回执 status=0（交易回滚）
     */
    FAILED("failed");

    private final String code;

    TransactionStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static TransactionStatusEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (TransactionStatusEnum status : TransactionStatusEnum.values()) {
            if (status.code.equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown transaction status code: " + code);
    }
}

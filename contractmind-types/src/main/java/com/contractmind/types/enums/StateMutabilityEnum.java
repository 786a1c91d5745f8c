package com.contractmind.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * ABI 函数可变性
 *
 * @author getoffer
 * @since 2025-10-02
 */
public enum StateMutabilityEnum {

    PURE("pure"),

    VIEW("view"),

    NONPAYABLE("nonpayable"),

    PAYABLE("payable");

    private final String code;

    StateMutabilityEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * 是否为只读（不需要发交易）。
     */
    public boolean isReadOnly() {
        return this == PURE || this == VIEW;
    }

    /**
     * 按 ABI 中的 stateMutability 解析，缺省按 nonpayable 处理。
     */
    public static StateMutabilityEnum fromCode(String code) {
        if (code == null || code.isBlank()) {
            return NONPAYABLE;
        }
        for (StateMutabilityEnum value : StateMutabilityEnum.values()) {
            if (value.code.equalsIgnoreCase(code.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown state mutability: " + code);
    }
}

package com.contractmind.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 交易路由类型
 *
 * @author getoffer
 * @since 2025-10-02
 */
public enum RouteTypeEnum {

    /**
     * 经由 ContractMind Hub 的 executeOnTarget 中转
     */
    HUB("hub", "ContractMind Hub"),

    /**
     * 直接调用目标合约
     */
    DIRECT("direct", "Direct (no intermediary)");

    private final String code;
    private final String label;

    RouteTypeEnum(String code, String label) {
        this.code = code;
        this.label = label;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getLabel() {
        return label;
    }
}

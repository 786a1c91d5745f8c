package com.contractmind.types.enums;

/**
 * 遥测事件 schema 标签。
 */
public enum TelemetrySchemaEnum {

    CHAT_MESSAGE("chat_message"),

    AGENT_EXECUTION("agent_execution"),

    TRANSACTION_EVENT("transaction_event");

    private final String code;

    TelemetrySchemaEnum(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}

package com.contractmind.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 对话消息角色枚举。
 */
public enum MessageRoleEnum {
    USER("user", "User"),
    ASSISTANT("assistant", "Assistant");

    private final String code;
    private final String label;

    MessageRoleEnum(String code, String label) {
        this.code = code;
        this.label = label;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * 提示词中使用的角色标签。
     */
    public String getLabel() {
        return label;
    }

    public static MessageRoleEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (MessageRoleEnum role : MessageRoleEnum.values()) {
            if (role.code.equalsIgnoreCase(code)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown message role code: " + code);
    }
}

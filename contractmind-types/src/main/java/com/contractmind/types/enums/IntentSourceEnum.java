package com.contractmind.types.enums;

/**
 * 意图解析来源。
 */
public enum IntentSourceEnum {
    LLM,
    KEYWORD,
    SYSTEM
}

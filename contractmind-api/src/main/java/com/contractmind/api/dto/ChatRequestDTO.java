package com.contractmind.api.dto;

import lombok.Data;

/**
 * 聊天请求 DTO
 */
@Data
public class ChatRequestDTO {

    /**
     * Agent 标识（bytes32 hex 或注册时的字符串）
     */
    private String agentId;

    /**
     * 用户消息
     */
    private String message;

    /**
     * 用户钱包地址，用于解析 "me"/"my" 等地址占位符
     */
    private String userAddress;
}

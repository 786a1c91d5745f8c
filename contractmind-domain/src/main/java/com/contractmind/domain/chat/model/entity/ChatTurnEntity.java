package com.contractmind.domain.chat.model.entity;

import com.contractmind.types.enums.MessageRoleEnum;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 对话轮次实体。
 *
 * @author getoffer
 * @since 2025-10-02
 */
@Data
public class ChatTurnEntity {

    private Long id;

    private String agentId;

    /**
     * 用户钱包地址（小写）
     */
    private String userAddress;

    private MessageRoleEnum role;

    private String message;

    /**
     * 助手回复关联的合约函数
     */
    private String functionName;

    private Boolean requiresTransaction;

    private String transactionHash;

    private LocalDateTime createdAt;

    public static ChatTurnEntity userTurn(String agentId, String userAddress, String message) {
        ChatTurnEntity turn = new ChatTurnEntity();
        turn.setAgentId(agentId);
        turn.setUserAddress(userAddress);
        turn.setRole(MessageRoleEnum.USER);
        turn.setMessage(message);
        turn.setRequiresTransaction(Boolean.FALSE);
        return turn;
    }

    public static ChatTurnEntity assistantTurn(String agentId,
                                               String userAddress,
                                               String message,
                                               String functionName,
                                               boolean requiresTransaction) {
        ChatTurnEntity turn = new ChatTurnEntity();
        turn.setAgentId(agentId);
        turn.setUserAddress(userAddress);
        turn.setRole(MessageRoleEnum.ASSISTANT);
        turn.setMessage(message);
        turn.setFunctionName(functionName);
        turn.setRequiresTransaction(requiresTransaction);
        return turn;
    }
}

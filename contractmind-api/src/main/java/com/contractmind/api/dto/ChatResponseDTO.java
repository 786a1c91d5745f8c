package com.contractmind.api.dto;

import lombok.Data;

/**
 * 聊天响应 DTO。
 * <p>
 * {@code isPreparedTransaction=true} 时 {@code preparedTransaction} 为待签名交易，前端交由钱包签名广播。
 * </p>
 */
@Data
public class ChatResponseDTO {

    private String response;
    private Boolean isPreparedTransaction;
    private PreparedTransactionDTO preparedTransaction;
}

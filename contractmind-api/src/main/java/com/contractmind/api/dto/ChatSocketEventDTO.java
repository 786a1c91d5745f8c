package com.contractmind.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.Map;

/**
 * WebSocket 下行事件。
 * <p>
 * type 取值：thinking / intent_parsed / transaction_ready / response / transaction_monitoring /
 * transaction_confirmed / transaction_result / pong / error。
 * </p>
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatSocketEventDTO {

    private String type;
    private String message;
    private Map<String, Object> intent;
    private PreparedTransactionDTO transaction;

    @JsonProperty("tx_hash")
    private String txHash;

    @JsonProperty("block_number")
    private Long blockNumber;

    private String status;

    public static ChatSocketEventDTO of(String type, String message) {
        ChatSocketEventDTO event = new ChatSocketEventDTO();
        event.setType(type);
        event.setMessage(message);
        return event;
    }
}

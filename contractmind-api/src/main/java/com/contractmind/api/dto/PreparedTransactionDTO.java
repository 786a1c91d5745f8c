package com.contractmind.api.dto;

import lombok.Data;

import java.util.Map;

/**
 * 未签名交易信封 DTO。
 */
@Data
public class PreparedTransactionDTO {

    private String to;
    private String data;
    private String value;
    private Long gas;
    private String gasPrice;
    private Long nonce;
    private String route;
    private String functionName;
    private String description;
    private Map<String, Object> params;
    private TransactionPreviewDTO preview;
}

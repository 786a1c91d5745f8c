package com.contractmind.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 交易预览 DTO。
 */
@Data
public class TransactionPreviewDTO {

    private String action;
    private String protocol;
    private String route;
    private String amount;
    private List<String> features;
}

package com.contractmind.domain.transaction.model.valobj;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * 交易预览，构造后不可变。
 */
@Getter
@ToString
@Builder
public class TransactionPreviewVO {

    private final String action;

    private final String protocol;

    private final String route;

    /**
     * "amount token"，金额或代币未知时为 null
     */
    private final String amount;

    private final List<String> features;
}

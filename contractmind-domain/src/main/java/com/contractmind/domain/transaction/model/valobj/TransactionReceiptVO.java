package com.contractmind.domain.transaction.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 交易回执
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransactionReceiptVO {

    private String txHash;

    /**
     * 回执 status=1
     */
    private boolean success;

    private Long blockNumber;

    private Long gasUsed;

    private String from;

    private String to;
}

package com.contractmind.domain.chat.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 交易结果回报的处理结果。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransactionOutcomeVO {

    public static final String STATUS_PENDING = "pending";
    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_FAILED = "failed";

    /**
     * pending / success / failed
     */
    private String status;

    /**
     * 写入对话历史的助手消息
     */
    private String message;

    private String txHash;

    private Long blockNumber;

    private Long gasUsed;

    public boolean isPending() {
        return STATUS_PENDING.equals(status);
    }

    public boolean isSuccess() {
        return STATUS_SUCCESS.equals(status);
    }
}

package com.contractmind.domain.transaction.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 路由上下文：描述和预览所需的意图信息。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RoutingContextVO {

    /**
     * Agent 标识，Hub 路由时作为 executeOnTarget 的 agentId
     */
    private String agentId;

    /**
     * stake / withdraw / swap / claim / 其它函数名
     */
    private String action;

    /**
     * 协议名（Agent 展示名）
     */
    private String protocol;

    /**
     * 用户输入的未换算金额
     */
    private String amount;

    private String token;
}

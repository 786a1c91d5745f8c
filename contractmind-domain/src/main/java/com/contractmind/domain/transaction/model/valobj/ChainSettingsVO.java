package com.contractmind.domain.transaction.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 链配置：网络信息与受信任 Hub 地址。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChainSettingsVO {

    private Long chainId;

    private String networkName;

    /**
     * ContractMind Hub 合约地址，Hub 路由的交易目的地址
     */
    private String hubAddress;

    /**
     * Agent 注册表合约地址
     */
    private String registryAddress;

    /**
     * 等待回执的超时时间（秒）
     */
    private Integer receiptTimeoutSeconds;
}

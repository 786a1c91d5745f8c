/**
 * Transaction 领域 - 意图到交易的编码与路由
 *
 * <p>参数归一化 → calldata 编码 → 合约类型探测 → Hub/直连路由，以及只读查询。</p>
 * <p>本域只构造未签名交易信封，签名与广播始终在客户端完成。</p>
 *
 * @author getoffer
 * @since 2025-10-02
 */
package com.contractmind.domain.transaction;

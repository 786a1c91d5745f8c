package com.contractmind.domain.transaction.adapter.gateway;

import com.contractmind.domain.transaction.model.valobj.TransactionReceiptVO;

import java.math.BigInteger;
import java.time.Duration;

/**
 * 区块链 RPC 端口。
 * <p>
 * 每个方法独立失败（抛出 RPC_ERROR 的 AppException），由调用方决定兜底值。
 * </p>
 */
public interface IBlockchainGateway {

    /**
     * 账户当前 nonce（pending）
     */
    BigInteger getNonce(String address);

    /**
     * 预估 gas
     */
    BigInteger estimateGas(String from, String to, String data);

    /**
     * 当前网络 gas price
     */
    BigInteger getGasPrice();

    /**
     * eth_call，返回原始十六进制结果
     *
     * @param from 调用方地址，可为空
     * @param to 合约地址
     * @param data calldata
     */
    String call(String from, String to, String data);

    /**
     * 查询交易回执，尚未出块返回 null
     */
    TransactionReceiptVO getTransactionReceipt(String txHash);

    /**
     * 轮询等待回执，超时返回 null
     */
    TransactionReceiptVO waitForReceipt(String txHash, Duration timeout);
}

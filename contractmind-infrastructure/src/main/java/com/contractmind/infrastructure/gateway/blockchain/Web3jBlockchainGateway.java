package com.contractmind.infrastructure.gateway.blockchain;

import com.contractmind.domain.transaction.adapter.gateway.IBlockchainGateway;
import com.contractmind.domain.transaction.model.valobj.TransactionReceiptVO;
import com.contractmind.types.enums.ResponseCode;
import com.contractmind.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.protocol.core.methods.response.EthEstimateGas;
import org.web3j.protocol.core.methods.response.EthGasPrice;
import org.web3j.protocol.core.methods.response.EthGetTransactionCount;
import org.web3j.protocol.core.methods.response.EthGetTransactionReceipt;
import org.web3j.protocol.core.methods.response.TransactionReceipt;

import java.io.IOException;
import java.math.BigInteger;
import java.time.Duration;
import java.util.Optional;

/**
 * 基于 Web3j 的 JSON-RPC 实现。
 * <p>
 * 每个方法单独失败，IO 异常与节点错误统一转为 RPC_ERROR。
 * </p>
 */
@Slf4j
@Component
public class Web3jBlockchainGateway implements IBlockchainGateway {

    private final Web3j web3j;
    private final long receiptPollIntervalMillis;

    public Web3jBlockchainGateway(Web3j web3j,
                                  @Value("${contractmind.blockchain.receipt-poll-interval-millis:1000}") long receiptPollIntervalMillis) {
        this.web3j = web3j;
        this.receiptPollIntervalMillis = Math.max(receiptPollIntervalMillis, 100L);
    }

    @Override
    public BigInteger getNonce(String address) {
        EthGetTransactionCount response = send("eth_getTransactionCount", () ->
                web3j.ethGetTransactionCount(address, DefaultBlockParameterName.PENDING).send());
        return response.getTransactionCount();
    }

    @Override
    public BigInteger estimateGas(String from, String to, String data) {
        EthEstimateGas response = send("eth_estimateGas", () ->
                web3j.ethEstimateGas(Transaction.createEthCallTransaction(from, to, data)).send());
        return response.getAmountUsed();
    }

    @Override
    public BigInteger getGasPrice() {
        EthGasPrice response = send("eth_gasPrice", () -> web3j.ethGasPrice().send());
        return response.getGasPrice();
    }

    @Override
    public String call(String from, String to, String data) {
        EthCall response = send("eth_call", () ->
                web3j.ethCall(Transaction.createEthCallTransaction(from, to, data), DefaultBlockParameterName.LATEST).send());
        if (response.isReverted()) {
            throw new AppException(ResponseCode.RPC_ERROR, "execution reverted: " + response.getRevertReason());
        }
        return response.getValue();
    }

    @Override
    public TransactionReceiptVO getTransactionReceipt(String txHash) {
        EthGetTransactionReceipt response = send("eth_getTransactionReceipt", () ->
                web3j.ethGetTransactionReceipt(txHash).send());
        Optional<TransactionReceipt> receipt = response.getTransactionReceipt();
        return receipt.map(this::toReceipt).orElse(null);
    }

    @Override
    public TransactionReceiptVO waitForReceipt(String txHash, Duration timeout) {
        long deadline = System.currentTimeMillis() + timeout.toMillis();
        while (true) {
            TransactionReceiptVO receipt = getTransactionReceipt(txHash);
            if (receipt != null) {
                return receipt;
            }
            if (System.currentTimeMillis() + receiptPollIntervalMillis > deadline) {
                log.info("TX_RECEIPT_WAIT_TIMEOUT txHash={}, timeoutMs={}", txHash, timeout.toMillis());
                return null;
            }
            try {
                Thread.sleep(receiptPollIntervalMillis);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                return null;
            }
        }
    }

    private TransactionReceiptVO toReceipt(TransactionReceipt receipt) {
        return TransactionReceiptVO.builder()
                .txHash(receipt.getTransactionHash())
                .success(receipt.isStatusOK())
                .blockNumber(receipt.getBlockNumber() == null ? null : receipt.getBlockNumber().longValue())
                .gasUsed(receipt.getGasUsed() == null ? null : receipt.getGasUsed().longValue())
                .from(receipt.getFrom())
                .to(receipt.getTo())
                .build();
    }

    private <T extends Response<?>> T send(String method, RpcCall<T> call) {
        T response;
        try {
            response = call.execute();
        } catch (IOException ex) {
            throw new AppException(ResponseCode.RPC_ERROR, method + " failed: " + ex.getMessage(), ex);
        }
        if (response == null) {
            throw new AppException(ResponseCode.RPC_ERROR, method + " returned no response");
        }
        if (response.hasError()) {
            throw new AppException(ResponseCode.RPC_ERROR, method + " error: " + response.getError().getMessage());
        }
        return response;
    }

    @FunctionalInterface
    private interface RpcCall<T> {
        T execute() throws IOException;
    }
}

package com.contractmind.domain.transaction.service;

import com.contractmind.domain.agent.model.valobj.AbiParameterVO;
import com.contractmind.domain.agent.model.valobj.FunctionDescriptorVO;
import com.contractmind.domain.transaction.adapter.gateway.IBlockchainGateway;
import com.contractmind.domain.transaction.model.valobj.ChainSettingsVO;
import com.contractmind.domain.transaction.model.valobj.RoutingContextVO;
import com.contractmind.domain.transaction.model.valobj.TransactionEnvelopeVO;
import com.contractmind.domain.transaction.model.valobj.TransactionPreviewVO;
import com.contractmind.types.common.Constants;
import com.contractmind.types.enums.ContractTypeEnum;
import com.contractmind.types.enums.RouteTypeEnum;
import com.contractmind.types.enums.StateMutabilityEnum;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * 交易路由领域服务：决定 Hub / 直连路由并组装未签名交易信封。
 * <p>
 * nonce、gas、gasPrice 三个 RPC 调用各自独立兜底，任何一个失败都不会中断组装。
 * 本服务不签名也不广播。
 * </p>
 */
@Slf4j
@Service
public class TransactionRouterDomainService {

    public static final BigInteger HUB_DEFAULT_GAS = BigInteger.valueOf(500_000L);
    public static final BigInteger DIRECT_DEFAULT_GAS = BigInteger.valueOf(300_000L);

    static final FunctionDescriptorVO EXECUTE_ON_TARGET = FunctionDescriptorVO.of(
            "executeOnTarget",
            List.of(AbiParameterVO.of("agentId", "bytes32"),
                    AbiParameterVO.of("target", "address"),
                    AbiParameterVO.of("data", "bytes")),
            Collections.emptyList(),
            StateMutabilityEnum.NONPAYABLE);

    private static final List<String> HUB_FEATURES =
            List.of("Rate limiting protection", "On-chain analytics", "Protocol fee: 0.1%");
    private static final List<String> DIRECT_FEATURES =
            List.of("Lower gas cost", "Standard Web3 transaction", "Full compatibility");

    private final IBlockchainGateway blockchainGateway;
    private final CalldataEncoderDomainService calldataEncoder;
    private final ChainSettingsVO chainSettings;

    public TransactionRouterDomainService(IBlockchainGateway blockchainGateway,
                                          CalldataEncoderDomainService calldataEncoder,
                                          ChainSettingsVO chainSettings) {
        this.blockchainGateway = blockchainGateway;
        this.calldataEncoder = calldataEncoder;
        this.chainSettings = chainSettings;
    }

    public TransactionEnvelopeVO route(String functionName,
                                       String targetAddress,
                                       String calldata,
                                       String callerAddress,
                                       ContractTypeEnum contractType,
                                       RoutingContextVO context) {
        RoutingContextVO safeContext = context == null ? RoutingContextVO.builder().build() : context;
        RouteTypeEnum route = contractType == ContractTypeEnum.HUB_AWARE ? RouteTypeEnum.HUB : RouteTypeEnum.DIRECT;
        String hubAddress = chainSettings == null ? null : chainSettings.getHubAddress();
        if (route == RouteTypeEnum.HUB && StringUtils.isBlank(hubAddress)) {
            log.warn("HUB_ADDRESS_MISSING target={}, fallback=direct", targetAddress);
            route = RouteTypeEnum.DIRECT;
        }

        String to;
        String data;
        if (route == RouteTypeEnum.HUB) {
            to = hubAddress;
            data = calldataEncoder.encode(EXECUTE_ON_TARGET, Arrays.asList(
                    CalldataEncoderDomainService.toBytes32(safeContext.getAgentId()),
                    targetAddress,
                    calldata));
        } else {
            to = targetAddress;
            data = calldata;
        }

        BigInteger nonce = fetchNonce(callerAddress);
        BigInteger gas = estimateGas(callerAddress, to, data, route);
        BigInteger gasPrice = fetchGasPrice();

        TransactionEnvelopeVO envelope = TransactionEnvelopeVO.builder()
                .to(to)
                .data(data)
                .value(Constants.ZERO_VALUE)
                .gas(gas)
                .gasPrice(gasPrice)
                .nonce(nonce)
                .route(route)
                .functionName(functionName)
                .description(describe(functionName, safeContext))
                .preview(preview(route, safeContext))
                .build();
        log.info("TRANSACTION_ROUTED function={}, route={}, to={}, gas={}, nonce={}",
                functionName, route.getCode(), to, gas, nonce);
        return envelope;
    }

    /**
     * 由函数名推断意图动作。
     */
    public static String deriveAction(String functionName) {
        if (StringUtils.isBlank(functionName)) {
            return null;
        }
        String lower = functionName.toLowerCase(Locale.ROOT);
        if (lower.contains("unstake") || lower.contains("withdraw")) {
            return "withdraw";
        }
        if (lower.contains("stake")) {
            return "stake";
        }
        if (lower.contains("swap")) {
            return "swap";
        }
        if (lower.contains("claim")) {
            return "claim";
        }
        return functionName;
    }

    String describe(String functionName, RoutingContextVO context) {
        String action = context.getAction();
        String protocol = StringUtils.defaultIfBlank(context.getProtocol(), "contract");
        if (StringUtils.isBlank(action)) {
            return "Execute " + functionName + " on contract";
        }
        // 金额模板要求数量和代币同时已知
        boolean amountKnown = StringUtils.isNotBlank(context.getAmount()) && StringUtils.isNotBlank(context.getToken());
        String quantity = amountKnown ? context.getAmount().trim() + " " + context.getToken().trim() : null;
        switch (action.toLowerCase(Locale.ROOT)) {
            case "stake":
                return amountKnown ? "Stake " + quantity + " on " + protocol : "Stake on " + protocol;
            case "withdraw":
                return amountKnown ? "Withdraw " + quantity + " from " + protocol : "Withdraw on " + protocol;
            case "swap":
                return "Swap tokens on " + protocol;
            case "claim":
                return "Claim rewards from " + protocol;
            default:
                return StringUtils.capitalize(action) + " on " + protocol;
        }
    }

    private TransactionPreviewVO preview(RouteTypeEnum route, RoutingContextVO context) {
        String amount = null;
        if (StringUtils.isNotBlank(context.getAmount()) && StringUtils.isNotBlank(context.getToken())) {
            amount = context.getAmount() + " " + context.getToken();
        }
        return TransactionPreviewVO.builder()
                .action(StringUtils.capitalize(context.getAction()))
                .protocol(context.getProtocol())
                .route(route.getLabel())
                .amount(amount)
                .features(route == RouteTypeEnum.HUB ? HUB_FEATURES : DIRECT_FEATURES)
                .build();
    }

    private BigInteger fetchNonce(String callerAddress) {
        try {
            return blockchainGateway.getNonce(callerAddress);
        } catch (Exception ex) {
            log.warn("NONCE_FETCH_FAILED caller={}, error={}", callerAddress, ex.getMessage());
            return null;
        }
    }

    private BigInteger estimateGas(String from, String to, String data, RouteTypeEnum route) {
        BigInteger fallback = route == RouteTypeEnum.HUB ? HUB_DEFAULT_GAS : DIRECT_DEFAULT_GAS;
        try {
            BigInteger estimated = blockchainGateway.estimateGas(from, to, data);
            return estimated == null ? fallback : estimated;
        } catch (Exception ex) {
            log.warn("GAS_ESTIMATE_FAILED route={}, to={}, fallback={}, error={}",
                    route.getCode(), to, fallback, ex.getMessage());
            return fallback;
        }
    }

    private BigInteger fetchGasPrice() {
        try {
            return blockchainGateway.getGasPrice();
        } catch (Exception ex) {
            log.warn("GAS_PRICE_FETCH_FAILED error={}", ex.getMessage());
            return null;
        }
    }
}

package com.contractmind.domain.transaction.service;

import com.contractmind.domain.agent.model.valobj.AbiParameterVO;
import com.contractmind.domain.agent.model.valobj.FunctionDescriptorVO;
import com.contractmind.domain.transaction.adapter.gateway.IBlockchainGateway;
import com.contractmind.domain.transaction.model.valobj.ChainSettingsVO;
import com.contractmind.types.enums.StateMutabilityEnum;
import com.contractmind.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 只读查询领域服务：对 view / pure 函数执行 eth_call 并格式化为聊天文本。
 * <p>
 * 常见 ERC-20 查询使用固定文案；其余函数按 ABI 解码并拼接返回值。
 * 任何失败都转为提示文本返回，不向上抛出。
 * </p>
 */
@Slf4j
@Service
public class ReadQueryDomainService {

    private static final FunctionDescriptorVO BALANCE_OF = standard("balanceOf",
            List.of(AbiParameterVO.of("account", "address")), "uint256");
    private static final FunctionDescriptorVO TOTAL_SUPPLY = standard("totalSupply", Collections.emptyList(), "uint256");
    private static final FunctionDescriptorVO DECIMALS = standard("decimals", Collections.emptyList(), "uint8");
    private static final FunctionDescriptorVO NAME = standard("name", Collections.emptyList(), "string");
    private static final FunctionDescriptorVO SYMBOL = standard("symbol", Collections.emptyList(), "string");
    private static final FunctionDescriptorVO OWNER = standard("owner", Collections.emptyList(), "address");

    private final IBlockchainGateway blockchainGateway;
    private final CalldataEncoderDomainService calldataEncoder;
    private final ChainSettingsVO chainSettings;

    public ReadQueryDomainService(IBlockchainGateway blockchainGateway,
                                  CalldataEncoderDomainService calldataEncoder,
                                  ChainSettingsVO chainSettings) {
        this.blockchainGateway = blockchainGateway;
        this.calldataEncoder = calldataEncoder;
        this.chainSettings = chainSettings;
    }

    public String query(String functionName, String targetAddress, String callerAddress) {
        return query(functionName, targetAddress, callerAddress, null, null);
    }

    /**
     * @param function 目录中的函数描述，通用查询时用于编码参数和解码返回值，可为空
     * @param params   已归一化的参数
     */
    public String query(String functionName,
                        String targetAddress,
                        String callerAddress,
                        FunctionDescriptorVO function,
                        Map<String, Object> params) {
        try {
            switch (functionName) {
                case "balanceOf": {
                    BigInteger balance = callNumber(BALANCE_OF, targetAddress, callerAddress, List.of(callerAddress));
                    return formatAmount("Your balance is", balance, targetAddress, callerAddress);
                }
                case "totalSupply": {
                    BigInteger supply = callNumber(TOTAL_SUPPLY, targetAddress, callerAddress, Collections.emptyList());
                    return formatAmount("Total supply is", supply, targetAddress, callerAddress);
                }
                case "decimals":
                    return "This token uses "
                            + callNumber(DECIMALS, targetAddress, callerAddress, Collections.emptyList()) + " decimals";
                case "name":
                    return "Token name: " + callSingle(NAME, targetAddress, callerAddress, Collections.emptyList());
                case "symbol":
                    return "Token symbol: " + callSingle(SYMBOL, targetAddress, callerAddress, Collections.emptyList());
                case "owner":
                    return "Contract owner: " + callSingle(OWNER, targetAddress, callerAddress, Collections.emptyList());
                case "allowance":
                    return "To check allowance, please specify: 'Check allowance for [spender address]'";
                default:
                    return genericQuery(functionName, targetAddress, callerAddress, function, params);
            }
        } catch (Exception ex) {
            log.warn("READ_QUERY_FAILED function={}, target={}, error={}", functionName, targetAddress, ex.getMessage());
            return String.format(Locale.ROOT,
                    "⚠️ Could not query %s on %s: %s. The contract may not be deployed or accessible on %s (Chain ID: %s).",
                    functionName, targetAddress, reason(ex),
                    chainSettings == null ? "the configured network" : chainSettings.getNetworkName(),
                    chainSettings == null ? "unknown" : chainSettings.getChainId());
        }
    }

    private String genericQuery(String functionName,
                                String targetAddress,
                                String callerAddress,
                                FunctionDescriptorVO function,
                                Map<String, Object> params) {
        FunctionDescriptorVO descriptor = function != null
                ? function
                : standard(functionName, Collections.emptyList(), null);
        List<Object> args = new ArrayList<>();
        for (AbiParameterVO input : descriptor.safeInputs()) {
            Object value = params == null ? null : params.get(input.getName());
            if (value == null && "address".equals(input.getType()) && descriptor.safeInputs().size() == 1) {
                value = callerAddress;
            }
            if (value == null) {
                throw new IllegalArgumentException("missing parameter " + input.getName());
            }
            args.add(value);
        }
        List<Object> values = call(descriptor, targetAddress, callerAddress, args);
        String rendered = values.isEmpty()
                ? "(no output)"
                : values.stream().map(String::valueOf).collect(Collectors.joining(", "));
        return functionName + " returned: " + rendered;
    }

    private String formatAmount(String prefix, BigInteger raw, String targetAddress, String callerAddress) {
        try {
            BigInteger decimals = callNumber(DECIMALS, targetAddress, callerAddress, Collections.emptyList());
            BigDecimal formatted = new BigDecimal(raw).divide(BigDecimal.TEN.pow(decimals.intValueExact()), MathContext.DECIMAL128);
            return String.format(Locale.ROOT, "%s %.4f tokens (raw: %s)", prefix, formatted, raw);
        } catch (Exception ex) {
            log.debug("DECIMALS_QUERY_FAILED target={}, error={}", targetAddress, ex.getMessage());
            return prefix + " " + raw + " (raw amount)";
        }
    }

    private BigInteger callNumber(FunctionDescriptorVO function, String target, String caller, List<Object> args) {
        Object value = callSingle(function, target, caller, args);
        if (!(value instanceof BigInteger number)) {
            throw new IllegalStateException("unexpected " + function.getName() + " result: " + value);
        }
        return number;
    }

    private Object callSingle(FunctionDescriptorVO function, String target, String caller, List<Object> args) {
        List<Object> values = call(function, target, caller, args);
        if (values.isEmpty()) {
            throw new IllegalStateException("empty result");
        }
        return values.get(0);
    }

    private List<Object> call(FunctionDescriptorVO function, String target, String caller, List<Object> args) {
        String data = calldataEncoder.encode(function, args);
        String result = blockchainGateway.call(caller, target, data);
        if (StringUtils.isBlank(result) || "0x".equalsIgnoreCase(result.trim())) {
            if (function.safeOutputs().isEmpty()) {
                return Collections.emptyList();
            }
            throw new IllegalStateException("empty result");
        }
        return calldataEncoder.decodeValues(result, function.safeOutputs());
    }

    private String reason(Exception ex) {
        if (ex instanceof AppException appException) {
            return appException.getInfo();
        }
        return StringUtils.defaultIfBlank(ex.getMessage(), ex.getClass().getSimpleName());
    }

    private static FunctionDescriptorVO standard(String name, List<AbiParameterVO> inputs, String outputType) {
        List<AbiParameterVO> outputs = outputType == null
                ? Collections.emptyList()
                : List.of(AbiParameterVO.of("", outputType));
        return FunctionDescriptorVO.of(name, inputs, outputs, StateMutabilityEnum.VIEW);
    }
}

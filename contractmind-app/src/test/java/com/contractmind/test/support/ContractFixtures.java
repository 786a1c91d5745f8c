package com.contractmind.test.support;

import com.contractmind.domain.agent.model.entity.AgentEntity;
import com.contractmind.domain.agent.model.valobj.AbiParameterVO;
import com.contractmind.domain.agent.model.valobj.FunctionCatalogVO;
import com.contractmind.domain.agent.model.valobj.FunctionDescriptorVO;
import com.contractmind.types.enums.StateMutabilityEnum;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 测试用合约、ABI 与 Agent 样例。
 */
public final class ContractFixtures {

    public static final String USER = "0x1234567890abcdef1234567890abcdef12345678";
    public static final String TARGET = "0x1111111111111111111111111111111111111111";
    public static final String HUB = "0x2222222222222222222222222222222222222222";
    public static final String RECIPIENT = "0x3333333333333333333333333333333333333333";
    public static final String AGENT_ID = "staking-agent";

    private ContractFixtures() {
    }

    public static FunctionDescriptorVO balanceOf() {
        return FunctionDescriptorVO.of("balanceOf", List.of(AbiParameterVO.of("account", "address")),
                List.of(AbiParameterVO.of("", "uint256")), StateMutabilityEnum.VIEW);
    }

    public static FunctionDescriptorVO stake() {
        return FunctionDescriptorVO.of("stake", List.of(AbiParameterVO.of("amount", "uint256")),
                List.of(), StateMutabilityEnum.NONPAYABLE);
    }

    public static FunctionDescriptorVO transfer() {
        return FunctionDescriptorVO.of("transfer",
                List.of(AbiParameterVO.of("to", "address"), AbiParameterVO.of("amount", "uint256")),
                List.of(AbiParameterVO.of("", "bool")), StateMutabilityEnum.NONPAYABLE);
    }

    public static FunctionDescriptorVO mint() {
        return FunctionDescriptorVO.of("mint",
                List.of(AbiParameterVO.of("to", "address"), AbiParameterVO.of("amount", "uint256")),
                List.of(), StateMutabilityEnum.NONPAYABLE);
    }

    public static FunctionCatalogVO catalog(FunctionDescriptorVO... functions) {
        return new FunctionCatalogVO(List.of(functions));
    }

    /**
     * 标准 ERC20 + 质押 ABI（JSON 形态）。
     */
    public static List<Map<String, Object>> stakingAbi() {
        List<Map<String, Object>> abi = new ArrayList<>();
        abi.add(function("balanceOf", "view", List.of(param("account", "address")), List.of(param("", "uint256"))));
        abi.add(function("decimals", "view", List.of(), List.of(param("", "uint8"))));
        abi.add(function("stake", "nonpayable", List.of(param("amount", "uint256")), List.of()));
        abi.add(function("transfer", "nonpayable",
                List.of(param("to", "address"), param("amount", "uint256")), List.of(param("", "bool"))));
        return abi;
    }

    public static Map<String, Boolean> allAuthorized() {
        Map<String, Boolean> authorizations = new LinkedHashMap<>();
        authorizations.put("balanceOf", true);
        authorizations.put("decimals", true);
        authorizations.put("stake", true);
        authorizations.put("transfer", true);
        return authorizations;
    }

    public static AgentEntity stakingAgent() {
        AgentEntity agent = new AgentEntity();
        agent.setAgentId(AGENT_ID);
        agent.setName("DeFi Staking");
        agent.setDescription("Stake tokens and earn rewards");
        agent.setOwner(USER);
        agent.setTargetAddress(TARGET);
        agent.setAbi(stakingAbi());
        agent.setIsActive(true);
        return agent;
    }

    public static Map<String, Object> function(String name,
                                               String mutability,
                                               List<Map<String, Object>> inputs,
                                               List<Map<String, Object>> outputs) {
        Map<String, Object> item = new LinkedHashMap<>();
        item.put("type", "function");
        item.put("name", name);
        item.put("stateMutability", mutability);
        item.put("inputs", inputs);
        item.put("outputs", outputs);
        return item;
    }

    public static Map<String, Object> param(String name, String type) {
        Map<String, Object> item = new LinkedHashMap<>();
        item.put("name", name);
        item.put("type", type);
        return item;
    }

    /**
     * 单个 uint 返回值的 eth_call 结果。
     */
    public static String word(BigInteger value) {
        return Numeric.toHexStringWithPrefixZeroPadded(value, 64);
    }

    /**
     * 单个 address 返回值的 eth_call 结果。
     */
    public static String addressWord(String address) {
        return word(Numeric.toBigInt(address));
    }
}

package com.contractmind.infrastructure.gateway.blockchain;

import com.contractmind.domain.agent.adapter.gateway.IAgentRegistryGateway;
import com.contractmind.domain.agent.model.entity.AgentEntity;
import com.contractmind.domain.agent.model.valobj.AbiParameterVO;
import com.contractmind.domain.agent.model.valobj.FunctionDescriptorVO;
import com.contractmind.domain.transaction.adapter.gateway.IBlockchainGateway;
import com.contractmind.domain.transaction.service.CalldataEncoderDomainService;
import com.contractmind.types.common.Constants;
import com.contractmind.types.enums.StateMutabilityEnum;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

/**
 * 链上 Agent 注册表读取：{@code getAgent(bytes32)}。
 * <p>
 * 返回值是含动态字段的结构体 (owner, targetContract, name, configIPFS, active, createdAt, updatedAt)，
 * 外层为一个指向元组的偏移字，去掉后按平铺元组解码。owner 为零地址表示未注册。
 * </p>
 */
@Slf4j
@Component
public class AgentRegistryGatewayImpl implements IAgentRegistryGateway {

    private static final FunctionDescriptorVO GET_AGENT = FunctionDescriptorVO.of(
            "getAgent",
            List.of(AbiParameterVO.of("agentId", "bytes32")),
            List.of(AbiParameterVO.of("owner", "address"),
                    AbiParameterVO.of("targetContract", "address"),
                    AbiParameterVO.of("name", "string"),
                    AbiParameterVO.of("configIPFS", "string"),
                    AbiParameterVO.of("active", "bool"),
                    AbiParameterVO.of("createdAt", "uint256"),
                    AbiParameterVO.of("updatedAt", "uint256")),
            StateMutabilityEnum.VIEW);

    private static final int WORD_HEX_LENGTH = 64;

    private final IBlockchainGateway blockchainGateway;
    private final CalldataEncoderDomainService calldataEncoder;
    private final String registryAddress;

    public AgentRegistryGatewayImpl(IBlockchainGateway blockchainGateway,
                                    CalldataEncoderDomainService calldataEncoder,
                                    @Value("${contractmind.blockchain.agent-registry-address:}") String registryAddress) {
        this.blockchainGateway = blockchainGateway;
        this.calldataEncoder = calldataEncoder;
        this.registryAddress = registryAddress;
    }

    @Override
    public AgentEntity fetchAgent(String agentId) {
        if (StringUtils.isBlank(registryAddress)) {
            log.debug("AGENT_REGISTRY_NOT_CONFIGURED agentId={}", agentId);
            return null;
        }
        String calldata = calldataEncoder.encode(GET_AGENT, List.of(CalldataEncoderDomainService.toBytes32(agentId)));
        String result = blockchainGateway.call(null, registryAddress, calldata);
        String clean = Numeric.cleanHexPrefix(StringUtils.defaultString(result));
        if (clean.length() <= WORD_HEX_LENGTH) {
            return null;
        }
        List<Object> values = calldataEncoder.decodeValues(clean.substring(WORD_HEX_LENGTH), GET_AGENT.safeOutputs());
        String owner = (String) values.get(0);
        if (Constants.ZERO_ADDRESS.equalsIgnoreCase(owner)) {
            return null;
        }
        AgentEntity agent = new AgentEntity();
        agent.setAgentId(agentId);
        agent.setOwner(owner);
        agent.setTargetAddress((String) values.get(1));
        agent.setName((String) values.get(2));
        agent.setConfigIpfs((String) values.get(3));
        agent.setIsActive((Boolean) values.get(4));
        agent.setCreatedAt(toDateTime((BigInteger) values.get(5)));
        agent.setUpdatedAt(toDateTime((BigInteger) values.get(6)));
        log.info("AGENT_REGISTRY_HIT agentId={}, target={}", agentId, agent.getTargetAddress());
        return agent;
    }

    private LocalDateTime toDateTime(BigInteger epochSeconds) {
        if (epochSeconds == null || epochSeconds.signum() <= 0) {
            return null;
        }
        return LocalDateTime.ofEpochSecond(epochSeconds.longValue(), 0, ZoneOffset.UTC);
    }
}

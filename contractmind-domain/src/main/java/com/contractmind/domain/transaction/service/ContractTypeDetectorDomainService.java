package com.contractmind.domain.transaction.service;

import com.contractmind.domain.transaction.adapter.gateway.IBlockchainGateway;
import com.contractmind.types.common.Constants;
import com.contractmind.types.enums.ContractTypeEnum;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import org.web3j.utils.Numeric;

import java.math.BigInteger;

/**
 * 合约类型探测：对目标合约做一次 {@code trustedHub()} 的 eth_call。
 * <p>
 * 返回非零地址视为 Hub-aware；revert、空结果、解码失败或零地址一律视为普通合约。
 * </p>
 */
@Slf4j
@Service
public class ContractTypeDetectorDomainService {

    static final String TRUSTED_HUB_SIGNATURE = "trustedHub()";

    private final IBlockchainGateway blockchainGateway;

    public ContractTypeDetectorDomainService(IBlockchainGateway blockchainGateway) {
        this.blockchainGateway = blockchainGateway;
    }

    public ContractTypeEnum detect(String targetAddress) {
        String calldata = CalldataEncoderDomainService.selectorOf(TRUSTED_HUB_SIGNATURE);
        String result;
        try {
            result = blockchainGateway.call(null, targetAddress, calldata);
        } catch (Exception ex) {
            log.debug("CONTRACT_TYPE_PROBE_FAILED target={}, error={}", targetAddress, ex.getMessage());
            return ContractTypeEnum.REGULAR;
        }
        String hub = decodeAddressWord(result);
        if (hub == null || Constants.ZERO_ADDRESS.equalsIgnoreCase(hub)) {
            return ContractTypeEnum.REGULAR;
        }
        log.debug("CONTRACT_TYPE_HUB_AWARE target={}, trustedHub={}", targetAddress, hub);
        return ContractTypeEnum.HUB_AWARE;
    }

    /**
     * 取返回值第一个 32 字节字的低 20 字节作为地址，不足一个字返回 null。
     */
    private String decodeAddressWord(String result) {
        if (StringUtils.isBlank(result)) {
            return null;
        }
        String clean = Numeric.cleanHexPrefix(result.trim());
        if (clean.length() < 64) {
            return null;
        }
        try {
            BigInteger word = new BigInteger(clean.substring(0, 64), 16);
            return Numeric.toHexStringWithPrefixZeroPadded(word.mod(BigInteger.TWO.pow(160)), 40);
        } catch (NumberFormatException ex) {
            return null;
        }
    }
}

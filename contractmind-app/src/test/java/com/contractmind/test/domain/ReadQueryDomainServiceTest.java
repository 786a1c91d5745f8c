package com.contractmind.test.domain;

import com.contractmind.domain.agent.model.valobj.AbiParameterVO;
import com.contractmind.domain.agent.model.valobj.FunctionDescriptorVO;
import com.contractmind.domain.transaction.adapter.gateway.IBlockchainGateway;
import com.contractmind.domain.transaction.model.valobj.ChainSettingsVO;
import com.contractmind.domain.transaction.service.CalldataEncoderDomainService;
import com.contractmind.domain.transaction.service.ReadQueryDomainService;
import com.contractmind.test.support.ContractFixtures;
import com.contractmind.types.enums.ResponseCode;
import com.contractmind.types.enums.StateMutabilityEnum;
import com.contractmind.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class ReadQueryDomainServiceTest {

    private static final String BALANCE_OF_SELECTOR = "0x70a08231";
    private static final String DECIMALS_SELECTOR = "0x313ce567";

    private IBlockchainGateway gateway;
    private ReadQueryDomainService readQuery;

    @BeforeEach
    public void setUp() {
        gateway = mock(IBlockchainGateway.class);
        ChainSettingsVO settings = ChainSettingsVO.builder()
                .chainId(50312L)
                .networkName("Somnia Testnet")
                .build();
        readQuery = new ReadQueryDomainService(gateway, new CalldataEncoderDomainService(), settings);
    }

    @Test
    public void shouldFormatBalanceWithTokenDecimals() {
        when(gateway.call(eq(ContractFixtures.USER), eq(ContractFixtures.TARGET), startsWith(BALANCE_OF_SELECTOR)))
                .thenReturn(ContractFixtures.word(new BigInteger("1500000000000000000")));
        when(gateway.call(eq(ContractFixtures.USER), eq(ContractFixtures.TARGET), startsWith(DECIMALS_SELECTOR)))
                .thenReturn(ContractFixtures.word(BigInteger.valueOf(18)));

        String reply = readQuery.query("balanceOf", ContractFixtures.TARGET, ContractFixtures.USER);

        Assertions.assertEquals("Your balance is 1.5000 tokens (raw: 1500000000000000000)", reply);
    }

    @Test
    public void shouldReportRawBalanceWhenDecimalsUnavailable() {
        when(gateway.call(eq(ContractFixtures.USER), eq(ContractFixtures.TARGET), startsWith(BALANCE_OF_SELECTOR)))
                .thenReturn(ContractFixtures.word(BigInteger.valueOf(42)));
        when(gateway.call(eq(ContractFixtures.USER), eq(ContractFixtures.TARGET), startsWith(DECIMALS_SELECTOR)))
                .thenThrow(new AppException(ResponseCode.RPC_ERROR, "execution reverted"));

        String reply = readQuery.query("balanceOf", ContractFixtures.TARGET, ContractFixtures.USER);

        Assertions.assertEquals("Your balance is 42 (raw amount)", reply);
    }

    @Test
    public void shouldExplainFailureWithNetworkDetails() {
        when(gateway.call(anyString(), anyString(), anyString()))
                .thenThrow(new AppException(ResponseCode.RPC_ERROR, "connection refused"));

        String reply = readQuery.query("balanceOf", ContractFixtures.TARGET, ContractFixtures.USER);

        Assertions.assertTrue(reply.startsWith("⚠️ Could not query balanceOf on " + ContractFixtures.TARGET));
        Assertions.assertTrue(reply.contains("connection refused"));
        Assertions.assertTrue(reply.endsWith("Somnia Testnet (Chain ID: 50312)."));
    }

    @Test
    public void shouldDecodeGenericViewFunction() {
        FunctionDescriptorVO rewards = FunctionDescriptorVO.of("pendingRewards",
                List.of(AbiParameterVO.of("account", "address")),
                List.of(AbiParameterVO.of("", "uint256")),
                StateMutabilityEnum.VIEW);
        String selector = CalldataEncoderDomainService.selectorOf("pendingRewards(address)");
        when(gateway.call(eq(ContractFixtures.USER), eq(ContractFixtures.TARGET), startsWith(selector)))
                .thenReturn(ContractFixtures.word(BigInteger.valueOf(1234)));

        String reply = readQuery.query("pendingRewards", ContractFixtures.TARGET, ContractFixtures.USER,
                rewards, Map.of("account", ContractFixtures.USER));

        Assertions.assertEquals("pendingRewards returned: 1234", reply);
    }

    @Test
    public void shouldAnswerAllowanceWithGuidance() {
        String reply = readQuery.query("allowance", ContractFixtures.TARGET, ContractFixtures.USER);

        Assertions.assertTrue(reply.startsWith("To check allowance"));
    }
}

package com.contractmind.test.domain;

import com.contractmind.domain.transaction.adapter.gateway.IBlockchainGateway;
import com.contractmind.domain.transaction.model.valobj.ChainSettingsVO;
import com.contractmind.domain.transaction.model.valobj.RoutingContextVO;
import com.contractmind.domain.transaction.model.valobj.TransactionEnvelopeVO;
import com.contractmind.domain.transaction.service.CalldataEncoderDomainService;
import com.contractmind.domain.transaction.service.TransactionRouterDomainService;
import com.contractmind.test.support.ContractFixtures;
import com.contractmind.types.enums.ContractTypeEnum;
import com.contractmind.types.enums.ResponseCode;
import com.contractmind.types.enums.RouteTypeEnum;
import com.contractmind.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.List;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class TransactionRouterDomainServiceTest {

    private static final String EXECUTE_ON_TARGET =
            CalldataEncoderDomainService.selectorOf("executeOnTarget(bytes32,address,bytes)");

    private IBlockchainGateway gateway;
    private CalldataEncoderDomainService encoder;
    private String stakeCalldata;

    @BeforeEach
    public void setUp() {
        gateway = mock(IBlockchainGateway.class);
        encoder = new CalldataEncoderDomainService();
        stakeCalldata = encoder.encode(ContractFixtures.stake(), List.of(BigInteger.TEN.pow(20)));
        when(gateway.getNonce(ContractFixtures.USER)).thenReturn(BigInteger.valueOf(7));
        when(gateway.getGasPrice()).thenReturn(BigInteger.valueOf(6_000_000_000L));
    }

    @Test
    public void shouldWrapHubAwareCallInExecuteOnTarget() {
        when(gateway.estimateGas(anyString(), anyString(), anyString()))
                .thenThrow(new AppException(ResponseCode.RPC_ERROR, "estimate failed"));
        TransactionRouterDomainService router = router(ContractFixtures.HUB);

        TransactionEnvelopeVO envelope = router.route("stake", ContractFixtures.TARGET, stakeCalldata,
                ContractFixtures.USER, ContractTypeEnum.HUB_AWARE, stakeContext());

        Assertions.assertEquals(RouteTypeEnum.HUB, envelope.getRoute());
        Assertions.assertEquals(ContractFixtures.HUB, envelope.getTo());
        Assertions.assertTrue(envelope.getData().startsWith(EXECUTE_ON_TARGET));
        Assertions.assertTrue(envelope.getData().contains(Numeric.cleanHexPrefix(stakeCalldata)));
        Assertions.assertEquals(TransactionRouterDomainService.HUB_DEFAULT_GAS, envelope.getGas());
        Assertions.assertEquals(BigInteger.valueOf(7), envelope.getNonce());
        Assertions.assertEquals("0x0", envelope.getValue());
        Assertions.assertEquals("Stake 100 USDC on DeFi Staking", envelope.getDescription());
        Assertions.assertEquals("100 USDC", envelope.getPreview().getAmount());
        Assertions.assertEquals("ContractMind Hub", envelope.getPreview().getRoute());
        Assertions.assertEquals(3, envelope.getPreview().getFeatures().size());
    }

    @Test
    public void shouldSendRegularContractCallDirectly() {
        when(gateway.estimateGas(anyString(), anyString(), anyString())).thenReturn(BigInteger.valueOf(52_000));
        TransactionRouterDomainService router = router(ContractFixtures.HUB);

        TransactionEnvelopeVO envelope = router.route("stake", ContractFixtures.TARGET, stakeCalldata,
                ContractFixtures.USER, ContractTypeEnum.REGULAR, stakeContext());

        Assertions.assertEquals(RouteTypeEnum.DIRECT, envelope.getRoute());
        Assertions.assertEquals(ContractFixtures.TARGET, envelope.getTo());
        Assertions.assertEquals(stakeCalldata, envelope.getData());
        Assertions.assertEquals(BigInteger.valueOf(52_000), envelope.getGas());
    }

    @Test
    public void shouldUseDirectDefaultGasWhenEstimateFails() {
        when(gateway.estimateGas(anyString(), anyString(), anyString()))
                .thenThrow(new AppException(ResponseCode.RPC_ERROR, "execution reverted"));
        TransactionRouterDomainService router = router(ContractFixtures.HUB);

        TransactionEnvelopeVO envelope = router.route("stake", ContractFixtures.TARGET, stakeCalldata,
                ContractFixtures.USER, ContractTypeEnum.REGULAR, stakeContext());

        Assertions.assertEquals(TransactionRouterDomainService.DIRECT_DEFAULT_GAS, envelope.getGas());
    }

    @Test
    public void shouldFallBackToDirectWhenHubAddressIsMissing() {
        when(gateway.estimateGas(anyString(), anyString(), anyString())).thenReturn(BigInteger.valueOf(60_000));
        TransactionRouterDomainService router = router(null);

        TransactionEnvelopeVO envelope = router.route("stake", ContractFixtures.TARGET, stakeCalldata,
                ContractFixtures.USER, ContractTypeEnum.HUB_AWARE, stakeContext());

        Assertions.assertEquals(RouteTypeEnum.DIRECT, envelope.getRoute());
        Assertions.assertEquals(ContractFixtures.TARGET, envelope.getTo());
    }

    @Test
    public void shouldLeaveNonceAndGasPriceEmptyWhenRpcFails() {
        when(gateway.getNonce(ContractFixtures.USER)).thenThrow(new AppException(ResponseCode.RPC_ERROR, "down"));
        when(gateway.getGasPrice()).thenThrow(new AppException(ResponseCode.RPC_ERROR, "down"));
        when(gateway.estimateGas(anyString(), anyString(), anyString())).thenReturn(BigInteger.valueOf(60_000));
        TransactionRouterDomainService router = router(ContractFixtures.HUB);

        TransactionEnvelopeVO envelope = router.route("transfer", ContractFixtures.TARGET, stakeCalldata,
                ContractFixtures.USER, ContractTypeEnum.REGULAR, RoutingContextVO.builder().build());

        Assertions.assertNull(envelope.getNonce());
        Assertions.assertNull(envelope.getGasPrice());
        Assertions.assertEquals("Execute transfer on contract", envelope.getDescription());
        Assertions.assertNull(envelope.getPreview().getAmount());
        Assertions.assertEquals("Direct (no intermediary)", envelope.getPreview().getRoute());
    }

    @Test
    public void shouldDescribeActionWithoutAmountWhenQuantityUnknown() {
        when(gateway.estimateGas(anyString(), anyString(), anyString())).thenReturn(BigInteger.valueOf(60_000));
        TransactionRouterDomainService router = router(ContractFixtures.HUB);

        TransactionEnvelopeVO staked = router.route("stake", ContractFixtures.TARGET, stakeCalldata,
                ContractFixtures.USER, ContractTypeEnum.REGULAR, RoutingContextVO.builder()
                        .action("stake").protocol("DeFi Staking").build());
        TransactionEnvelopeVO withdrawn = router.route("withdraw", ContractFixtures.TARGET, stakeCalldata,
                ContractFixtures.USER, ContractTypeEnum.REGULAR, RoutingContextVO.builder()
                        .action("withdraw").protocol("DeFi Staking").amount("5").build());

        Assertions.assertEquals("Stake on DeFi Staking", staked.getDescription());
        Assertions.assertEquals("Withdraw on DeFi Staking", withdrawn.getDescription());
        Assertions.assertNull(withdrawn.getPreview().getAmount());
    }

    @Test
    public void shouldCapitalizePreviewAction() {
        when(gateway.estimateGas(anyString(), anyString(), anyString())).thenReturn(BigInteger.valueOf(60_000));
        TransactionRouterDomainService router = router(ContractFixtures.HUB);

        TransactionEnvelopeVO envelope = router.route("stake", ContractFixtures.TARGET, stakeCalldata,
                ContractFixtures.USER, ContractTypeEnum.REGULAR, stakeContext());

        Assertions.assertEquals("Stake", envelope.getPreview().getAction());
        Assertions.assertEquals("DeFi Staking", envelope.getPreview().getProtocol());
    }

    @Test
    public void shouldDeriveActionFromFunctionName() {
        Assertions.assertEquals("withdraw", TransactionRouterDomainService.deriveAction("unstakeAll"));
        Assertions.assertEquals("stake", TransactionRouterDomainService.deriveAction("stake"));
        Assertions.assertEquals("claim", TransactionRouterDomainService.deriveAction("claimRewards"));
        Assertions.assertEquals("transfer", TransactionRouterDomainService.deriveAction("transfer"));
    }

    private TransactionRouterDomainService router(String hubAddress) {
        ChainSettingsVO settings = ChainSettingsVO.builder()
                .chainId(50312L)
                .networkName("Somnia Testnet")
                .hubAddress(hubAddress)
                .build();
        return new TransactionRouterDomainService(gateway, encoder, settings);
    }

    private RoutingContextVO stakeContext() {
        return RoutingContextVO.builder()
                .agentId(ContractFixtures.AGENT_ID)
                .action("stake")
                .protocol("DeFi Staking")
                .amount("100")
                .token("USDC")
                .build();
    }
}

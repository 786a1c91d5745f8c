package com.contractmind.test.domain;

import com.contractmind.domain.transaction.adapter.gateway.IBlockchainGateway;
import com.contractmind.domain.transaction.service.CalldataEncoderDomainService;
import com.contractmind.domain.transaction.service.ContractTypeDetectorDomainService;
import com.contractmind.test.support.ContractFixtures;
import com.contractmind.types.enums.ContractTypeEnum;
import com.contractmind.types.enums.ResponseCode;
import com.contractmind.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class ContractTypeDetectorDomainServiceTest {

    private static final String TRUSTED_HUB_CALL = CalldataEncoderDomainService.selectorOf("trustedHub()");

    private IBlockchainGateway gateway;
    private ContractTypeDetectorDomainService detector;

    @BeforeEach
    public void setUp() {
        gateway = mock(IBlockchainGateway.class);
        detector = new ContractTypeDetectorDomainService(gateway);
    }

    @Test
    public void shouldDetectHubAwareWhenTrustedHubIsSet() {
        when(gateway.call(isNull(), eq(ContractFixtures.TARGET), eq(TRUSTED_HUB_CALL)))
                .thenReturn(ContractFixtures.addressWord(ContractFixtures.HUB));

        Assertions.assertEquals(ContractTypeEnum.HUB_AWARE, detector.detect(ContractFixtures.TARGET));
    }

    @Test
    public void shouldTreatRevertAsRegular() {
        when(gateway.call(isNull(), eq(ContractFixtures.TARGET), eq(TRUSTED_HUB_CALL)))
                .thenThrow(new AppException(ResponseCode.RPC_ERROR, "execution reverted"));

        Assertions.assertEquals(ContractTypeEnum.REGULAR, detector.detect(ContractFixtures.TARGET));
    }

    @Test
    public void shouldTreatZeroAddressAndEmptyResultAsRegular() {
        when(gateway.call(isNull(), eq(ContractFixtures.TARGET), eq(TRUSTED_HUB_CALL)))
                .thenReturn(ContractFixtures.word(BigInteger.ZERO))
                .thenReturn("0x")
                .thenReturn("0x1234");

        Assertions.assertEquals(ContractTypeEnum.REGULAR, detector.detect(ContractFixtures.TARGET));
        Assertions.assertEquals(ContractTypeEnum.REGULAR, detector.detect(ContractFixtures.TARGET));
        Assertions.assertEquals(ContractTypeEnum.REGULAR, detector.detect(ContractFixtures.TARGET));
    }
}

package com.contractmind.test.domain;

import com.contractmind.domain.agent.model.valobj.AbiParameterVO;
import com.contractmind.domain.transaction.service.ParameterCoercionDomainService;
import com.contractmind.test.support.ContractFixtures;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class ParameterCoercionDomainServiceTest {

    private static final List<AbiParameterVO> TRANSFER_INPUTS =
            List.of(AbiParameterVO.of("to", "address"), AbiParameterVO.of("amount", "uint256"));

    private final ParameterCoercionDomainService service = new ParameterCoercionDomainService();

    @Test
    public void shouldReplaceSelfReferenceAndScaleAmount() {
        Map<String, Object> params = new HashMap<>();
        params.put("to", "me");
        params.put("amount", "100");

        Map<String, Object> result = service.coerce(params, TRANSFER_INPUTS, ContractFixtures.USER);

        Assertions.assertEquals(ContractFixtures.USER, result.get("to"));
        Assertions.assertEquals(BigInteger.TEN.pow(18).multiply(BigInteger.valueOf(100)), result.get("amount"));
        Assertions.assertEquals("me", params.get("to"));
    }

    @Test
    public void shouldMultiplyByTenToThe36WhenCoercedTwice() {
        Map<String, Object> params = new HashMap<>();
        params.put("amount", "100");

        Map<String, Object> once = service.coerce(params, TRANSFER_INPUTS, ContractFixtures.USER);
        Map<String, Object> twice = service.coerce(once, TRANSFER_INPUTS, ContractFixtures.USER);

        Assertions.assertEquals(BigInteger.TEN.pow(36).multiply(BigInteger.valueOf(100)), twice.get("amount"));
    }

    @Test
    public void shouldUseConfiguredDecimalsAndTruncateFraction() {
        Map<String, Object> params = new HashMap<>();
        params.put("amount", "1.5");

        Map<String, Object> result = service.coerce(params, TRANSFER_INPUTS, ContractFixtures.USER, 6);

        Assertions.assertEquals(BigInteger.valueOf(1_500_000L), result.get("amount"));
        Assertions.assertEquals(BigInteger.ONE, service.scaleAmount("amount", "0.0000019", 6));
    }

    @Test
    public void shouldKeepExplicitAddressAndUncoercibleAmount() {
        Map<String, Object> params = new HashMap<>();
        params.put("to", ContractFixtures.RECIPIENT);
        params.put("amount", "lots");

        Map<String, Object> result = service.coerce(params, TRANSFER_INPUTS, ContractFixtures.USER);

        Assertions.assertEquals(ContractFixtures.RECIPIENT, result.get("to"));
        Assertions.assertEquals("lots", result.get("amount"));
    }

    @Test
    public void shouldReplaceNonHexAddressWithCaller() {
        Map<String, Object> params = new HashMap<>();
        params.put("to", "alice");

        Map<String, Object> result = service.coerce(params, TRANSFER_INPUTS, ContractFixtures.USER);

        Assertions.assertEquals(ContractFixtures.USER, result.get("to"));
    }

    @Test
    public void shouldPassThroughAmountsBeyondUint256() {
        Map<String, Object> params = new HashMap<>();
        params.put("amount", "1E+2147483647");

        Map<String, Object> result = Assertions.assertDoesNotThrow(
                () -> service.coerce(params, TRANSFER_INPUTS, ContractFixtures.USER));

        Assertions.assertEquals("1E+2147483647", result.get("amount"));
        Assertions.assertEquals("1e999999999", service.scaleAmount("amount", "1e999999999", 18));
        Assertions.assertEquals(BigInteger.TEN.pow(77), service.scaleAmount("amount", "1e59", 18));
    }
}

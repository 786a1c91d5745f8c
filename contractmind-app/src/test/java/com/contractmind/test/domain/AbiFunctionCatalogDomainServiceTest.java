package com.contractmind.test.domain;

import com.contractmind.domain.agent.model.valobj.FunctionCatalogVO;
import com.contractmind.domain.agent.model.valobj.FunctionDescriptorVO;
import com.contractmind.domain.agent.service.AbiFunctionCatalogDomainService;
import com.contractmind.test.support.ContractFixtures;
import com.contractmind.types.enums.StateMutabilityEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class AbiFunctionCatalogDomainServiceTest {

    private final AbiFunctionCatalogDomainService service = new AbiFunctionCatalogDomainService();

    @Test
    public void shouldKeepFunctionsInAbiOrderWithAuthorization() {
        Map<String, Boolean> authorizations = Map.of("balanceOf", true, "stake", false);

        FunctionCatalogVO catalog = service.parse(ContractFixtures.stakingAbi(), authorizations);

        Assertions.assertEquals(4, catalog.size());
        Assertions.assertEquals("balanceOf", catalog.getFunctions().get(0).getName());
        Assertions.assertTrue(catalog.find("balanceOf").isAuthorized());
        Assertions.assertFalse(catalog.find("stake").isAuthorized());
        Assertions.assertFalse(catalog.find("transfer").isAuthorized());
        Assertions.assertTrue(catalog.find("decimals").isReadOnly());
        Assertions.assertEquals("transfer(address,uint256)", catalog.find("transfer").getSignature());
    }

    @Test
    public void shouldSkipEventsAndNormalizeLegacyEntries() {
        List<Map<String, Object>> abi = new ArrayList<>(ContractFixtures.stakingAbi());
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("type", "event");
        event.put("name", "Transfer");
        abi.add(event);
        Map<String, Object> legacy = new LinkedHashMap<>();
        legacy.put("name", "rewardOf");
        legacy.put("constant", true);
        legacy.put("inputs", List.of(ContractFixtures.param("", "uint")));
        legacy.put("outputs", List.of(ContractFixtures.param("", "uint[]")));
        abi.add(legacy);

        FunctionCatalogVO catalog = service.parse(abi, ContractFixtures.allAuthorized());

        Assertions.assertNull(catalog.find("Transfer"));
        FunctionDescriptorVO rewardOf = catalog.find("rewardOf");
        Assertions.assertEquals(StateMutabilityEnum.VIEW, rewardOf.getStateMutability());
        Assertions.assertEquals("arg0", rewardOf.getInputs().get(0).getName());
        Assertions.assertEquals("uint256", rewardOf.getInputs().get(0).getType());
        Assertions.assertEquals("uint256[]", rewardOf.getOutputs().get(0).getType());
        Assertions.assertFalse(rewardOf.isAuthorized());
    }

    @Test
    public void shouldTreatUnknownMutabilityAsNonpayable() {
        List<Map<String, Object>> abi = new ArrayList<>(ContractFixtures.stakingAbi());
        Map<String, Object> odd = new LinkedHashMap<>();
        odd.put("type", "function");
        odd.put("name", "rebase");
        odd.put("stateMutability", "immutable");
        abi.add(odd);

        FunctionCatalogVO catalog = Assertions.assertDoesNotThrow(() -> service.parse(abi, Map.of()));

        Assertions.assertEquals(5, catalog.size());
        Assertions.assertEquals(StateMutabilityEnum.NONPAYABLE, catalog.find("rebase").getStateMutability());
        Assertions.assertFalse(catalog.find("rebase").isReadOnly());
    }

    @Test
    public void shouldReturnEmptyCatalogWithoutAbi() {
        Assertions.assertTrue(service.parse(null, Map.of()).isEmpty());
        Assertions.assertTrue(service.parse(List.of(), Map.of()).isEmpty());
    }
}

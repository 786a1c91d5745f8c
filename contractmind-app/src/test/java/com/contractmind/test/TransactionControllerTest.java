package com.contractmind.test;

import com.contractmind.domain.chat.adapter.gateway.ITelemetrySink;
import com.contractmind.domain.chat.model.entity.TransactionRecordEntity;
import com.contractmind.domain.chat.service.ChatHistoryDomainService;
import com.contractmind.domain.chat.service.TransactionResultDomainService;
import com.contractmind.domain.transaction.adapter.gateway.IBlockchainGateway;
import com.contractmind.domain.transaction.model.valobj.ChainSettingsVO;
import com.contractmind.test.support.ContractFixtures;
import com.contractmind.test.support.InMemoryChatMessageRepository;
import com.contractmind.test.support.InMemoryTransactionRecordRepository;
import com.contractmind.trigger.application.query.TransactionQueryService;
import com.contractmind.trigger.http.GlobalApiExceptionHandler;
import com.contractmind.trigger.http.TransactionController;
import com.contractmind.types.enums.ResponseCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.Mockito.mock;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class TransactionControllerTest {

    private MockMvc mockMvc;
    private InMemoryTransactionRecordRepository transactionRepository;

    @BeforeEach
    public void setUp() {
        transactionRepository = new InMemoryTransactionRecordRepository();
        ITelemetrySink telemetrySink = mock(ITelemetrySink.class);
        TransactionResultDomainService domainService = new TransactionResultDomainService(
                mock(IBlockchainGateway.class),
                transactionRepository,
                new ChatHistoryDomainService(new InMemoryChatMessageRepository(), telemetrySink),
                telemetrySink,
                ChainSettingsVO.builder().build());
        this.mockMvc = MockMvcBuilders.standaloneSetup(new TransactionController(new TransactionQueryService(domainService)))
                .setControllerAdvice(new GlobalApiExceptionHandler())
                .build();
    }

    @Test
    public void shouldListTransactionsForLowercasedUser() throws Exception {
        transactionRepository.save(TransactionRecordEntity.pending("0xabc", ContractFixtures.USER,
                ContractFixtures.AGENT_ID, ContractFixtures.TARGET, "stake"));

        mockMvc.perform(get("/api/v1/transactions")
                        .param("userAddress", ContractFixtures.USER.toUpperCase().replace("0X", "0x")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0000"))
                .andExpect(jsonPath("$.data[0].txHash").value("0xabc"))
                .andExpect(jsonPath("$.data[0].status").value("pending"))
                .andExpect(jsonPath("$.data[0].executionMode").value("wallet"));
    }

    @Test
    public void shouldRejectMalformedAddress() throws Exception {
        mockMvc.perform(get("/api/v1/transactions").param("userAddress", "alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.ILLEGAL_PARAMETER.getCode()));
    }
}

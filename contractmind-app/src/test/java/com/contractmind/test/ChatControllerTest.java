package com.contractmind.test;

import com.contractmind.api.dto.ChatHistoryItemDTO;
import com.contractmind.api.dto.ChatResponseDTO;
import com.contractmind.api.dto.PreparedTransactionDTO;
import com.contractmind.api.dto.TransactionResultResponseDTO;
import com.contractmind.test.support.ContractFixtures;
import com.contractmind.trigger.application.command.ChatPipelineCommandService;
import com.contractmind.trigger.application.command.TransactionResultCommandService;
import com.contractmind.trigger.application.query.ChatHistoryQueryService;
import com.contractmind.trigger.http.ChatController;
import com.contractmind.trigger.http.GlobalApiExceptionHandler;
import com.contractmind.types.enums.ResponseCode;
import com.contractmind.types.exception.AppException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class ChatControllerTest {

    private MockMvc mockMvc;
    private ChatPipelineCommandService chatPipelineCommandService;
    private TransactionResultCommandService transactionResultCommandService;
    private ChatHistoryQueryService chatHistoryQueryService;
    private ObjectMapper objectMapper;

    @BeforeEach
    public void setUp() {
        this.chatPipelineCommandService = mock(ChatPipelineCommandService.class);
        this.transactionResultCommandService = mock(TransactionResultCommandService.class);
        this.chatHistoryQueryService = mock(ChatHistoryQueryService.class);
        this.mockMvc = MockMvcBuilders.standaloneSetup(new ChatController(chatPipelineCommandService,
                        transactionResultCommandService, chatHistoryQueryService))
                .setControllerAdvice(new GlobalApiExceptionHandler())
                .build();
        this.objectMapper = new ObjectMapper();
    }

    @Test
    public void shouldReturnPreparedTransaction() throws Exception {
        PreparedTransactionDTO prepared = new PreparedTransactionDTO();
        prepared.setTo(ContractFixtures.HUB);
        prepared.setRoute("hub");
        prepared.setGas(500_000L);
        prepared.setParams(Map.of("amount", "100000000000000000000"));
        ChatResponseDTO response = new ChatResponseDTO();
        response.setResponse("✅ Transaction prepared! Ready to call stake. Please review and sign.");
        response.setIsPreparedTransaction(true);
        response.setPreparedTransaction(prepared);
        when(chatPipelineCommandService.execute(ContractFixtures.AGENT_ID, "Stake 100 USDC", ContractFixtures.USER))
                .thenReturn(new ChatPipelineCommandService.ChatPipelineResult(null, response));

        mockMvc.perform(post("/api/v1/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "agentId", ContractFixtures.AGENT_ID,
                                "message", "Stake 100 USDC",
                                "userAddress", ContractFixtures.USER))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0000"))
                .andExpect(jsonPath("$.data.isPreparedTransaction").value(true))
                .andExpect(jsonPath("$.data.preparedTransaction.route").value("hub"))
                .andExpect(jsonPath("$.data.preparedTransaction.gas").value(500000))
                .andExpect(jsonPath("$.data.preparedTransaction.params.amount").value("100000000000000000000"));
    }

    @Test
    public void shouldReturnNotFoundCodeForUnknownAgent() throws Exception {
        when(chatPipelineCommandService.execute(eq("ghost"), anyString(), anyString()))
                .thenThrow(new AppException(ResponseCode.NOT_FOUND, "Agent not found: ghost"));

        mockMvc.perform(post("/api/v1/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "agentId", "ghost",
                                "message", "hello",
                                "userAddress", ContractFixtures.USER))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.NOT_FOUND.getCode()))
                .andExpect(jsonPath("$.info").value("Agent not found: ghost"));
    }

    @Test
    public void shouldReportTransactionResult() throws Exception {
        TransactionResultResponseDTO result = new TransactionResultResponseDTO();
        result.setStatus("pending");
        result.setTxHash("0xabc");
        result.setResponse("⏳ Transaction submitted! Hash: `0xabc`");
        when(transactionResultCommandService.report("0xabc", ContractFixtures.USER, ContractFixtures.AGENT_ID,
                "stake", ContractFixtures.TARGET)).thenReturn(result);

        mockMvc.perform(post("/api/v1/chat/transaction-result")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "txHash", "0xabc",
                                "userAddress", ContractFixtures.USER,
                                "agentId", ContractFixtures.AGENT_ID,
                                "functionName", "stake",
                                "targetAddress", ContractFixtures.TARGET))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0000"))
                .andExpect(jsonPath("$.data.status").value("pending"))
                .andExpect(jsonPath("$.data.txHash").value("0xabc"));
    }

    @Test
    public void shouldConfirmTransactionForAgent() throws Exception {
        TransactionResultResponseDTO result = new TransactionResultResponseDTO();
        result.setStatus("success");
        result.setBlockNumber(1234L);
        when(transactionResultCommandService.confirm("0xabc", ContractFixtures.USER, ContractFixtures.AGENT_ID, "stake"))
                .thenReturn(result);

        mockMvc.perform(post("/api/v1/chat/" + ContractFixtures.AGENT_ID + "/confirm")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "txHash", "0xabc",
                                "userAddress", ContractFixtures.USER,
                                "functionName", "stake"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("success"))
                .andExpect(jsonPath("$.data.blockNumber").value(1234));
    }

    @Test
    public void shouldListHistoryWithDefaultLimit() throws Exception {
        ChatHistoryItemDTO item = new ChatHistoryItemDTO();
        item.setRole("assistant");
        item.setMessage("Your balance is 1.0000 tokens (raw: 1000000000000000000)");
        when(chatHistoryQueryService.getHistory(ContractFixtures.AGENT_ID, ContractFixtures.USER, 50))
                .thenReturn(List.of(item));

        mockMvc.perform(get("/api/v1/chat/history")
                        .param("agentId", ContractFixtures.AGENT_ID)
                        .param("userAddress", ContractFixtures.USER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].role").value("assistant"));
        verify(chatHistoryQueryService).getHistory(ContractFixtures.AGENT_ID, ContractFixtures.USER, 50);
    }

    @Test
    public void shouldRejectHistoryWithoutUserAddress() throws Exception {
        mockMvc.perform(get("/api/v1/chat/history").param("agentId", ContractFixtures.AGENT_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.ILLEGAL_PARAMETER.getCode()));
    }
}

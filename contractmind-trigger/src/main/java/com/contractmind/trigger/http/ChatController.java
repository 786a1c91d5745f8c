package com.contractmind.trigger.http;

import com.contractmind.api.dto.ChatHistoryItemDTO;
import com.contractmind.api.dto.ChatRequestDTO;
import com.contractmind.api.dto.ChatResponseDTO;
import com.contractmind.api.dto.TransactionConfirmRequestDTO;
import com.contractmind.api.dto.TransactionResultRequestDTO;
import com.contractmind.api.dto.TransactionResultResponseDTO;
import com.contractmind.api.response.Response;
import com.contractmind.trigger.application.command.ChatPipelineCommandService;
import com.contractmind.trigger.application.command.TransactionResultCommandService;
import com.contractmind.trigger.application.query.ChatHistoryQueryService;
import com.contractmind.types.enums.ResponseCode;
import com.contractmind.types.exception.AppException;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 聊天 API：自然语言消息 → 查询结果或待签名交易。
 */
@RestController
@RequestMapping("/api/v1/chat")
public class ChatController {

    private final ChatPipelineCommandService chatPipelineCommandService;
    private final TransactionResultCommandService transactionResultCommandService;
    private final ChatHistoryQueryService chatHistoryQueryService;

    public ChatController(ChatPipelineCommandService chatPipelineCommandService,
                          TransactionResultCommandService transactionResultCommandService,
                          ChatHistoryQueryService chatHistoryQueryService) {
        this.chatPipelineCommandService = chatPipelineCommandService;
        this.transactionResultCommandService = transactionResultCommandService;
        this.chatHistoryQueryService = chatHistoryQueryService;
    }

    @PostMapping
    public Response<ChatResponseDTO> chat(@RequestBody ChatRequestDTO request) {
        if (request == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "request body is required");
        }
        ChatPipelineCommandService.ChatPipelineResult result = chatPipelineCommandService.execute(
                request.getAgentId(), request.getMessage(), request.getUserAddress());
        return Response.success(result.response());
    }

    @PostMapping("/transaction-result")
    public Response<TransactionResultResponseDTO> transactionResult(@RequestBody TransactionResultRequestDTO request) {
        if (request == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "request body is required");
        }
        return Response.success(transactionResultCommandService.report(
                request.getTxHash(),
                request.getUserAddress(),
                request.getAgentId(),
                request.getFunctionName(),
                request.getTargetAddress()));
    }

    @PostMapping("/{agentId}/confirm")
    public Response<TransactionResultResponseDTO> confirm(@PathVariable("agentId") String agentId,
                                                          @RequestBody TransactionConfirmRequestDTO request) {
        if (request == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "request body is required");
        }
        return Response.success(transactionResultCommandService.confirm(
                request.getTxHash(), request.getUserAddress(), agentId, request.getFunctionName()));
    }

    @GetMapping("/history")
    public Response<List<ChatHistoryItemDTO>> history(@RequestParam("agentId") String agentId,
                                                      @RequestParam("userAddress") String userAddress,
                                                      @RequestParam(value = "limit", defaultValue = "50") Integer limit) {
        return Response.success(chatHistoryQueryService.getHistory(agentId, userAddress, limit));
    }
}

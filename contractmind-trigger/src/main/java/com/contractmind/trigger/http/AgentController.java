package com.contractmind.trigger.http;

import com.contractmind.api.dto.AgentDetailDTO;
import com.contractmind.api.dto.AgentStatusRequestDTO;
import com.contractmind.api.dto.AgentSummaryDTO;
import com.contractmind.api.dto.AgentUpdateRequestDTO;
import com.contractmind.api.dto.FunctionAuthorizationRequestDTO;
import com.contractmind.api.response.Response;
import com.contractmind.trigger.application.command.AgentAdminCommandService;
import com.contractmind.trigger.application.query.AgentQueryService;
import com.contractmind.types.enums.ResponseCode;
import com.contractmind.types.exception.AppException;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Agent 目录 API。
 */
@RestController
@RequestMapping("/api/v1/agents")
public class AgentController {

    private final AgentQueryService agentQueryService;
    private final AgentAdminCommandService agentAdminCommandService;

    public AgentController(AgentQueryService agentQueryService, AgentAdminCommandService agentAdminCommandService) {
        this.agentQueryService = agentQueryService;
        this.agentAdminCommandService = agentAdminCommandService;
    }

    @GetMapping
    public Response<List<AgentSummaryDTO>> list(@RequestParam(value = "active", required = false) Boolean active) {
        return Response.success(agentQueryService.list(active));
    }

    @GetMapping("/{agentId}")
    public Response<AgentDetailDTO> detail(@PathVariable("agentId") String agentId) {
        return Response.success(agentQueryService.detail(agentId));
    }

    @GetMapping("/name/{name}")
    public Response<AgentDetailDTO> detailByName(@PathVariable("name") String name) {
        return Response.success(agentQueryService.detail(name));
    }

    @PostMapping("/{agentId}/authorize")
    public Response<AgentDetailDTO> authorize(@PathVariable("agentId") String agentId,
                                              @RequestBody FunctionAuthorizationRequestDTO request) {
        return Response.success(agentAdminCommandService.authorize(agentId, functionName(request)));
    }

    @PostMapping("/{agentId}/revoke")
    public Response<AgentDetailDTO> revoke(@PathVariable("agentId") String agentId,
                                           @RequestBody FunctionAuthorizationRequestDTO request) {
        return Response.success(agentAdminCommandService.revoke(agentId, functionName(request)));
    }

    @PatchMapping("/{agentId}/status")
    public Response<AgentDetailDTO> changeStatus(@PathVariable("agentId") String agentId,
                                                 @RequestBody AgentStatusRequestDTO request) {
        return Response.success(agentAdminCommandService.changeStatus(agentId, request == null ? null : request.getActive()));
    }

    @PatchMapping("/{agentId}")
    public Response<AgentDetailDTO> update(@PathVariable("agentId") String agentId,
                                           @RequestBody AgentUpdateRequestDTO request) {
        if (request == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "request body is required");
        }
        return Response.success(agentAdminCommandService.update(agentId, request.getName(),
                request.getDescription(), request.getAbi()));
    }

    @DeleteMapping("/{agentId}")
    public Response<Boolean> delete(@PathVariable("agentId") String agentId) {
        agentAdminCommandService.delete(agentId);
        return Response.success(Boolean.TRUE);
    }

    private String functionName(FunctionAuthorizationRequestDTO request) {
        return request == null ? null : request.getFunctionName();
    }
}

package com.contractmind.trigger.http;

import com.contractmind.api.dto.AgentStatsDTO;
import com.contractmind.api.dto.GlobalStatsDTO;
import com.contractmind.api.dto.UserStatsDTO;
import com.contractmind.api.response.Response;
import com.contractmind.trigger.application.query.AnalyticsQueryService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 交易统计 API，默认统计最近 7 天。
 */
@RestController
@RequestMapping("/api/v1/analytics")
public class AnalyticsController {

    private final AnalyticsQueryService analyticsQueryService;

    public AnalyticsController(AnalyticsQueryService analyticsQueryService) {
        this.analyticsQueryService = analyticsQueryService;
    }

    @GetMapping("/user/{userAddress}")
    public Response<UserStatsDTO> user(@PathVariable("userAddress") String userAddress,
                                       @RequestParam(value = "days", defaultValue = "7") Integer days) {
        return Response.success(analyticsQueryService.userStats(userAddress, days));
    }

    @GetMapping("/agent/{agentId}")
    public Response<AgentStatsDTO> agent(@PathVariable("agentId") String agentId,
                                         @RequestParam(value = "days", defaultValue = "7") Integer days) {
        return Response.success(analyticsQueryService.agentStats(agentId, days));
    }

    @GetMapping("/global")
    public Response<GlobalStatsDTO> global(@RequestParam(value = "days", defaultValue = "7") Integer days) {
        return Response.success(analyticsQueryService.globalStats(days));
    }
}

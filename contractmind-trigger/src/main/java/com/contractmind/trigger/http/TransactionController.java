package com.contractmind.trigger.http;

import com.contractmind.api.dto.TransactionRecordDTO;
import com.contractmind.api.response.Response;
import com.contractmind.trigger.application.query.TransactionQueryService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 交易记录查询 API
 */
@RestController
@RequestMapping("/api/v1/transactions")
public class TransactionController {

    private final TransactionQueryService transactionQueryService;

    public TransactionController(TransactionQueryService transactionQueryService) {
        this.transactionQueryService = transactionQueryService;
    }

    @GetMapping
    public Response<List<TransactionRecordDTO>> list(@RequestParam("userAddress") String userAddress,
                                                     @RequestParam(value = "limit", defaultValue = "50") Integer limit) {
        return Response.success(transactionQueryService.listByUser(userAddress, limit));
    }
}

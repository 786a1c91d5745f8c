package com.contractmind.trigger.application.query;

import com.contractmind.api.dto.TransactionRecordDTO;
import com.contractmind.domain.chat.model.entity.TransactionRecordEntity;
import com.contractmind.domain.chat.service.TransactionResultDomainService;
import com.contractmind.types.common.Constants;
import com.contractmind.types.enums.ResponseCode;
import com.contractmind.types.exception.AppException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 用户交易记录读用例。
 */
@Service
public class TransactionQueryService {

    private final TransactionResultDomainService transactionResultDomainService;

    public TransactionQueryService(TransactionResultDomainService transactionResultDomainService) {
        this.transactionResultDomainService = transactionResultDomainService;
    }

    public List<TransactionRecordDTO> listByUser(String userAddress, Integer limit) {
        if (userAddress == null || !userAddress.trim().matches(Constants.ADDRESS_REGEX)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "userAddress must be a 0x-prefixed 40 hex address");
        }
        int resolvedLimit = limit == null || limit <= 0 ? 50 : Math.min(limit, 200);
        return transactionResultDomainService.historyByUser(userAddress.trim(), resolvedLimit).stream()
                .map(TransactionQueryService::toDTO)
                .collect(Collectors.toList());
    }

    static TransactionRecordDTO toDTO(TransactionRecordEntity record) {
        TransactionRecordDTO dto = new TransactionRecordDTO();
        dto.setTxHash(record.getTxHash());
        dto.setUserAddress(record.getUserAddress());
        dto.setAgentId(record.getAgentId());
        dto.setTargetAddress(record.getTargetAddress());
        dto.setFunctionName(record.getFunctionName());
        dto.setExecutionMode(record.getExecutionMode());
        dto.setStatus(record.getStatus() == null ? null : record.getStatus().getCode());
        dto.setBlockNumber(record.getBlockNumber());
        dto.setGasUsed(record.getGasUsed());
        dto.setErrorMessage(record.getErrorMessage());
        dto.setCreatedAt(record.getCreatedAt());
        dto.setConfirmedAt(record.getConfirmedAt());
        return dto;
    }
}

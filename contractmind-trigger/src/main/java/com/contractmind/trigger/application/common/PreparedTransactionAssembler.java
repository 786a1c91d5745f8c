package com.contractmind.trigger.application.common;

import com.contractmind.api.dto.PreparedTransactionDTO;
import com.contractmind.api.dto.TransactionPreviewDTO;
import com.contractmind.domain.transaction.model.valobj.TransactionEnvelopeVO;
import com.contractmind.domain.transaction.model.valobj.TransactionPreviewVO;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 交易信封 → 前端 DTO。大整数参数按十进制字符串输出，避免 JS 精度丢失。
 */
public final class PreparedTransactionAssembler {

    private PreparedTransactionAssembler() {
    }

    public static PreparedTransactionDTO toDTO(TransactionEnvelopeVO envelope, Map<String, Object> params) {
        PreparedTransactionDTO dto = new PreparedTransactionDTO();
        dto.setTo(envelope.getTo());
        dto.setData(envelope.getData());
        dto.setValue(envelope.getValue());
        dto.setGas(envelope.getGas() == null ? null : envelope.getGas().longValue());
        dto.setGasPrice(envelope.getGasPrice() == null ? null : envelope.getGasPrice().toString());
        dto.setNonce(envelope.getNonce() == null ? null : envelope.getNonce().longValue());
        dto.setRoute(envelope.getRoute() == null ? null : envelope.getRoute().getCode());
        dto.setFunctionName(envelope.getFunctionName());
        dto.setDescription(envelope.getDescription());
        dto.setParams(displayParams(params));
        dto.setPreview(toPreview(envelope.getPreview()));
        return dto;
    }

    private static Map<String, Object> displayParams(Map<String, Object> params) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (params == null) {
            return result;
        }
        params.forEach((key, value) -> result.put(key, value instanceof BigInteger ? value.toString() : value));
        return result;
    }

    private static TransactionPreviewDTO toPreview(TransactionPreviewVO preview) {
        if (preview == null) {
            return null;
        }
        TransactionPreviewDTO dto = new TransactionPreviewDTO();
        dto.setAction(preview.getAction());
        dto.setProtocol(preview.getProtocol());
        dto.setRoute(preview.getRoute());
        dto.setAmount(preview.getAmount());
        dto.setFeatures(preview.getFeatures());
        return dto;
    }
}

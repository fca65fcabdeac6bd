package io.hhplus.storefront.application.operation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.hhplus.storefront.application.fulfillment.operation.SideEffectOperation;
import io.hhplus.storefront.common.exception.BusinessException;
import io.hhplus.storefront.common.exception.ErrorCode;
import io.hhplus.storefront.domain.operation.FailedOperation;
import io.hhplus.storefront.domain.operation.OperationType;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 재시도 기록을 작업 타입별 구현으로 넘긴다.
 */
@Component
public class FailedOperationDispatcher {

    private final Map<OperationType, SideEffectOperation<?>> operations = new EnumMap<>(OperationType.class);
    private final ObjectMapper objectMapper;

    public FailedOperationDispatcher(List<SideEffectOperation<?>> operations, ObjectMapper objectMapper) {
        operations.forEach(operation -> this.operations.put(operation.type(), operation));
        this.objectMapper = objectMapper;
    }

    public void dispatch(FailedOperation failedOperation) {
        SideEffectOperation<?> operation = operations.get(failedOperation.getOperationType());
        if (operation == null) {
            throw new BusinessException(
                ErrorCode.UNSUPPORTED_OPERATION,
                "지원하지 않는 후처리 작업입니다: " + failedOperation.getOperationType()
            );
        }
        execute(operation, failedOperation);
    }

    private <P> void execute(SideEffectOperation<P> operation, FailedOperation failedOperation) {
        P payload;
        try {
            payload = objectMapper.readValue(failedOperation.getPayload(), operation.payloadType());
        } catch (JsonProcessingException e) {
            throw new BusinessException(
                ErrorCode.UNSUPPORTED_OPERATION,
                "후처리 페이로드를 해석할 수 없습니다. id: " + failedOperation.getId(),
                e
            );
        }
        operation.execute(failedOperation.getTenantId(), payload);
    }
}

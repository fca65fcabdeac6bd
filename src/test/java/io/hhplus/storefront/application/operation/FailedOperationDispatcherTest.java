package io.hhplus.storefront.application.operation;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.hhplus.storefront.application.fulfillment.operation.OrderOperationPayload;
import io.hhplus.storefront.application.fulfillment.operation.SideEffectOperation;
import io.hhplus.storefront.common.exception.BusinessException;
import io.hhplus.storefront.common.exception.ErrorCode;
import io.hhplus.storefront.domain.operation.FailedOperation;
import io.hhplus.storefront.domain.operation.OperationType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class FailedOperationDispatcherTest {

    private final List<OrderOperationPayload> executed = new ArrayList<>();
    private FailedOperationDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        SideEffectOperation<OrderOperationPayload> notification = new SideEffectOperation<>() {
            @Override
            public OperationType type() {
                return OperationType.NOTIFICATION;
            }

            @Override
            public Class<OrderOperationPayload> payloadType() {
                return OrderOperationPayload.class;
            }

            @Override
            public void execute(Long tenantId, OrderOperationPayload payload) {
                executed.add(payload);
            }
        };
        dispatcher = new FailedOperationDispatcher(List.of(notification), new ObjectMapper());
    }

    private FailedOperation failed(OperationType type, String payload) {
        return FailedOperation.record(
            1L, type, "ORDER", 42L, payload, "first failure",
            5, List.of(Duration.ofMinutes(5)), LocalDateTime.of(2026, 1, 15, 10, 0)
        );
    }

    @Test
    @DisplayName("저장된 페이로드를 역직렬화해 같은 작업을 다시 실행한다")
    void dispatch_성공() {
        dispatcher.dispatch(failed(OperationType.NOTIFICATION, "{\"orderId\":42,\"orderNumber\":\"ORD-202601-00001\"}"));

        assertThat(executed).containsExactly(new OrderOperationPayload(42L, "ORD-202601-00001"));
    }

    @Test
    @DisplayName("등록되지 않은 작업 타입 - UNSUPPORTED_OPERATION")
    void dispatch_미등록타입_예외발생() {
        assertThatThrownBy(() -> dispatcher.dispatch(failed(OperationType.WEBHOOK_DELIVERY, "{}")))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.UNSUPPORTED_OPERATION);
    }

    @Test
    @DisplayName("깨진 페이로드 - UNSUPPORTED_OPERATION")
    void dispatch_잘못된페이로드_예외발생() {
        assertThatThrownBy(() -> dispatcher.dispatch(failed(OperationType.NOTIFICATION, "{broken")))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.UNSUPPORTED_OPERATION);
        assertThat(executed).isEmpty();
    }
}

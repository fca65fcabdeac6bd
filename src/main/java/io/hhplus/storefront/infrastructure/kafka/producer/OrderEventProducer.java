package io.hhplus.storefront.infrastructure.kafka.producer;

import io.hhplus.storefront.common.exception.BusinessException;
import io.hhplus.storefront.common.exception.ErrorCode;
import io.hhplus.storefront.infrastructure.kafka.message.OrderConfirmedMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Slf4j
@Component
@RequiredArgsConstructor
public class OrderEventProducer {

    public static final String ORDER_CONFIRMED_TOPIC = "order-confirmed";
    private static final long SEND_TIMEOUT_SECONDS = 10L;

    private final KafkaTemplate<String, Object> kafkaTemplate;

    /**
     * 주문 확정 이벤트 발행. 파티션 키는 테넌트 ID.
     * 브로커 응답을 기다려 실패를 EVENT_PUBLISH_FAILED로 돌려준다.
     */
    public void publishOrderConfirmed(OrderConfirmedMessage message) {
        try {
            SendResult<String, Object> result = kafkaTemplate
                .send(ORDER_CONFIRMED_TOPIC, String.valueOf(message.tenantId()), message)
                .get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);

            var metadata = result.getRecordMetadata();
            log.info("Kafka message published: orderId={}, topic={}, partition={}, offset={}",
                message.orderId(),
                metadata.topic(),
                metadata.partition(),
                metadata.offset()
            );
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BusinessException(ErrorCode.EVENT_PUBLISH_FAILED, "주문 이벤트 발행 중 인터럽트 발생", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new BusinessException(
                ErrorCode.EVENT_PUBLISH_FAILED,
                "주문 이벤트 발행 실패: orderId=" + message.orderId(),
                e
            );
        }
    }
}

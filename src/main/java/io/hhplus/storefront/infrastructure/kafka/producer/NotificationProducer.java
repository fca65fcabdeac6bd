package io.hhplus.storefront.infrastructure.kafka.producer;

import io.hhplus.storefront.common.exception.BusinessException;
import io.hhplus.storefront.common.exception.ErrorCode;
import io.hhplus.storefront.infrastructure.kafka.message.OrderNotificationMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 고객 알림 발행
 *
 * 실패를 호출자에게 돌려줘야 재시도 원장에 기록할 수 있으므로 브로커 응답을 동기로 기다린다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NotificationProducer {

    public static final String NOTIFICATION_TOPIC = "order-notification";
    private static final long SEND_TIMEOUT_SECONDS = 10L;

    private final KafkaTemplate<String, Object> kafkaTemplate;

    public void send(OrderNotificationMessage message) {
        try {
            SendResult<String, Object> result = kafkaTemplate
                .send(NOTIFICATION_TOPIC, String.valueOf(message.orderId()), message)
                .get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);

            log.info("알림 발행 완료: orderId={}, template={}, offset={}",
                message.orderId(), message.template(), result.getRecordMetadata().offset());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BusinessException(ErrorCode.NOTIFICATION_FAILED, "알림 발행 중 인터럽트 발생", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new BusinessException(
                ErrorCode.NOTIFICATION_FAILED,
                "알림 발행 실패: orderId=" + message.orderId(),
                e
            );
        }
    }
}

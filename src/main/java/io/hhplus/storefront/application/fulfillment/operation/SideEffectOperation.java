package io.hhplus.storefront.application.fulfillment.operation;

import io.hhplus.storefront.domain.operation.OperationType;

/**
 * 결제 확정 후속 처리 단위
 *
 * 코디네이터의 최초 실행과 재시도 스케줄러의 재실행이 같은 구현을 사용한다.
 * 같은 페이로드로 여러 번 실행해도 결과가 한 번 실행한 것과 같아야 한다.
 *
 * @param <P> 재시도 원장에 JSON으로 저장되는 페이로드 타입
 */
public interface SideEffectOperation<P> {

    OperationType type();

    Class<P> payloadType();

    /**
     * 실패 시 예외를 던진다. 예외 메시지가 재시도 원장의 errorMessage로 남는다.
     */
    void execute(Long tenantId, P payload);
}

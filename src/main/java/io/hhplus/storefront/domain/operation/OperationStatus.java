package io.hhplus.storefront.domain.operation;

public enum OperationStatus {
    PENDING,    // 재시도 대기
    RETRYING,   // 재시도 중
    SUCCEEDED,  // 성공
    FAILED      // 최종 실패
}

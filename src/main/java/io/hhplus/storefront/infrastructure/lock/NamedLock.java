package io.hhplus.storefront.infrastructure.lock;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * MySQL 네임드 락 어노테이션
 *
 * 여러 인스턴스 중 한 곳에서만 실행되어야 하는 배치 작업에 적용한다.
 * 락을 얻지 못하면 메서드를 실행하지 않고 건너뛴다 (void 메서드 전용).
 *
 * 사용 예시:
 * <pre>
 * {@code
 * @NamedLock(key = "'storefront:failed-operations'")
 * public void processDue() { ... }
 * }
 * </pre>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface NamedLock {

    /**
     * 락 이름 (SpEL 표현식, 최대 64자)
     */
    String key();

    /**
     * 락 대기 시간 (초). 0이면 즉시 포기한다.
     */
    int waitSeconds() default 0;
}

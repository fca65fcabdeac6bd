package io.hhplus.storefront.application.usecase;

import org.springframework.stereotype.Component;

import java.lang.annotation.*;

/**
 * 애플리케이션 진입점(유스케이스) 스테레오타입
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Component
public @interface UseCase {
    String value() default "";
}

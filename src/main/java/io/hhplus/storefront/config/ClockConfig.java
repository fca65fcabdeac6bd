package io.hhplus.storefront.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 시각 의존 로직(만료, 백오프, 서명 허용 범위)이 테스트에서 고정 시계를 쓸 수 있도록 Clock을 빈으로 둔다.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}

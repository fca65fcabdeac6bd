package io.hhplus.storefront.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
            .info(new Info()
                .title("Storefront Core API")
                .description("장바구니 예약, 체크아웃, 결제 웹훅 정산 API 문서")
                .version("1.0.0"));
    }
}

package io.hhplus.storefront.config;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.springframework.context.annotation.Bean;
import org.testcontainers.containers.KafkaContainer;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.utility.DockerImageName;

/**
 * TestContainers 설정
 *
 * 통합 테스트에서 사용할 MySQL과 Kafka 컨테이너.
 * 컨테이너는 JVM당 한 번만 띄우고 @ServiceConnection으로 접속 정보를 주입한다.
 */
@TestConfiguration(proxyBeanMethods = false)
public class TestContainersConfig {

    private static final MySQLContainer<?> mysql;
    private static final KafkaContainer kafka;

    static {
        mysql = new MySQLContainer<>("mysql:8.0")
                .withDatabaseName("test_storefront")
                .withUsername("test")
                .withPassword("test")
                .withCommand(
                        "--character-set-server=utf8mb4",
                        "--collation-server=utf8mb4_unicode_ci"
                );
        mysql.start();

        kafka = new KafkaContainer(DockerImageName.parse("confluentinc/cp-kafka:7.5.3"));
        kafka.start();
    }

    @Bean
    @ServiceConnection
    public MySQLContainer<?> mysqlContainer() {
        return mysql;
    }

    @Bean
    @ServiceConnection
    public KafkaContainer kafkaContainer() {
        return kafka;
    }
}

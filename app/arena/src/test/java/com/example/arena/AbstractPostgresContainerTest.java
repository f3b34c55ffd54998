/*
 * どこで: Arena テスト基盤
 * 何を: Testcontainers(Postgres) と DataSource/Flyway の共通設定を提供する
 * なぜ: 成績・実績・outbox の SQL を本番と同じ PostgreSQL 方言で検証するため
 */
package com.example.arena;

import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;

public abstract class AbstractPostgresContainerTest {

  // JVM 内のテスト全体で 1 コンテナを共有する
  static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine");

  static {
    // @DynamicPropertySource が拡張より先に評価されても接続先が確定しているよう明示起動する
    POSTGRES.start();
  }

  @DynamicPropertySource
  static void registerProperties(DynamicPropertyRegistry registry) {
    registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
    registry.add("spring.datasource.username", POSTGRES::getUsername);
    registry.add("spring.datasource.password", POSTGRES::getPassword);

    registry.add("spring.datasource.hikari.schema", () -> "arena");

    registry.add("spring.flyway.enabled", () -> "true");
    registry.add("spring.flyway.locations", () -> "classpath:db/migration");
    registry.add("spring.flyway.default-schema", () -> "arena");
    registry.add("spring.flyway.schemas", () -> "arena");
    registry.add("spring.flyway.create-schemas", () -> "true");
    registry.add("spring.flyway.table", () -> "flyway_schema_history_arena");
  }
}

/*
 * どこで: Queue 設定バインドのテスト
 * 何を: smql.* のプロパティが QueueProperties へバインドされることを検証する
 * なぜ: K 表記のサイズや Duration 表記のリース設定が起動時に正しく解釈されることを保証するため
 */
package com.example.queue.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class QueuePropertiesBindingTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withConfiguration(AutoConfigurations.of(ValidationAutoConfiguration.class))
          .withUserConfiguration(TestConfiguration.class);

  @Test
  void contextStartsAndBindsQueueFields() {
    contextRunner
        .withPropertyValues(
            "smql.max-message-size=64K",
            "smql.lease-timeout=45s",
            "smql.lease-reaper-enabled=false",
            "smql.lease-reaper-interval=500ms")
        .run(
            context -> {
              assertThat(context).hasNotFailed();
              final QueueProperties properties = context.getBean(QueueProperties.class);

              assertThat(properties.maxMessageSizeBytes()).isEqualTo(65536L);
              assertThat(properties.leaseTimeout()).isEqualTo(Duration.ofSeconds(45));
              assertThat(properties.leaseReaperEnabled()).isFalse();
              assertThat(properties.leaseReaperInterval()).isEqualTo(Duration.ofMillis(500));
            });
  }

  @Test
  void contextFailsWhenMaxMessageSizeIsInvalid() {
    contextRunner
        .withPropertyValues(
            "smql.max-message-size=0",
            "smql.lease-timeout=30s",
            "smql.lease-reaper-enabled=true",
            "smql.lease-reaper-interval=1s")
        .run(context -> assertThat(context).hasFailed());
  }

  @Configuration
  @EnableConfigurationProperties(QueueProperties.class)
  static class TestConfiguration {
    // ApplicationContextRunner 用の最小構成
  }
}

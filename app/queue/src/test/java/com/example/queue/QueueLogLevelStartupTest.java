/*
 * どこで: Queue アプリの起動テスト
 * 何を: SMQL_LOG_LEVEL 相当の指定ごとに起動とルートログレベルを検証する
 * なぜ: warning 表記や未知のレベルで起動失敗しないことを保証するため
 */
package com.example.queue;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.context.ConfigurableApplicationContext;

class QueueLogLevelStartupTest {

  @ParameterizedTest
  @CsvSource({"warning,warn,WARN", "WARN,warn,WARN", "verbose,info,INFO", "debug,debug,DEBUG"})
  void applicationStartsWithNormalizedRootLevel(
      String configured, String expectedProperty, LogLevel expectedLevel) {
    try (ConfigurableApplicationContext context =
        new SpringApplicationBuilder(QueueApplication.class)
            .web(WebApplicationType.NONE)
            .run("--logging.level.root=" + configured, "--smql.lease-reaper-enabled=false")) {
      assertThat(context.getEnvironment().getProperty("logging.level.root"))
          .isEqualTo(expectedProperty);
      assertThat(
              LoggingSystem.get(getClass().getClassLoader())
                  .getLoggerConfiguration(LoggingSystem.ROOT_LOGGER_NAME)
                  .getEffectiveLevel())
          .isEqualTo(expectedLevel);
    }
  }
}

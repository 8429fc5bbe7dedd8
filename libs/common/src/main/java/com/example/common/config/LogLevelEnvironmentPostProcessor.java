/*
 * どこで: Common 共通設定
 * 何を: logging.level.root の値を trace/debug/info/warn/error のいずれかへ正規化する
 * なぜ: warning 表記や未知のレベル指定で起動失敗させず info へ寄せるため
 */
package com.example.common.config;

import java.util.Locale;
import java.util.Map;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;

public class LogLevelEnvironmentPostProcessor implements EnvironmentPostProcessor {

  static final String ROOT_LEVEL_PROPERTY = "logging.level.root";
  static final String PROPERTY_SOURCE_NAME = "normalizedRootLogLevel";

  @Override
  public void postProcessEnvironment(
      ConfigurableEnvironment environment, SpringApplication application) {
    final String configured = environment.getProperty(ROOT_LEVEL_PROPERTY);
    if (configured == null) {
      return;
    }
    environment
        .getPropertySources()
        .addFirst(
            new MapPropertySource(
                PROPERTY_SOURCE_NAME, Map.of(ROOT_LEVEL_PROPERTY, normalize(configured))));
  }

  /**
   * 役割: レベル表記を Spring Boot が解釈できる名前へ変換する。
   * 動作: 大文字小文字を区別せず、warning は warn として扱い、それ以外の未知の値は info を返す。
   */
  public static String normalize(String level) {
    final String lower = level.trim().toLowerCase(Locale.ROOT);
    return switch (lower) {
      case "trace", "debug", "info", "error" -> lower;
      case "warn", "warning" -> "warn";
      default -> "info";
    };
  }
}

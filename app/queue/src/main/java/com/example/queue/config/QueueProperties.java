/*
 * どこで: Queue アプリの設定バインド
 * 何を: メッセージサイズ上限とリース期限/期限切れ回収の設定を保持する
 * なぜ: 環境変数で上書きできる値を起動時に一度だけ検証し、service へ明示的に渡すため
 */
package com.example.queue.config;

import com.example.common.ByteSizes;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "smql")
@Validated
public record QueueProperties(
    @NotBlank String maxMessageSize,
    @NotNull Duration leaseTimeout,
    boolean leaseReaperEnabled,
    @NotNull Duration leaseReaperInterval) {

  @AssertTrue(message = "smql.max-message-size must be a positive byte count or <n>K")
  public boolean isMaxMessageSizeValid() {
    return ByteSizes.parse(maxMessageSize).isPresent();
  }

  @AssertTrue(message = "smql.lease-timeout must not be negative")
  public boolean isLeaseTimeoutNotNegative() {
    // 0 はリース期限なし(自動解放しない)を意味する。
    return leaseTimeout == null || !leaseTimeout.isNegative();
  }

  @AssertTrue(message = "smql.lease-reaper-interval must be positive")
  public boolean isLeaseReaperIntervalPositive() {
    return leaseReaperInterval == null
        || (!leaseReaperInterval.isZero() && !leaseReaperInterval.isNegative());
  }

  /** 役割: 検証済みの max-message-size をバイト数で返す。 前提: isMaxMessageSizeValid が true であること。 */
  public long maxMessageSizeBytes() {
    return ByteSizes.parse(maxMessageSize)
        .orElseThrow(
            () -> new IllegalStateException("invalid smql.max-message-size: " + maxMessageSize));
  }

  /** 役割: リース期限が有効かどうかを返す。 */
  public boolean leaseExpiryEnabled() {
    return leaseTimeout != null && !leaseTimeout.isZero();
  }
}

/*
 * どこで: 共通ユーティリティ
 * 何を: "65536" や "64K" 形式のサイズ表記をバイト数へ変換する
 * なぜ: 環境変数で渡されるサイズ上限を各アプリで同じ規則で解釈するため
 */
package com.example.common;

import java.util.OptionalLong;

public final class ByteSizes {

  private static final long KIBIBYTE = 1024L;

  private ByteSizes() {}

  /**
   * 役割: サイズ表記を正のバイト数へ変換する。
   * 動作: 末尾の K/k はキビバイト指定として 1024 倍し、それ以外は素のバイト数として扱う。
   * 前提: 空文字、0 以下、数値でない値、long を超える値は empty を返す。
   */
  public static OptionalLong parse(String value) {
    if (value == null) {
      return OptionalLong.empty();
    }
    final String trimmed = value.trim();
    if (trimmed.isEmpty()) {
      return OptionalLong.empty();
    }
    final char last = trimmed.charAt(trimmed.length() - 1);
    if (last == 'K' || last == 'k') {
      return parsePositive(trimmed.substring(0, trimmed.length() - 1))
          .stream()
          .filter(kib -> kib <= Long.MAX_VALUE / KIBIBYTE)
          .map(kib -> kib * KIBIBYTE)
          .findFirst();
    }
    return parsePositive(trimmed);
  }

  private static OptionalLong parsePositive(String digits) {
    if (digits.isEmpty()) {
      return OptionalLong.empty();
    }
    for (int i = 0; i < digits.length(); i++) {
      final char c = digits.charAt(i);
      if (c < '0' || c > '9') {
        return OptionalLong.empty();
      }
    }
    try {
      final long parsed = Long.parseLong(digits);
      return parsed > 0 ? OptionalLong.of(parsed) : OptionalLong.empty();
    } catch (NumberFormatException ex) {
      // 桁あふれ
      return OptionalLong.empty();
    }
  }
}

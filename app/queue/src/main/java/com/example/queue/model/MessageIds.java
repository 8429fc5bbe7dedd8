/*
 * Where: Queue domain model
 * What: Generates and parses message identifiers
 * Why: IDs must sort by creation time and be validated before reaching storage
 */
package com.example.queue.model;

import com.github.f4b6a3.ulid.UlidCreator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class MessageIds {

  private static final String HYPHENATED =
      "([0-9a-fA-F]{8})-([0-9a-fA-F]{4})-([0-9a-fA-F]{4})-([0-9a-fA-F]{4})-([0-9a-fA-F]{12})";
  private static final Pattern SIMPLE_UUID =
      Pattern.compile(
          "^([0-9a-fA-F]{8})([0-9a-fA-F]{4})([0-9a-fA-F]{4})([0-9a-fA-F]{4})([0-9a-fA-F]{12})$");
  private static final Pattern HYPHENATED_UUID = Pattern.compile("^" + HYPHENATED + "$");
  private static final Pattern BRACED_UUID = Pattern.compile("^\\{" + HYPHENATED + "\\}$");
  private static final Pattern URN_UUID = Pattern.compile("^urn:uuid:" + HYPHENATED + "$");
  private static final List<Pattern> ACCEPTED_FORMS =
      List.of(HYPHENATED_UUID, SIMPLE_UUID, BRACED_UUID, URN_UUID);

  private MessageIds() {}

  /**
   * 役割: 新しいメッセージ ID を採番する。
   * 動作: 単調増加 ULID を RFC 4122 形式の UUID へ変換する。先頭 48bit がミリ秒時刻のため文字列順が生成順になる。
   */
  public static UUID newId() {
    return UlidCreator.getMonotonicUlid().toRfc4122().toUuid();
  }

  /**
   * 役割: API で受け取った ID 文字列を UUID へ変換する。
   * 動作: 8-4-4-4-12 形式に加え、ハイフンなし 32 桁、{...} 囲み、urn:uuid: 接頭辞の各形式を受け付ける。
   * 前提: 前後の空白や桁数違いなど、いずれの形式にも一致しない値は empty を返す。
   */
  public static Optional<UUID> parse(String value) {
    if (value == null) {
      return Optional.empty();
    }
    for (Pattern form : ACCEPTED_FORMS) {
      final Matcher matcher = form.matcher(value);
      if (matcher.matches()) {
        return Optional.of(UUID.fromString(toHyphenated(matcher)));
      }
    }
    return Optional.empty();
  }

  private static String toHyphenated(Matcher matcher) {
    return String.join(
        "-",
        matcher.group(1),
        matcher.group(2),
        matcher.group(3),
        matcher.group(4),
        matcher.group(5));
  }
}

/*
 * どこで: Queue Repository 層
 * 何を: ready キューと in-flight 集合に対する操作を抽象化する
 * なぜ: ストレージ実装(インメモリ/永続)を service から切り離すため
 */
package com.example.queue.repository;

import com.example.queue.model.Message;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface MessageRepository {

  /** 役割: メッセージを ready キュー末尾へ追加する。 前提: message は READY 状態であること。 */
  void add(Message message);

  /**
   * 役割: ready キュー先頭から最大 count 件をリースする。 動作: 取り出した各メッセージを PROCESSING にし、lock_until を付けて in-flight
   * 集合へ移し、キュー順で返す。在庫が count 未満なら在庫分だけ返し、待機もエラーもしない。 前提: 同時に呼ばれても同じメッセージを二者へ返さないこと。
   * lockUntil が null の場合はリース期限なしとして扱う。
   */
  List<Message> lease(int count, Instant lockUntil);

  /** 役割: in-flight のメッセージを確定削除する。 動作: in-flight に存在しない ID は何もせず無視し、削除した件数を返す。 */
  int delete(Collection<UUID> ids);

  /** 役割: ready キューと in-flight 集合を無条件に空にする。 動作: 破棄した件数を返す。 */
  int purge();

  /**
   * 役割: in-flight のメッセージを ready キューへ戻す。 動作: 指定順に retry_count を 1 増やして READY にし、キュー末尾へ追加する。
   * in-flight に存在しない ID はスキップする。戻した件数を返す。
   */
  int retry(Collection<UUID> ids);

  /** 役割: ready キュー先頭から最大 count 件を状態を変えずに返す。 */
  List<Message> peek(int count);

  /**
   * 役割: リース期限切れのメッセージを ready キューへ戻す。 動作: lock_until が now 以前のものを retry と同じ規則でリース順に戻し、件数を返す。
   * lock_until を持たないメッセージは対象外。
   */
  int releaseExpired(Instant now);

  /** 役割: ready キューの件数を返す。 */
  int readyCount();

  /** 役割: in-flight 集合の件数を返す。 */
  int inFlightCount();
}

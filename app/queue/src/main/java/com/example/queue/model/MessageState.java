/*
 * Where: Queue domain model
 * What: Lifecycle states of a queued message
 * Why: Keep API output and storage partitions in agreement
 */
package com.example.queue.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum MessageState {
  @JsonProperty("Ready")
  READY,
  @JsonProperty("Processing")
  PROCESSING,
  // 削除で到達する終端状態。ストレージ上にこの状態のメッセージは存在しない
  @JsonProperty("Done")
  DONE
}

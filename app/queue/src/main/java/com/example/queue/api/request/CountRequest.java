/*
 * どこで: Queue API リクエスト DTO
 * 何を: get/peek の取得件数を受け取る
 * なぜ: count 省略時の既定値 1 を service 側で一元的に適用するため
 */
package com.example.queue.api.request;

import jakarta.validation.constraints.PositiveOrZero;

public record CountRequest(@PositiveOrZero(message = "count must not be negative") Integer count) {}

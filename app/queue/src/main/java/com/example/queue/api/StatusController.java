/*
 * どこで: Queue API
 * 何を: 疎通確認用の /hello を返す
 * なぜ: 既存クライアントの動作確認エンドポイントを維持するため
 */
package com.example.queue.api;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class StatusController {

  @GetMapping("/hello")
  public ResponseEntity<ApiResponse<String>> hello() {
    return ResponseEntity.ok(ApiResponse.success("Hello World"));
  }
}

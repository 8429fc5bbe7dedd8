/*
 * どこで: Queue API
 * 何を: add/get/delete/purge/retry/peek エンドポイントを公開する
 * なぜ: クライアントからのキュー操作を受け付ける入口を提供するため
 */
package com.example.queue.api;

import com.example.queue.api.request.AddMessageRequest;
import com.example.queue.api.request.CountRequest;
import com.example.queue.api.request.MessageIdsRequest;
import com.example.queue.model.Message;
import com.example.queue.service.QueueService;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class QueueController {

  private static final String SUCCESS = "Success";

  private final QueueService queueService;

  @PostMapping("/add")
  public ResponseEntity<ApiResponse<Message>> add(@Valid @RequestBody AddMessageRequest request) {
    return ResponseEntity.ok(ApiResponse.success(queueService.add(request.body())));
  }

  @PostMapping("/get")
  public ResponseEntity<ApiResponse<List<Message>>> get(
      @Valid @RequestBody(required = false) CountRequest request) {
    return ResponseEntity.ok(ApiResponse.success(queueService.get(countOf(request))));
  }

  @PostMapping("/delete")
  public ResponseEntity<ApiResponse<String>> delete(@RequestBody MessageIdsRequest request) {
    queueService.delete(request.ids());
    return ResponseEntity.ok(ApiResponse.success(SUCCESS));
  }

  @PostMapping("/purge")
  public ResponseEntity<ApiResponse<String>> purge() {
    queueService.purge();
    return ResponseEntity.ok(ApiResponse.success(SUCCESS));
  }

  @PostMapping("/retry")
  public ResponseEntity<ApiResponse<String>> retry(@RequestBody MessageIdsRequest request) {
    queueService.retry(request.ids());
    return ResponseEntity.ok(ApiResponse.success(SUCCESS));
  }

  @PostMapping("/peek")
  public ResponseEntity<ApiResponse<List<Message>>> peek(
      @Valid @RequestBody(required = false) CountRequest request) {
    return ResponseEntity.ok(ApiResponse.success(queueService.peek(countOf(request))));
  }

  private Integer countOf(CountRequest request) {
    return request == null ? null : request.count();
  }
}

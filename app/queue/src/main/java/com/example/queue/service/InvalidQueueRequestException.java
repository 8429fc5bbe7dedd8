package com.example.queue.service;

public class InvalidQueueRequestException extends RuntimeException {
  public InvalidQueueRequestException(String message) {
    super(message);
  }
}

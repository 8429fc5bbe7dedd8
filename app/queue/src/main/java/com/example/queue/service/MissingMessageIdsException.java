package com.example.queue.service;

public class MissingMessageIdsException extends RuntimeException {
  public MissingMessageIdsException() {
    super("No message IDs provided");
  }
}

package com.example.queue.model;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class MessageTest {

  @Test
  void createAssignsIdAndReadyDefaults() {
    final Message message = Message.create("hello");

    assertThat(message.id()).isNotNull();
    assertThat(message.body()).isEqualTo("hello");
    assertThat(message.state()).isEqualTo(MessageState.READY);
    assertThat(message.lockUntil()).isNull();
    assertThat(message.retryCount()).isZero();
  }

  @Test
  void createAssignsDistinctIds() {
    assertThat(Message.create("a").id()).isNotEqualTo(Message.create("a").id());
  }

  @Test
  void serializesWithSnakeCaseFieldsAndStateNames() throws Exception {
    final ObjectMapper objectMapper =
        new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    final UUID id = UUID.fromString("01890a5d-ac96-774b-bcce-b302099a8057");
    final Message message =
        new Message(
            id, "payload", MessageState.PROCESSING, Instant.parse("2026-02-24T12:00:30Z"), 2);

    final JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(message));

    assertThat(json.get("id").asText()).isEqualTo("01890a5d-ac96-774b-bcce-b302099a8057");
    assertThat(json.get("body").asText()).isEqualTo("payload");
    assertThat(json.get("state").asText()).isEqualTo("Processing");
    assertThat(json.get("lock_until").asText()).isEqualTo("2026-02-24T12:00:30Z");
    assertThat(json.get("retry_count").asInt()).isEqualTo(2);
  }
}

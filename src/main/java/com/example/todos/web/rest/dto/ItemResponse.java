package com.example.todos.web.rest.dto;

import com.example.todos.domain.entity.Item;
import java.time.Instant;

public record ItemResponse(
    Long id,
    String name,
    boolean done,
    Long todoId,
    Instant createdAt,
    Instant updatedAt
) {

  public static ItemResponse from(Item item) {
    return new ItemResponse(item.getId(), item.getName(), item.isDone(), item.getTodoId(),
                            item.getCreatedAt(), item.getUpdatedAt());
  }
}

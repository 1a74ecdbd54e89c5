package com.example.todos.web.rest.dto;

import com.example.todos.domain.entity.Todo;
import java.time.Instant;
import java.util.List;

/**
 * A todo with its items nested, in item id order.
 */
public record TodoResponse(
    Long id,
    String title,
    String createdBy,
    Instant createdAt,
    Instant updatedAt,
    List<ItemResponse> items
) {

  public static TodoResponse from(Todo todo) {
    return new TodoResponse(
        todo.getId(),
        todo.getTitle(),
        todo.getCreatedBy(),
        todo.getCreatedAt(),
        todo.getUpdatedAt(),
        todo.getItems().stream().map(ItemResponse::from).toList());
  }
}

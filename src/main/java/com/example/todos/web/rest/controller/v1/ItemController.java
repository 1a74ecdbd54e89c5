package com.example.todos.web.rest.controller.v1;

import com.example.todos.domain.entity.UserPrincipal;
import com.example.todos.service.ItemService;
import com.example.todos.web.rest.dto.ItemRequest;
import com.example.todos.web.rest.dto.ItemResponse;
import com.example.todos.web.rest.dto.TodoResponse;
import com.example.todos.web.versioning.ApiVersionMapping;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

@RestController
@ApiVersionMapping("v1")
@RequiredArgsConstructor
public class ItemController implements ItemAPI {

  private final ItemService itemService;

  @Override
  public ResponseEntity<List<ItemResponse>> list(UserPrincipal principal, long todoId) {
    return ResponseEntity.ok(itemService.list(principal, todoId).orElseThrow());
  }

  @Override
  public ResponseEntity<ItemResponse> show(UserPrincipal principal, long todoId, long id) {
    return ResponseEntity.ok(itemService.find(principal, todoId, id).orElseThrow());
  }

  @Override
  public ResponseEntity<TodoResponse> create(UserPrincipal principal, long todoId,
                                             ItemRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(itemService.create(principal, todoId, request.name(), request.done()).orElseThrow());
  }

  @Override
  public ResponseEntity<Void> update(UserPrincipal principal, long todoId, long id,
                                     ItemRequest request) {
    itemService.update(principal, todoId, id, request.name(), request.done()).orElseThrow();
    return ResponseEntity.noContent().build();
  }

  @Override
  public ResponseEntity<Void> delete(UserPrincipal principal, long todoId, long id) {
    itemService.delete(principal, todoId, id).orElseThrow();
    return ResponseEntity.noContent().build();
  }
}

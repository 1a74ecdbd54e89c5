package com.example.todos.web.rest.controller.v1;

import com.example.todos.domain.entity.UserPrincipal;
import com.example.todos.service.TodoService;
import com.example.todos.web.rest.dto.TodoRequest;
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
public class TodoController implements TodoAPI {

  private final TodoService todoService;

  @Override
  public ResponseEntity<List<TodoResponse>> list(UserPrincipal principal, int page) {
    return ResponseEntity.ok(todoService.list(principal, page).orElseThrow());
  }

  @Override
  public ResponseEntity<TodoResponse> create(UserPrincipal principal, TodoRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(todoService.create(principal, request.title()).orElseThrow());
  }

  @Override
  public ResponseEntity<TodoResponse> show(UserPrincipal principal, long id) {
    return ResponseEntity.ok(todoService.find(principal, id).orElseThrow());
  }

  @Override
  public ResponseEntity<Void> update(UserPrincipal principal, long id, TodoRequest request) {
    todoService.update(principal, id, request.title()).orElseThrow();
    return ResponseEntity.noContent().build();
  }

  @Override
  public ResponseEntity<Void> delete(UserPrincipal principal, long id) {
    todoService.delete(principal, id).orElseThrow();
    return ResponseEntity.noContent().build();
  }
}

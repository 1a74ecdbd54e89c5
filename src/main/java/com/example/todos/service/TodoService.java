package com.example.todos.service;

import com.example.todos.domain.entity.Todo;
import com.example.todos.domain.entity.UserPrincipal;
import com.example.todos.exception.ErrorKind;
import com.example.todos.exception.Outcome;
import com.example.todos.properties.ApplicationProperties;
import com.example.todos.repository.TodoRepository;
import com.example.todos.util.ValidationMessages;
import com.example.todos.web.rest.dto.TodoResponse;
import jakarta.validation.Validator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Todos of the authenticated user. A todo owned by someone else is reported exactly like one that
 * does not exist.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TodoService {

  private final TodoRepository todoRepository;
  private final Validator validator;
  private final ApplicationProperties properties;

  /**
   * One page of the owner's todos in id order.
   *
   * @param page 1-based page number
   */
  @Transactional(readOnly = true)
  public Outcome<List<TodoResponse>> list(UserPrincipal principal, int page) {
    if (page < 1) {
      return ValidationMessages.failure("Page must be greater than or equal to 1");
    }
    PageRequest pageRequest =
        PageRequest.of(page - 1, properties.pagination().pageSize(), Sort.by("id"));

    return Outcome.success(todoRepository.findByCreatedBy(principal.ownerKey(), pageRequest)
                               .map(TodoResponse::from)
                               .getContent());
  }

  @Transactional
  public Outcome<TodoResponse> create(UserPrincipal principal, String title) {
    Todo todo = new Todo(title, principal.ownerKey());
    List<String> errors = ValidationMessages.describeAll(validator.validate(todo));
    if (!errors.isEmpty()) {
      return ValidationMessages.failure(errors);
    }

    Todo saved = todoRepository.save(todo);
    log.debug("User {} created todo {}", principal.id(), saved.getId());
    return Outcome.success(TodoResponse.from(saved));
  }

  @Transactional(readOnly = true)
  public Outcome<TodoResponse> find(UserPrincipal principal, long id) {
    return locate(principal, id).map(TodoResponse::from);
  }

  /**
   * Renames a todo. A null title leaves it unchanged.
   */
  @Transactional
  public Outcome<TodoResponse> update(UserPrincipal principal, long id, String title) {
    Outcome<Todo> located = locate(principal, id);
    if (located.isFailure() || title == null) {
      return located.map(TodoResponse::from);
    }

    List<String> errors =
        ValidationMessages.describeAll(validator.validateValue(Todo.class, "title", title));
    if (!errors.isEmpty()) {
      return ValidationMessages.failure(errors);
    }

    Todo todo = located.getValue();
    todo.rename(title);
    return Outcome.success(TodoResponse.from(todoRepository.saveAndFlush(todo)));
  }

  /**
   * Deletes a todo together with its items.
   */
  @Transactional
  public Outcome<Long> delete(UserPrincipal principal, long id) {
    return locate(principal, id).map(todo -> {
      todoRepository.delete(todo);
      log.debug("User {} deleted todo {}", principal.id(), id);
      return todo.getId();
    });
  }

  /**
   * Loads one of the principal's todos for use inside the caller's transaction.
   */
  @Transactional(readOnly = true)
  public Outcome<Todo> locate(UserPrincipal principal, long id) {
    return todoRepository.findByIdAndCreatedBy(id, principal.ownerKey())
        .map(Outcome::success)
        .orElseGet(() -> Outcome.failure(ErrorKind.NOT_FOUND,
                                         "Couldn't find Todo with 'id'=" + id));
  }
}

package com.example.todos.service;

import com.example.todos.domain.entity.Item;
import com.example.todos.domain.entity.Todo;
import com.example.todos.domain.entity.UserPrincipal;
import com.example.todos.exception.ErrorKind;
import com.example.todos.exception.Outcome;
import com.example.todos.repository.ItemRepository;
import com.example.todos.util.ValidationMessages;
import com.example.todos.web.rest.dto.ItemResponse;
import com.example.todos.web.rest.dto.TodoResponse;
import jakarta.validation.Validator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.hibernate.Hibernate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Items of one of the authenticated user's todos. Every operation first resolves the parent todo
 * through {@link TodoService#locate}, so another user's items are never reachable.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ItemService {

  private final TodoService todoService;
  private final ItemRepository itemRepository;
  private final Validator validator;

  @Transactional(readOnly = true)
  public Outcome<List<ItemResponse>> list(UserPrincipal principal, long todoId) {
    return todoService.locate(principal, todoId)
        .map(todo -> itemRepository.findByTodoOrderByIdAsc(todo).stream()
            .map(ItemResponse::from)
            .toList());
  }

  @Transactional(readOnly = true)
  public Outcome<ItemResponse> find(UserPrincipal principal, long todoId, long id) {
    return todoService.locate(principal, todoId)
        .flatMap(todo -> locate(todo, id))
        .map(ItemResponse::from);
  }

  /**
   * Adds an item and returns the parent todo with its items.
   */
  @Transactional
  public Outcome<TodoResponse> create(UserPrincipal principal, long todoId, String name,
                                      Boolean done) {
    return todoService.locate(principal, todoId).flatMap(todo -> {
      List<String> errors = validateName(name);
      if (!errors.isEmpty()) {
        return ValidationMessages.failure(errors);
      }

      // load before adding so the new item is not listed twice
      Hibernate.initialize(todo.getItems());
      Item item = itemRepository.save(todo.addItem(name, Boolean.TRUE.equals(done)));
      log.debug("User {} added item {} to todo {}", principal.id(), item.getId(), todoId);
      return Outcome.success(TodoResponse.from(todo));
    });
  }

  /**
   * Updates the fields that are present; null fields keep their stored value.
   */
  @Transactional
  public Outcome<ItemResponse> update(UserPrincipal principal, long todoId, long id, String name,
                                      Boolean done) {
    return todoService.locate(principal, todoId)
        .flatMap(todo -> locate(todo, id))
        .flatMap(item -> {
          if (name != null) {
            List<String> errors = validateName(name);
            if (!errors.isEmpty()) {
              return ValidationMessages.failure(errors);
            }
            item.rename(name);
          }
          if (done != null) {
            item.markDone(done);
          }
          return Outcome.success(ItemResponse.from(itemRepository.saveAndFlush(item)));
        });
  }

  @Transactional
  public Outcome<Long> delete(UserPrincipal principal, long todoId, long id) {
    return todoService.locate(principal, todoId).flatMap(todo -> locate(todo, id).map(item -> {
      Hibernate.initialize(todo.getItems());
      todo.removeItem(item);
      itemRepository.delete(item);
      log.debug("User {} deleted item {} from todo {}", principal.id(), id, todoId);
      return item.getId();
    }));
  }

  private Outcome<Item> locate(Todo todo, long id) {
    return itemRepository.findByIdAndTodo(id, todo)
        .map(Outcome::success)
        .orElseGet(() -> Outcome.failure(ErrorKind.NOT_FOUND,
                                         "Couldn't find Item with 'id'=" + id));
  }

  private List<String> validateName(String name) {
    return ValidationMessages.describeAll(validator.validateValue(Item.class, "name", name));
  }
}

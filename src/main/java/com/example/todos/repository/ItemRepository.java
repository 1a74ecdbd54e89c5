package com.example.todos.repository;

import com.example.todos.domain.entity.Item;
import com.example.todos.domain.entity.Todo;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ItemRepository extends JpaRepository<Item, Long> {

  List<Item> findByTodoOrderByIdAsc(Todo todo);

  Optional<Item> findByIdAndTodo(Long id, Todo todo);
}

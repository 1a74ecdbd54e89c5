package com.example.todos.repository;

import com.example.todos.domain.entity.Todo;
import java.util.Optional;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

public interface TodoRepository extends JpaRepository<Todo, Long> {

  Page<Todo> findByCreatedBy(String createdBy, Pageable pageable);

  /** Ownership-scoped lookup: another owner's todo is indistinguishable from a missing one. */
  Optional<Todo> findByIdAndCreatedBy(Long id, String createdBy);
}

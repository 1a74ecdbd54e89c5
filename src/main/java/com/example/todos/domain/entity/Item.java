package com.example.todos.domain.entity;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import java.time.Instant;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

@Entity
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Table(name = "items", indexes = @Index(name = "idx_items_todo_id", columnList = "todo_id"))
public class Item {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotBlank(message = "can't be blank")
  @Column(nullable = false)
  private String name;

  @Column(nullable = false)
  private boolean done;

  @ManyToOne(fetch = FetchType.LAZY, optional = false)
  @JoinColumn(name = "todo_id", nullable = false)
  private Todo todo;

  @CreationTimestamp
  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @UpdateTimestamp
  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  Item(Todo todo, String name, boolean done) {
    this.todo = todo;
    this.name = name;
    this.done = done;
  }

  public Long getTodoId() {
    return todo.getId();
  }

  public void rename(String name) {
    this.name = name;
  }

  public void markDone(boolean done) {
    this.done = done;
  }
}

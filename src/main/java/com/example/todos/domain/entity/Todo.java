package com.example.todos.domain.entity;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.BatchSize;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

@Entity
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Table(name = "todos", indexes = @Index(name = "idx_todos_created_by", columnList = "created_by"))
public class Todo {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotBlank(message = "can't be blank")
  @Column(nullable = false)
  private String title;

  // Owner's user id, kept as text like the column it maps to
  @NotBlank(message = "can't be blank")
  @Column(name = "created_by", nullable = false)
  private String createdBy;

  @BatchSize(size = 20)
  @OrderBy("id ASC")
  @OneToMany(mappedBy = "todo", cascade = CascadeType.ALL, orphanRemoval = true)
  private List<Item> items = new ArrayList<>();

  @CreationTimestamp
  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @UpdateTimestamp
  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  public Todo(String title, String createdBy) {
    this.title = title;
    this.createdBy = createdBy;
  }

  public void rename(String title) {
    this.title = title;
  }

  public Item addItem(String name, boolean done) {
    Item item = new Item(this, name, done);
    items.add(item);
    return item;
  }

  public void removeItem(Item item) {
    items.remove(item);
  }
}

package com.example.todos.domain.entity;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import java.time.Instant;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

/**
 * Registered account. Created at signup and read at login and on every authorized request.
 */
@Entity
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Table(name = "users", indexes = @Index(name = "idx_users_email", columnList = "email", unique = true))
public class User {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotBlank(message = "can't be blank")
  @Column(nullable = false)
  private String name;

  @NotBlank(message = "can't be blank")
  @Column(nullable = false, unique = true)
  private String email;

  @NotBlank(message = "can't be blank")
  @Column(name = "password_digest", nullable = false)
  private String passwordDigest;

  @CreationTimestamp
  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @UpdateTimestamp
  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  public User(String name, String email, String passwordDigest) {
    this.name = name;
    this.email = email;
    this.passwordDigest = passwordDigest;
  }

  @Override
  public String toString() {
    return "User[id=" + id + ", email=" + email + "]";
  }
}

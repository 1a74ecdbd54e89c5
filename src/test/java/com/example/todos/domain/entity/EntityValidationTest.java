package com.example.todos.domain.entity;

import static org.assertj.core.api.Assertions.assertThat;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class EntityValidationTest {

  private final Validator validator = Validation.buildDefaultValidatorFactory().getValidator();

  @Nested
  @DisplayName("Todo")
  class TodoValidation {

    @Test
    @DisplayName("requires a title")
    void title() {
      Set<ConstraintViolation<Todo>> violations = validator.validate(new Todo(" ", "1"));

      assertThat(violations).extracting(violation -> violation.getPropertyPath().toString())
          .containsExactly("title");
    }

    @Test
    @DisplayName("requires an owner")
    void createdBy() {
      Set<ConstraintViolation<Todo>> violations = validator.validate(new Todo("Groceries", null));

      assertThat(violations).extracting(violation -> violation.getPropertyPath().toString())
          .containsExactly("createdBy");
    }

    @Test
    @DisplayName("items belong to their todo and start in the given state")
    void items() {
      Todo todo = new Todo("Groceries", "1");

      Item item = todo.addItem("Milk", false);

      assertThat(todo.getItems()).containsExactly(item);
      assertThat(item.getTodo()).isSameAs(todo);
      assertThat(item.isDone()).isFalse();
      assertThat(validator.validate(todo)).isEmpty();
    }
  }

  @Nested
  @DisplayName("Item")
  class ItemValidation {

    @Test
    @DisplayName("requires a name")
    void name() {
      Item item = new Todo("Groceries", "1").addItem("", true);

      Set<ConstraintViolation<Item>> violations = validator.validate(item);

      assertThat(violations).extracting(ConstraintViolation::getMessage)
          .containsExactly("can't be blank");
    }
  }

  @Nested
  @DisplayName("User")
  class UserValidation {

    @Test
    @DisplayName("requires name, email and password digest")
    void required() {
      Set<ConstraintViolation<User>> violations = validator.validate(new User("", "", ""));

      assertThat(violations).extracting(violation -> violation.getPropertyPath().toString())
          .containsExactlyInAnyOrder("name", "email", "passwordDigest");
    }

    @Test
    @DisplayName("string form never shows the digest")
    void toStringHidesDigest() {
      assertThat(new User("Ash", "ash@example.com", "secret-digest").toString())
          .doesNotContain("secret-digest");
    }
  }
}

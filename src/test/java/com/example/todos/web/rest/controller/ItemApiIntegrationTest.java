package com.example.todos.web.rest.controller;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.todos.IntegrationTestSupport;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;

class ItemApiIntegrationTest extends IntegrationTestSupport {

  private String token;
  private long todoId;

  @BeforeEach
  void setUpTodo() throws Exception {
    token = signup("Ash", "ash@example.com");
    String body = mockMvc.perform(post("/todos")
                                      .headers(authorized(token))
                                      .contentType(MediaType.APPLICATION_JSON)
                                      .content(json(Map.of("title", "Groceries"))))
        .andExpect(status().isCreated())
        .andReturn().getResponse().getContentAsString();
    todoId = objectMapper.readTree(body).get("id").asLong();
  }

  private long addItem(String name) throws Exception {
    String body = mockMvc.perform(post("/todos/{todoId}/items", todoId)
                                      .headers(authorized(token))
                                      .contentType(MediaType.APPLICATION_JSON)
                                      .content(json(Map.of("name", name))))
        .andExpect(status().isCreated())
        .andReturn().getResponse().getContentAsString();
    var items = objectMapper.readTree(body).get("items");
    return items.get(items.size() - 1).get("id").asLong();
  }

  @Test
  @DisplayName("adding an item returns the parent todo with every item")
  void createReturnsParent() throws Exception {
    addItem("Milk");

    mockMvc.perform(post("/todos/{todoId}/items", todoId)
                        .headers(authorized(token))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("name", "Eggs", "done", true))))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.id").value(todoId))
        .andExpect(jsonPath("$.items", hasSize(2)))
        .andExpect(jsonPath("$.items[0].name").value("Milk"))
        .andExpect(jsonPath("$.items[0].done").value(false))
        .andExpect(jsonPath("$.items[1].name").value("Eggs"))
        .andExpect(jsonPath("$.items[1].done").value(true))
        .andExpect(jsonPath("$.items[1].todo_id").value(todoId));
  }

  @Test
  @DisplayName("items are listed and shown under their todo")
  void listAndShow() throws Exception {
    long milk = addItem("Milk");
    addItem("Eggs");

    mockMvc.perform(get("/todos/{todoId}/items", todoId).headers(authorized(token)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$", hasSize(2)));
    mockMvc.perform(get("/todos/{todoId}/items/{id}", todoId, milk).headers(authorized(token)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.name").value("Milk"));
    mockMvc.perform(get("/todos/{todoId}", todoId).headers(authorized(token)))
        .andExpect(jsonPath("$.items", hasSize(2)));
  }

  @Test
  @DisplayName("update changes only the given fields")
  void update() throws Exception {
    long milk = addItem("Milk");

    mockMvc.perform(put("/todos/{todoId}/items/{id}", todoId, milk)
                        .headers(authorized(token))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("done", true))))
        .andExpect(status().isNoContent());

    mockMvc.perform(get("/todos/{todoId}/items/{id}", todoId, milk).headers(authorized(token)))
        .andExpect(jsonPath("$.name").value("Milk"))
        .andExpect(jsonPath("$.done").value(true));
  }

  @Test
  @DisplayName("a blank name is unprocessable")
  void blankName() throws Exception {
    mockMvc.perform(post("/todos/{todoId}/items", todoId)
                        .headers(authorized(token))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("name", " "))))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.message").value("Validation failed: Name can't be blank"));
  }

  @Test
  @DisplayName("delete removes the item and deleting the todo removes the rest")
  void deletes() throws Exception {
    long milk = addItem("Milk");
    addItem("Eggs");

    mockMvc.perform(delete("/todos/{todoId}/items/{id}", todoId, milk).headers(authorized(token)))
        .andExpect(status().isNoContent());
    mockMvc.perform(get("/todos/{todoId}/items/{id}", todoId, milk).headers(authorized(token)))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.message").value("Couldn't find Item with 'id'=" + milk));

    mockMvc.perform(delete("/todos/{todoId}", todoId).headers(authorized(token)))
        .andExpect(status().isNoContent());
    mockMvc.perform(get("/todos/{todoId}/items", todoId).headers(authorized(token)))
        .andExpect(status().isNotFound());
  }

  @Test
  @DisplayName("another user's items are unreachable")
  void foreignItems() throws Exception {
    long milk = addItem("Milk");
    String other = signup("Brock", "brock@example.com");

    mockMvc.perform(get("/todos/{todoId}/items", todoId).headers(authorized(other)))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.message").value("Couldn't find Todo with 'id'=" + todoId));
    mockMvc.perform(delete("/todos/{todoId}/items/{id}", todoId, milk).headers(authorized(other)))
        .andExpect(status().isNotFound());
  }
}

package com.example.todos;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.todos.repository.TodoRepository;
import com.example.todos.repository.UserRepository;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

/**
 * Full application with MockMvc against the in-memory database. Tables are emptied before each
 * test.
 */
@Tag("integration")
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
public abstract class IntegrationTestSupport {

  protected static final String PASSWORD = "foobar";
  protected static final String V2_ACCEPT = "application/vnd.todos.v2+json";

  @Autowired
  protected MockMvc mockMvc;

  @Autowired
  protected ObjectMapper objectMapper;

  @Autowired
  protected UserRepository userRepository;

  @Autowired
  protected TodoRepository todoRepository;

  @BeforeEach
  void cleanDatabase() {
    todoRepository.deleteAll();
    userRepository.deleteAll();
  }

  protected String json(Object body) throws Exception {
    return objectMapper.writeValueAsString(body);
  }

  protected JsonNode read(MvcResult result) throws Exception {
    return objectMapper.readTree(result.getResponse().getContentAsString());
  }

  /**
   * Signs up a new account and returns its auth token.
   */
  protected String signup(String name, String email) throws Exception {
    MvcResult result = mockMvc.perform(post("/signup")
                                           .contentType(MediaType.APPLICATION_JSON)
                                           .content(json(Map.of(
                                               "name", name,
                                               "email", email,
                                               "password", PASSWORD,
                                               "password_confirmation", PASSWORD))))
        .andExpect(status().isCreated())
        .andReturn();
    return read(result).get("auth_token").asText();
  }

  protected static String bearer(String token) {
    return "Bearer " + token;
  }

  protected static HttpHeaders authorized(String token) {
    HttpHeaders headers = new HttpHeaders();
    headers.set(HttpHeaders.AUTHORIZATION, bearer(token));
    return headers;
  }

  protected long userId(String email) {
    return userRepository.findByEmail(email).orElseThrow().getId();
  }
}

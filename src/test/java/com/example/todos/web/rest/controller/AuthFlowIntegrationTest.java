package com.example.todos.web.rest.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.todos.IntegrationTestSupport;
import com.example.todos.domain.entity.TokenClaims;
import com.example.todos.exception.Outcome;
import com.example.todos.security.TokenCodec;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;

class AuthFlowIntegrationTest extends IntegrationTestSupport {

  @Autowired
  private TokenCodec tokenCodec;

  @Nested
  @DisplayName("POST /signup")
  class Signup {

    @Test
    @DisplayName("creates the account and returns a token for it")
    void created() throws Exception {
      // when
      String token = signup("Ash", "ash@example.com");

      // then
      Outcome<TokenClaims> claims = tokenCodec.decode(token);
      assertThat(claims.isSuccess()).isTrue();
      assertThat(claims.getValue().subject()).isEqualTo(userId("ash@example.com"));
      assertThat(userRepository.findByEmail("ash@example.com").orElseThrow().getPasswordDigest())
          .isNotEqualTo(PASSWORD)
          .startsWith("$2");
    }

    @Test
    @DisplayName("returns the creation message")
    void message() throws Exception {
      mockMvc.perform(post("/signup")
                          .contentType(MediaType.APPLICATION_JSON)
                          .content(json(Map.of("name", "Ash", "email", "ash@example.com",
                                               "password", PASSWORD))))
          .andExpect(status().isCreated())
          .andExpect(jsonPath("$.message").value("Account created successfully"))
          .andExpect(jsonPath("$.auth_token").isString());
    }

    @Test
    @DisplayName("a taken email is unprocessable")
    void duplicate() throws Exception {
      signup("Ash", "ash@example.com");

      mockMvc.perform(post("/signup")
                          .contentType(MediaType.APPLICATION_JSON)
                          .content(json(Map.of("name", "Other", "email", "ash@example.com",
                                               "password", PASSWORD))))
          .andExpect(status().isUnprocessableEntity())
          .andExpect(jsonPath("$.message")
                         .value("Validation failed: Email has already been taken"));
      assertThat(userRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("a blank name is unprocessable")
    void blankName() throws Exception {
      mockMvc.perform(post("/signup")
                          .contentType(MediaType.APPLICATION_JSON)
                          .content(json(Map.of("name", "", "email", "ash@example.com",
                                               "password", PASSWORD))))
          .andExpect(status().isUnprocessableEntity())
          .andExpect(jsonPath("$.message").value("Validation failed: Name can't be blank"));
    }

    @Test
    @DisplayName("a malformed body is a bad request")
    void malformed() throws Exception {
      mockMvc.perform(post("/signup")
                          .contentType(MediaType.APPLICATION_JSON)
                          .content("{not json"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.message").value("Malformed request body"));
    }
  }

  @Nested
  @DisplayName("POST /auth/login")
  class Login {

    @Test
    @DisplayName("valid credentials return a token for the user")
    void success() throws Exception {
      signup("Ash", "ash@example.com");

      String body = mockMvc.perform(post("/auth/login")
                                        .contentType(MediaType.APPLICATION_JSON)
                                        .content(json(Map.of("email", "ash@example.com",
                                                             "password", PASSWORD))))
          .andExpect(status().isOk())
          .andReturn().getResponse().getContentAsString();

      String token = objectMapper.readTree(body).get("auth_token").asText();
      assertThat(tokenCodec.decode(token).getValue().subject()).isEqualTo(userId("ash@example.com"));
    }

    @Test
    @DisplayName("wrong password and unknown email get the same response")
    void invalidCredentials() throws Exception {
      signup("Ash", "ash@example.com");

      mockMvc.perform(post("/auth/login")
                          .contentType(MediaType.APPLICATION_JSON)
                          .content(json(Map.of("email", "ash@example.com", "password", "nope"))))
          .andExpect(status().isUnauthorized())
          .andExpect(jsonPath("$.message").value("Invalid credentials"));

      mockMvc.perform(post("/auth/login")
                          .contentType(MediaType.APPLICATION_JSON)
                          .content(json(Map.of("email", "who@example.com", "password", PASSWORD))))
          .andExpect(status().isUnauthorized())
          .andExpect(jsonPath("$.message").value("Invalid credentials"));
    }

    @Test
    @DisplayName("a token from signup works on protected routes")
    void tokenIsAccepted() throws Exception {
      String token = signup("Ash", "ash@example.com");

      mockMvc.perform(get("/todos").headers(authorized(token)))
          .andExpect(status().isOk());
    }
  }

  @Nested
  @DisplayName("GET /health")
  class Health {

    @Test
    @DisplayName("probes are public")
    void probes() throws Exception {
      mockMvc.perform(get("/health"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.status").value("UP"));
      mockMvc.perform(get("/health/ready"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.ready").value(true))
          .andExpect(jsonPath("$.database.status").value("UP"));
      mockMvc.perform(get("/health/live"))
          .andExpect(jsonPath("$.status").exists());
    }
  }
}

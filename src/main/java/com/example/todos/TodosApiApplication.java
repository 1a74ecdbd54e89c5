package com.example.todos;

import com.example.todos.properties.ApplicationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Todos API Application
 *
 * Stateless REST API for per-user todo lists with:
 * - HS256 bearer tokens minted at signup/login
 * - Accept-header API version negotiation (application/vnd.todos.v1+json)
 * - Owner-scoped todos and nested items
 */
@SpringBootApplication(exclude = UserDetailsServiceAutoConfiguration.class)
@EnableConfigurationProperties(ApplicationProperties.class)
public class TodosApiApplication {
  public static void main(String[] args) {
    SpringApplication app = new SpringApplication(TodosApiApplication.class);

    app.setLazyInitialization(false); // fail fast on bad version routing or secrets
    app.setRegisterShutdownHook(true);

    app.run(args);
  }
}

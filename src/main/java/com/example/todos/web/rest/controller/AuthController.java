package com.example.todos.web.rest.controller;

import com.example.todos.service.AuthenticationService;
import com.example.todos.web.rest.dto.AuthResponse;
import com.example.todos.web.rest.dto.LoginRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for token issuance.
 */
@RestController
@Slf4j
@RequiredArgsConstructor
public class AuthController implements AuthAPI {

  private final AuthenticationService authenticationService;

  @Override
  public ResponseEntity<AuthResponse> login(LoginRequest request) {
    log.debug("Login request for {}", request.email());

    String token = authenticationService.login(request.email(), request.password()).orElseThrow();
    return ResponseEntity.ok(new AuthResponse(token));
  }
}

package com.example.todos.web.rest.controller;

import static com.example.todos.web.rest.ApiConstants.ApiMessage.ACCOUNT_CREATED;

import com.example.todos.service.AuthenticationService;
import com.example.todos.service.SignupResult;
import com.example.todos.web.rest.dto.SignupRequest;
import com.example.todos.web.rest.dto.SignupResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Slf4j
@RequiredArgsConstructor
public class UserController implements UserAPI {

  private final AuthenticationService authenticationService;

  @Override
  public ResponseEntity<SignupResponse> signup(SignupRequest request) {
    SignupResult result = authenticationService.signup(
        request.name(), request.email(), request.password(), request.passwordConfirmation())
        .orElseThrow();

    return ResponseEntity.status(HttpStatus.CREATED)
        .body(new SignupResponse(ACCOUNT_CREATED, result.authToken()));
  }
}

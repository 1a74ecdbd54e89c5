package com.example.todos.web.rest.controller;

import static com.example.todos.web.rest.ApiConstants.ApiPath.*;

import com.example.todos.web.rest.dto.AuthResponse;
import com.example.todos.web.rest.dto.LoginRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@Tag(
    name = "Authentication",
    description = "Exchange credentials for an auth token"
)
@RequestMapping(value = AUTH_BASE)
public interface AuthAPI {

  @Operation(
      summary = "Log in",
      description = "Verifies email and password and returns a bearer token for later requests"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Token issued"),
      @ApiResponse(responseCode = "400", description = "Malformed request body"),
      @ApiResponse(responseCode = "401", description = "Invalid credentials")
  })
  @PostMapping(value = LOGIN)
  ResponseEntity<AuthResponse> login(@RequestBody LoginRequest request);
}

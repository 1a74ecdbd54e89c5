package com.example.todos.web.rest.controller;

import static com.example.todos.web.rest.ApiConstants.ApiPath.*;

import com.example.todos.web.rest.dto.SignupRequest;
import com.example.todos.web.rest.dto.SignupResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@Tag(
    name = "Users",
    description = "Account registration"
)
public interface UserAPI {

  @Operation(
      summary = "Sign up",
      description = "Creates an account and returns a bearer token already logged in as it"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "201", description = "Account created"),
      @ApiResponse(responseCode = "400", description = "Malformed request body"),
      @ApiResponse(responseCode = "422", description = "Invalid or duplicate account details")
  })
  @PostMapping(value = SIGNUP)
  ResponseEntity<SignupResponse> signup(@RequestBody SignupRequest request);
}

package com.example.todos.web.rest.controller.v2;

import static com.example.todos.web.rest.ApiConstants.ApiPath.*;

import com.example.todos.web.rest.dto.MessageResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@Tag(
    name = "Todos v2",
    description = "Served only for Accept: application/vnd.todos.v2+json"
)
@SecurityRequirement(name = "bearer")
@RequestMapping(value = TODOS_BASE)
public interface TodoAPI {

  @Operation(summary = "Greeting placeholder for the second API version")
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Greeting returned"),
      @ApiResponse(responseCode = "401", description = "Missing, invalid or expired token")
  })
  @GetMapping
  ResponseEntity<MessageResponse> list();
}

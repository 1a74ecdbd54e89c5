package com.example.todos.web.rest.controller.v1;

import static com.example.todos.web.rest.ApiConstants.ApiPath.*;

import com.example.todos.domain.entity.UserPrincipal;
import com.example.todos.web.rest.dto.TodoRequest;
import com.example.todos.web.rest.dto.TodoResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

@Tag(
    name = "Todos v1",
    description = "Todo lists of the authenticated user. Served for application/vnd.todos.v1+json "
        + "and for requests that name no version"
)
@SecurityRequirement(name = "bearer")
@RequestMapping(value = TODOS_BASE)
public interface TodoAPI {

  @Operation(summary = "List todos", description = "One page of the caller's todos with their items")
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Todos returned"),
      @ApiResponse(responseCode = "401", description = "Missing, invalid or expired token"),
      @ApiResponse(responseCode = "422", description = "Page out of range")
  })
  @GetMapping
  ResponseEntity<List<TodoResponse>> list(
      @Parameter(hidden = true) @AuthenticationPrincipal UserPrincipal principal,
      @Parameter(description = "1-based page number", example = "1")
      @RequestParam(defaultValue = "1") int page
                                         );

  @Operation(summary = "Create a todo")
  @ApiResponses(value = {
      @ApiResponse(responseCode = "201", description = "Todo created"),
      @ApiResponse(responseCode = "401", description = "Missing, invalid or expired token"),
      @ApiResponse(responseCode = "422", description = "Title missing")
  })
  @PostMapping
  ResponseEntity<TodoResponse> create(
      @Parameter(hidden = true) @AuthenticationPrincipal UserPrincipal principal,
      @RequestBody TodoRequest request
                                     );

  @Operation(summary = "Show a todo")
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Todo returned"),
      @ApiResponse(responseCode = "404", description = "No such todo for this user")
  })
  @GetMapping(value = TODO_ID)
  ResponseEntity<TodoResponse> show(
      @Parameter(hidden = true) @AuthenticationPrincipal UserPrincipal principal,
      @PathVariable("id") long id
                                   );

  @Operation(summary = "Update a todo")
  @ApiResponses(value = {
      @ApiResponse(responseCode = "204", description = "Todo updated"),
      @ApiResponse(responseCode = "404", description = "No such todo for this user"),
      @ApiResponse(responseCode = "422", description = "Blank title")
  })
  @PutMapping(value = TODO_ID)
  ResponseEntity<Void> update(
      @Parameter(hidden = true) @AuthenticationPrincipal UserPrincipal principal,
      @PathVariable("id") long id,
      @RequestBody TodoRequest request
                             );

  @Operation(summary = "Delete a todo and its items")
  @ApiResponses(value = {
      @ApiResponse(responseCode = "204", description = "Todo deleted"),
      @ApiResponse(responseCode = "404", description = "No such todo for this user")
  })
  @DeleteMapping(value = TODO_ID)
  ResponseEntity<Void> delete(
      @Parameter(hidden = true) @AuthenticationPrincipal UserPrincipal principal,
      @PathVariable("id") long id
                             );
}

package com.example.todos.web.rest.controller.v1;

import static com.example.todos.web.rest.ApiConstants.ApiPath.*;

import com.example.todos.domain.entity.UserPrincipal;
import com.example.todos.web.rest.dto.ItemRequest;
import com.example.todos.web.rest.dto.ItemResponse;
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
    name = "Items v1",
    description = "Items nested under one of the authenticated user's todos"
)
@SecurityRequirement(name = "bearer")
@RequestMapping(value = TODOS_BASE)
public interface ItemAPI {

  @Operation(summary = "List a todo's items")
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Items returned"),
      @ApiResponse(responseCode = "404", description = "No such todo for this user")
  })
  @GetMapping(value = ITEMS)
  ResponseEntity<List<ItemResponse>> list(
      @Parameter(hidden = true) @AuthenticationPrincipal UserPrincipal principal,
      @PathVariable("todoId") long todoId
                                         );

  @Operation(summary = "Show an item")
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Item returned"),
      @ApiResponse(responseCode = "404", description = "No such todo or item")
  })
  @GetMapping(value = ITEM_ID)
  ResponseEntity<ItemResponse> show(
      @Parameter(hidden = true) @AuthenticationPrincipal UserPrincipal principal,
      @PathVariable("todoId") long todoId,
      @PathVariable("id") long id
                                   );

  @Operation(summary = "Add an item", description = "Returns the parent todo with all its items")
  @ApiResponses(value = {
      @ApiResponse(responseCode = "201", description = "Item created"),
      @ApiResponse(responseCode = "404", description = "No such todo for this user"),
      @ApiResponse(responseCode = "422", description = "Name missing")
  })
  @PostMapping(value = ITEMS)
  ResponseEntity<TodoResponse> create(
      @Parameter(hidden = true) @AuthenticationPrincipal UserPrincipal principal,
      @PathVariable("todoId") long todoId,
      @RequestBody ItemRequest request
                                     );

  @Operation(summary = "Update an item")
  @ApiResponses(value = {
      @ApiResponse(responseCode = "204", description = "Item updated"),
      @ApiResponse(responseCode = "404", description = "No such todo or item"),
      @ApiResponse(responseCode = "422", description = "Blank name")
  })
  @PutMapping(value = ITEM_ID)
  ResponseEntity<Void> update(
      @Parameter(hidden = true) @AuthenticationPrincipal UserPrincipal principal,
      @PathVariable("todoId") long todoId,
      @PathVariable("id") long id,
      @RequestBody ItemRequest request
                             );

  @Operation(summary = "Delete an item")
  @ApiResponses(value = {
      @ApiResponse(responseCode = "204", description = "Item deleted"),
      @ApiResponse(responseCode = "404", description = "No such todo or item")
  })
  @DeleteMapping(value = ITEM_ID)
  ResponseEntity<Void> delete(
      @Parameter(hidden = true) @AuthenticationPrincipal UserPrincipal principal,
      @PathVariable("todoId") long todoId,
      @PathVariable("id") long id
                             );
}

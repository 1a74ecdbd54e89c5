package com.example.todos.web.rest.controller.v2;

import static com.example.todos.web.rest.ApiConstants.ApiMessage.GREETING;

import com.example.todos.web.rest.dto.MessageResponse;
import com.example.todos.web.versioning.ApiVersionMapping;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

@RestController("todoControllerV2")
@ApiVersionMapping("v2")
public class TodoController implements TodoAPI {

  @Override
  public ResponseEntity<MessageResponse> list() {
    return ResponseEntity.ok(new MessageResponse(GREETING));
  }
}

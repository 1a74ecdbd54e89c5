package com.example.todos.web.rest;

public final class ApiConstants {

  public static final class ApiPath {
    // Base paths
    public static final String AUTH_BASE = "/auth";
    public static final String TODOS_BASE = "/todos";
    public static final String HEALTH_BASE = "/health";

    // Account paths
    public static final String SIGNUP = "/signup";
    public static final String LOGIN = "/login";

    // Todo paths
    public static final String TODO_ID = "/{id}";
    public static final String ITEMS = "/{todoId}/items";
    public static final String ITEM_ID = "/{todoId}/items/{id}";

    // Health paths
    public static final String LIVE = "/live";
    public static final String READY = "/ready";

    private ApiPath() {}
  }

  public static final class ApiMessage {
    public static final String ACCOUNT_CREATED = "Account created successfully";
    public static final String GREETING = "Hello there";

    private ApiMessage() {}
  }

  private ApiConstants() {}
}

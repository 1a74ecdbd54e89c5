package com.example.todos.web.rest.dto;

public record AuthResponse(String authToken) {}

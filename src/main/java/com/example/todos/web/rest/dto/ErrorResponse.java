package com.example.todos.web.rest.dto;

public record ErrorResponse(String message) {}

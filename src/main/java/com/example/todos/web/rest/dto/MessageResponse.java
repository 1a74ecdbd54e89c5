package com.example.todos.web.rest.dto;

public record MessageResponse(String message) {}

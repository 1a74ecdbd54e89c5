package com.example.todos.web.rest.dto;

public record SignupResponse(String message, String authToken) {}

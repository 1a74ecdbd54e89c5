package com.example.todos.web.rest.dto;

public record TodoRequest(String title) {}

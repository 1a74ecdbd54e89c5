package com.example.todos.web.rest.dto;

/**
 * Item fields. On update, an absent field leaves the stored value unchanged.
 */
public record ItemRequest(String name, Boolean done) {}

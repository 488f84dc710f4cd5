package com.example.idp.api;

public record ApiErrorResponse(String code, String message) {}

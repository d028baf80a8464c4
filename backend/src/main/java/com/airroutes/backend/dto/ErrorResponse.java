package com.airroutes.backend.dto;

/**
 * Minimal error body so clients get something structured.
 */
public record ErrorResponse(String error, String message) {
}

package com.deckinverter.model;

public record ErrorResponse(String code, String message) {
}

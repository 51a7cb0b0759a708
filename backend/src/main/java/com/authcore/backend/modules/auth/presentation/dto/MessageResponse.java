package com.authcore.backend.modules.auth.presentation.dto;

public record MessageResponse(String message) {
}

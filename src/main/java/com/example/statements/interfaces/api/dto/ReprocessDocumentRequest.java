package com.example.statements.interfaces.api.dto;

import jakarta.validation.constraints.NotNull;

/**
 * API-layer DTO carrying a re-generated extraction for an existing document.
 */
public record ReprocessDocumentRequest(@NotNull String canonicalXml) {
}

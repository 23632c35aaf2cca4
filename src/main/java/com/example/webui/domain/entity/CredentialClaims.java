package com.example.webui.domain.entity;

import java.time.Instant;

/**
 * Verified claims of an application credential.
 *
 * @param userId    the {@code id} claim
 * @param expiresAt the {@code exp} claim, or {@code null} for credentials without expiry
 */
public record CredentialClaims(String userId, Instant expiresAt) {}

package com.anthem.dataproc.auth.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;
import java.util.Optional;

/**
 * Identity attributes taken from a verified bearer token.
 * Optional attributes are modelled explicitly; defaults are applied by the decision builder.
 */
@Value
@Builder
public class IdentityClaims {

    @NonNull
    String subject;

    String email;

    String role;

    @NonNull
    Instant expiry;

    public Optional<String> getEmail() {
        return Optional.ofNullable(email).filter(value -> !value.isBlank());
    }

    public Optional<String> getRole() {
        return Optional.ofNullable(role).filter(value -> !value.isBlank());
    }
}

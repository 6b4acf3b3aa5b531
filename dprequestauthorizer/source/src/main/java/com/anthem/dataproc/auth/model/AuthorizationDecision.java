package com.anthem.dataproc.auth.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Allow/Deny verdict for one request against one resource. Consumed immediately by the
 * enforcement point; never cached or persisted.
 */
@Value
@Builder
public class AuthorizationDecision {

    @NonNull
    String principal;

    @NonNull
    Effect effect;

    /**
     * The specific operation being invoked (API Gateway method ARN).
     */
    @NonNull
    String resource;

    @Singular("contextEntry")
    Map<String, String> context;

    public boolean isAllowed() {
        return effect == Effect.ALLOW;
    }
}

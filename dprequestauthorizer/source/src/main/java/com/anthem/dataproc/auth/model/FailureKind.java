package com.anthem.dataproc.auth.model;

/**
 * Why a credential could not be turned into claims. Every kind resolves to a Deny.
 */
public enum FailureKind {

    /** No credential was presented, or it was blank. */
    MISSING_CREDENTIAL,

    /** The credential is not a structurally valid compact JWS. */
    MALFORMED_CREDENTIAL,

    /** Well-formed, but untrusted signature, wrong issuer/audience, or expired. */
    INVALID_CREDENTIAL
}

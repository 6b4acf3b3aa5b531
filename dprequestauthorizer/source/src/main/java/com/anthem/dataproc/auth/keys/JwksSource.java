package com.anthem.dataproc.auth.keys;

/**
 * Where the identity provider publishes its JSON Web Key Set.
 */
public interface JwksSource {

    /**
     * @return the raw JWK Set JSON document
     * @throws JwksUnavailableException if the document cannot be retrieved
     */
    String fetch();

    /**
     * Human-readable location for logs.
     */
    String describe();
}

package com.promlbac.gateway.security.jwk;

import com.nimbusds.jose.jwk.JWK;
import java.util.Optional;

/**
 * Looks up public signing keys by their key id.
 * <p>
 * Implementations must not perform network I/O on lookup: token verification only ever sees keys that are already
 * held in memory.
 */
@FunctionalInterface
public interface JwkKeyResolver {

    Optional<JWK> resolve(String keyId);
}

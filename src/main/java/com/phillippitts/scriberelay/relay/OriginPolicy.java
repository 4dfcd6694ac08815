package com.phillippitts.scriberelay.relay;

import java.util.List;
import java.util.Set;

/**
 * Exact-match origin allow list; an empty list allows every origin.
 */
final class OriginPolicy {

    private final Set<String> allowed;

    OriginPolicy(List<String> allowedOrigins) {
        this.allowed = allowedOrigins == null ? Set.of() : Set.copyOf(allowedOrigins.stream()
                .filter(o -> o != null && !o.isBlank())
                .map(String::trim)
                .toList());
    }

    boolean isAllowed(String origin) {
        return allowed.isEmpty() || (origin != null && allowed.contains(origin));
    }
}

package com.apichain.service.support;

import com.apichain.model.ApiOperation;
import com.apichain.model.ApiSpecification;
import com.apichain.model.SecuritySchemeInfo;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.util.MultiValueMap;

/**
 * Attaches a static credential to a request according to the operation's security requirement.
 */
@Slf4j
public final class CredentialApplier {

    private CredentialApplier() {
    }

    /**
     * The first security requirement of the operation, or of the document when the operation declares none.
     * An empty map means no credential is needed.
     */
    public static Map<String, List<String>> effectiveRequirement(ApiOperation operation, ApiSpecification spec) {
        List<Map<String, List<String>>> requirements = operation.getSecurity().isEmpty()
                ? spec.getSecurity()
                : operation.getSecurity();
        return requirements == null || requirements.isEmpty() ? Map.of() : requirements.get(0);
    }

    public static boolean requiresCredential(ApiOperation operation, ApiSpecification spec) {
        return effectiveRequirement(operation, spec).keySet().stream()
                .anyMatch(name -> spec.getSecuritySchemes().containsKey(name));
    }

    public static void apply(ApiOperation operation,
                             ApiSpecification spec,
                             String credential,
                             HttpHeaders headers,
                             MultiValueMap<String, String> queryParams) {
        if (credential == null || credential.isBlank()) {
            return;
        }
        effectiveRequirement(operation, spec).keySet().forEach(name -> {
            SecuritySchemeInfo scheme = spec.getSecuritySchemes().get(name);
            if (scheme == null) {
                log.warn("Operation {} requires unknown security scheme '{}'", operation.signature(), name);
                return;
            }
            log.debug("  Applying security scheme '{}' of type {}", name, scheme.type());
            if (scheme.isApiKey()) {
                switch (String.valueOf(scheme.in())) {
                    case "query" -> queryParams.set(scheme.name(), credential);
                    case "cookie" -> headers.add(HttpHeaders.COOKIE, scheme.name() + "=" + credential);
                    default -> headers.set(scheme.name(), credential);
                }
            } else if (scheme.isHttp() && "basic".equalsIgnoreCase(scheme.scheme())) {
                int colon = credential.indexOf(':');
                if (colon > 0) {
                    headers.setBasicAuth(HttpHeaders.encodeBasicAuth(
                            credential.substring(0, colon), credential.substring(colon + 1), StandardCharsets.UTF_8));
                } else {
                    headers.setBasicAuth(credential);
                }
            } else if (scheme.isHttp() || scheme.isOAuth()) {
                headers.setBearerAuth(credential);
            }
        });
    }
}

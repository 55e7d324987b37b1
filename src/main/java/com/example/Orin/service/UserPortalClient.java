package com.example.Orin.service;

import com.example.Orin.config.OrinProperties;
import com.example.Orin.exception.AuthenticationRequiredException;
import com.example.Orin.exception.PortalUnavailableException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Optional;

/**
 * Client for the internal user-data portal (marks, attendance, profile...).
 */
@Component
public class UserPortalClient {

    private static final Logger log = LoggerFactory.getLogger(UserPortalClient.class);

    private final RestTemplate restTemplate;
    private final OrinProperties.Portal portal;

    public UserPortalClient(RestTemplateBuilder restTemplateBuilder, OrinProperties properties) {
        this.portal = properties.getPortal();
        this.restTemplate = restTemplateBuilder
                .connectTimeout(portal.getConnectTimeout())
                .readTimeout(portal.getReadTimeout())
                .build();
    }

    /**
     * Fetch one kind of personal data for a user.
     *
     * @return the portal's JSON payload, or empty when the portal has no such data type
     * @throws AuthenticationRequiredException when no credential is given or the portal rejects it
     * @throws PortalUnavailableException      when the portal is not configured or cannot be reached
     */
    public Optional<JsonNode> fetchUserData(String userId, String dataType, String authToken) {
        if (authToken == null || authToken.isBlank()) {
            throw new AuthenticationRequiredException(AuthenticationRequiredException.MISSING_CREDENTIAL);
        }
        if (portal.getBaseUrl() == null || portal.getBaseUrl().isBlank()) {
            throw new PortalUnavailableException("Internal portal integration not configured.");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(authToken);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (portal.getApiKey() != null && !portal.getApiKey().isBlank()) {
            headers.set("X-API-Key", portal.getApiKey());
        }

        String url = stripTrailingSlash(portal.getBaseUrl()) + "/api/user/{userId}/{dataType}";
        try {
            ResponseEntity<JsonNode> resp = restTemplate.exchange(
                    url, HttpMethod.GET, new HttpEntity<>(headers), JsonNode.class, userId, dataType);
            return Optional.ofNullable(resp.getBody());
        } catch (HttpClientErrorException e) {
            if (e.getStatusCode().isSameCodeAs(HttpStatus.NOT_FOUND)) {
                return Optional.empty();
            }
            if (e.getStatusCode().isSameCodeAs(HttpStatus.UNAUTHORIZED)
                    || e.getStatusCode().isSameCodeAs(HttpStatus.FORBIDDEN)) {
                throw new AuthenticationRequiredException("The portal rejected the supplied credentials.");
            }
            throw new PortalUnavailableException("Portal request failed: status=" + e.getStatusCode(), e);
        } catch (RestClientException e) {
            log.warn("User portal unreachable: {}", e.getMessage());
            throw new PortalUnavailableException("Internal portal is unreachable.", e);
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}

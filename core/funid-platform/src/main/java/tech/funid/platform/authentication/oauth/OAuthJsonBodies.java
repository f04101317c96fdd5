package tech.funid.platform.authentication.oauth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.Map;

/**
 * Reads JSON request bodies on the OAuth endpoints.
 *
 * Bodies arrive as raw strings so that syntax errors and wrong shapes are
 * reported as {@code invalid_request} instead of the framework's empty 400.
 * A blank body reads as null.
 */
@ApplicationScoped
public class OAuthJsonBodies {

    private static final Logger LOG = Logger.getLogger(OAuthJsonBodies.class);

    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {
    };

    @Inject
    ObjectMapper objectMapper;

    public Map<String, Object> readObject(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(body, JSON_OBJECT);
        } catch (JsonProcessingException e) {
            LOG.debugf("Rejected JSON token request body: %s", e.getOriginalMessage());
            throw OAuthException.invalidRequest("Request body must be a JSON object");
        }
    }

    public ConsentDecision readConsentDecision(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(body, ConsentDecision.class);
        } catch (JsonProcessingException e) {
            LOG.debugf("Rejected consent decision body: %s", e.getOriginalMessage());
            throw OAuthException.invalidRequest("Request body must be a JSON consent decision object");
        }
    }
}

package com.eios.collab.security;

import com.eios.collab.client.AccessClient;
import com.eios.collab.client.AccessResponse;
import com.eios.collab.error.AuthRejectedException;
import com.eios.collab.message.RejectReason;
import com.eios.collab.room.DocumentKey;
import io.smallrye.jwt.auth.principal.JWTParser;
import io.smallrye.jwt.auth.principal.ParseException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.WebApplicationException;
import org.eclipse.microprofile.jwt.JsonWebToken;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.jboss.logging.Logger;

/**
 * Verifies the bearer JWT locally, then asks the platform API whether its subject may
 * open the document.
 */
@ApplicationScoped
public class AuthService implements Authenticator {

    private static final Logger LOG = Logger.getLogger(AuthService.class);

    private final JWTParser parser;
    private final AccessClient access;

    @Inject
    public AuthService(JWTParser parser, @RestClient AccessClient access) {
        this.parser = parser;
        this.access = access;
    }

    @Override
    public Identity authenticate(String bearer, DocumentKey document) {
        if (bearer == null || bearer.isBlank()) {
            throw new AuthRejectedException(RejectReason.UNAUTHENTICATED, "Bearer credential required");
        }
        JsonWebToken jwt;
        try {
            jwt = parser.parse(bearer);
        } catch (ParseException e) {
            throw new AuthRejectedException(RejectReason.UNAUTHENTICATED, "Invalid or expired credential", e);
        }
        String userId = jwt.getSubject();
        if (userId == null || userId.isBlank()) {
            throw new AuthRejectedException(RejectReason.UNAUTHENTICATED, "Credential has no subject");
        }

        AccessResponse response;
        try {
            response = access.checkAccess("Bearer " + bearer, document.siteId(), document.version());
        } catch (WebApplicationException e) {
            int status = e.getResponse().getStatus();
            throw switch (status) {
                case 401 -> new AuthRejectedException(RejectReason.UNAUTHENTICATED, "Credential rejected", e);
                case 403 -> new AuthRejectedException(RejectReason.UNAUTHORIZED, "No access to " + document, e);
                case 404 -> new AuthRejectedException(RejectReason.DOCUMENT_NOT_FOUND, "Unknown document " + document, e);
                default -> unavailable(document, "status " + status, e);
            };
        } catch (ProcessingException e) {
            throw unavailable(document, e.getMessage(), e);
        }
        if (response == null || !response.allowed()) {
            throw new AuthRejectedException(RejectReason.UNAUTHORIZED, "No access to " + document);
        }

        String name = response.displayName();
        if (name == null) {
            name = jwt.getClaim("name");
        }
        return new Identity(userId, name, response.canEdit());
    }

    private static AuthRejectedException unavailable(DocumentKey document, String detail, Throwable cause) {
        LOG.warnf("Authorization check for %s failed: %s", document, detail);
        return new AuthRejectedException(RejectReason.AUTH_UNAVAILABLE, "Authorization service unavailable", cause);
    }
}

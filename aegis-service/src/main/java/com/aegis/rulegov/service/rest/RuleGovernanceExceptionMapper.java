package com.aegis.rulegov.service.rest;

import com.aegis.rulegov.api.exceptions.GenerationFailureException;
import com.aegis.rulegov.api.exceptions.GovernanceViolationException;
import com.aegis.rulegov.api.exceptions.InvalidRequestException;
import com.aegis.rulegov.api.exceptions.PersistenceException;
import com.aegis.rulegov.api.exceptions.PolicyViolationException;
import com.aegis.rulegov.api.exceptions.RuleGovernanceException;
import com.aegis.rulegov.api.exceptions.RuleRejectedException;
import com.aegis.rulegov.api.exceptions.SampleUnavailableException;
import com.aegis.rulegov.api.exceptions.SuggestionNotFoundException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Renders governance failures as {@code {error, code, details}}.
 */
@Provider
public class RuleGovernanceExceptionMapper implements ExceptionMapper<RuleGovernanceException> {

    private static final Logger logger = Logger.getLogger(RuleGovernanceExceptionMapper.class.getName());

    @Override
    public Response toResponse(RuleGovernanceException exception) {
        int status = statusFor(exception);
        if (status >= 500) {
            logger.log(Level.WARNING, "Request failed: " + exception.getMessage(), exception);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", exception.getMessage());
        body.put("code", exception.errorCode());
        body.put("details", details(exception));
        return Response.status(status).type(MediaType.APPLICATION_JSON).entity(body).build();
    }

    static int statusFor(RuleGovernanceException exception) {
        if (exception instanceof InvalidRequestException) {
            return 400;
        }
        if (exception instanceof SuggestionNotFoundException) {
            return 404;
        }
        if (exception instanceof RuleRejectedException || exception instanceof PolicyViolationException) {
            return 422;
        }
        if (exception instanceof GovernanceViolationException governance) {
            return switch (governance.reason()) {
                case SELF_APPROVAL -> 403;
                case ALREADY_TERMINAL, EXPIRED, CONCURRENT_TRANSITION -> 409;
                case IMPACT_NOT_COMPUTED, INVALID_RULE -> 422;
                default -> 400;
            };
        }
        if (exception instanceof GenerationFailureException generation) {
            return generation.reason() == GenerationFailureException.Reason.RATE_LIMITED ? 429 : 503;
        }
        if (exception instanceof SampleUnavailableException || exception instanceof PersistenceException) {
            return 503;
        }
        return 500;
    }

    static Map<String, Object> details(RuleGovernanceException exception) {
        Map<String, Object> details = new LinkedHashMap<>();
        if (exception instanceof RuleRejectedException rejected) {
            details.put("errors", rejected.errors());
        } else if (exception instanceof PolicyViolationException policy) {
            details.put("violations", policy.violations());
        } else if (exception instanceof GovernanceViolationException governance) {
            details.put("reason", governance.reason().name());
        } else if (exception instanceof GenerationFailureException generation) {
            details.put("reason", generation.reason().name());
            details.put("prompt_hash", generation.promptHash());
        }
        return details;
    }
}

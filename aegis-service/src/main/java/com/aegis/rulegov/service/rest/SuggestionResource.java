/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.service.rest;

import com.aegis.rulegov.api.exceptions.InvalidRequestException;
import com.aegis.rulegov.api.model.Suggestion;
import com.aegis.rulegov.api.model.SuggestionStatus;
import com.aegis.rulegov.service.governance.GovernanceService;
import com.aegis.rulegov.service.pipeline.SubmitOptions;
import com.aegis.rulegov.service.pipeline.SuggestionPipeline;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import java.util.List;
import java.util.Map;

/**
 * Suggestion submission and review. Errors are rendered by {@link RuleGovernanceExceptionMapper}.
 */
@Path("/suggestions")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class SuggestionResource {

    @Inject
    SuggestionPipeline pipeline;

    @Inject
    GovernanceService governance;

    @POST
    public Response submit(SuggestionRequests.Submit request) {
        if (request == null) {
            throw new InvalidRequestException("Request body is required");
        }
        Suggestion suggestion = pipeline.submitSuggestion(request.instruction(), request.actor(),
                new SubmitOptions(request.sampleSize(), request.filters()));
        return Response.status(Response.Status.CREATED).entity(suggestion).build();
    }

    @GET
    public Response list(@QueryParam("status") String status,
                         @QueryParam("author") String author,
                         @QueryParam("limit") @DefaultValue("50") int limit,
                         @QueryParam("offset") @DefaultValue("0") int offset) {
        List<Suggestion> suggestions = governance.listSuggestions(parseStatus(status), author, limit, offset);
        return Response.ok(Map.of("suggestions", suggestions, "count", suggestions.size())).build();
    }

    @GET
    @Path("/{id}")
    public Suggestion get(@PathParam("id") String id) {
        return governance.findSuggestion(id);
    }

    @POST
    @Path("/{id}/approve")
    public Suggestion approve(@PathParam("id") String id, SuggestionRequests.Approve request) {
        if (request == null) {
            throw new InvalidRequestException("Request body is required");
        }
        return governance.approveSuggestion(id, request.approver(), request.notes(),
                request.acknowledgeImpact(), request.expectedImpact());
    }

    @POST
    @Path("/{id}/reject")
    public Suggestion reject(@PathParam("id") String id, SuggestionRequests.Reject request) {
        if (request == null) {
            throw new InvalidRequestException("Request body is required");
        }
        return governance.rejectSuggestion(id, request.reviewer(), request.notes());
    }

    static SuggestionStatus parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        try {
            return SuggestionStatus.fromWire(status.trim());
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("Unknown status: " + status);
        }
    }
}

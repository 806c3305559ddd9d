/*
 * Copyright (c) 2025 Aegis Rule Governance
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.rulegov.service.rest;

import com.aegis.rulegov.analysis.OverlapExample;
import com.aegis.rulegov.api.exceptions.InvalidRequestException;
import com.aegis.rulegov.api.model.ActiveRule;
import com.aegis.rulegov.service.impact.DryRunResult;
import com.aegis.rulegov.service.impact.ImpactService;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.List;
import java.util.Map;

/**
 * What-if analysis and read access to the active rule set.
 */
@Path("/rules")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class DryRunResource {

    @Inject
    ImpactService impactService;

    @ConfigProperty(name = "aegis.sample.size", defaultValue = "10000")
    int defaultSampleSize;

    @POST
    @Path("/dryrun")
    public DryRunResult dryRun(SuggestionRequests.DryRun request) {
        if (request == null) {
            throw new InvalidRequestException("Request body is required");
        }
        int sampleSize = request.sampleSize() == null ? defaultSampleSize : request.sampleSize();
        return impactService.dryRun(request.rule(), sampleSize, request.filters(), request.actor());
    }

    @POST
    @Path("/{id}/overlap-examples")
    public Response overlapExamples(@PathParam("id") String activeRuleId, SuggestionRequests.DryRun request) {
        if (request == null) {
            throw new InvalidRequestException("Request body is required");
        }
        int sampleSize = request.sampleSize() == null ? defaultSampleSize : request.sampleSize();
        List<OverlapExample> examples = impactService.overlapExamples(request.rule(), activeRuleId, sampleSize);
        return Response.ok(Map.of("rule_id", activeRuleId, "examples", examples)).build();
    }

    @GET
    public List<ActiveRule> activeRules() {
        return impactService.activeRules();
    }

    @GET
    @Path("/{id}")
    public Response activeRule(@PathParam("id") String ruleId) {
        return impactService.activeRule(ruleId)
                .map(rule -> Response.ok(rule).build())
                .orElseGet(() -> Response.status(Response.Status.NOT_FOUND)
                        .entity(Map.of("error", "Rule not found", "code", "NOT_FOUND", "details", Map.of("rule_id", ruleId)))
                        .build());
    }

    @GET
    @Path("/{id}/versions")
    public Response versions(@PathParam("id") String ruleId) {
        return Response.ok(Map.of("rule_id", ruleId, "versions", impactService.ruleVersions(ruleId))).build();
    }
}

package com.aegis.rulegov.service.rest;

import com.aegis.rulegov.api.model.AuditEntry;
import com.aegis.rulegov.service.governance.GovernanceService;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import java.util.List;

@Path("/audits")
@Produces(MediaType.APPLICATION_JSON)
public class AuditResource {

    @Inject
    GovernanceService governance;

    @GET
    @Path("/{resourceId}")
    public List<AuditEntry> trail(@PathParam("resourceId") String resourceId) {
        return governance.auditTrail(resourceId);
    }
}

/* (C)2026 */
package com.ammann.fedstats.resource;

import com.ammann.fedstats.dto.RoundOutcomeDTO;
import com.ammann.fedstats.dto.RunDescriptorDTO;
import com.ammann.fedstats.enumeration.FailureKind;
import com.ammann.fedstats.model.Run;
import com.ammann.fedstats.properties.ApiProperties;
import com.ammann.fedstats.service.CoordinatorRoundService;
import com.ammann.fedstats.service.ParticipantRoundService;
import com.ammann.fedstats.service.RunRegistryService;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * REST resource for submitting runs and driving their rounds.
 *
 * <p>Round outcomes are returned as {@link RoundOutcomeDTO}: 200 when the round published,
 * 202 while a coordinator round is still waiting for payloads, 409 when a stage failed.
 */
@Path(ApiProperties.BASE_URL_V1 + ApiProperties.Runs.BASE)
@Tag(name = "Federated Runs API", description = "Run submission, site rounds and coordinator aggregation")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class RunResource {

    private static final Logger LOG = Logger.getLogger(RunResource.class);

    @Inject RunRegistryService runRegistry;

    @Inject ParticipantRoundService participantRounds;

    @Inject CoordinatorRoundService coordinatorRounds;

    @Inject
    @Named("coordinator-executor")
    ManagedExecutor executor;

    @POST
    @Operation(summary = "Submit run", description = "Stores a new run with its ordered task specifications")
    public Response submitRun(RunDescriptorDTO descriptor) {
        Run run = runRegistry.submit(descriptor);
        return Response.status(Response.Status.CREATED).entity(RunDescriptorDTO.from(run)).build();
    }

    @GET
    @Path(ApiProperties.Runs.RUN)
    @Operation(summary = "Run descriptor", description = "Returns a submitted run")
    public Response getRun(@PathParam("runId") String runId) {
        return Response.ok(RunDescriptorDTO.from(runRegistry.find(runId))).build();
    }

    @POST
    @Path(ApiProperties.Runs.PARTICIPANT)
    @Operation(
            summary = "Run site round",
            description = "Loads the participant's dataset, fits the local model and publishes its statistics")
    public Response runParticipantRound(
            @PathParam("runId") String runId,
            @PathParam("sequence") int sequence,
            @PathParam("round") int round,
            @PathParam("participant") String participant) {
        return toResponse(participantRounds.runRound(runId, sequence, round, participant));
    }

    @POST
    @Path(ApiProperties.Runs.AGGREGATE)
    @Operation(
            summary = "Aggregate round",
            description = "Aggregates the round once it is ready; with wait=true blocks until ready or expired")
    public CompletionStage<Response> aggregateRound(
            @PathParam("runId") String runId,
            @PathParam("sequence") int sequence,
            @PathParam("round") int round,
            @QueryParam("wait") @DefaultValue("false") boolean wait) {
        if (!wait) {
            return CompletableFuture.completedFuture(
                    toResponse(coordinatorRounds.aggregate(runId, sequence, round)));
        }
        LOG.infof("Blocking aggregation requested for run %s round %d-%d", runId, sequence, round);
        return executor.supplyAsync(() -> {
            try {
                return toResponse(coordinatorRounds.awaitAndAggregate(runId, sequence, round));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CompletionException(e);
            }
        });
    }

    @POST
    @Path(ApiProperties.Runs.CLOSE)
    @Operation(summary = "Close round", description = "Signals that no further local payloads are expected")
    public Response closeRound(
            @PathParam("runId") String runId,
            @PathParam("sequence") int sequence,
            @PathParam("round") int round) {
        coordinatorRounds.closeRound(runId, sequence, round);
        return Response.noContent().build();
    }

    @GET
    @Path(ApiProperties.Runs.GLOBAL)
    @Operation(summary = "Global payload", description = "Returns the coordinator's published statistics for a round")
    public Response getGlobalPayload(
            @PathParam("runId") String runId,
            @PathParam("sequence") int sequence,
            @PathParam("round") int round) {
        String blob = coordinatorRounds.findGlobal(runId, sequence, round)
                .orElseThrow(() -> new NotFoundException(String.format(
                        "No global payload for run %s round %d-%d", runId, sequence, round)));
        return Response.ok(blob.trim()).build();
    }

    private static Response toResponse(RoundOutcomeDTO outcome) {
        if (outcome.success()) {
            return Response.ok(outcome).build();
        }
        if (FailureKind.AGGREGATION_NOT_READY.name().equals(outcome.failure())) {
            return Response.accepted(outcome).build();
        }
        return Response.status(Response.Status.CONFLICT).entity(outcome).build();
    }
}

package com.shareplan.infrastructure.rest;

import com.shareplan.domain.exception.Error;
import com.shareplan.domain.exception.Errors;
import com.shareplan.domain.usecase.CalculatePortfolioUseCase;
import com.shareplan.domain.usecase.GetTimelineUseCase;
import com.shareplan.domain.usecase.LoadPortfolioUseCase;
import com.shareplan.infrastructure.rest.dto.ErrorResponse;
import com.shareplan.infrastructure.rest.dto.LoadPortfolioRequest;
import com.shareplan.infrastructure.rest.dto.RecalculateRequest;
import com.shareplan.infrastructure.rest.mapper.CalculationsResponseMapper;
import com.shareplan.infrastructure.rest.mapper.PortfolioRequestMapper;
import com.shareplan.infrastructure.rest.mapper.TimelineResponseMapper;
import io.smallrye.mutiny.Uni;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import java.util.Set;
import java.util.UUID;

@Slf4j
@Path("/api/v1/portfolios")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@Tag(name = "Portfolios", description = "Share plan portfolio calculations")
public class PortfolioController {

    private static final int UNPROCESSABLE_ENTITY = 422;

    private static final Set<Error> BAD_REQUEST_ERRORS = Set.of(
            Errors.ReferencePoints.INVALID_INPUT,
            Errors.Calculation.INVALID_INPUT,
            Errors.Currency.INVALID_INPUT,
            Errors.PriceHistory.INVALID_INPUT,
            Errors.Session.INVALID_INPUT
    );

    private static final Set<Error> UNPROCESSABLE_ERRORS = Set.of(
            Errors.ReferencePoints.OVERSELL,
            Errors.Calculation.MISSING_DATA
    );

    private final LoadPortfolioUseCase loadPortfolioUseCase;
    private final CalculatePortfolioUseCase calculatePortfolioUseCase;
    private final GetTimelineUseCase getTimelineUseCase;
    private final PortfolioRequestMapper portfolioRequestMapper;
    private final CalculationsResponseMapper calculationsResponseMapper;
    private final TimelineResponseMapper timelineResponseMapper;

    public PortfolioController(LoadPortfolioUseCase loadPortfolioUseCase,
                               CalculatePortfolioUseCase calculatePortfolioUseCase,
                               GetTimelineUseCase getTimelineUseCase,
                               PortfolioRequestMapper portfolioRequestMapper,
                               CalculationsResponseMapper calculationsResponseMapper,
                               TimelineResponseMapper timelineResponseMapper) {
        this.loadPortfolioUseCase = loadPortfolioUseCase;
        this.calculatePortfolioUseCase = calculatePortfolioUseCase;
        this.getTimelineUseCase = getTimelineUseCase;
        this.portfolioRequestMapper = portfolioRequestMapper;
        this.calculationsResponseMapper = calculationsResponseMapper;
        this.timelineResponseMapper = timelineResponseMapper;
    }

    @POST
    @Operation(summary = "Load a parsed portfolio into a calculation session")
    public Uni<Response> loadPortfolio(@Valid @NotNull LoadPortfolioRequest request) {
        return loadPortfolioUseCase.execute(portfolioRequestMapper.toCommand(request))
                .map(this::toResponse);
    }

    @GET
    @Path("/{sessionId}/calculations")
    @Operation(summary = "Calculate the portfolio in its active currency")
    public Uni<Response> getCalculations(@PathParam("sessionId") UUID sessionId) {
        return calculate(CalculatePortfolioUseCase.Command.current(sessionId));
    }

    @POST
    @Path("/{sessionId}/calculations")
    @Operation(summary = "Recalculate the portfolio after switching currency or manual price")
    public Uni<Response> recalculate(@PathParam("sessionId") UUID sessionId, @Valid RecalculateRequest request) {
        RecalculateRequest changes = request != null ? request : new RecalculateRequest(null, null, null);
        return calculate(new CalculatePortfolioUseCase.Command(
                sessionId,
                changes.currency(),
                changes.manualPrice(),
                Boolean.TRUE.equals(changes.clearManualPrice())));
    }

    @GET
    @Path("/{sessionId}/timeline")
    @Operation(summary = "Portfolio value over time in the active currency")
    public Uni<Response> getTimeline(@PathParam("sessionId") UUID sessionId) {
        return getTimelineUseCase.execute(sessionId)
                .map(this::toResponse);
    }

    @DELETE
    @Path("/{sessionId}")
    @Operation(summary = "Discard a loaded portfolio")
    public Uni<Response> unloadPortfolio(@PathParam("sessionId") UUID sessionId) {
        return loadPortfolioUseCase.unload(sessionId)
                .map(removed -> removed
                        ? Response.noContent().build()
                        : notFound(sessionId));
    }

    private Uni<Response> calculate(CalculatePortfolioUseCase.Command command) {
        return calculatePortfolioUseCase.execute(command)
                .map(this::toResponse);
    }

    private Response toResponse(LoadPortfolioUseCase.Result result) {
        if (result instanceof LoadPortfolioUseCase.Result.Success success) {
            return Response.status(Response.Status.CREATED)
                    .entity(calculationsResponseMapper.toSessionResponse(success))
                    .build();
        }
        if (result instanceof LoadPortfolioUseCase.Result.Error error) {
            return errorResponse(error.error(), error.message());
        }
        throw new IllegalStateException("Unexpected load result: " + result);
    }

    private Response toResponse(CalculatePortfolioUseCase.Result result) {
        if (result instanceof CalculatePortfolioUseCase.Result.Success success) {
            return Response.ok(calculationsResponseMapper.toResponse(success.calculations(), success.availableCurrencies())).build();
        }
        if (result instanceof CalculatePortfolioUseCase.Result.NotFound notFound) {
            return notFound(notFound.sessionId());
        }
        if (result instanceof CalculatePortfolioUseCase.Result.Error error) {
            return errorResponse(error.error(), error.message());
        }
        throw new IllegalStateException("Unexpected calculation result: " + result);
    }

    private Response toResponse(GetTimelineUseCase.Result result) {
        if (result instanceof GetTimelineUseCase.Result.Success success) {
            return Response.ok(timelineResponseMapper.toResponse(success.timeline(), success.currency())).build();
        }
        if (result instanceof GetTimelineUseCase.Result.NotFound notFound) {
            return notFound(notFound.sessionId());
        }
        if (result instanceof GetTimelineUseCase.Result.Error error) {
            return errorResponse(error.error(), error.message());
        }
        throw new IllegalStateException("Unexpected timeline result: " + result);
    }

    private Response notFound(UUID sessionId) {
        return Response.status(Response.Status.NOT_FOUND)
                .entity(new ErrorResponse(Errors.Session.NOT_FOUND.code(), "Portfolio session not found: " + sessionId))
                .build();
    }

    private Response errorResponse(Error error, String message) {
        int status;
        if (BAD_REQUEST_ERRORS.contains(error)) {
            status = Response.Status.BAD_REQUEST.getStatusCode();
        } else if (UNPROCESSABLE_ERRORS.contains(error)) {
            status = UNPROCESSABLE_ENTITY;
        } else {
            log.error("Request failed [{}]: {}", error.code(), message);
            status = Response.Status.INTERNAL_SERVER_ERROR.getStatusCode();
        }
        return Response.status(status)
                .entity(new ErrorResponse(error.code(), message))
                .build();
    }
}

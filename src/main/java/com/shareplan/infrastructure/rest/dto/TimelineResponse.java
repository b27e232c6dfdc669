package com.shareplan.infrastructure.rest.dto;

import io.quarkus.runtime.annotations.RegisterForReflection;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.util.List;

@RegisterForReflection
@Schema(description = "Portfolio value over time in the active currency")
public record TimelineResponse(
    String currency,
    @Schema(description = "True when built from reference points because no price history exists")
    boolean synthetic,
    List<TimelinePointResponse> points,
    AsOfDateMarkerResponse asOfDateMarker
) {}

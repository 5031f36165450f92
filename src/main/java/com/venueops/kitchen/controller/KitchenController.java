package com.venueops.kitchen.controller;

import com.venueops.common.access.AccessLevel;
import com.venueops.common.access.VenueHeaders;
import com.venueops.common.access.VenueScope;
import com.venueops.common.dto.ApiResponse;
import com.venueops.kitchen.dto.StationResponse;
import com.venueops.kitchen.dto.TicketResponse;
import com.venueops.kitchen.dto.UpdateTicketStatusRequest;
import com.venueops.kitchen.service.BackfillResult;
import com.venueops.kitchen.service.BackfillScope;
import com.venueops.kitchen.service.KitchenTicketRouter;
import com.venueops.kitchen.service.RouteResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/kitchen")
@RequiredArgsConstructor
public class KitchenController {

    private final KitchenTicketRouter ticketRouter;

    @GetMapping("/stations")
    public ApiResponse<List<StationResponse>> stations(@RequestHeader(VenueHeaders.VENUE_ID) String venueId) {
        return ApiResponse.ok(ticketRouter.ensureStations(VenueScope.scoped(venueId)).stream()
                .map(StationResponse::from)
                .toList());
    }

    @GetMapping("/tickets")
    public ApiResponse<List<TicketResponse>> tickets(@RequestHeader(VenueHeaders.VENUE_ID) String venueId,
                                                     @RequestParam(required = false) Long stationId,
                                                     @RequestParam(required = false) String status) {
        return ApiResponse.ok(ticketRouter.listTickets(VenueScope.scoped(venueId), stationId, status).stream()
                .map(TicketResponse::from)
                .toList());
    }

    @PatchMapping("/tickets/{ticketId}")
    public ApiResponse<TicketResponse> updateStatus(@RequestHeader(VenueHeaders.VENUE_ID) String venueId,
                                                    @PathVariable Long ticketId,
                                                    @Valid @RequestBody UpdateTicketStatusRequest request) {
        return ApiResponse.ok(TicketResponse.from(
                ticketRouter.updateTicketStatus(VenueScope.scoped(venueId), ticketId, request.status())));
    }

    @PostMapping("/orders/{orderId}/route")
    public ApiResponse<RouteResult> route(@RequestHeader(VenueHeaders.VENUE_ID) String venueId,
                                          @PathVariable Long orderId) {
        return ApiResponse.ok(ticketRouter.routeOrder(VenueScope.scoped(venueId), orderId));
    }

    @PostMapping("/backfill")
    public ApiResponse<BackfillResult> backfill(@RequestHeader(VenueHeaders.VENUE_ID) String venueId,
                                                @RequestParam(defaultValue = "TODAY") BackfillScope scope) {
        return ApiResponse.ok(ticketRouter.backfill(VenueScope.scoped(venueId), scope));
    }

    @PostMapping("/backfill/all")
    public ApiResponse<BackfillResult> backfillAll(
            @RequestHeader(value = VenueHeaders.ACCESS_LEVEL, defaultValue = "SCOPED") AccessLevel accessLevel,
            @RequestParam(defaultValue = "LIVE") BackfillScope scope) {
        return ApiResponse.ok(ticketRouter.backfillAllVenues(accessLevel, scope));
    }
}

package com.venueops.table.controller;

import com.venueops.common.access.VenueHeaders;
import com.venueops.common.access.VenueScope;
import com.venueops.common.dto.ApiResponse;
import com.venueops.table.dto.CreateTableRequest;
import com.venueops.table.dto.MergeRequest;
import com.venueops.table.dto.ReleaseRequest;
import com.venueops.table.dto.SeatRequest;
import com.venueops.table.service.MergeResult;
import com.venueops.table.service.ReleaseOutcome;
import com.venueops.table.service.TableRef;
import com.venueops.table.service.TableSessionManager;
import com.venueops.table.service.TableState;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/tables")
@RequiredArgsConstructor
public class TableController {

    private final TableSessionManager tableSessionManager;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<TableState> create(@RequestHeader(VenueHeaders.VENUE_ID) String venueId,
                                          @Valid @RequestBody CreateTableRequest request) {
        return ApiResponse.ok(tableSessionManager.createTable(
                VenueScope.scoped(venueId), request.label(), request.seatCount(), request.tableNumber()));
    }

    @GetMapping
    public ApiResponse<List<TableState>> list(@RequestHeader(VenueHeaders.VENUE_ID) String venueId) {
        return ApiResponse.ok(tableSessionManager.listTables(VenueScope.scoped(venueId)));
    }

    @GetMapping("/{tableId}")
    public ApiResponse<TableState> get(@RequestHeader(VenueHeaders.VENUE_ID) String venueId,
                                       @PathVariable Long tableId) {
        return ApiResponse.ok(tableSessionManager.getTable(VenueScope.scoped(venueId), tableId));
    }

    @PostMapping("/{tableId}/seat")
    public ApiResponse<TableState> seat(@RequestHeader(VenueHeaders.VENUE_ID) String venueId,
                                        @PathVariable Long tableId,
                                        @Valid @RequestBody SeatRequest request) {
        return ApiResponse.ok(tableSessionManager.seat(VenueScope.scoped(venueId), tableId,
                request.serverId(), request.guestCount(), request.reservationId()));
    }

    @PostMapping("/{tableId}/merge")
    public ApiResponse<MergeResult> merge(@RequestHeader(VenueHeaders.VENUE_ID) String venueId,
                                          @PathVariable Long tableId,
                                          @Valid @RequestBody MergeRequest request) {
        return ApiResponse.ok(tableSessionManager.merge(
                VenueScope.scoped(venueId), tableId, request.secondaryTableId()));
    }

    @PostMapping("/{tableId}/unmerge")
    public ApiResponse<MergeResult> unmerge(@RequestHeader(VenueHeaders.VENUE_ID) String venueId,
                                            @PathVariable Long tableId) {
        return ApiResponse.ok(tableSessionManager.unmerge(VenueScope.scoped(venueId), tableId));
    }

    @PostMapping("/release")
    public ApiResponse<ReleaseOutcome> release(@RequestHeader(VenueHeaders.VENUE_ID) String venueId,
                                               @Valid @RequestBody ReleaseRequest request) {
        return ApiResponse.ok(tableSessionManager.release(VenueScope.scoped(venueId),
                TableRef.of(request.tableId(), request.tableNumber()), request.orderId()));
    }

    @PostMapping("/{tableId}/cleaning")
    public ApiResponse<TableState> markCleaning(@RequestHeader(VenueHeaders.VENUE_ID) String venueId,
                                                @PathVariable Long tableId) {
        return ApiResponse.ok(tableSessionManager.markCleaning(VenueScope.scoped(venueId), tableId));
    }

    @PostMapping("/{tableId}/free")
    public ApiResponse<TableState> markFree(@RequestHeader(VenueHeaders.VENUE_ID) String venueId,
                                            @PathVariable Long tableId) {
        return ApiResponse.ok(tableSessionManager.markFree(VenueScope.scoped(venueId), tableId));
    }

    @PostMapping("/{tableId}/reserve")
    public ApiResponse<TableState> markReserved(@RequestHeader(VenueHeaders.VENUE_ID) String venueId,
                                                @PathVariable Long tableId,
                                                @RequestParam(required = false) String reservationId) {
        return ApiResponse.ok(tableSessionManager.markReserved(VenueScope.scoped(venueId), tableId, reservationId));
    }
}

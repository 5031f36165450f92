package com.venueops.dashboard.controller;

import com.venueops.common.access.VenueHeaders;
import com.venueops.common.access.VenueScope;
import com.venueops.common.dto.ApiResponse;
import com.venueops.dashboard.service.DashboardAggregator;
import com.venueops.dashboard.service.DashboardCounts;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/dashboard")
@RequiredArgsConstructor
public class DashboardController {

    private final DashboardAggregator dashboardAggregator;

    @GetMapping("/counts")
    public ApiResponse<DashboardCounts> counts(@RequestHeader(VenueHeaders.VENUE_ID) String venueId,
                                               @RequestParam(required = false) String tz,
                                               @RequestParam(required = false) Integer liveWindowMinutes) {
        return ApiResponse.ok(dashboardAggregator.counts(VenueScope.scoped(venueId), tz, liveWindowMinutes));
    }
}

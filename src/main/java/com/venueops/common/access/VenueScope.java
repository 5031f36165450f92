package com.venueops.common.access;

import com.venueops.common.exception.BusinessException;
import com.venueops.common.exception.ErrorCode;

/**
 * Venue id plus the caller's access level, passed explicitly into every engine operation.
 * Every store query issued on behalf of a scope is filtered by {@link #venueId()}.
 */
public record VenueScope(String venueId, AccessLevel accessLevel) {

    public VenueScope {
        if (venueId == null || venueId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "venueId is required");
        }
        if (accessLevel == null) {
            accessLevel = AccessLevel.SCOPED;
        }
    }

    public static VenueScope scoped(String venueId) {
        return new VenueScope(venueId, AccessLevel.SCOPED);
    }

    public static VenueScope elevated(String venueId) {
        return new VenueScope(venueId, AccessLevel.ELEVATED);
    }

    public static void requireElevated(AccessLevel accessLevel) {
        if (accessLevel != AccessLevel.ELEVATED) {
            throw new BusinessException(ErrorCode.ACCESS_DENIED);
        }
    }
}

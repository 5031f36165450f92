package com.venueops.table.dto;

import jakarta.validation.constraints.NotNull;

public record MergeRequest(@NotNull Long secondaryTableId) {
}

package com.venueops.table.service;

public record MergeResult(TableState primary, TableState secondary) {
}

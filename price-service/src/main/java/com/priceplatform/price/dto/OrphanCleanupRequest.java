package com.priceplatform.price.dto;

import java.util.List;

public record OrphanCleanupRequest(List<String> trackedSymbols) {}

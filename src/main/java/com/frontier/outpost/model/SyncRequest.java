package com.frontier.outpost.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Request to reconcile one source outpost into one target outpost.
 */
public record SyncRequest(
    @NotBlank String source,
    @NotBlank String target,
    @NotNull MergeStrategy strategy
) {}

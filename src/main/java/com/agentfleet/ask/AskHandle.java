package com.agentfleet.ask;

import java.util.concurrent.CompletableFuture;

/**
 * What {@link AskManager#open(AskRequest)} hands back: the listed record and a future that
 * completes exactly once, by answer or by timeout. It never completes exceptionally.
 */
public record AskHandle(PendingAsk pending, CompletableFuture<AskResolution> result) {}

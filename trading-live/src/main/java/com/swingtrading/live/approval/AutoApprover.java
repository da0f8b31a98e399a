package com.swingtrading.live.approval;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/** Approves everything. Used when manual approval is switched off. */
public final class AutoApprover implements TradeApprover {

    @Override
    public CompletionStage<Boolean> requestApproval(ApprovalRequest request) {
        return CompletableFuture.completedFuture(true);
    }
}

package com.swingtrading.live.approval;

import java.util.concurrent.CompletionStage;

/**
 * Asynchronous yes/no gate in front of every live order. The driver waits on
 * the returned stage with a timeout; no answer in time counts as a rejection.
 */
@FunctionalInterface
public interface TradeApprover {

    CompletionStage<Boolean> requestApproval(ApprovalRequest request);
}

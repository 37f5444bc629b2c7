package com.eainde.expedition.action;

/**
 * Acknowledgement from the action execution layer. Logged only; never written back into the diagnosis.
 */
public record ExecutionReceipt(String receiptId, int accepted, int pendingApproval, String message) {
}

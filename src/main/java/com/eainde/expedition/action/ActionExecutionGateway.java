package com.eainde.expedition.action;

import com.eainde.expedition.model.ActionPayload;

import java.util.List;

/**
 * Downstream execution layer. Owns human approval and the real or simulated platform calls.
 */
public interface ActionExecutionGateway {

    ExecutionReceipt submit(String recordId, List<ActionPayload> actions);
}

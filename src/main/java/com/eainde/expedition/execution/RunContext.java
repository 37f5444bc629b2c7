package com.eainde.expedition.execution;

import com.eainde.expedition.catalog.ActionCatalog;
import com.eainde.expedition.catalog.ChannelRoutingTable;

import java.util.Objects;

/**
 * Everything a run needs besides its state: process-wide read-only tables and its own cancellation token.
 * Passed explicitly into every node when the run's graph is compiled.
 */
public record RunContext(
        String recordId,
        ActionCatalog actionCatalog,
        ChannelRoutingTable routingTable,
        CancellationToken cancellation
) {

    public RunContext {
        Objects.requireNonNull(recordId, "recordId");
        Objects.requireNonNull(actionCatalog, "actionCatalog");
        Objects.requireNonNull(routingTable, "routingTable");
        Objects.requireNonNull(cancellation, "cancellation");
    }
}

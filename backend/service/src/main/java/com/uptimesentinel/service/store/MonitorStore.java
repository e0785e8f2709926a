package com.uptimesentinel.service.store;

import com.uptimesentinel.core.model.BoundChannel;
import com.uptimesentinel.core.model.Check;
import com.uptimesentinel.core.model.CheckStatus;
import com.uptimesentinel.core.model.Monitor;

import java.util.List;
import java.util.Optional;

/**
 * Persistence seen by the scheduling engine. Implementations must be safe for concurrent use
 * from many tick and notification threads.
 */
public interface MonitorStore {
    List<Monitor> listActiveMonitors();

    void insertCheck(Check check);

    /**
     * Status of the most recent check for the monitor, empty when it has never been checked.
     */
    Optional<CheckStatus> latestStatus(long monitorId);

    List<BoundChannel> channelsBoundTo(long monitorId, boolean enabledOnly);
}

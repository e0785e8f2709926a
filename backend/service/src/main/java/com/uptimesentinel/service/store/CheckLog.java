package com.uptimesentinel.service.store;

import com.uptimesentinel.core.model.Check;

import java.util.List;
import java.util.Optional;

public interface CheckLog {
    void append(Check check);

    Optional<Check> latest(long monitorId);

    /**
     * Up to {@code limit} most recent checks for the monitor, oldest first.
     */
    List<Check> recent(long monitorId, int limit);
}

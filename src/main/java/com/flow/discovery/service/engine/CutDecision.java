package com.flow.discovery.service.engine;

import com.flow.discovery.service.cut.Cut;
import com.flow.discovery.service.log.EventLog;

import java.util.List;

/**
 * A cut chosen for a log, together with the log it applies to and its sub-logs.
 *
 * The log is the mined log itself, or a binned version of it when the
 * approximate miner found the cut on an approximation.
 */
public record CutDecision(Cut cut, EventLog log, List<EventLog> subLogs) {

    public CutDecision {
        subLogs = List.copyOf(subLogs);
        if (subLogs.size() != cut.size()) {
            throw new IllegalArgumentException(
                    "Expected " + cut.size() + " sub-logs for " + cut.type() + " cut, got " + subLogs.size());
        }
    }
}

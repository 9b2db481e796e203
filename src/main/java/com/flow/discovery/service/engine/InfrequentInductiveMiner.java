package com.flow.discovery.service.engine;

import com.flow.discovery.service.cut.Cut;
import com.flow.discovery.service.cut.CutSearch;
import com.flow.discovery.service.graph.DirectlyFollowsGraph;
import com.flow.discovery.service.log.EventLog;
import com.flow.discovery.service.split.LogSplitter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Inductive Miner that searches cuts on a noise-filtered graph first.
 *
 * At every level, edges lighter than {@code noiseThreshold} times the heaviest
 * edge of the current sub-log are ignored. Without a cut on the filtered
 * graph the unfiltered graph is searched before falling through. Cuts of
 * the filtered graph whose split would empty a sub-log or lose an activity
 * are skipped. A noise
 * threshold of zero mines exactly like {@link InductiveMiner}.
 */
@Slf4j
public class InfrequentInductiveMiner extends InductiveMiner {

    private final NoiseFilter noiseFilter;

    public InfrequentInductiveMiner(MiningCache cache, CutSearch cutSearch, LogSplitter splitter,
                                    NoiseFilter noiseFilter) {
        super(cache, cutSearch, splitter);
        this.noiseFilter = noiseFilter;
    }

    @Override
    public Algorithm algorithm() {
        return Algorithm.INFREQUENT;
    }

    @Override
    protected Optional<CutDecision> decideCut(EventLog eventLog, MiningParameters parameters, MiningRun run) {
        DirectlyFollowsGraph full = cache.graph(eventLog);
        if (parameters.noiseThreshold() > 0) {
            DirectlyFollowsGraph filtered = noiseFilter.filter(eventLog, parameters.noiseThreshold());
            if (filtered.edgeCount() < full.edgeCount()) {
                Optional<CutDecision> decision = cutSearch.findFirst(filtered,
                        cut -> splitKeepingEveryActivity(eventLog, cut));
                if (decision.isPresent()) {
                    run.filteredCut();
                    log.debug("Cut found after dropping {} infrequent edges",
                            full.edgeCount() - filtered.edgeCount());
                    return decision;
                }
            }
        }
        return cutSearch.findCut(full)
                .map(cut -> new CutDecision(cut, eventLog, splitter.split(eventLog, cut)));
    }

    /**
     * Splits the log along a cut found on the filtered graph. The split is
     * rejected when a sub-log is empty or an activity of the log is lost,
     * which happens when filtering isolated an activity that traces still
     * share with other parts.
     */
    private Optional<CutDecision> splitKeepingEveryActivity(EventLog eventLog, Cut cut) {
        List<EventLog> subLogs = splitter.split(eventLog, cut);
        var retained = new TreeSet<String>();
        for (EventLog subLog : subLogs) {
            if (subLog.isEmpty()) {
                log.debug("Rejected filtered {} cut: empty sub-log", cut.type());
                return Optional.empty();
            }
            retained.addAll(subLog.alphabet());
        }
        if (!retained.equals(eventLog.alphabet())) {
            log.debug("Rejected filtered {} cut: loses activities", cut.type());
            return Optional.empty();
        }
        return Optional.of(new CutDecision(cut, eventLog, subLogs));
    }
}

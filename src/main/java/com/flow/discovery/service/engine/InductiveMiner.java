package com.flow.discovery.service.engine;

import com.flow.discovery.service.cut.CutSearch;
import com.flow.discovery.service.log.EventLog;
import com.flow.discovery.service.split.LogSplitter;
import com.flow.discovery.service.tree.ProcessTree;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Recursive Inductive Miner.
 *
 * Each level tries, in order: base cases, a cut on the directly-follows graph
 * (only when the log has no empty trace) and the fallthroughs. Branches deeper
 * than the configured ceiling become flower models. Variants override
 * {@link #decideCut} and {@link #prepare}.
 */
@Slf4j
public class InductiveMiner {

    protected final MiningCache cache;
    protected final CutSearch cutSearch;
    protected final LogSplitter splitter;

    public InductiveMiner(MiningCache cache, CutSearch cutSearch, LogSplitter splitter) {
        this.cache = cache;
        this.cutSearch = cutSearch;
        this.splitter = splitter;
    }

    public Algorithm algorithm() {
        return Algorithm.INDUCTIVE;
    }

    // ==================== Entry Points ====================

    public ProcessTree mine(EventLog eventLog, MiningParameters parameters) {
        return mine(eventLog, parameters, new MiningRun());
    }

    public ProcessTree mine(EventLog eventLog, MiningParameters parameters, MiningRun run) {
        EventLog prepared = prepare(eventLog, parameters, run);
        return mineRecursive(prepared, 1, parameters, run);
    }

    /**
     * Hook for variants that rewrite the log once before mining.
     */
    protected EventLog prepare(EventLog eventLog, MiningParameters parameters, MiningRun run) {
        return eventLog;
    }

    // ==================== Recursion ====================

    protected ProcessTree mineRecursive(EventLog eventLog, int depth, MiningParameters parameters, MiningRun run) {
        run.enter(depth);
        if (depth > parameters.maxRecursionDepth()) {
            run.depthLimitHit();
            log.warn("Recursion depth {} exceeds ceiling {}; using flower model over {} activities",
                    depth, parameters.maxRecursionDepth(), eventLog.alphabet().size());
            return flower(eventLog, run);
        }

        Optional<ProcessTree> base = baseCase(eventLog);
        if (base.isPresent()) {
            run.baseCase();
            return base.get();
        }

        if (!eventLog.containsEmptyTrace()) {
            Optional<CutDecision> decision;
            try {
                decision = decideCut(eventLog, parameters, run);
            } catch (RuntimeException e) {
                run.degraded();
                log.error("Cut detection failed on a log with {} variants; using flower model", eventLog.size(), e);
                return flower(eventLog, run);
            }
            if (decision.isPresent()) {
                return applyCut(decision.get(), depth, parameters, run);
            }
        }

        return fallthrough(eventLog, depth, parameters, run);
    }

    /**
     * Zero traces or only the empty trace yield tau; a single one-activity
     * trace yields that activity.
     */
    protected Optional<ProcessTree> baseCase(EventLog eventLog) {
        if (eventLog.isEmpty()) {
            return Optional.of(ProcessTree.tau());
        }
        if (eventLog.size() == 1) {
            List<String> trace = eventLog.traces().keySet().iterator().next();
            if (trace.isEmpty()) {
                return Optional.of(ProcessTree.tau());
            }
            if (trace.size() == 1) {
                return Optional.of(ProcessTree.activity(trace.get(0)));
            }
        }
        return Optional.empty();
    }

    /**
     * Finds a cut on the log's directly-follows graph and splits the log along it.
     */
    protected Optional<CutDecision> decideCut(EventLog eventLog, MiningParameters parameters, MiningRun run) {
        return cutSearch.findCut(cache.graph(eventLog))
                .map(cut -> new CutDecision(cut, eventLog, splitter.split(eventLog, cut)));
    }

    protected ProcessTree applyCut(CutDecision decision, int depth, MiningParameters parameters, MiningRun run) {
        run.cut(decision.cut().type());
        log.debug("Depth {}: {} cut into {} parts", depth, decision.cut().type(), decision.cut().size());
        var children = new ArrayList<ProcessTree>(decision.subLogs().size());
        for (EventLog subLog : decision.subLogs()) {
            children.add(mineRecursive(subLog, depth + 1, parameters, run));
        }
        return ProcessTree.of(decision.cut().type().operator(), children);
    }

    // ==================== Fallthrough ====================

    protected ProcessTree fallthrough(EventLog eventLog, int depth, MiningParameters parameters, MiningRun run) {
        run.fallthrough();
        if (eventLog.containsEmptyTrace()) {
            log.debug("Depth {}: empty trace fallthrough", depth);
            return ProcessTree.xor(ProcessTree.tau(),
                    mineRecursive(eventLog.withoutEmptyTrace(), depth + 1, parameters, run));
        }
        var alphabet = eventLog.alphabet();
        if (alphabet.size() == 1) {
            String activity = alphabet.first();
            if (eventLog.hasRepeatedActivity(activity)) {
                log.debug("Depth {}: single activity {} repeats", depth, activity);
                return ProcessTree.loop(ProcessTree.activity(activity), ProcessTree.tau());
            }
            return ProcessTree.activity(activity);
        }
        log.debug("Depth {}: no cut over {} activities; flower model", depth, alphabet.size());
        return flower(eventLog, run);
    }

    protected ProcessTree flower(EventLog eventLog, MiningRun run) {
        run.flowerModel();
        return ProcessTree.flower(eventLog.alphabet());
    }
}

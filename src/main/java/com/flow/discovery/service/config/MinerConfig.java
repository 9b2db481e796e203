package com.flow.discovery.service.config;

import com.flow.discovery.service.cut.CutSearch;
import com.flow.discovery.service.engine.ActivityBinner;
import com.flow.discovery.service.engine.ApproximateInductiveMiner;
import com.flow.discovery.service.engine.ApproximationOptions;
import com.flow.discovery.service.engine.CutQualityValidator;
import com.flow.discovery.service.engine.InductiveMiner;
import com.flow.discovery.service.engine.InfrequentInductiveMiner;
import com.flow.discovery.service.engine.LogSampler;
import com.flow.discovery.service.engine.MiningCache;
import com.flow.discovery.service.engine.NoiseFilter;
import com.flow.discovery.service.split.LogSplitter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the mining engine.
 *
 * Creates the cache, the cut search and the three miners as Spring beans.
 */
@Slf4j
@Configuration
public class MinerConfig {

    /**
     * Shared memoization of graphs, filtered graphs, binnings and filtered logs.
     */
    @Bean
    public MiningCache miningCache(DiscoveryConfig config) {
        log.info("Initializing MiningCache (maxEntries={} per region)", config.getCache().getMaxEntries());
        return new MiningCache(config.getCache().getMaxEntries());
    }

    /**
     * Exclusive, sequence, parallel and loop detectors in priority order.
     */
    @Bean
    public CutSearch cutSearch() {
        log.info("Initializing CutSearch");
        return CutSearch.standard();
    }

    @Bean
    public LogSplitter logSplitter() {
        log.info("Initializing LogSplitter");
        return new LogSplitter();
    }

    @Bean
    public NoiseFilter noiseFilter(MiningCache miningCache) {
        log.info("Initializing NoiseFilter");
        return new NoiseFilter(miningCache);
    }

    @Bean
    public InductiveMiner inductiveMiner(MiningCache miningCache, CutSearch cutSearch, LogSplitter logSplitter) {
        log.info("Initializing InductiveMiner");
        return new InductiveMiner(miningCache, cutSearch, logSplitter);
    }

    @Bean
    public InfrequentInductiveMiner infrequentInductiveMiner(MiningCache miningCache, CutSearch cutSearch,
                                                             LogSplitter logSplitter, NoiseFilter noiseFilter) {
        log.info("Initializing InfrequentInductiveMiner");
        return new InfrequentInductiveMiner(miningCache, cutSearch, logSplitter, noiseFilter);
    }

    /**
     * Approximate miner with strict and relaxed cut validation.
     */
    @Bean
    public ApproximateInductiveMiner approximateInductiveMiner(DiscoveryConfig config, MiningCache miningCache,
                                                               CutSearch cutSearch, LogSplitter logSplitter,
                                                               NoiseFilter noiseFilter) {
        var approximate = config.getApproximate();
        var options = new ApproximationOptions(
                approximate.isBinningEnabled(),
                approximate.isSimplificationEnabled(),
                approximate.isValidationEnabled());
        log.info("Initializing ApproximateInductiveMiner ({})", options);
        return new ApproximateInductiveMiner(
                miningCache,
                cutSearch,
                logSplitter,
                noiseFilter,
                new ActivityBinner(approximate.getSimilarityThreshold()),
                new LogSampler(approximate.getSampleSeed()),
                new CutQualityValidator("strict",
                        approximate.getStrict().getTolerance(),
                        approximate.getStrict().getPreservationThreshold()),
                new CutQualityValidator("relaxed",
                        approximate.getRelaxed().getTolerance(),
                        approximate.getRelaxed().getPreservationThreshold()),
                options);
    }
}

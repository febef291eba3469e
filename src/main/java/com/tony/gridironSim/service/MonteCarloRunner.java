package com.tony.gridironSim.service;

import com.tony.gridironSim.config.EngineConfig;
import com.tony.gridironSim.engine.GameSimulator;
import com.tony.gridironSim.engine.TrialSeeds;
import com.tony.gridironSim.model.sim.SimulationBatch;
import com.tony.gridironSim.model.sim.SimulationRequest;
import com.tony.gridironSim.model.sim.SimulationTrial;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.SplittableRandom;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lance N essais indépendants sur le pool de simulation.
 * Chaque essai a sa graine dérivée de (graine batch, index) : avec une graine fixe,
 * deux exécutions donnent exactement le même batch, quel que soit l'ordonnancement.
 */
@Service
@Slf4j
public class MonteCarloRunner {

    static final int CHUNK_SIZE = 250;
    private static final SecureRandom SEED_SOURCE = new SecureRandom();

    private final ExecutorService executor;
    private final SimulationAggregator aggregator;

    public MonteCarloRunner(@Qualifier("simulationExecutor") ExecutorService executor,
                            SimulationAggregator aggregator) {
        this.executor = executor;
        this.aggregator = aggregator;
    }

    public SimulationBatch run(SimulationRequest request) {
        EngineConfig config = request.getConfig();
        int n = config.getTrials();
        if (n <= 0) {
            throw new IllegalArgumentException("Nombre d'essais invalide : " + n);
        }
        long batchSeed = request.getSeed() != null ? request.getSeed() : SEED_SOURCE.nextLong();
        GameSimulator simulator = GameSimulator.forConfig(config);

        Duration budget = config.getWallClockBudget();
        long budgetNanos = budget == null ? Long.MAX_VALUE : budget.toNanos();
        long startNanos = System.nanoTime();
        AtomicBoolean outOfTime = new AtomicBoolean(false);

        SimulationTrial[] results = new SimulationTrial[n];
        List<Callable<Void>> chunks = new ArrayList<>();
        for (int from = 0; from < n; from += CHUNK_SIZE) {
            int start = from;
            int end = Math.min(n, from + CHUNK_SIZE);
            chunks.add(() -> {
                for (int i = start; i < end; i++) {
                    if (outOfTime.get() || System.nanoTime() - startNanos >= budgetNanos) {
                        outOfTime.set(true);
                        return null;
                    }
                    results[i] = simulator.simulate(i, request, new SplittableRandom(TrialSeeds.forTrial(batchSeed, i)));
                }
                return null;
            });
        }

        try {
            for (Future<Void> f : executor.invokeAll(chunks)) {
                f.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Simulation interrompue", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Échec d'un essai de simulation", e.getCause());
        }

        boolean truncated = outOfTime.get();
        long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
        if (truncated) {
            log.warn("⏱️ Budget de {} dépassé : batch partiel {} vs {}", budget,
                    request.getHome().getTeamCode(), request.getAway().getTeamCode());
        }
        SimulationBatch batch = aggregator.aggregate(request, batchSeed, results, truncated);
        log.info("🎲 {} @ {} : {} essais en {} ms, marge moy. {}, total moy. {}, graine {}",
                request.getAway().getTeamCode(), request.getHome().getTeamCode(),
                batch.getCompletedTrials(), elapsedMs,
                String.format("%.2f", batch.getMarginMean()), String.format("%.2f", batch.getTotalMean()), batchSeed);
        return batch;
    }
}

package com.tony.gridironSim.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@Slf4j
public class SimulationExecutorConfig {

    /**
     * Pool fixe dédié aux essais Monte Carlo.
     * Aucun état partagé entre essais : chaque tâche possède son GameState et son RNG.
     */
    @Bean(name = "simulationExecutor", destroyMethod = "shutdown")
    public ExecutorService simulationExecutor(SimulationProperties properties) {
        int threads = properties.getWorkerThreads() > 0
                ? properties.getWorkerThreads()
                : Runtime.getRuntime().availableProcessors();
        log.info("🧵 Pool de simulation : {} threads", threads);

        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread t = new Thread(runnable, "sim-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newFixedThreadPool(threads, factory);
    }
}

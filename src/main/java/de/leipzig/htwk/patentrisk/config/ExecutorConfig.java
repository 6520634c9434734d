package de.leipzig.htwk.patentrisk.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/**
 * Thread pools of the engine.
 * <ul>
 *   <li>claimMatrixExecutor: CPU-bound similarity matrix rows, kept off the request threads</li>
 *   <li>collaboratorExecutor: blocking calls to embedding, vector index and explanation services</li>
 *   <li>requestExecutor: long-running comparisons served through DeferredResult so a client
 *       disconnect can interrupt them</li>
 * </ul>
 */
@Configuration
public class ExecutorConfig {

    @Bean(name = "claimMatrixExecutor", destroyMethod = "shutdown")
    public ExecutorService claimMatrixExecutor(RiskEngineConfig config) {
        return Executors.newFixedThreadPool(config.getMatrixThreads(), new CustomizableThreadFactory("claim-matrix-"));
    }

    @Bean(name = "collaboratorExecutor", destroyMethod = "shutdownNow")
    public ExecutorService collaboratorExecutor(RiskEngineConfig config) {
        return Executors.newFixedThreadPool(config.getCollaboratorThreads(), new CustomizableThreadFactory("collaborator-"));
    }

    @Bean(name = "requestExecutor", destroyMethod = "shutdownNow")
    public ExecutorService requestExecutor(RiskEngineConfig config) {
        return Executors.newFixedThreadPool(config.getRequestThreads(), new CustomizableThreadFactory("risk-request-"));
    }
}

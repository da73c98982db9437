package com.flagship.swap_coordinator.config;

import com.flagship.swap_coordinator.coordinator.SessionTimers;
import com.flagship.swap_coordinator.coordinator.SessionWorkers;
import com.flagship.swap_coordinator.coordinator.TimelockPolicy;
import com.flagship.swap_coordinator.ledger.RetryBackoff;
import com.flagship.swap_coordinator.secret.SecretSealer;
import com.flagship.swap_coordinator.session.SessionPolicy;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Wires the coordination core: session rules, timelocks, retry budget,
 * secret sealing and the thread pools everything runs on.
 *
 * Thread pools:
 * - sessionWorkerExecutor runs the per-session mailboxes
 * - ledgerIoExecutor runs blocking calls to the ledger gateways
 * - taskScheduler runs session timers, retries, observer polls and the
 *   {@code @Scheduled} jobs
 */
@Configuration
@EnableScheduling
public class CoordinatorConfig {

    static final Pattern EVM_ADDRESS = Pattern.compile("^0x[a-fA-F0-9]{40}$");
    static final Pattern NEAR_ACCOUNT =
            Pattern.compile("^(?=.{2,64}$)(([a-z\\d]+[-_])*[a-z\\d]+\\.)*([a-z\\d]+[-_])*[a-z\\d]+$");

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SessionPolicy sessionPolicy(
            @Value("${swap.chains.source:base,ethereum,polygon}") List<String> sourceChains,
            @Value("${swap.chains.destination:near}") List<String> destinationChains,
            @Value("${swap.chains.evm:base,ethereum,polygon}") List<String> evmChains,
            @Value("${swap.chains.near:near}") List<String> nearChains,
            @Value("${swap.session.ttl:1h}") Duration ttl,
            @Value("${swap.session.estimated-completion:5m}") Duration estimatedCompletion,
            @Value("${swap.session.max-active:1000}") int maxActiveSessions,
            @Value("${swap.fees.protocol-bps:30}") int protocolFeeBps,
            @Value("#{${swap.fees.network:{:}}}") Map<String, String> networkFees) {

        SessionPolicy.SessionPolicyBuilder builder = SessionPolicy.builder()
                .sourceChains(sourceChains)
                .destinationChains(destinationChains)
                .ttl(ttl)
                .estimatedCompletion(estimatedCompletion)
                .maxActiveSessions(maxActiveSessions)
                .protocolFeeBps(protocolFeeBps)
                .networkFees(networkFees);
        for (String chain : evmChains) {
            builder.tokenPattern(chain, EVM_ADDRESS).addressPattern(chain, EVM_ADDRESS);
        }
        for (String chain : nearChains) {
            builder.tokenPattern(chain, NEAR_ACCOUNT).addressPattern(chain, NEAR_ACCOUNT);
        }
        return builder.build();
    }

    @Bean
    public TimelockPolicy timelockPolicy(
            @Value("${swap.timelocks.source-window:15m}") Duration sourceWindow,
            @Value("${swap.timelocks.destination-window:14m}") Duration destinationWindow,
            @Value("${swap.timelocks.cancellation-margin:1m}") Duration cancellationMargin) {
        return new TimelockPolicy(sourceWindow, destinationWindow, cancellationMargin);
    }

    @Bean
    public RetryBackoff retryBackoff(
            @Value("${swap.retry.initial-delay:1s}") Duration initialDelay,
            @Value("${swap.retry.factor:2.0}") double factor,
            @Value("${swap.retry.max-delay:5s}") Duration maxDelay,
            @Value("${swap.retry.max-attempts:4}") int maxAttempts) {
        return new RetryBackoff(initialDelay, factor, maxDelay, maxAttempts);
    }

    @Bean
    public SecretSealer secretSealer(@Value("${swap.session-store:jpa}") String sessionStore,
                                     @Value("${swap.secrets.encryption-key:}") String encryptionKey) {
        return SecretSealer.forStore(sessionStore, encryptionKey);
    }

    @Bean
    public ThreadPoolTaskExecutor sessionWorkerExecutor(
            @Value("${swap.workers.core-size:8}") int coreSize,
            @Value("${swap.workers.max-size:32}") int maxSize,
            @Value("${swap.workers.queue-capacity:10000}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("session-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        return executor;
    }

    @Bean
    public ThreadPoolTaskExecutor ledgerIoExecutor(
            @Value("${swap.ledger-io.core-size:4}") int coreSize,
            @Value("${swap.ledger-io.max-size:16}") int maxSize,
            @Value("${swap.ledger-io.queue-capacity:1000}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("ledger-io-");
        return executor;
    }

    /**
     * Named {@code taskScheduler} so that {@code @Scheduled} methods run on it
     * too.
     */
    @Bean
    public ThreadPoolTaskScheduler taskScheduler(Clock clock,
                                                 @Value("${swap.scheduler.pool-size:4}") int poolSize) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(poolSize);
        scheduler.setThreadNamePrefix("swap-scheduler-");
        scheduler.setClock(clock);
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }

    @Bean
    public SessionWorkers sessionWorkers(@Qualifier("sessionWorkerExecutor") ThreadPoolTaskExecutor executor) {
        return new SessionWorkers(executor);
    }

    @Bean
    public SessionTimers sessionTimers(TaskScheduler taskScheduler) {
        return new SessionTimers(taskScheduler);
    }
}

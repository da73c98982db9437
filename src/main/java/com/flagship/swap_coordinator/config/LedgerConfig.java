package com.flagship.swap_coordinator.config;

import com.flagship.swap_coordinator.ledger.EscrowLedgerClient;
import com.flagship.swap_coordinator.ledger.EscrowLedgers;
import com.flagship.swap_coordinator.ledger.HttpEscrowLedgerClient;
import com.flagship.swap_coordinator.ledger.RetryBackoff;
import com.flagship.swap_coordinator.observability.SwapMetrics;
import com.flagship.swap_coordinator.observer.ChainObserver;
import com.flagship.swap_coordinator.observer.ChainObserverLifecycle;
import com.flagship.swap_coordinator.observer.LedgerEventListener;
import com.flagship.swap_coordinator.observer.PollingChainObserver;
import com.flagship.swap_coordinator.observer.SubscribingChainObserver;
import com.flagship.swap_coordinator.session.ChainRole;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Connects the coordinator to the two ledgers.
 *
 * Each role gets an {@link HttpEscrowLedgerClient} pointed at its ledger
 * gateway and, unless {@code swap.observer.enabled=false}, a chain observer
 * in the mode chosen by {@code swap.observer.mode}:
 * - polling (default): the observer reads the gateway on a timer
 * - subscription: raw events arrive through Kafka, see {@code LedgerEventConsumer}
 */
@Configuration
@Slf4j
public class LedgerConfig {

    @Bean
    public EscrowLedgers escrowLedgers(
            RestClient.Builder restClientBuilder,
            @Qualifier("ledgerIoExecutor") ThreadPoolTaskExecutor ledgerIoExecutor,
            @Value("${swap.ledgers.source.chain-id:base}") String sourceChainId,
            @Value("${swap.ledgers.source.base-url:http://localhost:8545}") String sourceBaseUrl,
            @Value("${swap.ledgers.destination.chain-id:near}") String destinationChainId,
            @Value("${swap.ledgers.destination.base-url:http://localhost:3030}") String destinationBaseUrl,
            @Value("${swap.ledgers.request-timeout:10s}") Duration requestTimeout) {

        EscrowLedgerClient source = httpClient(ChainRole.SOURCE, sourceChainId, sourceBaseUrl,
                restClientBuilder, ledgerIoExecutor, requestTimeout);
        EscrowLedgerClient destination = httpClient(ChainRole.DESTINATION, destinationChainId, destinationBaseUrl,
                restClientBuilder, ledgerIoExecutor, requestTimeout);
        log.info("Ledger gateways: source {} at {}, destination {} at {}",
                sourceChainId, sourceBaseUrl, destinationChainId, destinationBaseUrl);
        return new EscrowLedgers(source, destination);
    }

    private static EscrowLedgerClient httpClient(ChainRole role, String chainId, String baseUrl,
                                                 RestClient.Builder builder, ThreadPoolTaskExecutor executor,
                                                 Duration timeout) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(timeout);
        requestFactory.setReadTimeout(timeout);
        RestClient restClient = builder.clone()
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .build();
        return new HttpEscrowLedgerClient(role, chainId, restClient, executor);
    }

    @Bean
    @ConditionalOnProperty(name = "swap.observer.enabled", havingValue = "true", matchIfMissing = true)
    public ChainObserverLifecycle chainObserverLifecycle(List<ChainObserver> observers) {
        return new ChainObserverLifecycle(observers);
    }

    @Configuration
    @ConditionalOnProperty(name = "swap.observer.enabled", havingValue = "true", matchIfMissing = true)
    static class ObserverSettings {

        @Value("${swap.ledgers.source.confirmation-depth:3}")
        int sourceDepth;

        @Value("${swap.ledgers.destination.confirmation-depth:3}")
        int destinationDepth;

        @Value("${swap.observer.stale-after:2m}")
        Duration staleAfter;

        @Value("${swap.observer.replay-window:100}")
        long replayWindow;

        int depth(ChainRole role) {
            return role == ChainRole.SOURCE ? sourceDepth : destinationDepth;
        }
    }

    @Configuration
    @ConditionalOnExpression("${swap.observer.enabled:true} and '${swap.observer.mode:polling}' == 'polling'")
    static class PollingObservers {

        @Bean
        public PollingChainObserver sourceObserver(EscrowLedgers ledgers, LedgerEventListener listener,
                                                   SwapMetrics metrics, Clock clock, TaskScheduler taskScheduler,
                                                   RetryBackoff backoff, ObserverSettings settings,
                                                   @Value("${swap.observer.poll-interval:5s}") Duration pollInterval,
                                                   @Value("${swap.observer.max-blocks-per-poll:500}") int maxBlocks) {
            return polling(ChainRole.SOURCE, ledgers, listener, metrics, clock, taskScheduler, backoff, settings,
                    pollInterval, maxBlocks);
        }

        @Bean
        public PollingChainObserver destinationObserver(EscrowLedgers ledgers, LedgerEventListener listener,
                                                        SwapMetrics metrics, Clock clock,
                                                        TaskScheduler taskScheduler, RetryBackoff backoff,
                                                        ObserverSettings settings,
                                                        @Value("${swap.observer.poll-interval:5s}") Duration pollInterval,
                                                        @Value("${swap.observer.max-blocks-per-poll:500}") int maxBlocks) {
            return polling(ChainRole.DESTINATION, ledgers, listener, metrics, clock, taskScheduler, backoff, settings,
                    pollInterval, maxBlocks);
        }

        private static PollingChainObserver polling(ChainRole role, EscrowLedgers ledgers,
                                                    LedgerEventListener listener, SwapMetrics metrics, Clock clock,
                                                    TaskScheduler scheduler, RetryBackoff backoff,
                                                    ObserverSettings settings, Duration pollInterval, int maxBlocks) {
            return new PollingChainObserver(ledgers.forRole(role), settings.depth(role), listener, metrics, clock,
                    settings.staleAfter, scheduler, pollInterval, maxBlocks, settings.replayWindow, backoff);
        }
    }

    @Configuration
    @ConditionalOnExpression("${swap.observer.enabled:true} and '${swap.observer.mode:polling}' == 'subscription'")
    static class SubscribingObservers {

        @Bean
        public SubscribingChainObserver sourceObserver(EscrowLedgers ledgers, LedgerEventListener listener,
                                                       SwapMetrics metrics, Clock clock, ObserverSettings settings) {
            return new SubscribingChainObserver(ledgers.forRole(ChainRole.SOURCE), settings.depth(ChainRole.SOURCE),
                    listener, metrics, clock, settings.staleAfter, settings.replayWindow);
        }

        @Bean
        public SubscribingChainObserver destinationObserver(EscrowLedgers ledgers, LedgerEventListener listener,
                                                            SwapMetrics metrics, Clock clock,
                                                            ObserverSettings settings) {
            return new SubscribingChainObserver(ledgers.forRole(ChainRole.DESTINATION),
                    settings.depth(ChainRole.DESTINATION), listener, metrics, clock, settings.staleAfter,
                    settings.replayWindow);
        }
    }
}

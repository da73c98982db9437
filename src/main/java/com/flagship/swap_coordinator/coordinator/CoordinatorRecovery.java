package com.flagship.swap_coordinator.coordinator;

import com.flagship.swap_coordinator.session.SessionFilter;
import com.flagship.swap_coordinator.session.SessionStore;
import com.flagship.swap_coordinator.session.StepName;
import com.flagship.swap_coordinator.session.StepStatus;
import com.flagship.swap_coordinator.session.SwapSession;
import com.flagship.swap_coordinator.session.SwapStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Re-arms timers and resumes pending ledger work for every session that was
 * still in flight when the process stopped. Timers and retries live only in
 * memory; the store is the source of truth for everything else.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CoordinatorRecovery {

    private final SessionStore store;
    private final CrossChainCoordinator coordinator;

    @EventListener(ApplicationReadyEvent.class)
    public void recoverOnStartup() {
        int recovered = recoverAll();
        log.info("Recovered {} in-flight sessions", recovered);
    }

    public int recoverAll() {
        List<SwapSession> pending = new ArrayList<>(store.list(SessionFilter.active()));
        store.list(SessionFilter.builder()
                        .statuses(Set.of(SwapStatus.EXPIRED))
                        .limit(Integer.MAX_VALUE)
                        .build())
                .stream()
                .filter(session -> session.stepStatus(StepName.REFUND) != StepStatus.COMPLETED)
                .forEach(pending::add);
        // locks that landed after cancellation and are still waiting on a refund
        store.list(SessionFilter.builder()
                        .statuses(Set.of(SwapStatus.CANCELLED))
                        .limit(Integer.MAX_VALUE)
                        .build())
                .stream()
                .filter(session -> !session.getSourceLeg().getState().isSettled()
                        || !session.getDestinationLeg().getState().isSettled())
                .forEach(pending::add);

        pending.forEach(session -> coordinator.recover(session.getSessionId()));
        return pending.size();
    }
}

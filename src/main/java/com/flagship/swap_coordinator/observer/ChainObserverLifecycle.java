package com.flagship.swap_coordinator.observer;

import lombok.RequiredArgsConstructor;
import org.springframework.context.SmartLifecycle;

import java.util.List;

/**
 * Starts the chain observers after the rest of the context is up and stops
 * them first on shutdown.
 */
@RequiredArgsConstructor
public class ChainObserverLifecycle implements SmartLifecycle {

    private final List<ChainObserver> observers;
    private volatile boolean running;

    @Override
    public void start() {
        observers.forEach(ChainObserver::start);
        running = true;
    }

    @Override
    public void stop() {
        observers.forEach(ChainObserver::stop);
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE - 100;
    }
}

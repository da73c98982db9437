package com.flagship.swap_coordinator.observer;

import com.flagship.swap_coordinator.session.ChainRole;
import lombok.Value;

import java.time.Instant;

@Value
public class ObserverHealth {
    ChainRole role;
    String chainId;
    String mode;
    boolean running;
    long lastScannedHeight;
    Instant lastSuccessAt;
    int consecutiveFailures;
    boolean stale;
}

package com.flagship.swap_coordinator.session;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Creation rules and quotes applied to every new session. Assembled from
 * configuration in {@code CoordinatorConfig}.
 */
@Value
@Builder
public class SessionPolicy {
    @Singular
    Set<String> sourceChains;
    @Singular
    Set<String> destinationChains;
    /** Token identifier format per chain; chains without an entry accept any non-blank value. */
    @Singular
    Map<String, Pattern> tokenPatterns;
    /** Party identity format per chain, same rule as tokens. */
    @Singular
    Map<String, Pattern> addressPatterns;
    Duration ttl;
    Duration estimatedCompletion;
    int maxActiveSessions;
    int protocolFeeBps;
    @Singular
    Map<String, String> networkFees;
}

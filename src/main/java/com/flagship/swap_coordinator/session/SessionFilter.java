package com.flagship.swap_coordinator.session;

import lombok.Builder;
import lombok.Value;

import java.util.EnumSet;
import java.util.Set;

/**
 * Read-only listing criteria. An empty status set means any status.
 */
@Value
@Builder
public class SessionFilter {
    @Builder.Default
    Set<SwapStatus> statuses = Set.of();
    String maker;
    String taker;
    @Builder.Default
    int limit = 50;
    @Builder.Default
    int offset = 0;

    public static SessionFilter all() {
        return SessionFilter.builder().build();
    }

    public static SessionFilter active() {
        return SessionFilter.builder()
                .statuses(EnumSet.complementOf(
                        EnumSet.of(SwapStatus.COMPLETED, SwapStatus.CANCELLED, SwapStatus.EXPIRED)))
                .limit(Integer.MAX_VALUE)
                .build();
    }

    public boolean matches(SwapSession session) {
        return (statuses.isEmpty() || statuses.contains(session.getStatus()))
                && (maker == null || maker.equals(session.getMaker()))
                && (taker == null || taker.equals(session.getTaker()));
    }
}

package com.flagship.swap_coordinator.session;

import lombok.Value;

import java.math.BigInteger;
import java.util.Map;

/**
 * Fee breakdown quoted at session creation. Informational only; nothing in
 * the coordination path deducts these.
 */
@Value
public class SwapFees {
    int protocolFeeBps;
    BigInteger protocolFeeAmount;          // in source token base units
    Map<String, String> networkFees;       // chain id -> native fee estimate

    public static SwapFees quote(BigInteger sourceAmount, int protocolFeeBps, Map<String, String> networkFees) {
        BigInteger amount = sourceAmount
                .multiply(BigInteger.valueOf(protocolFeeBps))
                .divide(BigInteger.valueOf(10_000));
        return new SwapFees(protocolFeeBps, amount, Map.copyOf(networkFees));
    }
}

package com.flagship.swap_coordinator.coordinator;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * The maker's consent to execute a session: the signing address, the
 * signature and the order fields it covers. The signature is passed through
 * to the source ledger, which verifies it.
 */
@Value
@Builder
public class SwapAuthorization {
    String signer;
    String signature;
    @Singular("orderField")
    Map<String, String> order;
}

package com.flagship.swap_coordinator.session;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

/**
 * Parameters of a new swap as requested by the maker. Validated by
 * {@link SessionStore#create}.
 */
@Value
@Builder(toBuilder = true)
public class CreateSessionParams {
    String sourceChain;
    String destinationChain;
    String sourceToken;
    String destinationToken;
    BigInteger sourceAmount;
    BigInteger destinationAmount;
    String maker;
    String taker;
    Integer slippageToleranceBps;
}

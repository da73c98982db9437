package com.flagship.swap_coordinator.session.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.swap_coordinator.session.CreateSessionParams;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigInteger;

/**
 * Request DTO for opening a swap session.
 *
 * Only shape is checked here. Chain support, identifier formats and party
 * rules are enforced by {@code SessionStore}.
 */
@Value
@Builder
@Jacksonized
public class CreateSessionRequest {

    @NotBlank(message = "Source chain is required")
    @JsonProperty("source_chain")
    String sourceChain;

    @NotBlank(message = "Destination chain is required")
    @JsonProperty("destination_chain")
    String destinationChain;

    @NotBlank(message = "Source token is required")
    @JsonProperty("source_token")
    String sourceToken;

    @NotBlank(message = "Destination token is required")
    @JsonProperty("destination_token")
    String destinationToken;

    @NotBlank(message = "Source amount is required")
    @Pattern(regexp = "^\\d+$", message = "Source amount must be an integer in base units")
    @JsonProperty("source_amount")
    String sourceAmount;

    @NotBlank(message = "Destination amount is required")
    @Pattern(regexp = "^\\d+$", message = "Destination amount must be an integer in base units")
    @JsonProperty("destination_amount")
    String destinationAmount;

    @NotBlank(message = "Maker is required")
    @JsonProperty("maker")
    String maker;

    @NotBlank(message = "Taker is required")
    @JsonProperty("taker")
    String taker;

    @NotNull(message = "Slippage tolerance is required")
    @Min(value = 0, message = "Slippage tolerance must be at least 0")
    @Max(value = 10000, message = "Slippage tolerance must be at most 10000 basis points")
    @JsonProperty("slippage_tolerance")
    Integer slippageTolerance;

    public CreateSessionParams toParams() {
        return CreateSessionParams.builder()
                .sourceChain(sourceChain)
                .destinationChain(destinationChain)
                .sourceToken(sourceToken)
                .destinationToken(destinationToken)
                .sourceAmount(new BigInteger(sourceAmount))
                .destinationAmount(new BigInteger(destinationAmount))
                .maker(maker)
                .taker(taker)
                .slippageToleranceBps(slippageTolerance)
                .build();
    }
}

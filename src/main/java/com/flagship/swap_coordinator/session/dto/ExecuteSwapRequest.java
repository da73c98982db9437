package com.flagship.swap_coordinator.session.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.swap_coordinator.coordinator.SwapAuthorization;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * Request DTO for starting a swap: the maker's signed limit order.
 *
 * The signature is carried through to the source lock request but is not
 * verified here.
 */
@Value
@Builder
@Jacksonized
public class ExecuteSwapRequest {

    @NotBlank(message = "Signer is required")
    @JsonProperty("signer")
    String signer;

    @NotNull(message = "Limit order is required")
    @Valid
    @JsonProperty("limit_order")
    LimitOrder limitOrder;

    @Pattern(regexp = "^(fast|secure)$", message = "Confirmation level must be fast or secure")
    @JsonProperty("confirmation_level")
    String confirmationLevel;

    public SwapAuthorization toAuthorization() {
        SwapAuthorization.SwapAuthorizationBuilder builder = SwapAuthorization.builder()
                .signer(signer)
                .signature(limitOrder.getSignature());
        if (limitOrder.getOrder() != null) {
            limitOrder.getOrder().forEach((field, value) -> builder.orderField(field, String.valueOf(value)));
        }
        return builder.build();
    }

    @Value
    @Builder
    @Jacksonized
    public static class LimitOrder {

        @JsonProperty("order")
        Map<String, Object> order;

        @NotBlank(message = "Signature is required")
        @Pattern(regexp = "^0x[a-fA-F0-9]+$", message = "Signature must be 0x-prefixed hex")
        @JsonProperty("signature")
        String signature;
    }
}

package uk.gegc.creditledger.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.UUID;

@Schema(name = "VerifyPaymentRequest", description = "Gateway return parameters relayed by the client")
public record VerifyPaymentRequest(
        @NotNull(message = "invoice_id is required")
        UUID invoiceId,

        @NotBlank(message = "external_ref is required")
        @Size(max = 255)
        String externalRef,

        @Schema(description = "Status reported by the gateway redirect; omitted means the client claims success",
                example = "success")
        @Size(max = 64)
        String gatewayStatus
) {}

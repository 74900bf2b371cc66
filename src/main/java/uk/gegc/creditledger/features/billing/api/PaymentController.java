package uk.gegc.creditledger.features.billing.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.creditledger.features.billing.api.dto.PaymentSessionDto;
import uk.gegc.creditledger.features.billing.api.dto.VerifyPaymentRequest;
import uk.gegc.creditledger.features.billing.api.dto.VerifyPaymentResponse;
import uk.gegc.creditledger.features.billing.application.PaymentSessionService;
import uk.gegc.creditledger.features.billing.application.ReconciliationService;
import uk.gegc.creditledger.shared.config.FeatureFlags;

import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/api/v1/payments")
@RequiredArgsConstructor
@Validated
@Tag(name = "Payments", description = "Payment verification and session status")
@SecurityRequirement(name = "Bearer Authentication")
public class PaymentController {

    private final ReconciliationService reconciliationService;
    private final PaymentSessionService paymentSessionService;
    private final FeatureFlags featureFlags;

    @Operation(
            summary = "Verify a payment",
            description = "Called when the user returns from the gateway. Safe to repeat: a payment is credited at most once."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Payment reconciled; see success and status",
                    content = @Content(schema = @Schema(implementation = VerifyPaymentResponse.class))),
            @ApiResponse(responseCode = "400", description = "Callback does not match a payment session",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "410", description = "Payment session expired",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "503", description = "Gateway unavailable; retry later",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/verify")
    public ResponseEntity<VerifyPaymentResponse> verifyPayment(@Valid @RequestBody VerifyPaymentRequest request,
                                                               Authentication authentication) {
        if (!featureFlags.isBilling()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).build();
        }
        UUID userId = BillingSecurityUtils.requireUserId(authentication);
        VerifyPaymentResponse response = reconciliationService.reconcile(
                new ReconciliationService.PaymentCallback(request.invoiceId(), request.externalRef(), request.gatewayStatus()),
                userId);
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "Get payment session", description = "Status of one of the caller's payment sessions")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Session retrieved",
                    content = @Content(schema = @Schema(implementation = PaymentSessionDto.class))),
            @ApiResponse(responseCode = "404", description = "Session not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/{invoiceId}")
    public ResponseEntity<PaymentSessionDto> getSession(
            @Parameter(description = "Invoice id returned when the session was opened") @PathVariable UUID invoiceId,
            Authentication authentication) {
        if (!featureFlags.isBilling()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).build();
        }
        UUID userId = BillingSecurityUtils.requireUserId(authentication);
        return ResponseEntity.ok(paymentSessionService.getSession(userId, invoiceId));
    }
}

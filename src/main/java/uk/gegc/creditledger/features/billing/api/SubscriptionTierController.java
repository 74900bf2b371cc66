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
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.creditledger.features.billing.api.dto.CheckoutResponse;
import uk.gegc.creditledger.features.billing.api.dto.PurchaseTierRequest;
import uk.gegc.creditledger.features.billing.api.dto.PurchaseTierResponse;
import uk.gegc.creditledger.features.billing.api.dto.SubscriptionTiersResponse;
import uk.gegc.creditledger.features.billing.api.dto.UpgradeQuoteDto;
import uk.gegc.creditledger.features.billing.application.PaymentSessionService;
import uk.gegc.creditledger.features.billing.application.SubscriptionTierService;
import uk.gegc.creditledger.features.billing.domain.model.BillingCycle;
import uk.gegc.creditledger.features.billing.infra.mapping.TierMapper;
import uk.gegc.creditledger.shared.config.FeatureFlags;

import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Validated
@Tag(name = "Subscription Tiers", description = "Tier catalog, upgrade quotes and tier purchases")
@SecurityRequirement(name = "Bearer Authentication")
public class SubscriptionTierController {

    private final SubscriptionTierService subscriptionTierService;
    private final PaymentSessionService paymentSessionService;
    private final TierMapper tierMapper;
    private final FeatureFlags featureFlags;

    @Operation(summary = "List subscription tiers", description = "Tier catalog with the caller's current tier and balance")
    @ApiResponse(responseCode = "200", description = "Tiers retrieved",
            content = @Content(schema = @Schema(implementation = SubscriptionTiersResponse.class)))
    @GetMapping("/subscription-tiers")
    public ResponseEntity<SubscriptionTiersResponse> getTiers(Authentication authentication) {
        if (!featureFlags.isBilling()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).build();
        }
        UUID userId = BillingSecurityUtils.requireUserId(authentication);
        return ResponseEntity.ok(subscriptionTierService.getTierOverview(userId));
    }

    @Operation(summary = "Quote an upgrade", description = "Prorated cost of moving to a higher tier, without buying it")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Quote computed",
                    content = @Content(schema = @Schema(implementation = UpgradeQuoteDto.class))),
            @ApiResponse(responseCode = "400", description = "Not an upgrade, unknown tier or invalid cycle",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/subscription-tiers/quote")
    public ResponseEntity<UpgradeQuoteDto> quote(
            @Parameter(description = "Tier level to upgrade to") @RequestParam("target_tier") int targetTier,
            @Parameter(description = "monthly or yearly") @RequestParam(defaultValue = "monthly") String cycle,
            Authentication authentication) {
        if (!featureFlags.isBilling()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).build();
        }
        UUID userId = BillingSecurityUtils.requireUserId(authentication);
        BillingCycle billingCycle = BillingCycle.parse(cycle);
        return ResponseEntity.ok(tierMapper.toDto(subscriptionTierService.quoteUpgrade(userId, targetTier, billingCycle)));
    }

    @Operation(summary = "Buy a tier with wallet credits", description = "Debits the prorated cost and upgrades in one step")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Upgraded",
                    content = @Content(schema = @Schema(implementation = PurchaseTierResponse.class))),
            @ApiResponse(responseCode = "400", description = "Not an upgrade or unknown tier",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "403", description = "Wallet is frozen",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Insufficient funds",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/purchase/subscription-tier")
    public ResponseEntity<PurchaseTierResponse> purchaseTier(@Valid @RequestBody PurchaseTierRequest request,
                                                             Authentication authentication) {
        if (!featureFlags.isBilling()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).build();
        }
        UUID userId = BillingSecurityUtils.requireUserId(authentication);
        return ResponseEntity.ok(subscriptionTierService.purchaseWithWallet(userId, request.targetTier(), request.isYearly()));
    }

    @Operation(
            summary = "Buy a tier through the payment gateway",
            description = "Opens a payment session for the prorated cost; the upgrade applies once the payment is verified."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Payment session opened",
                    content = @Content(schema = @Schema(implementation = CheckoutResponse.class))),
            @ApiResponse(responseCode = "400", description = "Not an upgrade or unknown tier",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "503", description = "Payment gateway unavailable",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/purchase/subscription-tier/checkout")
    public ResponseEntity<CheckoutResponse> checkoutTier(@Valid @RequestBody PurchaseTierRequest request,
                                                         Authentication authentication) {
        if (!featureFlags.isBilling()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).build();
        }
        UUID userId = BillingSecurityUtils.requireUserId(authentication);
        return ResponseEntity.ok(paymentSessionService.createTierUpgradeSession(userId, request.targetTier(), request.isYearly()));
    }
}

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
import jakarta.validation.constraints.Min;
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
import uk.gegc.creditledger.features.billing.api.dto.AddFundsRequest;
import uk.gegc.creditledger.features.billing.api.dto.CheckoutResponse;
import uk.gegc.creditledger.features.billing.api.dto.TransactionDto;
import uk.gegc.creditledger.features.billing.api.dto.TransactionPageDto;
import uk.gegc.creditledger.features.billing.api.dto.WalletDto;
import uk.gegc.creditledger.features.billing.api.dto.WithdrawRequest;
import uk.gegc.creditledger.features.billing.application.PaymentSessionService;
import uk.gegc.creditledger.features.billing.application.WalletLedgerService;
import uk.gegc.creditledger.features.billing.domain.model.TransactionSource;
import uk.gegc.creditledger.shared.config.FeatureFlags;

import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/api/v1/wallet")
@RequiredArgsConstructor
@Validated
@Tag(name = "Wallet", description = "Credit balance, transaction history, top-ups and withdrawals")
@SecurityRequirement(name = "Bearer Authentication")
public class WalletController {

    private final WalletLedgerService walletLedgerService;
    private final PaymentSessionService paymentSessionService;
    private final FeatureFlags featureFlags;

    @Operation(summary = "Get wallet", description = "Returns the caller's balance and lifetime totals")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Wallet retrieved",
                    content = @Content(schema = @Schema(implementation = WalletDto.class))),
            @ApiResponse(responseCode = "404", description = "Billing feature disabled",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping
    public ResponseEntity<WalletDto> getWallet(Authentication authentication) {
        if (!featureFlags.isBilling()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).build();
        }
        UUID userId = BillingSecurityUtils.requireUserId(authentication);
        return ResponseEntity.ok(walletLedgerService.getWallet(userId));
    }

    @Operation(summary = "List wallet transactions", description = "Newest first, 1-based pages")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Transactions retrieved",
                    content = @Content(schema = @Schema(implementation = TransactionPageDto.class))),
            @ApiResponse(responseCode = "400", description = "Invalid page or size",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/transactions")
    public ResponseEntity<TransactionPageDto> getTransactions(
            @Parameter(description = "Page number, starting at 1") @RequestParam(defaultValue = "1") @Min(1) int page,
            @Parameter(description = "Page size, capped at the configured maximum") @RequestParam(required = false) @Min(1) Integer size,
            Authentication authentication) {
        if (!featureFlags.isBilling()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).build();
        }
        UUID userId = BillingSecurityUtils.requireUserId(authentication);
        int pageSize = size != null ? size : 0;
        return ResponseEntity.ok(walletLedgerService.getHistory(userId, page, pageSize));
    }

    @Operation(
            summary = "Add funds",
            description = "Opens a payment session with the gateway. The wallet is credited only after the payment is verified."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Payment session opened",
                    content = @Content(schema = @Schema(implementation = CheckoutResponse.class))),
            @ApiResponse(responseCode = "400", description = "Invalid amount or payment method",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "403", description = "Wallet is frozen",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "503", description = "Payment gateway unavailable",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/add-funds")
    public ResponseEntity<CheckoutResponse> addFunds(@Valid @RequestBody AddFundsRequest request,
                                                     Authentication authentication) {
        if (!featureFlags.isBilling()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).build();
        }
        UUID userId = BillingSecurityUtils.requireUserId(authentication);
        CheckoutResponse response = paymentSessionService.createTopUpSession(userId, request.amount(), request.paymentMethod());
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "Withdraw credits", description = "Debits the wallet; the payout itself happens outside this service")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Withdrawal recorded",
                    content = @Content(schema = @Schema(implementation = TransactionDto.class))),
            @ApiResponse(responseCode = "403", description = "Wallet is frozen",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Insufficient funds",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/withdraw")
    public ResponseEntity<TransactionDto> withdraw(@Valid @RequestBody WithdrawRequest request,
                                                   Authentication authentication) {
        if (!featureFlags.isBilling()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).build();
        }
        UUID userId = BillingSecurityUtils.requireUserId(authentication);
        String description = request.description() != null ? request.description() : "Withdrawal";
        TransactionDto transaction = walletLedgerService.debit(userId, request.amount(), TransactionSource.WITHDRAWAL,
                description, "withdrawal:" + UUID.randomUUID(), null);
        log.info("User {} withdrew {}", userId, request.amount());
        return ResponseEntity.ok(transaction);
    }
}

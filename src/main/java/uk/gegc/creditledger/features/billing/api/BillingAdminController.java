package uk.gegc.creditledger.features.billing.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.creditledger.features.billing.api.dto.AdminCreditRequest;
import uk.gegc.creditledger.features.billing.api.dto.FreezeWalletRequest;
import uk.gegc.creditledger.features.billing.api.dto.PaymentSessionDto;
import uk.gegc.creditledger.features.billing.api.dto.TransactionDto;
import uk.gegc.creditledger.features.billing.api.dto.WalletDto;
import uk.gegc.creditledger.features.billing.application.LedgerAuditService;
import uk.gegc.creditledger.features.billing.application.PaymentSessionService;
import uk.gegc.creditledger.features.billing.application.WalletLedgerService;
import uk.gegc.creditledger.features.billing.domain.model.TransactionSource;

import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
@Validated
@PreAuthorize("hasAuthority('BILLING_ADMIN')")
@Tag(name = "Billing Admin", description = "Administrative wallet operations and ledger audits")
@SecurityRequirement(name = "Bearer Authentication")
public class BillingAdminController {

    private final WalletLedgerService walletLedgerService;
    private final LedgerAuditService ledgerAuditService;
    private final PaymentSessionService paymentSessionService;

    @Operation(summary = "Credit a wallet", description = "Administrative adjustment; accepted even on frozen wallets")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Wallet credited",
                    content = @Content(schema = @Schema(implementation = TransactionDto.class))),
            @ApiResponse(responseCode = "403", description = "Missing BILLING_ADMIN authority"),
            @ApiResponse(responseCode = "409", description = "Idempotency key reused for a different credit")
    })
    @PostMapping("/wallets/{userId}/credits")
    public ResponseEntity<TransactionDto> credit(@PathVariable UUID userId, @Valid @RequestBody AdminCreditRequest request) {
        TransactionDto transaction = walletLedgerService.credit(userId, request.amount(), TransactionSource.ADJUSTMENT,
                request.description(), request.referenceId(), request.idempotencyKey());
        log.info("Admin credited {} to wallet {}: {}", request.amount(), userId, request.description());
        return ResponseEntity.ok(transaction);
    }

    @Operation(summary = "Freeze a wallet", description = "Blocks debits and purchase credits")
    @PostMapping("/wallets/{userId}/freeze")
    public ResponseEntity<WalletDto> freeze(@PathVariable UUID userId,
                                            @Valid @RequestBody(required = false) FreezeWalletRequest request) {
        String reason = request != null ? request.reason() : null;
        return ResponseEntity.ok(walletLedgerService.freeze(userId, reason));
    }

    @Operation(summary = "Unfreeze a wallet")
    @PostMapping("/wallets/{userId}/unfreeze")
    public ResponseEntity<WalletDto> unfreeze(@PathVariable UUID userId) {
        return ResponseEntity.ok(walletLedgerService.unfreeze(userId));
    }

    @Operation(summary = "Audit one wallet", description = "Replays the wallet's transactions against its balance")
    @ApiResponse(responseCode = "200", description = "Audit completed",
            content = @Content(schema = @Schema(implementation = LedgerAuditService.AuditResult.class)))
    @PostMapping("/wallets/{userId}/audit")
    public ResponseEntity<LedgerAuditService.AuditResult> auditWallet(@PathVariable UUID userId) {
        return ResponseEntity.ok(ledgerAuditService.auditWallet(userId));
    }

    @Operation(summary = "Audit all wallets")
    @ApiResponse(responseCode = "200", description = "Audit completed",
            content = @Content(schema = @Schema(implementation = LedgerAuditService.AuditSummary.class)))
    @PostMapping("/wallets/audit")
    public ResponseEntity<LedgerAuditService.AuditSummary> auditAll() {
        return ResponseEntity.ok(ledgerAuditService.auditAllWallets());
    }

    @Operation(summary = "Get any payment session")
    @GetMapping("/payments/{invoiceId}")
    public ResponseEntity<PaymentSessionDto> getSession(@PathVariable UUID invoiceId) {
        return ResponseEntity.ok(paymentSessionService.getSessionForAdmin(invoiceId));
    }
}

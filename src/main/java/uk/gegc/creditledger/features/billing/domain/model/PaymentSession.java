package uk.gegc.creditledger.features.billing.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Server-side record of one external payment attempt, keyed by invoice id.
 * Status transitions go through conditional updates in {@code PaymentSessionRepository}.
 */
@Entity
@Table(name = "payment_sessions")
@Getter
@Setter
public class PaymentSession {

    @Id
    @Column(name = "invoice_id", nullable = false, updatable = false)
    private UUID invoiceId;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "external_ref", length = 255)
    private String externalRef;

    @Column(name = "redirect_url", length = 2048)
    private String redirectUrl;

    @Column(name = "amount", nullable = false, updatable = false)
    private long amount;

    @Column(name = "currency", nullable = false, length = 10, updatable = false)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(name = "purpose", nullable = false, length = 32, updatable = false)
    private PaymentPurpose purpose;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private PaymentSessionStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "failure_reason", length = 32)
    private FailureReason failureReason;

    @Column(name = "failure_message", length = 512)
    private String failureMessage;

    @Column(name = "target_tier")
    private Integer targetTier;

    @Enumerated(EnumType.STRING)
    @Column(name = "target_cycle", length = 16)
    private BillingCycle targetCycle;

    @Column(name = "quoted_total_cost")
    private Long quotedTotalCost;

    @Column(name = "quoted_credit_applied")
    private Long quotedCreditApplied;

    /** Set while the gateway reports checkout complete but the payment itself has not settled. */
    @Column(name = "awaiting_settlement", nullable = false)
    private boolean awaitingSettlement;

    @Column(name = "credit_transaction_id")
    private Long creditTransactionId;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;

    @Column(name = "consumed_at")
    private LocalDateTime consumedAt;
}

package uk.gegc.creditledger.features.billing.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Audit record of one applied tier upgrade and the quote it was priced with.
 */
@Entity
@Table(name = "tier_purchases")
@Getter
@Setter
public class TierPurchase {

    public enum PaymentMethod { WALLET, GATEWAY }

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "from_tier", nullable = false)
    private int fromTier;

    @Column(name = "to_tier", nullable = false)
    private int toTier;

    @Enumerated(EnumType.STRING)
    @Column(name = "billing_cycle", nullable = false, length = 16)
    private BillingCycle billingCycle;

    @Column(name = "total_cost", nullable = false)
    private long totalCost;

    @Column(name = "credit_applied", nullable = false)
    private long creditApplied;

    @Column(name = "amount_paid", nullable = false)
    private long amountPaid;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_method", nullable = false, length = 16)
    private PaymentMethod paymentMethod;

    @Column(name = "payment_reference", length = 255)
    private String paymentReference;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}

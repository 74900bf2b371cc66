package uk.gegc.creditledger.features.billing.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Append-only ledger row. Never updated or deleted once written.
 */
@Entity
@Table(name = "wallet_transactions")
@Getter
@Setter
public class WalletTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "wallet_id", nullable = false, updatable = false)
    private UUID walletId;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 16, updatable = false)
    private TransactionKind kind;

    @Enumerated(EnumType.STRING)
    @Column(name = "source", nullable = false, length = 32, updatable = false)
    private TransactionSource source;

    @Column(name = "amount", nullable = false, updatable = false)
    private long amount;

    @Column(name = "description", nullable = false, length = 255, updatable = false)
    private String description;

    @Column(name = "reference_id", length = 255, updatable = false)
    private String referenceId;

    @Column(name = "idempotency_key", length = 255, unique = true, updatable = false)
    private String idempotencyKey;

    @Column(name = "balance_after", nullable = false, updatable = false)
    private long balanceAfter;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}

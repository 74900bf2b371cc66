package uk.gegc.creditledger.features.billing.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "wallets")
@Getter
@Setter
public class Wallet {

    @Id
    @Column(name = "owner_id", nullable = false, updatable = false)
    private UUID ownerId;

    @Column(name = "balance", nullable = false)
    private long balance;

    @Column(name = "total_earned", nullable = false)
    private long totalEarned;

    @Column(name = "total_spent", nullable = false)
    private long totalSpent;

    @Column(name = "is_frozen", nullable = false)
    private boolean frozen;

    @Column(name = "frozen_reason", length = 255)
    private String frozenReason;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}

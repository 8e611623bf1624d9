package com.scanreward.api.token.entities;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Transient;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.Setter;
import org.springframework.data.domain.Persistable;

import java.time.OffsetDateTime;

/**
 * A data access object that maps to the {@code reward_token} table in the database.
 * <p>
 * Its {@link #id} is assigned by the application before insertion, so it implements {@link
 * Persistable} to make Spring Data insert new instances instead of merging them into an existing
 * row with the same id.</p>
 */
@Entity
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RewardToken implements Persistable<String> {

    @Id
    @NonNull
    @Column(updatable = false)
    private String id;

    @NonNull
    @Column(updatable = false)
    @Builder.Default
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Version
    private long version;

    @NonNull
    @Column(updatable = false)
    private String productName;

    @NonNull
    @Column(updatable = false)
    private String batchId;

    private long amount;

    @NonNull
    @Enumerated(EnumType.STRING)
    @Builder.Default
    private TokenState state = TokenState.UNREDEEMED;

    private OffsetDateTime redeemedAt;

    private OffsetDateTime expiresAt;

    private String customerPhone;

    @Transient
    @Builder.Default
    @EqualsAndHashCode.Exclude
    @Setter(AccessLevel.NONE)
    private boolean isNew = true;

    @Override
    public boolean isNew() {
        return isNew;
    }

    /**
     * @param now the instant to compare against.
     * @return whether the token has an expiry deadline and {@code now} is strictly after it.
     */
    public boolean isExpiredAt(@NonNull OffsetDateTime now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }

    @PostLoad
    @PostPersist
    void markNotNew() {
        this.isNew = false;
    }
}

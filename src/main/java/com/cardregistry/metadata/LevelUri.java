package com.cardregistry.metadata;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Display URI registered for a card level. Independent of any card.
 */
@Entity
@Table(name = "level_uris")
@Data
@NoArgsConstructor
public class LevelUri {

    @Id
    @Column(name = "card_level", precision = 39, scale = 0)
    private BigInteger level;

    @Column(nullable = false, length = 2048)
    private String uri;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public LevelUri(BigInteger level, String uri) {
        this.level = level;
        this.uri = uri;
        this.updatedAt = Instant.now();
    }

    public void changeUri(String uri) {
        this.uri = uri;
        this.updatedAt = Instant.now();
    }
}

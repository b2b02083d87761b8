package com.marketdesk.jobs.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * One listing interval of a security.
 * Rows sharing a securityId form the lineage of one instrument across ticker renames.
 * A row with no maxDate is the active listing; rows are closed, never deleted.
 */
@Entity
@Table(name = "securities", uniqueConstraints = {
        @UniqueConstraint(name = "uk_securities_ticker_min_date", columnNames = { "ticker", "min_date" })
}, indexes = {
        @Index(name = "idx_securities_ticker", columnList = "ticker"),
        @Index(name = "idx_securities_figi", columnList = "figi"),
        @Index(name = "idx_securities_security_id", columnList = "security_id"),
        @Index(name = "idx_securities_max_date", columnList = "max_date")
})
@EntityListeners(AuditingEntityListener.class)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Security {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "security_id", nullable = false)
    private Long securityId;

    @Column(name = "ticker", nullable = false, length = 20)
    private String ticker;

    @Column(name = "figi", nullable = false, length = 20)
    @Builder.Default
    private String figi = "";

    @Column(name = "min_date", nullable = false)
    private LocalDate minDate;

    @Column(name = "max_date")
    private LocalDate maxDate;

    @Column(name = "cik")
    private Long cik;

    @Column(name = "name")
    private String name;

    @Column(name = "market", length = 20)
    private String market;

    @Column(name = "locale", length = 10)
    private String locale;

    @Column(name = "primary_exchange", length = 20)
    private String primaryExchange;

    @Column(name = "market_cap")
    private Long marketCap;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "logo", columnDefinition = "TEXT")
    private String logo;

    @Column(name = "icon", columnDefinition = "TEXT")
    private String icon;

    @Column(name = "active")
    private Boolean active;

    @CreatedDate
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @LastModifiedDate
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public boolean isListed() {
        return maxDate == null;
    }

    public boolean needsBranding() {
        return logo == null || icon == null;
    }

    public boolean hasFigi() {
        return figi != null && !figi.isEmpty();
    }
}

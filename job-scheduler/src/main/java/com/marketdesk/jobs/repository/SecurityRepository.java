package com.marketdesk.jobs.repository;

import com.marketdesk.jobs.domain.Security;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Security entity.
 * History queries order the active row first, then closed rows by most recent close.
 */
@Repository
public interface SecurityRepository extends JpaRepository<Security, Long> {

    /**
     * All rows sharing a FIGI, most recent first.
     *
     * @param figi a non-empty composite FIGI
     * @return the FIGI lineage, active row first
     */
    @Query("SELECT s FROM Security s WHERE s.figi = :figi "
            + "ORDER BY CASE WHEN s.maxDate IS NULL THEN 0 ELSE 1 END, s.maxDate DESC, s.id DESC")
    List<Security> findFigiHistory(@Param("figi") String figi);

    /**
     * All rows for a ticker, most recent first.
     *
     * @param ticker the ticker symbol
     * @return the ticker's rows, active row first
     */
    @Query("SELECT s FROM Security s WHERE s.ticker = :ticker "
            + "ORDER BY CASE WHEN s.maxDate IS NULL THEN 0 ELSE 1 END, s.maxDate DESC, s.id DESC")
    List<Security> findTickerHistory(@Param("ticker") String ticker);

    /**
     * Find the active rows for a ticker. More than one means the table needs repair.
     */
    List<Security> findByTickerAndMaxDateIsNull(String ticker);

    /**
     * Find the active rows carrying a FIGI.
     */
    List<Security> findByFigiAndMaxDateIsNull(String figi);

    /**
     * Find every active row.
     */
    List<Security> findByMaxDateIsNull();

    /**
     * Find active rows without a CIK.
     */
    List<Security> findByMaxDateIsNullAndCikIsNull();

    /**
     * Active rows still missing a logo or an icon, by ticker.
     */
    @Query("SELECT s FROM Security s WHERE s.maxDate IS NULL AND (s.logo IS NULL OR s.icon IS NULL) "
            + "ORDER BY s.ticker")
    List<Security> findActiveWithoutBranding();

    long countByMaxDateIsNull();

    boolean existsByTickerAndMinDate(String ticker, LocalDate minDate);

    /**
     * Most recent listing date in the table, where incremental reconciliation resumes.
     */
    @Query("SELECT MAX(s.minDate) FROM Security s")
    Optional<LocalDate> findLatestMinDate();

    @Query("SELECT COALESCE(MAX(s.securityId), 0) FROM Security s")
    long findMaxSecurityId();
}

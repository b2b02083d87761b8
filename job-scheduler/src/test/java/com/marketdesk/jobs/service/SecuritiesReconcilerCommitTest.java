package com.marketdesk.jobs.service;

import com.marketdesk.jobs.config.JobsProperties;
import com.marketdesk.jobs.config.JpaConfig;
import com.marketdesk.jobs.domain.ListingAction;
import com.marketdesk.jobs.domain.ReconciliationSummary;
import com.marketdesk.jobs.domain.Security;
import com.marketdesk.jobs.exception.MarketDataException;
import com.marketdesk.jobs.repository.SecurityRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Reconciliation with real per-day transactions: the test itself runs outside any transaction,
 * so each day commits or rolls back on its own.
 */
@DataJpaTest
@Import(JpaConfig.class)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class SecuritiesReconcilerCommitTest {

    private static final ZoneId NEW_YORK = ZoneId.of("America/New_York");
    private static final LocalDate D1 = LocalDate.of(2024, 3, 4);
    private static final LocalDate D2 = D1.plusDays(1);
    private static final LocalDate D3 = D1.plusDays(2);

    // Longer than the 20 character ticker column
    private static final String OVERSIZED_TICKER = "ABCDEFGHIJKLMNOPQRSTUVWXYZ";

    @Autowired
    private SecurityRepository securityRepository;

    @Autowired
    private PlatformTransactionManager transactionManager;

    private StubMarketDataProvider provider;
    private SimpleMeterRegistry meterRegistry;
    private SecuritiesReconciler reconciler;

    @BeforeEach
    void setUp() {
        provider = new StubMarketDataProvider();
        meterRegistry = new SimpleMeterRegistry();
        Clock clock = Clock.fixed(D3.atStartOfDay(NEW_YORK).toInstant(), NEW_YORK);
        reconciler = new SecuritiesReconciler(securityRepository,
                new ListingClassifier(securityRepository, provider), provider,
                new JobMetricsService(meterRegistry), transactionManager, new JobsProperties(), clock);
    }

    @AfterEach
    void tearDown() {
        securityRepository.deleteAll();
    }

    @Test
    void testReconcileHistory_FailingRecordDoesNotHoldBackTheDay() {
        // Arrange: the oversized insert fails in the database and poisons the day's transaction
        provider.listing(D1, "AAPL", "F-AAPL")
                .listing(D1, "MSFT", "F-MSFT")
                .listing(D1, OVERSIZED_TICKER, "F-BIG");

        // Act
        ReconciliationSummary summary = reconciler.reconcileHistory(D1, D1);

        // Assert
        assertEquals(1, summary.getFailures());
        assertEquals(2, summary.count(ListingAction.NEW_LISTING));
        assertEquals(1, securityRepository.findTickerHistory("AAPL").size());
        assertEquals(1, securityRepository.findTickerHistory("MSFT").size());
        assertEquals(2, securityRepository.count());
        assertEquals(1.0, meterRegistry.get("jobs.reconciliation.failures").counter().count());
    }

    @Test
    void testReconcileHistory_LaterDaysContinueAfterFailedRecord() {
        // Arrange
        provider.listing(D1, "AAPL", "F-AAPL")
                .listing(D1, OVERSIZED_TICKER, "F-BIG")
                .listing(D2, "AAPL", "F-AAPL")
                .listing(D2, "NVDA", "F-NVDA");

        // Act
        ReconciliationSummary summary = reconciler.reconcileHistory(D1, D2);

        // Assert
        assertEquals(2, summary.getDaysProcessed());
        assertEquals(1, summary.getFailures());
        assertNull(securityRepository.findTickerHistory("AAPL").get(0).getMaxDate());
        assertEquals(D2, securityRepository.findTickerHistory("NVDA").get(0).getMinDate());
    }

    @Test
    void testReconcileHistory_SnapshotFailureAbortsRunButKeepsCommittedDays() {
        // Arrange
        provider.listing(D1, "AAPL", "F-AAPL")
                .listing(D3, "AAPL", "F-AAPL")
                .unavailableOn(D2);

        // Act
        MarketDataException ex = assertThrows(MarketDataException.class,
                () -> reconciler.reconcileHistory(D1, D3));

        // Assert
        assertThat(ex.getMessage()).contains(D2.toString());
        List<Security> rows = securityRepository.findTickerHistory("AAPL");
        assertEquals(1, rows.size());
        assertEquals(D1, rows.get(0).getMinDate());
        assertNull(rows.get(0).getMaxDate());
        assertThat(provider.fetchedDates()).doesNotContain(D3);
    }
}

package com.marketdesk.jobs.service;

import com.marketdesk.jobs.config.JobsProperties;
import com.marketdesk.jobs.domain.DailySnapshot;
import com.marketdesk.jobs.domain.DayWindow;
import com.marketdesk.jobs.domain.FigiChange;
import com.marketdesk.jobs.domain.ListingAction;
import com.marketdesk.jobs.domain.ListingDecision;
import com.marketdesk.jobs.domain.ReconciliationSummary;
import com.marketdesk.jobs.domain.Security;
import com.marketdesk.jobs.domain.SnapshotDiff;
import com.marketdesk.jobs.domain.TickerListing;
import com.marketdesk.jobs.exception.ReconciliationException;
import com.marketdesk.jobs.exception.ReconciliationStep;
import com.marketdesk.jobs.infrastructure.MarketDataProvider;
import com.marketdesk.jobs.repository.SecurityRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.function.Consumer;

/**
 * Keeps the securities table in step with the exchange's daily ticker lists.
 * Each day applies FIGI changes, then additions, then removals. A day runs in one
 * transaction; if that transaction cannot commit, the day is replayed record by record
 * so a single bad record does not hold back the rest.
 */
@Service
@Slf4j
public class SecuritiesReconciler {

    private static final Consumer<LocalDate> NO_PROGRESS = date -> { };

    private final SecurityRepository securityRepository;
    private final ListingClassifier listingClassifier;
    private final MarketDataProvider marketDataProvider;
    private final JobMetricsService metricsService;
    private final TransactionTemplate transactionTemplate;
    private final JobsProperties.Reconciliation settings;
    private final Clock clock;

    public SecuritiesReconciler(SecurityRepository securityRepository, ListingClassifier listingClassifier,
            MarketDataProvider marketDataProvider, JobMetricsService metricsService,
            PlatformTransactionManager transactionManager, JobsProperties properties, Clock clock) {
        this.securityRepository = securityRepository;
        this.listingClassifier = listingClassifier;
        this.marketDataProvider = marketDataProvider;
        this.metricsService = metricsService;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.settings = properties.getReconciliation();
        this.clock = clock;
    }

    /**
     * Reconcile every calendar day in [start, end].
     *
     * @throws com.marketdesk.jobs.exception.MarketDataException if a day's snapshot cannot be fetched
     */
    public ReconciliationSummary reconcileHistory(LocalDate start, LocalDate end) {
        return reconcileHistory(start, end, NO_PROGRESS);
    }

    /**
     * Reconcile every calendar day in [start, end], reporting each finished day to {@code onDayDone}.
     */
    public ReconciliationSummary reconcileHistory(LocalDate start, LocalDate end, Consumer<LocalDate> onDayDone) {
        log.info("Reconciling securities from {} to {}", start, end);
        return run(new SnapshotWindow(marketDataProvider, start, end), start, onDayDone);
    }

    /**
     * Resume from the most recent listing date in the table, or from the coverage start
     * when the table is empty, up to today.
     */
    public ReconciliationSummary reconcileSinceLatestListing() {
        return reconcileSinceLatestListing(NO_PROGRESS);
    }

    public ReconciliationSummary reconcileSinceLatestListing(Consumer<LocalDate> onDayDone) {
        LocalDate start = securityRepository.findLatestMinDate().orElse(settings.getCoverageStart());
        return reconcileHistory(start, LocalDate.now(clock), onDayDone);
    }

    /**
     * Reconcile today's ticker list against the active rows currently in the table.
     */
    public ReconciliationSummary reconcileToday() {
        LocalDate today = LocalDate.now(clock);
        DailySnapshot live = DailySnapshot.fromActiveRows(today.minusDays(1), securityRepository.findByMaxDateIsNull());
        log.info("Reconciling {} against {} active securities", today, live.size());
        return run(new SnapshotWindow(marketDataProvider, live, today, today), today, NO_PROGRESS);
    }

    private ReconciliationSummary run(SnapshotWindow window, LocalDate start, Consumer<LocalDate> onDayDone) {
        ReconciliationSummary summary = new ReconciliationSummary(start);
        while (window.hasNext()) {
            DayWindow day = window.next();
            reconcileDay(day, summary);
            onDayDone.accept(day.getDate());
        }
        log.info("Securities reconciliation finished: {}", summary);
        return summary;
    }

    /**
     * Apply one day's diff and fold its counters into the run summary.
     */
    public void reconcileDay(DayWindow day, ReconciliationSummary summary) {
        LocalDate date = day.getDate();
        SnapshotDiff diff = day.diff();
        ReconciliationSummary daySummary = new ReconciliationSummary(date);

        if (!diff.isEmpty()) {
            log.debug("{}: {} additions, {} removals, {} FIGI changes", date,
                    diff.getAdditions().size(), diff.getRemovals().size(), diff.getFigiChanges().size());

            if (settings.isTransactionalDays()) {
                ReconciliationSummary attempt = new ReconciliationSummary(date);
                try {
                    transactionTemplate.executeWithoutResult(status -> applyDiff(date, diff, attempt));
                    daySummary = attempt;
                } catch (TransactionException | DataAccessException e) {
                    log.warn("Transaction for {} failed ({}); replaying record by record", date, e.getMessage());
                    applyDiff(date, diff, daySummary);
                }
            } else {
                applyDiff(date, diff, daySummary);
            }
        }

        daySummary.getActionCounts().forEach((action, count) -> {
            for (int i = 0; i < count; i++) {
                metricsService.recordReconciliationAction(action);
            }
        });
        for (int i = 0; i < daySummary.getFailures(); i++) {
            metricsService.recordReconciliationFailure();
        }
        summary.merge(daySummary);
        summary.recordDay(date);
    }

    private void applyDiff(LocalDate date, SnapshotDiff diff, ReconciliationSummary summary) {
        int loop = 0;
        for (FigiChange change : diff.getFigiChanges()) {
            loop++;
            try {
                applyFigiChange(change, date, loop, summary);
            } catch (RuntimeException e) {
                recordFailure(ReconciliationStep.FIGI_CHANGE, loop, change.getTicker(), change.getNewFigi(), date,
                        e, summary);
            }
        }

        loop = 0;
        for (TickerListing addition : diff.getAdditions()) {
            loop++;
            ListingDecision decision;
            try {
                decision = listingClassifier.classify(addition, date);
            } catch (RuntimeException e) {
                recordFailure(ReconciliationStep.CLASSIFY, loop, addition.getTicker(), addition.getCompositeFigi(),
                        date, e, summary);
                continue;
            }
            try {
                applyAddition(decision, date, loop, summary);
            } catch (RuntimeException e) {
                recordFailure(ReconciliationStep.APPLY_ADDITION, loop, addition.getTicker(),
                        addition.getCompositeFigi(), date, e, summary);
            }
        }

        loop = 0;
        for (TickerListing removal : diff.getRemovals()) {
            loop++;
            try {
                applyRemoval(removal, date, loop, summary);
            } catch (RuntimeException e) {
                recordFailure(ReconciliationStep.REMOVAL, loop, removal.getTicker(), removal.getCompositeFigi(),
                        date, e, summary);
            }
        }
    }

    private void applyFigiChange(FigiChange change, LocalDate date, int loop, ReconciliationSummary summary) {
        List<Security> active = securityRepository.findByTickerAndMaxDateIsNull(change.getTicker());
        if (active.isEmpty()) {
            log.debug("loop {} | ticker {} | figi {} | date {} | FIGI change found no active row",
                    loop, change.getTicker(), change.getNewFigi(), date);
            return;
        }
        active.forEach(row -> row.setFigi(change.getNewFigi()));
        securityRepository.saveAll(active);
        summary.record(ListingAction.FIGI_CHANGE);
        logAction(loop, change.getTicker(), change.getTicker(), change.getNewFigi(), date, "FIGI_CHANGE");
    }

    private void applyAddition(ListingDecision decision, LocalDate date, int loop, ReconciliationSummary summary) {
        TickerListing listing = decision.getListing();
        Security target = decision.getTarget();
        String targetTicker = target == null ? "" : target.getTicker();
        logAction(loop, listing.getTicker(), targetTicker, listing.getCompositeFigi(), date, decision.describe());

        if (decision.has(ListingAction.TICKER_CHANGE)) {
            applyTickerChange(decision, date, summary);
        } else if (decision.has(ListingAction.FALSE_DELIST) || decision.has(ListingAction.FIGI_CHANGE)) {
            applyReopen(decision, date, summary);
        } else if (decision.has(ListingAction.NEW_LISTING)) {
            applyNewListing(listing, date, summary);
        } else {
            summary.record(ListingAction.DUPLICATE_LISTING);
        }
    }

    /**
     * Close the FIGI's active row and open a successor row under the new ticker in the same lineage.
     */
    private void applyTickerChange(ListingDecision decision, LocalDate date, ReconciliationSummary summary) {
        TickerListing listing = decision.getListing();
        Security predecessor = decision.getTarget();

        List<Security> activeForFigi = securityRepository.findByFigiAndMaxDateIsNull(listing.getCompositeFigi());
        activeForFigi.forEach(row -> row.setMaxDate(date));
        securityRepository.saveAll(activeForFigi);

        if (decision.has(ListingAction.FALSE_DELIST) && !predecessor.isListed()) {
            // The old ticker kept trading through the gap: it was listed until the rename
            predecessor.setMaxDate(date);
            securityRepository.save(predecessor);
            summary.record(ListingAction.FALSE_DELIST);
        }

        List<Security> staleActive = securityRepository.findByTickerAndMaxDateIsNull(listing.getTicker());
        for (Security stale : staleActive) {
            log.warn("Ticker {} taken over by FIGI {} on {}; closing row of security {}",
                    listing.getTicker(), listing.getCompositeFigi(), date, stale.getSecurityId());
            stale.setMaxDate(latestOf(date.minusDays(1), stale.getMinDate()));
        }
        securityRepository.saveAll(staleActive);

        if (securityRepository.existsByTickerAndMinDate(listing.getTicker(), date)) {
            log.debug("Successor row {} on {} already exists", listing.getTicker(), date);
        } else {
            securityRepository.save(Security.builder()
                    .securityId(predecessor.getSecurityId())
                    .ticker(listing.getTicker())
                    .figi(listing.getCompositeFigi())
                    .minDate(date)
                    .cik(predecessor.getCik())
                    .name(listing.getName() != null ? listing.getName() : predecessor.getName())
                    .market(listing.getMarket() != null ? listing.getMarket() : predecessor.getMarket())
                    .locale(listing.getLocale() != null ? listing.getLocale() : predecessor.getLocale())
                    .primaryExchange(listing.getPrimaryExchange() != null
                            ? listing.getPrimaryExchange()
                            : predecessor.getPrimaryExchange())
                    .build());
        }
        summary.record(ListingAction.TICKER_CHANGE);
    }

    /**
     * Clear the close date of a falsely delisted row and/or give it the incoming FIGI.
     */
    private void applyReopen(ListingDecision decision, LocalDate date, ReconciliationSummary summary) {
        TickerListing listing = decision.getListing();
        Security target = decision.getTarget();

        if (decision.has(ListingAction.FALSE_DELIST) && !target.isListed()) {
            List<Security> active = securityRepository.findByTickerAndMaxDateIsNull(target.getTicker());
            if (!active.isEmpty()) {
                log.warn("Ticker {} already has an active row; not reopening row closed on {}",
                        target.getTicker(), target.getMaxDate());
                summary.record(ListingAction.DUPLICATE_LISTING);
                return;
            }
            target.setMaxDate(null);
            summary.record(ListingAction.FALSE_DELIST);
        }
        if (decision.has(ListingAction.FIGI_CHANGE)) {
            target.setFigi(listing.getCompositeFigi());
            summary.record(ListingAction.FIGI_CHANGE);
        }
        securityRepository.save(target);
    }

    private void applyNewListing(TickerListing listing, LocalDate date, ReconciliationSummary summary) {
        if (!securityRepository.findByTickerAndMaxDateIsNull(listing.getTicker()).isEmpty()
                || securityRepository.existsByTickerAndMinDate(listing.getTicker(), date)) {
            log.debug("Ticker {} already listed; skipping new listing on {}", listing.getTicker(), date);
            summary.record(ListingAction.DUPLICATE_LISTING);
            return;
        }
        // Single writer: reconciliation is the only job inserting securities
        long securityId = securityRepository.findMaxSecurityId() + 1;
        securityRepository.save(Security.builder()
                .securityId(securityId)
                .ticker(listing.getTicker())
                .figi(listing.getCompositeFigi())
                .minDate(date)
                .name(listing.getName())
                .market(listing.getMarket())
                .locale(listing.getLocale())
                .primaryExchange(listing.getPrimaryExchange())
                .build());
        summary.record(ListingAction.NEW_LISTING);
    }

    /**
     * Close the ticker's active row as of yesterday. When no row is active the removal is
     * expected only if a ticker change already closed it.
     */
    private void applyRemoval(TickerListing listing, LocalDate date, int loop, ReconciliationSummary summary) {
        LocalDate yesterday = date.minusDays(1);
        List<Security> active = securityRepository.findByTickerAndMaxDateIsNull(listing.getTicker());

        if (!active.isEmpty()) {
            active.forEach(row -> row.setMaxDate(latestOf(yesterday, row.getMinDate())));
            securityRepository.saveAll(active);
            summary.record(ListingAction.REMOVAL);
            logAction(loop, listing.getTicker(), "", listing.getCompositeFigi(), date, "REMOVAL");
            return;
        }

        if (closedByTickerChange(listing)) {
            log.debug("loop {} | ticker {} | figi {} | date {} | removal already applied by ticker change",
                    loop, listing.getTicker(), listing.getCompositeFigi(), date);
        } else {
            log.warn("loop {} | ticker {} | figi {} | date {} | removal found no active row",
                    loop, listing.getTicker(), listing.getCompositeFigi(), date);
        }
    }

    private boolean closedByTickerChange(TickerListing listing) {
        if (!listing.hasFigi()) {
            return false;
        }
        List<Security> history = securityRepository.findFigiHistory(listing.getCompositeFigi());
        if (history.isEmpty() || history.get(0).getTicker().equals(listing.getTicker())) {
            return false;
        }
        return history.stream()
                .skip(1)
                .anyMatch(row -> row.getTicker().equals(listing.getTicker()) && !row.isListed());
    }

    private void recordFailure(ReconciliationStep step, int loop, String ticker, String figi, LocalDate date,
            RuntimeException cause, ReconciliationSummary summary) {
        ReconciliationException failure = new ReconciliationException(step, ticker, figi, date, cause);
        log.warn("loop {} | {}", loop, failure.getMessage(), cause);
        summary.recordFailure();
    }

    private void logAction(int loop, String ticker, String targetTicker, String figi, LocalDate date, String action) {
        log.debug("loop {} | ticker {} | targetTicker {} | figi {} | date {} | action {}",
                loop, ticker, targetTicker, figi, date, action);
    }

    private static LocalDate latestOf(LocalDate a, LocalDate b) {
        return a.isBefore(b) ? b : a;
    }
}

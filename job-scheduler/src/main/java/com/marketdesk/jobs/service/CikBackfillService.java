package com.marketdesk.jobs.service;

import com.marketdesk.jobs.domain.SecCompanyTicker;
import com.marketdesk.jobs.domain.Security;
import com.marketdesk.jobs.infrastructure.MarketDataProvider;
import com.marketdesk.jobs.repository.SecurityRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Fills in SEC CIK numbers for active securities that have none.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CikBackfillService {

    private final SecurityRepository securityRepository;
    private final MarketDataProvider marketDataProvider;

    /**
     * Single pass over the active rows without a CIK.
     *
     * @return number of rows updated
     */
    @Transactional
    public int backfill() {
        List<Security> missing = securityRepository.findByMaxDateIsNullAndCikIsNull();
        if (missing.isEmpty()) {
            log.info("All active securities already have a CIK");
            return 0;
        }

        Map<String, Long> cikByTicker = new HashMap<>();
        for (SecCompanyTicker entry : marketDataProvider.fetchSecCompanyTickers()) {
            if (entry.getTicker() == null || entry.getTicker().isEmpty()) {
                continue;
            }
            cikByTicker.putIfAbsent(entry.getTicker().toUpperCase(Locale.ROOT), entry.getCik());
        }

        int updated = 0;
        for (Security security : missing) {
            Long cik = cikByTicker.get(security.getTicker());
            if (cik == null) {
                continue;
            }
            security.setCik(cik);
            updated++;
        }
        securityRepository.saveAll(missing);

        log.info("Assigned CIK to {} of {} active securities without one", updated, missing.size());
        return updated;
    }
}

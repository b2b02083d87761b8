package com.marketdesk.jobs.service;

import com.marketdesk.jobs.config.MarketDataProperties;
import com.marketdesk.jobs.domain.Security;
import com.marketdesk.jobs.domain.TickerDetails;
import com.marketdesk.jobs.exception.MarketDataException;
import com.marketdesk.jobs.infrastructure.MarketDataProvider;
import com.marketdesk.jobs.repository.SecurityRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Fills in descriptive data and branding images for active securities that lack a logo or icon.
 * Each security is saved on its own, so one bad lookup never holds back the rest.
 */
@Service
@Slf4j
public class SecurityDetailsService {

    private final SecurityRepository securityRepository;
    private final MarketDataProvider marketDataProvider;
    private final Duration requestInterval;

    public SecurityDetailsService(SecurityRepository securityRepository, MarketDataProvider marketDataProvider,
            MarketDataProperties properties) {
        this.securityRepository = securityRepository;
        this.marketDataProvider = marketDataProvider;
        this.requestInterval = properties.getPolygon().getDetailsRequestInterval();
    }

    /**
     * One pass over the active rows missing branding.
     *
     * @return number of rows updated
     */
    public int updateActiveSecurities() throws InterruptedException {
        List<Security> missing = securityRepository.findActiveWithoutBranding();
        if (missing.isEmpty()) {
            log.info("All active securities already have a logo and icon");
            return 0;
        }

        int updated = 0;
        int unknown = 0;
        int failed = 0;
        for (int i = 0; i < missing.size(); i++) {
            if (i > 0 && !requestInterval.isZero()) {
                Thread.sleep(requestInterval.toMillis());
            }
            Security security = missing.get(i);
            try {
                Optional<TickerDetails> details = marketDataProvider.fetchTickerDetails(security.getTicker());
                if (details.isEmpty()) {
                    unknown++;
                    continue;
                }
                apply(security, details.get());
                securityRepository.save(security);
                updated++;
            } catch (MarketDataException e) {
                failed++;
                log.warn("Could not fetch details for {}: {}", security.getTicker(), e.getMessage());
            } catch (RuntimeException e) {
                failed++;
                log.error("Could not update details for {} (securityId {})", security.getTicker(),
                        security.getSecurityId(), e);
            }
        }

        log.info("Updated details for {} of {} securities ({} unknown upstream, {} failed)",
                updated, missing.size(), unknown, failed);
        return updated;
    }

    private void apply(Security security, TickerDetails details) {
        security.setName(truncate(details.getName(), 255));
        security.setMarket(truncate(details.getMarket(), 20));
        security.setLocale(truncate(details.getLocale(), 10));
        security.setPrimaryExchange(truncate(details.getPrimaryExchange(), 20));
        security.setActive(details.getActive());
        security.setMarketCap(details.getMarketCap() == null || details.getMarketCap() == 0
                ? null : details.getMarketCap());
        security.setDescription(details.getDescription());
        // A failed image keeps whatever was stored and is retried on the next run
        fetchImage(security.getTicker(), "logo", details.getLogoUrl()).ifPresent(security::setLogo);
        fetchImage(security.getTicker(), "icon", details.getIconUrl()).ifPresent(security::setIcon);
    }

    private Optional<String> fetchImage(String ticker, String kind, String url) {
        try {
            return marketDataProvider.fetchBrandingImage(url);
        } catch (MarketDataException e) {
            log.warn("Could not fetch {} for {}: {}", kind, ticker, e.getMessage());
            return Optional.empty();
        }
    }

    private static String truncate(String value, int maxLength) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        return value.length() <= maxLength ? value : value.substring(0, maxLength);
    }
}

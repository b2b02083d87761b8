package com.marketdesk.jobs.service;

import com.marketdesk.jobs.domain.Security;
import com.marketdesk.jobs.repository.SecurityRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CikBackfillServiceTest {

    @Mock
    private SecurityRepository securityRepository;

    private static Security active(String ticker) {
        return Security.builder().securityId(1L).ticker(ticker).figi("").minDate(LocalDate.of(2020, 1, 2)).build();
    }

    @Test
    void testBackfill_AssignsKnownTickersOnly() {
        // Arrange
        Security apple = active("AAPL");
        Security unknown = active("ZZZZ");
        when(securityRepository.findByMaxDateIsNullAndCikIsNull()).thenReturn(List.of(apple, unknown));
        StubMarketDataProvider provider = new StubMarketDataProvider()
                .secTicker(320193L, "aapl")
                .secTicker(789019L, "MSFT");
        CikBackfillService service = new CikBackfillService(securityRepository, provider);

        // Act
        int updated = service.backfill();

        // Assert
        assertEquals(1, updated);
        assertEquals(320193L, apple.getCik());
        assertNull(unknown.getCik());
        verify(securityRepository).saveAll(List.of(apple, unknown));
    }

    @Test
    void testBackfill_NothingMissingSkipsFetch() {
        // Arrange
        when(securityRepository.findByMaxDateIsNullAndCikIsNull()).thenReturn(List.of());
        StubMarketDataProvider provider = spy(new StubMarketDataProvider());
        CikBackfillService service = new CikBackfillService(securityRepository, provider);

        // Act
        int updated = service.backfill();

        // Assert
        assertEquals(0, updated);
        verify(provider, never()).fetchSecCompanyTickers();
    }
}

package com.marketdesk.jobs.repository;

import com.marketdesk.jobs.config.JpaConfig;
import com.marketdesk.jobs.domain.Security;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Import(JpaConfig.class)
class SecurityRepositoryTest {

    private static final LocalDate LISTED = LocalDate.of(2020, 1, 2);

    @Autowired
    private SecurityRepository securityRepository;

    private Security save(long securityId, String ticker, LocalDate maxDate, String logo, String icon) {
        return securityRepository.save(Security.builder()
                .securityId(securityId)
                .ticker(ticker)
                .minDate(LISTED)
                .maxDate(maxDate)
                .logo(logo)
                .icon(icon)
                .build());
    }

    @Test
    void testFindActiveWithoutBranding_SkipsClosedAndComplete() {
        // Arrange
        save(1L, "MSFT", null, null, "data:image/png;base64,AA==");
        save(2L, "AAPL", null, "data:image/svg+xml;base64,AA==", null);
        save(3L, "IBM", null, "data:image/svg+xml;base64,AA==", "data:image/png;base64,AA==");
        save(4L, "OLD", LISTED.plusYears(1), null, null);

        // Act
        List<Security> missing = securityRepository.findActiveWithoutBranding();

        // Assert
        assertThat(missing).extracting(Security::getTicker).containsExactly("AAPL", "MSFT");
    }
}

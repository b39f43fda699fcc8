package com.dcv.validation;

import com.dcv.domain.Domain;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Selects domains whose validation expires soon.
 *
 * <p>A domain is expiring when the earlier of its OV and EV expiration dates falls before
 * <i>now + horizonDays</i>.
 * <br>Domains that were never validated have no dates and are always selected so they surface for attention.
 * <br>A zero or negative horizon selects only what already expired, it is not an error.
 */
public class ExpirationSelector {
    private static final Logger log = LogManager.getLogger(ExpirationSelector.class);

    private final Clock clock;

    /**
     * Constructs a new ExpirationSelector using the system clock.
     */
    public ExpirationSelector() {
        this(Clock.systemDefaultZone());
    }

    /**
     * Constructs a new ExpirationSelector with given clock.
     *
     * @param clock Clock instance.
     */
    public ExpirationSelector(Clock clock) {
        this.clock = clock;
    }

    /**
     * Selects expiring domains.
     *
     * @param domains     Candidate domains.
     * @param horizonDays Days from now.
     * @return List of Domain in input order.
     */
    public List<Domain> selectExpiring(List<Domain> domains, int horizonDays) {
        LocalDateTime cutoff = cutoff(horizonDays);

        List<Domain> expiring = new ArrayList<>();
        for (Domain domain : domains) {
            if (isExpiring(domain, cutoff)) {
                expiring.add(domain);
            }
        }

        log.debug("Selected {} of {} domains expiring before {}", expiring.size(), domains.size(), cutoff);
        return expiring;
    }

    /**
     * Gets the cutoff instant for given horizon.
     *
     * @param horizonDays Days from now.
     * @return LocalDateTime.
     */
    public LocalDateTime cutoff(int horizonDays) {
        return LocalDateTime.now(clock).plusDays(horizonDays);
    }

    /**
     * Checks if a domain expires before the cutoff.
     *
     * @param domain Domain instance.
     * @param cutoff Cutoff date time.
     * @return Boolean.
     */
    static boolean isExpiring(Domain domain, LocalDateTime cutoff) {
        Optional<LocalDate> earliest = domain.getEarliestExpiration();
        if (earliest.isEmpty()) {
            log.info("No expiration on {}, domain has likely never been validated", domain.getName());
            return true;
        }

        return earliest.get().atStartOfDay().isBefore(cutoff);
    }
}

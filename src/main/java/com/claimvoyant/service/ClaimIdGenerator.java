package com.claimvoyant.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * Issues claim ids of the form {@code CLAIM-yyyyMMddHHmmss} (UTC).
 *
 * <p>Ids are unique per instance: a request landing in a second that was
 * already issued gets the next free second instead.
 */
@Component
@RequiredArgsConstructor
public class ClaimIdGenerator {

    public static final String PREFIX = "CLAIM-";

    private static final Pattern CLAIM_ID = Pattern.compile("CLAIM-\\d{14}");

    private static final DateTimeFormatter FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMddHHmmss").withZone(ZoneOffset.UTC);

    private final Clock clock;

    private final AtomicLong lastIssuedSecond = new AtomicLong(Long.MIN_VALUE);

    public String nextId() {
        long now = clock.instant().getEpochSecond();
        long issued = lastIssuedSecond.updateAndGet(last -> Math.max(now, last + 1));
        return PREFIX + FORMAT.format(Instant.ofEpochSecond(issued));
    }

    public static boolean isValid(String claimId) {
        return claimId != null && CLAIM_ID.matcher(claimId).matches();
    }
}

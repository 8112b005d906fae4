/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package villagecompute.wpautomation.services;

import java.time.Clock;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.UUID;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import villagecompute.wpautomation.api.types.TextGenerationResultType;
import villagecompute.wpautomation.data.models.AiUsageTracking;
import villagecompute.wpautomation.exceptions.ConfigurationException;

/**
 * Records text-generation usage per user and enforces the monthly token allowance.
 *
 * <p>
 * <b>Monthly limit:</b> {@code ai.monthly-token-limit} caps the input plus output tokens a user may consume per
 * calendar month (UTC). {@code 0} disables the check. The check runs before every call; a call that pushes the user
 * over the limit still completes, and the next one is refused.
 */
@ApplicationScoped
public class AiUsageTrackingService {

    private static final Logger LOG = Logger.getLogger(AiUsageTrackingService.class);

    @Inject
    MeterRegistry meterRegistry;

    @Inject
    Clock clock;

    @ConfigProperty(
            name = "ai.monthly-token-limit",
            defaultValue = "0")
    long monthlyTokenLimit;

    /**
     * Refuses the call when the user has used up this month's tokens.
     *
     * @throws ConfigurationException
     *             if the monthly token limit is exceeded
     */
    public void checkTokenLimit(UUID userId) {
        if (monthlyTokenLimit <= 0 || userId == null) {
            return;
        }
        long used = AiUsageTracking.tokensUsed(userId, currentMonth());
        if (used >= monthlyTokenLimit) {
            LOG.warnf("User %s exceeded monthly token limit: used=%d, limit=%d", userId, used, monthlyTokenLimit);
            throw new ConfigurationException("Monthly token limit exceeded. Please upgrade your plan or wait until "
                    + "next month.");
        }
    }

    public void recordSuccess(UUID userId, String feature, TextGenerationResultType result) {
        Counter.builder("ai.api.requests").tag("feature", feature).tag("result", "success").register(meterRegistry)
                .increment();
        if (userId == null) {
            return;
        }
        AiUsageTracking.recordUsage(userId, currentMonth(), result.provider(), result.inputTokens(),
                result.outputTokens(), result.cost(), true);
    }

    public void recordFailure(UUID userId, String feature, String provider) {
        Counter.builder("ai.api.requests").tag("feature", feature).tag("result", "failure").register(meterRegistry)
                .increment();
        if (userId == null) {
            return;
        }
        try {
            AiUsageTracking.recordUsage(userId, currentMonth(), provider, 0, 0, null, false);
        } catch (RuntimeException e) {
            LOG.warnf(e, "Failed to record AI failure for user %s: %s", userId, e.getMessage());
        }
    }

    private YearMonth currentMonth() {
        return YearMonth.from(clock.instant().atZone(ZoneOffset.UTC));
    }
}

/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package villagecompute.wpautomation.data.models;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Optional;
import java.util.UUID;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.panache.common.Parameters;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.NamedQuery;
import jakarta.persistence.Table;

import org.jboss.logging.Logger;

/**
 * Monthly text-generation usage per user and provider.
 *
 * <p>
 * One row per {@code (user_id, usage_month, provider)}; rows are created lazily by {@link #recordUsage}. The monthly
 * token allowance is checked against the sum of all providers for the user.
 */
@Entity
@Table(
        name = "ai_usage_tracking")
@NamedQuery(
        name = AiUsageTracking.QUERY_FIND_BY_USER_MONTH_PROVIDER,
        query = "FROM AiUsageTracking WHERE userId = :userId AND usageMonth = :month AND provider = :provider")
@NamedQuery(
        name = AiUsageTracking.QUERY_SUM_TOKENS_FOR_MONTH,
        query = "SELECT SUM(totalTokensInput + totalTokensOutput) FROM AiUsageTracking "
                + "WHERE userId = :userId AND usageMonth = :month")
public class AiUsageTracking extends PanacheEntityBase {

    private static final Logger LOG = Logger.getLogger(AiUsageTracking.class);

    public static final String QUERY_FIND_BY_USER_MONTH_PROVIDER = "AiUsageTracking.findByUserMonthProvider";
    public static final String QUERY_SUM_TOKENS_FOR_MONTH = "AiUsageTracking.sumTokensForMonth";

    @Id
    @GeneratedValue
    public UUID id;

    @Column(
            name = "user_id",
            nullable = false)
    public UUID userId;

    @Column(
            name = "usage_month",
            nullable = false)
    public LocalDate usageMonth;

    @Column(
            nullable = false)
    public String provider;

    @Column(
            name = "total_requests",
            nullable = false)
    public int totalRequests = 0;

    @Column(
            name = "failed_requests",
            nullable = false)
    public int failedRequests = 0;

    @Column(
            name = "total_tokens_input",
            nullable = false)
    public long totalTokensInput = 0L;

    @Column(
            name = "total_tokens_output",
            nullable = false)
    public long totalTokensOutput = 0L;

    @Column(
            name = "estimated_cost",
            nullable = false,
            precision = 14,
            scale = 6)
    public BigDecimal estimatedCost = BigDecimal.ZERO;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt = Instant.now();

    public static Optional<AiUsageTracking> findByUserMonthProvider(UUID userId, LocalDate month, String provider) {
        return find("#" + QUERY_FIND_BY_USER_MONTH_PROVIDER,
                Parameters.with("userId", userId).and("month", month).and("provider", provider))
                .firstResultOptional();
    }

    /**
     * Total input plus output tokens recorded for the user in {@code month}.
     */
    public static long tokensUsed(UUID userId, YearMonth month) {
        return QuarkusTransaction.requiringNew().call(() -> {
            Long total = getEntityManager().createNamedQuery(QUERY_SUM_TOKENS_FOR_MONTH, Long.class)
                    .setParameter("userId", userId).setParameter("month", month.atDay(1)).getSingleResult();
            return total == null ? 0L : total;
        });
    }

    /**
     * Adds one request to the user's monthly row for {@code provider}, creating it if needed.
     */
    public static void recordUsage(UUID userId, YearMonth month, String provider, long inputTokens, long outputTokens,
            BigDecimal cost, boolean success) {
        QuarkusTransaction.requiringNew().run(() -> {
            LocalDate monthDate = month.atDay(1);
            AiUsageTracking tracking = findByUserMonthProvider(userId, monthDate, provider).orElseGet(() -> {
                AiUsageTracking created = new AiUsageTracking();
                created.userId = userId;
                created.usageMonth = monthDate;
                created.provider = provider;
                return created;
            });

            tracking.totalRequests++;
            if (!success) {
                tracking.failedRequests++;
            }
            tracking.totalTokensInput += inputTokens;
            tracking.totalTokensOutput += outputTokens;
            tracking.estimatedCost = tracking.estimatedCost.add(cost == null ? BigDecimal.ZERO : cost);
            tracking.updatedAt = Instant.now();
            tracking.persist();

            LOG.debugf("Recorded AI usage: user=%s, provider=%s, inputTokens=%d, outputTokens=%d, cost=%s, success=%b",
                    userId, provider, inputTokens, outputTokens, cost, success);
        });
    }
}

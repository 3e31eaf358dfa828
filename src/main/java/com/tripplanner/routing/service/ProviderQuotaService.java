package com.tripplanner.routing.service;

import com.tripplanner.routing.config.RoutingProperties;
import com.tripplanner.routing.model.Provider;
import com.tripplanner.routing.model.dto.UsageSummary;
import com.tripplanner.routing.model.entity.ProviderUsageEntity;
import com.tripplanner.routing.model.entity.ProviderUsageId;
import com.tripplanner.routing.repo.ProviderUsageRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Monthly per-provider call counters and the hosted-quota decision.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProviderQuotaService {

    private static final DateTimeFormatter MONTH_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM");

    private final ProviderUsageRepository usageRepository;
    private final RoutingProperties properties;
    private final Clock clock;

    /**
     * True when a Stadia key is configured and this month's usage is below the ceiling.
     * An unreadable counter counts as exhausted.
     */
    public boolean shouldUsePrimaryHosted() {
        if (!properties.getStadia().hasKey()) {
            return false;
        }
        try {
            long used = getUsage(currentMonth(), Provider.STADIA);
            boolean allowed = used < properties.getStadia().getMonthlyQuota();
            if (!allowed) {
                log.warn("Stadia quota reached: {}/{} this month", used, properties.getStadia().getMonthlyQuota());
            }
            return allowed;
        } catch (Exception e) {
            log.warn("Could not read Stadia usage, skipping hosted provider: {}", e.getMessage());
            return false;
        }
    }

    public void recordUsage(Provider provider) {
        String month = currentMonth();
        if (usageRepository.increment(month, provider.id()) > 0) {
            return;
        }
        try {
            usageRepository.saveAndFlush(new ProviderUsageEntity(new ProviderUsageId(month, provider.id()), 1));
            log.info("Started usage counter for {} in {}", provider.id(), month);
        } catch (DataIntegrityViolationException e) {
            // another request created the row first
            log.debug("Usage row for {} {} already exists, retrying increment", provider.id(), month);
            usageRepository.increment(month, provider.id());
        }
    }

    public long getUsage(String month, Provider provider) {
        return usageRepository.findById(new ProviderUsageId(month, provider.id()))
                .map(ProviderUsageEntity::getCallCount)
                .orElse(0L);
    }

    public UsageSummary summary() {
        String month = currentMonth();
        Map<String, Long> counts = usageRepository.findByIdMonth(month).stream()
                .collect(Collectors.toMap(u -> u.getId().getProvider(), ProviderUsageEntity::getCallCount));

        List<UsageSummary.ProviderUsage> providers = Arrays.stream(Provider.values())
                .filter(p -> p != Provider.CACHE)
                .map(p -> toUsage(p, counts.getOrDefault(p.id(), 0L)))
                .toList();

        return UsageSummary.builder()
                .month(month)
                .providers(providers)
                .build();
    }

    public String currentMonth() {
        return YearMonth.now(clock).format(MONTH_FORMAT);
    }

    private UsageSummary.ProviderUsage toUsage(Provider provider, long count) {
        Long quota = provider == Provider.STADIA ? properties.getStadia().getMonthlyQuota() : null;
        return UsageSummary.ProviderUsage.builder()
                .provider(provider.id())
                .count(count)
                .quota(quota)
                .remaining(quota == null ? null : Math.max(0, quota - count))
                .build();
    }
}

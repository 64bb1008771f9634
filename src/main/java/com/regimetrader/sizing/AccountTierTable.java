package com.regimetrader.sizing;

import com.regimetrader.domain.model.AccountTier;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Validated account tiers. The tiers partition [0, infinity) into half-open ranges without gaps
 * or overlaps, so every non-negative equity maps to exactly one tier.
 */
public final class AccountTierTable {

    private final List<AccountTier> tiers;

    public AccountTierTable(List<AccountTier> tiers) {
        if (tiers == null || tiers.isEmpty()) {
            throw new IllegalStateException("At least one account tier is required");
        }
        List<AccountTier> sorted = new ArrayList<>(tiers);
        sorted.sort(Comparator.comparing(AccountTier::getMinBalance));
        validate(sorted);
        this.tiers = List.copyOf(sorted);
    }

    public static AccountTierTable fromConfig(List<PositionSizingConfig.TierProperties> properties) {
        if (properties == null || properties.isEmpty()) {
            return defaults();
        }
        List<AccountTier> tiers = new ArrayList<>();
        for (PositionSizingConfig.TierProperties tier : properties) {
            tiers.add(AccountTier.builder()
                    .label(tier.getLabel())
                    .minBalance(tier.getMinBalance())
                    .maxBalance(tier.getMaxBalance())
                    .maxLotSize(tier.getMaxLotSize())
                    .riskPercentPerTrade(tier.getRiskPercentPerTrade())
                    .maxConcurrentTrades(tier.getMaxConcurrentTrades())
                    .build());
        }
        return new AccountTierTable(tiers);
    }

    public static AccountTierTable defaults() {
        return new AccountTierTable(List.of(
                tier("nano", "0", "100", "0.01", "0.01", 1),
                tier("micro", "100", "500", "0.01", "0.02", 3),
                tier("mini", "500", "2000", "0.05", "0.015", 5),
                tier("standard", "2000", "10000", "0.2", "0.01", 7),
                tier("professional", "10000", null, "1.0", "0.005", 10)));
    }

    /** Tier containing the equity; negative equity maps to the lowest tier. */
    public AccountTier tierFor(BigDecimal equity) {
        if (equity.signum() < 0) {
            return tiers.get(0);
        }
        for (AccountTier tier : tiers) {
            if (tier.contains(equity)) {
                return tier;
            }
        }
        // unreachable after validation: the last tier is unbounded
        return tiers.get(tiers.size() - 1);
    }

    public List<AccountTier> getTiers() {
        return tiers;
    }

    private static void validate(List<AccountTier> sorted) {
        Set<String> labels = new HashSet<>();
        if (sorted.get(0).getMinBalance().signum() != 0) {
            throw new IllegalStateException("The lowest account tier must start at 0");
        }
        for (int i = 0; i < sorted.size(); i++) {
            AccountTier tier = sorted.get(i);
            if (tier.getLabel() == null || !labels.add(tier.getLabel())) {
                throw new IllegalStateException("Account tier labels must be present and unique: " + tier.getLabel());
            }
            if (tier.getMaxLotSize() == null || tier.getMaxLotSize().signum() <= 0) {
                throw new IllegalStateException("Tier " + tier.getLabel() + " needs a positive max lot size");
            }
            if (tier.getRiskPercentPerTrade() == null
                    || tier.getRiskPercentPerTrade().signum() <= 0
                    || tier.getRiskPercentPerTrade().compareTo(BigDecimal.ONE) >= 0) {
                throw new IllegalStateException("Tier " + tier.getLabel() + " risk percent must be within (0, 1)");
            }
            if (tier.getMaxConcurrentTrades() < 1) {
                throw new IllegalStateException("Tier " + tier.getLabel() + " must allow at least one trade");
            }
            boolean last = i == sorted.size() - 1;
            if (last) {
                if (tier.getMaxBalance() != null) {
                    throw new IllegalStateException("The highest account tier must be unbounded");
                }
                continue;
            }
            AccountTier next = sorted.get(i + 1);
            if (tier.getMaxBalance() == null || tier.getMaxBalance().compareTo(tier.getMinBalance()) <= 0) {
                throw new IllegalStateException("Tier " + tier.getLabel() + " has an empty or unbounded range");
            }
            int boundary = tier.getMaxBalance().compareTo(next.getMinBalance());
            if (boundary < 0) {
                throw new IllegalStateException("Gap between tiers " + tier.getLabel() + " and " + next.getLabel());
            }
            if (boundary > 0) {
                throw new IllegalStateException("Tiers " + tier.getLabel() + " and " + next.getLabel() + " overlap");
            }
        }
    }

    private static AccountTier tier(String label, String min, String max, String maxLot, String risk, int trades) {
        return AccountTier.builder()
                .label(label)
                .minBalance(new BigDecimal(min))
                .maxBalance(max != null ? new BigDecimal(max) : null)
                .maxLotSize(new BigDecimal(maxLot))
                .riskPercentPerTrade(new BigDecimal(risk))
                .maxConcurrentTrades(trades)
                .build();
    }
}

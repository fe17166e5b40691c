package com.lucidityplatform.common.ledger;

import com.lucidityplatform.common.model.Liability;
import com.lucidityplatform.common.model.LucidityTier;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether an adjustment earns a liability and which one.
 *
 * <p>A liability is rolled when the loss is at least {@code lossThreshold} points or
 * when the tier strictly worsened. Selection is deterministic: the first catalog code
 * the actor does not already carry, falling back to the first catalog code (which then
 * gains a stack). At most one liability is rolled per adjustment.
 */
public final class LiabilityRoller {

    public static final int DEFAULT_LOSS_THRESHOLD = 15;

    public static final List<String> DEFAULT_CATALOG = List.of(
        "night_frayed_reflexes",
        "murmuring_chorus",
        "ritual_compulsion",
        "ethereal_chill",
        "bleak_outlook"
    );

    private final List<String> catalog;
    private final int lossThreshold;

    public LiabilityRoller(List<String> catalog, int lossThreshold) {
        if (catalog == null || catalog.isEmpty()) {
            throw new IllegalArgumentException("Liability catalog must not be empty");
        }
        this.catalog       = List.copyOf(catalog);
        this.lossThreshold = lossThreshold;
    }

    public static LiabilityRoller withDefaults() {
        return new LiabilityRoller(DEFAULT_CATALOG, DEFAULT_LOSS_THRESHOLD);
    }

    public boolean shouldRoll(int delta, LucidityTier previousTier, LucidityTier newTier) {
        boolean severeLoss = delta < 0 && Math.abs(delta) >= lossThreshold;
        return severeLoss || newTier.isWorseThan(previousTier);
    }

    /**
     * Rolls a liability if the adjustment qualifies.
     *
     * @return the chosen code, or empty when nothing is rolled
     */
    public Optional<String> roll(List<Liability> current, int delta,
                                 LucidityTier previousTier, LucidityTier newTier) {
        if (!shouldRoll(delta, previousTier, newTier)) {
            return Optional.empty();
        }
        return Optional.of(pick(current));
    }

    public String pick(List<Liability> current) {
        Set<String> existing = new HashSet<>();
        for (Liability liability : current) {
            existing.add(liability.code());
        }
        for (String code : catalog) {
            if (!existing.contains(code)) {
                return code;
            }
        }
        return catalog.get(0);
    }

    /** Increments the stack for {@code code}, or appends it with one stack. */
    public static List<Liability> stack(List<Liability> current, String code) {
        List<Liability> updated = new ArrayList<>(current.size() + 1);
        boolean found = false;
        for (Liability liability : current) {
            if (!found && liability.code().equals(code)) {
                updated.add(liability.incremented());
                found = true;
            } else {
                updated.add(liability);
            }
        }
        if (!found) {
            updated.add(Liability.single(code));
        }
        return updated;
    }

    /**
     * Removes one stack of {@code code}, or the whole entry when {@code removeAll} is set
     * or only one stack remains. The result equals {@code current} when the code is absent.
     */
    public static List<Liability> reduce(List<Liability> current, String code, boolean removeAll) {
        List<Liability> updated = new ArrayList<>(current.size());
        for (Liability liability : current) {
            if (!liability.code().equals(code)) {
                updated.add(liability);
            } else if (!removeAll && liability.stacks() > 1) {
                updated.add(liability.decremented());
            }
        }
        return updated;
    }
}

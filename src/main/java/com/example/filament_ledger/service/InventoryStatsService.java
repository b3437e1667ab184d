package com.example.filament_ledger.service;

import com.example.filament_ledger.ledger.Spool;
import com.example.filament_ledger.ledger.UsageRecord;
import com.example.filament_ledger.store.InventoryStore;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Usage aggregates over a time window. Records whose spool no longer exists are left out.
 */
@Service
public class InventoryStatsService {
    private static final MathContext COST_PRECISION = MathContext.DECIMAL64;

    private final InventoryStore store;
    private final Clock clock;

    public InventoryStatsService(InventoryStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * @param from inclusive lower bound, {@code null} for unbounded
     * @param to   exclusive upper bound, {@code null} for unbounded
     */
    public UsageSummary summarize(Instant from, Instant to) {
        Map<UUID, Spool> spools = store.allSpools().stream()
                .collect(Collectors.toMap(Spool::id, Function.identity()));
        List<UsageRecord> records = store.allUsage().stream()
                .filter(r -> r.spoolId() != null && spools.containsKey(r.spoolId()))
                .filter(r -> from == null || !r.recordedAt().isBefore(from))
                .filter(r -> to == null || r.recordedAt().isBefore(to))
                .toList();

        double totalMass = 0;
        BigDecimal totalCost = BigDecimal.ZERO;
        Set<UUID> spoolsUsed = new HashSet<>();
        Set<LocalDate> days = new HashSet<>();
        Map<String, MaterialAccumulator> byMaterial = new LinkedHashMap<>();

        for (UsageRecord record : records) {
            Spool spool = spools.get(record.spoolId());
            BigDecimal cost = costOf(record, spool);
            totalMass += record.massGrams();
            totalCost = totalCost.add(cost);
            spoolsUsed.add(spool.id());
            days.add(LocalDate.ofInstant(record.recordedAt(), clock.getZone()));
            byMaterial.computeIfAbsent(materialLabel(spool), k -> new MaterialAccumulator())
                    .add(record.massGrams(), cost);
        }

        double total = totalMass;
        List<MaterialUsage> materials = byMaterial.entrySet().stream()
                .map(e -> new MaterialUsage(e.getKey(), e.getValue().mass,
                        total > 0 ? e.getValue().mass / total * 100 : 0,
                        e.getValue().cost.setScale(2, RoundingMode.HALF_UP)))
                .sorted(Comparator.comparingDouble(MaterialUsage::massGrams).reversed())
                .toList();

        return new UsageSummary(spoolsUsed.size(), totalMass, totalCost.setScale(2, RoundingMode.HALF_UP),
                days.size(), records.size(), materials);
    }

    /**
     * Share of the spool price attributable to this record: {@code price * mass / initial}.
     */
    static BigDecimal costOf(UsageRecord record, Spool spool) {
        if (spool.price() == null || spool.price().signum() <= 0 || spool.initialMassGrams() <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal ratio = BigDecimal.valueOf(record.massGrams())
                .divide(BigDecimal.valueOf(spool.initialMassGrams()), COST_PRECISION);
        return spool.price().multiply(ratio, COST_PRECISION);
    }

    private static String materialLabel(Spool spool) {
        return spool.material() == null || spool.material().isBlank() ? "Unknown" : spool.material();
    }

    private static final class MaterialAccumulator {
        private double mass;
        private BigDecimal cost = BigDecimal.ZERO;

        void add(double grams, BigDecimal amount) {
            mass += grams;
            cost = cost.add(amount);
        }
    }

    public record UsageSummary(int spoolsUsed,
                               double totalMassGrams,
                               BigDecimal totalCost,
                               int printingDays,
                               int usageCount,
                               List<MaterialUsage> materials) {
    }

    public record MaterialUsage(String material, double massGrams, double percentage, BigDecimal cost) {
    }
}

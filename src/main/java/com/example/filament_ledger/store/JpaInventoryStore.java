package com.example.filament_ledger.store;

import com.example.filament_ledger.ledger.LedgerSettings;
import com.example.filament_ledger.ledger.MaterialColor;
import com.example.filament_ledger.ledger.Spool;
import com.example.filament_ledger.ledger.UsageRecord;
import com.example.filament_ledger.model.MaterialColorEntity;
import com.example.filament_ledger.model.SettingsEntity;
import com.example.filament_ledger.model.SpoolEntity;
import com.example.filament_ledger.model.UsageRecordEntity;
import com.example.filament_ledger.repository.MaterialColorRepository;
import com.example.filament_ledger.repository.SettingsRepository;
import com.example.filament_ledger.repository.SpoolRepository;
import com.example.filament_ledger.repository.UsageRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * {@link InventoryStore} on Spring Data JPA. Every public method runs in its own transaction.
 */
@Component
@Transactional
public class JpaInventoryStore implements InventoryStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(JpaInventoryStore.class);

    private final SpoolRepository spoolRepository;
    private final UsageRecordRepository usageRecordRepository;
    private final MaterialColorRepository materialColorRepository;
    private final SettingsRepository settingsRepository;

    public JpaInventoryStore(SpoolRepository spoolRepository,
                             UsageRecordRepository usageRecordRepository,
                             MaterialColorRepository materialColorRepository,
                             SettingsRepository settingsRepository) {
        this.spoolRepository = spoolRepository;
        this.usageRecordRepository = usageRecordRepository;
        this.materialColorRepository = materialColorRepository;
        this.settingsRepository = settingsRepository;
    }

    /* ---------- spools ---------- */

    @Override
    @Transactional(readOnly = true)
    public Optional<Spool> findSpool(UUID id) {
        return spoolRepository.findById(id).map(SpoolEntity::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Spool> allSpools() {
        return spoolRepository.findAll().stream().map(SpoolEntity::toDomain).toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Spool> findSpools(Predicate<Spool> filter) {
        return spoolRepository.findAll().stream().map(SpoolEntity::toDomain).filter(filter).toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Spool> activeSpools() {
        return spoolRepository.findByArchivedFalseOrderByAcquiredAtDesc().stream().map(SpoolEntity::toDomain).toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Spool> archivedSpools() {
        return spoolRepository.findByArchivedTrueOrderByAcquiredAtDesc().stream().map(SpoolEntity::toDomain).toList();
    }

    @Override
    public Spool createSpool(Spool spool) {
        if (spoolRepository.existsById(spool.id())) {
            throw new DuplicateKeyException("SPOOL_EXISTS id=" + spool.id());
        }
        SpoolEntity saved = spoolRepository.save(SpoolEntity.from(spool));
        return saved.toDomain();
    }

    @Override
    public Spool updateSpool(Spool spool) {
        SpoolEntity entity = spoolRepository.findById(spool.id())
                .orElseThrow(() -> new EmptyResultDataAccessException("SPOOL_NOT_FOUND id=" + spool.id(), 1));
        entity.apply(spool);
        return spoolRepository.save(entity).toDomain();
    }

    @Override
    public void deleteSpool(UUID id) {
        spoolRepository.deleteById(id);
    }

    /* ---------- usage records ---------- */

    @Override
    @Transactional(readOnly = true)
    public Optional<UsageRecord> findUsage(UUID id) {
        return usageRecordRepository.findById(id).map(UsageRecordEntity::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public List<UsageRecord> usageForSpool(UUID spoolId) {
        return usageRecordRepository.findBySpoolIdOrderByRecordedAtDesc(spoolId).stream()
                .map(UsageRecordEntity::toDomain)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<UsageRecord> allUsage() {
        return usageRecordRepository.findAll().stream().map(UsageRecordEntity::toDomain).toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<UUID> usageIdsForSpool(UUID spoolId) {
        return usageRecordRepository.findIdsBySpoolId(spoolId);
    }

    @Override
    public UsageRecord createUsage(UsageRecord record) {
        if (usageRecordRepository.existsById(record.id())) {
            throw new DuplicateKeyException("USAGE_EXISTS id=" + record.id());
        }
        return usageRecordRepository.save(UsageRecordEntity.from(record)).toDomain();
    }

    @Override
    public int deleteUsage(Collection<UUID> ids) {
        if (ids.isEmpty()) {
            return 0;
        }
        int deleted = usageRecordRepository.deleteByIdIn(ids);
        LOGGER.debug("JpaInventoryStore deleteUsage requested={} deleted={}", ids.size(), deleted);
        return deleted;
    }

    /* ---------- material colors ---------- */

    @Override
    @Transactional(readOnly = true)
    public List<MaterialColor> allColors() {
        return materialColorRepository.findAllByOrderByMaterialAsc().stream().map(MaterialColorEntity::toDomain).toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<MaterialColor> findColor(String material) {
        return materialColorRepository.findById(MaterialColor.keyOf(material)).map(MaterialColorEntity::toDomain);
    }

    @Override
    public MaterialColor saveColor(MaterialColor color) {
        MaterialColorEntity entity = materialColorRepository.findById(color.key())
                .map(existing -> {
                    existing.setColorHex(color.colorHex());
                    return existing;
                })
                .orElseGet(() -> MaterialColorEntity.from(color));
        return materialColorRepository.save(entity).toDomain();
    }

    @Override
    public void deleteAllColors() {
        materialColorRepository.deleteAllInBatch();
    }

    /* ---------- settings ---------- */

    @Override
    @Transactional(readOnly = true)
    public Optional<LedgerSettings> findSettings() {
        return settingsRepository.findFirstByOrderByIdAsc().map(SettingsEntity::toDomain);
    }

    @Override
    public LedgerSettings saveSettings(LedgerSettings settings) {
        SettingsEntity entity = settingsRepository.findFirstByOrderByIdAsc()
                .map(existing -> {
                    existing.apply(settings);
                    return existing;
                })
                .orElseGet(() -> new SettingsEntity(settings));
        return settingsRepository.save(entity).toDomain();
    }
}

package com.safar.bot.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.safar.bot.dto.BusinessSettings;
import com.safar.bot.dto.FareSettings;
import com.safar.bot.dto.LuggageSettings;
import com.safar.bot.dto.ReturnServiceSettings;
import com.safar.bot.dto.SettingKey;
import com.safar.bot.dto.TravelDateSettings;
import com.safar.bot.entity.AuditLogEntry;
import com.safar.bot.entity.BusinessSetting;
import com.safar.bot.entity.FaqEntry;
import com.safar.bot.exception.TransientStorageException;
import com.safar.bot.repository.AuditLogRepository;
import com.safar.bot.repository.BusinessSettingRepository;
import com.safar.bot.repository.FaqEntryRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Business settings and FAQ rows. Every write is audited, swaps the in-memory snapshot and
 * rebuilds the knowledge base before the write lock is released, so a committed setting and
 * the next knowledge-base read always agree.
 */
@Service
public class SettingsService {

    private static final Logger log = LoggerFactory.getLogger(SettingsService.class);

    static final String FAQ_AUDIT_KEY = "faq";

    private final BusinessSettingRepository settingRepository;
    private final AuditLogRepository auditLogRepository;
    private final FaqEntryRepository faqEntryRepository;
    private final KnowledgeBaseService knowledgeBaseService;
    private final ObjectMapper objectMapper;
    private final PlatformTransactionManager transactionManager;

    private final ReentrantLock writeLock = new ReentrantLock();
    private final AtomicReference<BusinessSettings> snapshot = new AtomicReference<>(BusinessSettings.defaults());
    private final AtomicReference<List<FaqEntry>> faqRows = new AtomicReference<>(Collections.emptyList());

    @Value("${bot.admin.audit-log-size:10}")
    private int auditLogSize = 10;

    @Value("${bot.storage.timeout-seconds:5}")
    private int timeoutSeconds = 5;

    public SettingsService(BusinessSettingRepository settingRepository,
                           AuditLogRepository auditLogRepository,
                           FaqEntryRepository faqEntryRepository,
                           KnowledgeBaseService knowledgeBaseService,
                           ObjectMapper objectMapper,
                           PlatformTransactionManager transactionManager) {
        this.settingRepository = settingRepository;
        this.auditLogRepository = auditLogRepository;
        this.faqEntryRepository = faqEntryRepository;
        this.knowledgeBaseService = knowledgeBaseService;
        this.objectMapper = objectMapper;
        this.transactionManager = transactionManager;
    }

    /** Runs after the seeder. */
    @EventListener(ApplicationReadyEvent.class)
    @Order(2)
    public void init() {
        reload();
    }

    public void reload() {
        writeLock.lock();
        try {
            BusinessSettings defaults = BusinessSettings.defaults();
            BusinessSettings loaded = defaults;
            for (SettingKey key : SettingKey.values()) {
                Optional<BusinessSetting> row = storage(() -> settingRepository.findById(key.getKey()));
                if (row.isPresent()) {
                    try {
                        loaded = loaded.with(key, objectMapper.readValue(row.get().getValueJson(), key.getValueType()));
                    } catch (JsonProcessingException e) {
                        log.error("Setting {} is unreadable, using default", key.getKey(), e);
                    }
                }
            }
            snapshot.set(loaded);
            faqRows.set(List.copyOf(storage(faqEntryRepository::findByActiveTrueOrderByIdAsc)));
            knowledgeBaseService.rebuild(snapshot.get(), faqRows.get());
        } finally {
            writeLock.unlock();
        }
    }

    public BusinessSettings current() {
        return snapshot.get();
    }

    public List<FaqEntry> faqRows() {
        return faqRows.get();
    }

    /**
     * Copies the current value of {@code key}, applies {@code mutation} to the copy and writes it.
     */
    @SuppressWarnings("unchecked")
    public <T> T update(String adminId, SettingKey key, Consumer<T> mutation) {
        writeLock.lock();
        try {
            T copy = (T) objectMapper.convertValue(snapshot.get().get(key), key.getValueType());
            mutation.accept(copy);
            write(adminId, key, copy);
            return copy;
        } finally {
            writeLock.unlock();
        }
    }

    /** Replaces a setting with a JSON document, validated against the setting's type. */
    public Object put(String adminId, SettingKey key, String json) {
        Object value;
        try {
            value = objectMapper.readValue(json, key.getValueType());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON for " + key.getKey() + ": " + e.getOriginalMessage());
        }
        writeLock.lock();
        try {
            write(adminId, key, value);
            return value;
        } finally {
            writeLock.unlock();
        }
    }

    public String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise " + value.getClass().getSimpleName(), e);
        }
    }

    public List<AuditLogEntry> auditLog() {
        List<AuditLogEntry> all = storage(auditLogRepository::findAllByOrderByIdDesc);
        return all.size() > auditLogSize ? new ArrayList<>(all.subList(0, auditLogSize)) : all;
    }

    public int rebuildKnowledgeBase() {
        writeLock.lock();
        try {
            return knowledgeBaseService.rebuild(snapshot.get(), faqRows.get()).size();
        } finally {
            writeLock.unlock();
        }
    }

    public FaqEntry addFaq(String adminId, String question, String answer) {
        if (StringUtils.isAnyBlank(question, answer)) {
            throw new IllegalArgumentException("Question and answer are required");
        }
        writeLock.lock();
        try {
            FaqEntry saved = inTransaction(() -> {
                FaqEntry row = faqEntryRepository.save(FaqEntry.builder()
                        .question(question.trim())
                        .answer(answer.trim())
                        .active(true)
                        .build());
                appendAudit(adminId, FAQ_AUDIT_KEY, null, "add #" + row.getId() + ": " + row.getQuestion());
                return row;
            });
            refreshFaqRows();
            log.info("[{}] FAQ #{} added", adminId, saved.getId());
            return saved;
        } finally {
            writeLock.unlock();
        }
    }

    public boolean removeFaq(String adminId, long id) {
        writeLock.lock();
        try {
            Boolean removed = inTransaction(() -> {
                Optional<FaqEntry> row = faqEntryRepository.findById(id);
                if (row.isEmpty() || !row.get().isActive()) {
                    return false;
                }
                row.get().setActive(false);
                faqEntryRepository.save(row.get());
                appendAudit(adminId, FAQ_AUDIT_KEY, row.get().getQuestion(), "removed #" + id);
                return true;
            });
            if (Boolean.TRUE.equals(removed)) {
                refreshFaqRows();
                log.info("[{}] FAQ #{} removed", adminId, id);
            }
            return Boolean.TRUE.equals(removed);
        } finally {
            writeLock.unlock();
        }
    }

    private void write(String adminId, SettingKey key, Object value) {
        validate(key, value);
        String newJson = toJson(value);
        String previousJson = toJson(snapshot.get().get(key));
        inTransaction(() -> {
            BusinessSetting row = settingRepository.findById(key.getKey())
                    .orElseGet(() -> BusinessSetting.builder().settingKey(key.getKey()).build());
            String oldJson = row.getValueJson() != null ? row.getValueJson() : previousJson;
            row.setValueJson(newJson);
            row.setUpdatedBy(adminId);
            settingRepository.save(row);
            appendAudit(adminId, key.getKey(), oldJson, newJson);
            return null;
        });
        snapshot.set(snapshot.get().with(key, value));
        knowledgeBaseService.rebuild(snapshot.get(), faqRows.get());
        log.info("[{}] setting {} updated", adminId, key.getKey());
    }

    private void refreshFaqRows() {
        faqRows.set(List.copyOf(storage(faqEntryRepository::findByActiveTrueOrderByIdAsc)));
        knowledgeBaseService.rebuild(snapshot.get(), faqRows.get());
    }

    private void appendAudit(String adminId, String key, String oldValue, String newValue) {
        auditLogRepository.save(AuditLogEntry.builder()
                .adminId(StringUtils.defaultIfBlank(adminId, "unknown"))
                .settingKey(key)
                .oldValue(oldValue)
                .newValue(newValue)
                .build());
        List<AuditLogEntry> all = auditLogRepository.findAllByOrderByIdDesc();
        if (all.size() > auditLogSize) {
            auditLogRepository.deleteAll(all.subList(auditLogSize, all.size()));
        }
    }

    private void validate(SettingKey key, Object value) {
        switch (key) {
            case FARES:
                for (Map.Entry<String, Integer> e : ((FareSettings) value).getFares().entrySet()) {
                    if (StringUtils.isBlank(e.getKey()) || e.getValue() == null || e.getValue() <= 0) {
                        throw new IllegalArgumentException("Fares must be positive amounts per route");
                    }
                }
                break;
            case DATES:
                ((TravelDateSettings) value).getDates().values().forEach(list -> list.forEach(this::requireIsoDate));
                break;
            case RETURN_SERVICE:
                String date = ((ReturnServiceSettings) value).getDate();
                if (StringUtils.isNotBlank(date)) {
                    requireIsoDate(date);
                }
                break;
            case LUGGAGE:
                if (((LuggageSettings) value).getMaxBags() < 0) {
                    throw new IllegalArgumentException("maxBags cannot be negative");
                }
                break;
            default:
                break;
        }
    }

    private void requireIsoDate(String date) {
        try {
            LocalDate.parse(date);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid date '" + date + "', expected yyyy-MM-dd");
        }
    }

    private <T> T inTransaction(Supplier<T> work) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setTimeout(timeoutSeconds);
        try {
            return template.execute(status -> work.get());
        } catch (DataAccessException | TransactionException e) {
            log.warn("Settings write failed: {}", e.getMessage());
            throw new TransientStorageException("Settings storage unavailable", e);
        }
    }

    private <T> T storage(Supplier<T> read) {
        try {
            return read.get();
        } catch (DataAccessException e) {
            throw new TransientStorageException("Settings storage unavailable", e);
        }
    }
}

package com.safar.bot.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.safar.bot.dto.BusinessSettings;
import com.safar.bot.dto.SettingKey;
import com.safar.bot.entity.BusinessSetting;
import com.safar.bot.entity.FaqEntry;
import com.safar.bot.repository.BusinessSettingRepository;
import com.safar.bot.repository.FaqEntryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Idempotent seeder: inserts any missing business settings and, on an empty table, a few
 * FAQ rows. Runs before the settings snapshot is loaded. Safe to re-run.
 */
@Component
public class DataInitializer {

    private static final Logger log = LoggerFactory.getLogger(DataInitializer.class);

    private final BusinessSettingRepository settingRepository;
    private final FaqEntryRepository faqEntryRepository;
    private final ObjectMapper objectMapper;

    public DataInitializer(BusinessSettingRepository settingRepository,
                           FaqEntryRepository faqEntryRepository,
                           ObjectMapper objectMapper) {
        this.settingRepository = settingRepository;
        this.faqEntryRepository = faqEntryRepository;
        this.objectMapper = objectMapper;
    }

    @EventListener(ApplicationReadyEvent.class)
    @Order(1)
    public void seed() {
        BusinessSettings defaults = BusinessSettings.defaults();
        int inserted = 0;
        for (SettingKey key : SettingKey.values()) {
            if (!settingRepository.existsById(key.getKey())) {
                settingRepository.save(BusinessSetting.builder()
                        .settingKey(key.getKey())
                        .valueJson(toJson(defaults.get(key)))
                        .updatedBy("seed")
                        .build());
                inserted++;
            }
        }
        if (faqEntryRepository.count() == 0) {
            log.info("Seeding FAQ entries...");
            faqEntryRepository.saveAll(List.of(
                    FaqEntry.builder()
                            .question("How do I pay for my seat?")
                            .answer("Pay via EasyPaisa, JazzCash or bank transfer, then upload the screenshot using the link sent after booking.")
                            .keywords("pay, payment, easypaisa, jazzcash, bank, transfer, account")
                            .category("GENERAL")
                            .build(),
                    FaqEntry.builder()
                            .question("Can I cancel my booking?")
                            .answer("Cancellations are accepted up to 48 hours before departure. Contact the organisers with your booking ID.")
                            .keywords("cancel, cancellation, refund, refunds")
                            .category("GENERAL")
                            .build(),
                    FaqEntry.builder()
                            .question("Is my seat confirmed after booking?")
                            .answer("Your seat is reserved as pending until the payment screenshot is verified, then it is confirmed.")
                            .keywords("confirmed, pending, verified, verification, reserved")
                            .category("SEATS")
                            .build()));
        }
        log.info("DataInitializer: settings inserted={}, faq rows={}", inserted, faqEntryRepository.count());
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise default " + value.getClass().getSimpleName(), e);
        }
    }
}

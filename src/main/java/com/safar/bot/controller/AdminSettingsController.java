package com.safar.bot.controller;

import com.safar.bot.dto.SettingKey;
import com.safar.bot.entity.AuditLogEntry;
import com.safar.bot.exception.TransientStorageException;
import com.safar.bot.service.BookingService;
import com.safar.bot.service.SettingsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Settings and seat overview for the web dashboard. Every call needs the shared admin key.
 */
@RestController
@RequestMapping("/admin")
public class AdminSettingsController {

    private static final Logger log = LoggerFactory.getLogger(AdminSettingsController.class);

    private static final String DEFAULT_ADMIN_ID = "web-admin";

    private final SettingsService settingsService;
    private final BookingService bookingService;
    private final Clock clock;

    @Value("${bot.admin.secret-key:}")
    private String secretKey;

    public AdminSettingsController(SettingsService settingsService, BookingService bookingService, Clock clock) {
        this.settingsService = settingsService;
        this.bookingService = bookingService;
        this.clock = clock;
    }

    @GetMapping(value = "/settings/{key}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> get(@RequestHeader(name = "X-Admin-Key", required = false) String adminKey,
                                 @PathVariable String key) {
        if (!authorized(adminKey)) {
            return unauthorized();
        }
        Optional<SettingKey> settingKey = SettingKey.fromKey(key);
        if (settingKey.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(settingsService.current().get(settingKey.get()));
    }

    @PutMapping(value = "/settings/{key}", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> put(@RequestHeader(name = "X-Admin-Key", required = false) String adminKey,
                                 @RequestHeader(name = "X-Admin-Id", required = false) String adminId,
                                 @PathVariable String key,
                                 @RequestBody String body) {
        if (!authorized(adminKey)) {
            return unauthorized();
        }
        Optional<SettingKey> settingKey = SettingKey.fromKey(key);
        if (settingKey.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        String who = StringUtils.hasText(adminId) ? adminId : DEFAULT_ADMIN_ID;
        Object saved = settingsService.put(who, settingKey.get(), body);
        log.info("[{}] updated {} via admin API", who, settingKey.get().getKey());
        return ResponseEntity.ok(saved);
    }

    @GetMapping(value = "/audit-log", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> auditLog(@RequestHeader(name = "X-Admin-Key", required = false) String adminKey) {
        if (!authorized(adminKey)) {
            return unauthorized();
        }
        List<Map<String, Object>> entries = settingsService.auditLog().stream()
                .map(AdminSettingsController::toView)
                .collect(Collectors.toList());
        return ResponseEntity.ok(entries);
    }

    @GetMapping(value = "/seats", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> seats(@RequestHeader(name = "X-Admin-Key", required = false) String adminKey) {
        if (!authorized(adminKey)) {
            return unauthorized();
        }
        List<Map<String, Object>> overview = bookingService.upcomingTrips(LocalDate.now(clock)).stream()
                .map(BookingQueryController::tripView)
                .collect(Collectors.toList());
        return ResponseEntity.ok(Map.of("overview", overview));
    }

    @PostMapping(value = "/rebuild-kb", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> rebuildKb(@RequestHeader(name = "X-Admin-Key", required = false) String adminKey) {
        if (!authorized(adminKey)) {
            return unauthorized();
        }
        return ResponseEntity.ok(Map.of("entries", settingsService.rebuildKnowledgeBase()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(TransientStorageException.class)
    public ResponseEntity<Map<String, String>> unavailable(TransientStorageException e) {
        log.warn("Admin API storage failure: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", "storage unavailable"));
    }

    private boolean authorized(String adminKey) {
        return StringUtils.hasText(secretKey) && secretKey.equals(adminKey);
    }

    private static ResponseEntity<Map<String, String>> unauthorized() {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(Map.of("error", "unauthorized"));
    }

    private static Map<String, Object> toView(AuditLogEntry e) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", e.getId());
        m.put("createdAt", e.getCreatedAt());
        m.put("adminId", e.getAdminId());
        m.put("settingKey", e.getSettingKey());
        m.put("oldValue", e.getOldValue());
        m.put("newValue", e.getNewValue());
        return m;
    }
}

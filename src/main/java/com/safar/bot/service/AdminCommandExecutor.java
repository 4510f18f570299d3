package com.safar.bot.service;

import com.safar.bot.component.ResponsePhrases;
import com.safar.bot.conversation.ConversationState;
import com.safar.bot.conversation.ConversationTurn;
import com.safar.bot.conversation.TransitionResult;
import com.safar.bot.dto.AdminCommand;
import com.safar.bot.dto.FareSettings;
import com.safar.bot.dto.LocationSettings;
import com.safar.bot.dto.LuggageSettings;
import com.safar.bot.dto.ReturnServiceSettings;
import com.safar.bot.dto.SettingKey;
import com.safar.bot.dto.TravelDateSettings;
import com.safar.bot.entity.AuditLogEntry;
import com.safar.bot.entity.FaqEntry;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Runs parsed admin commands. Each mutation is a single settings write, which audits it and
 * rebuilds the knowledge base before returning.
 */
@Service
public class AdminCommandExecutor {

    private static final Logger log = LoggerFactory.getLogger(AdminCommandExecutor.class);

    private static final int AUDIT_VALUE_MAX = 60;

    private final SettingsService settingsService;
    private final StatusFlowService statusFlowService;
    private final ReplyFactory replies;
    private final ResponsePhrases phrases;
    private final Clock clock;

    public AdminCommandExecutor(SettingsService settingsService,
                                StatusFlowService statusFlowService,
                                ReplyFactory replies,
                                ResponsePhrases phrases,
                                Clock clock) {
        this.settingsService = settingsService;
        this.statusFlowService = statusFlowService;
        this.replies = replies;
        this.phrases = phrases;
        this.clock = clock;
    }

    public TransitionResult showMenu(ConversationTurn turn) {
        return TransitionResult.reset(ConversationState.ADMIN_MENU, List.of(replies.adminMenu(turn.getUserId())));
    }

    public TransitionResult execute(ConversationTurn turn) {
        AdminCommand command = turn.getInput().getAdminCommand();
        String reply;
        try {
            reply = run(turn.getUserId(), command, LocalDate.ofInstant(turn.getNow(), clock.getZone()));
        } catch (IllegalArgumentException e) {
            log.warn("[{}] admin command rejected: {}", turn.getUserId(), e.getMessage());
            reply = e.getMessage();
        }
        return TransitionResult.reset(ConversationState.ADMIN_MENU, List.of(
                replies.text(turn.getUserId(), reply),
                replies.adminMenu(turn.getUserId())));
    }

    String run(String adminId, AdminCommand command, LocalDate today) {
        log.info("[{}] admin command {}", adminId, command);
        switch (command.getKind()) {
            case SHOW_MENU:
                return phrases.adminMenu();
            case SHOW_SETTING: {
                SettingKey key = SettingKey.fromKey(command.arg(AdminCommand.SETTING)).orElse(SettingKey.FARES);
                return key.getKey() + ":\n" + settingsService.toJson(settingsService.current().get(key));
            }
            case SET_FARE: {
                String route = command.arg(AdminCommand.ROUTE);
                int amount = Integer.parseInt(command.arg(AdminCommand.AMOUNT));
                settingsService.<FareSettings>update(adminId, SettingKey.FARES, f -> f.getFares().put(route, amount));
                return phrases.adminUpdated("fare for " + KnowledgeBaseBuilder.displayRoute(route) + " to Rs. " + amount);
            }
            case ADD_DATE:
            case REMOVE_DATE:
                return changeDate(adminId, command);
            case SET_RETURN:
                settingsService.<ReturnServiceSettings>update(adminId, SettingKey.RETURN_SERVICE, r -> {
                    r.setDate(command.arg(AdminCommand.DATE));
                    if (!command.arg(AdminCommand.DESCRIPTION).isEmpty()) {
                        r.setDescription(command.arg(AdminCommand.DESCRIPTION));
                    }
                });
                return phrases.adminUpdated("return service");
            case SET_LUGGAGE: {
                String field = command.arg(AdminCommand.FIELD);
                String value = command.arg(AdminCommand.VALUE);
                settingsService.<LuggageSettings>update(adminId, SettingKey.LUGGAGE, l -> {
                    if ("bags".equals(field)) {
                        l.setMaxBags(Integer.parseInt(value));
                    } else if ("size".equals(field)) {
                        l.setBagSize(value);
                    } else {
                        l.setNote(value);
                    }
                });
                return phrases.adminUpdated("luggage " + field);
            }
            case SET_LOCATION: {
                String point = command.arg(AdminCommand.POINT);
                settingsService.<LocationSettings>update(adminId, SettingKey.LOCATIONS,
                        l -> l.getPoints().put(point, command.arg(AdminCommand.TEXT)));
                return phrases.adminUpdated("pickup point " + point);
            }
            case CLEAR_LOCATIONS:
                settingsService.<LocationSettings>update(adminId, SettingKey.LOCATIONS, l -> l.getPoints().clear());
                return phrases.adminUpdated("pickup points");
            case ADD_FAQ: {
                FaqEntry row = settingsService.addFaq(adminId, command.arg(AdminCommand.QUESTION),
                        command.arg(AdminCommand.ANSWER));
                return phrases.adminUpdated("FAQ #" + row.getId());
            }
            case REMOVE_FAQ: {
                long id = Long.parseLong(command.arg(AdminCommand.ID));
                return settingsService.removeFaq(adminId, id)
                        ? phrases.adminUpdated("FAQ #" + id + " removed")
                        : "FAQ #" + id + " not found.";
            }
            case REBUILD_KB:
                return phrases.adminKbRebuilt(settingsService.rebuildKnowledgeBase());
            case AUDIT:
                return auditText(settingsService.auditLog());
            case SEATS_OVERVIEW:
                return statusFlowService.busStatusText(today);
            case INVALID:
            default:
                return phrases.adminUsage(command.arg(AdminCommand.USAGE));
        }
    }

    private String changeDate(String adminId, AdminCommand command) {
        String route = command.arg(AdminCommand.ROUTE);
        String date = command.arg(AdminCommand.DATE);
        if (settingsService.current().getFares().fareFor(route) == null) {
            return phrases.adminUnknownRoute(route);
        }
        if (command.getKind() == AdminCommand.Kind.ADD_DATE) {
            settingsService.<TravelDateSettings>update(adminId, SettingKey.DATES, d -> d.addDate(route, date));
            return phrases.adminUpdated("dates: added " + date + " for " + KnowledgeBaseBuilder.displayRoute(route));
        }
        if (!settingsService.current().getDates().datesFor(route).contains(date)) {
            return date + " is not scheduled for " + KnowledgeBaseBuilder.displayRoute(route) + ".";
        }
        settingsService.<TravelDateSettings>update(adminId, SettingKey.DATES, d -> d.removeDate(route, date));
        return phrases.adminUpdated("dates: removed " + date + " for " + KnowledgeBaseBuilder.displayRoute(route));
    }

    private String auditText(List<AuditLogEntry> entries) {
        if (entries.isEmpty()) {
            return phrases.adminAuditEmpty();
        }
        StringBuilder sb = new StringBuilder("Last ").append(entries.size()).append(" changes:");
        for (AuditLogEntry e : entries) {
            sb.append("\n- ").append(e.getCreatedAt()).append(" ").append(e.getAdminId())
                    .append(" changed ").append(e.getSettingKey())
                    .append(": ").append(auditValue(e.getOldValue()))
                    .append(" -> ").append(auditValue(e.getNewValue()));
        }
        return sb.toString();
    }

    private static String auditValue(String value) {
        if (StringUtils.isBlank(value)) {
            return "(none)";
        }
        return StringUtils.abbreviate(StringUtils.normalizeSpace(value), AUDIT_VALUE_MAX);
    }
}

package com.safar.bot.service;

import com.safar.bot.conversation.MenuOption;
import com.safar.bot.conversation.OutboundInstruction;
import com.twilio.Twilio;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import jakarta.annotation.PostConstruct;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Sends replies over Twilio's WhatsApp channel. Twilio has no free-form interactive
 * messages, so menus are rendered as text the classifier understands when typed back.
 */
@Service
@ConditionalOnProperty(name = "messaging.provider", havingValue = "twilio")
public class TwilioMessagingService implements OutboundTransport {

    private static final Logger log = LoggerFactory.getLogger(TwilioMessagingService.class);

    private static final String WHATSAPP_PREFIX = "whatsapp:";

    @Value("${twilio.account-sid:}")
    private String accountSid;

    @Value("${twilio.auth-token:}")
    private String authToken;

    @Value("${twilio.whatsapp-from:}")
    private String whatsappFrom;

    private boolean initialised;

    @PostConstruct
    void init() {
        if (StringUtils.isAnyBlank(accountSid, authToken)) {
            log.warn("Twilio credentials not set; outbound WhatsApp messages will be skipped");
            return;
        }
        Twilio.init(accountSid, authToken);
        initialised = true;
    }

    @Override
    public void send(OutboundInstruction instruction) {
        if (instruction == null || StringUtils.isBlank(instruction.getRecipientId())) {
            return;
        }
        if (!initialised || StringUtils.isBlank(whatsappFrom)) {
            log.warn("Twilio credentials not set; skipping send to {}", instruction.getRecipientId());
            return;
        }
        try {
            Message message = Message.creator(
                    new PhoneNumber(toAddress(instruction.getRecipientId())),
                    new PhoneNumber(toAddress(whatsappFrom)),
                    render(instruction)).create();
            log.debug("Twilio message {} queued for {}", message.getSid(), instruction.getRecipientId());
        } catch (Exception e) {
            log.error("Twilio send failed for {}", instruction.getRecipientId(), e);
        }
    }

    String render(OutboundInstruction instruction) {
        switch (instruction.getKind()) {
            case BUTTON_MENU: {
                StringBuilder sb = new StringBuilder(StringUtils.defaultString(instruction.getContent()));
                for (MenuOption option : instruction.getOptions()) {
                    sb.append("\n• ").append(option.getTitle());
                    if (StringUtils.isNotBlank(option.getDescription())) {
                        sb.append(" (").append(option.getDescription()).append(")");
                    }
                }
                if (!instruction.getOptions().isEmpty()) {
                    sb.append("\nReply with an option.");
                }
                return sb.toString();
            }
            case DOCUMENT_LINK:
                return instruction.getContent() + "\n" + instruction.getLink();
            case TEXT:
            default:
                return StringUtils.defaultString(instruction.getContent());
        }
    }

    static String toAddress(String number) {
        String n = StringUtils.removeStart(StringUtils.trimToEmpty(number), WHATSAPP_PREFIX);
        if (!n.startsWith("+")) {
            n = "+" + n;
        }
        return WHATSAPP_PREFIX + n;
    }
}

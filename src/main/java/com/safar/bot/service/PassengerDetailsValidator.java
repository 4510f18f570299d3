package com.safar.bot.service;

import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Pattern;

@Component
public class PassengerDetailsValidator {

    private static final int MIN_NAME = 3;
    private static final int MAX_NAME = 60;

    private final Pattern regNumberPattern;
    private final Pattern phonePattern;

    public PassengerDetailsValidator(@Value("${bot.booking.reg-number-pattern:^20\\d{5}$}") String regNumberPattern,
                                     @Value("${bot.booking.phone-pattern:^03\\d{9}$}") String phonePattern) {
        this.regNumberPattern = Pattern.compile(regNumberPattern);
        this.phonePattern = Pattern.compile(phonePattern);
    }

    public Optional<String> name(String text) {
        String name = StringUtils.normalizeSpace(text);
        if (name == null || name.length() < MIN_NAME || name.length() > MAX_NAME || StringUtils.isNumeric(name)) {
            return Optional.empty();
        }
        return Optional.of(name);
    }

    public Optional<String> regNumber(String text) {
        String reg = StringUtils.trimToEmpty(text);
        return regNumberPattern.matcher(reg).matches() ? Optional.of(reg) : Optional.empty();
    }

    /** Strips dashes and spaces before matching. */
    public Optional<String> phone(String text) {
        String phone = StringUtils.trimToEmpty(text).replace("-", "").replace(" ", "");
        return phonePattern.matcher(phone).matches() ? Optional.of(phone) : Optional.empty();
    }
}

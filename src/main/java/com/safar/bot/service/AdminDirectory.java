package com.safar.bot.service;

import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Authorized admin senders. Numbers compare on digits only with leading zeros dropped;
 * a suffix match of at least 10 digits lets local and international forms agree.
 */
@Component
public class AdminDirectory {

    private static final int MIN_SUFFIX_DIGITS = 10;

    private final Set<String> admins;

    public AdminDirectory(@Value("${bot.admin.phone-numbers:}") String phoneNumbers) {
        this.admins = Arrays.stream(StringUtils.defaultString(phoneNumbers).split(","))
                .map(AdminDirectory::normalize)
                .filter(StringUtils::isNotEmpty)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public boolean isAdmin(String userId) {
        String candidate = normalize(userId);
        if (candidate.isEmpty()) {
            return false;
        }
        for (String admin : admins) {
            if (admin.equals(candidate)) {
                return true;
            }
            String shorter = admin.length() < candidate.length() ? admin : candidate;
            String longer = shorter == admin ? candidate : admin;
            if (shorter.length() >= MIN_SUFFIX_DIGITS && longer.endsWith(shorter)) {
                return true;
            }
        }
        return false;
    }

    public int size() {
        return admins.size();
    }

    static String normalize(String number) {
        String digits = StringUtils.getDigits(StringUtils.defaultString(number));
        return StringUtils.stripStart(digits, "0");
    }
}

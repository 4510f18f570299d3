package com.safar.bot.dto;

import java.util.Arrays;
import java.util.Optional;

public enum SettingKey {

    FARES("fares", FareSettings.class),
    DATES("dates", TravelDateSettings.class),
    RETURN_SERVICE("return_service", ReturnServiceSettings.class),
    LUGGAGE("luggage", LuggageSettings.class),
    LOCATIONS("locations", LocationSettings.class);

    private final String key;
    private final Class<?> valueType;

    SettingKey(String key, Class<?> valueType) {
        this.key = key;
        this.valueType = valueType;
    }

    public String getKey() {
        return key;
    }

    public Class<?> getValueType() {
        return valueType;
    }

    public static Optional<SettingKey> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String k = key.trim().toLowerCase();
        return Arrays.stream(values()).filter(s -> s.key.equals(k)).findFirst();
    }
}

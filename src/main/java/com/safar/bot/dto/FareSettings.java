package com.safar.bot.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Route key (lowercase) to one-way fare in PKR. The keys of this map are the bookable routes.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FareSettings {

    @Builder.Default
    private Map<String, Integer> fares = new LinkedHashMap<>();

    private String currency;

    public Integer fareFor(String route) {
        return route == null ? null : fares.get(route.toLowerCase());
    }
}

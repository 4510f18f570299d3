package com.safar.bot.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Departure dates per route, ISO yyyy-MM-dd strings kept sorted.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TravelDateSettings {

    @Builder.Default
    private Map<String, List<String>> dates = new LinkedHashMap<>();

    private String description;

    public List<String> datesFor(String route) {
        if (route == null) {
            return Collections.emptyList();
        }
        List<String> list = dates.get(route.toLowerCase());
        return list == null ? Collections.emptyList() : list;
    }

    public void addDate(String route, String isoDate) {
        List<String> list = new ArrayList<>(datesFor(route));
        if (!list.contains(isoDate)) {
            list.add(isoDate);
            Collections.sort(list);
        }
        dates.put(route.toLowerCase(), list);
    }

    public boolean removeDate(String route, String isoDate) {
        List<String> list = new ArrayList<>(datesFor(route));
        boolean removed = list.remove(isoDate);
        if (removed) {
            dates.put(route.toLowerCase(), list);
        }
        return removed;
    }
}

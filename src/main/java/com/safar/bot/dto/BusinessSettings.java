package com.safar.bot.dto;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of every business setting. Replaced whole after each write.
 */
public final class BusinessSettings {

    private final FareSettings fares;
    private final TravelDateSettings dates;
    private final ReturnServiceSettings returnService;
    private final LuggageSettings luggage;
    private final LocationSettings locations;

    public BusinessSettings(FareSettings fares, TravelDateSettings dates, ReturnServiceSettings returnService,
                            LuggageSettings luggage, LocationSettings locations) {
        this.fares = fares != null ? fares : new FareSettings();
        this.dates = dates != null ? dates : new TravelDateSettings();
        this.returnService = returnService != null ? returnService : new ReturnServiceSettings();
        this.luggage = luggage != null ? luggage : new LuggageSettings();
        this.locations = locations != null ? locations : new LocationSettings();
    }

    public static BusinessSettings defaults() {
        Map<String, Integer> fares = new LinkedHashMap<>();
        fares.put("multan", 3500);
        fares.put("bahawalpur", 4200);

        Map<String, List<String>> dates = new LinkedHashMap<>();
        dates.put("multan", new ArrayList<>(List.of("2026-12-19", "2026-12-20")));
        dates.put("bahawalpur", new ArrayList<>(List.of("2026-12-19", "2026-12-21")));

        Map<String, String> points = new LinkedHashMap<>();
        points.put("campus", "Main gate, FAST NUCES Lahore");

        return new BusinessSettings(
                FareSettings.builder().fares(fares).currency("PKR").build(),
                TravelDateSettings.builder().dates(dates).description("Buses leave at 9:00 AM from campus").build(),
                ReturnServiceSettings.builder().date("2027-01-18").description("Return buses leave the same routes in the morning").build(),
                LuggageSettings.builder().maxBags(2).bagSize("medium").handCarry(true).note("Oversized items are not allowed").build(),
                LocationSettings.builder().points(points).note("More pickup points will be announced").build());
    }

    public FareSettings getFares() {
        return fares;
    }

    public TravelDateSettings getDates() {
        return dates;
    }

    public ReturnServiceSettings getReturnService() {
        return returnService;
    }

    public LuggageSettings getLuggage() {
        return luggage;
    }

    public LocationSettings getLocations() {
        return locations;
    }

    /** Bookable routes, in fare-setting order. */
    public List<String> routes() {
        return new ArrayList<>(fares.getFares().keySet());
    }

    public Object get(SettingKey key) {
        switch (key) {
            case FARES:
                return fares;
            case DATES:
                return dates;
            case RETURN_SERVICE:
                return returnService;
            case LUGGAGE:
                return luggage;
            case LOCATIONS:
                return locations;
            default:
                throw new IllegalArgumentException("Unknown setting " + key);
        }
    }

    public BusinessSettings with(SettingKey key, Object value) {
        return new BusinessSettings(
                key == SettingKey.FARES ? (FareSettings) value : fares,
                key == SettingKey.DATES ? (TravelDateSettings) value : dates,
                key == SettingKey.RETURN_SERVICE ? (ReturnServiceSettings) value : returnService,
                key == SettingKey.LUGGAGE ? (LuggageSettings) value : luggage,
                key == SettingKey.LOCATIONS ? (LocationSettings) value : locations);
    }
}

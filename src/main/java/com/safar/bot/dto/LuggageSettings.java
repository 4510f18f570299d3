package com.safar.bot.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LuggageSettings {

    private int maxBags;

    private String bagSize;

    private boolean handCarry;

    private String note;
}

package com.safar.bot.conversation;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class MenuOption {

    private final String id;
    private final String title;
    private final String description;

    public static MenuOption of(String id, String title) {
        return new MenuOption(id, title, null);
    }

    public static MenuOption of(String id, String title, String description) {
        return new MenuOption(id, title, description);
    }
}

package com.safar.bot.conversation;

@FunctionalInterface
public interface TransitionHandler {

    TransitionResult handle(ConversationTurn turn);
}

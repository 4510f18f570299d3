package com.safar.bot.service;

import com.safar.bot.conversation.OutboundInstruction;

/**
 * Fire-and-forget delivery of one reply. Implementations log failures and never retry.
 */
public interface OutboundTransport {

    void send(OutboundInstruction instruction);
}

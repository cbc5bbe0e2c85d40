package com.tradingagents.progress.bus;

import com.tradingagents.progress.message.Envelope;

@FunctionalInterface
public interface EnvelopeCallback {

    void onMessage(String topic, Envelope envelope);
}

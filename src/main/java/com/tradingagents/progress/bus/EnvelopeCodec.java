package com.tradingagents.progress.bus;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradingagents.progress.message.Envelope;
import lombok.RequiredArgsConstructor;

/**
 * JSON form of an envelope as it travels through a broker.
 */
@RequiredArgsConstructor
public class EnvelopeCodec {

    private final ObjectMapper objectMapper;

    public String encode(Envelope envelope) throws JsonProcessingException {
        return objectMapper.writeValueAsString(envelope);
    }

    public Envelope decode(String json) throws JsonProcessingException {
        return objectMapper.readValue(json, Envelope.class);
    }
}

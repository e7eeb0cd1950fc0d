package com.acme.resilience.kafka;

import com.acme.resilience.core.EventEnvelope;
import org.apache.kafka.common.serialization.Serializer;

/** Writes envelopes as UTF-8 JSON. */
public class EnvelopeSerializer implements Serializer<EventEnvelope> {

  @Override
  public byte[] serialize(String topic, EventEnvelope data) {
    return data == null ? null : data.serialize();
  }
}

package com.acme.resilience.kafka;

import com.acme.resilience.core.EventEnvelope;
import org.apache.kafka.common.errors.SerializationException;
import org.apache.kafka.common.serialization.Deserializer;

/**
 * Reads envelopes written by {@link EnvelopeSerializer}. Undecodable bytes surface from {@code
 * poll()} as a {@link org.apache.kafka.common.errors.RecordDeserializationException}.
 */
public class EnvelopeDeserializer implements Deserializer<EventEnvelope> {

  @Override
  public EventEnvelope deserialize(String topic, byte[] data) {
    if (data == null) {
      return null;
    }
    try {
      return EventEnvelope.deserialize(data);
    } catch (IllegalArgumentException e) {
      throw new SerializationException("Invalid event envelope on topic " + topic, e);
    }
  }
}

package com.github.adamzv.kafkasearch.ports;

import java.io.IOException;

/**
 * Hook turning raw record values into the bytes callers search and display.
 */
@FunctionalInterface
public interface PayloadDecoder {

  PayloadDecoder IDENTITY = (topic, data) -> data;

  byte[] decode(String topic, byte[] data) throws IOException;
}

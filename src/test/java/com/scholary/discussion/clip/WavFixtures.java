package com.scholary.discussion.clip;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/** Writes small 8 kHz mono 8-bit PCM files; byte {@code i} of the data holds {@code i % 251}. */
final class WavFixtures {

  static final int SAMPLE_RATE = 8000;

  private WavFixtures() {}

  static Path write(Path target, int seconds) throws IOException {
    return write(target, seconds, false);
  }

  /** With {@code listChunk}, a LIST chunk sits between fmt and data. */
  static Path write(Path target, int seconds, boolean listChunk) throws IOException {
    int dataLength = seconds * SAMPLE_RATE;
    byte[] list = listChunk ? "INFOtest".getBytes(StandardCharsets.US_ASCII) : new byte[0];
    int listSize = listChunk ? 8 + list.length : 0;
    ByteBuffer buffer =
        ByteBuffer.allocate(44 + listSize + dataLength).order(ByteOrder.LITTLE_ENDIAN);
    buffer.put("RIFF".getBytes(StandardCharsets.US_ASCII));
    buffer.putInt(36 + listSize + dataLength);
    buffer.put("WAVE".getBytes(StandardCharsets.US_ASCII));
    buffer.put("fmt ".getBytes(StandardCharsets.US_ASCII));
    buffer.putInt(16);
    buffer.putShort((short) 1);
    buffer.putShort((short) 1);
    buffer.putInt(SAMPLE_RATE);
    buffer.putInt(SAMPLE_RATE);
    buffer.putShort((short) 1);
    buffer.putShort((short) 8);
    if (listChunk) {
      buffer.put("LIST".getBytes(StandardCharsets.US_ASCII));
      buffer.putInt(list.length);
      buffer.put(list);
    }
    buffer.put("data".getBytes(StandardCharsets.US_ASCII));
    buffer.putInt(dataLength);
    for (int i = 0; i < dataLength; i++) {
      buffer.put((byte) (i % 251));
    }
    Files.createDirectories(target.getParent());
    Files.write(target, buffer.array());
    return target;
  }
}

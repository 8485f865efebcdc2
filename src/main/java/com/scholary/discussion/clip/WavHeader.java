package com.scholary.discussion.clip;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.channels.WritableByteChannel;
import java.nio.charset.StandardCharsets;

/**
 * Format and data location of a PCM WAV file.
 *
 * <p>Chunks are walked from the RIFF header, so files with extra chunks (LIST, bext) or an
 * extended fmt chunk are handled.
 */
public record WavHeader(
    int audioFormat,
    int channels,
    int sampleRate,
    int byteRate,
    int blockAlign,
    int bitsPerSample,
    long dataOffset,
    long dataLength) {

  static final int RIFF_HEADER_SIZE = 12;
  static final int CANONICAL_HEADER_SIZE = 44;
  private static final int CHUNK_HEADER_SIZE = 8;

  /** Read the header of an open WAV file. */
  public static WavHeader read(FileChannel channel) throws IOException {
    ByteBuffer riff = readAt(channel, 0, RIFF_HEADER_SIZE);
    if (!"RIFF".equals(fourCc(riff, 0)) || !"WAVE".equals(fourCc(riff, 8))) {
      throw new ClipExtractionException("Not a RIFF/WAVE file");
    }

    ByteBuffer fmt = null;
    long dataOffset = -1;
    long dataLength = 0;
    long position = RIFF_HEADER_SIZE;
    long fileSize = channel.size();

    while (position + CHUNK_HEADER_SIZE <= fileSize && (fmt == null || dataOffset < 0)) {
      ByteBuffer chunkHeader = readAt(channel, position, CHUNK_HEADER_SIZE);
      String id = fourCc(chunkHeader, 0);
      long size = Integer.toUnsignedLong(chunkHeader.getInt(4));
      long body = position + CHUNK_HEADER_SIZE;

      if ("fmt ".equals(id)) {
        fmt = readAt(channel, body, (int) Math.min(size, 40));
      } else if ("data".equals(id)) {
        dataOffset = body;
        // Streaming writers leave the size at 0 or 0xFFFFFFFF; use the rest of the file then.
        dataLength = size == 0 || body + size > fileSize ? fileSize - body : size;
      }
      position = body + size + (size % 2);
    }

    if (fmt == null || fmt.limit() < 16) {
      throw new ClipExtractionException("WAV file has no fmt chunk");
    }
    if (dataOffset < 0) {
      throw new ClipExtractionException("WAV file has no data chunk");
    }

    WavHeader header =
        new WavHeader(
            Short.toUnsignedInt(fmt.getShort(0)),
            Short.toUnsignedInt(fmt.getShort(2)),
            fmt.getInt(4),
            fmt.getInt(8),
            Short.toUnsignedInt(fmt.getShort(12)),
            Short.toUnsignedInt(fmt.getShort(14)),
            dataOffset,
            dataLength);
    if (header.byteRate() <= 0 || header.blockAlign() <= 0) {
      throw new ClipExtractionException("WAV file has an invalid fmt chunk: " + header);
    }
    return header;
  }

  public double durationSeconds() {
    return (double) dataLength / byteRate;
  }

  /** Write a canonical 44-byte PCM header with this format and the given data length. */
  public void writeCanonical(WritableByteChannel out, long newDataLength) throws IOException {
    ByteBuffer buffer = ByteBuffer.allocate(CANONICAL_HEADER_SIZE).order(ByteOrder.LITTLE_ENDIAN);
    buffer.put("RIFF".getBytes(StandardCharsets.US_ASCII));
    buffer.putInt((int) (36 + newDataLength));
    buffer.put("WAVE".getBytes(StandardCharsets.US_ASCII));
    buffer.put("fmt ".getBytes(StandardCharsets.US_ASCII));
    buffer.putInt(16);
    buffer.putShort((short) audioFormat);
    buffer.putShort((short) channels);
    buffer.putInt(sampleRate);
    buffer.putInt(byteRate);
    buffer.putShort((short) blockAlign);
    buffer.putShort((short) bitsPerSample);
    buffer.put("data".getBytes(StandardCharsets.US_ASCII));
    buffer.putInt((int) newDataLength);
    buffer.flip();
    while (buffer.hasRemaining()) {
      out.write(buffer);
    }
  }

  private static ByteBuffer readAt(FileChannel channel, long position, int length)
      throws IOException {
    ByteBuffer buffer = ByteBuffer.allocate(length).order(ByteOrder.LITTLE_ENDIAN);
    long offset = position;
    while (buffer.hasRemaining()) {
      int read = channel.read(buffer, offset);
      if (read < 0) {
        throw new ClipExtractionException("Unexpected end of WAV file at byte " + offset);
      }
      offset += read;
    }
    buffer.flip();
    return buffer;
  }

  private static String fourCc(ByteBuffer buffer, int index) {
    byte[] bytes = new byte[4];
    for (int i = 0; i < 4; i++) {
      bytes[i] = buffer.get(index + i);
    }
    return new String(bytes, StandardCharsets.US_ASCII);
  }
}

// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.fedsim.protocol;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/// Frames a byte stream into newline delimited UTF-8 lines. A single `read` may return part of a line or several
/// lines so bytes are buffered until a full line is available. A trailing carriage return is dropped. The end of the
/// stream in the middle of a line is a protocol error rather than a short message.
public final class LineFramer implements LineSource {
  public static final int DEFAULT_MAX_LINE_BYTES = 16 * 1024 * 1024;

  private static final int BUFFER_SIZE = 8192;

  private final InputStream in;
  private final int maxLineBytes;
  private final byte[] buffer = new byte[BUFFER_SIZE];
  private int position = 0;
  private int limit = 0;
  private final ByteArrayOutputStream partial = new ByteArrayOutputStream();

  public LineFramer(InputStream in) {
    this(in, DEFAULT_MAX_LINE_BYTES);
  }

  public LineFramer(InputStream in, int maxLineBytes) {
    if (maxLineBytes <= 0) {
      throw new IllegalArgumentException("maxLineBytes must be positive: " + maxLineBytes);
    }
    this.in = in;
    this.maxLineBytes = maxLineBytes;
  }

  @Override
  public String readLine() throws IOException {
    while (true) {
      if (position == limit) {
        final int read = in.read(buffer);
        if (read < 0) {
          if (partial.size() == 0) {
            return null;
          }
          throw new ProtocolException("stream ended inside a frame after " + partial.size() + " bytes");
        }
        position = 0;
        limit = read;
        continue;
      }
      for (int i = position; i < limit; i++) {
        if (buffer[i] == '\n') {
          append(position, i - position);
          position = i + 1;
          return takeLine();
        }
      }
      append(position, limit - position);
      position = limit;
    }
  }

  private void append(int offset, int length) throws ProtocolException {
    if (partial.size() + length > maxLineBytes) {
      throw new ProtocolException("line exceeds " + maxLineBytes + " bytes");
    }
    partial.write(buffer, offset, length);
  }

  private String takeLine() throws ProtocolException {
    byte[] bytes = partial.toByteArray();
    partial.reset();
    int length = bytes.length;
    if (length > 0 && bytes[length - 1] == '\r') {
      length--;
    }
    try {
      return StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(bytes, 0, length))
          .toString();
    } catch (CharacterCodingException e) {
      throw new ProtocolException("line is not valid UTF-8", e);
    }
  }
}

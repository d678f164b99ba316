package com.gentoro.agentrelay.proxy;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.agentrelay.exception.SerializationException;
import com.gentoro.agentrelay.utility.JacksonUtility;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import okio.BufferedSource;

/**
 * Lazy, finite sequence of JSON chunks read line by line from a newline-delimited JSON stream.
 * Blank lines are skipped. I/O failures surface as {@link UncheckedIOException}.
 */
class NdjsonChunkIterator implements Iterator<JsonNode> {
  private final BufferedSource source;
  private String nextLine;
  private boolean exhausted;

  NdjsonChunkIterator(BufferedSource source) {
    this.source = source;
  }

  @Override
  public boolean hasNext() {
    if (nextLine != null) return true;
    if (exhausted) return false;
    try {
      String line;
      do {
        line = source.readUtf8Line();
      } while (line != null && line.isBlank());
      if (line == null) {
        exhausted = true;
        return false;
      }
      nextLine = line;
      return true;
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  @Override
  public JsonNode next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    String line = nextLine;
    nextLine = null;
    try {
      return JacksonUtility.getJsonMapper().readTree(line);
    } catch (IOException e) {
      throw new SerializationException("Malformed stream chunk: " + line, e);
    }
  }
}

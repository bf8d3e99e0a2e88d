/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package gleaner.util.csv;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.List;

import gleaner.configuration.ConfigurationKeys;


/**
 * Reads delimited records from a character stream, one record per call.
 *
 * <p>
 *   Fields may be enclosed in quotes, in which case they can contain the separator, line breaks and doubled
 *   quotes. Unquoted fields are taken verbatim. Both {@code \n} and {@code \r\n} end a record. A leading byte
 *   order mark is dropped. Empty fields are returned as empty strings.
 * </p>
 */
public class InputStreamCSVReader implements Closeable {
  private static final char BYTE_ORDER_MARK = '\uFEFF';
  private static final int END = -1;

  private final Reader input;
  private final char separator;
  private final char enclosedChar;

  private int pushedBack = Integer.MIN_VALUE;
  private boolean atEOF = false;
  private boolean started = false;
  private int recordNumber = 0;

  public InputStreamCSVReader(String input) {
    this(new StringReader(input));
  }

  public InputStreamCSVReader(InputStream input) {
    this(new InputStreamReader(input, Charset.forName(ConfigurationKeys.DEFAULT_CHARSET_ENCODING)));
  }

  public InputStreamCSVReader(Reader input) {
    this(input, ',', '"');
  }

  public InputStreamCSVReader(Reader input, char separator, char enclosedChar) {
    this.input = input instanceof BufferedReader ? input : new BufferedReader(input);
    this.separator = separator;
    this.enclosedChar = enclosedChar;
  }

  /**
   * @return the next non blank record, or {@code null} at end of input
   */
  public List<String> nextRecord() throws IOException {
    List<String> record = readRecord();
    while (record != null && isBlank(record)) {
      record = readRecord();
    }
    return record;
  }

  /**
   * @return the number of records read so far, blank ones included
   */
  public int getRecordNumber() {
    return this.recordNumber;
  }

  private List<String> readRecord() throws IOException {
    if (this.atEOF) {
      return null;
    }
    if (!this.started) {
      this.started = true;
      int first = read();
      if (first != BYTE_ORDER_MARK) {
        unread(first);
      }
    }

    List<String> record = new ArrayList<>();
    StringBuilder field = new StringBuilder();
    boolean quoted = false;
    boolean afterQuote = false;
    this.recordNumber++;

    while (true) {
      int c = read();

      if (quoted) {
        if (c == END) {
          this.atEOF = true;
          throw new CSVParseException("EOF reached before closing an opened quote", this.recordNumber);
        }
        if (c == this.enclosedChar) {
          int next = read();
          if (next == this.enclosedChar) {
            field.append(this.enclosedChar);
          } else {
            unread(next);
            quoted = false;
            afterQuote = true;
          }
        } else {
          field.append((char) c);
        }
        continue;
      }

      if (c == END) {
        this.atEOF = true;
        if (record.isEmpty() && field.length() == 0 && !afterQuote) {
          this.recordNumber--;
          return null;
        }
        record.add(field.toString());
        return record;
      }
      if (c == '\r') {
        int next = read();
        if (next != '\n') {
          unread(next);
        }
        c = '\n';
      }
      if (c == '\n') {
        record.add(field.toString());
        return record;
      }
      if (c == this.separator) {
        record.add(field.toString());
        field.setLength(0);
        afterQuote = false;
        continue;
      }
      if (afterQuote) {
        throw new CSVParseException("Not expecting more text after end quote", this.recordNumber);
      }
      if (c == this.enclosedChar) {
        if (field.length() > 0) {
          throw new CSVParseException("Found unescaped quote. A value with quote should be within a quote",
              this.recordNumber);
        }
        quoted = true;
        continue;
      }
      field.append((char) c);
    }
  }

  private int read() throws IOException {
    if (this.pushedBack != Integer.MIN_VALUE) {
      int c = this.pushedBack;
      this.pushedBack = Integer.MIN_VALUE;
      return c;
    }
    return this.input.read();
  }

  private void unread(int c) {
    this.pushedBack = c;
  }

  private static boolean isBlank(List<String> record) {
    if (record.isEmpty()) {
      return true;
    }
    return record.size() == 1 && record.get(0).trim().isEmpty();
  }

  @Override
  public void close() throws IOException {
    this.input.close();
  }

  public static class CSVParseException extends IOException {
    private static final long serialVersionUID = 1L;

    private final int recordNumber;

    CSVParseException(String message, int recordNumber) {
      super(message + " (record " + recordNumber + ")");
      this.recordNumber = recordNumber;
    }

    public int getRecordNumber() {
      return this.recordNumber;
    }
  }
}

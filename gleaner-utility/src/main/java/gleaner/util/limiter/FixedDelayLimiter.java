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

package gleaner.util.limiter;

import java.io.Closeable;
import java.io.IOException;
import java.util.concurrent.TimeUnit;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import com.typesafe.config.Config;

import gleaner.configuration.ConfigurationKeys;
import gleaner.util.ConfigUtils;

import lombok.Getter;


/**
 * An implementation of {@link Limiter} that keeps a fixed pause between two consecutive permits.
 *
 * <p>
 *   The first permit after {@link #start()} is issued immediately. Every following call to
 *   {@link #acquirePermits(long)} blocks until at least {@link #getDelayMillis()} have passed since the
 *   previous permit was issued, regardless of how many permits are requested. Permit refills are not
 *   supported: the returned {@link Closeable} does nothing.
 * </p>
 *
 * <p>
 *   Instances are not thread safe; a harvest issues its chunk requests from a single thread.
 * </p>
 */
public class FixedDelayLimiter implements Limiter {

  private static final Closeable NO_OP_CLOSEABLE = new Closeable() {
    @Override
    public void close() throws IOException {
      // Nothing to release
    }
  };

  public static class Factory implements LimiterFactory {
    @Override
    public Limiter buildLimiter(Config config) {
      return new FixedDelayLimiter(ConfigUtils.getLong(config, ConfigurationKeys.FETCH_INTER_CHUNK_DELAY_MS_KEY,
          ConfigurationKeys.DEFAULT_FETCH_INTER_CHUNK_DELAY_MS));
    }
  }

  @Getter
  private final long delayMillis;
  private final Stopwatch sinceLastPermit;
  private boolean issuedAny = false;

  public FixedDelayLimiter(long delayMillis) {
    this(delayMillis, Ticker.systemTicker());
  }

  FixedDelayLimiter(long delayMillis, Ticker ticker) {
    Preconditions.checkArgument(delayMillis >= 0, "Delay must not be negative, got %s", delayMillis);
    this.delayMillis = delayMillis;
    this.sinceLastPermit = Stopwatch.createUnstarted(ticker);
  }

  @Override
  public void start() {
    this.issuedAny = false;
    this.sinceLastPermit.reset();
  }

  @Override
  public Closeable acquirePermits(long permits) throws InterruptedException {
    if (this.issuedAny) {
      long remaining = this.delayMillis - this.sinceLastPermit.elapsed(TimeUnit.MILLISECONDS);
      if (remaining > 0) {
        TimeUnit.MILLISECONDS.sleep(remaining);
      }
    }
    this.issuedAny = true;
    this.sinceLastPermit.reset().start();
    return NO_OP_CLOSEABLE;
  }

  @Override
  public void stop() {
    this.sinceLastPermit.reset();
  }
}

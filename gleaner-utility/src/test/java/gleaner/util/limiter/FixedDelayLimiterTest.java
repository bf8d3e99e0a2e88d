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

import java.util.concurrent.TimeUnit;

import org.testng.Assert;
import org.testng.annotations.Test;

import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableMap;

import gleaner.configuration.ConfigurationKeys;
import gleaner.util.ConfigUtils;


/**
 * Unit tests for {@link FixedDelayLimiter}.
 */
public class FixedDelayLimiterTest {

  private static class ManualTicker extends Ticker {
    private long nanos = 0;

    void advance(long millis) {
      this.nanos += TimeUnit.MILLISECONDS.toNanos(millis);
    }

    @Override
    public long read() {
      return this.nanos;
    }
  }

  @Test
  public void testFirstPermitIsImmediate() throws Exception {
    FixedDelayLimiter limiter = new FixedDelayLimiter(TimeUnit.HOURS.toMillis(1), new ManualTicker());
    limiter.start();
    long begin = System.nanoTime();
    limiter.acquirePermits(1).close();
    Assert.assertTrue(System.nanoTime() - begin < TimeUnit.SECONDS.toNanos(5));
  }

  @Test
  public void testNoWaitOnceDelayElapsed() throws Exception {
    ManualTicker ticker = new ManualTicker();
    FixedDelayLimiter limiter = new FixedDelayLimiter(TimeUnit.HOURS.toMillis(1), ticker);
    limiter.start();
    limiter.acquirePermits(1);
    ticker.advance(TimeUnit.HOURS.toMillis(1));
    long begin = System.nanoTime();
    limiter.acquirePermits(1);
    Assert.assertTrue(System.nanoTime() - begin < TimeUnit.SECONDS.toNanos(5));
  }

  @Test
  public void testWaitsBetweenPermits() throws Exception {
    FixedDelayLimiter limiter = new FixedDelayLimiter(100);
    limiter.start();
    long begin = System.nanoTime();
    for (int i = 0; i < 3; i++) {
      limiter.acquirePermits(1);
    }
    Assert.assertTrue(System.nanoTime() - begin >= TimeUnit.MILLISECONDS.toNanos(200));
  }

  @Test
  public void testStartResetsDelay() throws Exception {
    FixedDelayLimiter limiter = new FixedDelayLimiter(TimeUnit.HOURS.toMillis(1), new ManualTicker());
    limiter.start();
    limiter.acquirePermits(1);
    limiter.stop();
    limiter.start();
    long begin = System.nanoTime();
    limiter.acquirePermits(1);
    Assert.assertTrue(System.nanoTime() - begin < TimeUnit.SECONDS.toNanos(5));
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testNegativeDelay() {
    new FixedDelayLimiter(-1);
  }

  @Test
  public void testFactory() {
    FixedDelayLimiter.Factory factory = new FixedDelayLimiter.Factory();
    FixedDelayLimiter defaults =
        (FixedDelayLimiter) factory.buildLimiter(ConfigUtils.fromMap(ImmutableMap.<String, Object>of()));
    Assert.assertEquals(defaults.getDelayMillis(), ConfigurationKeys.DEFAULT_FETCH_INTER_CHUNK_DELAY_MS);
    Assert.assertEquals(((FixedDelayLimiter) factory.buildLimiter(ConfigUtils.fromMap(
        ImmutableMap.of(ConfigurationKeys.FETCH_INTER_CHUNK_DELAY_MS_KEY, 10)))).getDelayMillis(), 10L);
  }
}

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

package gleaner.runtime;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import org.joda.time.DateTime;
import org.joda.time.LocalDate;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.base.Supplier;
import com.google.common.collect.ImmutableList;

import gleaner.metric.CanonicalMetric;
import gleaner.metric.MetricSource;
import gleaner.source.DateRange;

import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;


/**
 * Client-side storage of the latest metrics per source.
 *
 * <p>
 *   Each source has a single writer: {@link #replace(MetricSource, List)} swaps the whole dataset of that source
 *   in one step, so readers see either the previous or the new snapshot, never a mix.
 * </p>
 */
@Slf4j
public class MetricSnapshotStore {

  private static final Supplier<DateTime> SYSTEM_CLOCK = new Supplier<DateTime>() {
    @Override
    public DateTime get() {
      return DateTime.now();
    }
  };

  @AllArgsConstructor
  private static class Snapshot {
    private static final Snapshot EMPTY =
        new Snapshot(ImmutableList.<CanonicalMetric>of(), Optional.<DateTime>absent());

    private final ImmutableList<CanonicalMetric> metrics;
    private final Optional<DateTime> importedAt;
  }

  private final Map<MetricSource, AtomicReference<Snapshot>> snapshots = new EnumMap<>(MetricSource.class);
  private final Supplier<DateTime> clock;

  public MetricSnapshotStore() {
    this(SYSTEM_CLOCK);
  }

  @VisibleForTesting
  MetricSnapshotStore(Supplier<DateTime> clock) {
    this.clock = clock;
    for (MetricSource source : MetricSource.values()) {
      this.snapshots.put(source, new AtomicReference<>(Snapshot.EMPTY));
    }
  }

  /**
   * Replace the dataset of {@code source} with {@code metrics}, all of which must carry that source.
   */
  public void replace(MetricSource source, List<CanonicalMetric> metrics) {
    for (CanonicalMetric metric : metrics) {
      Preconditions.checkArgument(metric.getSource() == source, "Record of source %s stored as %s",
          metric.getSource(), source);
    }
    this.snapshots.get(source).set(new Snapshot(ImmutableList.copyOf(metrics), Optional.of(this.clock.get())));
    log.info(String.format("Stored %d %s records", metrics.size(), source.getTag()));
  }

  public void clear(MetricSource source) {
    this.snapshots.get(source).set(Snapshot.EMPTY);
  }

  public ImmutableList<CanonicalMetric> get(MetricSource source) {
    return this.snapshots.get(source).get().metrics;
  }

  /**
   * @return the records of all sources, primary first
   */
  public ImmutableList<CanonicalMetric> getAll() {
    ImmutableList.Builder<CanonicalMetric> all = ImmutableList.builder();
    for (MetricSource source : MetricSource.values()) {
      all.addAll(get(source));
    }
    return all.build();
  }

  public DataMetadata getMetadata() {
    Snapshot primary = this.snapshots.get(MetricSource.PRIMARY).get();
    Snapshot secondary = this.snapshots.get(MetricSource.SECONDARY).get();

    Optional<DateTime> lastUpdated = primary.importedAt;
    if (secondary.importedAt.isPresent()
        && (!lastUpdated.isPresent() || secondary.importedAt.get().isAfter(lastUpdated.get()))) {
      lastUpdated = secondary.importedAt;
    }

    return DataMetadata.builder()
        .primaryImported(!primary.metrics.isEmpty())
        .primaryDateRange(dateRangeOf(primary.metrics))
        .primaryDataCount(primary.metrics.size())
        .primaryImportedAt(primary.importedAt)
        .secondaryImported(!secondary.metrics.isEmpty())
        .secondaryDataCount(secondary.metrics.size())
        .secondaryImportedAt(secondary.importedAt)
        .totalDataPoints(primary.metrics.size() + secondary.metrics.size())
        .lastUpdated(lastUpdated)
        .build();
  }

  private static Optional<DateRange> dateRangeOf(List<CanonicalMetric> metrics) {
    LocalDate earliest = null;
    LocalDate latest = null;
    for (CanonicalMetric metric : metrics) {
      LocalDate date = metric.getDate();
      if (date == null) {
        continue;
      }
      if (earliest == null || date.isBefore(earliest)) {
        earliest = date;
      }
      if (latest == null || date.isAfter(latest)) {
        latest = date;
      }
    }
    if (earliest == null) {
      return Optional.absent();
    }
    return Optional.of(new DateRange(earliest, latest));
  }
}

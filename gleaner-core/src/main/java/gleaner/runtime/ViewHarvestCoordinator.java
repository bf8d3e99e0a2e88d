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

import java.io.Closeable;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Optional;
import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.typesafe.config.Config;

import gleaner.configuration.ConfigurationKeys;
import gleaner.source.Credential;
import gleaner.source.HarvestResult;
import gleaner.source.extractor.Harvester;
import gleaner.util.ConfigUtils;

import lombok.extern.slf4j.Slf4j;


/**
 * Runs the harvests of independent views concurrently and publishes their outcome as {@link ViewState}s.
 *
 * <p>
 *   Every {@link #submit(ViewId, FilterState)} starts a new generation for its view. Only the harvest of the
 *   view's latest generation may publish: results of older generations are discarded whatever order they
 *   complete in, and their futures are cancelled. Views never wait on each other.
 * </p>
 */
@Slf4j
public class ViewHarvestCoordinator implements Closeable {

  private final Harvester harvester;
  private final Credential credential;
  private final ListeningExecutorService executor;

  private final Map<ViewId, AtomicReference<ViewState>> states = new EnumMap<>(ViewId.class);
  private final Map<ViewId, ListenableFuture<ViewResult>> inFlight = new EnumMap<>(ViewId.class);

  public ViewHarvestCoordinator(Harvester harvester, Credential credential, Config config) {
    this(harvester, credential, MoreExecutors.listeningDecorator(Executors.newFixedThreadPool(
        ConfigUtils.getInt(config, ConfigurationKeys.COORDINATOR_THREADS_KEY,
            ConfigurationKeys.DEFAULT_COORDINATOR_THREADS),
        new ThreadFactoryBuilder().setDaemon(true).setNameFormat("view-harvest-%d").build())));
  }

  @VisibleForTesting
  ViewHarvestCoordinator(Harvester harvester, Credential credential, ListeningExecutorService executor) {
    this.harvester = harvester;
    this.credential = credential;
    this.executor = executor;
    for (ViewId view : ViewId.values()) {
      this.states.put(view, new AtomicReference<>(ViewState.initial()));
    }
  }

  /**
   * Start harvesting {@code filterState} for {@code view}, superseding whatever the view was loading.
   *
   * @return the generation of the new harvest
   */
  public synchronized long submit(final ViewId view, final FilterState filterState) {
    AtomicReference<ViewState> state = this.states.get(view);
    ViewState previous;
    ViewState loading;
    do {
      previous = state.get();
      loading = previous.loading(previous.getGeneration() + 1, filterState);
    } while (!state.compareAndSet(previous, loading));
    final long generation = loading.getGeneration();

    ListenableFuture<ViewResult> future = this.executor.submit(new Callable<ViewResult>() {
      @Override
      public ViewResult call() throws Exception {
        return harvest(filterState);
      }
    });
    ListenableFuture<ViewResult> stale = this.inFlight.put(view, future);
    if (stale != null && stale.cancel(true)) {
      log.debug(String.format("Cancelled superseded harvest of %s view", view));
    }

    Futures.addCallback(future, new FutureCallback<ViewResult>() {
      @Override
      public void onSuccess(ViewResult result) {
        publish(view, generation, result, Optional.<String>absent());
      }

      @Override
      public void onFailure(Throwable t) {
        if (t instanceof CancellationException) {
          log.debug(String.format("Harvest %d of %s view was cancelled", generation, view));
          return;
        }
        log.error(String.format("Harvest %d of %s view failed", generation, view), t);
        publish(view, generation, null, Optional.of(String.valueOf(t.getMessage())));
      }
    }, MoreExecutors.directExecutor());

    return generation;
  }

  public ViewState getState(ViewId view) {
    return this.states.get(view).get();
  }

  private ViewResult harvest(FilterState filterState) throws Exception {
    HarvestResult current = this.harvester.harvest(this.credential, filterState.getSiteId(),
        filterState.getDateRange(), filterState.getDimensions(), filterState.getMode());
    Optional<HarvestResult> comparison = Optional.absent();
    if (filterState.getComparisonDateRange().isPresent()) {
      comparison = Optional.of(this.harvester.harvest(this.credential, filterState.getSiteId(),
          filterState.getComparisonDateRange().get(), filterState.getDimensions(), filterState.getMode()));
    }
    return new ViewResult(current, comparison);
  }

  /**
   * Replace the view's state unless a newer generation was submitted meanwhile.
   */
  private void publish(ViewId view, long generation, ViewResult result, Optional<String> error) {
    AtomicReference<ViewState> state = this.states.get(view);
    while (true) {
      ViewState current = state.get();
      if (current.getGeneration() != generation) {
        log.warn(String.format("Discarding result of harvest %d of %s view, generation %d is current", generation,
            view, current.getGeneration()));
        return;
      }
      ViewState next = error.isPresent() ? current.failed(error.get()) : current.loaded(result);
      if (state.compareAndSet(current, next)) {
        return;
      }
    }
  }

  @Override
  public void close() {
    this.executor.shutdownNow();
    try {
      if (!this.executor.awaitTermination(5, TimeUnit.SECONDS)) {
        log.warn("View harvests did not terminate in time");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}

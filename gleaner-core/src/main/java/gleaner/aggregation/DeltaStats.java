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

package gleaner.aggregation;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;


/**
 * Change between two {@link AggregateStats}, absolute and in percent.
 *
 * <p>
 *   Position moves the other way round: {@link #getPositionChange()} is {@code previous - current}, so a
 *   positive value means the ranking improved.
 * </p>
 */
@Getter
@Builder
@ToString
@EqualsAndHashCode
public class DeltaStats {
  private final long clicksChange;
  private final double clicksChangePercent;
  private final long impressionsChange;
  private final double impressionsChangePercent;
  private final double ctrChange;
  private final double ctrChangePercent;
  private final double positionChange;
  private final double positionChangePercent;
  private final long volumeChange;
  private final double volumeChangePercent;

  public static DeltaStats between(AggregateStats current, AggregateStats previous) {
    double positionChange = previous.getPosition() - current.getPosition();
    return DeltaStats.builder()
        .clicksChange(current.getTotalClicks() - previous.getTotalClicks())
        .clicksChangePercent(
            ChangeCalculator.rawPercentChange(current.getTotalClicks(), previous.getTotalClicks()))
        .impressionsChange(current.getTotalImpressions() - previous.getTotalImpressions())
        .impressionsChangePercent(
            ChangeCalculator.rawPercentChange(current.getTotalImpressions(), previous.getTotalImpressions()))
        .ctrChange(current.getCtr() - previous.getCtr())
        .ctrChangePercent(ChangeCalculator.rawPercentChange(current.getCtr(), previous.getCtr()))
        .positionChange(positionChange)
        // without a previous rank there is nothing to improve on
        .positionChangePercent(previous.getPosition() > 0 ? positionChange / previous.getPosition() * 100 : 0)
        .volumeChange(current.getTotalVolume() - previous.getTotalVolume())
        .volumeChangePercent(
            ChangeCalculator.rawPercentChange(current.getTotalVolume(), previous.getTotalVolume()))
        .build();
  }
}

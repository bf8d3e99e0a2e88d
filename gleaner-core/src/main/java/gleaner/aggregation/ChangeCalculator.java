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

/**
 * Percentage change with a fixed convention for a zero baseline: growth from nothing counts as 100%, no
 * movement from nothing as 0%.
 */
public class ChangeCalculator {

  /**
   * @return {@code round((current - previous) / previous * 100)} when {@code previous > 0}, otherwise 100 if
   *         {@code current > 0} and 0 if not
   */
  public static long percentChange(double current, double previous) {
    if (previous > 0) {
      return Math.round((current - previous) / previous * 100);
    }
    return current > 0 ? 100 : 0;
  }

  /**
   * Same as {@link #percentChange(double, double)} without rounding.
   */
  public static double rawPercentChange(double current, double previous) {
    if (previous > 0) {
      return (current - previous) / previous * 100;
    }
    return current > 0 ? 100 : 0;
  }
}

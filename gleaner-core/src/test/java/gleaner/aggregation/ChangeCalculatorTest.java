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

import org.testng.Assert;
import org.testng.annotations.Test;


@Test(groups = { "gleaner.aggregation" })
public class ChangeCalculatorTest {

  @Test
  public void testPercentChange() {
    Assert.assertEquals(ChangeCalculator.percentChange(150, 100), 50L);
    Assert.assertEquals(ChangeCalculator.percentChange(50, 100), -50L);
    Assert.assertEquals(ChangeCalculator.percentChange(1, 3), -67L);
  }

  @Test
  public void testZeroBaseline() {
    Assert.assertEquals(ChangeCalculator.percentChange(50, 0), 100L);
    Assert.assertEquals(ChangeCalculator.percentChange(0, 0), 0L);
    Assert.assertEquals(ChangeCalculator.rawPercentChange(0.5, 0), 100.0);
  }

  @Test
  public void testMetricChange() {
    MetricChange change = new MetricChange(8, 2);
    Assert.assertEquals(change.getAbsoluteChange(), -6.0);
    Assert.assertEquals(change.getPercentChange(), -75L);
  }
}

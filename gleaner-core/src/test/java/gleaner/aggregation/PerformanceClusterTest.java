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

import org.joda.time.DateTime;
import org.testng.Assert;
import org.testng.annotations.Test;

import com.google.common.collect.ImmutableList;


@Test(groups = { "gleaner.aggregation" })
public class PerformanceClusterTest {

  private static final DateTime CREATED = new DateTime(2024, 6, 1, 12, 0);

  @Test
  public void testMatchesEitherWayIgnoringCase() {
    PerformanceCluster cluster = new PerformanceCluster("blog", "Blog",
        ImmutableList.of("https://example.com/Blog", ""), CREATED, CREATED);

    Assert.assertTrue(cluster.matches("https://example.com/blog/post-1"));
    Assert.assertTrue(cluster.matches("example.com/blog"));
    Assert.assertFalse(cluster.matches("https://example.com/shop"));
    Assert.assertFalse(cluster.matches(""));
    Assert.assertFalse(cluster.matches(null));
  }

  @Test
  public void testEmptyClusterMatchesNothing() {
    PerformanceCluster cluster = new PerformanceCluster("empty", "Empty", ImmutableList.<String>of(), CREATED,
        CREATED);
    Assert.assertFalse(cluster.matches("https://example.com/"));
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testIdRequired() {
    new PerformanceCluster("", "Nameless", ImmutableList.of("/a"), CREATED, CREATED);
  }
}

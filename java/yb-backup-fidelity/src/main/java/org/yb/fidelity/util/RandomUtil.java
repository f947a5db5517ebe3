// Copyright (c) YugaByte, Inc.
//
// Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
// in compliance with the License.  You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software distributed under the License
// is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
// or implied.  See the License for the specific language governing permissions and limitations
// under the License.
//
package org.yb.fidelity.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Random;

/**
 * Seeding and small helpers for the explicitly threaded {@link Random} instances used by the
 * generators. Nothing here keeps global random state.
 */
public final class RandomUtil {
  private static final Logger LOG = LoggerFactory.getLogger(RandomUtil.class);

  private static final String NONBLOCKING_RANDOM_DEVICE = "/dev/urandom";

  private RandomUtil() {
  }

  /**
   * Produces a fresh seed, mixing the clock with bytes from /dev/urandom when available.
   */
  public static long newSeed() {
    long seed = System.nanoTime();
    if (new File(NONBLOCKING_RANDOM_DEVICE).exists()) {
      try (InputStream in = new FileInputStream(NONBLOCKING_RANDOM_DEVICE)) {
        for (int i = 0; i < 64; ++i) {
          seed = seed * 37 + in.read();
        }
      } catch (IOException ex) {
        LOG.warn("Failed to read from " + NONBLOCKING_RANDOM_DEVICE + " to seed random generator",
            ex);
      }
    }
    return seed;
  }

  public static <T> T getRandomElement(List<T> list, Random random) {
    return list.get(random.nextInt(list.size()));
  }
}

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

import java.util.concurrent.ConcurrentSkipListSet;

public final class EnvAndSysPropertyUtil {

  private static final Logger LOG = LoggerFactory.getLogger(EnvAndSysPropertyUtil.class);
  private static final ConcurrentSkipListSet<String> discrepanciesReportedForEnvVars =
      new ConcurrentSkipListSet<>();

  private EnvAndSysPropertyUtil() {
  }

  /**
   * Maps an environment variable name such as "YB_FIDELITY_SEED" to its system property
   * counterpart, "yb.fidelity.seed".
   */
  public static String toSystemPropertyName(String envVarName) {
    return envVarName.replace('_', '.').toLowerCase();
  }

  /**
   * Gets an environment variable or a system property. Environment variables take precedence.
   *
   * @param envVarName environment variable name, e.g. YB_FIDELITY_SEED
   * @param defaultValue default value to return if neither environment variable nor the system
   *                     property is defined.
   */
  public static String getEnvVarOrSystemProperty(String envVarName, String defaultValue) {
    final String systemPropertyName = toSystemPropertyName(envVarName);

    final String envVarValue = System.getenv(envVarName);
    final String systemPropertyValue = System.getProperty(systemPropertyName);
    if (envVarValue != null &&
        systemPropertyValue != null &&
        !envVarValue.equals(systemPropertyValue) &&
        discrepanciesReportedForEnvVars.add(envVarName)) {
      LOG.warn("Conflicting values for environment variable {} ({}) and system property {} ({})",
          envVarName, envVarValue, systemPropertyName, systemPropertyValue);
    }

    if (envVarValue != null) {
      return envVarValue;
    }
    if (systemPropertyValue != null) {
      return systemPropertyValue;
    }
    return defaultValue;
  }

  public static String getEnvVarOrSystemProperty(String envVarName) {
    return getEnvVarOrSystemProperty(envVarName, null);
  }

  public static long getLongEnvVarOrSystemProperty(String envVarName, long defaultValue) {
    String strValue = getEnvVarOrSystemProperty(envVarName);
    if (strValue == null || strValue.trim().isEmpty()) {
      return defaultValue;
    }
    try {
      return Long.parseLong(strValue.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          "Invalid value for " + envVarName + ", expected an integer: " + strValue, e);
    }
  }

  public static int getIntEnvVarOrSystemProperty(String envVarName, int defaultValue) {
    long value = getLongEnvVarOrSystemProperty(envVarName, defaultValue);
    if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
      throw new IllegalArgumentException(
          "Value of " + envVarName + " is out of the int range: " + value);
    }
    return (int) value;
  }
}

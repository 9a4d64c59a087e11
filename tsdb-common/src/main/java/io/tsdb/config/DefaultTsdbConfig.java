/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.tsdb.config;

import java.io.Serializable;
import java.util.Properties;

/**
 * Default way to load a config through a {@link java.util.Properties}.
 */
public class DefaultTsdbConfig implements Serializable {

  protected final Properties props;

  public DefaultTsdbConfig(Properties props) {
    this.props = props;
  }

  public static void setDefaultOnCondition(Properties props, boolean condition, String propName, String defaultValue) {
    if (condition) {
      props.setProperty(propName, defaultValue);
    }
  }

  /**
   * Sets the default of {@code option} unless the properties already carry its key.
   */
  public static <T> void setDefaultValue(Properties props, ConfigOption<T> option) {
    setDefaultOnCondition(props, !props.containsKey(option.key()), option.key(), String.valueOf(option.defaultValue()));
  }

  public <T> String getString(ConfigOption<T> option) {
    return props.getProperty(option.key(), String.valueOf(option.defaultValue()));
  }

  public Properties getProps() {
    return props;
  }

}

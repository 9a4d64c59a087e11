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

package io.tsdb.partition;

import io.tsdb.config.ConfigOption;
import io.tsdb.config.DefaultTsdbConfig;

import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.util.Properties;

/**
 * Partition key related config.
 */
public class PartitionKeyConfig extends DefaultTsdbConfig {

  public static final ConfigOption<String> DEFAULT_TIME_FORMAT = ConfigOption
      .key("tsdb.partition.default.time.format")
      .defaultValue("%Y-%m-%d")
      .withDocumentation("strftime format of the single time part used by tables that carry no "
          + "partition template of their own.");

  private PartitionKeyConfig(Properties props) {
    super(props);
  }

  public static PartitionKeyConfig.Builder newBuilder() {
    return new Builder();
  }

  public String getDefaultTimeFormat() {
    return getString(DEFAULT_TIME_FORMAT);
  }

  public static class Builder {

    private final Properties props = new Properties();

    public Builder fromFile(File propertiesFile) throws IOException {
      try (FileReader reader = new FileReader(propertiesFile)) {
        this.props.load(reader);
        return this;
      }
    }

    public Builder fromProperties(Properties props) {
      this.props.putAll(props);
      return this;
    }

    public Builder defaultTimeFormat(String format) {
      props.setProperty(DEFAULT_TIME_FORMAT.key(), format);
      return this;
    }

    public PartitionKeyConfig build() {
      PartitionKeyConfig config = new PartitionKeyConfig(props);
      setDefaultValue(props, DEFAULT_TIME_FORMAT);
      return config;
    }
  }
}

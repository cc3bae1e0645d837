/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.quarry.etl;

import java.io.IOException;

/**
 * Base class for failures raised by acquisition and conversion operations.
 *
 * <p>Subclasses distinguish the conditions an orchestration layer reacts to
 * differently: retry ({@link SourceUnavailableException}), force a refresh
 * ({@link PartialFetchException}) or abort ({@link UnsupportedFormatException},
 * {@link ConversionException}).
 */
public class EtlException extends IOException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a new EtlException with the specified message.
   */
  public EtlException(String message) {
    super(message);
  }

  /**
   * Creates a new EtlException with the specified message and cause.
   */
  public EtlException(String message, Throwable cause) {
    super(message, cause);
  }
}

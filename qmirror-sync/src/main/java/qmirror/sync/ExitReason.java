/*
 * Copyright 2014 WANdisco
 *
 *  WANdisco licenses this file to you under the Apache License,
 *  version 2.0 (the "License"); you may not use this file except in compliance
 *  with the License. You may obtain a copy of the License at:
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 *  WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 *  License for the specific language governing permissions and limitations
 *  under the License.
 */

package qmirror.sync;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Why a {@link SyncEndpoint} terminated. Only normal termination is silent towards linked endpoints;
 * every other reason is propagated to them as an exit signal.
 */
public final class ExitReason {
  public static final ExitReason NORMAL = new ExitReason("normal", null, true);
  public static final ExitReason NO_PROCESS = new ExitReason("noproc", null, false);
  public static final ExitReason SHUTDOWN = new ExitReason("shutdown", null, false);

  private final String description;
  @Nullable
  private final Throwable cause;
  private final boolean normal;

  private ExitReason(String description, @Nullable Throwable cause, boolean normal) {
    this.description = description;
    this.cause = cause;
    this.normal = normal;
  }

  public static ExitReason abnormal(String description) {
    return new ExitReason(description, null, false);
  }

  public static ExitReason crashed(Throwable cause) {
    return new ExitReason(String.valueOf(cause), cause, false);
  }

  public boolean isNormal() {
    return normal;
  }

  public String getDescription() {
    return description;
  }

  @Nullable
  public Throwable getCause() {
    return cause;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    ExitReason that = (ExitReason) o;
    return normal == that.normal
        && description.equals(that.description)
        && Objects.equals(cause, that.cause);
  }

  @Override
  public int hashCode() {
    return Objects.hash(description, cause, normal);
  }

  @Override
  public String toString() {
    return description;
  }
}

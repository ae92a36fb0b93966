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

package qmirror.sync.msg;

import org.jetbrains.annotations.Nullable;
import qmirror.sync.ExitReason;
import qmirror.sync.SyncEndpoint;

/**
 * Delivered to an endpoint when a linked endpoint terminates abnormally, or when someone asks the
 * endpoint to exit. {@code from} is null if the request came from outside any endpoint.
 */
public class ExitSignal extends SyncSignal {
  @Nullable
  public final SyncEndpoint from;
  public final ExitReason reason;

  public ExitSignal(@Nullable SyncEndpoint from, ExitReason reason) {
    this.from = from;
    this.reason = reason;
  }

  @Override
  public String toString() {
    return "ExitSignal{from=" + from + ", reason=" + reason + '}';
  }
}

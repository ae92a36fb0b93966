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

import java.util.UUID;

/**
 * Token identifying one sync round. Every protocol signal of a round carries it, so that signals left
 * over from another round can be recognised and ignored.
 */
public final class SyncRef {
  private final UUID id;

  private SyncRef(UUID id) {
    this.id = id;
  }

  public static SyncRef newRef() {
    return new SyncRef(UUID.randomUUID());
  }

  @Override
  public boolean equals(Object o) {
    return this == o
        || (o instanceof SyncRef && id.equals(((SyncRef) o).id));
  }

  @Override
  public int hashCode() {
    return id.hashCode();
  }

  @Override
  public String toString() {
    return "SyncRef{" + id + '}';
  }
}

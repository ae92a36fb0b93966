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

import com.google.common.base.Preconditions;
import qmirror.SyncConstants;

/**
 * Bounds of a credit flow: how many messages a sender may send to a peer before it must hear back,
 * and after how many consumed messages the peer grants that many more.
 */
public final class CreditSpec {
  public static final CreditSpec DISC_BOUND =
      new CreditSpec(SyncConstants.SYNC_CREDIT_INITIAL, SyncConstants.SYNC_CREDIT_MORE_AFTER);

  public final int initialCredit;
  public final int moreCreditAfter;

  public CreditSpec(int initialCredit, int moreCreditAfter) {
    Preconditions.checkArgument(initialCredit > 0, "initialCredit must be positive");
    Preconditions.checkArgument(moreCreditAfter > 0, "moreCreditAfter must be positive");
    this.initialCredit = initialCredit;
    this.moreCreditAfter = moreCreditAfter;
  }

  @Override
  public String toString() {
    return "{" + initialCredit + ", " + moreCreditAfter + "}";
  }
}

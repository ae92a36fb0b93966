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

/**
 * Bulk synchronisation of a mirrored queue's backlog from its master to newly joined slaves.
 * <p>
 * Each participant is a {@link qmirror.sync.SyncEndpoint} driven by a jetlang fiber. The master
 * streams its store through a per-round {@link qmirror.sync.Syncer}, which fans every message out
 * to the slaves under {@link qmirror.sync.CreditFlow} backpressure. Slaves take part through a
 * {@link qmirror.sync.SlaveReceiver}.
 */
package qmirror.sync;

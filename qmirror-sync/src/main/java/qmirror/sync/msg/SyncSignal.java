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

/**
 * Anything that can be delivered to the inbox of a {@link qmirror.sync.SyncEndpoint}.
 * <p>
 * The subclasses exist so handlers can be clear about what they accept. They fall in 3 groups:
 * <ul>
 * <li>round signals, which carry the {@link qmirror.sync.SyncRef} of the round they belong to
 * (see {@link RoundSignal})</li>
 * <li>process signals generated by monitors and links: {@link PeerDown}, {@link ExitSignal}</li>
 * <li>everything else: credit bumps and administrative casts to a queue replica</li>
 * </ul>
 */
public abstract class SyncSignal {
}

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.bedrock.adapter.outbound.bedrock;

/**
 * Connection refresh budget of one invocation client.
 *
 * <p>
 * {@code attemptCount} only grows, one per refresh, until {@link #reset()} is
 * called after a successful connection or invocation. Once it reaches
 * {@code maxAttempts} no further refresh is granted.
 */
public class ConnectionState {

    private final int maxAttempts;
    private int attemptCount;

    public ConnectionState(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    /**
     * Claim one refresh.
     *
     * @return the new attempt count, or -1 when the budget is used up
     */
    public synchronized int tryBeginRefresh() {
        if (attemptCount >= maxAttempts) {
            return -1;
        }
        attemptCount++;
        return attemptCount;
    }

    public synchronized void reset() {
        attemptCount = 0;
    }

    public synchronized int getAttemptCount() {
        return attemptCount;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public synchronized boolean isExhausted() {
        return attemptCount >= maxAttempts;
    }
}

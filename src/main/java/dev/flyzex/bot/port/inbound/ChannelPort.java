package dev.flyzex.bot.port.inbound;

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

/**
 * Port for inbound chat channels. Implementations manage the connection
 * lifecycle.
 */
public interface ChannelPort {

    /**
     * Returns the channel type identifier (e.g. "telegram").
     */
    String getChannelType();

    /**
     * Whether the channel is configured to run at all.
     */
    boolean isEnabled();

    /**
     * Starts listening for incoming updates.
     */
    void start();

    /**
     * Stops listening and disconnects.
     */
    void stop();

    boolean isRunning();
}

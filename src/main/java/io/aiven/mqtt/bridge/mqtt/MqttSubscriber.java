/*
 * Copyright 2026 Aiven Oy
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.aiven.mqtt.bridge.mqtt;

public interface MqttSubscriber {

    /**
     * Connects to the broker, subscribes to the configured topic filters and blocks until {@link #shutdown()} is
     * called. The client is disconnected before returning.
     *
     * @throws MqttSubscriberException
     *             if the initial connection can't be established
     */
    void run();

    void shutdown();

}

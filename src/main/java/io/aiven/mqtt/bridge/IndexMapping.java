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
package io.aiven.mqtt.bridge;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * One entry of the topic mapping file.
 *
 * @param topicFilter
 *            the MQTT subscription, possibly containing {@code +} or {@code #}
 * @param indexNameTemplate
 *            index name, optionally with {@code {Y}}, {@code {m}} and {@code {d}} placeholders
 * @param indexBody
 *            settings and mappings used when the index has to be created
 */
public record IndexMapping(String topicFilter, String indexNameTemplate, ObjectNode indexBody) {
}

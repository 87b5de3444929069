package me.golemcore.coder.domain.graph;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import me.golemcore.coder.domain.model.Message;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Detects the model issuing the same tool batch over and over. A batch
 * signature is the sorted list of {@code name:arguments} entries, arguments
 * serialized with sorted keys.
 */
public class RepeatedCallGuard {

    private static final ObjectMapper SIGNATURE_MAPPER = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private final int maxConsecutiveRepeats;
    private String lastSignature;
    private int consecutiveRepeats;

    public RepeatedCallGuard(int maxConsecutiveRepeats) {
        this.maxConsecutiveRepeats = maxConsecutiveRepeats;
    }

    /**
     * Records a batch and returns true when the loop must stop: the batch equals
     * the previous one for {@code maxConsecutiveRepeats} turns in a row.
     */
    public boolean recordAndCheck(List<Message.ToolCall> toolCalls) {
        String signature = signature(toolCalls);
        if (signature.equals(lastSignature)) {
            consecutiveRepeats++;
        } else {
            consecutiveRepeats = 0;
        }
        lastSignature = signature;
        return consecutiveRepeats >= maxConsecutiveRepeats;
    }

    public int getConsecutiveRepeats() {
        return consecutiveRepeats;
    }

    static String signature(List<Message.ToolCall> toolCalls) {
        return toolCalls.stream()
                .map(call -> call.getName() + ":" + serialize(call.getArguments()))
                .sorted()
                .collect(Collectors.joining("|"));
    }

    private static String serialize(Map<String, Object> arguments) {
        if (arguments == null) {
            return "{}";
        }
        try {
            return SIGNATURE_MAPPER.writeValueAsString(arguments);
        } catch (JsonProcessingException e) {
            return String.valueOf(arguments);
        }
    }
}

package me.golemcore.coder.domain.model;

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

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class VerificationResult {

    List<VerificationCheck> checks;
    boolean allPassed;
    List<String> suggestions;
    List<String> executedCommands;

    public List<VerificationCheck> failedChecks() {
        return checks.stream().filter(check -> !check.isPassed()).toList();
    }

    public static VerificationResult empty() {
        return VerificationResult.builder()
                .checks(List.of())
                .allPassed(true)
                .suggestions(List.of())
                .executedCommands(List.of())
                .build();
    }
}

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
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Classified risk items of one pending batch, split by how the approval policy
 * must treat them.
 */
@Data
@Builder
public class ApprovalRiskAnalysis {

    @Builder.Default
    private List<ApprovalRiskItem> dangerous = new ArrayList<>();
    @Builder.Default
    private List<ApprovalRiskItem> mandatoryApproval = new ArrayList<>();
    @Builder.Default
    private List<ApprovalRiskItem> requiresExplicitApproval = new ArrayList<>();
    @Builder.Default
    private RiskSeverity riskLevel = RiskSeverity.LOW;

    public boolean hasDangerous() {
        return !dangerous.isEmpty();
    }

    public boolean hasMandatoryApproval() {
        return !mandatoryApproval.isEmpty();
    }

    public boolean hasExplicitApproval() {
        return !requiresExplicitApproval.isEmpty();
    }

    public List<ApprovalRiskItem> allItems() {
        List<ApprovalRiskItem> all = new ArrayList<>(dangerous);
        all.addAll(mandatoryApproval);
        all.addAll(requiresExplicitApproval);
        return all;
    }
}

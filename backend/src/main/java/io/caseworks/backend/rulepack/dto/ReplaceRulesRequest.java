package io.caseworks.backend.rulepack.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.util.List;

public record ReplaceRulesRequest(@NotNull @Valid List<AttachRuleRequest> rules) {}

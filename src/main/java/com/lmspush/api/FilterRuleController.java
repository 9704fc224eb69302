package com.lmspush.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.lmspush.content.ContentRecord;
import com.lmspush.content.ContentType;
import com.lmspush.content.Grade;
import com.lmspush.filter.FilterCheck;
import com.lmspush.filter.FilterDecision;
import com.lmspush.filter.FilterRule;
import com.lmspush.filter.FilterRuleService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.Set;

@RestController
@RequestMapping("/v1/filter-rules")
public class FilterRuleController {

    private final FilterRuleService filterRuleService;

    public FilterRuleController(FilterRuleService filterRuleService) {
        this.filterRuleService = filterRuleService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Map<String, Object> create(@RequestBody FilterRule definition) {
        FilterRule rule = filterRuleService.create(definition);
        return Map.of(
            "message", "filter rule created",
            "rule_id", rule.id()
        );
    }

    @GetMapping
    public List<FilterRule> list() {
        return filterRuleService.list();
    }

    /**
     * Rule debugging: reports whether content would pass, without pushing anything.
     *
     * Expected request body:
     * {
     *   "content": { ... },
     *   "rule_id": "...",   // optional, a stored rule
     *   "rule": { ... }     // optional, an inline rule; both absent = all active rules
     * }
     */
    @PostMapping("/test")
    public FilterTestResponse test(@RequestBody FilterTestRequest request) {
        FilterDecision decision = filterRuleService.diagnose(request.content(), request.ruleId(), request.rule());
        ContentRecord content = request.content();
        return new FilterTestResponse(
            decision.passed(),
            decision.reason(),
            decision.failedCheck(),
            new FilterTestResponse.ContentSummary(content.contentType(), content.grade(), content.tags()));
    }

    public record FilterTestRequest(
        @JsonProperty("content") ContentRecord content,
        @JsonProperty("rule_id") String ruleId,
        @JsonProperty("rule") FilterRule rule
    ) {}

    public record FilterTestResponse(
        @JsonProperty("should_push") boolean shouldPush,
        @JsonProperty("reason") String reason,
        @JsonProperty("failed_check") FilterCheck failedCheck,
        @JsonProperty("content_summary") ContentSummary contentSummary
    ) {

        public record ContentSummary(
            @JsonProperty("type") ContentType type,
            @JsonProperty("grade") Grade grade,
            @JsonProperty("tags") Set<String> tags
        ) {}
    }
}

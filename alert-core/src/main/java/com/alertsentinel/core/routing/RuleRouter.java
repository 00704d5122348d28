package com.alertsentinel.core.routing;

import com.alertsentinel.core.model.AlertRule;
import com.alertsentinel.core.model.RuleSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered list of {@link AlertRule}s, evaluated top-down.
 *
 * <p>
 * The first rule whose job pattern matches wins, however specific a later
 * rule may be. Severity is not considered while matching.
 * </p>
 *
 * @since 1.0.0
 */
public class RuleRouter {

    private static final Logger LOG = LoggerFactory.getLogger(RuleRouter.class);

    /** Channels used when no rule matches at all. */
    public static final List<String> DEFAULT_CHANNELS = AlertRule.DEFAULT_CHANNELS;

    private final List<AlertRule> rules = new ArrayList<>();

    /**
     * Append a rule at the lowest priority.
     *
     * <p>
     * The router keeps its own copy, so later changes to {@code rule} have
     * no effect on routing.
     * </p>
     *
     * @param rule rule to register; validated before insertion
     * @throws IllegalStateException    if the rule is malformed
     * @throws IllegalArgumentException if a rule with the same name exists
     */
    public void add(AlertRule rule) {
        AlertRule registered = AlertRule.copyOf(rule);
        registered.validate();
        for (AlertRule existing : rules) {
            if (existing.getName().equals(registered.getName())) {
                throw new IllegalArgumentException("Alert rule already registered: " + registered.getName());
            }
        }
        rules.add(registered);
        LOG.info("Added alert rule: {}", registered.getName());
    }

    /**
     * @param name rule name
     * @return {@code true} if a rule was removed
     */
    public boolean remove(String name) {
        boolean removed = rules.removeIf(r -> Objects.equals(r.getName(), name));
        if (removed) {
            LOG.info("Removed alert rule: {}", name);
        }
        return removed;
    }

    /**
     * @param jobName job identity
     * @return the first matching rule, or empty if none matches
     */
    public Optional<AlertRule> resolve(String jobName) {
        for (AlertRule rule : rules) {
            if (rule.matchesJob(jobName)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    /**
     * Channel precedence: caller override, then the rule's channels, then
     * {@link #DEFAULT_CHANNELS}.
     *
     * @param rule     resolved rule, may be empty
     * @param override caller-supplied channels, may be {@code null}
     * @return channels to deliver on
     */
    public static List<String> resolveChannels(Optional<AlertRule> rule, List<String> override) {
        if (override != null) {
            return List.copyOf(override);
        }
        return rule.map(AlertRule::getChannels).orElse(DEFAULT_CHANNELS);
    }

    public List<RuleSummary> summaries() {
        return rules.stream().map(AlertRule::summarize).toList();
    }

    public int size() {
        return rules.size();
    }
}

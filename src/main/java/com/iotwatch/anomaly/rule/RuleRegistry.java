package com.iotwatch.anomaly.rule;

import com.iotwatch.anomaly.dispatch.FailureReporter;
import com.iotwatch.anomaly.dispatch.NotificationChannel;
import com.iotwatch.anomaly.model.OperatorFailure;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * RuleRegistry - holder of the active {@link RuleSet}.
 *
 * <h2>Consistency</h2>
 * <p>The active set lives behind a single {@link AtomicReference}. A reload validates the
 * complete candidate first and publishes it with one {@code set}; evaluators calling
 * {@link #current()} therefore see either the old or the new set, never a mix.</p>
 *
 * <h2>Validation</h2>
 * <ul>
 *   <li>ids present and unique</li>
 *   <li>predicate present, with a known field and comparator and a finite threshold</li>
 *   <li>cooldown present and not negative</li>
 *   <li>at least one channel, every channel registered</li>
 * </ul>
 */
@Component
@Slf4j
public class RuleRegistry {

    private static final String LOG_PREFIX = "[RULES]";

    private final AtomicReference<RuleSet> active = new AtomicReference<>(RuleSet.empty());
    private final RuleSetLoader loader;
    private final Set<String> channelNames;
    private final FailureReporter failureReporter;

    public RuleRegistry(RuleSetLoader loader, List<NotificationChannel> channels, FailureReporter failureReporter) {
        this.loader = loader;
        this.channelNames = channels.stream()
            .map(NotificationChannel::name)
            .collect(Collectors.toCollection(LinkedHashSet::new));
        this.failureReporter = failureReporter;
    }

    /**
     * Load the configured rule file. An invalid file at startup is fatal.
     */
    @PostConstruct
    public void loadInitial() {
        RuleSet loaded = reload(loader.load());
        log.info("{} Initial rule set active: {} (channels={})", LOG_PREFIX, loaded, channelNames);
    }

    public RuleSet current() {
        return active.get();
    }

    /**
     * Re-read the configured rule file and swap it in.
     */
    public RuleSet reloadFromSource() {
        List<AlertRule> rules;
        try {
            rules = loader.load();
        } catch (RuleValidationException e) {
            reportRejection(e);
            throw e;
        }
        return reload(rules);
    }

    /**
     * Validate and atomically publish a new rule set.
     *
     * @throws RuleValidationException listing every problem; the active set is left untouched
     */
    public synchronized RuleSet reload(List<AlertRule> rules) {
        List<String> errors = validate(rules);
        if (!errors.isEmpty()) {
            RuleValidationException rejection = new RuleValidationException(errors);
            reportRejection(rejection);
            throw rejection;
        }
        RuleSet previous = active.get();
        RuleSet next = new RuleSet(previous.getVersion() + 1, Instant.now(), rules);
        active.set(next);
        log.info("{} Rule set v{} published ({} rules), replaced v{}",
            LOG_PREFIX, next.getVersion(), next.size(), previous.getVersion());
        return next;
    }

    public Set<String> getChannelNames() {
        return Set.copyOf(channelNames);
    }

    List<String> validate(List<AlertRule> rules) {
        List<String> errors = new ArrayList<>();
        if (rules == null) {
            errors.add("rule list is missing");
            return errors;
        }
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < rules.size(); i++) {
            AlertRule rule = rules.get(i);
            String label = "rule[" + i + "]";
            if (rule == null) {
                errors.add(label + ": null entry");
                continue;
            }
            if (rule.getId() == null || rule.getId().isBlank()) {
                errors.add(label + ": id is required");
            } else {
                label = "rule '" + rule.getId() + "'";
                if (!seen.add(rule.getId())) {
                    errors.add(label + ": duplicate id");
                }
            }
            validatePredicate(label, rule.getPredicate(), errors);
            validateCooldown(label, rule.getCooldown(), errors);
            validateAction(label, rule.getAction(), errors);
        }
        return errors;
    }

    private void validatePredicate(String label, RulePredicate predicate, List<String> errors) {
        if (predicate == null) {
            errors.add(label + ": predicate is required");
            return;
        }
        if (predicate.getField() == null) {
            errors.add(label + ": unknown or missing predicate field");
        }
        if (predicate.getComparator() == null) {
            errors.add(label + ": unknown or missing comparator");
        }
        if (predicate.getThreshold() == null) {
            errors.add(label + ": threshold is required");
        } else if (!Double.isFinite(predicate.getThreshold())) {
            errors.add(label + ": threshold must be a finite number");
        }
    }

    private void validateCooldown(String label, Duration cooldown, List<String> errors) {
        if (cooldown == null) {
            errors.add(label + ": cooldown is required");
        } else if (cooldown.isNegative()) {
            errors.add(label + ": cooldown must not be negative");
        }
    }

    private void validateAction(String label, RuleAction action, List<String> errors) {
        if (action == null || action.getChannels() == null || action.getChannels().isEmpty()) {
            errors.add(label + ": action needs at least one channel");
            return;
        }
        for (String channel : action.getChannels()) {
            if (!channelNames.contains(channel)) {
                errors.add(label + ": unknown channel '" + channel + "'");
            }
        }
    }

    private void reportRejection(RuleValidationException e) {
        failureReporter.report(OperatorFailure.Category.CONFIGURATION_REJECTED, "rule-registry", e.getMessage());
    }
}

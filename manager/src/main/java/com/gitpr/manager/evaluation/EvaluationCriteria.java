package com.gitpr.manager.evaluation;

import java.time.Duration;
import java.util.List;

/**
 * Effective filters for one repository: global filters merged with the
 * repository's own settings and any command-line overrides.
 *
 * @param maxAge maximum PR age, or {@code null} for no limit
 */
public record EvaluationCriteria(
        List<String> allowedActors,
        List<String> skipLabels,
        Duration maxAge,
        boolean requireChecks
) {

    public EvaluationCriteria {
        allowedActors = List.copyOf(allowedActors);
        skipLabels = List.copyOf(skipLabels);
    }

    public boolean isAllowedActor(String login) {
        return login != null && allowedActors.stream().anyMatch(login::equalsIgnoreCase);
    }
}

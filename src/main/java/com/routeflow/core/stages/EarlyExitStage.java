package com.routeflow.core.stages;

import com.routeflow.core.model.Fork;
import com.routeflow.core.model.Severity;
import com.routeflow.core.state.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Decides whether the diagnosis already answers the question.
 * <p>
 * High and critical severities always continue to recommendations. Otherwise
 * the run stops when at most {@value #MAX_ISSUES_FOR_EXIT} issues were found.
 * Reads the diagnosis but never changes it.
 */
@Component
public class EarlyExitStage implements Stage {

    private static final Logger log = LoggerFactory.getLogger(EarlyExitStage.class);

    public static final String NAME = "early_exit_check";

    static final int MAX_ISSUES_FOR_EXIT = 2;

    static final String NOTHING_FOUND = "No significant issues were found for this question.";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Map<String, Object> apply(RunState state) {
        Severity severity = state.severity().orElse(Severity.MEDIUM);
        int issueCount = state.issues().size();

        boolean exit;
        String reason;
        if (severity.isSevere()) {
            exit = false;
            reason = "Severity " + severity + " requires recommendations";
        } else if (issueCount == 0) {
            exit = true;
            reason = state.diagnosisShortcut()
                    ? "Informational query answered by a single specialist"
                    : "No issues found";
        } else if (issueCount <= MAX_ISSUES_FOR_EXIT) {
            exit = true;
            reason = "Severity " + severity + " with " + issueCount + " issue(s)";
        } else {
            exit = false;
            reason = issueCount + " issues need recommendations";
        }

        log.info("Early exit {}: {}", exit ? "taken" : "declined", reason);

        var update = new HashMap<String, Object>();
        update.put(RunState.EARLY_EXIT, exit);
        update.put(RunState.EARLY_EXIT_REASON, reason);
        if (exit) {
            String summary = state.diagnosisSummary();
            update.put(RunState.EARLY_EXIT_RESPONSE, summary.isBlank() ? NOTHING_FOUND : summary);
        }
        update.put(RunState.TRACE, List.of("Early exit: " + (exit ? "exit" : "continue") + " (" + reason + ")"));
        return update;
    }

    /** Fork after the check: exit jumps to the response, continue goes on to recommendations. */
    public Fork decide(RunState state) {
        return state.earlyExit() ? Fork.EXIT : Fork.CONTINUE;
    }
}

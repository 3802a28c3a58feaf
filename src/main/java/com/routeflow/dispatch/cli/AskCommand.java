package com.routeflow.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.routeflow.core.engine.PipelineExecutor;
import com.routeflow.core.events.PipelineEvent;
import com.routeflow.core.model.PublicResult;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.function.Consumer;

/**
 * CLI command: routeflow ask "&lt;query&gt;"
 * <p>
 * Runs one question through the pipeline and prints the answer, its
 * confidence and the stages that produced it.
 */
@Command(name = "ask", mixinStandardHelpOptions = true, description = "Ask a question about campaign data")
@Component
public class AskCommand implements Callable<Integer> {

    private static final ObjectMapper JSON = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    @Parameters(index = "0", description = "Natural language question")
    private String query;

    @Option(names = {"--session", "-s"}, description = "Conversation session id")
    private String sessionId;

    @Option(names = {"--user", "-u"}, description = "User id", defaultValue = "cli")
    private String userId;

    @Option(names = {"--timeout", "-t"}, description = "Run deadline in seconds (default: configured run timeout)")
    private Long timeoutSeconds;

    @Option(names = "--json", description = "Print the full result as JSON")
    private boolean json;

    @Option(names = {"--quiet", "-q"}, description = "Do not print stage progress")
    private boolean quiet;

    private final PipelineExecutor executor;

    public AskCommand(PipelineExecutor executor) {
        this.executor = executor;
    }

    @Override
    public Integer call() {
        if (!json) {
            ConsoleOutput.printBanner();
            ConsoleOutput.info("Question: " + query + (sessionId != null ? " (session " + sessionId + ")" : ""));
        }

        Consumer<PipelineEvent> progress = (quiet || json) ? null : event -> {
            if (PipelineEvent.STAGE_COMPLETED.equals(event.eventType())) {
                ConsoleOutput.stage(event.stage(), event.payload().get("elapsedMs"));
            }
        };
        Duration deadline = timeoutSeconds != null ? Duration.ofSeconds(timeoutSeconds) : null;

        PublicResult result = executor.execute(query, sessionId, userId, deadline, progress);

        if (json) {
            try {
                System.out.println(JSON.writeValueAsString(result));
            } catch (JsonProcessingException e) {
                ConsoleOutput.error("Could not render result as JSON: " + e.getOriginalMessage());
                return 1;
            }
        } else {
            System.out.println();
            System.out.println(result.response());
            System.out.println();
            ConsoleOutput.confidence(result.confidence(), String.valueOf(result.metadata().get("path")));
            ConsoleOutput.provenance(result.provenance());
        }
        return Boolean.TRUE.equals(result.metadata().get("degraded")) ? 2 : 0;
    }
}

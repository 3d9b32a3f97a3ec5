package io.cronkeeper.cron;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Default executor. System events are acknowledged and logged; agent turns are sent to the
 * configured {@link ChatModel} and the reply becomes the run summary.
 */
@Component
public class PayloadJobExecutor implements JobExecutor {

    private static final Logger log = LoggerFactory.getLogger(PayloadJobExecutor.class);
    static final int MAX_SUMMARY_LENGTH = 500;

    private final ObjectProvider<ChatModel> chatModel;

    public PayloadJobExecutor(ObjectProvider<ChatModel> chatModel) {
        this.chatModel = chatModel;
    }

    @Override
    public RunResult execute(ScheduledJob job) throws Exception {
        if (job.payload() instanceof Payload.AgentTurn turn) {
            return runAgentTurn(job, turn);
        }
        log.info("[Scheduled: {}] {}", job.name(), job.payload().message());
        return RunResult.ok(job.payload().message());
    }

    private RunResult runAgentTurn(ScheduledJob job, Payload.AgentTurn turn) throws Exception {
        ChatModel model = chatModel.getIfAvailable();
        if (model == null) {
            log.warn("No chat model configured, skipping agent turn of job '{}' ({})", job.name(), job.id());
            return RunResult.skipped("no chat model configured");
        }

        log.info("Executing scheduled agent turn '{}': {}...", job.name(),
                turn.message().substring(0, Math.min(100, turn.message().length())));

        if (turn.timeoutSeconds() == null || turn.timeoutSeconds() <= 0) {
            return RunResult.ok(summarize(ask(model, turn)));
        }

        CompletableFuture<String> reply = CompletableFuture.supplyAsync(() -> ask(model, turn));
        try {
            return RunResult.ok(summarize(reply.get(turn.timeoutSeconds(), TimeUnit.SECONDS)));
        } catch (TimeoutException e) {
            reply.cancel(true);
            return RunResult.error("Agent turn timed out after " + turn.timeoutSeconds() + "s");
        } catch (ExecutionException e) {
            throw e.getCause() instanceof Exception cause ? cause : e;
        }
    }

    private String ask(ChatModel model, Payload.AgentTurn turn) {
        ChatClient.ChatClientRequestSpec request = ChatClient.create(model)
                .prompt()
                .user(turn.message());
        if (turn.model() != null && !turn.model().isBlank()) {
            request = request.options(ChatOptions.builder().model(turn.model()).build());
        }
        return request.call().content();
    }

    private static String summarize(String reply) {
        if (reply == null || reply.length() <= MAX_SUMMARY_LENGTH) {
            return reply;
        }
        return reply.substring(0, MAX_SUMMARY_LENGTH) + "...";
    }
}

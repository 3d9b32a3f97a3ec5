package io.cronkeeper.cron;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * What a job carries to its executor. The scheduler never interprets it.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Payload.SystemEvent.class, name = "systemEvent"),
        @JsonSubTypes.Type(value = Payload.AgentTurn.class, name = "agentTurn")
})
public sealed interface Payload permits Payload.SystemEvent, Payload.AgentTurn {

    String message();

    /**
     * Returns the discriminator used in the store file.
     */
    @JsonIgnore
    String kind();

    /**
     * Returns a copy with only the message replaced.
     */
    Payload withMessage(String message);

    /**
     * Shallow merge: non-null components of {@code patch} win. The patch must be of the same kind.
     */
    Payload mergedWith(Payload patch);

    @JsonIgnore
    default boolean hasMessage() {
        return message() != null && !message().isBlank();
    }

    /**
     * A message injected into the main session as a system event.
     */
    record SystemEvent(String message) implements Payload {

        @Override
        public String kind() {
            return "systemEvent";
        }

        @Override
        public Payload withMessage(String message) {
            return new SystemEvent(message);
        }

        @Override
        public Payload mergedWith(Payload patch) {
            SystemEvent other = (SystemEvent) patch;
            return new SystemEvent(other.message() != null ? other.message() : message);
        }
    }

    /**
     * A prompt handed to the agent as a fresh turn.
     *
     * @param message        the user message
     * @param model          model override, null for the default model
     * @param timeoutSeconds upper bound for the agent call
     * @param deliver        whether the reply should be delivered to a channel
     * @param channel        delivery channel
     * @param to             delivery target within the channel
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record AgentTurn(
            String message,
            String model,
            Integer timeoutSeconds,
            Boolean deliver,
            String channel,
            String to
    ) implements Payload {

        public static AgentTurn of(String message) {
            return new AgentTurn(message, null, null, null, null, null);
        }

        @Override
        public String kind() {
            return "agentTurn";
        }

        @Override
        public Payload withMessage(String message) {
            return new AgentTurn(message, model, timeoutSeconds, deliver, channel, to);
        }

        @Override
        public Payload mergedWith(Payload patch) {
            AgentTurn other = (AgentTurn) patch;
            return new AgentTurn(
                    other.message() != null ? other.message() : message,
                    other.model() != null ? other.model() : model,
                    other.timeoutSeconds() != null ? other.timeoutSeconds() : timeoutSeconds,
                    other.deliver() != null ? other.deliver() : deliver,
                    other.channel() != null ? other.channel() : channel,
                    other.to() != null ? other.to() : to
            );
        }
    }
}

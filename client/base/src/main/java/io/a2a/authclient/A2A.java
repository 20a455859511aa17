package io.a2a.authclient;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import io.a2a.authclient.spec.Message;
import io.a2a.authclient.spec.Part;
import io.a2a.authclient.spec.Task;
import io.a2a.authclient.spec.TaskSendParams;
import io.a2a.authclient.spec.TextPart;
import org.jspecify.annotations.Nullable;

/**
 * Utility methods for building A2A messages and task requests.
 */
public class A2A {

    private A2A() {
    }

    /**
     * Convert the given text to a user message.
     *
     * @param text the message text
     * @return the user message
     */
    public static Message toUserMessage(String text) {
        return createMessage(text, Message.Role.USER, null, null);
    }

    /**
     * Convert the given text to an agent message.
     *
     * @param text the message text
     * @return the agent message
     */
    public static Message toAgentMessage(String text) {
        return createMessage(text, Message.Role.AGENT, null, null);
    }

    /**
     * Create a user message with additional parts and metadata.
     *
     * @param text the message text, sent as the first part (optional when parts are given)
     * @param parts further message parts (optional)
     * @param metadata the message metadata (optional)
     * @return the user message
     */
    public static Message createUserMessage(@Nullable String text, @Nullable List<Part<?>> parts,
                                            @Nullable Map<String, Object> metadata) {
        return createMessage(text, Message.Role.USER, parts, metadata);
    }

    public static Message createAgentMessage(@Nullable String text, @Nullable List<Part<?>> parts,
                                             @Nullable Map<String, Object> metadata) {
        return createMessage(text, Message.Role.AGENT, parts, metadata);
    }

    /**
     * Create the parameters submitting the given text to a new task.
     *
     * @param text the message text
     * @return the parameters, with a random task id
     */
    public static TaskSendParams toTaskSendParams(String text) {
        return new TaskSendParams(generateTaskId(), toUserMessage(text));
    }

    public static TaskSendParams toTaskSendParams(String taskId, String text) {
        return new TaskSendParams(taskId, toUserMessage(text));
    }

    public static String generateTaskId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Concatenates the text parts of the task's status message.
     *
     * @param task the task
     * @return the text, empty if the status carries no message or no text
     */
    public static String getStatusText(Task task) {
        Message message = task.status().message();
        if (message == null) {
            return "";
        }
        StringBuilder text = new StringBuilder();
        for (Part<?> part : message.parts()) {
            if (part instanceof TextPart textPart) {
                text.append(textPart.text());
            }
        }
        return text.toString();
    }

    private static Message createMessage(@Nullable String text, Message.Role role, @Nullable List<Part<?>> parts,
                                         @Nullable Map<String, Object> metadata) {
        List<Part<?>> allParts = new ArrayList<>();
        if (text != null) {
            allParts.add(new TextPart(text));
        }
        if (parts != null) {
            allParts.addAll(parts);
        }
        return new Message(role, allParts, metadata);
    }
}

package com.example.tutor.ragservice.support;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.output.Response;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Chat model that replays queued replies in order. A queued {@link RuntimeException}
 * is thrown instead of answered.
 */
public class ScriptedChatModel implements ChatLanguageModel {

    private final Deque<Object> replies = new ArrayDeque<>();
    private final List<List<ChatMessage>> requests = new ArrayList<>();

    public ScriptedChatModel reply(String text) {
        replies.addLast(text);
        return this;
    }

    public ScriptedChatModel fail(RuntimeException e) {
        replies.addLast(e);
        return this;
    }

    public List<List<ChatMessage>> requests() {
        return requests;
    }

    @Override
    public Response<AiMessage> generate(List<ChatMessage> messages) {
        requests.add(List.copyOf(messages));
        Object next = replies.pollFirst();
        if (next == null) {
            throw new IllegalStateException("No scripted reply left");
        }
        if (next instanceof RuntimeException) {
            throw (RuntimeException) next;
        }
        return Response.from(AiMessage.from((String) next));
    }
}

package com.example.Orin.support;

import com.example.Orin.orchestration.GenerativeModel;
import com.example.Orin.orchestration.ModelReply;
import com.example.Orin.orchestration.ModelRequest;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Function;

/**
 * Generative model that replays queued replies; once the queue is empty it keeps
 * answering with the fallback.
 */
public class ScriptedGenerativeModel implements GenerativeModel {

    private final Deque<Function<ModelRequest, ModelReply>> script = new ArrayDeque<>();
    private final List<ModelRequest> requests = new ArrayList<>();
    private Function<ModelRequest, ModelReply> fallback = request -> ModelReply.answer("Done.");

    public ScriptedGenerativeModel then(ModelReply reply) {
        script.add(request -> reply);
        return this;
    }

    public ScriptedGenerativeModel then(Function<ModelRequest, ModelReply> step) {
        script.add(step);
        return this;
    }

    public ScriptedGenerativeModel otherwise(Function<ModelRequest, ModelReply> step) {
        this.fallback = step;
        return this;
    }

    @Override
    public synchronized ModelReply think(ModelRequest request) {
        requests.add(request);
        Function<ModelRequest, ModelReply> step = script.isEmpty() ? fallback : script.poll();
        return step.apply(request);
    }

    public synchronized List<ModelRequest> requests() {
        return List.copyOf(requests);
    }
}

package com.questrail.hostlink.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * SessionApi double that records every invocation and the thread it ran on.
 * A call is recorded once its behaviour has finished.
 *
 * <p>By default every command succeeds with {@code {"ok": true}}. Behaviour can
 * be overridden per command name.</p>
 */
public final class RecordingSessionApi implements SessionApi {

    public record Call(String commandName, Map<String, Object> params, Thread thread) {}

    @FunctionalInterface
    public interface Behavior {
        Object apply(Map<String, Object> params) throws Exception;
    }

    private final List<Call> calls = new ArrayList<>();
    private final Map<String, Behavior> behaviors = new ConcurrentHashMap<>();

    public RecordingSessionApi on(String commandName, Behavior behavior) {
        behaviors.put(commandName, behavior);
        return this;
    }

    @Override
    public Object invoke(String commandName, Map<String, Object> params) throws SessionException {
        try {
            return run(commandName, params);
        } finally {
            synchronized (this) {
                calls.add(new Call(commandName, params, Thread.currentThread()));
                notifyAll();
            }
        }
    }

    private Object run(String commandName, Map<String, Object> params) throws SessionException {
        Behavior behavior = behaviors.get(commandName);
        if (behavior == null) {
            return Map.of("ok", true);
        }
        try {
            return behavior.apply(params);
        } catch (SessionException | RuntimeException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SessionException("interrupted", e);
        } catch (Exception e) {
            throw new SessionException(e.getMessage(), e);
        }
    }

    public synchronized List<Call> calls() {
        return new ArrayList<>(calls);
    }

    public synchronized List<String> commandNames() {
        List<String> names = new ArrayList<>();
        for (Call c : calls) {
            names.add(c.commandName());
        }
        return names;
    }

    public synchronized boolean awaitCalls(int count, long timeoutMillis) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMillis;
        while (calls.size() < count) {
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) {
                return false;
            }
            wait(remaining);
        }
        return true;
    }
}

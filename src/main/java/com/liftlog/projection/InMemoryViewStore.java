package com.liftlog.projection;

import java.util.concurrent.ConcurrentHashMap;

public class InMemoryViewStore implements ViewStore {

    private final ConcurrentHashMap<String, UserViews> views = new ConcurrentHashMap<>();

    @Override
    public UserViews load(String userId) {
        return views.getOrDefault(userId, UserViews.EMPTY);
    }

    @Override
    public void commit(String userId, UserViews snapshot) {
        views.put(userId, snapshot);
    }

    @Override
    public void clear(String userId) {
        views.remove(userId);
    }
}

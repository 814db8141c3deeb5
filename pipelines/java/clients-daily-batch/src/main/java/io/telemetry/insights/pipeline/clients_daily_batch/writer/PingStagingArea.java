package io.telemetry.insights.pipeline.clients_daily_batch.writer;

import io.telemetry.insights.pipeline.clients_daily_batch.model.Ping;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

public class PingStagingArea {

    private final List<Ping> pings = new ArrayList<>();

    public synchronized void addAll(Collection<? extends Ping> staged) {
        pings.addAll(staged);
    }

    public synchronized List<Ping> snapshot() {
        return new ArrayList<>(pings);
    }

    public synchronized void clear() {
        pings.clear();
    }

    public synchronized int size() {
        return pings.size();
    }
}

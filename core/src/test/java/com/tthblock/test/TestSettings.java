package com.tthblock.test;

import com.tthblock.api.BlocklistSettings;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * In-memory settings: everything is enabled unless switched off.
 */
public class TestSettings implements BlocklistSettings {
    private final Set<String> disabled = new HashSet<>();
    private final List<String> registered = new ArrayList<>();
    private final List<String> known = new ArrayList<>();
    private volatile boolean broken = false;
    private int intervalMinutes = 60;

    public TestSettings disable(String name) {
        disabled.add(name);
        return this;
    }

    public TestSettings enable(String name) {
        disabled.remove(name);
        return this;
    }

    public void setBroken(boolean broken) {
        this.broken = broken;
    }

    public void setIntervalMinutes(int intervalMinutes) {
        this.intervalMinutes = intervalMinutes;
    }

    @Override
    public synchronized boolean isEnabled(String sourceName) {
        if (broken) throw new IllegalStateException("settings unavailable");
        return !disabled.contains(sourceName);
    }

    @Override
    public int getUpdateIntervalMinutes() {
        return intervalMinutes;
    }

    @Override
    public synchronized void registerNewSources(Collection<String> sourceNames) {
        registered.addAll(sourceNames);
    }

    @Override
    public synchronized void registerKnownSources(Collection<String> sourceNames) {
        known.addAll(sourceNames);
    }

    public synchronized List<String> getKnown() {
        return new ArrayList<>(known);
    }

    public synchronized List<String> getRegistered() {
        return new ArrayList<>(registered);
    }
}

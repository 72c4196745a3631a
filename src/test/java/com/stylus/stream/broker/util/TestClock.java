package com.stylus.stream.broker.util;

import javax.annotation.Nonnull;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Clock that tests can freeze and move forward. Falls back to the delegate when nothing is pushed.
 */
public class TestClock extends Clock {

    private final Deque<Clock> delegates = new ArrayDeque<>();

    private final Clock delegate;

    public TestClock(Clock delegate) {
        this.delegate = delegate;
    }

    @Override
    public ZoneId getZone() {
        return getDelegate().getZone();
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return getDelegate().withZone(zone);
    }

    @Override
    public Instant instant() {
        return getDelegate().instant();
    }

    @Nonnull
    private synchronized Clock getDelegate() {
        return delegates.isEmpty() ? delegate : delegates.peek();
    }

    public void setFixed(long timeMs) {
        pushDelegate(Clock.fixed(Instant.ofEpochMilli(timeMs), getDelegate().getZone()));
    }

    public void advanceMillis(long millis) {
        Clock current = getDelegate();
        pushDelegate(Clock.fixed(current.instant().plusMillis(millis), current.getZone()));
    }

    public synchronized void pushDelegate(Clock delegate) {
        delegates.push(delegate);
    }

    public synchronized void reset() {
        delegates.clear();
    }
}

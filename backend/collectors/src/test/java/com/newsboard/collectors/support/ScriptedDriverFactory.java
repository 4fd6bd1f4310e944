package com.newsboard.collectors.support;

import com.newsboard.collectors.page.PageDriver;
import com.newsboard.collectors.page.PageDriverFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Hands out queued drivers in order, one per {@link #open()}.
 */
public class ScriptedDriverFactory implements PageDriverFactory {
    private final Deque<FakePageDriver> queue = new ArrayDeque<>();
    private final List<FakePageDriver> opened = new ArrayList<>();

    public ScriptedDriverFactory then(FakePageDriver driver) {
        queue.addLast(driver);
        return this;
    }

    @Override
    public PageDriver open() {
        FakePageDriver next = queue.pollFirst();
        if (next == null) {
            throw new IllegalStateException("no scripted driver left");
        }
        opened.add(next);
        return next;
    }

    public List<FakePageDriver> opened() {
        return List.copyOf(opened);
    }
}

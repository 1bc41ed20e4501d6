package com.reportsync.session;

import com.reportsync.core.DriverException;
import org.openqa.selenium.Keys;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scripted browser. {@link #failLocate} maps a selector to how many lookups of it fail before succeeding.
 */
public final class FakeRemoteSessionDriver implements RemoteSessionDriver {
    public final List<String> calls = new CopyOnWriteArrayList<>();
    public final Map<String, Integer> failLocate = new HashMap<>();
    public final AtomicInteger disposals = new AtomicInteger();
    private final AtomicInteger nextElement = new AtomicInteger();

    /**
     * Factory over one shared fake; the first {@code failures} creations throw.
     */
    public static RemoteSessionDriverFactory factory(FakeRemoteSessionDriver driver, AtomicInteger creations, int failures) {
        return () -> {
            int n = creations.incrementAndGet();
            if (n <= failures) {
                throw new DriverException("session not created (" + n + ")");
            }
            return driver;
        };
    }

    @Override
    public void navigate(String url) {
        calls.add("navigate " + url);
    }

    @Override
    public synchronized ElementHandle locateElement(String selector, Duration timeout) {
        calls.add("locate " + selector);
        Integer remaining = failLocate.get(selector);
        if (remaining != null && remaining > 0) {
            failLocate.put(selector, remaining - 1);
            throw new ElementNotFoundException(selector);
        }
        return new ElementHandle("el-" + nextElement.incrementAndGet(), selector);
    }

    @Override
    public void sendKeys(ElementHandle element, CharSequence text) {
        calls.add("keys " + element.selector + " " + printable(text.toString()));
    }

    @Override
    public void click(ElementHandle element) {
        calls.add("click " + element.selector);
    }

    @Override
    public void selectOption(ElementHandle element, String value) {
        calls.add("select-value " + element.selector + " " + value);
    }

    @Override
    public void selectOptionByText(ElementHandle element, String text) {
        calls.add("select-text " + element.selector + " " + text);
    }

    @Override
    public void dispose() {
        disposals.incrementAndGet();
        calls.add("dispose");
    }

    private static String printable(String text) {
        return text.replace(Keys.NULL.toString(), "")
                .replace(Keys.CONTROL.toString(), "<CTRL>")
                .replace(Keys.DELETE.toString(), "<DEL>");
    }
}

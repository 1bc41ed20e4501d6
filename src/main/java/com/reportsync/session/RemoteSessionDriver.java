package com.reportsync.session;

import java.time.Duration;

/**
 * Blocking remote browser session. Every call may throw {@link com.reportsync.core.DriverException}.
 */
public interface RemoteSessionDriver {

    void navigate(String url);

    /**
     * Polls until the element appears or {@code timeout} passes.
     *
     * @throws ElementNotFoundException when the element did not appear in time
     */
    ElementHandle locateElement(String selector, Duration timeout);

    void sendKeys(ElementHandle element, CharSequence text);

    void click(ElementHandle element);

    /**
     * Selects the option of a {@code <select>} element whose value attribute equals {@code value}.
     */
    void selectOption(ElementHandle element, String value);

    /**
     * Selects the option of a {@code <select>} element whose visible text equals {@code text}.
     */
    void selectOptionByText(ElementHandle element, String text);

    void dispose();
}

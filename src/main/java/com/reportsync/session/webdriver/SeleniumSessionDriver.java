package com.reportsync.session.webdriver;

import com.reportsync.core.DriverException;
import com.reportsync.session.ElementHandle;
import com.reportsync.session.ElementNotFoundException;
import com.reportsync.session.RemoteSessionDriver;
import com.reportsync.session.RemoteSessionDriverFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.openqa.selenium.By;
import org.openqa.selenium.NoSuchElementException;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.chrome.ChromeOptions;
import org.openqa.selenium.remote.RemoteWebDriver;
import org.openqa.selenium.support.ui.ExpectedConditions;
import org.openqa.selenium.support.ui.Select;
import org.openqa.selenium.support.ui.WebDriverWait;

import java.net.MalformedURLException;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link RemoteSessionDriver} backed by a Selenium {@link WebDriver} running Chrome.
 * Selectors are element ids.
 */
public final class SeleniumSessionDriver implements RemoteSessionDriver {
    private static final Logger log = LogManager.getLogger(SeleniumSessionDriver.class);

    static final List<String> CHROME_ARGS = List.of(
            "--disable-logging",
            "--disable-extensions",
            "--no-sandbox",
            "--disable-gpu",
            "--disable-dev-shm-usage",
            "--log-level=3"
    );
    private static final Duration POLL_INTERVAL = Duration.ofSeconds(1);

    private final WebDriver browser;
    private final Duration pollInterval;
    private final Map<String, WebElement> elements = new ConcurrentHashMap<>();
    private final AtomicLong nextElement = new AtomicLong();
    private final AtomicBoolean disposed = new AtomicBoolean(false);

    SeleniumSessionDriver(WebDriver browser, Duration pollInterval) {
        this.browser = Objects.requireNonNull(browser, "browser cannot be null");
        this.pollInterval = pollInterval == null ? POLL_INTERVAL : pollInterval;
    }

    public static SeleniumSessionDriver create(URI endpoint, boolean headless) {
        Objects.requireNonNull(endpoint, "endpoint cannot be null");
        RemoteWebDriver browser;
        try {
            browser = new RemoteWebDriver(endpoint.toURL(), chromeOptions(headless));
        } catch (MalformedURLException | IllegalArgumentException e) {
            throw new DriverException("invalid WebDriver endpoint: " + endpoint, e);
        } catch (WebDriverException e) {
            throw new DriverException("browser session not created at " + endpoint, e);
        }
        log.info("Browser session {} created (headless={})", browser.getSessionId(), headless);
        return new SeleniumSessionDriver(browser, POLL_INTERVAL);
    }

    public static RemoteSessionDriverFactory factory(URI endpoint, boolean headless) {
        return () -> create(endpoint, headless);
    }

    static ChromeOptions chromeOptions(boolean headless) {
        ChromeOptions options = new ChromeOptions();
        if (headless) {
            options.addArguments("--headless");
        }
        options.addArguments(CHROME_ARGS);
        options.setExperimentalOption("excludeSwitches", List.of("enable-logging"));
        return options;
    }

    @Override
    public void navigate(String url) {
        call("navigate " + url, () -> browser.get(url));
    }

    @Override
    public ElementHandle locateElement(String selector, Duration timeout) {
        Duration wait = timeout == null || timeout.isNegative() ? Duration.ZERO : timeout;
        WebElement element;
        try {
            element = new WebDriverWait(browser, wait, pollInterval)
                    .until(ExpectedConditions.presenceOfElementLocated(By.id(selector)));
        } catch (TimeoutException e) {
            throw new ElementNotFoundException(selector);
        } catch (WebDriverException e) {
            throw new DriverException("lookup of " + selector + " failed", e);
        }
        String id = "el-" + nextElement.incrementAndGet();
        elements.put(id, element);
        return new ElementHandle(id, selector);
    }

    @Override
    public void sendKeys(ElementHandle element, CharSequence text) {
        WebElement target = resolve(element);
        call("keys " + element, () -> target.sendKeys(text));
    }

    @Override
    public void click(ElementHandle element) {
        WebElement target = resolve(element);
        call("click " + element, () -> target.click());
    }

    @Override
    public void selectOption(ElementHandle element, String value) {
        WebElement target = resolve(element);
        try {
            new Select(target).selectByValue(value);
        } catch (NoSuchElementException e) {
            throw new ElementNotFoundException(element.selector + " > option value " + value);
        } catch (WebDriverException | UnsupportedOperationException e) {
            throw new DriverException("select value " + value + " on " + element + " failed", e);
        }
    }

    @Override
    public void selectOptionByText(ElementHandle element, String text) {
        WebElement target = resolve(element);
        try {
            new Select(target).selectByVisibleText(text);
        } catch (NoSuchElementException e) {
            throw new ElementNotFoundException(element.selector + " > option text " + text);
        } catch (WebDriverException | UnsupportedOperationException e) {
            throw new DriverException("select text " + text + " on " + element + " failed", e);
        }
    }

    @Override
    public void dispose() {
        if (!disposed.compareAndSet(false, true)) {
            return;
        }
        elements.clear();
        call("quit", () -> browser.quit());
        log.info("Browser session closed");
    }

    private WebElement resolve(ElementHandle handle) {
        WebElement element = elements.get(handle.id);
        if (element == null) {
            throw new DriverException("unknown element " + handle);
        }
        return element;
    }

    private static void call(String description, Runnable action) {
        try {
            action.run();
        } catch (NoSuchElementException e) {
            throw new ElementNotFoundException(description);
        } catch (WebDriverException e) {
            throw new DriverException(description + " failed", e);
        }
    }
}

package io.hearthwarrio.autoapply.runner;

import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.openqa.selenium.remote.RemoteWebDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URL;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Starts one Chromium-family browser per application.
 * <p>
 * Local Chrome (or another Chromium binary such as Brave) by default, a Selenium Grid node when a
 * remote URL is configured. Implicit waits stay off: the session polls explicitly and counts
 * missing elements often.
 */
public final class BrowserDrivers {

    private static final Logger log = LoggerFactory.getLogger(BrowserDrivers.class);

    public static final Duration PAGE_LOAD_TIMEOUT = Duration.ofSeconds(60);

    // Password-save and notification bubbles sit on top of form fields and swallow clicks.
    private static final Map<String, Object> PREFS = Map.of(
            "credentials_enable_service", false,
            "profile.password_manager_enabled", false,
            "profile.default_content_setting_values.notifications", 2);

    private BrowserDrivers() {
        // utility class
    }

    /**
     * Options for filling application forms.
     *
     * @param binary   browser executable, or empty for the installed Chrome
     * @param headless run without a window
     */
    public static ChromeOptions applicationOptions(Optional<Path> binary, boolean headless) {
        Objects.requireNonNull(binary, "binary must not be null");

        ChromeOptions options = new ChromeOptions();
        options.addArguments("--no-sandbox", "--disable-dev-shm-usage", "--disable-popup-blocking");
        options.setExperimentalOption("prefs", PREFS);
        binary.ifPresent(path -> options.setBinary(path.toFile()));
        if (headless) {
            options.addArguments("--headless=new", "--window-size=1920,1080");
        }
        return options;
    }

    /**
     * Starts a browser locally, or on the grid at {@code remoteUrl} when present.
     * A browser that started but rejected the window setup is quit before the failure propagates.
     */
    public static WebDriver open(Optional<URL> remoteUrl, Optional<Path> binary, boolean headless) {
        Objects.requireNonNull(remoteUrl, "remoteUrl must not be null");

        ChromeOptions options = applicationOptions(binary, headless);
        WebDriver driver = remoteUrl.isPresent()
                ? new RemoteWebDriver(remoteUrl.get(), options)
                : new ChromeDriver(options);
        try {
            driver.manage().timeouts().pageLoadTimeout(PAGE_LOAD_TIMEOUT);
            if (!headless) {
                driver.manage().window().maximize();
            }
        } catch (WebDriverException e) {
            driver.quit();
            throw e;
        }
        log.debug("Started {} browser{}", remoteUrl.isPresent() ? "remote" : "local", headless ? " (headless)" : "");
        return driver;
    }
}

package io.hearthwarrio.autoapply.runner;

import io.hearthwarrio.autoapply.allure.AutoApplyAllureLoggers;
import io.hearthwarrio.autoapply.core.config.AutofillSettings;
import io.hearthwarrio.autoapply.core.config.JsonProfileStore;
import io.hearthwarrio.autoapply.core.config.KeywordTables;
import io.hearthwarrio.autoapply.core.config.Profile;
import io.hearthwarrio.autoapply.core.logging.DecisionLoggers;
import io.hearthwarrio.autoapply.core.logging.LogDetail;
import io.hearthwarrio.autoapply.core.runtime.JobRunner;
import io.hearthwarrio.autoapply.core.runtime.NavigatorFactory;
import io.hearthwarrio.autoapply.core.runtime.SessionFactory;
import io.hearthwarrio.autoapply.core.runtime.WorkerPool;
import io.hearthwarrio.autoapply.webdriver.SeleniumBrowserSession;
import io.hearthwarrio.autoapply.webdriver.StdOutDecisionLogger;
import org.openqa.selenium.WebDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URL;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Command line entry point: starts the worker pool and runs until the process is stopped.
 */
public final class AutoApplyMain {

    private static final Logger log = LoggerFactory.getLogger(AutoApplyMain.class);

    private AutoApplyMain() {
        // utility class
    }

    public static void main(String[] args) throws InterruptedException {
        RunnerEnvironment env = RunnerEnvironment.system();

        AutofillSettings settings = AutofillSettings.load(env.settingsOverlay().orElse(null));
        KeywordTables tables = KeywordTables.load(env.keywordOverlay().orElse(null));
        Profile profile = JsonProfileStore.load(env.profile());

        NavigatorFactory navigators = navigators(env, settings, tables, profile);
        SessionFactory sessions = sessions(env, settings);
        JobRunner runner = new JobRunner(sessions, navigators);

        WorkerPool pool = new WorkerPool(new HttpJobQueue(env.jobApiUrl()), runner, settings);
        Runtime.getRuntime().addShutdownHook(new Thread(pool::close, "autoapply-shutdown"));
        pool.start();
        log.info("Polling {} for jobs", env.jobApiUrl());
        pool.awaitTermination();
    }

    static NavigatorFactory navigators(RunnerEnvironment env,
                                       AutofillSettings settings,
                                       KeywordTables tables,
                                       Profile profile) {
        NavigatorFactory factory = new NavigatorFactory(settings, tables, profile, new HttpReasoningOracle(env.oracleUrl()));
        switch (env.decisionLog()) {
            case "none" -> factory.withDecisionLogger(DecisionLoggers.noop());
            case "allure" -> factory.withSessionDecisionLogger(session -> {
                if (session instanceof SeleniumBrowserSession selenium) {
                    return AutoApplyAllureLoggers.decisions(selenium.driver(), LogDetail.FULL, false);
                }
                return DecisionLoggers.noop();
            });
            default -> factory.withDecisionLogger(new StdOutDecisionLogger(LogDetail.WITH_LOCATOR));
        }
        return factory;
    }

    static SessionFactory sessions(RunnerEnvironment env, AutofillSettings settings) {
        Optional<URL> remoteUrl = env.remoteUrl();
        Optional<Path> binary = env.browserBinary();
        boolean headless = env.headless();
        return () -> {
            WebDriver driver = BrowserDrivers.open(remoteUrl, binary, headless);
            return new SeleniumBrowserSession(driver, settings);
        };
    }
}

package net.lookvault;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Entry point for the LookVault asset cache service.
 * <p>
 * Values from a local {@code .env} file are exposed as system properties before the context starts,
 * so provider credentials can live outside {@code application.properties}.
 */
@SpringBootApplication
@EnableScheduling
public class LookVaultApplication {

    private static final Logger log = LoggerFactory.getLogger(LookVaultApplication.class);
    private static final int SCHEDULER_POOL_SIZE = 2;
    private static final int SCHEDULER_SHUTDOWN_TIMEOUT_SECONDS = 30;
    private static final String SCHEDULER_THREAD_PREFIX = "LookVaultScheduler-";

    public static void main(String[] args) {
        loadDotEnvFile(Paths.get(".env"));
        SpringApplication.run(LookVaultApplication.class, args);
    }

    /**
     * Scheduler for the trend refresh; kept small since each run blocks on provider calls.
     */
    @Bean(name = "taskScheduler")
    public TaskScheduler applicationTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setThreadNamePrefix(SCHEDULER_THREAD_PREFIX);
        scheduler.setPoolSize(SCHEDULER_POOL_SIZE);
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(SCHEDULER_SHUTDOWN_TIMEOUT_SECONDS);
        return scheduler;
    }

    /**
     * Copies {@code .env} entries into system properties unless the environment already defines them.
     *
     * @return number of entries applied
     */
    static int loadDotEnvFile(Path envFile) {
        if (!Files.exists(envFile)) {
            return 0;
        }
        try {
            Properties props = new Properties();
            try (InputStream is = Files.newInputStream(envFile)) {
                props.load(is);
            }
            int applied = 0;
            for (String key : props.stringPropertyNames()) {
                if (System.getenv(key) == null && System.getProperty(key) == null) {
                    System.setProperty(key, props.getProperty(key).trim());
                    applied++;
                }
            }
            log.info("Loaded {} setting(s) from {}", applied, envFile.toAbsolutePath());
            return applied;
        } catch (IOException | SecurityException e) {
            log.warn("Failed to load {}; aborting startup", envFile, e);
            throw new IllegalStateException("Failed to load .env file", e);
        }
    }
}

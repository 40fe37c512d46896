package com.ayjx.app.config;

import com.ayjx.browser.Browser;
import com.ayjx.browser.SharedBrowser;
import com.ayjx.common.config.AyjxConfig;
import com.ayjx.common.config.ConfigService;
import com.ayjx.common.config.SharedConfig;
import com.ayjx.core.pipeline.PluginPipeline;
import com.ayjx.core.schedule.TaskScheduler;
import com.ayjx.plugins.BuiltinPlugins;
import com.ayjx.plugins.webshot.BrowserPageCapturer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Shared services of the bot process.
 */
@Configuration
public class AyjxBeanConfig {

    @Value("${ayjx.config.path:config.json}")
    private String configPath;

    @Bean
    public ConfigService configService() {
        return new ConfigService(Path.of(configPath));
    }

    @Bean
    public SharedConfig sharedConfig(ConfigService configService) {
        return new SharedConfig(configService);
    }

    @Bean
    public TaskScheduler taskScheduler() {
        return new TaskScheduler();
    }

    /** Launch settings are read on every (re)launch. */
    @Bean
    public SharedBrowser sharedBrowser(SharedConfig config) {
        return new SharedBrowser(() -> {
            AyjxConfig.BrowserConfig browser = config.snapshot().getBrowser();
            return Browser.launch(browser.isHeadless(), browser.getExecutable());
        });
    }

    /** Closed after the launcher stops, which shuts the plugins' own pools down. */
    @Bean(destroyMethod = "close")
    public PluginPipeline pluginPipeline(SharedBrowser browser) {
        return BuiltinPlugins.pipeline(new BrowserPageCapturer(browser));
    }

    @Bean
    public BotLauncher botLauncher(SharedConfig config, TaskScheduler scheduler, PluginPipeline pipeline) {
        return new BotLauncher(config, scheduler, pipeline);
    }
}

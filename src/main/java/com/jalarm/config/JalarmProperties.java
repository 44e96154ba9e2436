package com.jalarm.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "jalarm")
public class JalarmProperties {

    private SchedulerProperties scheduler = new SchedulerProperties();
    private DeliveryProperties delivery = new DeliveryProperties();
    private ExecutionProperties executions = new ExecutionProperties();
    private TelegramProperties telegram = new TelegramProperties();
    private TaskRunnerProperties taskRunner = new TaskRunnerProperties();
    private SecurityProperties security = new SecurityProperties();

    public SchedulerProperties getScheduler() { return scheduler; }
    public void setScheduler(SchedulerProperties scheduler) { this.scheduler = scheduler; }

    public DeliveryProperties getDelivery() { return delivery; }
    public void setDelivery(DeliveryProperties delivery) { this.delivery = delivery; }

    public ExecutionProperties getExecutions() { return executions; }
    public void setExecutions(ExecutionProperties executions) { this.executions = executions; }

    public TelegramProperties getTelegram() { return telegram; }
    public void setTelegram(TelegramProperties telegram) { this.telegram = telegram; }

    public TaskRunnerProperties getTaskRunner() { return taskRunner; }
    public void setTaskRunner(TaskRunnerProperties taskRunner) { this.taskRunner = taskRunner; }

    public SecurityProperties getSecurity() { return security; }
    public void setSecurity(SecurityProperties security) { this.security = security; }

    public static class SchedulerProperties {
        private Duration gracePeriod = Duration.ofSeconds(60);
        private int timerPoolSize = 4;
        private boolean rehydrateOnStartup = true;

        public Duration getGracePeriod() { return gracePeriod; }
        public void setGracePeriod(Duration gracePeriod) { this.gracePeriod = gracePeriod; }
        public int getTimerPoolSize() { return timerPoolSize; }
        public void setTimerPoolSize(int timerPoolSize) { this.timerPoolSize = timerPoolSize; }
        public boolean isRehydrateOnStartup() { return rehydrateOnStartup; }
        public void setRehydrateOnStartup(boolean rehydrateOnStartup) { this.rehydrateOnStartup = rehydrateOnStartup; }
    }

    public static class DeliveryProperties {
        private Duration notifierTimeout = Duration.ofSeconds(10);
        private Duration taskRunnerTimeout = Duration.ofMinutes(5);

        public Duration getNotifierTimeout() { return notifierTimeout; }
        public void setNotifierTimeout(Duration notifierTimeout) { this.notifierTimeout = notifierTimeout; }
        public Duration getTaskRunnerTimeout() { return taskRunnerTimeout; }
        public void setTaskRunnerTimeout(Duration taskRunnerTimeout) { this.taskRunnerTimeout = taskRunnerTimeout; }
    }

    public static class ExecutionProperties {
        private int retentionDays = 30;
        private int listLimit = 50;

        public int getRetentionDays() { return retentionDays; }
        public void setRetentionDays(int retentionDays) { this.retentionDays = retentionDays; }
        public int getListLimit() { return listLimit; }
        public void setListLimit(int listLimit) { this.listLimit = listLimit; }
    }

    public static class TelegramProperties {
        private String apiBase = "https://api.telegram.org";

        public String getApiBase() { return apiBase; }
        public void setApiBase(String apiBase) { this.apiBase = apiBase; }
    }

    public static class TaskRunnerProperties {
        private List<String> endpoints = new ArrayList<>(List.of("http://127.0.0.1:8787"));
        private String path = "/scheduled-task";

        public List<String> getEndpoints() { return endpoints; }
        public void setEndpoints(List<String> endpoints) { this.endpoints = endpoints; }
        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }
    }

    public static class SecurityProperties {
        private PiiProperties pii = new PiiProperties();

        public PiiProperties getPii() { return pii; }
        public void setPii(PiiProperties pii) { this.pii = pii; }
    }

    public static class PiiProperties {
        private boolean redactInLogs = true;
        private List<String> redactPatterns = new ArrayList<>();

        public boolean isRedactInLogs() { return redactInLogs; }
        public void setRedactInLogs(boolean redactInLogs) { this.redactInLogs = redactInLogs; }
        public List<String> getRedactPatterns() { return redactPatterns; }
        public void setRedactPatterns(List<String> redactPatterns) { this.redactPatterns = redactPatterns; }
    }
}

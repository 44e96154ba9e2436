package com.jalarm.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SecretsConfig {

    @Value("${vcap.services.jalarm-secrets.credentials.telegram-bot-token:}")
    private String telegramBotToken;

    @Value("${vcap.services.jalarm-secrets.credentials.task-runner-api-key:}")
    private String taskRunnerApiKey;

    public String getTelegramBotToken() { return telegramBotToken; }
    public String getTaskRunnerApiKey() { return taskRunnerApiKey; }
}

package com.newswebsite.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Application settings bound from the {@code app.*} namespace.
 *
 * <p>Every value has an environment variable override in application.yml,
 * so deployments only need to export the secrets.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    /** "development" exposes exception messages in error responses, "production" hides them. */
    private String environment = "development";

    private String clientUrl = "http://localhost:3000";

    private String adminEmail = "info@alenalki.se";

    private Jwt jwt = new Jwt();
    private Mail mail = new Mail();
    private Newsletter newsletter = new Newsletter();
    private Cloudinary cloudinary = new Cloudinary();
    private MailExecutor mailExecutor = new MailExecutor();
    private Seed seed = new Seed();

    public boolean isProduction() {
        return "production".equalsIgnoreCase(environment);
    }

    @Getter
    @Setter
    public static class Jwt {
        private String secret;
        private Duration expiration = Duration.ofDays(7);
        private int cookieExpirationDays = 7;
    }

    @Getter
    @Setter
    public static class Mail {
        private String fromAddress = "no-reply@alenalki.se";
        private String fromName = "Alenalki";
        private String appName = "Alenalki";
    }

    @Getter
    @Setter
    public static class Newsletter {
        private int batchSize = 100;
    }

    @Getter
    @Setter
    public static class Cloudinary {
        private String cloudName;
        private String apiKey;
        private String apiSecret;
        private String uploadUrl = "https://api.cloudinary.com/v1_1";
    }

    @Getter
    @Setter
    public static class MailExecutor {
        private int corePoolSize = 4;
        private int maxPoolSize = 16;
        private int queueCapacity = 500;
        private String threadNamePrefix = "mail-";
    }

    @Getter
    @Setter
    public static class Seed {
        private boolean enabled = false;
        private String adminEmail = "admin@alenalki.se";
        private String adminPassword;
    }
}
